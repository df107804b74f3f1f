/*
 * Copyright (c) 2015 Spotify AB.
 *
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package com.spotify.zipper.httpquery;

import com.spotify.zipper.common.Stats;
import lombok.RequiredArgsConstructor;

/**
 * Class of a request sent to a backend, with the stats counters it is accounted under.
 */
@RequiredArgsConstructor
public enum RequestClass {
    RENDER(Stats.RENDER_REQUESTS, Stats.RENDER_ERRORS, Stats.RENDER_TIMEOUTS),
    FIND(Stats.FIND_REQUESTS, Stats.FIND_ERRORS, Stats.FIND_TIMEOUTS),
    INFO(Stats.INFO_REQUESTS, Stats.INFO_ERRORS, Stats.INFO_TIMEOUTS),
    TAGS(null, null, null);

    private final String requests;
    private final String errors;
    private final String timeouts;

    public Stats requested() {
        return count(requests);
    }

    /**
     * Stats of a failed request.
     *
     * @param timeout if the request failed because its deadline passed
     */
    public Stats failed(final boolean timeout) {
        final Stats failed = count(errors);

        if (!timeout) {
            return failed;
        }

        return failed.merge(Stats.of(Stats.TIMEOUTS, 1)).merge(count(timeouts));
    }

    private static Stats count(final String key) {
        if (key == null) {
            return Stats.empty();
        }

        return Stats.of(key, 1);
    }
}
