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

package com.spotify.zipper;

import com.spotify.zipper.common.Stats;
import com.spotify.zipper.errors.HttpErrors;
import com.spotify.zipper.errors.ZipperException;
import lombok.Data;

import java.util.Optional;

/**
 * The answer to one router call, ready to be rendered by a transport.
 * <p>
 * A response may come with an error and a 200 status code, in which case the error describes the
 * backends that did not contribute.
 */
@Data
public class RouterResponse<T> {
    private final Optional<T> response;
    private final Stats stats;
    private final Optional<ZipperException> error;
    private final int httpCode;

    public boolean isOk() {
        return httpCode == HttpErrors.OK;
    }
}
