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

package com.spotify.zipper.metric;

import lombok.Data;

import java.util.Objects;

/**
 * Request for a single metric, or a glob or tag expression that expands into several.
 */
@Data
public class FetchRequest {
    private final String name;
    private final long startTime;
    private final long stopTime;
    private final String pathExpression;
    private final long maxDataPoints;

    public FetchRequest(
        final String name, final long startTime, final long stopTime,
        final String pathExpression, final long maxDataPoints
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.startTime = startTime;
        this.stopTime = stopTime;
        this.pathExpression = Objects.requireNonNull(pathExpression, "pathExpression");
        this.maxDataPoints = maxDataPoints;
    }

    public static FetchRequest of(final String name, final long startTime, final long stopTime) {
        return new FetchRequest(name, startTime, stopTime, name, 0);
    }

    public FetchRequest withName(final String name) {
        return new FetchRequest(name, startTime, stopTime, pathExpression, maxDataPoints);
    }

    public boolean isTagQuery() {
        return name.startsWith("seriesByTag");
    }

    public boolean isGlob() {
        return name.indexOf('*') >= 0 || name.indexOf('{') >= 0;
    }
}
