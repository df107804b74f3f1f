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

package com.spotify.zipper.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Deadlines per request class.
 */
@Data
public class Timeouts {
    public static final Duration DEFAULT_RENDER = Duration.of(10000, TimeUnit.SECONDS);
    public static final Duration DEFAULT_FIND = Duration.of(100, TimeUnit.SECONDS);
    public static final Duration DEFAULT_CONNECT = Duration.of(200, TimeUnit.MILLISECONDS);

    private final Duration render;
    private final Duration find;
    private final Duration connect;

    @JsonCreator
    public Timeouts(
        @JsonProperty("render") Optional<Duration> render,
        @JsonProperty("find") Optional<Duration> find,
        @JsonProperty("connect") Optional<Duration> connect
    ) {
        this.render = render.filter(d -> !d.isZero()).orElse(DEFAULT_RENDER);
        this.find = find.filter(d -> !d.isZero()).orElse(DEFAULT_FIND);
        this.connect = connect.filter(d -> !d.isZero()).orElse(DEFAULT_CONNECT);
    }

    public static Timeouts defaults() {
        return new Timeouts(Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static Timeouts of(final Duration render, final Duration find, final Duration connect) {
        return new Timeouts(Optional.of(render), Optional.of(find), Optional.of(connect));
    }
}
