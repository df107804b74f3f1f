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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Metric metadata keyed by the server that reported it.
 */
@Data
public class InfoResponse {
    private static final InfoResponse EMPTY = new InfoResponse(ImmutableMap.of());

    private final Map<String, List<MetricInfo>> servers;

    public InfoResponse(final Map<String, List<MetricInfo>> servers) {
        this.servers = ImmutableMap.copyOf(Objects.requireNonNull(servers, "servers"));
    }

    public static InfoResponse empty() {
        return EMPTY;
    }

    public static InfoResponse of(final String server, final List<MetricInfo> infos) {
        return new InfoResponse(ImmutableMap.of(server, ImmutableList.copyOf(infos)));
    }

    public boolean isEmpty() {
        return servers.isEmpty();
    }

    /**
     * Later entries replace earlier ones for the same server.
     */
    public InfoResponse merge(final InfoResponse other) {
        if (other.isEmpty()) {
            return this;
        }

        final Map<String, List<MetricInfo>> merged = new LinkedHashMap<>(servers);
        merged.putAll(other.servers);
        return new InfoResponse(merged);
    }
}
