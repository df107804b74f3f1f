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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Monotonic request counters.
 * <p>
 * Instances are immutable. {@link #merge(Stats)} adds the counters of both sides.
 */
@Data
public class Stats {
    public static final String TIMEOUTS = "timeouts";
    public static final String FIND_REQUESTS = "findRequests";
    public static final String FIND_ERRORS = "findErrors";
    public static final String FIND_TIMEOUTS = "findTimeouts";
    public static final String RENDER_REQUESTS = "renderRequests";
    public static final String RENDER_ERRORS = "renderErrors";
    public static final String RENDER_TIMEOUTS = "renderTimeouts";
    public static final String INFO_REQUESTS = "infoRequests";
    public static final String INFO_ERRORS = "infoErrors";
    public static final String INFO_TIMEOUTS = "infoTimeouts";
    public static final String ZIPPER_REQUESTS = "zipperRequests";
    public static final String TOTAL_METRICS_COUNT = "totalMetricsCount";
    public static final String TRANSPORT_ERRORS = "transportErrors";
    public static final String CACHE_HITS = "cacheHits";
    public static final String CACHE_MISSES = "cacheMisses";
    public static final String MEMORY_USAGE = "memoryUsage";

    private static final Stats EMPTY =
        new Stats(ImmutableMap.of(), ImmutableSortedSet.of(), ImmutableSortedSet.of());

    private final Map<String, Long> counters;
    private final Set<String> servers;
    private final Set<String> failedServers;

    @JsonCreator
    public Stats(
        @JsonProperty("counters") final Map<String, Long> counters,
        @JsonProperty("servers") final Set<String> servers,
        @JsonProperty("failedServers") final Set<String> failedServers
    ) {
        this.counters = ImmutableMap.copyOf(Objects.requireNonNull(counters, "counters"));
        this.servers = ImmutableSortedSet.copyOf(Objects.requireNonNull(servers, "servers"));
        this.failedServers =
            ImmutableSortedSet.copyOf(Objects.requireNonNull(failedServers, "failedServers"));

        for (final Map.Entry<String, Long> e : this.counters.entrySet()) {
            if (e.getValue() < 0) {
                throw new IllegalArgumentException(
                    "Counter must not be negative: " + e.getKey() + "=" + e.getValue());
            }
        }
    }

    public long get(final String key) {
        return counters.getOrDefault(key, 0L);
    }

    public Stats merge(final Stats other) {
        if (other.isEmpty()) {
            return this;
        }

        if (isEmpty()) {
            return other;
        }

        final Map<String, Long> merged = new HashMap<>(counters);

        for (final Map.Entry<String, Long> e : other.counters.entrySet()) {
            merged.merge(e.getKey(), e.getValue(), Long::sum);
        }

        return new Stats(merged, ImmutableSortedSet
            .<String>naturalOrder()
            .addAll(servers)
            .addAll(other.servers)
            .build(), ImmutableSortedSet
            .<String>naturalOrder()
            .addAll(failedServers)
            .addAll(other.failedServers)
            .build());
    }

    /**
     * Replace a derived counter, such as a total computed by a group from its merged response.
     */
    public Stats replace(final String key, final long value) {
        final Map<String, Long> next = new HashMap<>(counters);
        next.put(key, value);
        return new Stats(next, servers, failedServers);
    }

    public boolean isEmpty() {
        return counters.isEmpty() && servers.isEmpty() && failedServers.isEmpty();
    }

    public static Stats empty() {
        return EMPTY;
    }

    public static Stats of(final String k1, final long v1) {
        return new Stats(ImmutableMap.of(k1, v1), ImmutableSortedSet.of(),
            ImmutableSortedSet.of());
    }

    public static Stats of(final String k1, final long v1, final String k2, final long v2) {
        return new Stats(ImmutableMap.of(k1, v1, k2, v2), ImmutableSortedSet.of(),
            ImmutableSortedSet.of());
    }

    public static Stats of(
        final String k1, final long v1, final String k2, final long v2, final String k3,
        final long v3
    ) {
        return new Stats(ImmutableMap.of(k1, v1, k2, v2, k3, v3), ImmutableSortedSet.of(),
            ImmutableSortedSet.of());
    }

    public static Stats server(final String server) {
        return new Stats(ImmutableMap.of(), ImmutableSortedSet.of(server),
            ImmutableSortedSet.of());
    }

    public static Stats failedServer(final String server) {
        return new Stats(ImmutableMap.of(), ImmutableSortedSet.of(),
            ImmutableSortedSet.of(server));
    }
}
