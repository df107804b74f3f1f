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

package com.spotify.zipper.cache;

import com.google.common.collect.ImmutableList;
import com.spotify.zipper.backend.BackendServer;
import com.spotify.zipper.common.Duration;
import lombok.ToString;
import net.jodah.expiringmap.ExpirationPolicy;
import net.jodah.expiringmap.ExpiringMap;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Expiring hints of which backends serve a top level path segment.
 * <p>
 * Entries are only written by the probe of the root group. Lookups never block writers.
 */
@ToString(of = {"expireDelay"})
public class RoutingCache {
    private final Duration expireDelay;
    private final ExpiringMap<String, List<BackendServer>> cache;

    public RoutingCache(final Duration expireDelay) {
        this.expireDelay = expireDelay;
        this.cache = ExpiringMap
            .builder()
            .expirationPolicy(ExpirationPolicy.CREATED)
            .expiration(expireDelay.toMilliseconds(), TimeUnit.MILLISECONDS)
            .build();
    }

    public Optional<List<BackendServer>> get(final String tld) {
        return Optional.ofNullable(cache.get(tld));
    }

    public void put(final String tld, final List<BackendServer> servers) {
        cache.put(tld, ImmutableList.copyOf(servers));
    }

    public void putAll(final Map<String, List<BackendServer>> entries) {
        for (final Map.Entry<String, List<BackendServer>> e : entries.entrySet()) {
            put(e.getKey(), e.getValue());
        }
    }

    public int size() {
        return cache.size();
    }

    public Duration getExpireDelay() {
        return expireDelay;
    }

    /**
     * The first dot separated segment of a metric path.
     */
    public static String tld(final String path) {
        final int idx = path.indexOf('.');

        if (idx > 0) {
            return path.substring(0, idx);
        }

        return path;
    }
}
