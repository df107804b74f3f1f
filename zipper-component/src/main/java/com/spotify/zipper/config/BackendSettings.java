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

package com.spotify.zipper.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spotify.zipper.common.Duration;
import com.spotify.zipper.common.Timeouts;
import lombok.Data;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fully resolved settings of one backend group, with global defaults applied.
 */
@Data
public class BackendSettings {
    private final String groupName;
    private final String protocol;
    private final LoadBalanceMethod lbMethod;
    private final List<String> servers;
    private final int concurrencyLimit;
    private final int maxIdleConnsPerHost;
    private final Duration keepAliveInterval;
    private final int maxTries;
    private final int maxBatchSize;
    private final Timeouts timeouts;
    private final boolean doMultipleRequestsIfSplit;
    private final Map<String, Object> backendOptions;

    public BackendSettings(
        final String groupName, final String protocol, final LoadBalanceMethod lbMethod,
        final List<String> servers, final int concurrencyLimit, final int maxIdleConnsPerHost,
        final Duration keepAliveInterval, final int maxTries, final int maxBatchSize,
        final Timeouts timeouts, final boolean doMultipleRequestsIfSplit,
        final Map<String, Object> backendOptions
    ) {
        this.groupName = Objects.requireNonNull(groupName, "groupName");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.lbMethod = Objects.requireNonNull(lbMethod, "lbMethod");
        this.servers = ImmutableList.copyOf(servers);
        this.concurrencyLimit = concurrencyLimit;
        this.maxIdleConnsPerHost = maxIdleConnsPerHost;
        this.keepAliveInterval = Objects.requireNonNull(keepAliveInterval, "keepAliveInterval");
        this.maxTries = maxTries;
        this.maxBatchSize = maxBatchSize;
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.doMultipleRequestsIfSplit = doMultipleRequestsIfSplit;
        this.backendOptions = ImmutableMap.copyOf(backendOptions);
    }

    /**
     * Settings for a single server of this group, as used when broadcasting.
     */
    public BackendSettings forServer(final String server) {
        return new BackendSettings(server, protocol, lbMethod, ImmutableList.of(server),
            concurrencyLimit, maxIdleConnsPerHost, keepAliveInterval, maxTries, maxBatchSize,
            timeouts, doMultipleRequestsIfSplit, backendOptions);
    }

    public Optional<Object> option(final String key) {
        return Optional.ofNullable(backendOptions.get(key));
    }

    /**
     * Read a numeric protocol option, accepting both numbers and numeric strings.
     */
    public long longOption(final String key, final long defaultValue) {
        final Optional<Object> value = option(key);

        if (!value.isPresent()) {
            return defaultValue;
        }

        final Object v = value.get();

        if (v instanceof Number) {
            return ((Number) v).longValue();
        }

        try {
            return Long.parseLong(v.toString().trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(
                groupName + ": option '" + key + "' is not a number: " + v, e);
        }
    }
}
