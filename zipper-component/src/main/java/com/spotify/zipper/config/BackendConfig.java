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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spotify.zipper.common.Duration;
import com.spotify.zipper.common.Timeouts;
import lombok.Data;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Optional.empty;
import static java.util.Optional.of;

/**
 * Configuration of one backend group.
 * <p>
 * Every tuning knob is optional and falls back to the global value in {@link ZipperConfig}.
 */
@Data
public class BackendConfig {
    private final String groupName;
    private final String protocol;
    private final LoadBalanceMethod lbMethod;
    private final List<String> servers;
    private final Optional<Integer> concurrencyLimit;
    private final Optional<Integer> maxIdleConnsPerHost;
    private final Optional<Duration> keepAliveInterval;
    private final Optional<Integer> maxTries;
    private final Optional<Integer> maxBatchSize;
    private final Optional<Timeouts> timeouts;
    private final Optional<Boolean> doMultipleRequestsIfSplit;
    private final Map<String, Object> backendOptions;

    @JsonCreator
    public BackendConfig(
        @JsonProperty("groupName") final String groupName,
        @JsonProperty("protocol") final String protocol,
        @JsonProperty("lbMethod") final Optional<LoadBalanceMethod> lbMethod,
        @JsonProperty("servers") final Optional<List<String>> servers,
        @JsonProperty("concurrencyLimit") final Optional<Integer> concurrencyLimit,
        @JsonProperty("maxIdleConnsPerHost") final Optional<Integer> maxIdleConnsPerHost,
        @JsonProperty("keepAliveInterval") final Optional<Duration> keepAliveInterval,
        @JsonProperty("maxTries") final Optional<Integer> maxTries,
        @JsonProperty("maxBatchSize") final Optional<Integer> maxBatchSize,
        @JsonProperty("timeouts") final Optional<Timeouts> timeouts,
        @JsonProperty("doMultipleRequestsIfSplit")
        final Optional<Boolean> doMultipleRequestsIfSplit,
        @JsonProperty("backendOptions") final Optional<Map<String, Object>> backendOptions
    ) {
        if (groupName == null || groupName.isEmpty()) {
            throw new IllegalArgumentException("groupName must be specified");
        }

        if (protocol == null || protocol.isEmpty()) {
            throw new IllegalArgumentException(groupName + ": protocol must be specified");
        }

        this.groupName = groupName;
        this.protocol = protocol;
        this.lbMethod = lbMethod.orElse(LoadBalanceMethod.ROUND_ROBIN);
        this.servers = ImmutableList.copyOf(servers.orElseGet(ImmutableList::of));
        this.concurrencyLimit = concurrencyLimit;
        this.maxIdleConnsPerHost = maxIdleConnsPerHost;
        this.keepAliveInterval = keepAliveInterval;
        this.maxTries = maxTries;
        this.maxBatchSize = maxBatchSize;
        this.timeouts = timeouts;
        this.doMultipleRequestsIfSplit = doMultipleRequestsIfSplit;
        this.backendOptions = ImmutableMap.copyOf(backendOptions.orElseGet(ImmutableMap::of));
    }

    /**
     * Apply global defaults for everything this group does not override.
     */
    public BackendSettings resolve(final ZipperConfig global) {
        return new BackendSettings(groupName, protocol, lbMethod, servers,
            concurrencyLimit.orElse(global.getConcurrencyLimit()),
            maxIdleConnsPerHost.orElse(global.getMaxIdleConnsPerHost()),
            keepAliveInterval.orElse(global.getKeepAliveInterval()),
            maxTries.orElse(global.getMaxTries()), maxBatchSize.orElse(global.getMaxBatchSize()),
            timeouts.orElse(global.getTimeouts()),
            doMultipleRequestsIfSplit.orElse(global.isDoMultipleRequestsIfSplit()),
            backendOptions);
    }

    public static Builder builder(final String groupName, final String protocol) {
        return new Builder(groupName, protocol);
    }

    public static class Builder {
        private final String groupName;
        private final String protocol;
        private Optional<LoadBalanceMethod> lbMethod = empty();
        private Optional<List<String>> servers = empty();
        private Optional<Integer> concurrencyLimit = empty();
        private Optional<Integer> maxIdleConnsPerHost = empty();
        private Optional<Duration> keepAliveInterval = empty();
        private Optional<Integer> maxTries = empty();
        private Optional<Integer> maxBatchSize = empty();
        private Optional<Timeouts> timeouts = empty();
        private Optional<Boolean> doMultipleRequestsIfSplit = empty();
        private Optional<Map<String, Object>> backendOptions = empty();

        Builder(final String groupName, final String protocol) {
            this.groupName = groupName;
            this.protocol = protocol;
        }

        public Builder lbMethod(final LoadBalanceMethod lbMethod) {
            this.lbMethod = of(lbMethod);
            return this;
        }

        public Builder servers(final List<String> servers) {
            this.servers = of(servers);
            return this;
        }

        /**
         * Max number of requests in flight per server.
         */
        public Builder concurrencyLimit(final int concurrencyLimit) {
            this.concurrencyLimit = of(concurrencyLimit);
            return this;
        }

        public Builder maxIdleConnsPerHost(final int maxIdleConnsPerHost) {
            this.maxIdleConnsPerHost = of(maxIdleConnsPerHost);
            return this;
        }

        public Builder keepAliveInterval(final Duration keepAliveInterval) {
            this.keepAliveInterval = of(keepAliveInterval);
            return this;
        }

        /**
         * Attempts per request. At least one attempt is made per server.
         */
        public Builder maxTries(final int maxTries) {
            this.maxTries = of(maxTries);
            return this;
        }

        /**
         * Max metrics per fetch sent to a child, 0 disables splitting.
         */
        public Builder maxBatchSize(final int maxBatchSize) {
            this.maxBatchSize = of(maxBatchSize);
            return this;
        }

        public Builder timeouts(final Timeouts timeouts) {
            this.timeouts = of(timeouts);
            return this;
        }

        public Builder doMultipleRequestsIfSplit(final boolean doMultipleRequestsIfSplit) {
            this.doMultipleRequestsIfSplit = of(doMultipleRequestsIfSplit);
            return this;
        }

        public Builder backendOptions(final Map<String, Object> backendOptions) {
            this.backendOptions = of(backendOptions);
            return this;
        }

        public BackendConfig build() {
            return new BackendConfig(groupName, protocol, lbMethod, servers, concurrencyLimit,
                maxIdleConnsPerHost, keepAliveInterval, maxTries, maxBatchSize, timeouts,
                doMultipleRequestsIfSplit, backendOptions);
        }
    }
}
