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
import com.spotify.zipper.common.Duration;
import com.spotify.zipper.common.Timeouts;
import lombok.Data;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static java.util.Optional.empty;
import static java.util.Optional.of;

/**
 * Top level router configuration.
 */
@Data
public class ZipperConfig {
    public static final int DEFAULT_CONCURRENCY_LIMIT = 20;
    public static final int DEFAULT_MAX_IDLE_CONNS_PER_HOST = 100;
    public static final Duration DEFAULT_KEEP_ALIVE_INTERVAL = Duration.of(30, TimeUnit.SECONDS);
    public static final int DEFAULT_MAX_TRIES = 1;
    public static final int DEFAULT_MAX_BATCH_SIZE = 100;
    public static final Duration DEFAULT_EXPIRE_DELAY = Duration.of(600, TimeUnit.SECONDS);
    public static final Duration MIN_EXPIRE_DELAY = Duration.of(30, TimeUnit.SECONDS);
    public static final Duration DEFAULT_PROBE_INTERVAL = Duration.of(10, TimeUnit.MINUTES);

    private final int concurrencyLimit;
    private final int maxIdleConnsPerHost;
    private final Duration keepAliveInterval;
    private final int maxTries;
    private final int maxBatchSize;
    private final boolean doMultipleRequestsIfSplit;
    private final Timeouts timeouts;
    private final Duration expireDelay;
    private final boolean tldCacheDisabled;
    private final boolean requireSuccessAll;
    private final Duration probeInterval;
    private final Optional<String> searchPrefix;
    private final List<BackendConfig> search;
    private final List<BackendConfig> backends;

    @JsonCreator
    public ZipperConfig(
        @JsonProperty("concurrencyLimit") final Optional<Integer> concurrencyLimit,
        @JsonProperty("maxIdleConnsPerHost") final Optional<Integer> maxIdleConnsPerHost,
        @JsonProperty("keepAliveInterval") final Optional<Duration> keepAliveInterval,
        @JsonProperty("maxTries") final Optional<Integer> maxTries,
        @JsonProperty("maxBatchSize") final Optional<Integer> maxBatchSize,
        @JsonProperty("doMultipleRequestsIfSplit")
        final Optional<Boolean> doMultipleRequestsIfSplit,
        @JsonProperty("timeouts") final Optional<Timeouts> timeouts,
        @JsonProperty("expireDelay") final Optional<Duration> expireDelay,
        @JsonProperty("tldCacheDisabled") final Optional<Boolean> tldCacheDisabled,
        @JsonProperty("requireSuccessAll") final Optional<Boolean> requireSuccessAll,
        @JsonProperty("probeInterval") final Optional<Duration> probeInterval,
        @JsonProperty("searchPrefix") final Optional<String> searchPrefix,
        @JsonProperty("search") final Optional<List<BackendConfig>> search,
        @JsonProperty("backends") final Optional<List<BackendConfig>> backends
    ) {
        this.concurrencyLimit = concurrencyLimit.orElse(DEFAULT_CONCURRENCY_LIMIT);
        this.maxIdleConnsPerHost = maxIdleConnsPerHost.orElse(DEFAULT_MAX_IDLE_CONNS_PER_HOST);
        this.keepAliveInterval = keepAliveInterval.orElse(DEFAULT_KEEP_ALIVE_INTERVAL);
        this.maxTries = maxTries.orElse(DEFAULT_MAX_TRIES);
        this.maxBatchSize = maxBatchSize.orElse(DEFAULT_MAX_BATCH_SIZE);
        this.doMultipleRequestsIfSplit = doMultipleRequestsIfSplit.orElse(false);
        this.timeouts = timeouts.orElseGet(Timeouts::defaults);
        this.expireDelay = expireDelay.orElse(DEFAULT_EXPIRE_DELAY).max(MIN_EXPIRE_DELAY);
        this.tldCacheDisabled = tldCacheDisabled.orElse(false);
        this.requireSuccessAll = requireSuccessAll.orElse(false);
        this.probeInterval = probeInterval.orElse(DEFAULT_PROBE_INTERVAL);
        this.searchPrefix = searchPrefix.filter(p -> !p.isEmpty());
        this.search = ImmutableList.copyOf(search.orElseGet(ImmutableList::of));
        this.backends = ImmutableList.copyOf(backends.orElseGet(ImmutableList::of));

        if (this.searchPrefix.isPresent() && this.search.isEmpty()) {
            throw new IllegalArgumentException("searchPrefix requires search backends");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Optional<Integer> concurrencyLimit = empty();
        private Optional<Integer> maxIdleConnsPerHost = empty();
        private Optional<Duration> keepAliveInterval = empty();
        private Optional<Integer> maxTries = empty();
        private Optional<Integer> maxBatchSize = empty();
        private Optional<Boolean> doMultipleRequestsIfSplit = empty();
        private Optional<Timeouts> timeouts = empty();
        private Optional<Duration> expireDelay = empty();
        private Optional<Boolean> tldCacheDisabled = empty();
        private Optional<Boolean> requireSuccessAll = empty();
        private Optional<Duration> probeInterval = empty();
        private Optional<String> searchPrefix = empty();
        private Optional<List<BackendConfig>> search = empty();
        private Optional<List<BackendConfig>> backends = empty();

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

        public Builder maxTries(final int maxTries) {
            this.maxTries = of(maxTries);
            return this;
        }

        public Builder maxBatchSize(final int maxBatchSize) {
            this.maxBatchSize = of(maxBatchSize);
            return this;
        }

        public Builder doMultipleRequestsIfSplit(final boolean doMultipleRequestsIfSplit) {
            this.doMultipleRequestsIfSplit = of(doMultipleRequestsIfSplit);
            return this;
        }

        public Builder timeouts(final Timeouts timeouts) {
            this.timeouts = of(timeouts);
            return this;
        }

        /**
         * Lifetime of routing cache entries. Never less than 30 seconds.
         */
        public Builder expireDelay(final Duration expireDelay) {
            this.expireDelay = of(expireDelay);
            return this;
        }

        public Builder tldCacheDisabled(final boolean tldCacheDisabled) {
            this.tldCacheDisabled = of(tldCacheDisabled);
            return this;
        }

        /**
         * Fail a request if any backend failed, even if others answered.
         */
        public Builder requireSuccessAll(final boolean requireSuccessAll) {
            this.requireSuccessAll = of(requireSuccessAll);
            return this;
        }

        public Builder probeInterval(final Duration probeInterval) {
            this.probeInterval = of(probeInterval);
            return this;
        }

        public Builder searchPrefix(final String searchPrefix) {
            this.searchPrefix = of(searchPrefix);
            return this;
        }

        public Builder search(final List<BackendConfig> search) {
            this.search = of(search);
            return this;
        }

        public Builder backends(final List<BackendConfig> backends) {
            this.backends = of(backends);
            return this;
        }

        public ZipperConfig build() {
            return new ZipperConfig(concurrencyLimit, maxIdleConnsPerHost, keepAliveInterval,
                maxTries, maxBatchSize, doMultipleRequestsIfSplit, timeouts, expireDelay,
                tldCacheDisabled, requireSuccessAll, probeInterval, searchPrefix, search,
                backends);
        }
    }
}
