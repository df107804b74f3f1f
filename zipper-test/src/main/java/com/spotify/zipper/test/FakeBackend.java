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

package com.spotify.zipper.test;

import com.google.common.collect.ImmutableList;
import com.spotify.zipper.backend.BackendResult;
import com.spotify.zipper.backend.BackendServer;
import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.common.Stats;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.ZipperException;
import com.spotify.zipper.metric.InfoResponse;
import com.spotify.zipper.metric.ListMetricsResponse;
import com.spotify.zipper.metric.MetricDetailsResponse;
import com.spotify.zipper.metric.MultiFetchRequest;
import com.spotify.zipper.metric.MultiFetchResponse;
import com.spotify.zipper.metric.MultiGlobRequest;
import com.spotify.zipper.metric.MultiGlobResponse;
import com.spotify.zipper.metric.MultiMetricsInfoRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A scripted backend for tests.
 * <p>
 * Every operation answers with its configured handler, after an optional delay. Operations without
 * a handler fail with {@link ErrorKind#NOT_IMPLEMENTED_YET}. A backend built with {@link
 * Builder#hang()} never answers and returns a timeout once its context is done, one built with
 * {@link Builder#hangFirst(int)} does so only for its first operations.
 */
@Slf4j
public class FakeBackend implements BackendServer {
    private final String name;
    private final int maxMetricsPerRequest;
    private final long delayMillis;
    private final boolean hang;
    private final int hangFirst;
    private final Function<MultiFetchRequest, BackendResult<MultiFetchResponse>> fetch;
    private final Function<MultiGlobRequest, BackendResult<MultiGlobResponse>> find;
    private final Function<MultiMetricsInfoRequest, BackendResult<InfoResponse>> info;
    private final BackendResult<List<String>> probe;
    private final BackendResult<List<String>> tagNames;
    private final BackendResult<List<String>> tagValues;

    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private FakeBackend(final Builder b) {
        this.name = b.name;
        this.maxMetricsPerRequest = b.maxMetricsPerRequest;
        this.delayMillis = b.delayMillis;
        this.hang = b.hang;
        this.hangFirst = b.hangFirst;
        this.fetch = b.fetch;
        this.find = b.find;
        this.info = b.info;
        this.probe = b.probe;
        this.tagNames = b.tagNames;
        this.tagValues = b.tagValues;
    }

    public static Builder builder(final String name) {
        return new Builder(name);
    }

    /**
     * Number of operations invoked on this backend.
     */
    public int calls() {
        return calls.get();
    }

    /**
     * Highest number of operations observed running at the same time.
     */
    public int maxInFlight() {
        return maxInFlight.get();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> backends() {
        return ImmutableList.of(name);
    }

    @Override
    public int maxMetricsPerRequest() {
        return maxMetricsPerRequest;
    }

    @Override
    public BackendResult<MultiFetchResponse> fetch(
        final QueryContext ctx, final MultiFetchRequest request
    ) {
        return run(ctx, () -> fetch.apply(request));
    }

    @Override
    public BackendResult<MultiGlobResponse> find(
        final QueryContext ctx, final MultiGlobRequest request
    ) {
        return run(ctx, () -> find.apply(request));
    }

    @Override
    public BackendResult<InfoResponse> info(
        final QueryContext ctx, final MultiMetricsInfoRequest request
    ) {
        return run(ctx, () -> info.apply(request));
    }

    @Override
    public BackendResult<ListMetricsResponse> list(final QueryContext ctx) {
        return run(ctx, FakeBackend::notImplemented);
    }

    @Override
    public BackendResult<MetricDetailsResponse> stats(final QueryContext ctx) {
        return run(ctx, FakeBackend::notImplemented);
    }

    @Override
    public BackendResult<List<String>> probeTLDs(final QueryContext ctx) {
        return run(ctx, () -> probe);
    }

    @Override
    public BackendResult<List<String>> tagNames(
        final QueryContext ctx, final String query, final int limit
    ) {
        return run(ctx, () -> tagNames);
    }

    @Override
    public BackendResult<List<String>> tagValues(
        final QueryContext ctx, final String query, final int limit
    ) {
        return run(ctx, () -> tagValues);
    }

    private <T> BackendResult<T> run(
        final QueryContext ctx, final Supplier<BackendResult<T>> answer
    ) {
        final int call = calls.incrementAndGet();
        final int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);

        try {
            if (hang || call <= hangFirst) {
                return waitForDone(ctx);
            }

            if (delayMillis > 0) {
                try {
                    Thread.sleep(delayMillis);
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return BackendResult.failed(ctx.error().withServer(name));
                }
            }

            return answer.get();
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private <T> BackendResult<T> waitForDone(final QueryContext ctx) {
        while (!ctx.isDone()) {
            try {
                Thread.sleep(5);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        log.debug("{}: gave up waiting, {}", name, ctx);
        return BackendResult.failed(
            new ZipperException(ErrorKind.TIMEOUT_EXCEEDED).withServer(name),
            Stats.of(Stats.TIMEOUTS, 1));
    }

    private static <T> BackendResult<T> notImplemented() {
        return BackendResult.failed(new ZipperException(ErrorKind.NOT_IMPLEMENTED_YET));
    }

    public static class Builder {
        private final String name;
        private int maxMetricsPerRequest = 0;
        private long delayMillis = 0;
        private boolean hang = false;
        private int hangFirst = 0;
        private Function<MultiFetchRequest, BackendResult<MultiFetchResponse>> fetch =
            r -> notImplemented();
        private Function<MultiGlobRequest, BackendResult<MultiGlobResponse>> find =
            r -> notImplemented();
        private Function<MultiMetricsInfoRequest, BackendResult<InfoResponse>> info =
            r -> notImplemented();
        private BackendResult<List<String>> probe = notImplemented();
        private BackendResult<List<String>> tagNames = notImplemented();
        private BackendResult<List<String>> tagValues = notImplemented();

        Builder(final String name) {
            this.name = name;
        }

        public Builder maxMetricsPerRequest(final int maxMetricsPerRequest) {
            this.maxMetricsPerRequest = maxMetricsPerRequest;
            return this;
        }

        public Builder delay(final long delay, final TimeUnit unit) {
            this.delayMillis = unit.toMillis(delay);
            return this;
        }

        /**
         * Never answer, wait for the context to expire or be cancelled.
         */
        public Builder hang() {
            this.hang = true;
            return this;
        }

        /**
         * Hang like {@link #hang()}, but only for the first given number of operations.
         */
        public Builder hangFirst(final int operations) {
            this.hangFirst = operations;
            return this;
        }

        public Builder fetch(final MultiFetchResponse response) {
            return fetch(r -> BackendResult.ok(response, Stats.of(Stats.RENDER_REQUESTS, 1)));
        }

        public Builder fetch(
            final Function<MultiFetchRequest, BackendResult<MultiFetchResponse>> fetch
        ) {
            this.fetch = fetch;
            return this;
        }

        public Builder find(final MultiGlobResponse response) {
            return find(r -> BackendResult.ok(response, Stats.of(Stats.FIND_REQUESTS, 1)));
        }

        public Builder find(
            final Function<MultiGlobRequest, BackendResult<MultiGlobResponse>> find
        ) {
            this.find = find;
            return this;
        }

        public Builder info(
            final Function<MultiMetricsInfoRequest, BackendResult<InfoResponse>> info
        ) {
            this.info = info;
            return this;
        }

        public Builder probe(final List<String> tlds) {
            this.probe = BackendResult.ok(ImmutableList.copyOf(tlds), Stats.empty());
            return this;
        }

        public Builder tagNames(final List<String> names) {
            this.tagNames = BackendResult.ok(ImmutableList.copyOf(names), Stats.empty());
            return this;
        }

        public Builder tagValues(final List<String> values) {
            this.tagValues = BackendResult.ok(ImmutableList.copyOf(values), Stats.empty());
            return this;
        }

        /**
         * Fail every operation with the given error.
         */
        public Builder failing(final ZipperException error) {
            this.fetch = r -> BackendResult.failed(error);
            this.find = r -> BackendResult.failed(error);
            this.info = r -> BackendResult.failed(error);
            this.probe = BackendResult.failed(error);
            this.tagNames = BackendResult.failed(error);
            this.tagValues = BackendResult.failed(error);
            return this;
        }

        public FakeBackend build() {
            return new FakeBackend(this);
        }
    }
}
