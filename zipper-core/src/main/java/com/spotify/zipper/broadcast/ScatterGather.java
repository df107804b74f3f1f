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

package com.spotify.zipper.broadcast;

import com.google.common.collect.ImmutableList;
import com.spotify.zipper.backend.BackendResult;
import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.common.Stats;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.Errors;
import com.spotify.zipper.errors.ZipperException;
import com.spotify.zipper.limiter.ServerLimiter;
import eu.toolchain.async.AsyncFramework;
import eu.toolchain.async.AsyncFuture;
import eu.toolchain.async.StreamCollector;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * Runs a set of units concurrently and gathers their results until all have answered or the
 * context is done.
 * <p>
 * Every limited unit holds a limiter slot, keyed by its name, until its future finishes. Units
 * still running when gathering ends are cancelled, which releases their slot. Results arriving
 * after gathering ended are dropped.
 *
 * @param <T> type of the response of a unit
 */
@Slf4j
@RequiredArgsConstructor
class ScatterGather<T> {
    private final String group;
    private final AsyncFramework async;
    private final ServerLimiter limiter;
    private final BinaryOperator<T> merger;

    @Data
    static class Unit<T> {
        private final String name;
        private final boolean limited;
        private final Function<QueryContext, BackendResult<T>> call;
    }

    /**
     * Gathered result. Errors of the units are collected as is, it is up to the caller to decide
     * if they are fatal.
     */
    @Data
    static class Gathered<T> {
        private final Optional<T> response;
        private final Stats stats;
        private final List<Throwable> errors;
        private final int answered;
        private final List<String> noAnswer;
    }

    @Data
    private static class Reply<T> {
        private final int index;
        private final BackendResult<T> result;
    }

    static <T> Unit<T> unit(
        final String name, final Function<QueryContext, BackendResult<T>> call
    ) {
        return new Unit<>(name, true, call);
    }

    static <T> Unit<T> unlimited(
        final String name, final Function<QueryContext, BackendResult<T>> call
    ) {
        return new Unit<>(name, false, call);
    }

    Gathered<T> run(final QueryContext ctx, final List<Unit<T>> units) {
        final Collector collector = new Collector(units);
        final List<AsyncFuture<Reply<T>>> futures = new ArrayList<>(units.size());

        try (QueryContext workers = ctx.fork()) {
            for (int i = 0; i < units.size(); i++) {
                futures.add(dispatch(workers, i, units.get(i)));
            }

            final AsyncFuture<Gathered<T>> all = async.collect(futures, collector);
            ctx.onCancel(all::cancel);

            try {
                all.get(ctx.remaining(TimeUnit.NANOSECONDS), TimeUnit.NANOSECONDS);
            } catch (final TimeoutException | CancellationException e) {
                log.debug("{}: stopped gathering ({})", group, ctx);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (final ExecutionException e) {
                log.error("{}: failed to gather responses", group, e.getCause());
                collector.error(e.getCause());
            }
        } finally {
            for (final AsyncFuture<Reply<T>> f : futures) {
                f.cancel();
            }
        }

        return collector.close();
    }

    private AsyncFuture<Reply<T>> dispatch(
        final QueryContext ctx, final int index, final Unit<T> unit
    ) {
        final Slot slot = new Slot(unit);
        final AsyncFuture<Reply<T>> future;

        try {
            future = async
                .call(() -> new Reply<T>(index, call(ctx, unit, slot)))
                .catchFailed(e -> new Reply<T>(index, BackendResult.failed(e)));
        } catch (final RejectedExecutionException e) {
            return async.resolved(new Reply<>(index, BackendResult.failed(
                new ZipperException(ErrorKind.FAILED, "executor rejected request")
                    .withServer(unit.getName()))));
        }

        future.onFinished(slot::release);
        return future;
    }

    private BackendResult<T> call(final QueryContext ctx, final Unit<T> unit, final Slot slot) {
        final String name = unit.getName();

        try {
            slot.acquire(ctx);
        } catch (final ZipperException e) {
            log.debug("{}: timeout waiting for a slot on {}", group, name);
            return new BackendResult<>(Optional.empty(), Stats.empty(), Errors.nonFatal(e));
        }

        try {
            log.debug("{}: sending request to {}", group, name);
            return unit.getCall().apply(ctx);
        } catch (final RuntimeException e) {
            log.error("{}: request to {} failed", group, name, e);
            return BackendResult.failed(e);
        }
    }

    /**
     * Limiter slot of a single unit, released exactly once when the unit's future finishes.
     */
    @RequiredArgsConstructor
    private class Slot {
        private static final int IDLE = 0;
        private static final int HELD = 1;
        private static final int DONE = 2;

        private final Unit<T> unit;
        private final AtomicInteger state = new AtomicInteger(IDLE);

        void acquire(final QueryContext ctx) {
            if (!unit.isLimited()) {
                return;
            }

            log.debug("{}: waiting for slot on {}", group, unit.getName());
            limiter.enter(ctx, unit.getName());

            /* the future finished while we were waiting */
            if (!state.compareAndSet(IDLE, HELD)) {
                limiter.leave(unit.getName());
                throw new ZipperException(ErrorKind.CANCELLED, "request cancelled").withServer(
                    unit.getName());
            }
        }

        void release() {
            if (state.getAndSet(DONE) == HELD) {
                limiter.leave(unit.getName());
            }
        }
    }

    /**
     * Merges replies as they arrive. Once closed, the gathered result is fixed.
     */
    private class Collector implements StreamCollector<Reply<T>, Gathered<T>> {
        private final List<Unit<T>> units;
        private final boolean[] answered;

        private Optional<T> response = Optional.empty();
        private Stats stats = Stats.empty();
        private final List<Throwable> errors = new ArrayList<>();
        private int count = 0;
        private Gathered<T> closed = null;

        Collector(final List<Unit<T>> units) {
            this.units = units;
            this.answered = new boolean[units.size()];
        }

        @Override
        public synchronized void resolved(final Reply<T> reply) throws Exception {
            if (closed != null) {
                log.debug("{}: dropping late reply from {}", group,
                    units.get(reply.index).getName());
                return;
            }

            count++;
            answered[reply.index] = true;

            final BackendResult<T> r = reply.result;
            stats = stats.merge(r.getStats());
            errors.addAll(r.getErrors().getErrors());

            if (!r.getResponse().isPresent()) {
                return;
            }

            try {
                response = response.isPresent() ?
                    Optional.of(merger.apply(response.get(), r.getResponse().get())) :
                    r.getResponse();
            } catch (final ZipperException e) {
                log.error("{}: unable to merge responses", group, e);
                errors.add(e);
            }
        }

        @Override
        public void failed(final Throwable cause) throws Exception {
            error(cause);
        }

        @Override
        public void cancelled() throws Exception {
            /* counted as no answer */
        }

        @Override
        public Gathered<T> end(final int resolved, final int failed, final int cancelled)
            throws Exception {
            return close();
        }

        synchronized void error(final Throwable cause) {
            if (closed == null) {
                errors.add(cause);
            }
        }

        synchronized Gathered<T> close() {
            if (closed != null) {
                return closed;
            }

            final List<String> noAnswer = new ArrayList<>();

            for (int i = 0; i < units.size(); i++) {
                if (!answered[i]) {
                    noAnswer.add(units.get(i).getName());
                }
            }

            if (!noAnswer.isEmpty()) {
                final Set<String> names = new LinkedHashSet<>(noAnswer);
                log.warn("{}: timeout waiting for more responses, no answers from {}", group,
                    names);
                errors.add(new ZipperException(ErrorKind.TIMEOUT_EXCEEDED,
                    "timeout waiting for more responses, no answers from: " +
                        String.join(", ", names)));
                stats = stats.merge(Stats.of(Stats.TIMEOUTS, noAnswer.size()));
            }

            closed = new Gathered<>(response, stats, ImmutableList.copyOf(errors), count,
                ImmutableList.copyOf(noAnswer));
            return closed;
        }
    }
}
