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

import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.ZipperException;
import eu.toolchain.async.AsyncFramework;
import eu.toolchain.async.ResolvableFuture;
import eu.toolchain.async.TinyAsync;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * A request scoped deadline and cancellation token.
 * <p>
 * Every operation that may suspend takes a context. Derived contexts never outlive their parent:
 * their deadline is capped by the parent deadline and cancelling the parent cancels them.
 * Cancellation is signalled by cancelling the future behind {@link #cancelled()}.
 */
public final class QueryContext implements AutoCloseable {
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    /* only hands out futures, callbacks run on the thread that cancels */
    private static final AsyncFramework SIGNALS = TinyAsync.builder().build();

    private final String requestId;
    private final long deadline;
    private final ResolvableFuture<Void> signal = SIGNALS.future();

    private QueryContext(final String requestId, final long deadline) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.deadline = deadline;
    }

    /**
     * A root context without deadline.
     */
    public static QueryContext background() {
        return new QueryContext(UUID.randomUUID().toString(), NO_DEADLINE);
    }

    public static QueryContext withRequestId(final String requestId) {
        return new QueryContext(requestId, NO_DEADLINE);
    }

    /**
     * Derive a context which expires after the given timeout, or when this context does.
     */
    public QueryContext withTimeout(final Duration timeout) {
        return withTimeout(timeout.toNanoseconds(), TimeUnit.NANOSECONDS);
    }

    public QueryContext withTimeout(final long timeout, final TimeUnit unit) {
        final long now = System.nanoTime();
        final long candidate = saturatedAdd(now, unit.toNanos(timeout));
        final QueryContext child = new QueryContext(requestId, Math.min(deadline, candidate));
        signal.onCancelled(child::cancel);
        return child;
    }

    /**
     * Derive a context with the same deadline which can be cancelled without affecting this one.
     */
    public QueryContext fork() {
        return withTimeout(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
    }

    public String getRequestId() {
        return requestId;
    }

    public boolean isCancelled() {
        return signal.isCancelled();
    }

    public boolean isExpired() {
        return deadline != NO_DEADLINE && System.nanoTime() - deadline >= 0;
    }

    public boolean isDone() {
        return isCancelled() || isExpired();
    }

    /**
     * Remaining time until the deadline, never negative. Contexts without deadline report
     * {@link Long#MAX_VALUE}.
     */
    public long remaining(final TimeUnit unit) {
        if (deadline == NO_DEADLINE) {
            return Long.MAX_VALUE;
        }

        final long left = deadline - System.nanoTime();
        return left <= 0 ? 0 : unit.convert(left, TimeUnit.NANOSECONDS);
    }

    public boolean hasDeadline() {
        return deadline != NO_DEADLINE;
    }

    /**
     * Build the error describing why this context is done.
     */
    public ZipperException error() {
        if (isExpired()) {
            return new ZipperException(ErrorKind.TIMEOUT_EXCEEDED);
        }

        return new ZipperException(ErrorKind.CANCELLED);
    }

    /**
     * Future which is cancelled when this context is. It never resolves.
     */
    public ResolvableFuture<Void> cancelled() {
        return signal;
    }

    /**
     * Register a listener that is invoked once when this context is cancelled. If the context is
     * already cancelled, the listener is invoked immediately.
     */
    public void onCancel(final Runnable listener) {
        signal.onCancelled(listener::run);
    }

    public void cancel() {
        signal.cancel();
    }

    /**
     * Cancel this context, and every context derived from it.
     */
    @Override
    public void close() {
        cancel();
    }

    private static long saturatedAdd(final long a, final long b) {
        final long r = a + b;

        if (((a ^ r) & (b ^ r)) < 0) {
            return NO_DEADLINE;
        }

        return r;
    }

    @Override
    public String toString() {
        return "QueryContext(requestId=" + requestId + ", cancelled=" + isCancelled() +
            ", remainingMs=" + remaining(TimeUnit.MILLISECONDS) + ")";
    }
}
