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

package com.spotify.zipper.limiter;

import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.ZipperException;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * A counting semaphore per backend name.
 * <p>
 * Waiting callers wake up periodically to observe cancellation of their context, so a cancelled
 * request never sits in the queue until its deadline.
 */
@Slf4j
@ToString(of = {"capacity"})
public class CoreServerLimiter implements ServerLimiter {
    static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final int capacity;
    private final ConcurrentMap<String, Semaphore> slots = new ConcurrentHashMap<>();

    public CoreServerLimiter(final Collection<String> names, final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }

        this.capacity = capacity;

        for (final String name : names) {
            slots.put(name, new Semaphore(capacity, true));
        }
    }

    @Override
    public void enter(final QueryContext ctx, final String name) {
        final Semaphore slot = slot(name);

        try {
            while (!ctx.isDone()) {
                final long wait = Math.min(ctx.remaining(TimeUnit.NANOSECONDS), POLL_NANOS);

                if (slot.tryAcquire(wait, TimeUnit.NANOSECONDS)) {
                    return;
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ZipperException(ErrorKind.TIMEOUT_EXCEEDED, "interrupted waiting for slot")
                .withServer(name);
        }

        log.debug("{}: gave up waiting for slot ({})", name, ctx);
        throw ctx.error().prepend("timeout waiting for slot").withServer(name);
    }

    @Override
    public void leave(final String name) {
        slot(name).release();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    /**
     * Number of free slots for the given name.
     */
    public int available(final String name) {
        return slot(name).availablePermits();
    }

    private Semaphore slot(final String name) {
        return slots.computeIfAbsent(name, n -> new Semaphore(capacity, true));
    }
}
