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

package com.spotify.zipper;

import com.spotify.zipper.backend.BackendResult;
import com.spotify.zipper.backend.BackendServer;
import com.spotify.zipper.common.Duration;
import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.scheduler.DefaultScheduler;
import com.spotify.zipper.scheduler.ExclusiveTask;
import eu.toolchain.async.AsyncFramework;
import eu.toolchain.async.AsyncFuture;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the routing cache warm by probing the root group for the top level segments each backend
 * serves.
 * <p>
 * Probes run periodically and on demand. Overlapping probes are skipped.
 */
@Slf4j
public class TldProber {
    public static final String NAME = "tld-probe";

    private final BackendServer root;
    private final DefaultScheduler scheduler;
    private final Duration interval;
    private final AtomicLong probes = new AtomicLong();
    private final ExclusiveTask task;

    private volatile boolean stopped = false;

    public TldProber(
        final BackendServer root, final DefaultScheduler scheduler, final AsyncFramework async,
        final Duration interval
    ) {
        this.root = root;
        this.scheduler = scheduler;
        this.interval = interval;
        this.task = new ExclusiveTask(NAME) {
            @Override
            public AsyncFuture<Void> invoke() {
                final QueryContext ctx = QueryContext.withRequestId(NAME);

                final AsyncFuture<Void> future = async.call(() -> {
                    probe(ctx);
                    return null;
                });

                future.onFinished(ctx::close);
                return future;
            }
        };
    }

    public void start() {
        log.info("Probing {} every {}", root.name(), interval.toDSL());
        scheduler.periodically(NAME, interval.getDuration(), interval.getUnit(), task::run);
    }

    /**
     * Probe now, unless a probe is already in progress.
     */
    public void force() {
        task.run();
    }

    public void stop() {
        stopped = true;
        scheduler.stop();
        task.stop();
    }

    /**
     * Number of completed probes.
     */
    public long probes() {
        return probes.get();
    }

    void probe(final QueryContext ctx) {
        if (stopped) {
            return;
        }

        final BackendResult<List<String>> result = root.probeTLDs(ctx);
        probes.incrementAndGet();

        if (result.isFatal()) {
            log.error("{}: probe failed: {}", root.name(), result.getErrors().getErrors());
            return;
        }

        if (result.hasErrors()) {
            log.warn("{}: probe had errors: {}", root.name(), result.getErrors().getErrors());
        }

        log.debug("{}: probed {} TLDs", root.name(),
            result.getResponse().map(List::size).orElse(0));
    }
}
