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

package com.spotify.zipper.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs tasks later, or periodically, on a scheduled executor.
 * <p>
 * A periodic task is scheduled again after each run, so a slow run delays the next one rather than
 * overlapping with it. Failing runs are logged and do not end the period.
 */
@Slf4j
@RequiredArgsConstructor
@ToString(exclude = {"scheduler"})
public class DefaultScheduler {
    private static final String UNKNOWN = "unknown";

    private final ScheduledExecutorService scheduler;

    private volatile boolean stopped = false;

    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }

    public void periodically(final long value, final TimeUnit unit, final Task task) {
        periodically(UNKNOWN, value, unit, task);
    }

    public void periodically(
        final String name, final long value, final TimeUnit unit, final Task task
    ) {
        final Runnable periodic = new Runnable() {
            @Override
            public void run() {
                if (stopped) {
                    return;
                }

                try {
                    task.run();
                } catch (final InterruptedException e) {
                    log.debug("task '{}' interrupted", name);
                } catch (final Exception e) {
                    log.error("task '{}' failed", name, e);
                }

                if (!stopped) {
                    scheduler.schedule(this, value, unit);
                }
            }
        };

        scheduler.schedule(periodic, value, unit);
    }

    public void schedule(
        final String name, final long value, final TimeUnit unit, final Task task
    ) {
        scheduler.schedule(() -> {
            if (stopped) {
                return;
            }

            try {
                task.run();
            } catch (final Exception e) {
                log.error("{} task failed", name, e);
            }
        }, value, unit);
    }

    /**
     * Stop running tasks. Runs already in progress are not interrupted.
     */
    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }
}
