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

import eu.toolchain.async.AsyncFuture;
import eu.toolchain.async.FutureDone;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * A task of which at most one invocation is in progress at any time.
 * <p>
 * Running the task while a previous invocation is still in progress does nothing.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class ExclusiveTask implements Runnable {
    private final Object lock = new Object();
    private volatile AsyncFuture<Void> progress = null;

    private final String name;

    @Override
    public void run() {
        final AsyncFuture<Void> future;

        synchronized (lock) {
            if (progress != null) {
                /* silently do not invoke */
                return;
            }

            try {
                future = invoke();
            } catch (final Exception e) {
                error(e);
                return;
            }

            this.progress = future;
        }

        future.onDone(new FutureDone<Void>() {
            @Override
            public void failed(final Throwable cause) throws Exception {
                finished(future);
                error(cause);
            }

            @Override
            public void resolved(final Void result) throws Exception {
                finished(future);
            }

            @Override
            public void cancelled() throws Exception {
                finished(future);
            }
        });
    }

    public boolean isRunning() {
        return progress != null;
    }

    public void stop() {
        synchronized (lock) {
            if (progress != null) {
                progress.cancel();
                progress = null;
            }
        }
    }

    public void error(final Throwable cause) {
        log.error("{}: Failed to run task", name, cause);
    }

    private void finished(final AsyncFuture<Void> future) {
        synchronized (lock) {
            if (progress == future) {
                progress = null;
            }
        }
    }

    /**
     * Task to run, implemented by user.
     *
     * @throws Exception if unable to run.
     */
    public abstract AsyncFuture<Void> invoke() throws Exception;
}
