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

package com.spotify.zipper.backend;

import com.spotify.zipper.common.Stats;
import com.spotify.zipper.errors.Errors;
import lombok.Data;

import java.util.Objects;
import java.util.Optional;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * Outcome of one backend operation.
 * <p>
 * A response may be present alongside non-fatal errors. A fatal result never carries a response
 * that callers should rely on.
 *
 * @param <T> type of the response
 */
@Data
public class BackendResult<T> {
    private final Optional<T> response;
    private final Stats stats;
    private final Errors errors;

    public BackendResult(final Optional<T> response, final Stats stats, final Errors errors) {
        this.response = Objects.requireNonNull(response, "response");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    public static <T> BackendResult<T> ok(final T response, final Stats stats) {
        return new BackendResult<>(Optional.of(response), stats, Errors.none());
    }

    public static <T> BackendResult<T> failed(final Throwable error, final Stats stats) {
        return new BackendResult<>(Optional.empty(), stats, Errors.fatal(error));
    }

    public static <T> BackendResult<T> failed(final Throwable error) {
        return failed(error, Stats.empty());
    }

    public boolean isFatal() {
        return errors.isFatal();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public BackendResult<T> withStats(final Stats stats) {
        return new BackendResult<>(response, stats, errors);
    }

    public BackendResult<T> withErrors(final Errors errors) {
        return new BackendResult<>(response, stats, errors);
    }

    public <R> BackendResult<R> map(final Function<? super T, ? extends R> fn) {
        return new BackendResult<>(response.map(fn), stats, errors);
    }

    /**
     * Combine with another partial result. Responses are merged with the given function, stats
     * are added and errors appended.
     */
    public BackendResult<T> merge(final BackendResult<T> other, final BinaryOperator<T> merger) {
        final Optional<T> merged;

        if (!response.isPresent()) {
            merged = other.response;
        } else if (!other.response.isPresent()) {
            merged = response;
        } else {
            merged = Optional.of(merger.apply(response.get(), other.response.get()));
        }

        return new BackendResult<>(merged, stats.merge(other.stats), errors.merge(other.errors));
    }
}
