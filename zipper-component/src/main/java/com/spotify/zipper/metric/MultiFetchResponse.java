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

package com.spotify.zipper.metric;

import com.google.common.collect.ImmutableList;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.ZipperException;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Series for many metrics.
 * <p>
 * Merging is keyed by metric name and requested range, series under the same key are combined with
 * {@link FetchResponse#merge(FetchResponse, FetchResponse)}. The first series wins when two cannot
 * be combined.
 */
@Data
public class MultiFetchResponse {
    private static final MultiFetchResponse EMPTY = new MultiFetchResponse(ImmutableList.of());

    private final List<FetchResponse> metrics;

    public MultiFetchResponse(final List<FetchResponse> metrics) {
        this.metrics = ImmutableList.copyOf(Objects.requireNonNull(metrics, "metrics"));
    }

    public static MultiFetchResponse empty() {
        return EMPTY;
    }

    public static MultiFetchResponse of(final FetchResponse... metrics) {
        return new MultiFetchResponse(ImmutableList.copyOf(metrics));
    }

    public boolean isEmpty() {
        return metrics.isEmpty();
    }

    public MultiFetchResponse merge(final MultiFetchResponse other) {
        if (other.isEmpty()) {
            return this;
        }

        final Map<Key, FetchResponse> merged = new LinkedHashMap<>();
        put(merged, metrics);
        put(merged, other.metrics);
        return new MultiFetchResponse(ImmutableList.copyOf(merged.values()));
    }

    /**
     * Apply the given function to every series.
     */
    public MultiFetchResponse map(final Function<FetchResponse, FetchResponse> fn) {
        return new MultiFetchResponse(metrics.stream().map(fn).collect(Collectors.toList()));
    }

    private static void put(final Map<Key, FetchResponse> target, final List<FetchResponse> from) {
        for (final FetchResponse r : from) {
            final Key key = new Key(r.getName(), r.getRequestStartTime(), r.getRequestStopTime());
            final FetchResponse existing = target.get(key);

            if (existing == null) {
                target.put(key, r);
                continue;
            }

            try {
                target.put(key, FetchResponse.merge(existing, r));
            } catch (final ZipperException e) {
                if (!e.is(ErrorKind.RESPONSE_START_TIME_MISMATCH)) {
                    throw e;
                }
            }
        }
    }

    @Data
    private static class Key {
        private final String name;
        private final long requestStartTime;
        private final long requestStopTime;
    }
}
