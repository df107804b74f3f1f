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
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Matches for many glob queries.
 * <p>
 * Merging is by query name, and a path only appears once per query. A path reported as a leaf
 * by any source is a leaf.
 */
@Data
public class MultiGlobResponse {
    private static final MultiGlobResponse EMPTY = new MultiGlobResponse(ImmutableList.of());

    private final List<GlobResponse> metrics;

    public MultiGlobResponse(final List<GlobResponse> metrics) {
        this.metrics = ImmutableList.copyOf(Objects.requireNonNull(metrics, "metrics"));
    }

    public static MultiGlobResponse empty() {
        return EMPTY;
    }

    public static MultiGlobResponse of(final GlobResponse... metrics) {
        return new MultiGlobResponse(ImmutableList.copyOf(metrics));
    }

    public boolean isEmpty() {
        return totalMatches() == 0;
    }

    public int totalMatches() {
        int total = 0;

        for (final GlobResponse r : metrics) {
            total += r.getMatches().size();
        }

        return total;
    }

    /**
     * Paths of all leaf matches, across all queries, in order of appearance.
     */
    public List<String> leaves() {
        final Set<String> leaves = new LinkedHashSet<>();

        for (final GlobResponse r : metrics) {
            for (final GlobMatch m : r.getMatches()) {
                if (m.isLeaf()) {
                    leaves.add(m.getPath());
                }
            }
        }

        return ImmutableList.copyOf(leaves);
    }

    public MultiGlobResponse merge(final MultiGlobResponse other) {
        if (other.metrics.isEmpty()) {
            return this;
        }

        final Map<String, Map<String, GlobMatch>> merged = new LinkedHashMap<>();
        put(merged, metrics);
        put(merged, other.metrics);

        final List<GlobResponse> result = new ArrayList<>(merged.size());

        for (final Map.Entry<String, Map<String, GlobMatch>> e : merged.entrySet()) {
            result.add(new GlobResponse(e.getKey(), ImmutableList.copyOf(e.getValue().values())));
        }

        return new MultiGlobResponse(result);
    }

    private static void put(
        final Map<String, Map<String, GlobMatch>> target, final List<GlobResponse> from
    ) {
        for (final GlobResponse r : from) {
            final Map<String, GlobMatch> matches =
                target.computeIfAbsent(r.getName(), k -> new LinkedHashMap<>());

            for (final GlobMatch m : r.getMatches()) {
                matches.merge(m.getPath(), m, (a, b) -> a.isLeaf() ? a : b);
            }
        }
    }
}
