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

import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.ZipperException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Objects;

/**
 * A single series.
 * <p>
 * Absent points are represented as {@link Double#NaN}.
 */
@Slf4j
@Data
public class FetchResponse {
    public static final String DEFAULT_CONSOLIDATION = "Average";

    private final String name;
    private final String pathExpression;
    private final String consolidationFunc;
    private final long startTime;
    private final long stopTime;
    private final long stepTime;
    private final double xFilesFactor;
    private final double[] values;
    private final long requestStartTime;
    private final long requestStopTime;

    public FetchResponse(
        final String name, final String pathExpression, final String consolidationFunc,
        final long startTime, final long stopTime, final long stepTime,
        final double xFilesFactor, final double[] values, final long requestStartTime,
        final long requestStopTime
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.pathExpression = Objects.requireNonNull(pathExpression, "pathExpression");
        this.consolidationFunc = Objects.requireNonNull(consolidationFunc, "consolidationFunc");
        this.startTime = startTime;
        this.stopTime = stopTime;
        this.stepTime = stepTime;
        this.xFilesFactor = xFilesFactor;
        this.values = Objects.requireNonNull(values, "values");
        this.requestStartTime = requestStartTime;
        this.requestStopTime = requestStopTime;
    }

    /**
     * Build a series covering the given values, with the stop time derived from them.
     */
    public static FetchResponse of(
        final String name, final long startTime, final long stepTime, final double... values
    ) {
        return new FetchResponse(name, name, DEFAULT_CONSOLIDATION, startTime,
            stopTimeOf(startTime, stepTime, values.length), stepTime, 0.0, values, startTime,
            stopTimeOf(startTime, stepTime, values.length));
    }

    public FetchResponse withRequestRange(final long requestStartTime, final long requestStopTime) {
        return new FetchResponse(name, pathExpression, consolidationFunc, startTime, stopTime,
            stepTime, xFilesFactor, values, requestStartTime, requestStopTime);
    }

    public FetchResponse withValues(final double[] values) {
        return new FetchResponse(name, pathExpression, consolidationFunc, startTime, stopTime,
            stepTime, xFilesFactor, values, requestStartTime, requestStopTime);
    }

    /**
     * Recalculate the stop time from start, step and the number of values, so that
     * {@code (stop - start) / step + 1 == values.length}.
     */
    public FetchResponse withConsistentStopTime() {
        final long stop = stopTimeOf(startTime, stepTime, values.length);

        if (stop == stopTime) {
            return this;
        }

        return new FetchResponse(name, pathExpression, consolidationFunc, startTime, stop,
            stepTime, xFilesFactor, values, requestStartTime, requestStopTime);
    }

    public int presentValues() {
        int count = 0;

        for (final double v : values) {
            if (!Double.isNaN(v)) {
                count++;
            }
        }

        return count;
    }

    /**
     * Merge two series for the same metric.
     * <p>
     * With equal steps, the longer series (or, at equal length, the one with more present points)
     * is primary and each of its absent points is filled from the other at the same index. Start
     * times must then be aligned. With unequal steps, the coarser series is kept as is.
     *
     * @throws ZipperException with {@link ErrorKind#RESPONSE_START_TIME_MISMATCH} if the series
     * were requested for, or start at, different times.
     */
    public static FetchResponse merge(final FetchResponse a, final FetchResponse b) {
        if (a.requestStartTime != b.requestStartTime) {
            throw mismatch(a, b);
        }

        if (a.stepTime == b.stepTime) {
            return mergeEqualSteps(a, b);
        }

        final FetchResponse coarser = a.stepTime > b.stepTime ? a : b;

        log.warn("{}: fetch responses had different step times, keeping step {} over {}", a.name,
            coarser.stepTime, coarser == a ? b.stepTime : a.stepTime);

        return coarser;
    }

    private static FetchResponse mergeEqualSteps(final FetchResponse a, final FetchResponse b) {
        if (a.startTime != b.startTime) {
            throw mismatch(a, b);
        }

        final FetchResponse primary;
        final FetchResponse patch;

        if (isPrimary(a, b)) {
            primary = a;
            patch = b;
        } else {
            primary = b;
            patch = a;
        }

        final double[] merged = primary.values.clone();
        boolean changed = false;

        for (int i = 0; i < patch.values.length; i++) {
            if (Double.isNaN(merged[i]) && !Double.isNaN(patch.values[i])) {
                merged[i] = patch.values[i];
                changed = true;
            }
        }

        return changed ? primary.withValues(merged) : primary;
    }

    private static boolean isPrimary(final FetchResponse a, final FetchResponse b) {
        if (a.values.length != b.values.length) {
            return a.values.length > b.values.length;
        }

        final int present = Integer.compare(a.presentValues(), b.presentValues());

        if (present != 0) {
            return present > 0;
        }

        // keeps merge order independent when both sides are equally complete
        return Arrays.compare(a.values, b.values) <= 0;
    }

    private static ZipperException mismatch(final FetchResponse a, final FetchResponse b) {
        log.error("{}: unable to merge fetch responses, request start {} vs {}, start {} vs {}",
            a.name, a.requestStartTime, b.requestStartTime, a.startTime, b.startTime);
        return new ZipperException(ErrorKind.RESPONSE_START_TIME_MISMATCH);
    }

    static long stopTimeOf(final long startTime, final long stepTime, final int length) {
        if (length == 0) {
            return startTime;
        }

        return startTime + (length - 1) * stepTime;
    }
}
