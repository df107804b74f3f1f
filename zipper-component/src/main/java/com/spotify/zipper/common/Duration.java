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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Data;

import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A simplified duration, as used in configuration.
 * <p>
 * Parses strings like {@code 200ms}, {@code 10s}, {@code 5m}, {@code 1h} and {@code 1d}. A bare
 * number is interpreted as milliseconds.
 */
@Data
public class Duration {
    private static final Pattern PATTERN = Pattern.compile("^(\\d+)\\s*([a-zA-Z]*)$");

    private final long duration;
    private final TimeUnit unit;

    public long convert(final TimeUnit other) {
        return other.convert(duration, unit);
    }

    public long toMilliseconds() {
        return convert(TimeUnit.MILLISECONDS);
    }

    public long toNanoseconds() {
        return convert(TimeUnit.NANOSECONDS);
    }

    public boolean isZero() {
        return duration == 0;
    }

    public Duration max(final Duration other) {
        return toNanoseconds() >= other.toNanoseconds() ? this : other;
    }

    @JsonValue
    public String toDSL() {
        return duration + unitSuffix(unit);
    }

    public static Duration of(final long duration, final TimeUnit unit) {
        return new Duration(duration, unit);
    }

    @JsonCreator
    public static Duration parse(final String input) {
        final Matcher m = PATTERN.matcher(input.trim());

        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid duration: " + input);
        }

        final long value = Long.parseLong(m.group(1));
        return new Duration(value, parseUnit(m.group(2)));
    }

    @JsonCreator
    public static Duration fromMilliseconds(final long milliseconds) {
        return new Duration(milliseconds, TimeUnit.MILLISECONDS);
    }

    private static TimeUnit parseUnit(final String unit) {
        switch (unit.toLowerCase()) {
            case "":
            case "ms":
                return TimeUnit.MILLISECONDS;
            case "s":
                return TimeUnit.SECONDS;
            case "m":
                return TimeUnit.MINUTES;
            case "h":
                return TimeUnit.HOURS;
            case "d":
                return TimeUnit.DAYS;
            default:
                throw new IllegalArgumentException("Unsupported duration unit: " + unit);
        }
    }

    private static String unitSuffix(final TimeUnit unit) {
        switch (unit) {
            case MILLISECONDS:
                return "ms";
            case SECONDS:
                return "s";
            case MINUTES:
                return "m";
            case HOURS:
                return "h";
            case DAYS:
                return "d";
            default:
                throw new IllegalStateException("Unsupported unit: " + unit);
        }
    }
}
