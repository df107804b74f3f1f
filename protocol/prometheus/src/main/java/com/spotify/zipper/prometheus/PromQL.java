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

package com.spotify.zipper.prometheus;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.ZipperException;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Conversions between graphite naming and PromQL.
 */
public final class PromQL {
    public static final String NAME_LABEL = "__name__";
    /**
     * Graphite tag name standing for the metric name.
     */
    public static final String NAME_TAG = "name";
    public static final String STEP_TAG = "__step__";
    public static final String SERIES_BY_TAG = "seriesByTag(";

    private static final long[] STEPS = {
        20, 30, 60, 120, 300, 600, 900, 1200, 1800, 3600, 7200, 10800, 21600, 43200
    };
    private static final long MAX_STEP = 86400;

    private PromQL() {
    }

    @Data
    public static class TagExpression {
        private final String tag;
        private final String op;
        private final String value;
    }

    /**
     * A selector, and the step requested through the {@code __step__} tag if any.
     */
    @Data
    public static class Selector {
        private final String query;
        private final Optional<String> step;
    }

    /**
     * Parse {@code tag=value}, {@code tag=~re}, {@code tag!=value} or {@code tag!=~re}.
     */
    public static TagExpression parseTag(final String expression) {
        final int idx = expression.indexOf('=');

        if (idx < 0) {
            throw new ZipperException(ErrorKind.INVALID_ARGUMENT,
                "invalid tag expression: " + expression);
        }

        final boolean negated = idx > 0 && expression.charAt(idx - 1) == '!';
        final String tag = expression.substring(0, negated ? idx - 1 : idx);
        final boolean regex = idx + 1 < expression.length() && expression.charAt(idx + 1) == '~';
        final String value = expression.substring(regex ? idx + 2 : idx + 1);

        final String op;

        if (negated) {
            op = regex ? "!~" : "!=";
        } else {
            op = regex ? "=~" : "=";
        }

        return new TagExpression(tag, op, value);
    }

    /**
     * Convert {@code seriesByTag('name=a', 'dc=~us.*')} into {@code a{dc=~"us.*"}}.
     * <p>
     * Selectors are rendered in tag order. The {@code name} tag stands for {@code __name__}, an
     * equality on it becomes the metric name.
     */
    public static Selector seriesByTag(final String target) {
        if (!target.startsWith(SERIES_BY_TAG) || !target.endsWith(")")) {
            throw new ZipperException(ErrorKind.INVALID_ARGUMENT, "not a seriesByTag: " + target);
        }

        final String args = target.substring(SERIES_BY_TAG.length(), target.length() - 1);
        final SortedMap<String, TagExpression> tags = new TreeMap<>();

        for (final String arg : Splitter.on(',').trimResults().omitEmptyStrings().split(args)) {
            final TagExpression t = toLabel(parseTag(unquote(arg)));
            tags.put(t.getTag(), t);
        }

        Optional<String> step = Optional.empty();
        final StringBuilder query = new StringBuilder();
        final List<String> selectors = new ArrayList<>();

        final TagExpression name = tags.remove(NAME_LABEL);

        if (name != null) {
            if ("=".equals(name.getOp())) {
                query.append(name.getValue());
            } else {
                selectors.add(selector(name));
            }
        }

        for (final TagExpression t : tags.values()) {
            if (STEP_TAG.equals(t.getTag())) {
                step = Optional.of(t.getValue());
                continue;
            }

            selectors.add(selector(t));
        }

        if (!selectors.isEmpty()) {
            query.append('{').append(Joiner.on(", ").join(selectors)).append('}');
        }

        return new Selector(query.toString(), step);
    }

    /**
     * Convert a graphite glob into a regular expression.
     * <p>
     * {@code *} matches within one path segment, except when trailing where it matches the rest of
     * the name. {@code [...]} is kept as a character class and {@code {a,b}} becomes an
     * alternation.
     */
    public static String globToRegex(final String glob) {
        final StringBuilder sb = new StringBuilder();
        String rest = glob;

        while (true) {
            final int n = indexOfAny(rest, "*[{");

            if (n < 0) {
                sb.append(quote(rest));
                return sb.toString();
            }

            sb.append(quote(rest.substring(0, n)));
            final char ch = rest.charAt(n);
            rest = rest.substring(n + 1);

            switch (ch) {
                case '*':
                    sb.append(rest.isEmpty() ? ".*" : "[^.]*?");
                    break;
                case '[':
                    final int close = rest.indexOf(']');

                    if (close < 0) {
                        sb.append(quote("[" + rest));
                        return sb.toString();
                    }

                    sb.append('[').append(rest, 0, close + 1);
                    rest = rest.substring(close + 1);
                    break;
                default:
                    final int end = rest.indexOf('}');

                    if (end < 0) {
                        sb.append(quote("{" + rest));
                        return sb.toString();
                    }

                    final List<String> alternatives = new ArrayList<>();

                    for (final String alt : Splitter.on(',').split(rest.substring(0, end))) {
                        alternatives.add(quote(alt));
                    }

                    sb.append('(').append(Joiner.on('|').join(alternatives)).append(')');
                    rest = rest.substring(end + 1);
                    break;
            }
        }
    }

    /**
     * Render a label set as {@code name;k1=v1;k2=v2}, with keys sorted.
     */
    public static String toGraphiteName(final Map<String, String> labels) {
        final Map<String, String> rest = new TreeMap<>(labels);
        final StringBuilder sb = new StringBuilder();
        final String name = rest.remove(NAME_LABEL);

        if (name != null) {
            sb.append(name);
        }

        for (final Map.Entry<String, String> e : rest.entrySet()) {
            sb.append(';').append(e.getKey()).append('=').append(e.getValue());
        }

        return sb.toString();
    }

    /**
     * Place samples on the grid {@code start, start + step, ..., stop}, absent points are NaN.
     */
    public static double[] alignValues(
        final long start, final long stop, final long step, final List<Sample> samples
    ) {
        final int length = (int) ((stop - start) / step + 1);
        final double[] values = new double[Math.max(length, 0)];
        int next = 0;

        for (int i = 0; i < values.length; i++) {
            final double timestamp = start + i * step;

            while (next < samples.size() && samples.get(next).getTimestamp() < timestamp) {
                next++;
            }

            if (next < samples.size() && samples.get(next).getTimestamp() == timestamp) {
                values[i] = samples.get(next++).getValue();
                continue;
            }

            values[i] = Double.NaN;
        }

        return values;
    }

    /**
     * Widen the step so that the range holds at most {@code maxPoints} points, rounded up to one
     * of the usual dashboard steps.
     */
    public static long adjustStep(
        final long start, final long stop, final long maxPoints, final long minStep
    ) {
        final long safeStep = (long) Math.ceil((double) (stop - start) / maxPoints);

        if (safeStep <= minStep) {
            return minStep;
        }

        for (final long step : STEPS) {
            if (safeStep <= step) {
                return step;
            }
        }

        return MAX_STEP;
    }

    /**
     * Replace the {@code name} tag with the {@code __name__} label.
     */
    static TagExpression toLabel(final TagExpression t) {
        if (NAME_TAG.equals(t.getTag())) {
            return new TagExpression(NAME_LABEL, t.getOp(), t.getValue());
        }

        return t;
    }

    static String selector(final TagExpression t) {
        return t.getTag() + t.getOp() + "\"" + t.getValue() + "\"";
    }

    private static String unquote(final String arg) {
        if (arg.length() >= 2) {
            final char first = arg.charAt(0);
            final char last = arg.charAt(arg.length() - 1);

            if ((first == '\'' || first == '"') && first == last) {
                return arg.substring(1, arg.length() - 1);
            }
        }

        return arg;
    }

    /**
     * Escape metacharacters with backslashes, the only quoting RE2 supports.
     */
    private static String quote(final String literal) {
        final StringBuilder sb = new StringBuilder(literal.length());

        for (final char c : literal.toCharArray()) {
            if ("\\.+*?()|[]{}^$".indexOf(c) >= 0) {
                sb.append('\\');
            }

            sb.append(c);
        }

        return sb.toString();
    }

    private static int indexOfAny(final String s, final String chars) {
        for (int i = 0; i < s.length(); i++) {
            if (chars.indexOf(s.charAt(i)) >= 0) {
                return i;
            }
        }

        return -1;
    }
}
