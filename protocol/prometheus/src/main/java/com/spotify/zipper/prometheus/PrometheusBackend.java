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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.spotify.zipper.backend.BackendResult;
import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.common.Stats;
import com.spotify.zipper.config.BackendSettings;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.Errors;
import com.spotify.zipper.errors.ZipperException;
import com.spotify.zipper.httpquery.AbstractHttpBackend;
import com.spotify.zipper.httpquery.HttpQuery;
import com.spotify.zipper.httpquery.RequestClass;
import com.spotify.zipper.limiter.ServerLimiter;
import com.spotify.zipper.metric.FetchRequest;
import com.spotify.zipper.metric.FetchResponse;
import com.spotify.zipper.metric.GlobMatch;
import com.spotify.zipper.metric.GlobResponse;
import com.spotify.zipper.metric.InfoResponse;
import com.spotify.zipper.metric.MetricInfo;
import com.spotify.zipper.metric.MultiFetchRequest;
import com.spotify.zipper.metric.MultiFetchResponse;
import com.spotify.zipper.metric.MultiGlobRequest;
import com.spotify.zipper.metric.MultiGlobResponse;
import com.spotify.zipper.metric.MultiMetricsInfoRequest;
import com.spotify.zipper.metric.Retention;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Client for the Prometheus HTTP API.
 * <p>
 * Graphite names map to {@code __name__}, tagged series to PromQL selectors and back to
 * {@code name;tag=value} names.
 */
@Slf4j
@ToString(of = {"settings", "step", "maxPointsPerQuery"})
public class PrometheusBackend extends AbstractHttpBackend {
    public static final String CONTENT_TYPE = "application/json";

    public static final String STEP_OPTION = "step";
    public static final String MAX_POINTS_PER_QUERY_OPTION = "maxPointsPerQuery";
    public static final long DEFAULT_STEP = 15;
    public static final long DEFAULT_MAX_POINTS_PER_QUERY = 11000;

    private static final Pattern LABEL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private static final TypeReference<ApiResponse<QueryRangeData>> QUERY_RANGE =
        new TypeReference<ApiResponse<QueryRangeData>>() {
        };
    private static final TypeReference<ApiResponse<List<String>>> STRINGS =
        new TypeReference<ApiResponse<List<String>>>() {
        };
    private static final TypeReference<ApiResponse<List<Map<String, String>>>> SERIES =
        new TypeReference<ApiResponse<List<Map<String, String>>>>() {
        };
    private static final TypeReference<ApiResponse<Object>> ANY =
        new TypeReference<ApiResponse<Object>>() {
        };

    private final long step;
    private final long maxPointsPerQuery;
    private final ObjectMapper mapper;

    public PrometheusBackend(final BackendSettings settings, final ServerLimiter limiter) {
        super(settings, limiter, CONTENT_TYPE);
        this.step = settings.longOption(STEP_OPTION, DEFAULT_STEP);
        this.maxPointsPerQuery =
            settings.longOption(MAX_POINTS_PER_QUERY_OPTION, DEFAULT_MAX_POINTS_PER_QUERY);

        if (step <= 0 || maxPointsPerQuery <= 0) {
            throw new IllegalArgumentException(
                name() + ": step and maxPointsPerQuery must be positive");
        }

        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new Jdk8Module());
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Run one range query per metric.
     */
    @Override
    public BackendResult<MultiFetchResponse> fetch(
        final QueryContext ctx, final MultiFetchRequest request
    ) {
        final List<BackendResult<MultiFetchResponse>> parts = new ArrayList<>();

        for (final FetchRequest m : request.getMetrics()) {
            try {
                parts.add(fetchOne(ctx, m));
            } catch (final ZipperException e) {
                log.debug("{}: rejecting target {}: {}", name(), m.getName(), e.getMessage());
                parts.add(new BackendResult<>(Optional.empty(),
                    RequestClass.RENDER.requested().merge(RequestClass.RENDER.failed(false)),
                    Errors.fatal(e)));
            }
        }

        return combine(parts, MultiFetchResponse.empty(), MultiFetchResponse::merge);
    }

    private BackendResult<MultiFetchResponse> fetchOne(
        final QueryContext ctx, final FetchRequest m
    ) {
        final String query;
        long minStep = step;

        if (m.isTagQuery()) {
            final PromQL.Selector selector = PromQL.seriesByTag(m.getName());
            query = selector.getQuery();

            if (selector.getStep().isPresent()) {
                minStep = parseStep(selector.getStep().get());
            }
        } else if (m.isGlob()) {
            query = nameMatcher(m.getName());
        } else {
            query = m.getName();
        }

        final long start = m.getStartTime();
        final long stop = m.getStopTime();
        final long queryStep = PromQL.adjustStep(start, stop, maxPointsPerQuery, minStep);

        log.debug("{}: will do query {} from {} to {} with step {}", name(), query, start, stop,
            queryStep);

        final String uri = uri("/api/v1/query_range", ImmutableListMultimap.of(
            "query", query, "start", Long.toString(start), "end", Long.toString(stop), "step",
            Long.toString(queryStep)));

        return request(ctx, RequestClass.RENDER, uri, body -> {
            final QueryRangeData data = mapper.readValue(body, QUERY_RANGE).getOrThrow();
            final List<FetchResponse> series = new ArrayList<>(data.getResult().size());

            for (final RangeResult r : data.getResult()) {
                series.add(new FetchResponse(PromQL.toGraphiteName(r.getMetric()),
                    m.getPathExpression(), FetchResponse.DEFAULT_CONSOLIDATION, start, stop,
                    queryStep, 0.0, PromQL.alignValues(start, stop, queryStep, r.getValues()),
                    start, stop).withConsistentStopTime());
            }

            return new MultiFetchResponse(series);
        });
    }

    /**
     * Find metric names. {@code *} lists all names, other globs are matched as a regular
     * expression over {@code __name__}. Names deeper than the glob are reported as branches.
     */
    @Override
    public BackendResult<MultiGlobResponse> find(
        final QueryContext ctx, final MultiGlobRequest request
    ) {
        final List<BackendResult<MultiGlobResponse>> parts = new ArrayList<>();

        for (final String q : request.getMetrics()) {
            if ("*".equals(q)) {
                parts.add(request(ctx, RequestClass.FIND, "/api/v1/label/__name__/values",
                    body -> globResponse(q, mapper.readValue(body, STRINGS).getOrThrow())));
                continue;
            }

            final String uri =
                uri("/api/v1/series", ImmutableListMultimap.of("match[]", nameMatcher(q)));

            parts.add(request(ctx, RequestClass.FIND, uri, body -> {
                final List<String> names = new ArrayList<>();

                for (final Map<String, String> labels : mapper
                    .readValue(body, SERIES)
                    .getOrThrow()) {
                    final String name = labels.get(PromQL.NAME_LABEL);

                    if (name != null) {
                        names.add(name);
                    }
                }

                return globResponse(q, names);
            }));
        }

        return combine(parts, MultiGlobResponse.empty(), MultiGlobResponse::merge);
    }

    /**
     * Describe metrics from configuration, since the API has no notion of retention. The query
     * step is reported as the only retention.
     */
    @Override
    public BackendResult<InfoResponse> info(
        final QueryContext ctx, final MultiMetricsInfoRequest request
    ) {
        final List<MetricInfo> infos = new ArrayList<>();

        for (final String name : request.getNames()) {
            infos.add(new MetricInfo(name, MetricInfo.DEFAULT_CONSOLIDATION, 0.0,
                step * maxPointsPerQuery, ImmutableList.of(new Retention(step,
                maxPointsPerQuery))));
        }

        final String server = backends().size() == 1 ? backends().get(0) : name();
        return BackendResult.ok(InfoResponse.of(server, infos), Stats.empty());
    }

    @Override
    public BackendResult<List<String>> tagNames(
        final QueryContext ctx, final String query, final int limit
    ) {
        final HttpUrl parsed = parseQuery(query);
        final Optional<String> prefix = Optional.ofNullable(parsed.queryParameter("tagPrefix"));
        final ImmutableListMultimap<String, String> matchers;

        try {
            matchers = matchers(parsed);
        } catch (final ZipperException e) {
            return BackendResult.failed(e);
        }

        return request(ctx, RequestClass.TAGS, uri("/api/v1/labels", matchers), body -> {
            final List<String> names = new ArrayList<>();

            for (final String label : mapper.readValue(body, STRINGS).getOrThrow()) {
                final String tag = PromQL.NAME_LABEL.equals(label) ? PromQL.NAME_TAG : label;

                if (prefix.map(tag::startsWith).orElse(true)) {
                    names.add(tag);
                }
            }

            return truncate(names, limit);
        });
    }

    @Override
    public BackendResult<List<String>> tagValues(
        final QueryContext ctx, final String query, final int limit
    ) {
        final HttpUrl parsed = parseQuery(query);
        final String tag = parsed.queryParameter("tag");

        if (tag == null || tag.isEmpty()) {
            return BackendResult.failed(
                new ZipperException(ErrorKind.INVALID_ARGUMENT, "tag is not specified"));
        }

        final Optional<String> prefix = Optional.ofNullable(parsed.queryParameter("valuePrefix"));
        final String label = PromQL.NAME_TAG.equals(tag) ? PromQL.NAME_LABEL : tag;

        if (!LABEL_NAME.matcher(label).matches()) {
            return BackendResult.failed(
                new ZipperException(ErrorKind.INVALID_ARGUMENT, "invalid tag: " + tag));
        }

        final ImmutableListMultimap<String, String> matchers;

        try {
            matchers = matchers(parsed);
        } catch (final ZipperException e) {
            return BackendResult.failed(e);
        }

        final String path = "/api/v1/label/" + label + "/values";

        return request(ctx, RequestClass.TAGS, uri(path, matchers), body -> {
            final List<String> values = new ArrayList<>();

            for (final String value : mapper.readValue(body, STRINGS).getOrThrow()) {
                if (prefix.map(value::startsWith).orElse(true)) {
                    values.add(value);
                }
            }

            return truncate(values, limit);
        });
    }

    /**
     * Errors of the API come with a JSON body describing them.
     */
    @Override
    protected ZipperException statusError(final HttpQuery.ServerResponse response) {
        try {
            final ApiResponse<Object> parsed = mapper.readValue(response.getBody(), ANY);

            if (!parsed.isSuccess()) {
                return parsed.toError().withServer(response.getServer());
            }
        } catch (final IOException e) {
            log.debug("{}: error response from {} is not an API response", name(),
                response.getServer(), e);
        }

        return super.statusError(response);
    }

    /**
     * Map names to a glob answer. A name with more segments than the glob matched through a
     * trailing wildcard, and is cut to a branch at the depth of the glob.
     */
    static MultiGlobResponse globResponse(final String glob, final List<String> names) {
        final int depth = Splitter.on('.').splitToList(glob).size();
        final Set<GlobMatch> matches = new LinkedHashSet<>();

        for (final String name : names) {
            final List<String> segments = Splitter.on('.').splitToList(name);

            if (segments.size() > depth) {
                matches.add(GlobMatch.branch(Joiner.on('.').join(segments.subList(0, depth))));
            } else {
                matches.add(GlobMatch.leaf(name));
            }
        }

        return MultiGlobResponse.of(new GlobResponse(glob, ImmutableList.copyOf(matches)));
    }

    private static String nameMatcher(final String glob) {
        return "{" + PromQL.NAME_LABEL + "=~\"^" + PromQL.globToRegex(glob) + "$\"}";
    }

    /**
     * Series selector built from the {@code expr} parameters of a graphite tag query.
     */
    private static ImmutableListMultimap<String, String> matchers(final HttpUrl parsed) {
        final List<String> selectors = new ArrayList<>();

        for (final String expr : parsed.queryParameterValues("expr")) {
            selectors.add(PromQL.selector(PromQL.toLabel(PromQL.parseTag(expr))));
        }

        if (selectors.isEmpty()) {
            return ImmutableListMultimap.of();
        }

        return ImmutableListMultimap.of("match[]", "{" + Joiner.on(", ").join(selectors) + "}");
    }

    private static List<String> truncate(final List<String> values, final int limit) {
        if (limit > 0 && values.size() > limit) {
            return ImmutableList.copyOf(values.subList(0, limit));
        }

        return values;
    }

    private static long parseStep(final String value) {
        try {
            final long parsed = Long.parseLong(value);

            if (parsed > 0) {
                return parsed;
            }
        } catch (final NumberFormatException e) {
            log.debug("invalid step: {}", value, e);
        }

        throw new ZipperException(ErrorKind.INVALID_ARGUMENT, "invalid step: " + value);
    }
}
