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

package com.spotify.zipper.msgpack;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.spotify.zipper.backend.BackendResult;
import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.config.BackendSettings;
import com.spotify.zipper.httpquery.AbstractHttpBackend;
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
import lombok.Data;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for graphite-web compatible servers answering in msgpack.
 */
@Slf4j
@ToString(of = {"settings"})
public class MsgpackBackend extends AbstractHttpBackend {
    public static final String FORMAT = "msgpack";
    public static final String CONTENT_TYPE = "application/x-msgpack";

    private static final TypeReference<List<RenderSeries>> RENDER =
        new TypeReference<List<RenderSeries>>() {
        };
    private static final TypeReference<List<FindMatch>> FIND =
        new TypeReference<List<FindMatch>>() {
        };
    private static final TypeReference<List<String>> TAGS = new TypeReference<List<String>>() {
    };

    private final ObjectMapper msgpack = mapper(new ObjectMapper(new MessagePackFactory()));
    private final ObjectMapper json = mapper(new ObjectMapper());

    public MsgpackBackend(final BackendSettings settings, final ServerLimiter limiter) {
        super(settings, limiter, CONTENT_TYPE);
    }

    /**
     * Fetch all metrics, with one render request per path expression and time range.
     */
    @Override
    public BackendResult<MultiFetchResponse> fetch(
        final QueryContext ctx, final MultiFetchRequest request
    ) {
        final Map<RenderGroup, List<String>> groups = new LinkedHashMap<>();

        for (final FetchRequest m : request.getMetrics()) {
            groups
                .computeIfAbsent(new RenderGroup(m.getPathExpression(), m.getStartTime(),
                    m.getStopTime()), k -> new ArrayList<>())
                .add(m.getName());
        }

        final List<BackendResult<MultiFetchResponse>> parts = new ArrayList<>();

        for (final Map.Entry<RenderGroup, List<String>> e : groups.entrySet()) {
            final RenderGroup group = e.getKey();
            final ImmutableListMultimap.Builder<String, String> params =
                ImmutableListMultimap.builder();

            params.putAll("target", e.getValue());
            params.put("format", FORMAT);
            params.put("from", Long.toString(group.getStartTime()));
            params.put("until", Long.toString(group.getStopTime()));

            parts.add(request(ctx, RequestClass.RENDER, uri("/render/", params.build()),
                body -> toFetchResponse(group, msgpack.readValue(body, RENDER))));
        }

        return combine(parts, MultiFetchResponse.empty(), MultiFetchResponse::merge);
    }

    @Override
    public BackendResult<MultiGlobResponse> find(
        final QueryContext ctx, final MultiGlobRequest request
    ) {
        final List<BackendResult<MultiGlobResponse>> parts = new ArrayList<>();

        for (final String q : request.getMetrics()) {
            final String uri = uri("/metrics/find/", ImmutableListMultimap.of(
                "query", q, "format", FORMAT));

            parts.add(request(ctx, RequestClass.FIND, uri, body -> {
                final List<FindMatch> found = msgpack.readValue(body, FIND);
                final List<GlobMatch> matches = new ArrayList<>(found.size());

                for (final FindMatch m : found) {
                    matches.add(new GlobMatch(m.getPath(), m.isLeaf()));
                }

                return MultiGlobResponse.of(new GlobResponse(q, matches));
            }));
        }

        return combine(parts, MultiGlobResponse.empty(), MultiGlobResponse::merge);
    }

    /**
     * Describe metrics. Answers are keyed by the server address when there is only one, or by the
     * name of this backend otherwise.
     */
    @Override
    public BackendResult<InfoResponse> info(
        final QueryContext ctx, final MultiMetricsInfoRequest request
    ) {
        final List<BackendResult<List<MetricInfo>>> parts = new ArrayList<>();

        for (final String target : request.getNames()) {
            final String uri = uri("/info/", ImmutableListMultimap.of(
                "target", target, "format", FORMAT));

            parts.add(request(ctx, RequestClass.INFO, uri,
                body -> ImmutableList.of(
                    msgpack.readValue(body, InfoMessage.class).toMetricInfo(target))));
        }

        final String server = backends().size() == 1 ? backends().get(0) : name();

        return combine(parts, ImmutableList.<MetricInfo>of(),
            (a, b) -> ImmutableList.<MetricInfo>builder().addAll(a).addAll(b).build()).map(
            infos -> InfoResponse.of(server, infos));
    }

    @Override
    public BackendResult<List<String>> tagNames(
        final QueryContext ctx, final String query, final int limit
    ) {
        return tags(ctx, "/tags/autoComplete/tags", query);
    }

    @Override
    public BackendResult<List<String>> tagValues(
        final QueryContext ctx, final String query, final int limit
    ) {
        return tags(ctx, "/tags/autoComplete/values", query);
    }

    private BackendResult<List<String>> tags(
        final QueryContext ctx, final String path, final String query
    ) {
        final String uri = query.isEmpty() ? path : path + "?" + query;
        return request(ctx, RequestClass.TAGS, uri, body -> json.readValue(body, TAGS));
    }

    private MultiFetchResponse toFetchResponse(
        final RenderGroup group, final List<RenderSeries> series
    ) {
        final List<FetchResponse> metrics = new ArrayList<>(series.size());

        for (final RenderSeries s : series) {
            metrics.add(new FetchResponse(s.getName(), group.getPathExpression(),
                FetchResponse.DEFAULT_CONSOLIDATION, s.getStart(), s.getEnd(), s.getStep(), 0.0,
                s.doubleValues(), group.getStartTime(), group.getStopTime()));
        }

        log.debug("{}: got {} series for {}", name(), metrics.size(), group.getPathExpression());
        return new MultiFetchResponse(metrics);
    }

    private static ObjectMapper mapper(final ObjectMapper mapper) {
        mapper.registerModule(new Jdk8Module());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Data
    private static class RenderGroup {
        private final String pathExpression;
        private final long startTime;
        private final long stopTime;
    }
}
