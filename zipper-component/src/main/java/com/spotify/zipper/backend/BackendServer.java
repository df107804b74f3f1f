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

import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.metric.InfoResponse;
import com.spotify.zipper.metric.ListMetricsResponse;
import com.spotify.zipper.metric.MetricDetailsResponse;
import com.spotify.zipper.metric.MultiFetchRequest;
import com.spotify.zipper.metric.MultiFetchResponse;
import com.spotify.zipper.metric.MultiGlobRequest;
import com.spotify.zipper.metric.MultiGlobResponse;
import com.spotify.zipper.metric.MultiMetricsInfoRequest;

import java.util.List;

/**
 * A backend capable of answering metric queries.
 * <p>
 * Implemented both by protocol adapters talking to a set of servers and by groups which fan out to
 * other backends. Operations never throw for backend failures, they are reported through
 * {@link BackendResult#getErrors()}.
 */
public interface BackendServer {
    /**
     * Name used for limiter slots, stats and error messages.
     */
    String name();

    /**
     * Addresses of the servers behind this backend.
     */
    List<String> backends();

    /**
     * Largest number of metrics to send in one fetch, {@code 0} for no limit.
     */
    int maxMetricsPerRequest();

    BackendResult<MultiFetchResponse> fetch(QueryContext ctx, MultiFetchRequest request);

    BackendResult<MultiGlobResponse> find(QueryContext ctx, MultiGlobRequest request);

    BackendResult<InfoResponse> info(QueryContext ctx, MultiMetricsInfoRequest request);

    BackendResult<ListMetricsResponse> list(QueryContext ctx);

    BackendResult<MetricDetailsResponse> stats(QueryContext ctx);

    /**
     * First path segments currently served by this backend.
     */
    BackendResult<List<String>> probeTLDs(QueryContext ctx);

    BackendResult<List<String>> tagNames(QueryContext ctx, String query, int limit);

    BackendResult<List<String>> tagValues(QueryContext ctx, String query, int limit);
}
