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

package com.spotify.zipper;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.spotify.zipper.backend.BackendResult;
import com.spotify.zipper.backend.BackendServer;
import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.common.Stats;
import com.spotify.zipper.common.Timeouts;
import com.spotify.zipper.config.ZipperConfig;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.Errors;
import com.spotify.zipper.errors.HttpErrors;
import com.spotify.zipper.errors.ZipperException;
import com.spotify.zipper.metric.FetchRequest;
import com.spotify.zipper.metric.InfoResponse;
import com.spotify.zipper.metric.ListMetricsResponse;
import com.spotify.zipper.metric.MetricDetailsResponse;
import com.spotify.zipper.metric.MultiFetchRequest;
import com.spotify.zipper.metric.MultiFetchResponse;
import com.spotify.zipper.metric.MultiGlobRequest;
import com.spotify.zipper.metric.MultiGlobResponse;
import com.spotify.zipper.metric.MultiMetricsInfoRequest;
import com.spotify.zipper.protocol.CoreProtocolRegistry;
import com.spotify.zipper.scheduler.DefaultScheduler;
import eu.toolchain.async.AsyncFramework;
import eu.toolchain.async.TinyAsync;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Entry point of all queries.
 * <p>
 * Applies the deadline of each request class, routes queries under the search prefix to the
 * search backends, and turns the result of the backend tree into one response with a status code.
 * Also owns the loop keeping the routing cache warm.
 */
@Slf4j
public class QueryRouter implements AutoCloseable {
    public static final String ROOT = "root";
    public static final String SEARCH = "search";

    private final BackendServer root;
    private final Optional<BackendServer> search;
    private final Optional<String> searchPrefix;
    private final Timeouts timeouts;
    private final StatsSender statsSender;
    private final Optional<TldProber> prober;
    private final List<Runnable> shutdown;

    public QueryRouter(
        final BackendServer root, final Optional<BackendServer> search,
        final Optional<String> searchPrefix, final Timeouts timeouts,
        final StatsSender statsSender, final Optional<TldProber> prober,
        final List<Runnable> shutdown
    ) {
        if (searchPrefix.isPresent() && !search.isPresent()) {
            throw new IllegalArgumentException("searchPrefix requires a search backend");
        }

        this.root = root;
        this.search = search;
        this.searchPrefix = searchPrefix;
        this.timeouts = timeouts;
        this.statsSender = statsSender;
        this.prober = prober;
        this.shutdown = ImmutableList.copyOf(shutdown);
    }

    /**
     * Build a router with all its backends from configuration.
     */
    public static QueryRouter create(
        final ZipperConfig config, final CoreProtocolRegistry registry,
        final StatsSender statsSender
    ) {
        final ExecutorService workers = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("zipper-worker-%d").build());
        final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("zipper-timer-%d").build());
        final AsyncFramework async = TinyAsync.builder().executor(workers).build();

        final BackendFactory factory = new BackendFactory(registry, config, async);
        final BackendServer root = factory.group(ROOT, config.getBackends(), true);

        final Optional<BackendServer> search;

        if (config.getSearchPrefix().isPresent()) {
            search = Optional.of(factory.group(SEARCH, config.getSearch(), false));
        } else {
            search = Optional.empty();
        }

        final TldProber prober =
            new TldProber(root, new DefaultScheduler(timer), async, config.getProbeInterval());

        return new QueryRouter(root, search, config.getSearchPrefix(), config.getTimeouts(),
            statsSender, Optional.of(prober), ImmutableList.of(timer::shutdownNow,
            workers::shutdownNow));
    }

    /**
     * Probe the backends once and start probing periodically.
     */
    public void start() {
        prober.ifPresent(p -> {
            p.force();
            p.start();
        });
    }

    @Override
    public void close() {
        prober.ifPresent(TldProber::stop);
        shutdown.forEach(Runnable::run);
    }

    public RouterResponse<MultiFetchResponse> fetch(
        final QueryContext ctx, final MultiFetchRequest request
    ) {
        try (QueryContext renderCtx = ctx.withTimeout(timeouts.getRender())) {
            final BackendResult<MultiFetchRequest> expanded = expandSearch(renderCtx, request);
            final MultiFetchRequest targets = expanded.getResponse().orElse(request);

            if (targets.isEmpty()) {
                final ZipperException error =
                    new ZipperException(ErrorKind.NOT_FOUND, "no metrics to fetch");
                return respond("fetch", new BackendResult<MultiFetchResponse>(Optional.empty(),
                    expanded.getStats(), expanded.getErrors().merge(Errors.fatal(error))));
            }

            final BackendResult<MultiFetchResponse> result = root.fetch(renderCtx, targets);
            return respond("fetch", withPrelude(result, expanded));
        }
    }

    public RouterResponse<MultiGlobResponse> find(
        final QueryContext ctx, final MultiGlobRequest request
    ) {
        try (QueryContext findCtx = ctx.withTimeout(timeouts.getFind())) {
            return respond("find", doFind(findCtx, request));
        }
    }

    /**
     * Describe metrics. Globs are expanded with a find first, if that fails the names are sent as
     * given.
     */
    public RouterResponse<InfoResponse> info(
        final QueryContext ctx, final MultiMetricsInfoRequest request
    ) {
        try (QueryContext findCtx = ctx.withTimeout(timeouts.getFind())) {
            final BackendResult<MultiGlobResponse> found =
                doFind(findCtx, new MultiGlobRequest(request.getNames()));

            final List<String> names;

            if (found.isFatal() || !found.getResponse().isPresent()) {
                log.debug("find failed before info, using names as given: {}",
                    found.getErrors().getErrors());
                names = request.getNames();
            } else {
                names = found.getResponse().get().leaves();
            }

            final BackendResult<InfoResponse> result =
                root.info(findCtx, new MultiMetricsInfoRequest(names));
            return respond("info", result.withStats(found.getStats().merge(result.getStats())));
        }
    }

    public RouterResponse<ListMetricsResponse> list(final QueryContext ctx) {
        return respond("list", root.list(ctx));
    }

    public RouterResponse<MetricDetailsResponse> stats(final QueryContext ctx) {
        return respond("stats", root.stats(ctx));
    }

    public RouterResponse<List<String>> tagNames(
        final QueryContext ctx, final String query, final int limit
    ) {
        try (QueryContext findCtx = ctx.withTimeout(timeouts.getFind())) {
            return respond("tagNames", root.tagNames(findCtx, query, limit));
        }
    }

    public RouterResponse<List<String>> tagValues(
        final QueryContext ctx, final String query, final int limit
    ) {
        try (QueryContext findCtx = ctx.withTimeout(timeouts.getFind())) {
            return respond("tagValues", root.tagValues(findCtx, query, limit));
        }
    }

    private BackendResult<MultiGlobResponse> doFind(
        final QueryContext ctx, final MultiGlobRequest request
    ) {
        if (!searchPrefix.isPresent()) {
            return root.find(ctx, request);
        }

        final List<String> regular = new ArrayList<>();
        final List<String> searched = new ArrayList<>();

        for (final String query : request.getMetrics()) {
            if (query.startsWith(searchPrefix.get())) {
                searched.add(query);
            } else {
                regular.add(query);
            }
        }

        if (searched.isEmpty()) {
            return root.find(ctx, request);
        }

        final BackendResult<MultiGlobResponse> fromSearch =
            search.get().find(ctx, new MultiGlobRequest(searched));

        if (regular.isEmpty()) {
            return fromSearch;
        }

        final BackendResult<MultiGlobResponse> merged = root
            .find(ctx, new MultiGlobRequest(regular))
            .merge(fromSearch, MultiGlobResponse::merge);

        final boolean hasData = merged.getResponse().map(r -> !r.isEmpty()).orElse(false);
        return merged.withErrors(
            hasData ? merged.getErrors().asNonFatal() : merged.getErrors().asFatal());
    }

    /**
     * Replace metrics under the search prefix with the leaves the search backends find for them.
     */
    private BackendResult<MultiFetchRequest> expandSearch(
        final QueryContext ctx, final MultiFetchRequest request
    ) {
        if (!searchPrefix.isPresent()) {
            return BackendResult.ok(request, Stats.empty());
        }

        final List<FetchRequest> metrics = new ArrayList<>();
        Stats stats = Stats.empty();
        Errors errors = Errors.none();

        for (final FetchRequest metric : request.getMetrics()) {
            if (!metric.getName().startsWith(searchPrefix.get())) {
                metrics.add(metric);
                continue;
            }

            final BackendResult<MultiGlobResponse> found =
                search.get().find(ctx, MultiGlobRequest.of(metric.getName()));
            stats = stats.merge(found.getStats());

            if (found.isFatal() || !found.getResponse().isPresent()) {
                log.warn("search for {} failed: {}", metric.getName(),
                    found.getErrors().getErrors());
                errors = errors.merge(found.getErrors().asNonFatal());
                continue;
            }

            errors = errors.merge(found.getErrors());

            for (final String leaf : found.getResponse().get().leaves()) {
                metrics.add(metric.withName(leaf));
            }
        }

        return new BackendResult<>(Optional.of(new MultiFetchRequest(metrics)), stats, errors);
    }

    private static <T> BackendResult<T> withPrelude(
        final BackendResult<T> result, final BackendResult<?> prelude
    ) {
        return new BackendResult<>(result.getResponse(),
            prelude.getStats().merge(result.getStats()),
            prelude.getErrors().asNonFatal().merge(result.getErrors()));
    }

    private <T> RouterResponse<T> respond(final String operation, final BackendResult<T> result) {
        statsSender.send(operation, result.getStats());
        return toResponse(result);
    }

    /**
     * Derive the externally visible outcome of a result.
     * <p>
     * Fatal results carry no data and the consensus status of their errors. Results with data are
     * always successful, non-fatal errors are attached as causes.
     */
    static <T> RouterResponse<T> toResponse(final BackendResult<T> result) {
        final Errors errors = result.getErrors();

        if (errors.isFatal() || !result.getResponse().isPresent()) {
            if (errors.isEmpty()) {
                return new RouterResponse<>(Optional.empty(), result.getStats(),
                    Optional.of(new ZipperException(ErrorKind.NO_RESPONSE_FETCHED)),
                    HttpErrors.NOT_FOUND);
            }

            final int code = HttpErrors.mergeHttpErrors(errors.getErrors()).getCode();
            return new RouterResponse<>(Optional.empty(), result.getStats(),
                Optional.of(asException(errors).withHttpCode(code)), code);
        }

        if (errors.isEmpty()) {
            return new RouterResponse<>(result.getResponse(), result.getStats(),
                Optional.empty(), HttpErrors.OK);
        }

        return new RouterResponse<>(result.getResponse(), result.getStats(),
            Optional.of(new ZipperException(ErrorKind.NON_FATAL_ERRORS).withCauses(
                errors.getErrors())), HttpErrors.OK);
    }

    private static ZipperException asException(final Errors errors) {
        if (errors.getErrors().size() == 1 && errors.first().get() instanceof ZipperException) {
            return (ZipperException) errors.first().get();
        }

        return new ZipperException(ErrorKind.FAILED_TO_FETCH,
            ErrorKind.FAILED_TO_FETCH.getDescription()).withCauses(errors.getErrors());
    }
}
