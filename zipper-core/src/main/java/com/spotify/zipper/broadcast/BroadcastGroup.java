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

package com.spotify.zipper.broadcast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.spotify.zipper.backend.BackendResult;
import com.spotify.zipper.backend.BackendServer;
import com.spotify.zipper.broadcast.ScatterGather.Gathered;
import com.spotify.zipper.broadcast.ScatterGather.Unit;
import com.spotify.zipper.cache.RoutingCache;
import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.common.Stats;
import com.spotify.zipper.common.Timeouts;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.Errors;
import com.spotify.zipper.errors.HttpErrors;
import com.spotify.zipper.errors.ZipperException;
import com.spotify.zipper.limiter.CoreServerLimiter;
import com.spotify.zipper.limiter.NoopLimiter;
import com.spotify.zipper.limiter.ServerLimiter;
import com.spotify.zipper.metric.FetchRequest;
import com.spotify.zipper.metric.FetchResponse;
import com.spotify.zipper.metric.GlobMatch;
import com.spotify.zipper.metric.GlobResponse;
import com.spotify.zipper.metric.InfoResponse;
import com.spotify.zipper.metric.ListMetricsResponse;
import com.spotify.zipper.metric.MetricDetailsResponse;
import com.spotify.zipper.metric.MultiFetchRequest;
import com.spotify.zipper.metric.MultiFetchResponse;
import com.spotify.zipper.metric.MultiGlobRequest;
import com.spotify.zipper.metric.MultiGlobResponse;
import com.spotify.zipper.metric.MultiMetricsInfoRequest;
import eu.toolchain.async.AsyncFramework;
import lombok.Data;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Presents many backends as one.
 * <p>
 * Each operation is sent to every child concurrently, under the deadline of its request class, and
 * the partial answers are merged. Children that fail or do not answer in time are reported as
 * non-fatal errors next to the merged data. The result is only fatal if no child contributed any
 * data, or if the group requires every child to succeed.
 */
@Slf4j
@ToString(of = {"name", "children", "root"})
public class BroadcastGroup implements BackendServer {
    private final String name;
    private final List<BackendServer> children;
    private final ServerLimiter limiter;
    private final Timeouts timeouts;
    private final int maxMetricsPerRequest;
    private final boolean doMultipleRequestsIfSplit;
    private final boolean requireSuccessAll;
    private final Optional<RoutingCache> cache;
    private final boolean root;

    private final ScatterGather<MultiFetchResponse> fetches;
    private final ScatterGather<MultiGlobResponse> finds;
    private final ScatterGather<InfoResponse> infos;
    private final ScatterGather<List<String>> tags;
    private final ScatterGather<Map<String, List<BackendServer>>> probes;

    BroadcastGroup(
        final String name, final List<BackendServer> children, final ServerLimiter limiter,
        final Timeouts timeouts, final int maxMetricsPerRequest,
        final boolean doMultipleRequestsIfSplit, final boolean requireSuccessAll,
        final Optional<RoutingCache> cache, final boolean root, final AsyncFramework async
    ) {
        this.name = name;
        this.children = ImmutableList.copyOf(children);
        this.limiter = limiter;
        this.timeouts = timeouts;
        this.maxMetricsPerRequest = maxMetricsPerRequest;
        this.doMultipleRequestsIfSplit = doMultipleRequestsIfSplit;
        this.requireSuccessAll = requireSuccessAll;
        this.cache = cache;
        this.root = root;

        this.fetches = new ScatterGather<>(name, async, limiter, MultiFetchResponse::merge);
        this.finds = new ScatterGather<>(name, async, limiter, MultiGlobResponse::merge);
        this.infos = new ScatterGather<>(name, async, limiter, InfoResponse::merge);
        this.tags = new ScatterGather<>(name, async, limiter, BroadcastGroup::union);
        this.probes = new ScatterGather<>(name, async, limiter, BroadcastGroup::mergeProbes);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> backends() {
        final Set<String> backends = new LinkedHashSet<>();

        for (final BackendServer child : children) {
            backends.addAll(child.backends());
        }

        return ImmutableList.copyOf(backends);
    }

    @Override
    public int maxMetricsPerRequest() {
        return maxMetricsPerRequest;
    }

    public List<BackendServer> children() {
        return children;
    }

    public boolean isRoot() {
        return root;
    }

    public Optional<RoutingCache> cache() {
        return cache;
    }

    @Override
    public BackendResult<MultiFetchResponse> fetch(
        final QueryContext ctx, final MultiFetchRequest request
    ) {
        log.debug("{}: will try to fetch {}", name, request.names());

        try (QueryContext fetchCtx = ctx.withTimeout(timeouts.getRender())) {
            final Filtered filtered = filterServersByTLD(request.names());
            Stats stats = filtered.getStats();

            final List<Throwable> errors = new ArrayList<>();
            final List<Unit<MultiFetchResponse>> units = new ArrayList<>();

            if (doMultipleRequestsIfSplit) {
                for (final BackendServer child : filtered.getServers()) {
                    units.add(ScatterGather.unlimited(child.name(),
                        c -> fetchInBatches(c, request, child)));
                }
            } else {
                for (final BackendServer child : filtered.getServers()) {
                    units.add(ScatterGather.unit(child.name(),
                        c -> fetchSequentially(c, request, child)));
                }
            }

            final Gathered<MultiFetchResponse> gathered = fetches.run(fetchCtx, units);
            stats = stats.merge(gathered.getStats());
            errors.addAll(gathered.getErrors());

            final MultiFetchResponse response =
                gathered.getResponse().orElseGet(MultiFetchResponse::empty);

            if (response.isEmpty() || (requireSuccessAll && !errors.isEmpty())) {
                return BackendResult.failed(mergeErrors(errors), stats);
            }

            log.debug("{}: got {} series from {} of {} requests ({} errors)", name,
                response.getMetrics().size(), gathered.getAnswered(), units.size(),
                errors.size());

            return new BackendResult<>(
                Optional.of(response.map(FetchResponse::withConsistentStopTime)), stats,
                Errors.nonFatal(errors));
        }
    }

    @Override
    public BackendResult<MultiGlobResponse> find(
        final QueryContext ctx, final MultiGlobRequest request
    ) {
        log.debug("{}: will find {} with timeout {}", name, request.getMetrics(),
            timeouts.getFind());

        try (QueryContext findCtx = ctx.withTimeout(timeouts.getFind())) {
            final List<Unit<MultiGlobResponse>> units = children
                .stream()
                .map(child -> ScatterGather.unit(child.name(), c -> child.find(c, request)))
                .collect(Collectors.toList());

            final Gathered<MultiGlobResponse> gathered = finds.run(findCtx, units);
            final Stats stats = Stats
                .of(Stats.ZIPPER_REQUESTS, children.size())
                .merge(gathered.getStats());
            final List<Throwable> errors = gathered.getErrors();

            final MultiGlobResponse response =
                gathered.getResponse().orElseGet(MultiGlobResponse::empty);

            if (response.isEmpty() || (requireSuccessAll && !errors.isEmpty())) {
                return BackendResult.failed(mergeErrors(errors), stats);
            }

            return new BackendResult<>(Optional.of(response),
                stats.replace(Stats.TOTAL_METRICS_COUNT, response.totalMatches()),
                Errors.nonFatal(errors));
        }
    }

    @Override
    public BackendResult<InfoResponse> info(
        final QueryContext ctx, final MultiMetricsInfoRequest request
    ) {
        try (QueryContext infoCtx = ctx.withTimeout(timeouts.getFind())) {
            final List<Unit<InfoResponse>> units = children
                .stream()
                .map(child -> ScatterGather.unit(child.name(), c -> child.info(c, request)))
                .collect(Collectors.toList());

            final Gathered<InfoResponse> gathered = infos.run(infoCtx, units);
            final Stats stats = Stats
                .of(Stats.ZIPPER_REQUESTS, children.size())
                .merge(gathered.getStats());
            final List<Throwable> errors = gathered.getErrors();
            final InfoResponse response = gathered.getResponse().orElseGet(InfoResponse::empty);

            if (!errors.isEmpty() && (response.isEmpty() || requireSuccessAll)) {
                return BackendResult.failed(mergeErrors(errors), stats);
            }

            return new BackendResult<>(Optional.of(response), stats, Errors.nonFatal(errors));
        }
    }

    @Override
    public BackendResult<ListMetricsResponse> list(final QueryContext ctx) {
        return BackendResult.failed(new ZipperException(ErrorKind.NOT_IMPLEMENTED_YET));
    }

    @Override
    public BackendResult<MetricDetailsResponse> stats(final QueryContext ctx) {
        return BackendResult.failed(new ZipperException(ErrorKind.NOT_IMPLEMENTED_YET));
    }

    @Override
    public BackendResult<List<String>> tagNames(
        final QueryContext ctx, final String query, final int limit
    ) {
        return tagEverything(ctx, query, limit, true);
    }

    @Override
    public BackendResult<List<String>> tagValues(
        final QueryContext ctx, final String query, final int limit
    ) {
        return tagEverything(ctx, query, limit, false);
    }

    /**
     * Ask every child which top level segments it serves.
     * <p>
     * The root group records the answers in the routing cache. Probes never hold a limiter slot.
     */
    @Override
    public BackendResult<List<String>> probeTLDs(final QueryContext ctx) {
        try (QueryContext probeCtx = ctx.withTimeout(timeouts.getFind())) {
            final List<Unit<Map<String, List<BackendServer>>>> units = children
                .stream()
                .map(child -> ScatterGather.<Map<String, List<BackendServer>>>unlimited(
                    child.name(), c -> child.probeTLDs(c).map(tlds -> byTld(child, tlds))))
                .collect(Collectors.toList());

            final Gathered<Map<String, List<BackendServer>>> gathered = probes.run(probeCtx, units);
            final Map<String, List<BackendServer>> found =
                gathered.getResponse().orElseGet(Collections::emptyMap);
            final List<Throwable> errors = gathered.getErrors();

            if (!found.isEmpty()) {
                updateCache(found);
            }

            if (found.isEmpty() && !errors.isEmpty()) {
                return BackendResult.failed(mergeErrors(errors), gathered.getStats());
            }

            return new BackendResult<>(Optional.of(ImmutableList.copyOf(found.keySet())),
                gathered.getStats(), Errors.nonFatal(errors));
        }
    }

    private BackendResult<List<String>> tagEverything(
        final QueryContext ctx, final String query, final int limit, final boolean names
    ) {
        try (QueryContext tagCtx = ctx.withTimeout(timeouts.getFind())) {
            final List<Unit<List<String>>> units = children
                .stream()
                .map(child -> ScatterGather.unit(child.name(),
                    c -> names ? child.tagNames(c, query, limit) :
                        child.tagValues(c, query, limit)))
                .collect(Collectors.toList());

            final Gathered<List<String>> gathered = tags.run(tagCtx, units);
            List<String> result = gathered.getResponse().orElseGet(ImmutableList::of);

            if (limit != -1 && result.size() > limit) {
                final List<String> sorted = new ArrayList<>(result);
                Collections.sort(sorted);
                result = ImmutableList.copyOf(sorted.subList(0, limit));
            }

            log.debug("{}: got {} tags from {} of {} children", name, result.size(),
                gathered.getAnswered(), children.size());

            return new BackendResult<>(Optional.of(result), gathered.getStats(),
                Errors.nonFatal(gathered.getErrors()));
        }
    }

    private void updateCache(final Map<String, List<BackendServer>> found) {
        if (!cache.isPresent()) {
            return;
        }

        if (!root) {
            log.error("{}: routing cache can only be updated by the root group", name);
            return;
        }

        cache.get().putAll(found);
    }

    /**
     * Narrow the children to those the routing cache knows to serve the requested metrics.
     * Falls back to all children when the cache has nothing to say.
     */
    Filtered filterServersByTLD(final List<String> names) {
        if (!cache.isPresent()) {
            return new Filtered(children, Stats.empty());
        }

        final RoutingCache routing = cache.get();
        final Set<BackendServer> found = Sets.newIdentityHashSet();
        long hits = 0;
        long misses = 0;

        for (final String metric : names) {
            if (metric.startsWith("seriesByTag")) {
                return new Filtered(children, Stats.empty());
            }

            final Optional<List<BackendServer>> cached = routing.get(RoutingCache.tld(metric));

            if (cached.isPresent()) {
                hits++;
                found.addAll(cached.get());
            } else {
                misses++;
            }
        }

        final Stats stats = Stats.of(Stats.CACHE_HITS, hits, Stats.CACHE_MISSES, misses);
        final List<BackendServer> filtered =
            children.stream().filter(found::contains).collect(Collectors.toList());

        if (filtered.isEmpty()) {
            return new Filtered(children, stats);
        }

        return new Filtered(filtered, stats);
    }

    /**
     * Split a request into batches of at most the number of metrics the child accepts per
     * request, expanding globs into leaves with a find against the child.
     */
    Split splitRequest(
        final QueryContext ctx, final MultiFetchRequest request, final BackendServer child
    ) {
        final int max = child.maxMetricsPerRequest();

        if (max == 0) {
            return new Split(ImmutableList.of(request), Stats.empty(), ImmutableList.of());
        }

        final List<MultiFetchRequest> batches = new ArrayList<>();
        final List<Throwable> errors = new ArrayList<>();
        List<FetchRequest> current = new ArrayList<>();
        Stats stats = Stats.empty();

        for (final FetchRequest metric : request.getMetrics()) {
            if (current.size() >= max) {
                batches.add(new MultiFetchRequest(current));
                current = new ArrayList<>();
            }

            if (metric.isTagQuery()) {
                current.add(metric.withName(metric.getPathExpression()));
                continue;
            }

            if (!metric.isGlob()) {
                current.add(metric);
                continue;
            }

            final BackendResult<MultiGlobResponse> found =
                child.find(ctx, MultiGlobRequest.of(metric.getName()));
            stats = stats.merge(found.getStats());

            final Optional<MultiGlobResponse> response = found.getResponse();

            if (found.isFatal() || !response.isPresent() || response.get().isEmpty()) {
                final Throwable error = found.getErrors().first().orElseGet(
                    () -> new ZipperException(ErrorKind.NO_METRICS_FETCHED,
                        "no result fetched for " + metric.getName()));

                log.warn("{}: find request failed when resolving globs for {}: {}", name,
                    metric.getName(), error.getMessage());
                errors.add(error);

                if (!response.isPresent()) {
                    continue;
                }
            }

            for (final GlobResponse glob : response.get().getMetrics()) {
                for (final GlobMatch match : glob.getMatches()) {
                    if (!match.isLeaf()) {
                        continue;
                    }

                    current.add(metric.withName(match.getPath()));

                    if (current.size() >= max) {
                        batches.add(new MultiFetchRequest(current));
                        current = new ArrayList<>();
                    }
                }
            }
        }

        if (!current.isEmpty()) {
            batches.add(new MultiFetchRequest(current));
        }

        return new Split(batches, stats, errors);
    }

    /**
     * Split the request for one child, then send every batch as its own request. Each batch holds
     * a limiter slot of the child.
     */
    private BackendResult<MultiFetchResponse> fetchInBatches(
        final QueryContext ctx, final MultiFetchRequest request, final BackendServer child
    ) {
        final Split split = splitRequest(ctx, request, child);

        final List<Unit<MultiFetchResponse>> units = split
            .getBatches()
            .stream()
            .map(batch -> ScatterGather.unit(child.name(), c -> child.fetch(c, batch)))
            .collect(Collectors.toList());

        final Gathered<MultiFetchResponse> gathered = fetches.run(ctx, units);

        final List<Throwable> errors = new ArrayList<>(split.getErrors());
        errors.addAll(gathered.getErrors());

        return new BackendResult<>(gathered.getResponse(),
            split.getStats().merge(gathered.getStats()), Errors.nonFatal(errors));
    }

    private BackendResult<MultiFetchResponse> fetchSequentially(
        final QueryContext ctx, final MultiFetchRequest request, final BackendServer child
    ) {
        final Split split = splitRequest(ctx, request, child);

        BackendResult<MultiFetchResponse> result =
            new BackendResult<>(Optional.empty(), split.getStats(),
                Errors.nonFatal(split.getErrors()));

        for (final MultiFetchRequest batch : split.getBatches()) {
            result = result.merge(child.fetch(ctx, batch), MultiFetchResponse::merge);
        }

        return result;
    }

    /**
     * Turn the errors of all children into the single error of a failed group request.
     */
    private ZipperException mergeErrors(final List<Throwable> errors) {
        final HttpErrors.Merged merged = HttpErrors.mergeHttpErrors(errors);

        if (!merged.getMessages().isEmpty()) {
            log.debug("{}: errors while fetching data from backends, code {}: {}", name,
                merged.getCode(), merged.getMessages());

            return new ZipperException(ErrorKind.FAILED_TO_FETCH, merged.getCode(),
                name + ": " + String.join("\n", merged.getMessages()), Optional.empty(), errors);
        }

        return new ZipperException(ErrorKind.NOT_FOUND, HttpErrors.NOT_FOUND,
            name + ": " + ErrorKind.NOT_FOUND.getDescription(), Optional.empty(), errors);
    }

    private static Map<String, List<BackendServer>> byTld(
        final BackendServer child, final List<String> tlds
    ) {
        final Map<String, List<BackendServer>> result = new LinkedHashMap<>();

        for (final String tld : tlds) {
            result.put(tld, ImmutableList.of(child));
        }

        return result;
    }

    private static Map<String, List<BackendServer>> mergeProbes(
        final Map<String, List<BackendServer>> a, final Map<String, List<BackendServer>> b
    ) {
        final Map<String, List<BackendServer>> result = new LinkedHashMap<>(a);

        for (final Map.Entry<String, List<BackendServer>> e : b.entrySet()) {
            result.merge(e.getKey(), e.getValue(),
                (x, y) -> ImmutableList.<BackendServer>builder().addAll(x).addAll(y).build());
        }

        return result;
    }

    private static List<String> union(final List<String> a, final List<String> b) {
        final Set<String> result = new LinkedHashSet<>(a);
        result.addAll(b);
        return ImmutableList.copyOf(result);
    }

    @Data
    static class Filtered {
        private final List<BackendServer> servers;
        private final Stats stats;
    }

    @Data
    static class Split {
        private final List<MultiFetchRequest> batches;
        private final Stats stats;
        private final List<Throwable> errors;
    }

    public static Builder builder(final String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private List<BackendServer> children = ImmutableList.of();
        private int concurrencyLimit = 0;
        private Timeouts timeouts = Timeouts.defaults();
        private int maxMetricsPerRequest = 0;
        private boolean doMultipleRequestsIfSplit = false;
        private boolean requireSuccessAll = false;
        private Optional<RoutingCache> cache = Optional.empty();
        private boolean root = false;
        private AsyncFramework async;

        Builder(final String name) {
            this.name = name;
        }

        public Builder children(final List<? extends BackendServer> children) {
            this.children = ImmutableList.copyOf(children);
            return this;
        }

        /**
         * Max number of requests in flight per child, 0 for no limit.
         */
        public Builder concurrencyLimit(final int concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
            return this;
        }

        public Builder timeouts(final Timeouts timeouts) {
            this.timeouts = timeouts;
            return this;
        }

        public Builder maxMetricsPerRequest(final int maxMetricsPerRequest) {
            this.maxMetricsPerRequest = maxMetricsPerRequest;
            return this;
        }

        /**
         * Send each batch of a split fetch as its own request, instead of one child request
         * running all batches in turn.
         */
        public Builder doMultipleRequestsIfSplit(final boolean doMultipleRequestsIfSplit) {
            this.doMultipleRequestsIfSplit = doMultipleRequestsIfSplit;
            return this;
        }

        public Builder requireSuccessAll(final boolean requireSuccessAll) {
            this.requireSuccessAll = requireSuccessAll;
            return this;
        }

        public Builder cache(final RoutingCache cache) {
            this.cache = Optional.of(cache);
            return this;
        }

        /**
         * Mark this group as the root of the tree, the only group allowed to write the routing
         * cache.
         */
        public Builder root(final boolean root) {
            this.root = root;
            return this;
        }

        /**
         * Framework running the requests to the children. The group does not own it.
         */
        public Builder async(final AsyncFramework async) {
            this.async = async;
            return this;
        }

        public BroadcastGroup build() {
            if (children.isEmpty()) {
                throw new ZipperException(ErrorKind.NO_SERVERS_SPECIFIED,
                    name + ": " + ErrorKind.NO_SERVERS_SPECIFIED.getDescription());
            }

            Objects.requireNonNull(async, name + ": async framework is required");

            final ServerLimiter limiter;

            if (concurrencyLimit != 0) {
                limiter = new CoreServerLimiter(
                    children.stream().map(BackendServer::name).collect(Collectors.toList()),
                    concurrencyLimit);
            } else {
                limiter = NoopLimiter.get();
            }

            return new BroadcastGroup(name, children, limiter, timeouts, maxMetricsPerRequest,
                doMultipleRequestsIfSplit, requireSuccessAll, cache, root, async);
        }
    }
}
