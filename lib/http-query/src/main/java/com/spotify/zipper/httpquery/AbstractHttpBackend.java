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

package com.spotify.zipper.httpquery;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.spotify.zipper.backend.BackendResult;
import com.spotify.zipper.backend.BackendServer;
import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.common.Stats;
import com.spotify.zipper.config.BackendSettings;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.Errors;
import com.spotify.zipper.errors.HttpErrors;
import com.spotify.zipper.errors.ZipperException;
import com.spotify.zipper.limiter.ServerLimiter;
import com.spotify.zipper.metric.GlobMatch;
import com.spotify.zipper.metric.GlobResponse;
import com.spotify.zipper.metric.ListMetricsResponse;
import com.spotify.zipper.metric.MetricDetailsResponse;
import com.spotify.zipper.metric.MultiGlobRequest;
import com.spotify.zipper.metric.MultiGlobResponse;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * Base of clients talking to a set of equivalent servers over HTTP.
 * <p>
 * Each operation is made up of one or more requests. Partial failures are kept as non-fatal
 * errors next to the data of the requests that succeeded, an operation where every request failed
 * is fatal.
 */
@Slf4j
public abstract class AbstractHttpBackend implements BackendServer {
    private static final HttpUrl BASE = HttpUrl.get("http://127.0.0.1/");

    protected final BackendSettings settings;
    protected final HttpQuery query;

    protected AbstractHttpBackend(
        final BackendSettings settings, final ServerLimiter limiter, final String accept
    ) {
        if (settings.getConcurrencyLimit() <= 0) {
            throw new ZipperException(ErrorKind.CONCURRENCY_LIMIT_NOT_SET,
                settings.getGroupName() + ": " +
                    ErrorKind.CONCURRENCY_LIMIT_NOT_SET.getDescription());
        }

        this.settings = settings;
        this.query = new HttpQuery(settings.getGroupName(), settings.getServers(),
            settings.getMaxTries(), limiter, HttpQuery.client(settings), accept);
    }

    @FunctionalInterface
    protected interface Decoder<T> {
        T decode(byte[] body) throws IOException;
    }

    @Override
    public String name() {
        return settings.getGroupName();
    }

    @Override
    public List<String> backends() {
        return settings.getServers();
    }

    @Override
    public int maxMetricsPerRequest() {
        return settings.getMaxBatchSize();
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
    public BackendResult<List<String>> probeTLDs(final QueryContext ctx) {
        final BackendResult<MultiGlobResponse> found = find(ctx, MultiGlobRequest.of("*"));

        return found.map(response -> {
            final List<String> tlds = new ArrayList<>();

            for (final GlobResponse r : response.getMetrics()) {
                for (final GlobMatch m : r.getMatches()) {
                    tlds.add(m.getPath());
                }
            }

            log.debug("{}: probed top-level domains: {}", name(), tlds);
            return tlds;
        });
    }

    /**
     * Send one request and decode its response.
     * <p>
     * A response with a status outside of 2xx is an error, {@code 404} being translated to
     * {@link ErrorKind#NOT_FOUND}.
     */
    protected <T> BackendResult<T> request(
        final QueryContext ctx, final RequestClass type, final String uri,
        final Decoder<T> decoder
    ) {
        final HttpQuery.Reply reply = query.doQuery(ctx, uri);
        final Stats stats = type.requested().merge(reply.getStats());

        if (!reply.getResponse().isPresent()) {
            final boolean timeout = reply.getErrors().contains(ErrorKind.TIMEOUT_EXCEEDED);
            return new BackendResult<>(Optional.empty(), stats.merge(type.failed(timeout)),
                reply.getErrors().asFatal());
        }

        final HttpQuery.ServerResponse response = reply.getResponse().get();

        if (!response.isSuccessful()) {
            final ZipperException error = statusError(response);
            log.debug("{}: {} answered {}: {}", name(), response.getServer(), response.getCode(),
                error.getMessage());
            return new BackendResult<>(Optional.empty(), stats.merge(type.failed(false)),
                Errors.fatal(error));
        }

        try {
            return BackendResult.ok(decoder.decode(response.getBody()), stats);
        } catch (final ZipperException e) {
            log.debug("{}: {} answered with an error: {}", name(), response.getServer(),
                e.getMessage());
            return new BackendResult<>(Optional.empty(), stats.merge(type.failed(false)),
                Errors.fatal(e.withServer(response.getServer())));
        } catch (final IOException | RuntimeException e) {
            log.error("{}: failed to decode response from {}", name(), response.getServer(), e);
            final ZipperException error = new ZipperException(ErrorKind.UNMARSHAL_FAILED,
                ErrorKind.UNMARSHAL_FAILED.getDefaultCode(),
                ErrorKind.UNMARSHAL_FAILED.getDescription() + ": " + e.getMessage(),
                Optional.of(response.getServer()), ImmutableList.of(e));
            return new BackendResult<>(Optional.empty(), stats.merge(type.failed(false)),
                Errors.fatal(error));
        }
    }

    /**
     * Combine the results of all requests making up one operation.
     */
    protected <T> BackendResult<T> combine(
        final List<BackendResult<T>> parts, final T empty, final BinaryOperator<T> merger
    ) {
        BackendResult<T> result = BackendResult.ok(empty, Stats.empty());
        boolean anySuccess = parts.isEmpty();

        for (final BackendResult<T> part : parts) {
            anySuccess |= part.getResponse().isPresent();
            result = result.merge(part, merger);
        }

        if (result.getErrors().isEmpty()) {
            return result;
        }

        log.error("{}: errors occurred while getting results: {}", name(),
            result.getErrors().getErrors());

        final Stats stats = result.getStats().merge(Stats.failedServer(name()));

        if (anySuccess) {
            return new BackendResult<>(result.getResponse(), stats,
                result.getErrors().asNonFatal());
        }

        return new BackendResult<>(Optional.empty(), stats, result.getErrors().asFatal());
    }

    /**
     * Build the path and query of a request.
     */
    protected static String uri(final String path, final ListMultimap<String, String> params) {
        final HttpUrl.Builder url = BASE.newBuilder().encodedPath(path);

        for (final Map.Entry<String, String> e : params.entries()) {
            url.addQueryParameter(e.getKey(), e.getValue());
        }

        final HttpUrl built = url.build();

        if (built.encodedQuery() == null) {
            return built.encodedPath();
        }

        return built.encodedPath() + "?" + built.encodedQuery();
    }

    /**
     * Parse a raw query string, as passed through for tag queries.
     */
    protected static HttpUrl parseQuery(final String rawQuery) {
        return BASE.newBuilder().encodedQuery(rawQuery.isEmpty() ? null : rawQuery).build();
    }

    /**
     * Translate a response with a status outside of 2xx.
     */
    protected ZipperException statusError(final HttpQuery.ServerResponse response) {
        final String body = new String(response.getBody(), StandardCharsets.UTF_8);

        if (response.getCode() == HttpErrors.NOT_FOUND) {
            return new ZipperException(ErrorKind.NOT_FOUND).withServer(response.getServer());
        }

        return HttpErrors.errorByCode(response.getCode(), body).withServer(response.getServer());
    }
}
