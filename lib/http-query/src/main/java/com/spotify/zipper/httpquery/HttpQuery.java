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
import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.common.Stats;
import com.spotify.zipper.config.BackendSettings;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.Errors;
import com.spotify.zipper.errors.HttpErrors;
import com.spotify.zipper.errors.ZipperException;
import com.spotify.zipper.limiter.ServerLimiter;
import lombok.Data;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.ConnectionPool;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends one logical request to a set of equivalent servers.
 * <p>
 * Servers are picked round-robin. A failed attempt is retried against the next server, until
 * {@code max(maxTries, #servers)} attempts were made or the context is done. Every attempt holds a
 * limiter slot for its server while in flight.
 */
@Slf4j
@ToString(of = {"group", "servers", "maxTries"})
public class HttpQuery {
    public static final String REQUEST_ID_HEADER = "X-Zipper-Request-Id";

    private final String group;
    private final List<String> servers;
    private final int maxTries;
    private final ServerLimiter limiter;
    private final OkHttpClient client;
    private final String accept;

    private final AtomicLong counter = new AtomicLong();

    public HttpQuery(
        final String group, final List<String> servers, final int maxTries,
        final ServerLimiter limiter, final OkHttpClient client, final String accept
    ) {
        if (servers.isEmpty()) {
            throw new ZipperException(ErrorKind.NO_SERVERS_SPECIFIED,
                group + ": " + ErrorKind.NO_SERVERS_SPECIFIED.getDescription());
        }

        this.group = group;
        this.servers = ImmutableList.copyOf(servers);
        this.maxTries = maxTries;
        this.limiter = limiter;
        this.client = client;
        this.accept = accept;
    }

    /**
     * Build a client configured with the connection settings of a group.
     */
    public static OkHttpClient client(final BackendSettings settings) {
        return new OkHttpClient.Builder()
            .connectTimeout(settings.getTimeouts().getConnect().toMilliseconds(),
                TimeUnit.MILLISECONDS)
            .connectionPool(new ConnectionPool(settings.getMaxIdleConnsPerHost(),
                settings.getKeepAliveInterval().toMilliseconds(), TimeUnit.MILLISECONDS))
            .retryOnConnectionFailure(false)
            .build();
    }

    public List<String> servers() {
        return servers;
    }

    /**
     * A response from one server, with status below 500.
     */
    @Data
    public static class ServerResponse {
        private final String server;
        private final int code;
        private final byte[] body;

        public boolean isSuccessful() {
            return code >= 200 && code < 300;
        }
    }

    /**
     * Outcome of a query. Errors of attempts that were followed by a successful one are dropped.
     */
    @Data
    public static class Reply {
        private final Optional<ServerResponse> response;
        private final Errors errors;
        private final Stats stats;
    }

    /**
     * Query the given path on one of the servers.
     *
     * @param path path and query string, relative to the server address.
     */
    public Reply doQuery(final QueryContext ctx, final String path) {
        final int tries = Math.max(maxTries, servers.size());
        final List<Throwable> errors = new ArrayList<>();
        Stats stats = Stats.empty();

        for (int attempt = 0; attempt < tries; attempt++) {
            final String server = pickServer();

            try {
                final ServerResponse response = doRequest(ctx, server, path);
                stats = stats.merge(Stats.server(server)).merge(
                    Stats.of(Stats.MEMORY_USAGE, response.getBody().length));
                return new Reply(Optional.of(response), Errors.none(), stats);
            } catch (final ZipperException e) {
                log.debug("{}: request to {} failed: {}", group, server, e.getMessage());
                errors.add(e);
                stats = stats
                    .merge(Stats.of(Stats.TRANSPORT_ERRORS, 1))
                    .merge(Stats.failedServer(server));

                if (ctx.isDone()) {
                    return new Reply(Optional.empty(), new Errors(errors, true), stats);
                }

                if (e.is(ErrorKind.FORBIDDEN)) {
                    return new Reply(Optional.empty(), new Errors(errors, true), stats);
                }
            }
        }

        errors.add(new ZipperException(ErrorKind.MAX_TRIES_EXCEEDED,
            group + ": " + ErrorKind.MAX_TRIES_EXCEEDED.getDescription()));
        return new Reply(Optional.empty(), new Errors(errors, true), stats);
    }

    String pickServer() {
        if (servers.size() == 1) {
            return servers.get(0);
        }

        final long next = counter.getAndIncrement() & Long.MAX_VALUE;
        return servers.get((int) (next % servers.size()));
    }

    private ServerResponse doRequest(
        final QueryContext ctx, final String server, final String path
    ) {
        final HttpUrl url = HttpUrl.parse(server + path);

        if (url == null) {
            throw new ZipperException(ErrorKind.INVALID_ARGUMENT, "invalid url: " + server + path)
                .withServer(server);
        }

        final Request request = new Request.Builder()
            .url(url)
            .header("Accept", accept)
            .header(REQUEST_ID_HEADER, ctx.getRequestId())
            .get()
            .build();

        log.debug("{}: waiting for slot on {}", group, server);
        limiter.enter(ctx, server);

        try {
            final Call call = client.newCall(request);

            if (ctx.hasDeadline()) {
                call.timeout().timeout(ctx.remaining(TimeUnit.NANOSECONDS), TimeUnit.NANOSECONDS);
            }

            ctx.onCancel(call::cancel);

            try (final Response response = call.execute()) {
                final ResponseBody body = response.body();
                final byte[] bytes = body == null ? new byte[0] : body.bytes();

                if (response.code() >= HttpErrors.INTERNAL_SERVER_ERROR ||
                    response.code() == HttpErrors.FORBIDDEN) {
                    log.info("{}: status not ok from {}: {}", group, server, response.code());
                    throw HttpErrors
                        .errorByCode(response.code(), new String(bytes, StandardCharsets.UTF_8))
                        .prepend(group)
                        .withServer(server);
                }

                log.debug("{}: got response from {} ({} bytes)", group, server, bytes.length);
                return new ServerResponse(server, response.code(), bytes);
            }
        } catch (final IOException e) {
            if (ctx.isDone()) {
                throw ctx.error().withServer(server).withCause(e);
            }

            log.error("{}: error fetching result from {}", group, server, e);
            throw HttpErrors.requestError(e, server);
        } finally {
            limiter.leave(server);
        }
    }
}
