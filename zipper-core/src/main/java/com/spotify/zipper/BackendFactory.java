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
import com.spotify.zipper.backend.BackendServer;
import com.spotify.zipper.broadcast.BroadcastGroup;
import com.spotify.zipper.cache.RoutingCache;
import com.spotify.zipper.config.BackendConfig;
import com.spotify.zipper.config.BackendSettings;
import com.spotify.zipper.config.ZipperConfig;
import com.spotify.zipper.limiter.CoreServerLimiter;
import com.spotify.zipper.limiter.NoopLimiter;
import com.spotify.zipper.limiter.ServerLimiter;
import com.spotify.zipper.protocol.CoreProtocolRegistry;
import com.spotify.zipper.protocol.ProtocolFactory;
import eu.toolchain.async.AsyncFramework;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the tree of backends described by the configuration.
 */
@Slf4j
@RequiredArgsConstructor
public class BackendFactory {
    private final CoreProtocolRegistry registry;
    private final ZipperConfig config;
    private final AsyncFramework async;

    /**
     * Build the backend of one configured group.
     * <p>
     * With {@code roundrobin}, one client is built for all servers of the group. With {@code
     * broadcast}, one client is built per server and they are wrapped in a group named after the
     * configured group.
     */
    public BackendServer build(final BackendConfig backend) {
        final BackendSettings settings = backend.resolve(config);
        final ProtocolFactory factory = registry.require(settings.getProtocol());

        log.info("{}: building {} backend for {} ({})", settings.getGroupName(),
            settings.getProtocol(), settings.getServers(), settings.getLbMethod().value());

        switch (settings.getLbMethod()) {
            case ROUND_ROBIN:
                return factory.build(settings, limiter(settings.getServers(), settings));
            case BROADCAST:
                final List<BackendServer> clients = new ArrayList<>();

                for (final String server : settings.getServers()) {
                    clients.add(factory.build(settings.forServer(server),
                        limiter(ImmutableList.of(server), settings)));
                }

                return BroadcastGroup
                    .builder(settings.getGroupName())
                    .children(clients)
                    .concurrencyLimit(settings.getConcurrencyLimit())
                    .timeouts(settings.getTimeouts())
                    .maxMetricsPerRequest(settings.getMaxBatchSize())
                    .doMultipleRequestsIfSplit(settings.isDoMultipleRequestsIfSplit())
                    .requireSuccessAll(config.isRequireSuccessAll())
                    .async(async)
                    .build();
            default:
                throw new IllegalArgumentException(
                    "Unsupported load balance method: " + settings.getLbMethod());
        }
    }

    /**
     * Build a group over all given backends.
     *
     * @param root if the group is the root of the tree, which owns the routing cache.
     */
    public BroadcastGroup group(
        final String name, final List<BackendConfig> backends, final boolean root
    ) {
        final List<BackendServer> children = new ArrayList<>();

        for (final BackendConfig backend : backends) {
            children.add(build(backend));
        }

        final BroadcastGroup.Builder builder = BroadcastGroup
            .builder(name)
            .children(children)
            .concurrencyLimit(config.getConcurrencyLimit())
            .timeouts(config.getTimeouts())
            .maxMetricsPerRequest(config.getMaxBatchSize())
            .doMultipleRequestsIfSplit(config.isDoMultipleRequestsIfSplit())
            .requireSuccessAll(config.isRequireSuccessAll())
            .root(root)
            .async(async);

        routingCache(root).ifPresent(builder::cache);
        return builder.build();
    }

    private Optional<RoutingCache> routingCache(final boolean root) {
        if (!root || config.isTldCacheDisabled()) {
            return Optional.empty();
        }

        return Optional.of(new RoutingCache(config.getExpireDelay()));
    }

    private static ServerLimiter limiter(
        final List<String> servers, final BackendSettings settings
    ) {
        if (settings.getConcurrencyLimit() == 0) {
            return NoopLimiter.get();
        }

        return new CoreServerLimiter(servers, settings.getConcurrencyLimit());
    }
}
