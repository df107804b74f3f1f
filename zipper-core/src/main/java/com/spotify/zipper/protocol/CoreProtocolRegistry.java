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

package com.spotify.zipper.protocol;

import com.google.common.collect.ImmutableSortedSet;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Registry of protocols, populated by {@link ZipperModule}s at startup.
 */
@Slf4j
public class CoreProtocolRegistry implements ProtocolRegistry {
    private final Map<String, ProtocolFactory> factories = new HashMap<>();

    private final Object lock = new Object();

    @Override
    public void register(
        final ProtocolFactory factory, final String name, final String... aliases
    ) {
        synchronized (lock) {
            put(name, factory);

            for (final String alias : aliases) {
                put(alias, factory);
            }
        }
    }

    @Override
    public Optional<ProtocolFactory> lookup(final String name) {
        synchronized (lock) {
            return Optional.ofNullable(factories.get(name));
        }
    }

    /**
     * Look up a protocol which is required to exist.
     *
     * @throws IllegalArgumentException if no such protocol is registered.
     */
    public ProtocolFactory require(final String name) {
        return lookup(name).orElseThrow(() -> new IllegalArgumentException(
            "Unknown protocol '" + name + "', registered protocols are: " + names()));
    }

    @Override
    public Set<String> names() {
        synchronized (lock) {
            return ImmutableSortedSet.copyOf(factories.keySet());
        }
    }

    public CoreProtocolRegistry load(final ZipperModule module) {
        log.debug("Loading module {}", module.getClass().getCanonicalName());
        module.setup(this);
        return this;
    }

    /**
     * Load every module registered as a service on the class path.
     */
    public CoreProtocolRegistry loadAll() {
        for (final ZipperModule module : ServiceLoader.load(ZipperModule.class)) {
            load(module);
        }

        return this;
    }

    private void put(final String name, final ProtocolFactory factory) {
        if (factories.containsKey(name)) {
            throw new IllegalArgumentException(
                "A protocol with the same name (" + name + ") is already registered");
        }

        factories.put(name, factory);
    }
}
