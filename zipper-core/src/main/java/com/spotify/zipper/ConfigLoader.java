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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.spotify.zipper.config.ZipperConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ZipperConfig} from YAML or JSON.
 */
public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static ObjectMapper config() {
        return configure(new ObjectMapper(new YAMLFactory()));
    }

    public static ObjectMapper json() {
        return configure(new ObjectMapper());
    }

    /**
     * Load configuration from a file, picking the format from its extension. Anything but
     * {@code .json} is read as YAML.
     */
    public static ZipperConfig load(final Path path) throws IOException {
        final ObjectMapper mapper =
            path.getFileName().toString().endsWith(".json") ? json() : config();

        try (final InputStream in = Files.newInputStream(path)) {
            return mapper.readValue(in, ZipperConfig.class);
        }
    }

    public static ZipperConfig load(final InputStream in) throws IOException {
        return config().readValue(in, ZipperConfig.class);
    }

    private static ObjectMapper configure(final ObjectMapper mapper) {
        mapper.registerModule(new Jdk8Module());
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
