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

package com.spotify.zipper.metric;

import lombok.Data;

import java.util.Objects;

@Data
public class GlobMatch {
    private final String path;
    private final boolean leaf;

    public GlobMatch(final String path, final boolean leaf) {
        this.path = Objects.requireNonNull(path, "path");
        this.leaf = leaf;
    }

    public static GlobMatch leaf(final String path) {
        return new GlobMatch(path, true);
    }

    public static GlobMatch branch(final String path) {
        return new GlobMatch(path, false);
    }
}
