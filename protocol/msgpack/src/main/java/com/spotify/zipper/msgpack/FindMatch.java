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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Optional;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
class FindMatch {
    private final String path;
    private final boolean leaf;

    /**
     * Accepts both spellings of the leaf flag used by graphite-web versions.
     */
    @JsonCreator
    FindMatch(
        @JsonProperty("path") final String path,
        @JsonProperty("isLeaf") final Optional<Boolean> isLeaf,
        @JsonProperty("is_leaf") final Optional<Boolean> snakeIsLeaf
    ) {
        this.path = path;
        this.leaf = isLeaf.orElseGet(() -> snakeIsLeaf.orElse(false));
    }
}
