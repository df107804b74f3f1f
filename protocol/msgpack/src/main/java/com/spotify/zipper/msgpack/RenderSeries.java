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
import com.google.common.collect.ImmutableList;
import lombok.Data;

import java.util.List;
import java.util.Optional;

/**
 * A series as answered by graphite-web's render endpoint.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
class RenderSeries {
    private final String name;
    private final long start;
    private final long end;
    private final long step;
    private final List<Object> values;

    @JsonCreator
    RenderSeries(
        @JsonProperty("name") final String name, @JsonProperty("start") final long start,
        @JsonProperty("end") final long end, @JsonProperty("step") final long step,
        @JsonProperty("values") final Optional<List<Object>> values
    ) {
        this.name = name;
        this.start = start;
        this.end = end;
        this.step = step;
        this.values = values.orElseGet(ImmutableList::of);
    }

    /**
     * Values as doubles, anything that is not a number is absent.
     */
    double[] doubleValues() {
        final double[] result = new double[values.size()];

        for (int i = 0; i < result.length; i++) {
            final Object v = values.get(i);
            result[i] = v instanceof Number ? ((Number) v).doubleValue() : Double.NaN;
        }

        return result;
    }
}
