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
import com.spotify.zipper.metric.MetricInfo;
import com.spotify.zipper.metric.Retention;
import lombok.Data;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
class InfoMessage {
    private final String name;
    private final String aggregationMethod;
    private final double xFilesFactor;
    private final long maxRetention;
    private final List<RetentionMessage> retentions;

    @JsonCreator
    InfoMessage(
        @JsonProperty("name") final String name,
        @JsonProperty("aggregationMethod") final Optional<String> aggregationMethod,
        @JsonProperty("xFilesFactor") final Optional<Double> xFilesFactor,
        @JsonProperty("maxRetention") final Optional<Long> maxRetention,
        @JsonProperty("retentions") final Optional<List<RetentionMessage>> retentions
    ) {
        this.name = name;
        this.aggregationMethod = aggregationMethod
            .filter(m -> !m.isEmpty())
            .orElse(MetricInfo.DEFAULT_CONSOLIDATION);
        this.xFilesFactor = xFilesFactor.orElse(0.0);
        this.maxRetention = maxRetention.orElse(0L);
        this.retentions = retentions.orElseGet(ImmutableList::of);
    }

    MetricInfo toMetricInfo(final String query) {
        return new MetricInfo(name == null ? query : name, aggregationMethod, xFilesFactor,
            maxRetention, retentions
            .stream()
            .map(r -> new Retention(r.getSecondsPerPoint(), r.getNumberOfPoints()))
            .collect(Collectors.toList()));
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RetentionMessage {
        private final long secondsPerPoint;
        private final long numberOfPoints;

        @JsonCreator
        RetentionMessage(
            @JsonProperty("secondsPerPoint") final long secondsPerPoint,
            @JsonProperty("numberOfPoints") final long numberOfPoints
        ) {
            this.secondsPerPoint = secondsPerPoint;
            this.numberOfPoints = numberOfPoints;
        }
    }
}
