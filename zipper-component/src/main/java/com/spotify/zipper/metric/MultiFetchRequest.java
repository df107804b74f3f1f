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

import com.google.common.collect.ImmutableList;
import lombok.Data;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Data
public class MultiFetchRequest {
    private final List<FetchRequest> metrics;

    public MultiFetchRequest(final List<FetchRequest> metrics) {
        this.metrics = ImmutableList.copyOf(Objects.requireNonNull(metrics, "metrics"));
    }

    public static MultiFetchRequest of(final FetchRequest... metrics) {
        return new MultiFetchRequest(ImmutableList.copyOf(metrics));
    }

    public List<String> names() {
        return metrics.stream().map(FetchRequest::getName).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return metrics.isEmpty();
    }

    public int size() {
        return metrics.size();
    }
}
