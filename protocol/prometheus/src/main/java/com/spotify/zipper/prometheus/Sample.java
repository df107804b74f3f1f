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

package com.spotify.zipper.prometheus;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.Data;

import java.util.List;

/**
 * One point of a range vector, encoded as {@code [timestamp, "value"]}.
 */
@Data
public class Sample {
    private final double timestamp;
    private final double value;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Sample fromPair(final List<Object> pair) {
        if (pair.size() != 2) {
            throw new IllegalArgumentException(
                "length mismatch, got " + pair.size() + ", expected 2");
        }

        if (!(pair.get(0) instanceof Number)) {
            throw new IllegalArgumentException("timestamp is not a number: " + pair.get(0));
        }

        if (!(pair.get(1) instanceof String)) {
            throw new IllegalArgumentException("value is not a string: " + pair.get(1));
        }

        return new Sample(((Number) pair.get(0)).doubleValue(), parseValue((String) pair.get(1)));
    }

    static double parseValue(final String value) {
        switch (value) {
            case "NaN":
                return Double.NaN;
            case "+Inf":
                return Double.POSITIVE_INFINITY;
            case "-Inf":
                return Double.NEGATIVE_INFINITY;
            default:
                return Double.parseDouble(value);
        }
    }
}
