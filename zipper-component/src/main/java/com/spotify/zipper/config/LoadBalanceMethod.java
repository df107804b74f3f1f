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

package com.spotify.zipper.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a group spreads requests over its servers.
 */
public enum LoadBalanceMethod {
    /**
     * One client over all servers, each request goes to the next server in turn.
     */
    ROUND_ROBIN("roundrobin"),
    /**
     * One client per server, every request goes to all of them.
     */
    BROADCAST("broadcast");

    private final String value;

    LoadBalanceMethod(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static LoadBalanceMethod parse(final String input) {
        switch (input.toLowerCase()) {
            case "":
            case "rr":
            case "roundrobin":
                return ROUND_ROBIN;
            case "all":
            case "broadcast":
                return BROADCAST;
            default:
                throw new IllegalArgumentException("Unknown load balance method: " + input);
        }
    }
}
