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

import com.spotify.zipper.backend.BackendServer;
import com.spotify.zipper.config.BackendSettings;
import com.spotify.zipper.limiter.ServerLimiter;

/**
 * Builds a client speaking one wire protocol.
 */
@FunctionalInterface
public interface ProtocolFactory {
    /**
     * Build a client for the servers of the given settings.
     *
     * @param settings resolved settings of the group or single server
     * @param limiter limiter with one slot set per server address
     */
    BackendServer build(BackendSettings settings, ServerLimiter limiter);
}
