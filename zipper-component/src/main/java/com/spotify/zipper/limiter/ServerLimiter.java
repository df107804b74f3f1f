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

package com.spotify.zipper.limiter;

import com.spotify.zipper.common.QueryContext;
import com.spotify.zipper.errors.ZipperException;

/**
 * Bounds the number of requests in flight per backend name.
 */
public interface ServerLimiter {
    /**
     * Acquire a slot for the given name, waiting until one is free.
     *
     * @throws ZipperException if the context is done before a slot could be acquired, in which case
     * no slot is held.
     */
    void enter(QueryContext ctx, String name);

    /**
     * Release a slot previously acquired with {@link #enter(QueryContext, String)}.
     */
    void leave(String name);

    /**
     * Number of slots per name.
     */
    int capacity();
}
