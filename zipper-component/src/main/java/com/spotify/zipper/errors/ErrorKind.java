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

package com.spotify.zipper.errors;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum ErrorKind {
    TIMEOUT_EXCEEDED(504, "timeout while fetching response"),
    BACKEND_ERROR(503, "error fetching data from backend"),
    FORBIDDEN(403, "forbidden"),
    NO_METRICS_FETCHED(404, "no metrics in the response"),
    NOT_FOUND(404, "metric not found"),
    NO_RESPONSE_FETCHED(404, "no responses fetched from upstream"),
    FAILED_TO_FETCH(500, "failed to fetch data from server/group"),
    FAILED(500, "failed due to error"),
    NON_FATAL_ERRORS(200, "response contains non-fatal errors"),
    MAX_TRIES_EXCEEDED(503, "max tries exceeded"),
    NOT_IMPLEMENTED_YET(501, "this feature is not implemented yet"),
    NOT_SUPPORTED_BY_BACKEND(501, "this feature is not supported by backend"),
    RESPONSE_START_TIME_MISMATCH(500, "response start time mismatch"),
    UNMARSHAL_FAILED(502, "unmarshal failed"),
    RESPONSE_ERROR(500, "error while fetching response"),
    INVALID_ARGUMENT(400, "invalid argument"),
    CONCURRENCY_LIMIT_NOT_SET(500, "concurrency limit is not set"),
    NO_SERVERS_SPECIFIED(500, "no servers specified"),
    CANCELLED(503, "request cancelled");

    /**
     * Status code used when no explicit code is attached to the error.
     */
    @Getter
    private final int defaultCode;

    @Getter
    private final String description;
}
