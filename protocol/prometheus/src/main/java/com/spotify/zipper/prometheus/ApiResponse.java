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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.spotify.zipper.errors.ErrorKind;
import com.spotify.zipper.errors.HttpErrors;
import com.spotify.zipper.errors.ZipperException;
import lombok.Data;

import java.util.Optional;

/**
 * Envelope of all Prometheus HTTP API responses.
 *
 * @param <T> type of the data
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiResponse<T> {
    public static final String SUCCESS = "success";
    public static final String BAD_DATA = "bad_data";

    private final String status;
    private final Optional<String> errorType;
    private final Optional<String> error;
    private final Optional<T> data;

    @JsonCreator
    public ApiResponse(
        @JsonProperty("status") final String status,
        @JsonProperty("errorType") final Optional<String> errorType,
        @JsonProperty("error") final Optional<String> error,
        @JsonProperty("data") final Optional<T> data
    ) {
        this.status = status;
        this.errorType = errorType;
        this.error = error;
        this.data = data;
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    /**
     * Data of a successful response.
     *
     * @throws ZipperException if the response reports an error.
     */
    public T getOrThrow() {
        if (!isSuccess()) {
            throw toError();
        }

        return data.orElseThrow(() -> new ZipperException(ErrorKind.UNMARSHAL_FAILED,
            "response has no data"));
    }

    public ZipperException toError() {
        final String message = error.orElse(status);

        if (errorType.filter(BAD_DATA::equals).isPresent()) {
            return new ZipperException(ErrorKind.INVALID_ARGUMENT, message);
        }

        return new ZipperException(ErrorKind.FAILED, HttpErrors.INTERNAL_SERVER_ERROR,
            errorType.map(t -> t + ": " + message).orElse(message), Optional.empty(),
            ImmutableList.of());
    }
}
