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

import com.google.common.collect.ImmutableList;
import lombok.Data;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Translation between errors and transport status codes.
 * <p>
 * Merging is independent of the order errors arrived in. Not found is the weakest outcome and a
 * bad argument the strongest. Communication failures escalate to service unavailable, unless a
 * backend explicitly answered forbidden.
 */
public final class HttpErrors {
    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int INTERNAL_SERVER_ERROR = 500;
    public static final int BAD_GATEWAY = 502;
    public static final int SERVICE_UNAVAILABLE = 503;
    public static final int GATEWAY_TIMEOUT = 504;

    private static final Pattern HTML_TAGS = Pattern.compile("<[^>]*>");

    private HttpErrors() {
    }

    @Data
    public static class Merged {
        private final int code;
        private final List<String> messages;
    }

    /**
     * Status code of a single error.
     */
    public static int httpCode(final Throwable error) {
        if (error == null) {
            return OK;
        }

        if (error instanceof ZipperException) {
            return ((ZipperException) error).getHttpCode();
        }

        return INTERNAL_SERVER_ERROR;
    }

    /**
     * Derive one status code and the list of messages from many errors. Errors that only say
     * "not found" contribute neither.
     */
    public static Merged mergeHttpErrors(final List<? extends Throwable> errors) {
        int code = NOT_FOUND;
        final List<String> messages = new ArrayList<>();

        for (final Throwable error : errors) {
            int errorCode = httpCode(error);

            if (errorCode == NOT_FOUND) {
                continue;
            }

            if (errorCode == INTERNAL_SERVER_ERROR &&
                ZipperException.is(error, ErrorKind.INVALID_ARGUMENT)) {
                errorCode = BAD_REQUEST;
            }

            messages.add(message(error));
            code = recalcCode(code, errorCode);
        }

        return new Merged(code, ImmutableList.copyOf(messages));
    }

    static int recalcCode(final int code, final int newCode) {
        int next = newCode;

        if (next == GATEWAY_TIMEOUT || next == BAD_GATEWAY) {
            next = SERVICE_UNAVAILABLE;
        }

        if (code == 0 || code == NOT_FOUND) {
            return next;
        }

        if (next >= 400 && next < 500 && code >= 400 && code < 500) {
            if (next == BAD_REQUEST) {
                return next;
            }

            if (next == FORBIDDEN && code != BAD_REQUEST) {
                return next;
            }
        }

        return Math.min(code, next);
    }

    /**
     * Translate a status code answered by a backend into the taxonomy.
     */
    public static ZipperException errorByCode(final int code, final String body) {
        final String message = stripHtmlTags(body);

        if (code == FORBIDDEN) {
            if (message.isEmpty()) {
                return new ZipperException(ErrorKind.FORBIDDEN);
            }

            return new ZipperException(ErrorKind.FORBIDDEN, message);
        }

        final String text = message.isEmpty() ? "status " + code : message;

        if (code == SERVICE_UNAVAILABLE || code == BAD_GATEWAY || code == GATEWAY_TIMEOUT) {
            return new ZipperException(ErrorKind.FAILED_TO_FETCH, code, text, Optional.empty(),
                ImmutableList.of());
        }

        return new ZipperException(ErrorKind.FAILED, code, text, Optional.empty(),
            ImmutableList.of());
    }

    /**
     * Translate a transport failure talking to the given server.
     */
    public static ZipperException requestError(final Throwable error, final String server) {
        if (error instanceof ZipperException) {
            return ((ZipperException) error).withServer(server);
        }

        if (error instanceof InterruptedException || error instanceof InterruptedIOException) {
            return new ZipperException(ErrorKind.TIMEOUT_EXCEEDED, ErrorKind.TIMEOUT_EXCEEDED
                .getDefaultCode(), ErrorKind.TIMEOUT_EXCEEDED.getDescription(), Optional.of(server),
                ImmutableList.of(error));
        }

        if (error instanceof ConnectException || error instanceof NoRouteToHostException ||
            error instanceof UnknownHostException || error instanceof SocketException) {
            return new ZipperException(ErrorKind.BACKEND_ERROR,
                ErrorKind.BACKEND_ERROR.getDefaultCode(),
                ErrorKind.BACKEND_ERROR.getDescription() + ": " + error.getMessage(),
                Optional.of(server), ImmutableList.of(error));
        }

        final String message = error instanceof IOException ?
            ErrorKind.RESPONSE_ERROR.getDescription() + ": " + error.getMessage() :
            ErrorKind.RESPONSE_ERROR.getDescription();

        return new ZipperException(ErrorKind.RESPONSE_ERROR,
            ErrorKind.RESPONSE_ERROR.getDefaultCode(), message, Optional.of(server),
            ImmutableList.of(error));
    }

    static String message(final Throwable error) {
        final String message = error.getMessage();

        if (message == null) {
            return error.getClass().getSimpleName();
        }

        return message.replaceAll("\\n+$", "");
    }

    static String stripHtmlTags(final String body) {
        if (body == null) {
            return "";
        }

        return HTML_TAGS.matcher(body).replaceAll("").trim();
    }
}
