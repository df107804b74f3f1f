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
import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * An error in the shared taxonomy.
 * <p>
 * Carries the status code it maps to at the transport boundary, the server it originated from (if
 * known) and any number of causes, which are preserved for logging.
 */
public class ZipperException extends RuntimeException {
    @Getter
    private final ErrorKind kind;
    @Getter
    private final int httpCode;
    @Getter
    private final Optional<String> server;
    @Getter
    private final List<Throwable> causes;

    public ZipperException(final ErrorKind kind) {
        this(kind, kind.getDescription());
    }

    public ZipperException(final ErrorKind kind, final String message) {
        this(kind, kind.getDefaultCode(), message, Optional.empty(), ImmutableList.of());
    }

    public ZipperException(
        final ErrorKind kind, final int httpCode, final String message,
        final Optional<String> server, final List<Throwable> causes
    ) {
        super(message, causes.isEmpty() ? null : causes.get(0));
        this.kind = kind;
        this.httpCode = httpCode;
        this.server = server;
        this.causes = ImmutableList.copyOf(causes);
    }

    public ZipperException withHttpCode(final int code) {
        return new ZipperException(kind, code, getMessage(), server, causes);
    }

    public ZipperException withMessage(final String message) {
        return new ZipperException(kind, httpCode, message, server, causes);
    }

    public ZipperException withServer(final String server) {
        return new ZipperException(kind, httpCode, getMessage(), Optional.of(server), causes);
    }

    public ZipperException withCause(final Throwable cause) {
        return new ZipperException(kind, httpCode, getMessage(), server,
            ImmutableList.<Throwable>builder().addAll(causes).add(cause).build());
    }

    public ZipperException withCauses(final List<? extends Throwable> more) {
        return new ZipperException(kind, httpCode, getMessage(), server,
            ImmutableList.<Throwable>builder().addAll(causes).addAll(more).build());
    }

    /**
     * Prepend context to the message, keeping kind and code.
     */
    public ZipperException prepend(final String prefix) {
        return withMessage(prefix + ": " + getMessage());
    }

    /**
     * Check if this error, or any of its causes, is of the given kind.
     */
    public boolean is(final ErrorKind other) {
        if (kind == other) {
            return true;
        }

        for (final Throwable cause : causes) {
            if (cause instanceof ZipperException && ((ZipperException) cause).is(other)) {
                return true;
            }
        }

        return false;
    }

    public static boolean is(final Throwable error, final ErrorKind kind) {
        return error instanceof ZipperException && ((ZipperException) error).is(kind);
    }

    @Override
    public String toString() {
        return "ZipperException(kind=" + kind + ", code=" + httpCode + ", message=" + getMessage() +
            server.map(s -> ", server=" + s).orElse("") + ")";
    }
}
