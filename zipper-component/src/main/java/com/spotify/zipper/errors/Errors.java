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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An ordered list of errors, and whether they leave the result without usable data.
 */
@Data
public final class Errors {
    private static final Errors NONE = new Errors(ImmutableList.of(), false);

    private final List<Throwable> errors;
    private final boolean fatal;

    public Errors(final List<Throwable> errors, final boolean fatal) {
        this.errors = ImmutableList.copyOf(Objects.requireNonNull(errors, "errors"));
        this.fatal = fatal;
    }

    public static Errors none() {
        return NONE;
    }

    public static Errors fatal(final Throwable error) {
        return new Errors(ImmutableList.of(error), true);
    }

    public static Errors nonFatal(final Throwable error) {
        return new Errors(ImmutableList.of(error), false);
    }

    public static Errors nonFatal(final List<? extends Throwable> errors) {
        return new Errors(ImmutableList.copyOf(errors), false);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public Errors add(final Throwable error) {
        return new Errors(ImmutableList.<Throwable>builder().addAll(errors).add(error).build(),
            fatal);
    }

    /**
     * Append the errors of another result. Fatality is OR:ed.
     */
    public Errors merge(final Errors other) {
        if (other.errors.isEmpty() && !other.fatal) {
            return this;
        }

        return new Errors(
            ImmutableList.<Throwable>builder().addAll(errors).addAll(other.errors).build(),
            fatal || other.fatal);
    }

    public Errors asFatal() {
        return new Errors(errors, true);
    }

    public Errors asNonFatal() {
        return new Errors(errors, false);
    }

    public boolean contains(final ErrorKind kind) {
        return errors.stream().anyMatch(e -> ZipperException.is(e, kind));
    }

    public Optional<Throwable> first() {
        return errors.stream().findFirst();
    }
}
