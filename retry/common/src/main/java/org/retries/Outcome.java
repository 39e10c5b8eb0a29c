/*
 *
 *  Copyright 2026 Johan Haleby
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.retries;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of a single invocation of the retried operation. It's either a {@link Success} carrying the value
 * returned by the operation (which may be {@code null}) or a {@link Failure} carrying the exception it threw.
 *
 * @param <T> The type of the value returned by the operation
 */
@NullMarked
public sealed interface Outcome<T> {

    static <T> Outcome<T> success(@Nullable T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(Throwable error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * @return The value of a {@link Success}, {@code null} for a {@link Failure} (a failure carries no value).
     */
    default @Nullable T getValueOrNull() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        return null;
    }

    /**
     * @return The error of a {@link Failure}, or an empty {@code Optional} for a {@link Success}.
     */
    default Optional<Throwable> getFailure() {
        if (this instanceof Failure<T> failure) {
            return Optional.of(failure.error());
        }
        return Optional.empty();
    }

    record Success<T>(@Nullable T value) implements Outcome<T> {
    }

    record Failure<T>(Throwable error) implements Outcome<T> {
        public Failure {
            Objects.requireNonNull(error, "Error cannot be null");
        }
    }
}
