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

package org.retries.blocking;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.retries.Arguments;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * An operation that is invoked on the calling thread and either returns a value or throws.
 *
 * @param <T> The type of the value returned by the operation
 */
@NullMarked
@FunctionalInterface
public interface BlockingOperation<T> {

    /**
     * @param arguments The arguments of the run, the same for every attempt
     * @return The value of the operation
     * @throws Exception If the attempt failed
     */
    @Nullable T invoke(Arguments arguments) throws Exception;

    /**
     * Create an operation that ignores the arguments of the run.
     */
    static <T> BlockingOperation<T> from(Callable<T> callable) {
        Objects.requireNonNull(callable, Callable.class.getSimpleName() + " cannot be null");
        return named(callable.toString(), __ -> callable.call());
    }

    /**
     * Give {@code operation} a name that is used when the run is logged and in {@link org.retries.ExecutionRecord#toString()}.
     */
    static <T> BlockingOperation<T> named(String name, BlockingOperation<T> operation) {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(operation, BlockingOperation.class.getSimpleName() + " cannot be null");
        return new BlockingOperation<>() {
            @Override
            public @Nullable T invoke(Arguments arguments) throws Exception {
                return operation.invoke(arguments);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
