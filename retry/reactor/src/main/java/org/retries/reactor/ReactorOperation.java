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

package org.retries.reactor;

import org.jspecify.annotations.NullMarked;
import org.retries.Arguments;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * An operation whose attempts are represented by a {@link Mono}. Every attempt invokes the operation again and subscribes to the {@code Mono} it returns,
 * so the returned {@code Mono} should be cold.
 *
 * @param <T> The type of the value emitted by the operation
 */
@NullMarked
@FunctionalInterface
public interface ReactorOperation<T> {

    /**
     * @param arguments The arguments of the run, the same for every attempt
     * @return A {@code Mono} that performs the attempt when subscribed to, never {@code null}
     */
    Mono<T> invoke(Arguments arguments);

    /**
     * Create an operation that ignores the arguments of the run.
     */
    static <T> ReactorOperation<T> from(Supplier<Mono<T>> supplier) {
        requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
        return named(supplier.toString(), __ -> supplier.get());
    }

    static <T> ReactorOperation<T> named(String name, ReactorOperation<T> operation) {
        requireNonNull(name, "Name cannot be null");
        requireNonNull(operation, ReactorOperation.class.getSimpleName() + " cannot be null");
        return new ReactorOperation<>() {
            @Override
            public Mono<T> invoke(Arguments arguments) {
                return operation.invoke(arguments);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
