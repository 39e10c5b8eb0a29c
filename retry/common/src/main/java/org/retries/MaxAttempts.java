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

/**
 * The number of times a {@link Strategy} may be applied before it's exhausted.
 */
@NullMarked
public sealed interface MaxAttempts {

    static MaxAttempts limit(int limit) {
        return new Limit(limit);
    }

    static MaxAttempts infinite() {
        return Infinite.INSTANCE;
    }

    /**
     * @param attemptsTaken The number of attempts taken so far
     * @return {@code true} if {@code attemptsTaken} has reached the limit, {@code false} otherwise (always {@code false} for {@link Infinite}).
     */
    default boolean isReachedBy(int attemptsTaken) {
        if (this instanceof Limit limit) {
            return attemptsTaken >= limit.limit();
        }
        return false;
    }

    /**
     * A limit of {@code 0} is allowed, such a strategy is exhausted before it's ever applied.
     */
    record Limit(int limit) implements MaxAttempts {
        public Limit {
            if (limit < 0) {
                throw new IllegalArgumentException("Max attempts cannot be negative");
            }
        }

        @Override
        public String toString() {
            return String.valueOf(limit);
        }
    }

    record Infinite() implements MaxAttempts {
        private static final Infinite INSTANCE = new Infinite();

        @Override
        public String toString() {
            return "infinite";
        }
    }
}
