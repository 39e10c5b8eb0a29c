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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * The result of applying a {@link Strategy} (or a whole chain of strategies) to the outcome of an attempt.
 */
@NullMarked
public sealed interface StrategyDecision {

    static StrategyDecision continueAfter(Duration delay) {
        return new Continue(delay);
    }

    static StrategyDecision stop() {
        return Stop.INSTANCE;
    }

    static StrategyDecision exhausted(@Nullable Throwable cause) {
        return new Exhausted(cause);
    }

    /**
     * Retry again once {@code delay} has passed. The delay is {@link Duration#ZERO} for strategies that don't pace.
     */
    record Continue(Duration delay) implements StrategyDecision {
        public Continue {
            Objects.requireNonNull(delay, "Delay cannot be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("Delay cannot be negative");
            }
        }
    }

    /**
     * The strategy asks the orchestrator to stop retrying, for example because the outcome matched an expected value.
     */
    record Stop() implements StrategyDecision {
        private static final Stop INSTANCE = new Stop();
    }

    /**
     * The strategy was already exhausted when it was applied. {@code cause} is the failure of the outcome it was applied to, if any.
     */
    record Exhausted(@Nullable Throwable cause) implements StrategyDecision {

        public Optional<Throwable> getCause() {
            return Optional.ofNullable(cause);
        }
    }
}
