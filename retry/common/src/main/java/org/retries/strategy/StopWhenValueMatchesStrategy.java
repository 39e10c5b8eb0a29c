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

package org.retries.strategy;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.retries.MaxAttempts;
import org.retries.Outcome;
import org.retries.Strategy;
import org.retries.StrategyDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Keeps retrying until the outcome of an attempt carries the {@code expected} value. A failed attempt carries no value, i.e. {@code null}.
 * <p>
 * Without a max attempts limit the strategy never exhausts by itself and its counter is never advanced, so it should be combined with another
 * bounding strategy (or an expected value that is eventually observed).
 * </p>
 */
@NullMarked
public class StopWhenValueMatchesStrategy implements Strategy {
    private static final Logger log = LoggerFactory.getLogger(StopWhenValueMatchesStrategy.class);

    private final @Nullable Object expected;
    private final MaxAttempts maxAttempts;
    private final boolean logging;
    private int attemptsTaken;

    public StopWhenValueMatchesStrategy(@Nullable Object expected) {
        this(expected, MaxAttempts.infinite());
    }

    public StopWhenValueMatchesStrategy(@Nullable Object expected, int maxAttempts) {
        this(expected, MaxAttempts.limit(maxAttempts));
    }

    public StopWhenValueMatchesStrategy(@Nullable Object expected, MaxAttempts maxAttempts) {
        this(expected, maxAttempts, true);
    }

    public StopWhenValueMatchesStrategy(@Nullable Object expected, MaxAttempts maxAttempts, boolean logging) {
        Objects.requireNonNull(maxAttempts, MaxAttempts.class.getSimpleName() + " cannot be null");
        this.expected = expected;
        this.maxAttempts = maxAttempts;
        this.logging = logging;
    }

    @Override
    public StrategyDecision apply(Outcome<?> outcome) {
        if (isExhausted()) {
            return StrategyDecision.exhausted(outcome.getFailure().orElse(null));
        }

        if (maxAttempts instanceof MaxAttempts.Limit) {
            if (logging) {
                log.info("{} is at {}/{}.", StopWhenValueMatchesStrategy.class.getSimpleName(), attemptsTaken, maxAttempts);
            }
            attemptsTaken++;
        }

        if (Objects.equals(outcome.getValueOrNull(), expected)) {
            return StrategyDecision.stop();
        }
        return StrategyDecision.continueAfter(Duration.ZERO);
    }

    @Override
    public boolean isExhausted() {
        return maxAttempts.isReachedBy(attemptsTaken);
    }

    @Override
    public int getAttemptsTaken() {
        return attemptsTaken;
    }

    @Override
    public MaxAttempts getMaxAttempts() {
        return maxAttempts;
    }

    public @Nullable Object getExpected() {
        return expected;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", StopWhenValueMatchesStrategy.class.getSimpleName() + "[", "]")
                .add("expected=" + expected)
                .add("maxAttempts=" + maxAttempts)
                .add("attemptsTaken=" + attemptsTaken)
                .toString();
    }
}
