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

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Static factory methods for the built-in strategies, e.g.
 * <pre>
 * RetryConfig.withStrategies(fixedDelay(Duration.ofMillis(200), 3), exponentialBackoff(5, Duration.ofMillis(100)));
 * </pre>
 * Every call returns a new strategy instance. Strategies are stateful so don't share an instance between runs that may execute concurrently.
 */
@NullMarked
public final class Strategies {

    private Strategies() {
    }

    /**
     * Retry once, immediately.
     */
    public static NoOpStrategy noOp() {
        return new NoOpStrategy();
    }

    /**
     * Retry {@code maxAttempts} times, immediately.
     */
    public static NoOpStrategy noOp(int maxAttempts) {
        return new NoOpStrategy(maxAttempts);
    }

    public static FixedDelayStrategy fixedDelay(Duration delay) {
        return new FixedDelayStrategy(delay);
    }

    public static FixedDelayStrategy fixedDelay(Duration delay, int maxAttempts) {
        return new FixedDelayStrategy(delay, maxAttempts);
    }

    public static ExponentialDelayStrategy exponentialBackoff(int maxAttempts, Duration baseDelay) {
        return new ExponentialDelayStrategy(maxAttempts, baseDelay);
    }

    /**
     * Exponential backoff where the jitter (in seconds) is taken from the supplied {@code jitter} instead of being drawn uniformly from {@code [0, 1)}.
     */
    public static ExponentialDelayStrategy exponentialBackoff(int maxAttempts, Duration baseDelay, DoubleSupplier jitter) {
        return new ExponentialDelayStrategy(maxAttempts, baseDelay, jitter);
    }

    public static StopAfterAttemptStrategy stopAfterAttempt(int maxAttempts) {
        return new StopAfterAttemptStrategy(maxAttempts);
    }

    public static StopWhenValueMatchesStrategy stopWhenValueMatches(@Nullable Object expected) {
        return new StopWhenValueMatchesStrategy(expected);
    }

    public static StopWhenValueMatchesStrategy stopWhenValueMatches(@Nullable Object expected, int maxAttempts) {
        return new StopWhenValueMatchesStrategy(expected, maxAttempts);
    }
}
