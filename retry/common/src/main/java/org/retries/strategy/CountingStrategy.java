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
import org.retries.MaxAttempts;
import org.retries.Outcome;
import org.retries.Strategy;
import org.retries.StrategyDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.StringJoiner;

/**
 * Base class for strategies that are exhausted after a fixed number of applications and pace each retry with a (possibly zero) delay.
 */
@NullMarked
public abstract class CountingStrategy implements Strategy {
    private static final Logger log = LoggerFactory.getLogger(CountingStrategy.class);

    private final MaxAttempts maxAttempts;
    private final boolean logging;
    private int attemptsTaken;

    protected CountingStrategy(int maxAttempts, boolean logging) {
        this.maxAttempts = MaxAttempts.limit(maxAttempts);
        this.logging = logging;
    }

    @Override
    public final StrategyDecision apply(Outcome<?> outcome) {
        if (isExhausted()) {
            return StrategyDecision.exhausted(outcome.getFailure().orElse(null));
        }

        attemptsTaken++;
        Duration delay = delayForAttempt(attemptsTaken);
        if (logging) {
            if (delay.isZero()) {
                log.info("{} {}/{} attempts.", getClass().getSimpleName(), attemptsTaken, maxAttempts);
            } else {
                log.info("{} {}/{} attempts. Sleeping for {}", getClass().getSimpleName(), attemptsTaken, maxAttempts, delay);
            }
        }
        return StrategyDecision.continueAfter(delay);
    }

    /**
     * @param attempt The attempt that is being applied, {@code 1} for the first application.
     * @return How long to wait before the operation is invoked again
     */
    protected abstract Duration delayForAttempt(int attempt);

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

    /**
     * @return {@code true} if every application of the strategy is logged at {@code INFO}
     */
    public boolean isLogging() {
        return logging;
    }

    protected StringJoiner toStringJoiner() {
        return new StringJoiner(", ", getClass().getSimpleName() + "[", "]")
                .add("maxAttempts=" + maxAttempts)
                .add("attemptsTaken=" + attemptsTaken)
                .add("logging=" + logging);
    }

    @Override
    public String toString() {
        return toStringJoiner().toString();
    }
}
