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

import org.retries.strategy.Strategies;

/**
 * A stateful retry policy. Each time an attempt fails the orchestrator applies the currently active strategy to the
 * outcome, and the strategy decides whether (and after how long) the operation should be invoked again.
 * <p>
 * Strategies keep an internal attempt counter that is mutated in place and never reset, so a {@code Strategy} instance
 * belongs to a single run at a time and is <i>not</i> thread-safe. The counters can still be inspected once the run has
 * finished.
 * </p>
 *
 * @see Strategies
 */
public interface Strategy {

    /**
     * Apply the strategy to the outcome of the latest attempt.
     * <p>
     * If the strategy is already {@link #isExhausted() exhausted} it returns {@link StrategyDecision.Exhausted}, carrying
     * the failure of the outcome (if any), and nothing else happens. Otherwise the attempt counter is incremented
     * <i>before</i> the decision (and its pacing delay) is computed.
     * </p>
     *
     * @param outcome The outcome of the latest attempt
     * @return The decision
     */
    StrategyDecision apply(Outcome<?> outcome);

    /**
     * @return {@code true} if the strategy has no more retries to offer, {@code false} otherwise.
     */
    boolean isExhausted();

    /**
     * @return The number of times the strategy has been applied without being exhausted.
     */
    int getAttemptsTaken();

    MaxAttempts getMaxAttempts();
}
