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

package org.retries.internal;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.retries.Outcome;
import org.retries.Strategy;
import org.retries.StrategyDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Consults the strategies of a run one at a time, in the order they were supplied. A strategy stays active until it's exhausted, then the next
 * one is pulled from the head of the chain. Never use this class directly from your own code!
 */
@NullMarked
public class StrategyChain {
    private static final Logger log = LoggerFactory.getLogger(StrategyChain.class);

    private final Deque<Strategy> remaining;
    private final boolean logAttempts;

    public StrategyChain(List<? extends Strategy> strategies, boolean logAttempts) {
        Objects.requireNonNull(strategies, "Strategies cannot be null");
        this.remaining = new ArrayDeque<>(strategies);
        this.logAttempts = logAttempts;
    }

    /**
     * Apply the active strategy, or the next one in the chain, to the outcome of the latest attempt.
     *
     * @return {@link StrategyDecision.Continue} if the operation should be invoked again, {@link StrategyDecision.Stop} if the active strategy
     * asked to stop and {@link StrategyDecision.Exhausted} if the whole chain is exhausted.
     */
    public StrategyDecision evaluate(DefaultExecutionRecord<?> record, Outcome<?> outcome) {
        @Nullable Throwable cause = outcome.getFailure().orElse(null);
        while (true) {
            Strategy strategy = record.getActiveStrategy().orElse(null);
            if (strategy == null) {
                strategy = remaining.pollFirst();
                if (strategy == null) {
                    return StrategyDecision.exhausted(cause);
                }
                record.activate(strategy);
            }

            if (logAttempts) {
                log.info("Executing '{}' retry strategy. Current attempt {}", strategy.getClass().getSimpleName(), record.getAttemptCount());
            }

            StrategyDecision decision = strategy.apply(outcome);
            if (decision instanceof StrategyDecision.Exhausted) {
                log.debug("{} was already exhausted, pulling the next strategy", strategy);
                record.deactivate();
                continue;
            }

            record.incrementAttemptCount();
            if (strategy.isExhausted()) {
                record.deactivate();
            }
            return decision;
        }
    }

    /**
     * @return The number of strategies that haven't been pulled yet
     */
    public int remaining() {
        return remaining.size();
    }
}
