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
import org.retries.Arguments;
import org.retries.ExecutionRecord;
import org.retries.Outcome;
import org.retries.RetryConfig;
import org.retries.RetryExhaustedException;
import org.retries.StrategyDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The attempt state machine shared by the blocking and the reactive orchestrator. The orchestrator owns the loop, invokes the operation and
 * performs the delays while this class decides what happens after each attempt. Never use this class directly from your own code!
 */
@NullMarked
public class RetryExecution<T> {
    private static final Logger log = LoggerFactory.getLogger(RetryExecution.class);

    private final RetryConfig<T> config;
    private final DefaultExecutionRecord<T> record;
    private final StrategyChain chain;

    private RetryExecution(RetryConfig<T> config, DefaultExecutionRecord<T> record, StrategyChain chain) {
        this.config = config;
        this.record = record;
        this.chain = chain;
    }

    public static <T> RetryExecution<T> start(RetryConfig<T> config, Object operation, Arguments arguments) {
        Objects.requireNonNull(config, RetryConfig.class.getSimpleName() + " cannot be null");
        DefaultExecutionRecord<T> record = new DefaultExecutionRecord<>(operation, arguments, config.clock.instant());
        StrategyChain chain = new StrategyChain(config.strategies.get(), config.logAttempts);
        if (config.logAttempts) {
            log.info("Calling '{}'", operation);
        }
        return new RetryExecution<>(config, record, chain);
    }

    public ExecutionRecord<T> record() {
        return record;
    }

    /**
     * Clears the outcome of the previous attempt and runs the before hooks. Hook failures propagate to the caller.
     */
    public void beforeAttempt() {
        record.clearOutcome();
        config.beforeHooks.forEach(Runnable::run);
    }

    /**
     * Captures the outcome of an attempt, runs the failure and after hooks and decides how the run proceeds.
     */
    public Resolution<T> afterAttempt(Outcome<T> outcome) {
        Objects.requireNonNull(outcome, Outcome.class.getSimpleName() + " cannot be null");
        record.capture(outcome);
        outcome.getFailure().ifPresent(config.onFailure);
        config.afterHooks.forEach(hook -> hook.accept(outcome));

        if (outcome instanceof Outcome.Success<T> success) {
            finish();
            return new Resolution.Succeeded<>(success.value());
        }

        Throwable failure = ((Outcome.Failure<T>) outcome).error();
        if (!config.isRetryable(failure)) {
            finish();
            log.debug("'{}' failed with {} which is not eligible for retry", record.getOperation(), failure.getClass().getName());
            return new Resolution.Exhausted<>(new RetryExhaustedException("'" + record.getOperation() + "' failed with " + failure.getClass().getName()
                    + " which is not eligible for retry", failure, record));
        }

        StrategyDecision decision = chain.evaluate(record, outcome);
        if (decision instanceof StrategyDecision.Continue next) {
            return new Resolution.RetryAfter<>(next.delay());
        }

        finish();
        String reason = decision instanceof StrategyDecision.Stop ? "retries were stopped" : "retries were exhausted";
        log.debug("Giving up on '{}', {} after {} attempt(s)", record.getOperation(), reason, record.getInvocationCount());
        return new Resolution.Exhausted<>(new RetryExhaustedException("Giving up on '" + record.getOperation() + "', " + reason + " after "
                + record.getInvocationCount() + " attempt(s)", failure, record));
    }

    /**
     * Ends the run without a resolution, for example when the orchestrator is interrupted while an attempt or a delay is in progress.
     */
    public void abort() {
        finish();
    }

    private void finish() {
        record.finish(config.clock.instant());
    }
}
