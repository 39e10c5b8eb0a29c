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
import org.retries.Arguments;
import org.retries.ExecutionRecord;
import org.retries.Outcome;
import org.retries.Strategy;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Mutable {@link ExecutionRecord} owned by exactly one run. Never use this class directly from your own code!
 */
@NullMarked
public class DefaultExecutionRecord<T> implements ExecutionRecord<T> {
    private final Object operation;
    private final Arguments arguments;
    private final Instant startTime;

    private @Nullable Instant endTime;
    private int attemptCount;
    private int invocationCount;
    private @Nullable T lastValue;
    private @Nullable Throwable lastFailure;
    private @Nullable Strategy activeStrategy;

    public DefaultExecutionRecord(Object operation, Arguments arguments, Instant startTime) {
        Objects.requireNonNull(operation, "Operation cannot be null");
        Objects.requireNonNull(arguments, Arguments.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(startTime, "Start time cannot be null");
        this.operation = operation;
        this.arguments = arguments;
        this.startTime = startTime;
    }

    void clearOutcome() {
        lastValue = null;
        lastFailure = null;
    }

    void capture(Outcome<T> outcome) {
        invocationCount++;
        lastValue = outcome.getValueOrNull();
        lastFailure = outcome.getFailure().orElse(null);
    }

    void incrementAttemptCount() {
        attemptCount++;
    }

    void activate(Strategy strategy) {
        if (activeStrategy != null) {
            throw new IllegalStateException("Cannot activate " + strategy + " since " + activeStrategy + " is still active");
        }
        activeStrategy = strategy;
    }

    void deactivate() {
        activeStrategy = null;
    }

    void finish(Instant endTime) {
        Objects.requireNonNull(endTime, "End time cannot be null");
        if (this.endTime != null) {
            throw new IllegalStateException("Execution already finished at " + this.endTime);
        }
        this.endTime = endTime;
    }

    @Override
    public Object getOperation() {
        return operation;
    }

    @Override
    public Arguments getArguments() {
        return arguments;
    }

    @Override
    public Instant getStartTime() {
        return startTime;
    }

    @Override
    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    @Override
    public int getAttemptCount() {
        return attemptCount;
    }

    @Override
    public int getInvocationCount() {
        return invocationCount;
    }

    @Override
    public Optional<T> getLastValue() {
        return Optional.ofNullable(lastValue);
    }

    @Override
    public Optional<Throwable> getLastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    @Override
    public Optional<Strategy> getActiveStrategy() {
        return Optional.ofNullable(activeStrategy);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ExecutionRecord.class.getSimpleName() + "[", "]")
                .add("operation=" + operation)
                .add("startTime=" + startTime)
                .add("endTime=" + endTime)
                .add("attemptCount=" + attemptCount)
                .add("invocationCount=" + invocationCount)
                .add("lastFailure=" + lastFailure)
                .add("lastValue=" + lastValue)
                .toString();
    }
}
