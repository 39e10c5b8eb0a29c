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

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Contains the state of a single orchestration run. A run is started for every call to an orchestrator's {@code execute} method.
 * <p>
 * The final record of a run is handed back to the caller, either from {@code executeForRecord} when the run succeeds or
 * from {@link RetryExhaustedException#getExecutionRecord()} when it doesn't. It's never attached to the operation itself.
 * </p>
 *
 * @param <T> The type of the value returned by the operation
 */
@NullMarked
public interface ExecutionRecord<T> {

    /**
     * @return The operation that is retried
     */
    Object getOperation();

    /**
     * @return The arguments forwarded to the operation on every attempt
     */
    Arguments getArguments();

    /**
     * @return When the run was started
     */
    Instant getStartTime();

    /**
     * @return When the run reached its terminal state (success or exhaustion), or an empty {@code Optional} if it's still running.
     */
    Optional<Instant> getEndTime();

    /**
     * @return The number of times a strategy has been applied, <i>not</i> the number of times the operation was invoked.
     * @see #getInvocationCount()
     */
    int getAttemptCount();

    /**
     * @return The number of times the operation has been invoked.
     */
    int getInvocationCount();

    /**
     * @return The value returned by the latest attempt, empty if the attempt failed, returned {@code null} or hasn't completed yet.
     */
    Optional<T> getLastValue();

    /**
     * @return The failure of the latest attempt, empty if the attempt succeeded or hasn't completed yet.
     */
    Optional<Throwable> getLastFailure();

    /**
     * @return The strategy that currently governs retries, or an empty {@code Optional} if the next strategy must be pulled from the chain.
     */
    Optional<Strategy> getActiveStrategy();

    default boolean hasFailed() {
        return getLastFailure().isPresent();
    }

    default boolean isFinished() {
        return getEndTime().isPresent();
    }

    /**
     * @return How long the run took, or an empty {@code Optional} if it's still running.
     */
    default Optional<Duration> getDuration() {
        return getEndTime().map(endTime -> Duration.between(getStartTime(), endTime));
    }
}
