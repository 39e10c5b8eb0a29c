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

import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown when an operation could not be completed successfully, either because the chain of strategies was exhausted, because
 * a strategy asked to stop retrying, or because the failure isn't configured to be retried. The cause is the last failure of the
 * operation, if any.
 */
public class RetryExhaustedException extends RuntimeException {
    private final transient ExecutionRecord<?> executionRecord;

    public RetryExhaustedException(String message, @Nullable Throwable cause, ExecutionRecord<?> executionRecord) {
        super(message, cause);
        Objects.requireNonNull(executionRecord, ExecutionRecord.class.getSimpleName() + " cannot be null");
        this.executionRecord = executionRecord;
    }

    /**
     * @return The final state of the run that was exhausted
     */
    public ExecutionRecord<?> getExecutionRecord() {
        return executionRecord;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryExhaustedException.class.getSimpleName() + "[", "]")
                .add("message=" + getMessage())
                .add("cause=" + getCause())
                .add("executionRecord=" + executionRecord)
                .toString();
    }
}
