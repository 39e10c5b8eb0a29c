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

package org.retries.blocking;

import org.retries.ExecutionRecord;

import java.util.Objects;

/**
 * Thrown when the thread running a blocking retry is interrupted, while the operation is invoked or while waiting for the next attempt.
 * The interrupt flag of the thread is restored before this exception is thrown. Interruption is never retried.
 */
public class RetryInterruptedException extends RuntimeException {
    private final transient ExecutionRecord<?> executionRecord;

    public RetryInterruptedException(String message, InterruptedException cause, ExecutionRecord<?> executionRecord) {
        super(message, cause);
        Objects.requireNonNull(executionRecord, ExecutionRecord.class.getSimpleName() + " cannot be null");
        this.executionRecord = executionRecord;
    }

    /**
     * @return The state of the run when it was interrupted, the run is finished at the time of the interruption
     */
    public ExecutionRecord<?> getExecutionRecord() {
        return executionRecord;
    }
}
