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

/**
 * Thrown when an operation cannot be invoked by the orchestrator it was handed to, for example an operation returning a
 * {@link java.util.concurrent.CompletionStage} given to the blocking orchestrator. This is a programming error and is never retried.
 */
public class IllegalRetryUsageException extends IllegalStateException {

    public IllegalRetryUsageException(String message) {
        super(message);
    }
}
