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

import java.time.Duration;

/**
 * Stops retrying after {@code maxAttempts} attempts. Counts exactly like {@link NoOpStrategy} but is meant to be placed last in a chain, as a guard
 * that bounds the total number of retries.
 */
public class StopAfterAttemptStrategy extends CountingStrategy {

    public StopAfterAttemptStrategy(int maxAttempts) {
        this(maxAttempts, true);
    }

    public StopAfterAttemptStrategy(int maxAttempts, boolean logging) {
        super(maxAttempts, logging);
    }

    @Override
    protected Duration delayForAttempt(int attempt) {
        return Duration.ZERO;
    }
}
