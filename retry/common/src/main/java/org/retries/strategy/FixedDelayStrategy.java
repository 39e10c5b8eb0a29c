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
import java.util.Objects;

/**
 * Waits for a fixed delay before each retry, {@code maxAttempts} times.
 */
public class FixedDelayStrategy extends CountingStrategy {
    private final Duration delay;

    public FixedDelayStrategy(Duration delay) {
        this(delay, 1);
    }

    public FixedDelayStrategy(Duration delay, int maxAttempts) {
        this(delay, maxAttempts, true);
    }

    public FixedDelayStrategy(Duration delay, int maxAttempts, boolean logging) {
        super(maxAttempts, logging);
        Objects.requireNonNull(delay, "Delay cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Delay cannot be negative");
        }
        this.delay = delay;
    }

    @Override
    protected Duration delayForAttempt(int attempt) {
        return delay;
    }

    public Duration getDelay() {
        return delay;
    }

    @Override
    public String toString() {
        return toStringJoiner().add("delay=" + delay).toString();
    }
}
