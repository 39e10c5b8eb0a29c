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
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter. The delay before retry {@code k} (1 for the first retry) is
 * <pre>
 * baseDelay * 2^k + jitter
 * </pre>
 * where {@code jitter} is a number of seconds drawn from {@code [0, 1)} for every retry. The jitter spreads retries of
 * concurrent callers so that they don't hit the same resource at the same time. Delays are computed from {@code k} alone,
 * they're not accumulated.
 */
public class ExponentialDelayStrategy extends CountingStrategy {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;
    private static final DoubleSupplier UNIFORM_JITTER = () -> ThreadLocalRandom.current().nextDouble();

    private final Duration baseDelay;
    private final DoubleSupplier jitter;
    private Duration lastDelay = Duration.ZERO;

    public ExponentialDelayStrategy(int maxAttempts, Duration baseDelay) {
        this(maxAttempts, baseDelay, UNIFORM_JITTER);
    }

    /**
     * @param maxAttempts The number of retries before the strategy is exhausted
     * @param baseDelay   The base delay
     * @param jitter      Supplies the jitter, in seconds, added to each delay
     */
    public ExponentialDelayStrategy(int maxAttempts, Duration baseDelay, DoubleSupplier jitter) {
        this(maxAttempts, baseDelay, jitter, true);
    }

    public ExponentialDelayStrategy(int maxAttempts, Duration baseDelay, DoubleSupplier jitter, boolean logging) {
        super(maxAttempts, logging);
        Objects.requireNonNull(baseDelay, "Base delay cannot be null");
        Objects.requireNonNull(jitter, "Jitter cannot be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("Base delay cannot be negative");
        }
        this.baseDelay = baseDelay;
        this.jitter = jitter;
    }

    @Override
    protected Duration delayForAttempt(int attempt) {
        double baseDelaySeconds = baseDelay.toNanos() / NANOS_PER_SECOND;
        double delaySeconds = baseDelaySeconds * Math.pow(2, attempt) + jitter.getAsDouble();
        lastDelay = Duration.ofNanos(Math.round(Math.max(0, delaySeconds) * NANOS_PER_SECOND));
        return lastDelay;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    /**
     * @return The delay computed by the latest application, {@link Duration#ZERO} if the strategy hasn't been applied.
     */
    public Duration getLastDelay() {
        return lastDelay;
    }

    @Override
    public String toString() {
        return toStringJoiner().add("baseDelay=" + baseDelay).add("lastDelay=" + lastDelay).toString();
    }
}
