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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.reactivestreams.Publisher;
import org.retries.Arguments;
import org.retries.ExecutionRecord;
import org.retries.IllegalRetryUsageException;
import org.retries.Outcome;
import org.retries.RetryConfig;
import org.retries.RetryExhaustedException;
import org.retries.internal.Resolution;
import org.retries.internal.RetryExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;

/**
 * Retries an operation on the calling thread. The thread is occupied for the whole run, including the delays between attempts.
 * <p>
 * Example:
 * <pre>
 * BlockingRetry&lt;String&gt; retry = new BlockingRetry&lt;&gt;(new RetryConfig.Builder&lt;String&gt;()
 *         .strategies(() -&gt; List.of(Strategies.fixedDelay(Duration.ofMillis(200), 3)))
 *         .retryOn(IOException.class)
 *         .build());
 *
 * String body = retry.execute(() -&gt; client.fetch(uri));
 * </pre>
 * An instance is immutable and can be shared between threads as long as its config creates fresh strategies for every run.
 *
 * @param <T> The type of the value returned by the operation
 */
@NullMarked
public class BlockingRetry<T> {
    private static final Logger log = LoggerFactory.getLogger(BlockingRetry.class);

    private final RetryConfig<T> config;
    private final Sleeper sleeper;

    public BlockingRetry(RetryConfig<T> config) {
        this(config, Sleeper.threadSleep());
    }

    public BlockingRetry(RetryConfig<T> config, Sleeper sleeper) {
        Objects.requireNonNull(config, RetryConfig.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(sleeper, Sleeper.class.getSimpleName() + " cannot be null");
        this.config = config;
        this.sleeper = sleeper;
    }

    /**
     * Invoke {@code callable} until it succeeds or retries are exhausted.
     *
     * @return The value returned by the first successful attempt
     * @throws RetryExhaustedException     If no attempt succeeded
     * @throws RetryInterruptedException   If the thread was interrupted
     * @throws IllegalRetryUsageException If the callable returns an asynchronous value
     */
    public @Nullable T execute(Callable<T> callable) {
        return execute(BlockingOperation.from(callable), Arguments.none());
    }

    /**
     * Invoke {@code operation} with {@code arguments} until it succeeds or retries are exhausted.
     *
     * @return The value returned by the first successful attempt
     * @throws RetryExhaustedException     If no attempt succeeded
     * @throws RetryInterruptedException   If the thread was interrupted
     * @throws IllegalRetryUsageException If the operation returns an asynchronous value
     */
    public @Nullable T execute(BlockingOperation<T> operation, Arguments arguments) {
        return run(operation, arguments).getLastValue().orElse(null);
    }

    /**
     * Same as {@link #execute(BlockingOperation, Arguments)} but returns the record of the successful run instead of its value.
     * The record of an exhausted run is available from {@link RetryExhaustedException#getExecutionRecord()}.
     */
    public ExecutionRecord<T> executeForRecord(BlockingOperation<T> operation, Arguments arguments) {
        return run(operation, arguments);
    }

    public RetryConfig<T> getConfig() {
        return config;
    }

    private ExecutionRecord<T> run(BlockingOperation<T> operation, Arguments arguments) {
        Objects.requireNonNull(operation, BlockingOperation.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(arguments, Arguments.class.getSimpleName() + " cannot be null");
        RetryExecution<T> execution = RetryExecution.start(config, operation, arguments);
        for (; ; ) {
            execution.beforeAttempt();
            Outcome<T> outcome = invoke(operation, arguments, execution);
            Resolution<T> resolution = execution.afterAttempt(outcome);
            if (resolution instanceof Resolution.RetryAfter<T> retryAfter) {
                pause(retryAfter.delay(), execution);
            } else if (resolution instanceof Resolution.Exhausted<T> exhausted) {
                throw exhausted.exception();
            } else {
                return execution.record();
            }
        }
    }

    private Outcome<T> invoke(BlockingOperation<T> operation, Arguments arguments, RetryExecution<T> execution) {
        final T value;
        try {
            value = operation.invoke(arguments);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            execution.abort();
            throw new RetryInterruptedException("'" + operation + "' was interrupted", e, execution.record());
        } catch (Exception e) {
            log.debug("'{}' failed with {}", operation, e.toString());
            return Outcome.failure(e);
        }
        rejectAsynchronousValue(operation, value);
        return Outcome.success(value);
    }

    private void pause(Duration delay, RetryExecution<T> execution) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            execution.abort();
            throw new RetryInterruptedException("Interrupted while waiting " + delay + " to retry '" + execution.record().getOperation() + "'", e, execution.record());
        }
    }

    private static void rejectAsynchronousValue(BlockingOperation<?> operation, @Nullable Object value) {
        if (value instanceof CompletionStage || value instanceof Future || value instanceof Publisher) {
            throw new IllegalRetryUsageException("'" + operation + "' returned an asynchronous value (" + value.getClass().getName() + ") which cannot be retried by "
                    + BlockingRetry.class.getSimpleName() + ", use an orchestrator for asynchronous operations instead");
        }
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", BlockingRetry.class.getSimpleName() + "[", "]")
                .add("config=" + config)
                .add("sleeper=" + sleeper)
                .toString();
    }
}
