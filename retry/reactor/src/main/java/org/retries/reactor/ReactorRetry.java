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

package org.retries.reactor;

import org.jspecify.annotations.NullMarked;
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
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.StringJoiner;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Retries an operation without blocking. Both the attempts and the delays between them are asynchronous, the delays are scheduled on the
 * configured {@link Scheduler} ({@link Schedulers#parallel()} by default). Nothing happens until the returned {@code Mono} is subscribed to,
 * and every subscription starts a new run. Disposing the subscription cancels the current attempt or delay.
 * <p>
 * A {@link CancellationException} emitted by the operation is never retried and is propagated as is.
 * </p>
 *
 * @param <T> The type of the value emitted by the operation
 */
@NullMarked
public class ReactorRetry<T> {
    private static final Logger log = LoggerFactory.getLogger(ReactorRetry.class);

    private final RetryConfig<T> config;
    private final Scheduler scheduler;

    public ReactorRetry(RetryConfig<T> config) {
        this(config, Schedulers.parallel());
    }

    public ReactorRetry(RetryConfig<T> config, Scheduler scheduler) {
        requireNonNull(config, RetryConfig.class.getSimpleName() + " cannot be null");
        requireNonNull(scheduler, Scheduler.class.getSimpleName() + " cannot be null");
        this.config = config;
        this.scheduler = scheduler;
    }

    /**
     * @return A {@code Mono} with the value of the first successful attempt, or an error with a {@link RetryExhaustedException} if no attempt succeeded.
     */
    public Mono<T> execute(Supplier<Mono<T>> supplier) {
        return execute(ReactorOperation.from(supplier), Arguments.none());
    }

    /**
     * @return A {@code Mono} with the value of the first successful attempt, or an error with a {@link RetryExhaustedException} if no attempt succeeded.
     * The {@code Mono} is empty if the successful attempt was empty.
     */
    public Mono<T> execute(ReactorOperation<T> operation, Arguments arguments) {
        return executeForRecord(operation, arguments).flatMap(record -> Mono.justOrEmpty(record.getLastValue()));
    }

    /**
     * Same as {@link #execute(ReactorOperation, Arguments)} but emits the record of the successful run instead of its value.
     * The record of an exhausted run is available from {@link RetryExhaustedException#getExecutionRecord()}.
     */
    public Mono<ExecutionRecord<T>> executeForRecord(ReactorOperation<T> operation, Arguments arguments) {
        requireNonNull(operation, ReactorOperation.class.getSimpleName() + " cannot be null");
        requireNonNull(arguments, Arguments.class.getSimpleName() + " cannot be null");
        return Mono.defer(() -> {
            RetryExecution<T> execution = RetryExecution.start(config, operation, arguments);
            return attempt(operation, arguments, execution)
                    .expand(resolution -> next(resolution, operation, arguments, execution))
                    .last()
                    .flatMap(resolution -> {
                        if (resolution instanceof Resolution.Exhausted<T> exhausted) {
                            return Mono.<ExecutionRecord<T>>error(exhausted.exception());
                        }
                        return Mono.just(execution.record());
                    });
        });
    }

    public RetryConfig<T> getConfig() {
        return config;
    }

    private Mono<Resolution<T>> next(Resolution<T> resolution, ReactorOperation<T> operation, Arguments arguments, RetryExecution<T> execution) {
        if (resolution instanceof Resolution.RetryAfter<T> retryAfter) {
            return pause(retryAfter.delay()).then(attempt(operation, arguments, execution));
        }
        return Mono.empty();
    }

    private Mono<Resolution<T>> attempt(ReactorOperation<T> operation, Arguments arguments, RetryExecution<T> execution) {
        return Mono.defer(() -> {
            execution.beforeAttempt();
            return invoke(operation, arguments)
                    .<Outcome<T>>map(Outcome::success)
                    .switchIfEmpty(Mono.fromSupplier(() -> Outcome.<T>success(null)))
                    .onErrorResume(ReactorRetry::isRetryMaterial, error -> {
                        log.debug("'{}' failed with {}", operation, error.toString());
                        return Mono.just(Outcome.<T>failure(error));
                    })
                    .map(execution::afterAttempt);
        });
    }

    private Mono<T> invoke(ReactorOperation<T> operation, Arguments arguments) {
        final Mono<T> invocation;
        try {
            invocation = operation.invoke(arguments);
        } catch (RuntimeException e) {
            return Mono.error(e);
        }
        if (invocation == null) {
            throw new IllegalRetryUsageException("'" + operation + "' returned null instead of a " + Mono.class.getSimpleName());
        }
        return invocation;
    }

    private Mono<Long> pause(Duration delay) {
        if (delay.isZero()) {
            return Mono.empty();
        }
        return Mono.delay(delay, scheduler);
    }

    // Cancellation and usage errors are never retried, neither are Errors
    private static boolean isRetryMaterial(Throwable error) {
        return error instanceof Exception && !(error instanceof CancellationException) && !(error instanceof IllegalRetryUsageException);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ReactorRetry.class.getSimpleName() + "[", "]")
                .add("config=" + config)
                .add("scheduler=" + scheduler)
                .toString();
    }
}
