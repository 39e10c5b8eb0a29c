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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.retries.Arguments;
import org.retries.ExecutionRecord;
import org.retries.IllegalRetryUsageException;
import org.retries.RetryConfig;
import org.retries.RetryExhaustedException;
import org.retries.Strategy;
import org.retries.strategy.NoOpStrategy;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.retries.strategy.Strategies.exponentialBackoff;
import static org.retries.strategy.Strategies.fixedDelay;
import static org.retries.strategy.Strategies.noOp;

@DisplayName("reactor retry")
@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(10)
public class ReactorRetryTest {

    private final Scheduler scheduler = Schedulers.newSingle("retry-test");

    @AfterEach
    void disposeScheduler() {
        scheduler.dispose();
    }

    @Nested
    @DisplayName("when operation keeps failing")
    class WhenOperationKeepsFailing {

        @Test
        void chain_of_two_strategies_invokes_the_operation_one_plus_n_plus_m_times() {
            // Given
            NoOpStrategy a = noOp(2);
            NoOpStrategy b = noOp(4);
            ReactorRetry<String> retry = new ReactorRetry<>(config(a, b), scheduler);
            AtomicInteger counter = new AtomicInteger(0);

            // When
            Throwable throwable = catchThrowable(() -> retry.execute(() -> Mono.fromCallable(() -> {
                counter.incrementAndGet();
                throw new IllegalStateException("expected");
            })).block());

            // Then
            assertAll(
                    () -> assertThat(counter).hasValue(7),
                    () -> assertThat(a.getAttemptsTaken()).isEqualTo(2),
                    () -> assertThat(b.getAttemptsTaken()).isEqualTo(4),
                    () -> assertThat(throwable).isExactlyInstanceOf(RetryExhaustedException.class)
            );
        }

        @Test
        void single_strategy_invokes_the_operation_one_plus_n_times_and_the_cause_is_the_last_failure() {
            // Given
            ReactorRetry<String> retry = new ReactorRetry<>(config(noOp(2)), scheduler);
            AtomicInteger counter = new AtomicInteger(0);

            // When
            Throwable throwable = catchThrowable(() -> retry.execute(() -> Mono.error(() -> new IllegalStateException("failure " + counter.incrementAndGet()))).block());

            // Then
            assertAll(
                    () -> assertThat(counter).hasValue(3),
                    () -> assertThat(throwable).isExactlyInstanceOf(RetryExhaustedException.class),
                    () -> assertThat(throwable.getCause()).isExactlyInstanceOf(IllegalStateException.class).hasMessage("failure 3")
            );
        }

        @Test
        void exception_thrown_while_creating_the_mono_is_retried_like_an_error_signal() {
            // Given
            ReactorRetry<String> retry = new ReactorRetry<>(config(noOp(1)), scheduler);
            AtomicInteger counter = new AtomicInteger(0);

            // When
            Throwable throwable = catchThrowable(() -> retry.execute(() -> {
                counter.incrementAndGet();
                throw new IllegalArgumentException("expected");
            }).block());

            // Then
            assertAll(
                    () -> assertThat(counter).hasValue(2),
                    () -> assertThat(throwable).isExactlyInstanceOf(RetryExhaustedException.class).hasCauseExactlyInstanceOf(IllegalArgumentException.class)
            );
        }

        @Test
        void execution_record_of_the_exhausted_run_is_available_from_the_exception() {
            // Given
            ReactorRetry<String> retry = new ReactorRetry<>(config(noOp(1)), scheduler);
            ReactorOperation<String> operation = ReactorOperation.named("always-failing", args -> Mono.error(new IOException("expected")));

            // When
            RetryExhaustedException exception = (RetryExhaustedException) catchThrowable(() -> retry.execute(operation, Arguments.of("x")).block());

            // Then
            ExecutionRecord<?> record = exception.getExecutionRecord();
            assertAll(
                    () -> assertThat(record.getOperation()).isSameAs(operation),
                    () -> assertThat(record.getInvocationCount()).isEqualTo(2),
                    () -> assertThat(record.getLastFailure()).containsInstanceOf(IOException.class),
                    () -> assertThat(record.isFinished()).isTrue()
            );
        }
    }

    @Nested
    @DisplayName("eligibility")
    class Eligibility {

        @Test
        void failure_that_is_not_eligible_exhausts_the_run_after_the_first_attempt() {
            // Given
            NoOpStrategy strategy = noOp(3);
            ReactorRetry<String> retry = new ReactorRetry<>(new RetryConfig.Builder<String>().strategies(strategy).retryOn(IllegalArgumentException.class).build(), scheduler);
            AtomicInteger counter = new AtomicInteger(0);

            // When
            Throwable throwable = catchThrowable(() -> retry.execute(() -> Mono.fromRunnable(counter::incrementAndGet).then(Mono.error(new IllegalStateException("expected")))).block());

            // Then
            assertAll(
                    () -> assertThat(counter).hasValue(1),
                    () -> assertThat(strategy.getAttemptsTaken()).isZero(),
                    () -> assertThat(throwable).isExactlyInstanceOf(RetryExhaustedException.class).hasCauseExactlyInstanceOf(IllegalStateException.class)
            );
        }
    }

    @Nested
    @DisplayName("when operation succeeds")
    class WhenOperationSucceeds {

        @Test
        void value_is_emitted_and_no_strategy_is_consulted_nor_failure_hook_invoked() {
            // Given
            NoOpStrategy strategy = noOp(2);
            List<Throwable> failures = new CopyOnWriteArrayList<>();
            ReactorRetry<String> retry = new ReactorRetry<>(new RetryConfig.Builder<String>().strategies(strategy).onFailure(failures::add).build(), scheduler);

            // When
            String value = retry.execute(() -> Mono.just("value")).block();

            // Then
            assertAll(
                    () -> assertThat(value).isEqualTo("value"),
                    () -> assertThat(strategy.getAttemptsTaken()).isZero(),
                    () -> assertThat(failures).isEmpty()
            );
        }

        @Test
        void empty_mono_is_a_successful_attempt_without_value() {
            // Given
            ReactorRetry<String> retry = new ReactorRetry<>(config(noOp(2)), scheduler);
            AtomicInteger counter = new AtomicInteger(0);

            // When
            ExecutionRecord<String> record = retry.executeForRecord(args -> Mono.fromRunnable(counter::incrementAndGet), Arguments.none()).block();

            // Then
            assertAll(
                    () -> assertThat(counter).hasValue(1),
                    () -> assertThat(record.getLastValue()).isEmpty(),
                    () -> assertThat(record.hasFailed()).isFalse()
            );
        }

        @Test
        void arguments_are_forwarded_to_every_attempt() {
            // Given
            ReactorRetry<Integer> retry = new ReactorRetry<>(RetryConfig.<Integer>withStrategies(noOp(1)), scheduler);
            List<Arguments> received = new CopyOnWriteArrayList<>();

            // When
            Integer value = retry.execute(args -> {
                received.add(args);
                if (received.size() == 1) {
                    return Mono.error(new IllegalStateException("expected"));
                }
                return Mono.just(args.get("factor", Integer.class) * 2);
            }, Arguments.none().with("factor", 21)).block();

            // Then
            assertAll(
                    () -> assertThat(value).isEqualTo(42),
                    () -> assertThat(received).hasSize(2).containsOnly(Arguments.none().with("factor", 21))
            );
        }

        @Test
        void nothing_happens_until_subscribed_and_every_subscription_is_a_new_run() {
            // Given
            ReactorRetry<String> retry = new ReactorRetry<>(new RetryConfig.Builder<String>().strategies(() -> List.of(noOp(1))).build(), scheduler);
            AtomicInteger counter = new AtomicInteger(0);
            Mono<String> mono = retry.execute(() -> Mono.fromCallable(() -> {
                if (counter.incrementAndGet() % 2 == 1) {
                    throw new IllegalStateException("expected");
                }
                return "value";
            }));
            int invocationsBeforeSubscription = counter.get();

            // When
            String first = mono.block();
            String second = mono.block();

            // Then
            assertAll(
                    () -> assertThat(invocationsBeforeSubscription).isZero(),
                    () -> assertThat(first).isEqualTo("value"),
                    () -> assertThat(second).isEqualTo("value"),
                    () -> assertThat(counter).hasValue(4)
            );
        }
    }

    @Nested
    @DisplayName("hooks")
    class Hooks {

        @Test
        void before_hooks_run_before_every_attempt_and_after_hooks_after_every_attempt() {
            // Given
            List<String> events = new CopyOnWriteArrayList<>();
            AtomicInteger counter = new AtomicInteger(0);
            ReactorRetry<String> retry = new ReactorRetry<>(new RetryConfig.Builder<String>()
                    .strategies(noOp(2))
                    .beforeHook(() -> events.add("h1"))
                    .beforeHook(() -> events.add("h2"))
                    .afterHook(outcome -> events.add("h3"))
                    .build(), scheduler);

            // When
            retry.execute(() -> Mono.fromCallable(() -> {
                events.add("call");
                if (counter.incrementAndGet() < 3) {
                    throw new IllegalStateException("expected");
                }
                return "value";
            })).block();

            // Then
            assertThat(events).containsExactly("h1", "h2", "call", "h3", "h1", "h2", "call", "h3", "h1", "h2", "call", "h3");
        }

        @Test
        void failing_after_hook_is_propagated_without_retrying() {
            // Given
            AtomicInteger counter = new AtomicInteger(0);
            ReactorRetry<String> retry = new ReactorRetry<>(new RetryConfig.Builder<String>()
                    .strategies(noOp(3))
                    .afterHook(outcome -> {
                        throw new IllegalArgumentException("hook failed");
                    })
                    .build(), scheduler);

            // When
            Throwable throwable = catchThrowable(() -> retry.execute(() -> Mono.fromCallable(counter::incrementAndGet).then(Mono.error(new IllegalStateException("expected")))).block());

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("hook failed"),
                    () -> assertThat(counter).hasValue(1)
            );
        }
    }

    @Nested
    @DisplayName("pacing")
    class Pacing {

        @Test
        void retries_after_a_delay_run_on_the_scheduler() {
            // Given
            List<String> threads = new CopyOnWriteArrayList<>();
            ReactorRetry<String> retry = new ReactorRetry<>(config(fixedDelay(Duration.ofMillis(10), 2)), scheduler);

            // When
            Mono<String> mono = retry.execute(() -> Mono.fromCallable(() -> {
                threads.add(Thread.currentThread().getName());
                throw new IllegalStateException("expected");
            }));

            // Then
            StepVerifier.create(mono)
                    .expectError(RetryExhaustedException.class)
                    .verify(Duration.ofSeconds(5));
            assertAll(
                    () -> assertThat(threads).hasSize(3),
                    () -> assertThat(threads.subList(1, 3)).allMatch(name -> name.startsWith("retry-test"))
            );
        }

        @Test
        void exponential_backoff_waits_base_delay_times_two_to_the_power_of_k_before_retry_k() {
            // Given
            AtomicInteger counter = new AtomicInteger(0);

            // When
            StepVerifier.withVirtualTime(() -> new ReactorRetry<String>(config(exponentialBackoff(2, Duration.ofMillis(25), () -> 0)))
                            .execute(() -> Mono.fromCallable(() -> {
                                counter.incrementAndGet();
                                throw new IllegalStateException("expected");
                            })))
                    .expectSubscription()
                    .expectNoEvent(Duration.ofMillis(49))
                    .then(() -> assertThat(counter).hasValue(1))
                    .thenAwait(Duration.ofMillis(1))
                    .then(() -> assertThat(counter).hasValue(2))
                    .expectNoEvent(Duration.ofMillis(99))
                    .then(() -> assertThat(counter).hasValue(2))
                    .thenAwait(Duration.ofMillis(1))
                    // Then
                    .expectErrorSatisfies(error -> assertAll(
                            () -> assertThat(error).isExactlyInstanceOf(RetryExhaustedException.class).hasCauseExactlyInstanceOf(IllegalStateException.class),
                            () -> assertThat(counter).hasValue(3)
                    ))
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        void value_of_a_delayed_retry_is_emitted_once_the_delay_has_elapsed() {
            // Given
            AtomicInteger counter = new AtomicInteger(0);

            // When
            StepVerifier.withVirtualTime(() -> new ReactorRetry<String>(config(fixedDelay(Duration.ofSeconds(2), 3)))
                            .execute(() -> Mono.fromCallable(() -> {
                                if (counter.incrementAndGet() < 3) {
                                    throw new IllegalStateException("expected");
                                }
                                return "value";
                            })))
                    .expectSubscription()
                    .expectNoEvent(Duration.ofSeconds(2))
                    .then(() -> assertThat(counter).hasValue(2))
                    .expectNoEvent(Duration.ofMillis(1999))
                    .thenAwait(Duration.ofMillis(1))
                    // Then
                    .expectNext("value")
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        void cancellation_exception_is_propagated_as_is_and_never_retried() {
            // Given
            ReactorRetry<String> retry = new ReactorRetry<>(config(noOp(3)), scheduler);
            AtomicInteger counter = new AtomicInteger(0);

            // When
            Mono<String> mono = retry.execute(() -> Mono.fromRunnable(counter::incrementAndGet).then(Mono.error(new CancellationException("cancelled"))));

            // Then
            StepVerifier.create(mono)
                    .expectErrorSatisfies(error -> assertThat(error).isExactlyInstanceOf(CancellationException.class).hasMessage("cancelled"))
                    .verify(Duration.ofSeconds(5));
            assertThat(counter).hasValue(1);
        }

        @Test
        void cancelling_the_subscription_while_waiting_for_the_next_attempt_stops_the_run() {
            // Given
            VirtualTimeScheduler virtualTime = VirtualTimeScheduler.create();
            ReactorRetry<String> retry = new ReactorRetry<>(config(fixedDelay(Duration.ofMillis(300), 3)), virtualTime);
            AtomicInteger counter = new AtomicInteger(0);
            Mono<String> mono = retry.execute(() -> Mono.fromCallable(() -> {
                counter.incrementAndGet();
                throw new IllegalStateException("expected");
            }));

            // When
            StepVerifier.create(mono)
                    .expectSubscription()
                    .then(() -> virtualTime.advanceTimeBy(Duration.ofMillis(100)))
                    .then(() -> assertThat(counter).hasValue(1))
                    .thenCancel()
                    .verify(Duration.ofSeconds(5));
            virtualTime.advanceTimeBy(Duration.ofSeconds(10));

            // Then
            assertThat(counter).hasValue(1);
            virtualTime.dispose();
        }
    }

    @Test
    void config_of_the_orchestrator_is_the_one_it_was_created_with() {
        // Given
        RetryConfig<String> config = config(noOp(2));

        // When
        ReactorRetry<String> retry = new ReactorRetry<>(config, scheduler);

        // Then
        assertThat(retry.getConfig()).isSameAs(config);
    }

    @Test
    void operation_returning_null_is_a_usage_error() {
        // Given
        ReactorRetry<String> retry = new ReactorRetry<>(config(noOp(3)), scheduler);
        AtomicInteger counter = new AtomicInteger(0);

        // When
        Throwable throwable = catchThrowable(() -> retry.execute(() -> {
            counter.incrementAndGet();
            return null;
        }).block());

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalRetryUsageException.class),
                () -> assertThat(counter).hasValue(1)
        );
    }

    private static RetryConfig<String> config(Strategy... strategies) {
        return RetryConfig.withStrategies(strategies);
    }
}
