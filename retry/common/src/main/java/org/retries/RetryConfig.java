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
import org.jspecify.annotations.NullUnmarked;
import org.retries.strategy.Strategies;

import java.time.Clock;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Configuration shared by the blocking and the reactive retry orchestrators. A {@code RetryConfig} is immutable and may be used for any number of runs.
 * By default, the following settings are used:
 *
 * <ul>
 *     <li>No strategies (the first failure exhausts the run)</li>
 *     <li>Retries all exceptions</li>
 *     <li>No hooks</li>
 *     <li>{@link Clock#systemUTC()}</li>
 *     <li>Attempts are logged</li>
 * </ul>
 * <p>
 * <pre>
 * RetryConfig&lt;String&gt; config = new RetryConfig.Builder&lt;String&gt;()
 *         .strategies(() -&gt; List.of(Strategies.fixedDelay(Duration.ofMillis(200), 3), Strategies.stopAfterAttempt(5)))
 *         .retryOn(IOException.class)
 *         .onFailure(e -&gt; log.warn("Attempt failed", e))
 *         .build();
 * </pre>
 * </p>
 *
 * @param <T> The type of the value returned by the retried operation
 * @see Strategies
 */
@NullMarked
public class RetryConfig<T> {
    private static final Consumer<Throwable> NOOP_FAILURE_HOOK = __ -> {
    };

    public final Supplier<List<Strategy>> strategies;
    public final Set<Class<? extends Throwable>> retryOn;
    public final List<Runnable> beforeHooks;
    public final List<Consumer<? super Outcome<T>>> afterHooks;
    public final Consumer<Throwable> onFailure;
    public final Clock clock;
    public final boolean logAttempts;

    private RetryConfig(Supplier<List<Strategy>> strategies, Set<Class<? extends Throwable>> retryOn, List<Runnable> beforeHooks,
                        List<Consumer<? super Outcome<T>>> afterHooks, Consumer<Throwable> onFailure, Clock clock, boolean logAttempts) {
        Objects.requireNonNull(strategies, "Strategies cannot be null");
        Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.strategies = strategies;
        this.retryOn = Collections.unmodifiableSet(new LinkedHashSet<>(retryOn));
        this.beforeHooks = List.copyOf(beforeHooks);
        this.afterHooks = List.copyOf(afterHooks);
        this.onFailure = onFailure;
        this.clock = clock;
        this.logAttempts = logAttempts;
    }

    /**
     * @return A config with the default settings, i.e. without any strategies.
     */
    public static <T> RetryConfig<T> defaults() {
        return new Builder<T>().build();
    }

    /**
     * @param strategies The strategies to use
     * @return A config with default settings apart from the supplied strategies.
     * @see Builder#strategies(Strategy...)
     */
    public static <T> RetryConfig<T> withStrategies(Strategy... strategies) {
        return new Builder<T>().strategies(strategies).build();
    }

    /**
     * @param error The failure of an attempt
     * @return {@code true} if {@code error} is eligible for retry, i.e. no failure types are configured or {@code error} is an instance of one of them.
     */
    public boolean isRetryable(Throwable error) {
        if (retryOn.isEmpty()) {
            return true;
        }
        return retryOn.stream().anyMatch(type -> type.isInstance(error));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryConfig<?> that)) return false;
        return logAttempts == that.logAttempts && Objects.equals(strategies, that.strategies) && Objects.equals(retryOn, that.retryOn) && Objects.equals(beforeHooks, that.beforeHooks) && Objects.equals(afterHooks, that.afterHooks) && Objects.equals(onFailure, that.onFailure) && Objects.equals(clock, that.clock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategies, retryOn, beforeHooks, afterHooks, onFailure, clock, logAttempts);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryConfig.class.getSimpleName() + "[", "]")
                .add("strategies=" + strategies)
                .add("retryOn=" + retryOn)
                .add("beforeHooks=" + beforeHooks)
                .add("afterHooks=" + afterHooks)
                .add("onFailure=" + onFailure)
                .add("clock=" + clock)
                .add("logAttempts=" + logAttempts)
                .toString();
    }

    @NullUnmarked
    public static final class Builder<T> {
        private Supplier<List<Strategy>> strategies = Collections::emptyList;
        private final Set<Class<? extends Throwable>> retryOn = new LinkedHashSet<>();
        private final List<Runnable> beforeHooks = new ArrayList<>();
        private final List<Consumer<? super Outcome<T>>> afterHooks = new ArrayList<>();
        private Consumer<Throwable> onFailure = NOOP_FAILURE_HOOK;
        private Clock clock = Clock.systemUTC();
        private boolean logAttempts = true;

        /**
         * Use the supplied strategy instances, consulted in the given order. Note that strategies are stateful and never reset,
         * so every run of an orchestrator built from this config continues where the previous run left off.
         * Use {@link #strategies(Supplier)} to get fresh strategies for every run.
         *
         * @param strategies The strategies, in the order they should be consulted
         * @return The builder instance
         */
        @NullMarked
        public Builder<T> strategies(Strategy... strategies) {
            Objects.requireNonNull(strategies, "Strategies cannot be null");
            return strategies(Arrays.asList(strategies));
        }

        /**
         * @param strategies The strategies, in the order they should be consulted
         * @return The builder instance
         * @see #strategies(Strategy...)
         */
        @NullMarked
        public Builder<T> strategies(List<? extends Strategy> strategies) {
            Objects.requireNonNull(strategies, "Strategies cannot be null");
            strategies.forEach(strategy -> Objects.requireNonNull(strategy, Strategy.class.getSimpleName() + " cannot be null"));
            List<Strategy> copy = List.copyOf(strategies);
            this.strategies = () -> copy;
            return this;
        }

        /**
         * Specify a supplier that creates the chain of strategies. The supplier is invoked once at the start of every run,
         * which allows the same orchestrator to be used for many (also concurrent) runs.
         *
         * @param strategiesPerRun Creates the strategies for a run, in the order they should be consulted
         * @return The builder instance
         */
        @NullMarked
        public Builder<T> strategies(Supplier<? extends List<? extends Strategy>> strategiesPerRun) {
            Objects.requireNonNull(strategiesPerRun, "Strategies supplier cannot be null");
            this.strategies = () -> List.copyOf(Objects.requireNonNull(strategiesPerRun.get(), "Strategies supplier returned null"));
            return this;
        }

        /**
         * Only retry failures that are instances of one of the supplied types. All other failures exhaust the run immediately,
         * without consulting any strategy. Can be called several times, the types are accumulated.
         *
         * @param types The failure types that should be retried
         * @return The builder instance
         */
        @SafeVarargs
        @NullMarked
        public final Builder<T> retryOn(Class<? extends Throwable>... types) {
            Objects.requireNonNull(types, "Types cannot be null");
            for (Class<? extends Throwable> type : types) {
                retryOn.add(Objects.requireNonNull(type, "Type cannot be null"));
            }
            return this;
        }

        /**
         * @param hook A hook that is run before every attempt, including the first one. Hooks run in the order they were added.
         * @return The builder instance
         */
        @NullMarked
        public Builder<T> beforeHook(Runnable hook) {
            beforeHooks.add(Objects.requireNonNull(hook, "Hook cannot be null"));
            return this;
        }

        /**
         * @param hook A hook that is run after every attempt, regardless of its outcome. Hooks run in the order they were added.
         * @return The builder instance
         */
        @NullMarked
        public Builder<T> afterHook(Consumer<? super Outcome<T>> hook) {
            afterHooks.add(Objects.requireNonNull(hook, "Hook cannot be null"));
            return this;
        }

        /**
         * @param onFailure A hook that is run with the failure of every failed attempt, before the after hooks.
         * @return The builder instance
         */
        @NullMarked
        public Builder<T> onFailure(Consumer<Throwable> onFailure) {
            this.onFailure = Objects.requireNonNull(onFailure, "Failure hook cannot be null");
            return this;
        }

        /**
         * @param clock The clock used to record when a run started and ended
         * @return The builder instance
         */
        @NullMarked
        public Builder<T> clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
            return this;
        }

        /**
         * @param logAttempts {@code true} if the orchestrator should log every run and strategy application at info level (default), {@code false} otherwise.
         * @return The builder instance
         */
        public Builder<T> logAttempts(boolean logAttempts) {
            this.logAttempts = logAttempts;
            return this;
        }

        @NullMarked
        public RetryConfig<T> build() {
            return new RetryConfig<>(strategies, retryOn, beforeHooks, afterHooks, onFailure, clock, logAttempts);
        }
    }
}
