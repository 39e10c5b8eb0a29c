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
import org.jspecify.annotations.Nullable;

import java.util.*;

/**
 * Positional and named arguments that are forwarded, unchanged, to the retried operation on every attempt.
 * {@code Arguments} are immutable, {@link #with(String, Object)} returns a new instance.
 * <p>
 * <pre>
 * Arguments arguments = Arguments.of("order-1", 42).with("dryRun", true);
 * </pre>
 * </p>
 */
@NullMarked
public final class Arguments {
    private static final Arguments NONE = new Arguments(Collections.emptyList(), Collections.emptyMap());

    private final List<@Nullable Object> positional;
    private final Map<String, @Nullable Object> named;

    private Arguments(List<@Nullable Object> positional, Map<String, @Nullable Object> named) {
        this.positional = positional;
        this.named = named;
    }

    /**
     * @return {@code Arguments} without any positional or named arguments
     */
    public static Arguments none() {
        return NONE;
    }

    /**
     * @param positional The positional arguments, {@code null} elements are allowed.
     * @return {@code Arguments} containing the supplied positional arguments
     */
    public static Arguments of(@Nullable Object... positional) {
        Objects.requireNonNull(positional, "Positional arguments cannot be null");
        if (positional.length == 0) {
            return NONE;
        }
        return new Arguments(Collections.unmodifiableList(Arrays.asList(positional.clone())), Collections.emptyMap());
    }

    /**
     * @param name  The name of the argument
     * @param value The value of the argument, may be {@code null}
     * @return A new instance of {@code Arguments} that also contains the named argument. An existing argument with the same name is replaced.
     */
    public Arguments with(String name, @Nullable Object value) {
        Objects.requireNonNull(name, "Argument name cannot be null");
        Map<String, @Nullable Object> newNamed = new LinkedHashMap<>(named);
        newNamed.put(name, value);
        return new Arguments(positional, Collections.unmodifiableMap(newNamed));
    }

    public int size() {
        return positional.size();
    }

    public @Nullable Object get(int index) {
        if (index < 0 || index >= positional.size()) {
            throw new IllegalArgumentException("No positional argument at index " + index + ", there are " + positional.size() + " positional arguments");
        }
        return positional.get(index);
    }

    public <A> @Nullable A get(int index, Class<A> type) {
        Objects.requireNonNull(type, "Type cannot be null");
        return type.cast(get(index));
    }

    public boolean has(String name) {
        return named.containsKey(name);
    }

    public @Nullable Object get(String name) {
        if (!has(name)) {
            throw new IllegalArgumentException("No argument named '" + name + "'");
        }
        return named.get(name);
    }

    public <A> @Nullable A get(String name, Class<A> type) {
        Objects.requireNonNull(type, "Type cannot be null");
        return type.cast(get(name));
    }

    public List<@Nullable Object> positional() {
        return positional;
    }

    public Map<String, @Nullable Object> named() {
        return named;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Arguments that)) return false;
        return Objects.equals(positional, that.positional) && Objects.equals(named, that.named);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positional, named);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", Arguments.class.getSimpleName() + "[", "]")
                .add("positional=" + positional)
                .add("named=" + named)
                .toString();
    }
}
