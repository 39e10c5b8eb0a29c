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

package org.retries.internal;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.retries.RetryExhaustedException;

import java.time.Duration;

/**
 * What an orchestrator should do after an attempt. Never use this class directly from your own code!
 */
@NullMarked
public sealed interface Resolution<T> {

    record Succeeded<T>(@Nullable T value) implements Resolution<T> {
    }

    record RetryAfter<T>(Duration delay) implements Resolution<T> {
    }

    record Exhausted<T>(RetryExhaustedException exception) implements Resolution<T> {
    }
}
