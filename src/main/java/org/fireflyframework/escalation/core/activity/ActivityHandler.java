/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.fireflyframework.escalation.core.activity;

import reactor.core.publisher.Mono;

/**
 * A side-effecting operation invoked from durable workflow code. Implementations must be
 * idempotent: a crash between the side effect and its journal write re-runs the call.
 *
 * @param <I> input type
 * @param <O> result type; an empty {@code Mono} records a {@code null} result
 */
@FunctionalInterface
public interface ActivityHandler<I, O> {

    Mono<O> execute(I input);
}
