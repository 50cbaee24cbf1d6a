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
package org.fireflyframework.escalation.core.engine;

import org.fireflyframework.escalation.core.context.DurableContext;
import reactor.core.publisher.Mono;

/**
 * Deterministic workflow function. {@link #run} is re-executed from the top on every resume, so
 * it must request its steps through the {@link DurableContext} only and must not read the wall
 * clock, random sources or mutable shared state directly.
 *
 * @param <I> input type, serialized into the run record
 * @param <O> output type
 */
public interface DurableWorkflow<I, O> {

    String name();

    Class<I> inputType();

    Mono<O> run(DurableContext ctx, I input);
}
