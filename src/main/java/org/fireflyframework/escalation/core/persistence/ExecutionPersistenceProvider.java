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
package org.fireflyframework.escalation.core.persistence;

import org.fireflyframework.escalation.core.model.ExecutionStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Storage SPI for durable run records. A {@link #save} must be durable before the returned
 * {@code Mono} completes; the engine relies on it to never re-run a journaled step.
 */
public interface ExecutionPersistenceProvider {

    Mono<Void> save(ExecutionState state);

    Mono<Optional<ExecutionState>> findById(String instanceId);

    Flux<ExecutionState> findByStatus(ExecutionStatus status);

    /** Runs in {@code RUNNING} or {@code WAITING}. */
    Flux<ExecutionState> findInFlight();

    /** Active runs whose last update is older than {@code before}. */
    Flux<ExecutionState> findStale(Instant before);

    /** Removes terminal runs last updated more than {@code olderThan} ago; emits the count removed. */
    Mono<Long> cleanup(Duration olderThan);

    Mono<Boolean> isHealthy();
}
