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
package org.fireflyframework.escalation.core.recovery;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.escalation.core.engine.DurableExecutionEngine;
import org.fireflyframework.escalation.core.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.escalation.core.persistence.ExecutionState;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Restart-time housekeeping: re-attaches in-flight runs, reports stale ones and purges old
 * terminal records.
 */
@Slf4j
public class RecoveryService {
    private final ExecutionPersistenceProvider persistence;
    private final DurableExecutionEngine engine;
    private final Clock clock;
    private final Duration staleThreshold;

    public RecoveryService(ExecutionPersistenceProvider persistence, DurableExecutionEngine engine,
                           Clock clock, Duration staleThreshold) {
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(staleThreshold, "staleThreshold must not be null");
        if (staleThreshold.isNegative() || staleThreshold.isZero()) {
            throw new IllegalArgumentException("staleThreshold must be positive, got: " + staleThreshold);
        }
        this.staleThreshold = staleThreshold;
    }

    /**
     * Resumes every persisted run in RUNNING or WAITING state. A run that cannot be resumed
     * (already held, unknown workflow) is logged and skipped; emits the number resumed.
     */
    public Mono<Long> resumeInFlight() {
        return persistence.findInFlight()
                .concatMap(state -> engine.resume(state.instanceId())
                        .thenReturn(1L)
                        .onErrorResume(err -> {
                            log.warn("[recovery] could not resume instanceId={} workflow={} error={}",
                                    state.instanceId(), state.workflowName(), err.getMessage());
                            return Mono.just(0L);
                        }))
                .reduce(0L, Long::sum)
                .doOnNext(count -> log.info("[recovery] resumed {} in-flight run(s)", count));
    }

    public Flux<ExecutionState> findStaleExecutions() {
        return persistence.findStale(clock.instant().minus(staleThreshold));
    }

    public Mono<Long> cleanupCompletedExecutions(Duration olderThan) {
        return persistence.cleanup(olderThan)
                .doOnNext(count -> log.info("[recovery] cleaned up {} completed executions older than {}", count, olderThan))
                .doOnError(err -> log.error("[recovery] cleanup failed for duration {}", olderThan, err));
    }
}
