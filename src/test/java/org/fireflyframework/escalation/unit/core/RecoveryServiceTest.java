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
package org.fireflyframework.escalation.unit.core;

import org.fireflyframework.escalation.core.engine.DurableExecutionEngine;
import org.fireflyframework.escalation.core.exception.ExecutionAlreadyRunningException;
import org.fireflyframework.escalation.core.model.ExecutionStatus;
import org.fireflyframework.escalation.core.persistence.ExecutionState;
import org.fireflyframework.escalation.core.persistence.InMemoryPersistenceProvider;
import org.fireflyframework.escalation.core.recovery.RecoveryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecoveryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private DurableExecutionEngine engine;

    private InMemoryPersistenceProvider persistence;
    private RecoveryService recoveryService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        persistence = new InMemoryPersistenceProvider(clock);
        recoveryService = new RecoveryService(persistence, engine, clock, Duration.ofMinutes(30));
    }

    private ExecutionState state(String id, ExecutionStatus status, Instant updatedAt) {
        return new ExecutionState(id, "alert-escalation", status, "{}", null, List.of(), null, updatedAt, updatedAt);
    }

    @Test
    void resumeInFlight_resumesActiveRuns_andSkipsFailures() {
        var waiting = state("waiting-1", ExecutionStatus.WAITING, NOW);
        var running = state("running-1", ExecutionStatus.RUNNING, NOW);
        persistence.save(waiting).block();
        persistence.save(running).block();
        persistence.save(state("done-1", ExecutionStatus.COMPLETED, NOW)).block();

        when(engine.resume("waiting-1")).thenReturn(Mono.just(waiting));
        when(engine.resume("running-1")).thenReturn(Mono.error(new ExecutionAlreadyRunningException("running-1")));

        StepVerifier.create(recoveryService.resumeInFlight())
                .expectNext(1L)
                .verifyComplete();

        verify(engine, never()).resume("done-1");
    }

    @Test
    void resumeInFlight_nothingToResume_emitsZero() {
        StepVerifier.create(recoveryService.resumeInFlight())
                .expectNext(0L)
                .verifyComplete();
        verifyNoInteractions(engine);
    }

    @Test
    void findStaleExecutions_detectsActiveRunsPastThreshold() {
        persistence.save(state("stale-1", ExecutionStatus.WAITING, NOW.minus(Duration.ofHours(1)))).block();
        persistence.save(state("fresh-1", ExecutionStatus.WAITING, NOW.minus(Duration.ofMinutes(5)))).block();

        StepVerifier.create(recoveryService.findStaleExecutions().map(ExecutionState::instanceId).collectList())
                .assertNext(ids -> assertThat(ids).containsExactly("stale-1"))
                .verifyComplete();
    }

    @Test
    void cleanupCompletedExecutions_delegatesToProvider() {
        persistence.save(state("old", ExecutionStatus.FAILED, NOW.minus(Duration.ofDays(8)))).block();
        persistence.save(state("new", ExecutionStatus.COMPLETED, NOW.minus(Duration.ofDays(1)))).block();

        StepVerifier.create(recoveryService.cleanupCompletedExecutions(Duration.ofDays(7)))
                .expectNext(1L)
                .verifyComplete();
        assertThat(persistence.size()).isEqualTo(1);
    }

    @Test
    void constructor_rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new RecoveryService(persistence, engine, Clock.systemUTC(), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
