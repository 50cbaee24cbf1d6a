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

import org.fireflyframework.escalation.core.activity.ActivityRegistry;
import org.fireflyframework.escalation.core.context.DurableContext;
import org.fireflyframework.escalation.core.engine.DurableExecutionEngine;
import org.fireflyframework.escalation.core.engine.DurableWorkflow;
import org.fireflyframework.escalation.core.engine.WorkflowRegistry;
import org.fireflyframework.escalation.core.exception.ExecutionAlreadyRunningException;
import org.fireflyframework.escalation.core.exception.ExecutionNotFoundException;
import org.fireflyframework.escalation.core.lease.ExecutionLeaseRegistry;
import org.fireflyframework.escalation.core.model.ExecutionStatus;
import org.fireflyframework.escalation.core.observability.OrchestrationEvents;
import org.fireflyframework.escalation.core.persistence.ExecutionState;
import org.fireflyframework.escalation.core.persistence.InMemoryPersistenceProvider;
import org.fireflyframework.escalation.core.persistence.StateSerializer;
import org.fireflyframework.escalation.core.timer.DurableTimerService;
import org.fireflyframework.escalation.support.VirtualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.*;

class DurableExecutionEngineTest {

    private static final Instant BASE = Instant.parse("2026-03-02T10:00:00Z");

    private VirtualTimeScheduler time;
    private VirtualClock clock;
    private InMemoryPersistenceProvider persistence;
    private ExecutionLeaseRegistry leases;
    private WorkflowRegistry workflows;
    private ActivityRegistry activities;
    private DurableExecutionEngine engine;
    private final AtomicInteger echoCalls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        time = VirtualTimeScheduler.create();
        clock = new VirtualClock(time, BASE);
        persistence = new InMemoryPersistenceProvider(clock);
        leases = new ExecutionLeaseRegistry();
        activities = new ActivityRegistry().register("echo", (String in) -> {
            echoCalls.incrementAndGet();
            return Mono.just(in + "!");
        });
        workflows = new WorkflowRegistry(List.of(
                new TestWorkflow("greeter", (ctx, in) -> ctx.callActivity("echo", in, String.class)),
                new TestWorkflow("sleeper", (ctx, in) -> ctx.delay("nap", Duration.ofMinutes(5))
                        .then(ctx.callActivity("echo", in, String.class))),
                new TestWorkflow("broken", (ctx, in) -> Mono.error(new IllegalStateException("kaput")))));
        engine = newEngine(leases);
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
        time.dispose();
    }

    private DurableExecutionEngine newEngine(ExecutionLeaseRegistry leaseRegistry) {
        return new DurableExecutionEngine(workflows, activities, persistence,
                new DurableTimerService(clock, time), new StateSerializer(), leaseRegistry,
                new OrchestrationEvents() {}, clock, Schedulers.immediate());
    }

    private ExecutionState stored(String id) {
        return persistence.findById(id).block().orElseThrow();
    }

    @Test
    void execute_completesAndPersistsOutput() {
        StepVerifier.create(engine.execute("greeter", "run-1", "hello", String.class))
                .expectNext("hello!")
                .verifyComplete();

        ExecutionState state = stored("run-1");
        assertThat(state.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(state.output()).isEqualTo("\"hello!\"");
        assertThat(state.input()).isEqualTo("\"hello\"");
        assertThat(leases.isHeld("run-1")).isFalse();
    }

    @Test
    void execute_unknownWorkflow_failsWithNotFound() {
        StepVerifier.create(engine.execute("nope", "run-1", "x", String.class))
                .expectError(ExecutionNotFoundException.class)
                .verify();
    }

    @Test
    void execute_failingWorkflow_marksRunFailed() {
        StepVerifier.create(engine.execute("broken", "run-1", "x", String.class))
                .expectErrorMessage("kaput")
                .verify();

        ExecutionState state = stored("run-1");
        assertThat(state.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(state.failureReason()).isEqualTo("kaput");
        assertThat(leases.activeCount()).isZero();
    }

    @Test
    void submit_whileSameInstanceActive_isRejected() {
        StepVerifier.create(engine.submit("sleeper", "run-1", "x"))
                .assertNext(state -> assertThat(state.status()).isEqualTo(ExecutionStatus.RUNNING))
                .verifyComplete();
        assertThat(engine.isRunning("run-1")).isTrue();
        assertThat(stored("run-1").status()).isEqualTo(ExecutionStatus.WAITING);

        StepVerifier.create(engine.submit("sleeper", "run-1", "x"))
                .expectError(ExecutionAlreadyRunningException.class)
                .verify();
        assertThat(engine.runningCount()).isEqualTo(1);
    }

    @Test
    void submit_activeRecordInStore_isRejectedWithoutLease() {
        persistence.save(ExecutionState.started("run-1", "sleeper", "\"x\"", clock.instant())).block();

        StepVerifier.create(engine.submit("sleeper", "run-1", "x"))
                .expectError(ExecutionAlreadyRunningException.class)
                .verify();
        assertThat(leases.isHeld("run-1")).isFalse();
    }

    @Test
    void submit_afterTerminalRun_startsFreshRun() {
        engine.execute("greeter", "run-1", "first", String.class).block();

        StepVerifier.create(engine.execute("greeter", "run-1", "second", String.class))
                .expectNext("second!")
                .verifyComplete();
        assertThat(stored("run-1").journal()).hasSize(1);
    }

    @Test
    void sleeper_completesWhenTimerFires() {
        engine.submit("sleeper", "run-1", "zz").block();
        assertThat(echoCalls.get()).isZero();

        time.advanceTimeBy(Duration.ofMinutes(5));

        assertThat(stored("run-1").status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(echoCalls.get()).isEqualTo(1);
        assertThat(engine.isRunning("run-1")).isFalse();
    }

    @Test
    void shutdown_keepsRunActive_andResumeFinishesIt() {
        engine.submit("sleeper", "run-1", "zz").block();

        engine.shutdown();
        assertThat(engine.runningCount()).isZero();
        time.advanceTimeBy(Duration.ofMinutes(5));
        assertThat(stored("run-1").status()).isEqualTo(ExecutionStatus.WAITING);
        assertThat(echoCalls.get()).isZero();

        engine = newEngine(new ExecutionLeaseRegistry());
        StepVerifier.create(engine.resume("run-1"))
                .assertNext(state -> assertThat(state.status()).isEqualTo(ExecutionStatus.WAITING))
                .verifyComplete();

        assertThat(stored("run-1").status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(stored("run-1").output()).isEqualTo("\"zz!\"");
        assertThat(echoCalls.get()).isEqualTo(1);
    }

    @Test
    void resume_terminalRun_returnsItUnchanged() {
        engine.execute("greeter", "run-1", "hello", String.class).block();

        StepVerifier.create(engine.resume("run-1"))
                .assertNext(state -> assertThat(state.status()).isEqualTo(ExecutionStatus.COMPLETED))
                .verifyComplete();
        assertThat(echoCalls.get()).isEqualTo(1);
        assertThat(leases.isHeld("run-1")).isFalse();
    }

    @Test
    void resume_unknownInstance_failsWithNotFound() {
        StepVerifier.create(engine.resume("ghost"))
                .expectError(ExecutionNotFoundException.class)
                .verify();
        assertThat(leases.isHeld("ghost")).isFalse();
    }

    @Test
    void findOutput_onlyForTerminalRuns() {
        engine.submit("sleeper", "run-1", "zz").block();
        StepVerifier.create(engine.findOutput("run-1", String.class))
                .expectNext(Optional.empty())
                .verifyComplete();

        time.advanceTimeBy(Duration.ofMinutes(5));
        StepVerifier.create(engine.findOutput("run-1", String.class))
                .expectNext(Optional.of("zz!"))
                .verifyComplete();
    }

    private record TestWorkflow(String name, BiFunction<DurableContext, String, Mono<String>> body)
            implements DurableWorkflow<String, String> {

        @Override
        public Class<String> inputType() {
            return String.class;
        }

        @Override
        public Mono<String> run(DurableContext ctx, String input) {
            return body.apply(ctx, input);
        }
    }
}
