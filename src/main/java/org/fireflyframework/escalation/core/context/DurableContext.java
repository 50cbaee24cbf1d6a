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
package org.fireflyframework.escalation.core.context;

import org.fireflyframework.escalation.core.activity.ActivityHandler;
import org.fireflyframework.escalation.core.activity.ActivityRegistry;
import org.fireflyframework.escalation.core.exception.ActivityFailureException;
import org.fireflyframework.escalation.core.exception.NonDeterministicReplayException;
import org.fireflyframework.escalation.core.model.ExecutionStatus;
import org.fireflyframework.escalation.core.model.StepKind;
import org.fireflyframework.escalation.core.observability.OrchestrationEvents;
import org.fireflyframework.escalation.core.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.escalation.core.persistence.ExecutionState;
import org.fireflyframework.escalation.core.persistence.JournalEntry;
import org.fireflyframework.escalation.core.persistence.StateSerializer;
import org.fireflyframework.escalation.core.timer.DurableTimerService;
import org.slf4j.Logger;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Step API available to durable workflow code.
 *
 * <p>Every call claims the next step index when its {@code Mono} is subscribed. While the index
 * is covered by the journal loaded at construction the recorded outcome is returned without
 * running anything; afterwards the step runs live and its outcome is persisted before the
 * returned {@code Mono} emits. Workflow code must therefore request steps sequentially and
 * derive every decision from step results, {@link #currentTime()} and its input.
 *
 * <p>A journaled step that does not match the requested kind, name and input hash fails the
 * step with {@link NonDeterministicReplayException}.
 */
public class DurableContext {

    private final String instanceId;
    private final String workflowName;
    private final List<JournalEntry> recorded;
    private final AtomicReference<ExecutionState> state;
    private final AtomicInteger nextStep = new AtomicInteger();
    private final AtomicReference<Instant> logicalTime;
    private final ExecutionPersistenceProvider persistence;
    private final ActivityRegistry activities;
    private final DurableTimerService timers;
    private final StateSerializer serializer;
    private final OrchestrationEvents events;
    private final Clock clock;
    private final ReplaySafeLogger logger;

    public DurableContext(ExecutionState initial,
                          ExecutionPersistenceProvider persistence,
                          ActivityRegistry activities,
                          DurableTimerService timers,
                          StateSerializer serializer,
                          OrchestrationEvents events,
                          Clock clock,
                          Logger workflowLogger) {
        this.instanceId = initial.instanceId();
        this.workflowName = initial.workflowName();
        this.recorded = initial.journal();
        this.state = new AtomicReference<>(initial);
        this.logicalTime = new AtomicReference<>(initial.startedAt());
        this.persistence = persistence;
        this.activities = activities;
        this.timers = timers;
        this.serializer = serializer;
        this.events = events;
        this.clock = clock;
        this.logger = new ReplaySafeLogger(workflowLogger, this::isReplaying);
    }

    public String instanceId() {
        return instanceId;
    }

    public String workflowName() {
        return workflowName;
    }

    /**
     * True while the next step to be requested is answered from the journal.
     */
    public boolean isReplaying() {
        return nextStep.get() < recorded.size();
    }

    /**
     * Deterministic "now": the run start, advanced to each step's journal time and to each
     * timer's deadline as the run progresses. Identical on every replay.
     */
    public Instant currentTime() {
        return logicalTime.get();
    }

    public ReplaySafeLogger logger() {
        return logger;
    }

    /**
     * Invokes the activity registered under {@code name}, or returns its journaled outcome.
     * A failed activity surfaces as {@link ActivityFailureException}, live and on replay.
     */
    public <T> Mono<T> callActivity(String name, Object input, Class<T> resultType) {
        return Mono.defer(() -> {
            int index = nextStep.getAndIncrement();
            String inputHash = serializer.hash(input);
            Optional<JournalEntry> journaled = journaled(index, StepKind.ACTIVITY, name, inputHash);
            if (journaled.isPresent()) {
                JournalEntry entry = journaled.get();
                advanceLogicalTime(entry.recordedAt());
                events.onStepReplayed(workflowName, instanceId, index, StepKind.ACTIVITY, name);
                if (entry.failed()) {
                    return Mono.error(new ActivityFailureException(name, entry.error()));
                }
                return Mono.justOrEmpty(serializer.fromJson(entry.result(), resultType));
            }
            return invokeLive(index, name, input, inputHash, resultType);
        });
    }

    /**
     * Durable wait of {@code duration} measured from {@link #currentTime()}. The absolute deadline
     * is journaled; a resumed run only waits for whatever part of it is still in the future.
     */
    public Mono<Void> delay(String name, Duration duration) {
        return Mono.defer(() -> {
            int index = nextStep.getAndIncrement();
            String inputHash = serializer.hash(duration.toString());
            Optional<JournalEntry> journaled = journaled(index, StepKind.TIMER, name, inputHash);
            Mono<Instant> deadline;
            if (journaled.isPresent()) {
                events.onStepReplayed(workflowName, instanceId, index, StepKind.TIMER, name);
                deadline = Mono.just(serializer.fromJson(journaled.get().result(), Instant.class));
            } else {
                Instant fireAt = timers.deadlineFrom(currentTime(), duration);
                JournalEntry entry = JournalEntry.success(index, StepKind.TIMER, name, inputHash,
                        serializer.toJson(fireAt), clock.instant());
                deadline = append(entry, ExecutionStatus.WAITING, 0)
                        .then(Mono.fromRunnable(() -> events.onTimerScheduled(workflowName, instanceId, name, fireAt)))
                        .thenReturn(fireAt);
            }
            return deadline
                    .flatMap(timers::awaitDeadline)
                    .doOnNext(fired -> {
                        advanceLogicalTime(fired);
                        if (!isReplaying()) {
                            events.onTimerFired(workflowName, instanceId, name);
                        }
                    })
                    .then();
        });
    }

    /**
     * Records the value produced by {@code supplier} once and returns the recorded value on replay.
     */
    public <T> Mono<T> sideEffect(String name, Supplier<T> supplier, Class<T> resultType) {
        return Mono.defer(() -> {
            int index = nextStep.getAndIncrement();
            String inputHash = serializer.hash(null);
            Optional<JournalEntry> journaled = journaled(index, StepKind.SIDE_EFFECT, name, inputHash);
            if (journaled.isPresent()) {
                JournalEntry entry = journaled.get();
                advanceLogicalTime(entry.recordedAt());
                events.onStepReplayed(workflowName, instanceId, index, StepKind.SIDE_EFFECT, name);
                return Mono.justOrEmpty(serializer.fromJson(entry.result(), resultType));
            }
            T value = supplier.get();
            JournalEntry entry = JournalEntry.success(index, StepKind.SIDE_EFFECT, name, inputHash,
                    serializer.toJson(value), clock.instant());
            return append(entry, ExecutionStatus.RUNNING, 0).then(Mono.justOrEmpty(value));
        });
    }

    public Mono<String> newUuid() {
        return sideEffect("uuid", () -> UUID.randomUUID().toString(), String.class);
    }

    /** Marks the run COMPLETED with its serialized output. */
    public Mono<ExecutionState> complete(Object output) {
        return Mono.defer(() -> {
            ExecutionState next = state.updateAndGet(s -> s.completed(serializer.toJson(output), clock.instant()));
            return persistence.save(next).thenReturn(next);
        }).doOnSuccess(s -> events.onCompleted(workflowName, instanceId, true, elapsedMillis(s)));
    }

    /** Marks the run FAILED. */
    public Mono<ExecutionState> fail(Throwable error) {
        return Mono.defer(() -> {
            ExecutionState next = state.updateAndGet(s -> s.failed(ActivityFailureException.describe(error), clock.instant()));
            return persistence.save(next).thenReturn(next);
        }).doOnSuccess(s -> events.onCompleted(workflowName, instanceId, false, elapsedMillis(s)));
    }

    public ExecutionState snapshot() {
        return state.get();
    }

    private <T> Mono<T> invokeLive(int index, String name, Object input, String inputHash, Class<T> resultType) {
        ActivityHandler<Object, Object> handler = activities.get(name);
        long startNanos = System.nanoTime();
        return Mono.defer(() -> handler.execute(input))
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .onErrorResume(err -> {
                    String message = ActivityFailureException.describe(err);
                    events.onActivityFailed(workflowName, instanceId, name, err);
                    JournalEntry entry = JournalEntry.failure(index, name, inputHash, message, clock.instant());
                    return append(entry, ExecutionStatus.RUNNING, elapsedSince(startNanos))
                            .then(Mono.<Optional<Object>>error(new ActivityFailureException(name, message, err)));
                })
                .flatMap(result -> {
                    JournalEntry entry = JournalEntry.success(index, StepKind.ACTIVITY, name, inputHash,
                            serializer.toJson(result.orElse(null)), clock.instant());
                    return append(entry, ExecutionStatus.RUNNING, elapsedSince(startNanos))
                            .then(Mono.justOrEmpty(result.map(resultType::cast)));
                });
    }

    private Optional<JournalEntry> journaled(int index, StepKind kind, String name, String inputHash) {
        if (index >= recorded.size()) {
            return Optional.empty();
        }
        JournalEntry entry = recorded.get(index);
        if (entry.kind() != kind || !entry.name().equals(name) || !entry.inputHash().equals(inputHash)) {
            String requested = kind + ":" + name + "#" + inputHash;
            events.onReplayDivergence(workflowName, instanceId, index, entry.describe() + " != " + requested);
            throw new NonDeterministicReplayException(index, entry.describe(), requested);
        }
        return Optional.of(entry);
    }

    private Mono<Void> append(JournalEntry entry, ExecutionStatus status, long latencyMs) {
        return Mono.defer(() -> {
            ExecutionState next = state.updateAndGet(s -> s.withJournalEntry(entry, status, clock.instant()));
            return persistence.save(next);
        }).doOnSuccess(v -> {
            if (entry.kind() != StepKind.TIMER) {
                advanceLogicalTime(entry.recordedAt());
            }
            events.onStepRecorded(workflowName, instanceId, entry.stepIndex(), entry.kind(), entry.name(), latencyMs);
        });
    }

    private void advanceLogicalTime(Instant candidate) {
        if (candidate != null) {
            logicalTime.accumulateAndGet(candidate, (current, next) -> next.isAfter(current) ? next : current);
        }
    }

    private long elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    private long elapsedMillis(ExecutionState s) {
        return s.startedAt() != null && s.updatedAt() != null
                ? Duration.between(s.startedAt(), s.updatedAt()).toMillis() : 0L;
    }
}
