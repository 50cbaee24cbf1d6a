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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.escalation.core.activity.ActivityRegistry;
import org.fireflyframework.escalation.core.context.DurableContext;
import org.fireflyframework.escalation.core.exception.ExecutionAlreadyRunningException;
import org.fireflyframework.escalation.core.exception.ExecutionNotFoundException;
import org.fireflyframework.escalation.core.lease.ExecutionLeaseRegistry;
import org.fireflyframework.escalation.core.observability.OrchestrationEvents;
import org.fireflyframework.escalation.core.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.escalation.core.persistence.ExecutionState;
import org.fireflyframework.escalation.core.persistence.StateSerializer;
import org.fireflyframework.escalation.core.timer.DurableTimerService;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts, resumes and tracks durable runs.
 *
 * <p>A run is keyed by its instance id. Only one run per id may be active: the in-process lease
 * guards concurrent starts and the persisted status guards against a run that is still active
 * in the store. A terminal run may be replaced by a new one.
 *
 * <p>Runs are subscribed on the worker scheduler; durable waits park on the timer scheduler and
 * hold no worker thread. {@link #shutdown()} cancels every run in flight without touching the
 * store, exactly like a process crash, so the runs are picked up again by {@link #resume}.
 */
@Slf4j
public class DurableExecutionEngine {

    private final WorkflowRegistry workflows;
    private final ActivityRegistry activities;
    private final ExecutionPersistenceProvider persistence;
    private final DurableTimerService timers;
    private final StateSerializer serializer;
    private final ExecutionLeaseRegistry leases;
    private final OrchestrationEvents events;
    private final Clock clock;
    private final Scheduler worker;
    private final ConcurrentHashMap<String, Disposable.Swap> running = new ConcurrentHashMap<>();

    public DurableExecutionEngine(WorkflowRegistry workflows,
                                  ActivityRegistry activities,
                                  ExecutionPersistenceProvider persistence,
                                  DurableTimerService timers,
                                  StateSerializer serializer,
                                  ExecutionLeaseRegistry leases,
                                  OrchestrationEvents events,
                                  Clock clock,
                                  Scheduler worker) {
        this.workflows = workflows;
        this.activities = activities;
        this.persistence = persistence;
        this.timers = timers;
        this.serializer = serializer;
        this.leases = leases;
        this.events = events;
        this.clock = clock;
        this.worker = worker;
    }

    /**
     * Starts a run and completes with its output once the workflow finishes.
     */
    public <O> Mono<O> execute(String workflowName, String instanceId, Object input, Class<O> outputType) {
        return Mono.defer(() -> {
            DurableWorkflow<Object, Object> workflow = lookup(workflowName);
            return start(workflow, instanceId, input)
                    .flatMap(state -> drive(workflow, state))
                    .map(outputType::cast);
        });
    }

    /**
     * Starts a run in the background and emits its initial record once it is persisted.
     */
    public Mono<ExecutionState> submit(String workflowName, String instanceId, Object input) {
        return Mono.defer(() -> {
            DurableWorkflow<Object, Object> workflow = lookup(workflowName);
            return start(workflow, instanceId, input)
                    .doOnNext(state -> launch(workflow, state));
        });
    }

    /**
     * Re-attaches to a persisted run. An active run is replayed from its journal in the background;
     * a terminal run is returned as is.
     */
    public Mono<ExecutionState> resume(String instanceId) {
        return Mono.defer(() -> {
            if (!leases.tryAcquire(instanceId)) {
                return Mono.error(new ExecutionAlreadyRunningException(instanceId));
            }
            return persistence.findById(instanceId)
                    .flatMap(found -> {
                        if (found.isEmpty()) {
                            return Mono.error(new ExecutionNotFoundException(instanceId));
                        }
                        ExecutionState state = found.get();
                        if (state.isTerminal()) {
                            leases.release(instanceId);
                            return Mono.just(state);
                        }
                        DurableWorkflow<Object, Object> workflow = lookup(state.workflowName());
                        events.onResumed(workflow.name(), instanceId, state.journal().size());
                        launch(workflow, state);
                        return Mono.just(state);
                    })
                    .doOnError(e -> leases.release(instanceId));
        });
    }

    public Mono<Optional<ExecutionState>> findExecution(String instanceId) {
        return persistence.findById(instanceId);
    }

    public <O> Mono<Optional<O>> findOutput(String instanceId, Class<O> outputType) {
        return persistence.findById(instanceId)
                .map(found -> found
                        .filter(ExecutionState::isTerminal)
                        .map(ExecutionState::output)
                        .map(json -> serializer.fromJson(json, outputType)));
    }

    public boolean isRunning(String instanceId) {
        return running.containsKey(instanceId);
    }

    public int runningCount() {
        return running.size();
    }

    /**
     * Cancels every run in flight. Persisted records stay as they are.
     */
    public void shutdown() {
        log.info("[engine] shutting down, cancelling {} in-flight run(s)", running.size());
        running.values().forEach(Disposable::dispose);
        running.clear();
    }

    private DurableWorkflow<Object, Object> lookup(String workflowName) {
        return workflows.get(workflowName)
                .orElseThrow(() -> new ExecutionNotFoundException(workflowName));
    }

    private Mono<ExecutionState> start(DurableWorkflow<Object, Object> workflow, String instanceId, Object input) {
        if (!leases.tryAcquire(instanceId)) {
            return Mono.error(new ExecutionAlreadyRunningException(instanceId));
        }
        return persistence.findById(instanceId)
                .flatMap(existing -> {
                    if (existing.filter(ExecutionState::isActive).isPresent()) {
                        return Mono.<ExecutionState>error(new ExecutionAlreadyRunningException(instanceId));
                    }
                    if (existing.isPresent()) {
                        log.info("[engine] replacing terminal run instanceId={} status={}",
                                instanceId, existing.get().status());
                    }
                    ExecutionState state = ExecutionState.started(instanceId, workflow.name(),
                            serializer.toJson(input), clock.instant());
                    return persistence.save(state).thenReturn(state);
                })
                .doOnNext(state -> events.onStart(workflow.name(), instanceId))
                .doOnError(e -> leases.release(instanceId));
    }

    private void launch(DurableWorkflow<Object, Object> workflow, ExecutionState state) {
        String instanceId = state.instanceId();
        Disposable.Swap slot = Disposables.swap();
        running.put(instanceId, slot);
        slot.update(drive(workflow, state)
                .doFinally(signal -> running.remove(instanceId, slot))
                .subscribe(
                        output -> log.debug("[engine] run finished instanceId={} output={}", instanceId, output),
                        error -> log.warn("[engine] run failed instanceId={} error={}", instanceId, error.getMessage())));
    }

    private Mono<Object> drive(DurableWorkflow<Object, Object> workflow, ExecutionState state) {
        String instanceId = state.instanceId();
        DurableContext ctx = new DurableContext(state, persistence, activities, timers, serializer, events, clock,
                LoggerFactory.getLogger(workflow.getClass()));
        return Mono.defer(() -> workflow.run(ctx, serializer.fromJson(state.input(), workflow.inputType())))
                .flatMap(output -> ctx.complete(output).thenReturn(output))
                .switchIfEmpty(Mono.defer(() -> ctx.complete(null).then(Mono.empty())))
                .onErrorResume(error -> ctx.fail(error).then(Mono.error(error)))
                .doFinally(signal -> leases.release(instanceId))
                .subscribeOn(worker);
    }
}
