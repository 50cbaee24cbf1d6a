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
package org.fireflyframework.escalation.service;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.escalation.alert.Alert;
import org.fireflyframework.escalation.alert.AlertLifecycleService;
import org.fireflyframework.escalation.alert.AlertStore;
import org.fireflyframework.escalation.core.engine.DurableExecutionEngine;
import org.fireflyframework.escalation.core.exception.ExecutionAlreadyRunningException;
import org.fireflyframework.escalation.core.persistence.ExecutionState;
import org.fireflyframework.escalation.orchestrator.AlertOrchestrator;
import org.fireflyframework.escalation.orchestrator.EscalationOutcome;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Entry point for alert escalation. One escalation run per alert id; the run id is the alert id.
 */
@Slf4j
public class EscalationService {

    private final DurableExecutionEngine engine;
    private final AlertStore alertStore;
    private final AlertLifecycleService lifecycle;

    public EscalationService(DurableExecutionEngine engine, AlertStore alertStore, AlertLifecycleService lifecycle) {
        this.engine = engine;
        this.alertStore = alertStore;
        this.lifecycle = lifecycle;
    }

    /**
     * Starts escalating {@code alert} in the background. Fails with
     * {@link org.fireflyframework.escalation.core.exception.ExecutionAlreadyRunningException}
     * while a run for the same alert is still active.
     */
    public Mono<ExecutionState> escalate(Alert alert) {
        log.info("[escalation] escalate requested alertId={} customerId={}", alert.id(), alert.customerId());
        return engine.submit(AlertOrchestrator.WORKFLOW_NAME, alert.id(), alert);
    }

    /**
     * Stores a newly received alert and starts escalating it.
     */
    public Mono<ExecutionState> ingest(Alert alert) {
        return alertStore.create(alert).flatMap(this::escalate);
    }

    /**
     * Escalates and completes with the outcome once the run ends.
     */
    public Mono<EscalationOutcome> escalateAndAwait(Alert alert) {
        return engine.execute(AlertOrchestrator.WORKFLOW_NAME, alert.id(), alert, EscalationOutcome.class);
    }

    public Mono<Alert> acknowledge(String alertId, String actor, String comment) {
        return lifecycle.acknowledge(alertId, actor, comment)
                .doOnNext(alert -> log.info("[escalation] alertId={} acknowledged by {}", alertId, actor));
    }

    public Mono<Alert> resolve(String alertId, String actor, String comment) {
        return lifecycle.resolve(alertId, actor, comment)
                .doOnNext(alert -> log.info("[escalation] alertId={} resolved by {}", alertId, actor));
    }

    /**
     * Operator-requested re-escalation: marks the alert ESCALATED, counts one more attempt and
     * starts a fresh run from the updated alert. Rejected, leaving the alert untouched, while a
     * run for the alert is still active.
     */
    public Mono<ExecutionState> requestManualEscalation(String alertId, String actor) {
        return engine.findExecution(alertId)
                .flatMap(run -> engine.isRunning(alertId) || run.filter(ExecutionState::isActive).isPresent()
                        ? Mono.<Alert>error(new ExecutionAlreadyRunningException(alertId))
                        : lifecycle.requestManualEscalation(alertId, actor))
                .doOnNext(alert -> log.info("[escalation] manual escalation alertId={} requestedBy={}", alertId, actor))
                .flatMap(this::escalate);
    }

    public Mono<Optional<ExecutionState>> findRun(String alertId) {
        return engine.findExecution(alertId);
    }

    public Mono<Optional<EscalationOutcome>> findOutcome(String alertId) {
        return engine.findOutput(alertId, EscalationOutcome.class);
    }
}
