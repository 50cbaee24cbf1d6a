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
package org.fireflyframework.escalation.orchestrator;

import org.fireflyframework.escalation.alert.Alert;
import org.fireflyframework.escalation.core.context.DurableContext;
import org.fireflyframework.escalation.core.engine.DurableWorkflow;
import org.fireflyframework.escalation.core.exception.ActivityFailureException;
import org.fireflyframework.escalation.core.exception.NonDeterministicReplayException;
import org.fireflyframework.escalation.core.observability.OrchestrationEvents;
import org.fireflyframework.escalation.coverage.EscalationPolicy;
import org.fireflyframework.escalation.coverage.OnCallCoverage;
import reactor.core.publisher.Mono;

import static org.fireflyframework.escalation.orchestrator.EscalationActivities.*;

/**
 * Durable workflow driving one alert from intake to a terminal escalation outcome.
 *
 * <p>Coverage is resolved at the run's logical time. With nobody on call the alert is marked
 * ESCALATED and nobody is paged. Any failure during the run marks the alert FAILED; only a replay
 * divergence is left to fail the run itself. An alert that disappears mid-run ends it
 * {@link EscalationOutcome#HANDLED_EXTERNALLY}.
 */
public class AlertOrchestrator implements DurableWorkflow<Alert, EscalationOutcome> {

    public static final String WORKFLOW_NAME = "alert-escalation";
    static final String NO_COVERAGE_REASON = "No on-call users configured - unable to send notifications";

    private final EscalationStateMachine stateMachine;
    private final EscalationPolicy defaultPolicy;
    private final OrchestrationEvents events;

    public AlertOrchestrator(EscalationStateMachine stateMachine, EscalationPolicy defaultPolicy, OrchestrationEvents events) {
        this.stateMachine = stateMachine;
        this.defaultPolicy = defaultPolicy != null ? defaultPolicy : EscalationPolicy.DEFAULT;
        this.events = events;
    }

    @Override
    public String name() {
        return WORKFLOW_NAME;
    }

    @Override
    public Class<Alert> inputType() {
        return Alert.class;
    }

    @Override
    public Mono<EscalationOutcome> run(DurableContext ctx, Alert alert) {
        ctx.logger().info("[escalation] orchestrating alertId={} customerId={} severity={}",
                alert.id(), alert.customerId(), alert.severity());
        return ctx.callActivity(RESOLVE_COVERAGE, new ResolveCoverageInput(alert.customerId(), ctx.currentTime()), OnCallCoverage.class)
                .flatMap(coverage -> {
                    if (coverage.isEmpty()) {
                        ctx.logger().warn("[escalation] no on-call users for alertId={} customerId={}",
                                alert.id(), alert.customerId());
                        return ctx.callActivity(MARK_ESCALATED, new MarkEscalatedInput(alert.id(), NO_COVERAGE_REASON), Alert.class)
                                .map(marked -> EscalationOutcome.NO_COVERAGE)
                                .defaultIfEmpty(EscalationOutcome.HANDLED_EXTERNALLY);
                    }
                    return stateMachine.run(ctx, alert, coverage.withDefaultPolicy(defaultPolicy));
                })
                .onErrorResume(error -> !(error instanceof NonDeterministicReplayException), error -> {
                    String message = error instanceof ActivityFailureException afe
                            ? afe.getFailureMessage() : ActivityFailureException.describe(error);
                    ctx.logger().error("[escalation] orchestration failed for alertId={}: {}", alert.id(), message);
                    return ctx.callActivity(MARK_FAILED, new MarkFailedInput(alert.id(), "Orchestration failed: " + message), Alert.class)
                            .map(marked -> EscalationOutcome.FAILED)
                            .defaultIfEmpty(EscalationOutcome.HANDLED_EXTERNALLY);
                })
                .doOnNext(outcome -> {
                    if (!ctx.isReplaying()) {
                        events.onEscalationFinished(alert.id(), outcome.name());
                    }
                });
    }
}
