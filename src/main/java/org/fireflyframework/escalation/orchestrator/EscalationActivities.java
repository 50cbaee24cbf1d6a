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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.escalation.alert.Alert;
import org.fireflyframework.escalation.alert.AlertLifecycleService;
import org.fireflyframework.escalation.alert.AlertNotFoundException;
import org.fireflyframework.escalation.alert.AlertSeverity;
import org.fireflyframework.escalation.core.activity.ActivityRegistry;
import org.fireflyframework.escalation.core.exception.ActivityFailureException;
import org.fireflyframework.escalation.core.observability.OrchestrationEvents;
import org.fireflyframework.escalation.coverage.CoverageResolver;
import org.fireflyframework.escalation.coverage.OnCallMember;
import org.fireflyframework.escalation.notification.NotificationDispatcher;
import org.fireflyframework.escalation.notification.NotificationMessageBuilder;
import org.fireflyframework.escalation.notification.NotificationRequest;
import org.fireflyframework.escalation.notification.NotificationResult;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * The side-effecting steps of an escalation run, registered under stable activity names. The
 * input records are hashed into the journal, so their shape is part of the persisted format.
 */
@Slf4j
public class EscalationActivities {

    public static final String GET_ALERT = "GetAlert";
    public static final String RESOLVE_COVERAGE = "ResolveCoverage";
    public static final String UPDATE_ESCALATION_STATE = "UpdateEscalationState";
    public static final String SEND_NOTIFICATION = "SendNotification";
    public static final String RECORD_NOTIFICATION_RESULT = "RecordNotificationResult";
    public static final String MARK_ESCALATED = "MarkEscalated";
    public static final String MARK_FAILED = "MarkFailed";
    public static final String ADD_TIMELINE_ENTRY = "AddTimelineEntry";

    public record GetAlertInput(String alertId) {}

    public record ResolveCoverageInput(String customerId, Instant asOf) {}

    public record UpdateEscalationStateInput(String alertId, int attempt, String targetUserId) {}

    public record SendNotificationInput(String notificationId, String alertId, AlertSeverity severity, String title,
                                        String description, String resourceId, OnCallMember member, boolean backup) {}

    public record RecordNotificationResultInput(String alertId, String userName, boolean emailSent, boolean smsSent,
                                                String errorMessage, boolean backup) {}

    public record MarkEscalatedInput(String alertId, String reason) {}

    public record MarkFailedInput(String alertId, String reason) {}

    public record AddTimelineEntryInput(String alertId, String message) {}

    private final AlertLifecycleService lifecycle;
    private final CoverageResolver coverageResolver;
    private final NotificationDispatcher dispatcher;
    private final NotificationMessageBuilder messages;
    private final OrchestrationEvents events;

    public EscalationActivities(AlertLifecycleService lifecycle, CoverageResolver coverageResolver,
                                NotificationDispatcher dispatcher, NotificationMessageBuilder messages,
                                OrchestrationEvents events) {
        this.lifecycle = lifecycle;
        this.coverageResolver = coverageResolver;
        this.dispatcher = dispatcher;
        this.messages = messages;
        this.events = events;
    }

    /**
     * Registers every step. Steps that write the alert complete empty once the alert is gone,
     * which the workflow reads as "handled elsewhere".
     */
    public ActivityRegistry registerAll(ActivityRegistry registry) {
        return registry
                .register(GET_ALERT, (GetAlertInput in) -> lifecycle.find(in.alertId()))
                .register(RESOLVE_COVERAGE, (ResolveCoverageInput in) -> coverageResolver.resolve(in.customerId(), in.asOf()))
                .register(UPDATE_ESCALATION_STATE, (UpdateEscalationStateInput in) ->
                        ifPresent(lifecycle.updateEscalationState(in.alertId(), in.attempt(), in.targetUserId())))
                .register(SEND_NOTIFICATION, (SendNotificationInput in) -> sendNotification(in))
                .register(RECORD_NOTIFICATION_RESULT, (RecordNotificationResultInput in) ->
                        ifPresent(lifecycle.recordNotificationResult(in.alertId(), in.userName(), in.emailSent(),
                                in.smsSent(), in.errorMessage(), in.backup())))
                .register(MARK_ESCALATED, (MarkEscalatedInput in) -> ifPresent(lifecycle.markEscalated(in.alertId(), in.reason())))
                .register(MARK_FAILED, (MarkFailedInput in) -> ifPresent(lifecycle.markFailed(in.alertId(), in.reason())))
                .register(ADD_TIMELINE_ENTRY, (AddTimelineEntryInput in) ->
                        ifPresent(lifecycle.addTimelineEntry(in.alertId(), in.message())));
    }

    private static Mono<Alert> ifPresent(Mono<Alert> write) {
        return write.onErrorResume(AlertNotFoundException.class, e -> {
            log.info("[escalation] {}, skipping write", e.getMessage());
            return Mono.empty();
        });
    }

    Mono<NotificationResult> sendNotification(SendNotificationInput in) {
        OnCallMember member = in.member();
        NotificationRequest request = new NotificationRequest(in.notificationId(), in.alertId(), member.userId(),
                member.displayName(), member.email(), member.phone(),
                messages.subject(in.severity(), in.title()),
                messages.body(in.severity(), in.title(), in.description(), in.resourceId()),
                messages.shortMessage(in.severity(), in.title()));
        return dispatcher.send(request)
                .onErrorResume(e -> {
                    log.warn("[notification] dispatcher failed alertId={} userId={} error={}",
                            in.alertId(), member.userId(), e.getMessage());
                    return Mono.just(NotificationResult.failed(ActivityFailureException.describe(e)));
                })
                .doOnNext(result -> events.onNotificationAttempt(in.alertId(), member.userId(), result.isDelivered()));
    }
}
