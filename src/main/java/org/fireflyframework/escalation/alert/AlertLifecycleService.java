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
package org.fireflyframework.escalation.alert;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Every state change the escalation machinery applies to an alert. Each operation reads the
 * current record, applies one change and appends the matching timeline entry.
 *
 * <p>The operations are safe to repeat: attempts only move forward and a repeated call adds
 * at most one more timeline line.
 *
 * <p>Writes are conditional on the record that was read. A write that loses against a
 * concurrent change, such as an out-of-band acknowledgement, is re-applied to the fresh record.
 * Engine-side changes never take an alert out of a handled status.
 */
@Slf4j
public class AlertLifecycleService {

    public static final String SYSTEM_ACTOR = "system";

    static final int MAX_CONFLICT_RETRIES = 10;

    private static final Set<AlertStatus> PRE_ESCALATION = EnumSet.of(AlertStatus.RECEIVED, AlertStatus.CHECKING);

    private final AlertStore store;
    private final Clock clock;
    private final AlertStatusPolicy statusPolicy;

    public AlertLifecycleService(AlertStore store, Clock clock, AlertStatusPolicy statusPolicy) {
        this.store = store;
        this.clock = clock;
        this.statusPolicy = statusPolicy != null ? statusPolicy : AlertStatusPolicy.defaults();
    }

    public AlertLifecycleService(AlertStore store, Clock clock) {
        this(store, clock, AlertStatusPolicy.defaults());
    }

    public Mono<Alert> find(String alertId) {
        return store.get(alertId);
    }

    /**
     * Records that attempt {@code attempt} targets {@code targetUserId}. An alert still in intake
     * moves to PENDING. Completes empty, writing nothing, once the alert is handled.
     */
    public Mono<Alert> updateEscalationState(String alertId, int attempt, String targetUserId) {
        return mutate(alertId, (alert, now) -> {
            if (statusPolicy.isHandled(alert.status())) {
                return null;
            }
            Alert next = alert.withEscalation(attempt, targetUserId, now);
            if (PRE_ESCALATION.contains(alert.status())) {
                next = next.withStatus(AlertStatus.PENDING, now)
                        .withTimelineEntry(change(SYSTEM_ACTOR, "Escalation started", alert.status(), AlertStatus.PENDING, now));
            }
            return next;
        });
    }

    public Mono<Alert> recordNotificationResult(String alertId, String userName, boolean emailSent, boolean smsSent,
                                                String errorMessage, boolean backup) {
        return mutate(alertId, (alert, now) -> alert.withTimelineEntry(
                note(notificationSummary(userName, emailSent, smsSent, errorMessage, backup), alert.status(), now)));
    }

    /** No-op on a handled alert. */
    public Mono<Alert> markEscalated(String alertId, String reason) {
        return mutate(alertId, (alert, now) -> statusPolicy.isHandled(alert.status())
                ? alert
                : transitioned(alert, AlertStatus.ESCALATED, SYSTEM_ACTOR, reason, now));
    }

    /** A handled alert keeps its status and only gets the reason on its timeline. */
    public Mono<Alert> markFailed(String alertId, String reason) {
        return mutate(alertId, (alert, now) -> statusPolicy.isHandled(alert.status())
                ? alert.withTimelineEntry(note(reason, alert.status(), now))
                : transitioned(alert, AlertStatus.FAILED, SYSTEM_ACTOR, reason, now));
    }

    public Mono<Alert> addTimelineEntry(String alertId, String message) {
        return mutate(alertId, (alert, now) -> alert.withTimelineEntry(note(message, alert.status(), now)));
    }

    /**
     * Out-of-band acceptance by a responder. A resolved alert cannot be accepted.
     */
    public Mono<Alert> acknowledge(String alertId, String actor, String comment) {
        return mutate(alertId, (alert, now) -> {
            if (alert.status() == AlertStatus.RESOLVED) {
                throw new AlertStateException(alertId, alert.status(), "cannot acknowledge a resolved alert");
            }
            return alert.withStatus(AlertStatus.ACCEPTED, now)
                    .withTimelineEntry(change(actor, comment != null ? comment : "Alert acknowledged",
                            alert.status(), AlertStatus.ACCEPTED, now));
        });
    }

    public Mono<Alert> resolve(String alertId, String actor, String comment) {
        return mutate(alertId, (alert, now) -> transitioned(alert, AlertStatus.RESOLVED, actor,
                comment != null ? comment : "Alert resolved", now));
    }

    /**
     * Operator request to page again. Resolved alerts are rejected.
     */
    public Mono<Alert> requestManualEscalation(String alertId, String actor) {
        return mutate(alertId, (alert, now) -> {
            if (alert.status() == AlertStatus.RESOLVED) {
                throw new AlertStateException(alertId, alert.status(), "cannot escalate a resolved alert");
            }
            return alert.withStatus(AlertStatus.ESCALATED, now)
                    .withEscalation(alert.escalationAttempts() + 1, alert.currentEscalationTarget(), now)
                    .withTimelineEntry(change(actor, "Manual escalation to backup requested",
                            alert.status(), AlertStatus.ESCALATED, now));
        });
    }

    static String notificationSummary(String userName, boolean emailSent, boolean smsSent,
                                      String errorMessage, boolean backup) {
        String tier = backup ? "backup" : "primary";
        if (!emailSent && !smsSent) {
            return "Failed to notify " + tier + " on-call " + userName
                    + (errorMessage != null ? ": " + errorMessage : "");
        }
        StringBuilder sb = new StringBuilder("Notified ").append(tier).append(" on-call ").append(userName).append(" via ");
        if (emailSent && smsSent) {
            sb.append("email and SMS");
        } else {
            sb.append(emailSent ? "email" : "SMS");
        }
        if (errorMessage != null) {
            sb.append(" (").append(errorMessage).append(')');
        }
        return sb.toString();
    }

    private Alert transitioned(Alert alert, AlertStatus target, String actor, String comment, Instant now) {
        return alert.withStatus(target, now)
                .withTimelineEntry(change(actor, comment, alert.status(), target, now));
    }

    /**
     * Reads, applies {@code mutation} and writes back only if nobody changed the alert meanwhile.
     * A mutation returning the record it was given writes nothing; one returning {@code null}
     * completes empty.
     */
    private Mono<Alert> mutate(String alertId, Mutation mutation) {
        return Mono.defer(() -> store.get(alertId)
                        .switchIfEmpty(Mono.error(() -> new AlertNotFoundException(alertId)))
                        .flatMap(current -> {
                            Alert next = mutation.apply(current, clock.instant());
                            if (next == null || next == current) {
                                return Mono.justOrEmpty(next);
                            }
                            return store.replace(current, next)
                                    .switchIfEmpty(Mono.error(() -> new ConcurrentAlertUpdateException(alertId)))
                                    .doOnNext(alert -> log.debug("[alert] updated alertId={} status={} attempts={}",
                                            alert.id(), alert.status(), alert.escalationAttempts()));
                        }))
                .retryWhen(Retry.max(MAX_CONFLICT_RETRIES)
                        .filter(ConcurrentAlertUpdateException.class::isInstance)
                        .doBeforeRetry(signal -> log.debug("[alert] concurrent update of alertId={}, retrying", alertId))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private AlertChange note(String comment, AlertStatus status, Instant now) {
        return change(SYSTEM_ACTOR, comment, status, status, now);
    }

    private AlertChange change(String actor, String comment, AlertStatus from, AlertStatus to, Instant now) {
        return new AlertChange(UUID.randomUUID().toString(), actor, comment, from, to, now);
    }

    @FunctionalInterface
    private interface Mutation {
        Alert apply(Alert alert, Instant now);
    }
}
