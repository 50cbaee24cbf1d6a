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
import org.fireflyframework.escalation.alert.AlertStatusPolicy;
import org.fireflyframework.escalation.core.context.DurableContext;
import org.fireflyframework.escalation.coverage.EscalationPolicy;
import org.fireflyframework.escalation.coverage.OnCallCoverage;
import org.fireflyframework.escalation.coverage.OnCallMember;
import org.fireflyframework.escalation.notification.NotificationResult;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.fireflyframework.escalation.orchestrator.EscalationActivities.*;

/**
 * Two-tier paging loop.
 *
 * <p>For each tier, primary first, up to {@code maxAttemptsPerTier} members are paged in order.
 * Before every page the alert is re-read; once it is gone or in a handled status the run stops
 * with {@link EscalationOutcome#HANDLED_EXTERNALLY}. A page that reached at least one channel
 * is followed by a durable wait of {@code ackTimeout}; a page that reached nobody moves on
 * immediately. The backup tier is entered only when the primary tier did not get the alert
 * handled, and is announced by marking the alert ESCALATED. After the last tier the run ends
 * {@link EscalationOutcome#EXHAUSTED} with a timeline note and the alert status left as is.
 *
 * <p>Attempt numbers continue from the attempts already on the input alert.
 */
public class EscalationStateMachine {

    static final String ACK_TIMER = "ack-timeout";
    static final String ESCALATE_TO_BACKUP_REASON = "Primary on-call did not respond. Escalating to backup.";

    private final AlertStatusPolicy statusPolicy;

    public EscalationStateMachine(AlertStatusPolicy statusPolicy) {
        this.statusPolicy = statusPolicy;
    }

    public Mono<EscalationOutcome> run(DurableContext ctx, Alert alert, OnCallCoverage coverage) {
        EscalationPolicy policy = coverage.policy();
        List<OnCallMember> primary = cap(coverage.primaryTier(), policy.maxAttemptsPerTier());
        List<OnCallMember> backup = cap(coverage.backupTier(), policy.maxAttemptsPerTier());
        Tier primaryTier = new Tier(primary, false, alert.escalationAttempts());
        Tier backupTier = new Tier(backup, true, alert.escalationAttempts() + primary.size());

        ctx.logger().info("[escalation] starting alertId={} primary={} backup={} ackTimeout={}",
                alert.id(), primary.size(), backup.size(), policy.ackTimeout());

        return page(ctx, alert.id(), primaryTier, policy, 0)
                .flatMap(handled -> handled ? Mono.just(true) : isHandled(ctx, alert.id()))
                .flatMap(handled -> {
                    if (handled) {
                        return Mono.just(true);
                    }
                    if (backup.isEmpty()) {
                        return Mono.just(false);
                    }
                    ctx.logger().info("[escalation] primary did not respond, escalating alertId={} to backup", alert.id());
                    return ctx.callActivity(MARK_ESCALATED, new MarkEscalatedInput(alert.id(), ESCALATE_TO_BACKUP_REASON), Alert.class)
                            .then(page(ctx, alert.id(), backupTier, policy, 0));
                })
                .flatMap(handled -> handled ? Mono.just(true) : isHandled(ctx, alert.id()))
                .flatMap(handled -> {
                    if (handled) {
                        ctx.logger().info("[escalation] alertId={} handled externally", alert.id());
                        return Mono.just(EscalationOutcome.HANDLED_EXTERNALLY);
                    }
                    int total = primary.size() + backup.size();
                    ctx.logger().warn("[escalation] all {} notification attempts exhausted for alertId={}", total, alert.id());
                    return ctx.callActivity(ADD_TIMELINE_ENTRY, new AddTimelineEntryInput(alert.id(),
                                    "All " + total + " notification attempts completed without response"), Alert.class)
                            .map(noted -> EscalationOutcome.EXHAUSTED)
                            .defaultIfEmpty(EscalationOutcome.HANDLED_EXTERNALLY);
                });
    }

    /**
     * Pages the tier from {@code index} on. Emits {@code true} as soon as the alert turns out to be handled.
     */
    private Mono<Boolean> page(DurableContext ctx, String alertId, Tier tier, EscalationPolicy policy, int index) {
        if (index >= tier.members().size()) {
            return Mono.just(false);
        }
        return isHandled(ctx, alertId)
                .flatMap(handled -> handled
                        ? Mono.just(true)
                        : notify(ctx, alertId, tier, policy, index)
                                .flatMap(gone -> gone ? Mono.just(true) : page(ctx, alertId, tier, policy, index + 1)));
    }

    private Mono<Boolean> notify(DurableContext ctx, String alertId, Tier tier, EscalationPolicy policy, int index) {
        OnCallMember member = tier.members().get(index);
        int attempt = tier.attemptBase() + index + 1;
        ctx.logger().info("[escalation] notifying {} member {} for alertId={} attempt={}",
                tier.label(), member.label(), alertId, attempt);
        return ctx.callActivity(UPDATE_ESCALATION_STATE, new UpdateEscalationStateInput(alertId, attempt, member.userId()), Alert.class)
                .flatMap(current -> ctx.newUuid()
                        .flatMap(notificationId -> ctx.callActivity(SEND_NOTIFICATION,
                                new SendNotificationInput(notificationId, alertId, current.severity(), current.title(),
                                        current.description(), current.resourceId(), member, tier.backup()),
                                NotificationResult.class))
                        .flatMap(result -> ctx.callActivity(RECORD_NOTIFICATION_RESULT,
                                        new RecordNotificationResultInput(alertId, member.label(), result.emailSent(),
                                                result.smsSent(), result.error(), tier.backup()), Alert.class)
                                .flatMap(recorded -> Mono.defer(() -> awaitAcknowledgement(ctx, result, policy))
                                        .thenReturn(false))))
                .defaultIfEmpty(true);
    }

    private Mono<Void> awaitAcknowledgement(DurableContext ctx, NotificationResult result, EscalationPolicy policy) {
        if (!result.isDelivered()) {
            ctx.logger().warn("[escalation] notification not delivered on any channel, moving on");
            return Mono.empty();
        }
        return ctx.delay(ACK_TIMER, policy.ackTimeout());
    }

    private Mono<Boolean> isHandled(DurableContext ctx, String alertId) {
        return ctx.callActivity(GET_ALERT, new GetAlertInput(alertId), Alert.class)
                .map(current -> {
                    boolean handled = statusPolicy.isHandled(current.status());
                    if (handled) {
                        ctx.logger().info("[escalation] alertId={} is {}, stopping", alertId, current.status());
                    }
                    return handled;
                })
                .defaultIfEmpty(true);
    }

    private static List<OnCallMember> cap(List<OnCallMember> members, int max) {
        return members.size() > max ? List.copyOf(members.subList(0, max)) : members;
    }

    private record Tier(List<OnCallMember> members, boolean backup, int attemptBase) {
        String label() {
            return backup ? "backup" : "primary";
        }
    }
}
