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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Alert record. Immutable; every mutation returns a copy with {@code updatedAt} moved forward.
 * The timeline only ever grows and {@code escalationAttempts} never decreases.
 */
public record Alert(
        String id,
        String customerId,
        String resourceId,
        AlertStatus status,
        AlertSeverity severity,
        String title,
        String description,
        int escalationAttempts,
        String currentEscalationTarget,
        List<AlertChange> timeline,
        Instant createdAt,
        Instant updatedAt,
        Instant resolvedAt
) {
    public Alert {
        timeline = timeline != null ? List.copyOf(timeline) : List.of();
        severity = severity != null ? severity : AlertSeverity.MEDIUM;
        status = status != null ? status : AlertStatus.RECEIVED;
    }

    public static Alert received(String id, String customerId, String resourceId, AlertSeverity severity,
                                 String title, String description, Instant now) {
        return new Alert(id, customerId, resourceId, AlertStatus.RECEIVED, severity, title, description,
                0, null, List.of(), now, now, null);
    }

    public Alert withStatus(AlertStatus newStatus, Instant now) {
        Instant resolved = newStatus == AlertStatus.RESOLVED ? now : resolvedAt;
        return new Alert(id, customerId, resourceId, newStatus, severity, title, description,
                escalationAttempts, currentEscalationTarget, timeline, createdAt, now, resolved);
    }

    public Alert withEscalation(int attempts, String target, Instant now) {
        return new Alert(id, customerId, resourceId, status, severity, title, description,
                Math.max(escalationAttempts, attempts), target, timeline, createdAt, now, resolvedAt);
    }

    public Alert withTimelineEntry(AlertChange change) {
        List<AlertChange> next = new ArrayList<>(timeline);
        next.add(change);
        return new Alert(id, customerId, resourceId, status, severity, title, description,
                escalationAttempts, currentEscalationTarget, next, createdAt, change.timestamp(), resolvedAt);
    }
}
