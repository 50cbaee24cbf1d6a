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

import java.util.EnumSet;
import java.util.Set;

/**
 * Statuses that mean a human has taken the alert over and automated paging must stop.
 */
public class AlertStatusPolicy {

    public static final Set<AlertStatus> DEFAULT_HANDLED = EnumSet.of(AlertStatus.ACCEPTED, AlertStatus.RESOLVED);

    private final Set<AlertStatus> handled;

    public AlertStatusPolicy(Set<AlertStatus> handled) {
        this.handled = handled == null || handled.isEmpty() ? DEFAULT_HANDLED : EnumSet.copyOf(handled);
    }

    public static AlertStatusPolicy defaults() {
        return new AlertStatusPolicy(DEFAULT_HANDLED);
    }

    public boolean isHandled(AlertStatus status) {
        return status != null && handled.contains(status);
    }

    public Set<AlertStatus> handledStatuses() {
        return Set.copyOf(handled);
    }
}
