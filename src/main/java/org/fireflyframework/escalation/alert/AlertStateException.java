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

import org.fireflyframework.escalation.core.exception.OrchestrationException;

/**
 * The requested change is not allowed from the alert's current status.
 */
public class AlertStateException extends OrchestrationException {
    private final AlertStatus currentStatus;

    public AlertStateException(String alertId, AlertStatus currentStatus, String message) {
        super("Alert '" + alertId + "' is " + currentStatus + ": " + message, "ESCALATION_ALERT_INVALID_STATE");
        this.currentStatus = currentStatus;
    }

    public AlertStatus getCurrentStatus() {
        return currentStatus;
    }
}
