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
package org.fireflyframework.escalation.notification;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Per-channel outcome. {@code error} holds the first channel failure, if any.
 */
public record NotificationResult(boolean emailSent, boolean smsSent, String error) {

    public static NotificationResult failed(String error) {
        return new NotificationResult(false, false, error);
    }

    /** At least one channel accepted the message. */
    @JsonIgnore
    public boolean isDelivered() {
        return emailSent || smsSent;
    }
}
