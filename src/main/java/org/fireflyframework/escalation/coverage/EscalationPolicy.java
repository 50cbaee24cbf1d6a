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
package org.fireflyframework.escalation.coverage;

import java.time.Duration;
import java.util.Objects;

/**
 * @param ackTimeout         how long to wait for an acknowledgement after a delivered page
 * @param maxAttemptsPerTier how many members of each tier are paged, in tier order
 * @param retryDelay         carried from the on-call plan; the state machine does not wait on it
 */
public record EscalationPolicy(Duration ackTimeout, int maxAttemptsPerTier, Duration retryDelay) {

    public static final EscalationPolicy DEFAULT =
            new EscalationPolicy(Duration.ofMinutes(5), 3, Duration.ofMinutes(5));

    public EscalationPolicy {
        Objects.requireNonNull(ackTimeout, "ackTimeout");
        if (ackTimeout.isNegative()) {
            throw new IllegalArgumentException("ackTimeout must not be negative, got: " + ackTimeout);
        }
        if (maxAttemptsPerTier < 0) {
            throw new IllegalArgumentException("maxAttemptsPerTier must not be negative, got: " + maxAttemptsPerTier);
        }
        retryDelay = retryDelay != null ? retryDelay : Duration.ZERO;
    }
}
