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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Who to page for a customer at one instant. The same member may appear in both tiers.
 */
public record OnCallCoverage(
        List<OnCallMember> primaryTier,
        List<OnCallMember> backupTier,
        EscalationPolicy policy,
        String planId
) {
    public OnCallCoverage {
        primaryTier = primaryTier != null ? List.copyOf(primaryTier) : List.of();
        backupTier = backupTier != null ? List.copyOf(backupTier) : List.of();
    }

    public static OnCallCoverage empty() {
        return new OnCallCoverage(List.of(), List.of(), null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return primaryTier.isEmpty() && backupTier.isEmpty();
    }

    public OnCallCoverage withDefaultPolicy(EscalationPolicy defaultPolicy) {
        return policy != null ? this : new OnCallCoverage(primaryTier, backupTier, defaultPolicy, planId);
    }
}
