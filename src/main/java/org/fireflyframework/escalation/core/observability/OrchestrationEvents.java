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
package org.fireflyframework.escalation.core.observability;

import org.fireflyframework.escalation.core.model.StepKind;

import java.time.Instant;

public interface OrchestrationEvents {
    // Run lifecycle
    default void onStart(String name, String instanceId) {}
    default void onResumed(String name, String instanceId, int journaledSteps) {}
    default void onCompleted(String name, String instanceId, boolean success, long durationMs) {}

    // Journal
    default void onStepRecorded(String name, String instanceId, int stepIndex, StepKind kind, String stepName, long latencyMs) {}
    default void onStepReplayed(String name, String instanceId, int stepIndex, StepKind kind, String stepName) {}
    default void onActivityFailed(String name, String instanceId, String activityName, Throwable error) {}
    default void onReplayDivergence(String name, String instanceId, int stepIndex, String detail) {}

    // Timers
    default void onTimerScheduled(String name, String instanceId, String timerName, Instant deadline) {}
    default void onTimerFired(String name, String instanceId, String timerName) {}

    // Escalation
    default void onNotificationAttempt(String alertId, String userId, boolean delivered) {}
    default void onEscalationFinished(String alertId, String outcome) {}
}
