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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.escalation.core.model.StepKind;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeOrchestrationEvents implements OrchestrationEvents {
    private final List<OrchestrationEvents> delegates;

    public CompositeOrchestrationEvents(List<OrchestrationEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    private void safeForEach(Consumer<OrchestrationEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    @Override public void onStart(String name, String instanceId) { safeForEach(d -> d.onStart(name, instanceId)); }
    @Override public void onResumed(String name, String instanceId, int journaledSteps) { safeForEach(d -> d.onResumed(name, instanceId, journaledSteps)); }
    @Override public void onCompleted(String name, String instanceId, boolean success, long durationMs) { safeForEach(d -> d.onCompleted(name, instanceId, success, durationMs)); }
    @Override public void onStepRecorded(String name, String instanceId, int stepIndex, StepKind kind, String stepName, long latencyMs) { safeForEach(d -> d.onStepRecorded(name, instanceId, stepIndex, kind, stepName, latencyMs)); }
    @Override public void onStepReplayed(String name, String instanceId, int stepIndex, StepKind kind, String stepName) { safeForEach(d -> d.onStepReplayed(name, instanceId, stepIndex, kind, stepName)); }
    @Override public void onActivityFailed(String name, String instanceId, String activityName, Throwable error) { safeForEach(d -> d.onActivityFailed(name, instanceId, activityName, error)); }
    @Override public void onReplayDivergence(String name, String instanceId, int stepIndex, String detail) { safeForEach(d -> d.onReplayDivergence(name, instanceId, stepIndex, detail)); }
    @Override public void onTimerScheduled(String name, String instanceId, String timerName, Instant deadline) { safeForEach(d -> d.onTimerScheduled(name, instanceId, timerName, deadline)); }
    @Override public void onTimerFired(String name, String instanceId, String timerName) { safeForEach(d -> d.onTimerFired(name, instanceId, timerName)); }
    @Override public void onNotificationAttempt(String alertId, String userId, boolean delivered) { safeForEach(d -> d.onNotificationAttempt(alertId, userId, delivered)); }
    @Override public void onEscalationFinished(String alertId, String outcome) { safeForEach(d -> d.onEscalationFinished(alertId, outcome)); }
}
