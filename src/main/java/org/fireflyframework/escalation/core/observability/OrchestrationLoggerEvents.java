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

@Slf4j
public class OrchestrationLoggerEvents implements OrchestrationEvents {
    @Override
    public void onStart(String name, String instanceId) {
        log.info("[engine] started name={} instanceId={}", name, instanceId);
    }
    @Override
    public void onResumed(String name, String instanceId, int journaledSteps) {
        log.info("[engine] resumed name={} instanceId={} journaledSteps={}", name, instanceId, journaledSteps);
    }
    @Override
    public void onCompleted(String name, String instanceId, boolean success, long durationMs) {
        log.info("[engine] completed name={} instanceId={} success={} durationMs={}", name, instanceId, success, durationMs);
    }
    @Override
    public void onStepRecorded(String name, String instanceId, int stepIndex, StepKind kind, String stepName, long latencyMs) {
        log.debug("[engine] step.recorded name={} instanceId={} step={} kind={} stepName={} latencyMs={}", name, instanceId, stepIndex, kind, stepName, latencyMs);
    }
    @Override
    public void onActivityFailed(String name, String instanceId, String activityName, Throwable error) {
        log.warn("[engine] activity.failed name={} instanceId={} activity={} error={}", name, instanceId, activityName, error.getMessage());
    }
    @Override
    public void onReplayDivergence(String name, String instanceId, int stepIndex, String detail) {
        log.error("[engine] replay.diverged name={} instanceId={} step={} detail={}", name, instanceId, stepIndex, detail);
    }
    @Override
    public void onTimerScheduled(String name, String instanceId, String timerName, Instant deadline) {
        log.info("[timer] scheduled name={} instanceId={} timer={} deadline={}", name, instanceId, timerName, deadline);
    }
    @Override
    public void onTimerFired(String name, String instanceId, String timerName) {
        log.info("[timer] fired name={} instanceId={} timer={}", name, instanceId, timerName);
    }
    @Override
    public void onNotificationAttempt(String alertId, String userId, boolean delivered) {
        log.info("[escalation] notification alertId={} userId={} delivered={}", alertId, userId, delivered);
    }
    @Override
    public void onEscalationFinished(String alertId, String outcome) {
        log.info("[escalation] finished alertId={} outcome={}", alertId, outcome);
    }
}
