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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.escalation.core.model.StepKind;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

public class OrchestrationMetrics implements OrchestrationEvents {
    private static final String PREFIX = "firefly.escalation";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onStart(String name, String instanceId) {
        counter("runs.started", "name", name).increment();
    }

    @Override
    public void onResumed(String name, String instanceId, int journaledSteps) {
        counter("runs.resumed", "name", name).increment();
    }

    @Override
    public void onCompleted(String name, String instanceId, boolean success, long durationMs) {
        counter("runs.completed", "name", name, "success", String.valueOf(success)).increment();
        timer("runs.duration", "name", name).record(Duration.ofMillis(durationMs));
    }

    @Override
    public void onStepRecorded(String name, String instanceId, int stepIndex, StepKind kind, String stepName, long latencyMs) {
        counter("steps.recorded", "name", name, "kind", kind.name(), "step", stepName).increment();
        if (kind == StepKind.ACTIVITY) {
            timer("activities.duration", "name", name, "step", stepName).record(Duration.ofMillis(latencyMs));
        }
    }

    @Override
    public void onStepReplayed(String name, String instanceId, int stepIndex, StepKind kind, String stepName) {
        counter("steps.replayed", "name", name, "kind", kind.name()).increment();
    }

    @Override
    public void onActivityFailed(String name, String instanceId, String activityName, Throwable error) {
        counter("activities.failed", "name", name, "step", activityName).increment();
    }

    @Override
    public void onReplayDivergence(String name, String instanceId, int stepIndex, String detail) {
        counter("replay.divergences", "name", name).increment();
    }

    @Override
    public void onNotificationAttempt(String alertId, String userId, boolean delivered) {
        counter("notifications.attempted", "delivered", String.valueOf(delivered)).increment();
    }

    @Override
    public void onEscalationFinished(String alertId, String outcome) {
        counter("escalations.finished", "outcome", outcome).increment();
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
