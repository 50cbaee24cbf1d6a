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
package org.fireflyframework.escalation.unit.core;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.escalation.core.model.StepKind;
import org.fireflyframework.escalation.core.observability.CompositeOrchestrationEvents;
import org.fireflyframework.escalation.core.observability.OrchestrationEvents;
import org.fireflyframework.escalation.core.observability.OrchestrationMetrics;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestrationMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final OrchestrationMetrics metrics = new OrchestrationMetrics(registry);

    @Test
    void runAndStepEvents_incrementTaggedCounters() {
        metrics.onStart("alert-escalation", "a-1");
        metrics.onStepRecorded("alert-escalation", "a-1", 0, StepKind.ACTIVITY, "GetAlert", 3);
        metrics.onStepRecorded("alert-escalation", "a-1", 1, StepKind.ACTIVITY, "GetAlert", 2);
        metrics.onStepReplayed("alert-escalation", "a-1", 0, StepKind.TIMER, "ack-timeout");
        metrics.onCompleted("alert-escalation", "a-1", true, 10);

        assertThat(registry.get("firefly.escalation.runs.started").tag("name", "alert-escalation").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("firefly.escalation.steps.recorded").tag("step", "GetAlert").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("firefly.escalation.steps.replayed").tag("kind", "TIMER").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("firefly.escalation.runs.completed").tag("success", "true").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void escalationEvents_countedByOutcomeAndDelivery() {
        metrics.onNotificationAttempt("a-1", "alice", false);
        metrics.onNotificationAttempt("a-1", "bob", true);
        metrics.onEscalationFinished("a-1", "EXHAUSTED");

        assertThat(registry.get("firefly.escalation.notifications.attempted").tag("delivered", "false").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("firefly.escalation.escalations.finished").tag("outcome", "EXHAUSTED").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void composite_isolatesFailingDelegate() {
        List<String> seen = new ArrayList<>();
        OrchestrationEvents failing = new OrchestrationEvents() {
            @Override
            public void onEscalationFinished(String alertId, String outcome) {
                throw new IllegalStateException("listener broke");
            }
        };
        OrchestrationEvents recording = new OrchestrationEvents() {
            @Override
            public void onEscalationFinished(String alertId, String outcome) {
                seen.add(outcome);
            }
        };

        new CompositeOrchestrationEvents(List.of(failing, recording, metrics)).onEscalationFinished("a-1", "NO_COVERAGE");

        assertThat(seen).containsExactly("NO_COVERAGE");
        assertThat(registry.get("firefly.escalation.escalations.finished").counter().count()).isEqualTo(1.0);
    }
}
