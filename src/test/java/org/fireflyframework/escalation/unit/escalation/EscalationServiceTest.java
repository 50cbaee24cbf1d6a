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
package org.fireflyframework.escalation.unit.escalation;

import org.fireflyframework.escalation.alert.Alert;
import org.fireflyframework.escalation.alert.AlertChange;
import org.fireflyframework.escalation.alert.AlertNotFoundException;
import org.fireflyframework.escalation.alert.AlertSeverity;
import org.fireflyframework.escalation.alert.AlertStateException;
import org.fireflyframework.escalation.alert.AlertStatus;
import org.fireflyframework.escalation.core.exception.ExecutionAlreadyRunningException;
import org.fireflyframework.escalation.core.model.ExecutionStatus;
import org.fireflyframework.escalation.orchestrator.EscalationOutcome;
import org.fireflyframework.escalation.support.EscalationFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EscalationServiceTest {

    private EscalationFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EscalationFixture();
        fixture.onCall(List.of("alice"), List.of(), null);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void ingest_storesAlertAndStartsRun() {
        Alert alert = Alert.received("alert-1", EscalationFixture.CUSTOMER, "db-1", AlertSeverity.CRITICAL,
                "Replication lag", null, fixture.clock.instant());

        StepVerifier.create(fixture.service().ingest(alert))
                .assertNext(run -> assertThat(run.instanceId()).isEqualTo("alert-1"))
                .verifyComplete();

        assertThat(fixture.alert("alert-1").status()).isEqualTo(AlertStatus.PENDING);
        assertThat(fixture.email.sent()).containsExactly("alice@example.com");
        StepVerifier.create(fixture.service().findRun("alert-1"))
                .assertNext(run -> assertThat(run).hasValueSatisfying(
                        state -> assertThat(state.status()).isEqualTo(ExecutionStatus.WAITING)))
                .verifyComplete();
    }

    @Test
    void requestManualEscalation_countsAttemptAndStartsNewRun() {
        Alert alert = fixture.newAlert("alert-1");
        fixture.service().escalate(alert).block();
        fixture.advance(Duration.ofMinutes(5));
        assertThat(fixture.service().findOutcome("alert-1").block()).contains(EscalationOutcome.EXHAUSTED);
        assertThat(fixture.alert("alert-1").escalationAttempts()).isEqualTo(1);

        StepVerifier.create(fixture.service().requestManualEscalation("alert-1", "operator"))
                .assertNext(run -> assertThat(run.status()).isEqualTo(ExecutionStatus.RUNNING))
                .verifyComplete();

        Alert escalated = fixture.alert("alert-1");
        // manual request counts one attempt, the new page continues from there
        assertThat(escalated.escalationAttempts()).isEqualTo(3);
        assertThat(escalated.status()).isEqualTo(AlertStatus.ESCALATED);
        assertThat(escalated.timeline()).extracting(AlertChange::comment)
                .contains("Manual escalation to backup requested");
        assertThat(fixture.email.sentTo("alice@example.com")).isEqualTo(2);
    }

    @Test
    void requestManualEscalation_whileRunActive_isRejectedWithoutTouchingAlert() {
        fixture.service().escalate(fixture.newAlert("alert-1")).block();
        Alert waiting = fixture.alert("alert-1");
        assertThat(waiting.status()).isEqualTo(AlertStatus.PENDING);
        assertThat(waiting.escalationAttempts()).isEqualTo(1);

        StepVerifier.create(fixture.service().requestManualEscalation("alert-1", "operator"))
                .expectError(ExecutionAlreadyRunningException.class)
                .verify();

        assertThat(fixture.alert("alert-1")).isEqualTo(waiting);
    }

    @Test
    void requestManualEscalation_afterRestartWithRunStillPersistedActive_isRejected() {
        fixture.service().escalate(fixture.newAlert("alert-1")).block();
        fixture.restart();
        Alert waiting = fixture.alert("alert-1");

        StepVerifier.create(fixture.service().requestManualEscalation("alert-1", "operator"))
                .expectError(ExecutionAlreadyRunningException.class)
                .verify();
        assertThat(fixture.alert("alert-1")).isEqualTo(waiting);
    }

    @Test
    void requestManualEscalation_resolvedAlert_isRejected() {
        fixture.newAlert("alert-1");
        fixture.service().resolve("alert-1", "alice", null).block();

        StepVerifier.create(fixture.service().requestManualEscalation("alert-1", "operator"))
                .expectError(AlertStateException.class)
                .verify();
        assertThat(fixture.service().findRun("alert-1").block()).isEmpty();
    }

    @Test
    void requestManualEscalation_unknownAlert_isRejected() {
        StepVerifier.create(fixture.service().requestManualEscalation("missing", "operator"))
                .expectError(AlertNotFoundException.class)
                .verify();
    }

    @Test
    void acknowledge_resolvedAlert_isRejected() {
        fixture.newAlert("alert-1");
        fixture.service().resolve("alert-1", "alice", "Fixed").block();

        StepVerifier.create(fixture.service().acknowledge("alert-1", "bob", null))
                .expectError(AlertStateException.class)
                .verify();
        assertThat(fixture.alert("alert-1").status()).isEqualTo(AlertStatus.RESOLVED);
    }
}
