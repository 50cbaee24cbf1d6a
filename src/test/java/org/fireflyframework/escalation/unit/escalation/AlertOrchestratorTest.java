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
import org.fireflyframework.escalation.alert.AlertSeverity;
import org.fireflyframework.escalation.alert.AlertStatus;
import org.fireflyframework.escalation.core.model.ExecutionStatus;
import org.fireflyframework.escalation.orchestrator.EscalationOutcome;
import org.fireflyframework.escalation.support.EscalationFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AlertOrchestratorTest {

    private EscalationFixture fixture;

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void noOnCallUsers_marksEscalatedWithoutPaging() {
        fixture = new EscalationFixture();
        Alert alert = fixture.newAlert("alert-1");

        StepVerifier.create(fixture.service().escalateAndAwait(alert))
                .expectNext(EscalationOutcome.NO_COVERAGE)
                .verifyComplete();

        Alert after = fixture.alert("alert-1");
        assertThat(after.status()).isEqualTo(AlertStatus.ESCALATED);
        assertThat(after.escalationAttempts()).isZero();
        assertThat(after.timeline()).hasSize(1);
        assertThat(after.timeline().get(0).comment())
                .isEqualTo("No on-call users configured - unable to send notifications");
        assertThat(fixture.email.sent()).isEmpty();
        assertThat(fixture.sms.sent()).isEmpty();
        assertThat(fixture.outcomes).containsExactly("NO_COVERAGE");
        assertThat(fixture.run("alert-1").status()).isEqualTo(ExecutionStatus.COMPLETED);
    }

    @Test
    void coverageResolutionFailure_marksAlertFailed() {
        fixture = new EscalationFixture((customerId, asOf) -> Mono.error(new IllegalStateException("schedule store down")));
        Alert alert = fixture.newAlert("alert-1");

        StepVerifier.create(fixture.service().escalateAndAwait(alert))
                .expectNext(EscalationOutcome.FAILED)
                .verifyComplete();

        Alert after = fixture.alert("alert-1");
        assertThat(after.status()).isEqualTo(AlertStatus.FAILED);
        assertThat(after.timeline()).extracting(AlertChange::comment)
                .containsExactly("Orchestration failed: schedule store down");
        assertThat(fixture.run("alert-1").status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(fixture.outcomes).containsExactly("FAILED");
    }

    @Test
    void alertDeletedBeforeFirstPage_isHandledExternally() {
        fixture = new EscalationFixture();
        fixture.onCall(List.of("alice"), List.of(), null);
        Alert alert = fixture.newAlert("alert-1");
        fixture.alerts.clear();

        StepVerifier.create(fixture.service().escalateAndAwait(alert))
                .expectNext(EscalationOutcome.HANDLED_EXTERNALLY)
                .verifyComplete();
        assertThat(fixture.email.sent()).isEmpty();
    }

    @Test
    void missingAlertWithoutCoverage_endsQuietly() {
        fixture = new EscalationFixture();
        Alert ghost = Alert.received("ghost", EscalationFixture.CUSTOMER, "db-1", AlertSeverity.HIGH,
                "Disk full on db-1", null, fixture.clock.instant());

        StepVerifier.create(fixture.service().escalateAndAwait(ghost))
                .expectNext(EscalationOutcome.HANDLED_EXTERNALLY)
                .verifyComplete();

        assertThat(fixture.run("ghost").status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(fixture.alerts.all()).isEmpty();
        assertThat(fixture.outcomes).containsExactly("HANDLED_EXTERNALLY");
    }

    @Test
    void missingAlertAfterCoverageFailure_endsQuietly() {
        fixture = new EscalationFixture((customerId, asOf) -> Mono.error(new IllegalStateException("schedule store down")));
        Alert ghost = Alert.received("ghost", EscalationFixture.CUSTOMER, "db-1", AlertSeverity.HIGH,
                "Disk full on db-1", null, fixture.clock.instant());

        StepVerifier.create(fixture.service().escalateAndAwait(ghost))
                .expectNext(EscalationOutcome.HANDLED_EXTERNALLY)
                .verifyComplete();
        assertThat(fixture.run("ghost").status()).isEqualTo(ExecutionStatus.COMPLETED);
    }

    @Test
    void completedRun_outcomeIsQueryable() {
        fixture = new EscalationFixture();
        Alert alert = fixture.newAlert("alert-1");
        fixture.service().escalateAndAwait(alert).block();

        StepVerifier.create(fixture.service().findOutcome("alert-1"))
                .assertNext(outcome -> assertThat(outcome).contains(EscalationOutcome.NO_COVERAGE))
                .verifyComplete();
    }
}
