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

import org.fireflyframework.escalation.coverage.InMemoryScheduleSliceRepository;
import org.fireflyframework.escalation.coverage.ScheduleSlice;
import org.fireflyframework.escalation.coverage.SliceRole;
import org.fireflyframework.escalation.schedule.CustomerPlanBinding;
import org.fireflyframework.escalation.schedule.CustomerPlanBindingRepository;
import org.fireflyframework.escalation.schedule.HorizonExtensionReport;
import org.fireflyframework.escalation.schedule.ScheduleGenerator;
import org.fireflyframework.escalation.schedule.ScheduleHorizonExtender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScheduleHorizonExtenderTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final Instant TODAY = Instant.parse("2026-03-02T00:00:00Z");
    private static final Instant HORIZON = Instant.parse("2026-04-16T00:00:00Z");

    private InMemoryScheduleSliceRepository slices;
    private CustomerPlanBindingRepository bindings;
    private ScheduleGenerator generator;
    private ScheduleHorizonExtender extender;

    @BeforeEach
    void setUp() {
        slices = new InMemoryScheduleSliceRepository();
        bindings = mock(CustomerPlanBindingRepository.class);
        generator = mock(ScheduleGenerator.class);
        when(generator.regenerate(any(), any(), any())).thenReturn(Mono.empty());
        when(generator.extendHorizon(any(), any(), any())).thenReturn(Mono.empty());
        extender = new ScheduleHorizonExtender(bindings, slices, generator,
                Clock.fixed(NOW, ZoneOffset.UTC), 45, ZoneId.of("UTC"));
    }

    @Test
    void extendAll_customerWithoutSlices_isRegeneratedFromToday() {
        bind("cust-new");

        StepVerifier.create(extender.extendAll())
                .expectNext(new HorizonExtensionReport(1, 0, 0))
                .verifyComplete();

        verify(generator).regenerate("cust-new", TODAY, HORIZON);
        verify(generator, never()).extendHorizon(any(), any(), any());
    }

    @Test
    void extendAll_shortSchedule_isExtendedFromStartOfLastDay() {
        bind("cust-short");
        slices.save(slice("cust-short", Instant.parse("2026-03-19T20:00:00Z"), Instant.parse("2026-03-20T08:00:00Z")));

        StepVerifier.create(extender.extendAll())
                .expectNext(new HorizonExtensionReport(1, 0, 0))
                .verifyComplete();

        verify(generator).extendHorizon("cust-short", Instant.parse("2026-03-20T00:00:00Z"), HORIZON);
    }

    @Test
    void extendAll_coveredSchedule_isSkipped() {
        bind("cust-full");
        slices.save(slice("cust-full", Instant.parse("2026-04-15T00:00:00Z"), HORIZON));

        StepVerifier.create(extender.extendAll())
                .expectNext(new HorizonExtensionReport(0, 1, 0))
                .verifyComplete();

        verify(generator, never()).extendHorizon(any(), any(), any());
        verify(generator, never()).regenerate(any(), any(), any());
    }

    @Test
    void extendAll_failureForOneCustomer_doesNotStopOthers() {
        bind("cust-broken", "cust-new");
        when(generator.regenerate(eq("cust-broken"), any(), any()))
                .thenReturn(Mono.error(new IllegalStateException("generator down")));

        StepVerifier.create(extender.extendAll())
                .expectNext(new HorizonExtensionReport(1, 0, 1))
                .verifyComplete();

        verify(generator).regenerate("cust-new", TODAY, HORIZON);
    }

    @Test
    void extendAll_noBindings_emitsEmptyReport() {
        bind();

        StepVerifier.create(extender.extendAll())
                .expectNext(HorizonExtensionReport.empty())
                .verifyComplete();
    }

    @Test
    void nonPositiveHorizon_isRejected() {
        assertThatThrownBy(() -> new ScheduleHorizonExtender(bindings, slices, generator,
                Clock.fixed(NOW, ZoneOffset.UTC), 0, ZoneId.of("UTC")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void bind(String... customerIds) {
        when(bindings.findAll()).thenReturn(Flux.fromArray(customerIds)
                .map(id -> new CustomerPlanBinding(id, "plan-" + id)));
    }

    private static ScheduleSlice slice(String customerId, Instant from, Instant to) {
        return new ScheduleSlice(customerId + "-slice", customerId, "plan-" + customerId, SliceRole.ON_HOURS,
                List.of("alice"), from, to);
    }
}
