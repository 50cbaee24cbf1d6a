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
package org.fireflyframework.escalation.schedule;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.escalation.coverage.ScheduleSlice;
import org.fireflyframework.escalation.coverage.ScheduleSliceRepository;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Keeps every bound customer's rotation generated a fixed number of days ahead. Meant to run once
 * a day; a failure for one customer is counted and does not stop the others.
 */
@Slf4j
public class ScheduleHorizonExtender {

    private final CustomerPlanBindingRepository bindings;
    private final ScheduleSliceRepository slices;
    private final ScheduleGenerator generator;
    private final Clock clock;
    private final int horizonDays;
    private final ZoneId zone;

    public ScheduleHorizonExtender(CustomerPlanBindingRepository bindings, ScheduleSliceRepository slices,
                                   ScheduleGenerator generator, Clock clock, int horizonDays, ZoneId zone) {
        if (horizonDays <= 0) {
            throw new IllegalArgumentException("horizonDays must be positive, got: " + horizonDays);
        }
        this.bindings = bindings;
        this.slices = slices;
        this.generator = generator;
        this.clock = clock;
        this.horizonDays = horizonDays;
        this.zone = zone;
    }

    public Mono<HorizonExtensionReport> extendAll() {
        return Mono.defer(() -> {
            LocalDate today = LocalDate.now(clock.withZone(zone));
            Instant todayStart = today.atStartOfDay(zone).toInstant();
            Instant horizon = today.plusDays(horizonDays).atStartOfDay(zone).toInstant();
            log.info("[horizon] extending schedules to {}", horizon);
            return bindings.findAll()
                    .concatMap(binding -> extend(binding.customerId(), todayStart, horizon))
                    .reduce(HorizonExtensionReport.empty(), HorizonExtensionReport::plus)
                    .doOnNext(report -> log.info("[horizon] completed extended={} skipped={} errors={}",
                            report.extended(), report.skipped(), report.errors()));
        });
    }

    private Mono<HorizonExtensionReport.Decision> extend(String customerId, Instant todayStart, Instant horizon) {
        return slices.findLatest(customerId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(latest -> {
                    if (latest.isEmpty()) {
                        log.info("[horizon] generating schedule customerId={} from={} to={}", customerId, todayStart, horizon);
                        return generator.regenerate(customerId, todayStart, horizon)
                                .thenReturn(HorizonExtensionReport.Decision.EXTENDED);
                    }
                    ScheduleSlice slice = latest.get();
                    if (slice.endUtc().isBefore(horizon)) {
                        Instant from = slice.endUtc().atZone(zone).toLocalDate().atStartOfDay(zone).toInstant();
                        log.debug("[horizon] extending customerId={} from={} to={}", customerId, from, horizon);
                        return generator.extendHorizon(customerId, from, horizon)
                                .thenReturn(HorizonExtensionReport.Decision.EXTENDED);
                    }
                    log.debug("[horizon] customerId={} already covered until {}, skipping", customerId, slice.endUtc());
                    return Mono.just(HorizonExtensionReport.Decision.SKIPPED);
                })
                .onErrorResume(e -> {
                    log.error("[horizon] failed to extend schedule customerId={}", customerId, e);
                    return Mono.just(HorizonExtensionReport.Decision.ERROR);
                });
    }
}
