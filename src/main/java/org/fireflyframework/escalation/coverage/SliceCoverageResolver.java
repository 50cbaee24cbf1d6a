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

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Resolves coverage from the customer's rotation slices.
 *
 * <p>The primary tier comes from the earliest-starting ON_HOURS or OFF_HOURS slice covering the
 * instant, the backup tier from the covering BACKUP slice. Member ids the directory does not know
 * are skipped. The policy is the plan's, falling back to the configured default.
 */
@Slf4j
public class SliceCoverageResolver implements CoverageResolver {

    private final ScheduleSliceRepository slices;
    private final OnCallDirectory directory;
    private final EscalationPolicy defaultPolicy;

    public SliceCoverageResolver(ScheduleSliceRepository slices, OnCallDirectory directory, EscalationPolicy defaultPolicy) {
        this.slices = slices;
        this.directory = directory;
        this.defaultPolicy = defaultPolicy != null ? defaultPolicy : EscalationPolicy.DEFAULT;
    }

    @Override
    public Mono<OnCallCoverage> resolve(String customerId, Instant asOf) {
        return slices.findCovering(customerId, asOf)
                .collectList()
                .flatMap(covering -> {
                    Optional<ScheduleSlice> primary = covering.stream().filter(s -> s.role().isPrimary()).findFirst();
                    Optional<ScheduleSlice> backup = covering.stream().filter(s -> s.role() == SliceRole.BACKUP).findFirst();
                    String planId = primary.map(ScheduleSlice::planId)
                            .or(() -> backup.map(ScheduleSlice::planId))
                            .orElse(null);
                    return Mono.zip(members(primary), members(backup), policy(planId))
                            .map(t -> new OnCallCoverage(t.getT1(), t.getT2(), t.getT3(), planId));
                })
                .doOnNext(coverage -> log.info("[coverage] customerId={} asOf={} primary={} backup={} planId={}",
                        customerId, asOf, coverage.primaryTier().size(), coverage.backupTier().size(), coverage.planId()))
                .onErrorMap(e -> !(e instanceof CoverageResolutionException), e -> new CoverageResolutionException(customerId, e));
    }

    private Mono<List<OnCallMember>> members(Optional<ScheduleSlice> slice) {
        if (slice.isEmpty()) {
            return Mono.just(List.of());
        }
        return Flux.fromIterable(slice.get().memberIds())
                .concatMap(userId -> directory.findMember(userId)
                        .switchIfEmpty(Mono.fromRunnable(() ->
                                log.warn("[coverage] unknown member userId={} in slice {}", userId, slice.get().id()))))
                .collectList();
    }

    private Mono<EscalationPolicy> policy(String planId) {
        if (planId == null) {
            return Mono.just(defaultPolicy);
        }
        return directory.findPolicy(planId).defaultIfEmpty(defaultPolicy);
    }
}
