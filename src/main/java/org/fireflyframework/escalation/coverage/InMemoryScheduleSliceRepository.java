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

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryScheduleSliceRepository implements ScheduleSliceRepository {

    private final ConcurrentHashMap<String, ScheduleSlice> slices = new ConcurrentHashMap<>();

    @Override
    public Flux<ScheduleSlice> findCovering(String customerId, Instant instant) {
        return Flux.defer(() -> Flux.fromIterable(forCustomer(customerId))
                .filter(slice -> slice.covers(instant))
                .sort(Comparator.comparing(ScheduleSlice::startUtc)));
    }

    @Override
    public Mono<ScheduleSlice> findLatest(String customerId) {
        return Mono.fromCallable(() -> forCustomer(customerId).stream()
                .max(Comparator.comparing(ScheduleSlice::endUtc))
                .orElse(null));
    }

    @Override
    public Mono<Void> saveAll(Iterable<ScheduleSlice> toSave) {
        return Mono.fromRunnable(() -> toSave.forEach(slice -> slices.put(slice.id(), slice)));
    }

    public void save(ScheduleSlice slice) {
        slices.put(slice.id(), slice);
    }

    private List<ScheduleSlice> forCustomer(String customerId) {
        return slices.values().stream()
                .filter(slice -> slice.customerId().equals(customerId))
                .toList();
    }
}
