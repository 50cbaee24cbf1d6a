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
package org.fireflyframework.escalation.alert;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAlertStore implements AlertStore {

    private final ConcurrentHashMap<String, Alert> alerts = new ConcurrentHashMap<>();

    @Override
    public Mono<Alert> get(String alertId) {
        return Mono.fromCallable(() -> alerts.get(alertId));
    }

    @Override
    public Mono<Alert> update(Alert alert) {
        return Mono.defer(() -> alerts.computeIfPresent(alert.id(), (id, existing) -> alert) != null
                ? Mono.just(alert)
                : Mono.error(new AlertNotFoundException(alert.id())));
    }

    @Override
    public Mono<Alert> replace(Alert expected, Alert updated) {
        return Mono.defer(() -> {
            if (alerts.replace(expected.id(), expected, updated)) {
                return Mono.just(updated);
            }
            return alerts.containsKey(expected.id())
                    ? Mono.<Alert>empty()
                    : Mono.<Alert>error(new AlertNotFoundException(expected.id()));
        });
    }

    @Override
    public Mono<Alert> create(Alert alert) {
        return Mono.fromCallable(() -> {
            alerts.put(alert.id(), alert);
            return alert;
        });
    }

    public List<Alert> all() {
        return List.copyOf(alerts.values());
    }

    public void clear() {
        alerts.clear();
    }
}
