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

/**
 * Alert persistence collaborator.
 */
public interface AlertStore {

    /** Emits the alert, or completes empty when it does not exist. */
    Mono<Alert> get(String alertId);

    /** Replaces the stored alert; fails with {@link AlertNotFoundException} when it does not exist. */
    Mono<Alert> update(Alert alert);

    /**
     * Stores {@code updated} only if the stored alert still equals {@code expected}. Completes
     * empty when the alert changed in between; fails with {@link AlertNotFoundException} when it
     * does not exist.
     */
    Mono<Alert> replace(Alert expected, Alert updated);

    Mono<Alert> create(Alert alert);
}
