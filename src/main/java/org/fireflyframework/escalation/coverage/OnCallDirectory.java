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

import reactor.core.publisher.Mono;

/**
 * Read access to responders and on-call plans.
 */
public interface OnCallDirectory {

    /** Emits the member, or completes empty for an unknown user id. */
    Mono<OnCallMember> findMember(String userId);

    /** Emits the plan's escalation policy, or completes empty when the plan defines none. */
    Mono<EscalationPolicy> findPolicy(String planId);
}
