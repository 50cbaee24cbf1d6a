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

import java.util.concurrent.ConcurrentHashMap;

public class InMemoryOnCallDirectory implements OnCallDirectory {

    private final ConcurrentHashMap<String, OnCallMember> members = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, EscalationPolicy> policies = new ConcurrentHashMap<>();

    public InMemoryOnCallDirectory addMember(OnCallMember member) {
        members.put(member.userId(), member);
        return this;
    }

    public InMemoryOnCallDirectory addPolicy(String planId, EscalationPolicy policy) {
        policies.put(planId, policy);
        return this;
    }

    @Override
    public Mono<OnCallMember> findMember(String userId) {
        return Mono.fromCallable(() -> members.get(userId));
    }

    @Override
    public Mono<EscalationPolicy> findPolicy(String planId) {
        return Mono.fromCallable(() -> policies.get(planId));
    }
}
