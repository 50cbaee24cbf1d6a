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
package org.fireflyframework.escalation.core.lease;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process mutual exclusion for run instances. At most one holder per instance id.
 */
@Slf4j
public class ExecutionLeaseRegistry {

    private final Set<String> held = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(String instanceId) {
        boolean acquired = held.add(instanceId);
        if (!acquired) {
            log.debug("[lease] rejected instanceId={} reason=already-held", instanceId);
        }
        return acquired;
    }

    public void release(String instanceId) {
        held.remove(instanceId);
    }

    public boolean isHeld(String instanceId) {
        return held.contains(instanceId);
    }

    public int activeCount() {
        return held.size();
    }
}
