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
package org.fireflyframework.escalation.core.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class WorkflowRegistry {

    private final ConcurrentHashMap<String, DurableWorkflow<?, ?>> workflows = new ConcurrentHashMap<>();

    public WorkflowRegistry() {
    }

    public WorkflowRegistry(Collection<? extends DurableWorkflow<?, ?>> initial) {
        initial.forEach(this::register);
    }

    public void register(DurableWorkflow<?, ?> workflow) {
        workflows.put(workflow.name(), workflow);
        log.info("[engine] registered workflow '{}'", workflow.name());
    }

    @SuppressWarnings("unchecked")
    public Optional<DurableWorkflow<Object, Object>> get(String name) {
        return Optional.ofNullable((DurableWorkflow<Object, Object>) workflows.get(name));
    }

    public List<String> names() {
        return List.copyOf(workflows.keySet());
    }
}
