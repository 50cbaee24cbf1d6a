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
package org.fireflyframework.escalation.core.activity;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.escalation.core.exception.ActivityNotFoundException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed activity lookup. Names are part of the journal format and must stay stable.
 */
@Slf4j
public class ActivityRegistry {

    private final ConcurrentHashMap<String, ActivityHandler<?, ?>> handlers = new ConcurrentHashMap<>();

    public <I, O> ActivityRegistry register(String name, ActivityHandler<I, O> handler) {
        ActivityHandler<?, ?> previous = handlers.put(name, handler);
        if (previous != null) {
            log.warn("[engine] activity '{}' re-registered, replacing {}", name, previous.getClass().getSimpleName());
        }
        return this;
    }

    @SuppressWarnings("unchecked")
    public ActivityHandler<Object, Object> get(String name) {
        ActivityHandler<?, ?> handler = handlers.get(name);
        if (handler == null) {
            throw new ActivityNotFoundException(name);
        }
        return (ActivityHandler<Object, Object>) handler;
    }

    public boolean contains(String name) {
        return handlers.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(handlers.keySet());
    }
}
