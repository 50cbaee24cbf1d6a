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
package org.fireflyframework.escalation.core.context;

import org.slf4j.Logger;

import java.util.function.BooleanSupplier;

/**
 * Logger handed to workflow code. Drops every call made while the run is replaying journaled
 * steps, so a resumed run does not repeat the log lines of its first attempt.
 */
public class ReplaySafeLogger {

    private final Logger delegate;
    private final BooleanSupplier replaying;

    public ReplaySafeLogger(Logger delegate, BooleanSupplier replaying) {
        this.delegate = delegate;
        this.replaying = replaying;
    }

    public void debug(String format, Object... args) {
        if (!replaying.getAsBoolean()) delegate.debug(format, args);
    }

    public void info(String format, Object... args) {
        if (!replaying.getAsBoolean()) delegate.info(format, args);
    }

    public void warn(String format, Object... args) {
        if (!replaying.getAsBoolean()) delegate.warn(format, args);
    }

    public void error(String format, Object... args) {
        if (!replaying.getAsBoolean()) delegate.error(format, args);
    }

    public Logger delegate() {
        return delegate;
    }
}
