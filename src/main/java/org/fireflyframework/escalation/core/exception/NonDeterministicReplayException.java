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
package org.fireflyframework.escalation.core.exception;

/**
 * Raised when re-executed workflow code asks for a step that differs from the journaled one
 * at the same index.
 */
public final class NonDeterministicReplayException extends OrchestrationException {
    private final int stepIndex;

    public NonDeterministicReplayException(int stepIndex, String expected, String actual) {
        super("Step " + stepIndex + ": journal recorded " + expected + " but workflow requested " + actual,
                "ORCHESTRATION_NON_DETERMINISTIC_REPLAY");
        this.stepIndex = stepIndex;
    }

    public int getStepIndex() {
        return stepIndex;
    }
}
