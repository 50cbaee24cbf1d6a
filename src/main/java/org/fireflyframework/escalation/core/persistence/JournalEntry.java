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
package org.fireflyframework.escalation.core.persistence;

import org.fireflyframework.escalation.core.model.StepKind;

import java.time.Instant;

/**
 * One completed step of a durable run.
 *
 * @param stepIndex  zero-based position in the journal
 * @param kind       step kind
 * @param name       activity or timer name
 * @param inputHash  SHA-256 of the serialized step input
 * @param result     serialized result (JSON), {@code null} for empty results and failures
 * @param error      failure message when the step failed, otherwise {@code null}
 * @param recordedAt wall-clock instant the step was journaled
 */
public record JournalEntry(
        int stepIndex,
        StepKind kind,
        String name,
        String inputHash,
        String result,
        String error,
        Instant recordedAt
) {
    public static JournalEntry success(int stepIndex, StepKind kind, String name, String inputHash,
                                       String result, Instant recordedAt) {
        return new JournalEntry(stepIndex, kind, name, inputHash, result, null, recordedAt);
    }

    public static JournalEntry failure(int stepIndex, String name, String inputHash,
                                       String error, Instant recordedAt) {
        return new JournalEntry(stepIndex, StepKind.ACTIVITY, name, inputHash, null,
                error != null ? error : "unknown error", recordedAt);
    }

    public boolean failed() {
        return error != null;
    }

    public String describe() {
        return kind + ":" + name + "#" + inputHash;
    }
}
