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

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.fireflyframework.escalation.core.model.ExecutionStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persisted record of one durable run. The journal is append-only; every transition returns
 * a new copy.
 */
public record ExecutionState(
        String instanceId,
        String workflowName,
        ExecutionStatus status,
        String input,
        String output,
        List<JournalEntry> journal,
        String failureReason,
        Instant startedAt,
        Instant updatedAt
) {
    public ExecutionState {
        journal = journal != null ? List.copyOf(journal) : List.of();
    }

    public static ExecutionState started(String instanceId, String workflowName, String input, Instant now) {
        return new ExecutionState(instanceId, workflowName, ExecutionStatus.RUNNING, input, null,
                List.of(), null, now, now);
    }

    public ExecutionState withJournalEntry(JournalEntry entry, ExecutionStatus newStatus, Instant now) {
        List<JournalEntry> next = new ArrayList<>(journal);
        next.add(entry);
        return new ExecutionState(instanceId, workflowName, newStatus, input, output,
                next, failureReason, startedAt, now);
    }

    public ExecutionState withStatus(ExecutionStatus newStatus, Instant now) {
        return new ExecutionState(instanceId, workflowName, newStatus, input, output,
                journal, failureReason, startedAt, now);
    }

    public ExecutionState completed(String serializedOutput, Instant now) {
        return new ExecutionState(instanceId, workflowName, ExecutionStatus.COMPLETED, input, serializedOutput,
                journal, null, startedAt, now);
    }

    public ExecutionState failed(String reason, Instant now) {
        return new ExecutionState(instanceId, workflowName, ExecutionStatus.FAILED, input, output,
                journal, reason, startedAt, now);
    }

    public int nextStepIndex() {
        return journal.size();
    }

    public Optional<JournalEntry> entryAt(int stepIndex) {
        return stepIndex < journal.size() ? Optional.of(journal.get(stepIndex)) : Optional.empty();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    @JsonIgnore
    public boolean isActive() {
        return status != null && status.isActive();
    }
}
