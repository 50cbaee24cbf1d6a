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
 * An activity call failed. Raised live with the original cause, and again on replay from the
 * journaled error message (without cause). Both carry the same message.
 */
public final class ActivityFailureException extends OrchestrationException {
    private final String activityName;
    private final String failureMessage;

    public ActivityFailureException(String activityName, String failureMessage) {
        super("Activity '" + activityName + "' failed: " + failureMessage, "ORCHESTRATION_ACTIVITY_FAILED");
        this.activityName = activityName;
        this.failureMessage = failureMessage;
    }

    public ActivityFailureException(String activityName, String failureMessage, Throwable cause) {
        super("Activity '" + activityName + "' failed: " + failureMessage, "ORCHESTRATION_ACTIVITY_FAILED", cause);
        this.activityName = activityName;
        this.failureMessage = failureMessage;
    }

    public String getActivityName() {
        return activityName;
    }

    /** The activity's own error message, as journaled. */
    public String getFailureMessage() {
        return failureMessage;
    }

    public static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
