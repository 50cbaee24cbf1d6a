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
package org.fireflyframework.escalation.notification;

import org.fireflyframework.escalation.alert.AlertSeverity;

/**
 * Renders page texts for an alert.
 */
public class NotificationMessageBuilder {

    private static final String ELLIPSIS = "...";

    private final String subjectPrefix;
    private final int smsTitleMaxLength;

    public NotificationMessageBuilder(String subjectPrefix, int smsTitleMaxLength) {
        this.subjectPrefix = subjectPrefix != null ? subjectPrefix : "[On-Call]";
        if (smsTitleMaxLength <= ELLIPSIS.length()) {
            throw new IllegalArgumentException("smsTitleMaxLength must exceed " + ELLIPSIS.length() + ", got: " + smsTitleMaxLength);
        }
        this.smsTitleMaxLength = smsTitleMaxLength;
    }

    public NotificationMessageBuilder() {
        this("[On-Call]", 50);
    }

    public String subject(AlertSeverity severity, String title) {
        return subjectPrefix + " " + severity + ": " + titleOrDefault(title);
    }

    public String body(AlertSeverity severity, String title, String description, String resourceId) {
        String text = description != null && !description.isBlank() ? description : "No description provided";
        return "Alert Notification\n\n"
                + "Title: " + titleOrDefault(title) + "\n"
                + "Severity: " + severity + "\n"
                + "Resource: " + resourceId + "\n\n"
                + "Description:\n"
                + text + "\n\n"
                + "You are receiving this notification because you are on call.\n"
                + "Acknowledge the alert to stop further escalation.\n";
    }

    /** Short form for SMS; titles longer than the limit are cut and end with "...". */
    public String shortMessage(AlertSeverity severity, String title) {
        String text = titleOrDefault(title);
        if (text.length() > smsTitleMaxLength) {
            text = text.substring(0, smsTitleMaxLength - ELLIPSIS.length()) + ELLIPSIS;
        }
        return subjectPrefix + " " + severity + ": " + text;
    }

    private static String titleOrDefault(String title) {
        return title != null && !title.isBlank() ? title : "Alert";
    }
}
