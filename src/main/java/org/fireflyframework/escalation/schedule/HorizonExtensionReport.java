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
package org.fireflyframework.escalation.schedule;

public record HorizonExtensionReport(int extended, int skipped, int errors) {

    public static HorizonExtensionReport empty() {
        return new HorizonExtensionReport(0, 0, 0);
    }

    HorizonExtensionReport plus(Decision decision) {
        return switch (decision) {
            case EXTENDED -> new HorizonExtensionReport(extended + 1, skipped, errors);
            case SKIPPED -> new HorizonExtensionReport(extended, skipped + 1, errors);
            case ERROR -> new HorizonExtensionReport(extended, skipped, errors + 1);
        };
    }

    enum Decision { EXTENDED, SKIPPED, ERROR }
}
