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
package org.fireflyframework.escalation.config;

import org.fireflyframework.escalation.core.recovery.RecoveryService;
import org.fireflyframework.escalation.core.scheduling.OrchestrationScheduler;
import org.fireflyframework.escalation.schedule.ScheduleHorizonExtender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;

import java.time.Duration;

/**
 * Once the application is ready: resumes in-flight runs, schedules the periodic cleanup of
 * terminal runs and the nightly schedule horizon job.
 */
@Slf4j
public class EscalationStartupListener implements ApplicationListener<ApplicationReadyEvent> {

    static final String CLEANUP_TASK = "execution-cleanup";
    static final String HORIZON_TASK = "schedule-horizon";

    private final RecoveryService recovery;
    private final ScheduleHorizonExtender horizonExtender;
    private final OrchestrationScheduler scheduler;
    private final EscalationProperties properties;

    public EscalationStartupListener(RecoveryService recovery, ScheduleHorizonExtender horizonExtender,
                                     OrchestrationScheduler scheduler, EscalationProperties properties) {
        this.recovery = recovery;
        this.horizonExtender = horizonExtender;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (recovery != null) {
            if (properties.getRecovery().isResumeOnStartup()) {
                recovery.resumeInFlight().subscribe(
                        count -> log.info("[recovery] Resumed {} in-flight run(s) on startup", count),
                        err -> log.error("[recovery] Startup resume failed", err));
            }
            scheduleCleanup();
        }
        if (horizonExtender != null && properties.getHorizon().isEnabled()) {
            scheduleHorizon();
        }
    }

    private void scheduleCleanup() {
        Duration retention = properties.getPersistence().getRetentionPeriod();
        long intervalMs = properties.getPersistence().getCleanupInterval().toMillis();
        scheduler.scheduleAtFixedRate(CLEANUP_TASK, () -> recovery.cleanupCompletedExecutions(retention)
                .subscribe(
                        removed -> log.debug("[recovery] Cleanup removed {} terminal run(s)", removed),
                        err -> log.warn("[recovery] Cleanup failed: {}", err.getMessage())),
                intervalMs, intervalMs);
    }

    private void scheduleHorizon() {
        EscalationProperties.HorizonProperties horizon = properties.getHorizon();
        scheduler.scheduleWithCron(HORIZON_TASK, () -> horizonExtender.extendAll()
                .subscribe(
                        report -> log.info("[horizon] Run finished: extended={} skipped={} errors={}",
                                report.extended(), report.skipped(), report.errors()),
                        err -> log.error("[horizon] Run failed", err)),
                horizon.getCron(), horizon.getZone());
    }
}
