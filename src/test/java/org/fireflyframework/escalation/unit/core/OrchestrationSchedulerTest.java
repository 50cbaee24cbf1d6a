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
package org.fireflyframework.escalation.unit.core;

import org.fireflyframework.escalation.core.scheduling.OrchestrationScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestrationSchedulerTest {

    private OrchestrationScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new OrchestrationScheduler(2);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void scheduleAtFixedRate_runsRepeatedly_andSurvivesTaskFailure() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(3);
        scheduler.scheduleAtFixedRate("flaky", () -> {
            latch.countDown();
            throw new IllegalStateException("task failed");
        }, 0, 20);

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.activeTaskCount()).isEqualTo(1);
    }

    @Test
    void scheduleAtFixedRate_sameId_replacesPreviousTask() {
        scheduler.scheduleAtFixedRate("cleanup", () -> {}, 60_000, 60_000);
        scheduler.scheduleAtFixedRate("cleanup", () -> {}, 60_000, 60_000);

        assertThat(scheduler.activeTaskCount()).isEqualTo(1);
    }

    @Test
    void cancel_removesTask() {
        scheduler.scheduleWithCron("horizon", () -> {}, "0 0 2 * * *", "UTC");
        assertThat(scheduler.activeTaskCount()).isEqualTo(1);

        scheduler.cancel("horizon");
        assertThat(scheduler.activeTaskCount()).isZero();
    }

    @Test
    void delayUntilNext_nightlyCron_honoursZone() {
        CronExpression cron = CronExpression.parse("0 0 2 * * *");
        ZoneId zone = ZoneId.of("Europe/Berlin");
        // 00:30 UTC is 01:30 in Berlin in March (CET), so 02:00 local is 30 minutes away
        ZonedDateTime now = ZonedDateTime.parse("2026-03-02T00:30:00Z");

        Duration delay = OrchestrationScheduler.delayUntilNext(cron, zone, now);

        assertThat(delay).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void delayUntilNext_justPastFiring_waitsForNextDay() {
        CronExpression cron = CronExpression.parse("0 0 2 * * *");
        ZonedDateTime now = ZonedDateTime.parse("2026-03-02T02:00:01Z");

        Duration delay = OrchestrationScheduler.delayUntilNext(cron, ZoneId.of("UTC"), now);

        assertThat(delay).isEqualTo(Duration.ofHours(24).minusSeconds(1));
    }
}
