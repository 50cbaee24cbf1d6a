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
package org.fireflyframework.escalation.core.timer;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Waits for absolute deadlines without pinning a thread. A deadline already in the past
 * completes immediately, which is how a resumed run skips the part of a wait that elapsed
 * while the process was down.
 */
@Slf4j
public class DurableTimerService {

    private final Clock clock;
    private final Scheduler scheduler;

    public DurableTimerService(Clock clock, Scheduler scheduler) {
        this.clock = clock;
        this.scheduler = scheduler;
    }

    public Instant deadlineFrom(Instant logicalNow, Duration duration) {
        return logicalNow.plus(duration);
    }

    /**
     * Emits {@code deadline} once the clock reaches it.
     */
    public Mono<Instant> awaitDeadline(Instant deadline) {
        return Mono.defer(() -> {
            Duration remaining = remaining(deadline);
            if (remaining.isZero()) {
                return Mono.just(deadline);
            }
            log.debug("[timer] waiting {} until {}", remaining, deadline);
            return Mono.delay(remaining, scheduler).thenReturn(deadline);
        });
    }

    public Duration remaining(Instant deadline) {
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public Clock clock() {
        return clock;
    }
}
