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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.escalation.core.resilience.ResilienceDecorator;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Sends a request over the registered channels independently. Each channel call is guarded by
 * its own circuit breaker ({@code notification-email}, {@code notification-sms}); a rejected
 * call counts as a failed channel. The result keeps the first error message.
 */
@Slf4j
public class ChannelNotificationDispatcher implements NotificationDispatcher {

    private final Map<NotificationChannelType, NotificationChannel> channels = new EnumMap<>(NotificationChannelType.class);
    private final ResilienceDecorator resilience;

    public ChannelNotificationDispatcher(List<NotificationChannel> channels, ResilienceDecorator resilience) {
        channels.forEach(channel -> this.channels.put(channel.type(), channel));
        this.resilience = resilience;
    }

    @Override
    public Mono<NotificationResult> send(NotificationRequest request) {
        Mono<Outcome> email = attempt(NotificationChannelType.EMAIL, request.email(), request.subject(), request.body(), request);
        Mono<Outcome> sms = attempt(NotificationChannelType.SMS, request.phone(), null, request.shortMessage(), request);
        return Mono.zip(email, sms)
                .map(t -> new NotificationResult(t.getT1().sent(), t.getT2().sent(),
                        t.getT1().error() != null ? t.getT1().error() : t.getT2().error()))
                .doOnNext(result -> log.info("[notification] alertId={} userId={} emailSent={} smsSent={}",
                        request.alertId(), request.userId(), result.emailSent(), result.smsSent()));
    }

    private Mono<Outcome> attempt(NotificationChannelType type, String destination, String subject, String body,
                                  NotificationRequest request) {
        if (destination == null || destination.isBlank()) {
            log.warn("[notification] no {} destination for userId={}", type, request.userId());
            return Mono.just(Outcome.SKIPPED);
        }
        NotificationChannel channel = channels.get(type);
        if (channel == null) {
            log.warn("[notification] no {} channel registered, alertId={}", type, request.alertId());
            return Mono.just(Outcome.SKIPPED);
        }
        return resilience.decorate("notification-" + type.name().toLowerCase(),
                        Mono.defer(() -> channel.send(destination, subject, body)))
                .thenReturn(Outcome.SENT)
                .onErrorResume(e -> {
                    log.warn("[notification] {} failed alertId={} userId={} error={}",
                            type, request.alertId(), request.userId(), e.getMessage());
                    return Mono.just(new Outcome(false, type + ": " + describe(e)));
                });
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record Outcome(boolean sent, String error) {
        static final Outcome SENT = new Outcome(true, null);
        static final Outcome SKIPPED = new Outcome(false, null);
    }
}
