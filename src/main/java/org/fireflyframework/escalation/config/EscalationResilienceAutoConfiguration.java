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

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.fireflyframework.escalation.core.resilience.ResilienceDecorator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Circuit breakers around notification channels.
 *
 * <p>Uses the application's {@code CircuitBreakerRegistry} when one is defined, otherwise a
 * registry with resilience4j defaults.
 */
@Slf4j
@AutoConfiguration(before = EscalationAutoConfiguration.class)
@ConditionalOnClass(CircuitBreakerRegistry.class)
public class EscalationResilienceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResilienceDecorator resilienceDecorator(CircuitBreakerRegistry registry) {
        log.info("[escalation] Resilience decorator initialized with CircuitBreakerRegistry");
        return new ResilienceDecorator(registry);
    }
}
