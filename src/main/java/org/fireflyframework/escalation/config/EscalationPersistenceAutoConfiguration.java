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

import org.fireflyframework.escalation.core.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.escalation.core.persistence.StateSerializer;
import org.fireflyframework.escalation.persistence.redis.RedisPersistenceProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Auto-configuration for journal persistence adapters.
 *
 * <p>Redis is activated when {@code firefly.escalation.persistence.provider=redis} and a
 * {@code ReactiveRedisTemplate} bean is present. Otherwise the default
 * {@code InMemoryPersistenceProvider} from {@link EscalationAutoConfiguration} is used.
 */
@Slf4j
@AutoConfiguration(before = EscalationAutoConfiguration.class)
@EnableConfigurationProperties(EscalationProperties.class)
public class EscalationPersistenceAutoConfiguration {

    @Configuration
    @ConditionalOnClass(name = "org.springframework.data.redis.core.ReactiveRedisTemplate")
    @ConditionalOnBean(type = "org.springframework.data.redis.core.ReactiveRedisTemplate")
    @ConditionalOnProperty(name = "firefly.escalation.persistence.provider", havingValue = "redis")
    static class RedisPersistenceConfig {

        @Bean
        @ConditionalOnMissingBean(ExecutionPersistenceProvider.class)
        public ExecutionPersistenceProvider redisPersistenceProvider(
                org.springframework.data.redis.core.ReactiveRedisTemplate<String, String> redisTemplate,
                StateSerializer serializer,
                Clock escalationClock,
                EscalationProperties properties) {
            log.info("[escalation] Using Redis-based persistence provider");
            return new RedisPersistenceProvider(redisTemplate, serializer,
                    properties.getPersistence().getKeyPrefix(),
                    properties.getPersistence().getKeyTtl(),
                    escalationClock);
        }
    }
}
