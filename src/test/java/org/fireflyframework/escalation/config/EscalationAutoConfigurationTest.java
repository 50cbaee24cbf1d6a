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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.escalation.alert.AlertStatus;
import org.fireflyframework.escalation.alert.AlertStatusPolicy;
import org.fireflyframework.escalation.alert.AlertStore;
import org.fireflyframework.escalation.alert.InMemoryAlertStore;
import org.fireflyframework.escalation.core.activity.ActivityRegistry;
import org.fireflyframework.escalation.core.engine.DurableExecutionEngine;
import org.fireflyframework.escalation.core.engine.WorkflowRegistry;
import org.fireflyframework.escalation.core.health.OrchestrationHealthIndicator;
import org.fireflyframework.escalation.core.observability.CompositeOrchestrationEvents;
import org.fireflyframework.escalation.core.observability.OrchestrationEvents;
import org.fireflyframework.escalation.core.observability.OrchestrationLoggerEvents;
import org.fireflyframework.escalation.core.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.escalation.core.persistence.InMemoryPersistenceProvider;
import org.fireflyframework.escalation.core.recovery.RecoveryService;
import org.fireflyframework.escalation.coverage.EscalationPolicy;
import org.fireflyframework.escalation.orchestrator.AlertOrchestrator;
import org.fireflyframework.escalation.persistence.redis.RedisPersistenceProvider;
import org.fireflyframework.escalation.schedule.CustomerPlanBindingRepository;
import org.fireflyframework.escalation.schedule.ScheduleGenerator;
import org.fireflyframework.escalation.schedule.ScheduleHorizonExtender;
import org.fireflyframework.escalation.service.EscalationService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Verifies the default wiring of the escalation auto-configurations and that each default
 * backs off or switches on as its conditions say.
 */
class EscalationAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    EscalationPersistenceAutoConfiguration.class,
                    EscalationResilienceAutoConfiguration.class,
                    EscalationAutoConfiguration.class));

    @Test
    void defaults_wireInMemoryStack() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(EscalationService.class);
            assertThat(context).hasSingleBean(DurableExecutionEngine.class);
            assertThat(context).hasSingleBean(RecoveryService.class);
            assertThat(context).hasSingleBean(OrchestrationHealthIndicator.class);
            assertThat(context).doesNotHaveBean(ScheduleHorizonExtender.class);
            assertThat(context.getBean(ExecutionPersistenceProvider.class)).isInstanceOf(InMemoryPersistenceProvider.class);
            assertThat(context.getBean(AlertStore.class)).isInstanceOf(InMemoryAlertStore.class);
            assertThat(context.getBean(WorkflowRegistry.class).get(AlertOrchestrator.WORKFLOW_NAME)).isPresent();
            assertThat(context.getBean(ActivityRegistry.class).names()).contains("SendNotification", "ResolveCoverage");
            assertThat(context.getBean(EscalationPolicy.class)).isEqualTo(EscalationPolicy.DEFAULT);
        });
    }

    @Test
    void events_withoutMeterRegistry_isLoggerOnly() {
        contextRunner.run(context -> {
            OrchestrationEvents events = context.getBean("orchestrationEvents", OrchestrationEvents.class);
            assertThat(events).isInstanceOf(OrchestrationLoggerEvents.class);
        });
    }

    @Test
    void events_withMeterRegistry_composesMetrics() {
        contextRunner
                .withUserConfiguration(MeterRegistryConfig.class)
                .run(context -> {
                    OrchestrationEvents events = context.getBean("orchestrationEvents", OrchestrationEvents.class);
                    assertThat(events).isInstanceOf(CompositeOrchestrationEvents.class);
                });
    }

    @Test
    void events_metricsDisabled_isLoggerOnly() {
        contextRunner
                .withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("firefly.escalation.metrics.enabled=false")
                .run(context -> assertThat(context.getBean("orchestrationEvents", OrchestrationEvents.class))
                        .isInstanceOf(OrchestrationLoggerEvents.class));
    }

    @Test
    void userAlertStore_replacesDefault() {
        contextRunner
                .withUserConfiguration(CustomAlertStoreConfig.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(AlertStore.class);
                    assertThat(context.getBean(AlertStore.class))
                            .isSameAs(context.getBean(CustomAlertStoreConfig.class).store);
                });
    }

    @Test
    void recoveryDisabled_noRecoveryService() {
        contextRunner
                .withPropertyValues("firefly.escalation.recovery.enabled=false")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).doesNotHaveBean(RecoveryService.class);
                    assertThat(context).hasSingleBean(EscalationStartupListener.class);
                });
    }

    @Test
    void healthDisabled_noIndicator() {
        contextRunner
                .withPropertyValues("firefly.escalation.health.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(OrchestrationHealthIndicator.class));
    }

    @Test
    void horizonExtender_requiresGeneratorAndBindings() {
        contextRunner
                .withUserConfiguration(ScheduleGenerationConfig.class)
                .run(context -> assertThat(context).hasSingleBean(ScheduleHorizonExtender.class));
    }

    @Test
    void properties_bindPolicyAndHandledStatuses() {
        contextRunner
                .withPropertyValues(
                        "firefly.escalation.policy.ack-timeout=2m",
                        "firefly.escalation.policy.max-attempts-per-tier=1",
                        "firefly.escalation.alert.handled-statuses=ACCEPTED")
                .run(context -> {
                    EscalationPolicy policy = context.getBean(EscalationPolicy.class);
                    assertThat(policy.ackTimeout()).isEqualTo(Duration.ofMinutes(2));
                    assertThat(policy.maxAttemptsPerTier()).isEqualTo(1);
                    AlertStatusPolicy statusPolicy = context.getBean(AlertStatusPolicy.class);
                    assertThat(statusPolicy.isHandled(AlertStatus.ACCEPTED)).isTrue();
                    assertThat(statusPolicy.isHandled(AlertStatus.RESOLVED)).isFalse();
                });
    }

    @Test
    void redisProvider_withTemplateAndProperty_replacesInMemory() {
        contextRunner
                .withUserConfiguration(RedisTemplateConfig.class)
                .withPropertyValues(
                        "firefly.escalation.persistence.provider=redis",
                        "firefly.escalation.persistence.key-ttl=7d")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(ExecutionPersistenceProvider.class);
                    assertThat(context.getBean(ExecutionPersistenceProvider.class))
                            .isInstanceOf(RedisPersistenceProvider.class);
                });
    }

    @Test
    void redisTemplateWithoutProperty_staysInMemory() {
        contextRunner
                .withUserConfiguration(RedisTemplateConfig.class)
                .run(context -> assertThat(context.getBean(ExecutionPersistenceProvider.class))
                        .isInstanceOf(InMemoryPersistenceProvider.class));
    }

    @Test
    void redisPropertyWithoutTemplate_staysInMemory() {
        contextRunner
                .withPropertyValues("firefly.escalation.persistence.provider=redis")
                .run(context -> assertThat(context.getBean(ExecutionPersistenceProvider.class))
                        .isInstanceOf(InMemoryPersistenceProvider.class));
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomAlertStoreConfig {
        final InMemoryAlertStore store = new InMemoryAlertStore();

        @Bean
        AlertStore customAlertStore() {
            return store;
        }
    }

    @Configuration
    static class ScheduleGenerationConfig {
        @Bean
        ScheduleGenerator scheduleGenerator() {
            return mock(ScheduleGenerator.class);
        }

        @Bean
        CustomerPlanBindingRepository customerPlanBindingRepository() {
            return mock(CustomerPlanBindingRepository.class);
        }
    }

    @Configuration
    static class RedisTemplateConfig {
        @Bean
        @SuppressWarnings("unchecked")
        ReactiveRedisTemplate<String, String> reactiveRedisTemplate() {
            return mock(ReactiveRedisTemplate.class);
        }
    }
}
