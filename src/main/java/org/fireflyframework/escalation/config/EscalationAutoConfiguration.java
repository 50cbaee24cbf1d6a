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
import org.fireflyframework.escalation.alert.AlertLifecycleService;
import org.fireflyframework.escalation.alert.AlertStatusPolicy;
import org.fireflyframework.escalation.alert.AlertStore;
import org.fireflyframework.escalation.alert.InMemoryAlertStore;
import org.fireflyframework.escalation.core.activity.ActivityRegistry;
import org.fireflyframework.escalation.core.engine.DurableExecutionEngine;
import org.fireflyframework.escalation.core.engine.DurableWorkflow;
import org.fireflyframework.escalation.core.engine.WorkflowRegistry;
import org.fireflyframework.escalation.core.health.OrchestrationHealthIndicator;
import org.fireflyframework.escalation.core.lease.ExecutionLeaseRegistry;
import org.fireflyframework.escalation.core.observability.CompositeOrchestrationEvents;
import org.fireflyframework.escalation.core.observability.OrchestrationEvents;
import org.fireflyframework.escalation.core.observability.OrchestrationLoggerEvents;
import org.fireflyframework.escalation.core.observability.OrchestrationMetrics;
import org.fireflyframework.escalation.core.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.escalation.core.persistence.InMemoryPersistenceProvider;
import org.fireflyframework.escalation.core.persistence.StateSerializer;
import org.fireflyframework.escalation.core.recovery.RecoveryService;
import org.fireflyframework.escalation.core.resilience.ResilienceDecorator;
import org.fireflyframework.escalation.core.scheduling.OrchestrationScheduler;
import org.fireflyframework.escalation.core.timer.DurableTimerService;
import org.fireflyframework.escalation.coverage.CoverageResolver;
import org.fireflyframework.escalation.coverage.EscalationPolicy;
import org.fireflyframework.escalation.coverage.InMemoryOnCallDirectory;
import org.fireflyframework.escalation.coverage.InMemoryScheduleSliceRepository;
import org.fireflyframework.escalation.coverage.OnCallDirectory;
import org.fireflyframework.escalation.coverage.ScheduleSliceRepository;
import org.fireflyframework.escalation.coverage.SliceCoverageResolver;
import org.fireflyframework.escalation.notification.ChannelNotificationDispatcher;
import org.fireflyframework.escalation.notification.NotificationChannel;
import org.fireflyframework.escalation.notification.NotificationDispatcher;
import org.fireflyframework.escalation.notification.NotificationMessageBuilder;
import org.fireflyframework.escalation.orchestrator.AlertOrchestrator;
import org.fireflyframework.escalation.orchestrator.EscalationActivities;
import org.fireflyframework.escalation.orchestrator.EscalationStateMachine;
import org.fireflyframework.escalation.schedule.CustomerPlanBindingRepository;
import org.fireflyframework.escalation.schedule.ScheduleGenerator;
import org.fireflyframework.escalation.schedule.ScheduleHorizonExtender;
import org.fireflyframework.escalation.service.EscalationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Main auto-configuration for the escalation engine.
 *
 * <p>Wires the durable execution substrate (journal persistence, leases, timers, engine,
 * recovery, scheduling, observability) and the escalation domain on top of it (alert store,
 * coverage resolution, notification dispatch, state machine and orchestrator). Every bean
 * backs off when the application defines its own.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(EscalationProperties.class)
public class EscalationAutoConfiguration {

    static final String WORKER_SCHEDULER = "escalationWorkerScheduler";

    // --- Substrate ---

    @Bean
    @ConditionalOnMissingBean
    public Clock escalationClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public StateSerializer stateSerializer() {
        return new StateSerializer();
    }

    @Bean
    @ConditionalOnMissingBean(OrchestrationEvents.class)
    public OrchestrationEvents orchestrationEvents(ObjectProvider<MeterRegistry> meterRegistry,
                                                   EscalationProperties properties) {
        List<OrchestrationEvents> delegates = new ArrayList<>();
        delegates.add(new OrchestrationLoggerEvents());
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null && properties.getMetrics().isEnabled()) {
            log.info("[escalation] Micrometer metrics enabled");
            delegates.add(new OrchestrationMetrics(registry));
        }
        if (delegates.size() == 1) {
            return delegates.get(0);
        }
        return new CompositeOrchestrationEvents(delegates);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionPersistenceProvider executionPersistenceProvider(Clock escalationClock) {
        log.info("[escalation] Using in-memory persistence provider (default)");
        return new InMemoryPersistenceProvider(escalationClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionLeaseRegistry executionLeaseRegistry() {
        return new ExecutionLeaseRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public DurableTimerService durableTimerService(Clock escalationClock) {
        return new DurableTimerService(escalationClock, Schedulers.parallel());
    }

    @Bean(name = WORKER_SCHEDULER, destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = WORKER_SCHEDULER)
    public Scheduler escalationWorkerScheduler(EscalationProperties properties) {
        EscalationProperties.EngineProperties engine = properties.getEngine();
        return Schedulers.newBoundedElastic(engine.getWorkerThreadCap(), engine.getWorkerQueueCap(),
                "escalation-worker");
    }

    @Bean
    @ConditionalOnMissingBean
    public ActivityRegistry activityRegistry(EscalationActivities escalationActivities) {
        ActivityRegistry registry = escalationActivities.registerAll(new ActivityRegistry());
        log.info("[escalation] Registered activities: {}", registry.names());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowRegistry workflowRegistry(ObjectProvider<DurableWorkflow<?, ?>> workflows) {
        WorkflowRegistry registry = new WorkflowRegistry(workflows.orderedStream().toList());
        log.info("[escalation] Registered workflows: {}", registry.names());
        return registry;
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public DurableExecutionEngine durableExecutionEngine(WorkflowRegistry workflows,
                                                         ActivityRegistry activities,
                                                         ExecutionPersistenceProvider persistence,
                                                         DurableTimerService timers,
                                                         StateSerializer serializer,
                                                         ExecutionLeaseRegistry leases,
                                                         OrchestrationEvents events,
                                                         Clock escalationClock,
                                                         @Qualifier(WORKER_SCHEDULER) Scheduler worker) {
        return new DurableExecutionEngine(workflows, activities, persistence, timers, serializer,
                leases, events, escalationClock, worker);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public OrchestrationScheduler orchestrationScheduler(EscalationProperties properties, Clock escalationClock) {
        int poolSize = properties.getScheduling().getThreadPoolSize();
        log.info("[escalation] Scheduler initialized with thread pool size: {}", poolSize);
        return new OrchestrationScheduler(poolSize, escalationClock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.escalation.recovery.enabled", havingValue = "true", matchIfMissing = true)
    public RecoveryService recoveryService(ExecutionPersistenceProvider persistence,
                                           DurableExecutionEngine engine,
                                           Clock escalationClock,
                                           EscalationProperties properties) {
        log.info("[escalation] Recovery service initialized with stale threshold: {}",
                properties.getRecovery().getStaleThreshold());
        return new RecoveryService(persistence, engine, escalationClock, properties.getRecovery().getStaleThreshold());
    }

    // --- Escalation domain ---

    @Bean
    @ConditionalOnMissingBean
    public EscalationPolicy escalationPolicy(EscalationProperties properties) {
        EscalationProperties.PolicyProperties policy = properties.getPolicy();
        return new EscalationPolicy(policy.getAckTimeout(), policy.getMaxAttemptsPerTier(), policy.getRetryDelay());
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertStatusPolicy alertStatusPolicy(EscalationProperties properties) {
        return new AlertStatusPolicy(properties.getAlert().getHandledStatuses());
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertStore alertStore() {
        log.info("[escalation] Using in-memory alert store (default)");
        return new InMemoryAlertStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertLifecycleService alertLifecycleService(AlertStore alertStore, Clock escalationClock,
                                                       AlertStatusPolicy alertStatusPolicy) {
        return new AlertLifecycleService(alertStore, escalationClock, alertStatusPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleSliceRepository scheduleSliceRepository() {
        return new InMemoryScheduleSliceRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public OnCallDirectory onCallDirectory() {
        return new InMemoryOnCallDirectory();
    }

    @Bean
    @ConditionalOnMissingBean
    public CoverageResolver coverageResolver(ScheduleSliceRepository slices, OnCallDirectory directory,
                                             EscalationPolicy escalationPolicy) {
        return new SliceCoverageResolver(slices, directory, escalationPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationMessageBuilder notificationMessageBuilder(EscalationProperties properties) {
        EscalationProperties.NotificationProperties notification = properties.getNotification();
        return new NotificationMessageBuilder(notification.getSubjectPrefix(), notification.getSmsTitleMaxLength());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(ObjectProvider<NotificationChannel> channels,
                                                         ResilienceDecorator resilienceDecorator) {
        List<NotificationChannel> available = channels.orderedStream().toList();
        if (available.isEmpty()) {
            log.warn("[notification] No notification channels registered; every page will fail");
        }
        return new ChannelNotificationDispatcher(available, resilienceDecorator);
    }

    @Bean
    @ConditionalOnMissingBean
    public EscalationActivities escalationActivities(AlertLifecycleService lifecycle,
                                                     CoverageResolver coverageResolver,
                                                     NotificationDispatcher dispatcher,
                                                     NotificationMessageBuilder messages,
                                                     OrchestrationEvents events) {
        return new EscalationActivities(lifecycle, coverageResolver, dispatcher, messages, events);
    }

    @Bean
    @ConditionalOnMissingBean
    public EscalationStateMachine escalationStateMachine(AlertStatusPolicy alertStatusPolicy) {
        return new EscalationStateMachine(alertStatusPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertOrchestrator alertOrchestrator(EscalationStateMachine stateMachine,
                                               EscalationPolicy escalationPolicy,
                                               OrchestrationEvents events) {
        return new AlertOrchestrator(stateMachine, escalationPolicy, events);
    }

    @Bean
    @ConditionalOnMissingBean
    public EscalationService escalationService(DurableExecutionEngine engine, AlertStore alertStore,
                                               AlertLifecycleService lifecycle) {
        return new EscalationService(engine, alertStore, lifecycle);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ScheduleGenerator.class, CustomerPlanBindingRepository.class})
    public ScheduleHorizonExtender scheduleHorizonExtender(CustomerPlanBindingRepository bindings,
                                                           ScheduleSliceRepository slices,
                                                           ScheduleGenerator generator,
                                                           Clock escalationClock,
                                                           EscalationProperties properties) {
        EscalationProperties.HorizonProperties horizon = properties.getHorizon();
        log.info("[horizon] Schedule horizon job configured: days={} cron='{}' zone={}",
                horizon.getDays(), horizon.getCron(), horizon.getZone());
        return new ScheduleHorizonExtender(bindings, slices, generator, escalationClock,
                horizon.getDays(), ZoneId.of(horizon.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public EscalationStartupListener escalationStartupListener(ObjectProvider<RecoveryService> recovery,
                                                               ObjectProvider<ScheduleHorizonExtender> horizonExtender,
                                                               OrchestrationScheduler scheduler,
                                                               EscalationProperties properties) {
        return new EscalationStartupListener(recovery.getIfAvailable(), horizonExtender.getIfAvailable(),
                scheduler, properties);
    }

    @Configuration
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    static class HealthConfig {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnProperty(name = "firefly.escalation.health.enabled", havingValue = "true", matchIfMissing = true)
        public OrchestrationHealthIndicator escalationHealthIndicator(ExecutionPersistenceProvider persistence,
                                                                      ExecutionLeaseRegistry leases) {
            return new OrchestrationHealthIndicator(persistence, leases);
        }
    }
}
