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

import org.fireflyframework.escalation.alert.AlertStatus;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Configuration properties for the escalation engine.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   escalation:
 *     engine:
 *       worker-thread-cap: 10
 *     persistence:
 *       provider: redis
 *       key-prefix: escalation:
 *       retention-period: 7d
 *     recovery:
 *       resume-on-startup: true
 *       stale-threshold: 1h
 *     policy:
 *       ack-timeout: 5m
 *       max-attempts-per-tier: 3
 *     alert:
 *       handled-statuses: ACCEPTED, RESOLVED
 *     horizon:
 *       days: 45
 *       cron: "0 0 2 * * *"
 *     notification:
 *       subject-prefix: "[On-Call]"
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.escalation")
public class EscalationProperties {

    @NestedConfigurationProperty
    private EngineProperties engine = new EngineProperties();

    @NestedConfigurationProperty
    private PersistenceProperties persistence = new PersistenceProperties();

    @NestedConfigurationProperty
    private RecoveryProperties recovery = new RecoveryProperties();

    @NestedConfigurationProperty
    private SchedulingProperties scheduling = new SchedulingProperties();

    @NestedConfigurationProperty
    private PolicyProperties policy = new PolicyProperties();

    @NestedConfigurationProperty
    private AlertProperties alert = new AlertProperties();

    @NestedConfigurationProperty
    private HorizonProperties horizon = new HorizonProperties();

    @NestedConfigurationProperty
    private NotificationProperties notification = new NotificationProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    // --- Getters and Setters ---

    public EngineProperties getEngine() { return engine; }
    public void setEngine(EngineProperties engine) { this.engine = engine; }

    public PersistenceProperties getPersistence() { return persistence; }
    public void setPersistence(PersistenceProperties persistence) { this.persistence = persistence; }

    public RecoveryProperties getRecovery() { return recovery; }
    public void setRecovery(RecoveryProperties recovery) { this.recovery = recovery; }

    public SchedulingProperties getScheduling() { return scheduling; }
    public void setScheduling(SchedulingProperties scheduling) { this.scheduling = scheduling; }

    public PolicyProperties getPolicy() { return policy; }
    public void setPolicy(PolicyProperties policy) { this.policy = policy; }

    public AlertProperties getAlert() { return alert; }
    public void setAlert(AlertProperties alert) { this.alert = alert; }

    public HorizonProperties getHorizon() { return horizon; }
    public void setHorizon(HorizonProperties horizon) { this.horizon = horizon; }

    public NotificationProperties getNotification() { return notification; }
    public void setNotification(NotificationProperties notification) { this.notification = notification; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    public HealthProperties getHealth() { return health; }
    public void setHealth(HealthProperties health) { this.health = health; }

    // --- Nested property classes ---

    public static class EngineProperties {
        private int workerThreadCap = 10;
        private int workerQueueCap = 10_000;

        public int getWorkerThreadCap() { return workerThreadCap; }
        public void setWorkerThreadCap(int workerThreadCap) { this.workerThreadCap = workerThreadCap; }

        public int getWorkerQueueCap() { return workerQueueCap; }
        public void setWorkerQueueCap(int workerQueueCap) { this.workerQueueCap = workerQueueCap; }
    }

    public static class PersistenceProperties {
        private String provider = "in-memory";
        private String keyPrefix = "escalation:";
        private Duration keyTtl;
        private Duration retentionPeriod = Duration.ofDays(7);
        private Duration cleanupInterval = Duration.ofHours(1);

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }

        public Duration getKeyTtl() { return keyTtl; }
        public void setKeyTtl(Duration keyTtl) { this.keyTtl = keyTtl; }

        public Duration getRetentionPeriod() { return retentionPeriod; }
        public void setRetentionPeriod(Duration retentionPeriod) { this.retentionPeriod = retentionPeriod; }

        public Duration getCleanupInterval() { return cleanupInterval; }
        public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
    }

    public static class RecoveryProperties {
        private boolean enabled = true;
        private boolean resumeOnStartup = true;
        private Duration staleThreshold = Duration.ofHours(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isResumeOnStartup() { return resumeOnStartup; }
        public void setResumeOnStartup(boolean resumeOnStartup) { this.resumeOnStartup = resumeOnStartup; }

        public Duration getStaleThreshold() { return staleThreshold; }
        public void setStaleThreshold(Duration staleThreshold) { this.staleThreshold = staleThreshold; }
    }

    public static class SchedulingProperties {
        private int threadPoolSize = 2;

        public int getThreadPoolSize() { return threadPoolSize; }
        public void setThreadPoolSize(int threadPoolSize) { this.threadPoolSize = threadPoolSize; }
    }

    public static class PolicyProperties {
        private Duration ackTimeout = Duration.ofMinutes(5);
        private int maxAttemptsPerTier = 3;
        private Duration retryDelay = Duration.ofMinutes(5);

        public Duration getAckTimeout() { return ackTimeout; }
        public void setAckTimeout(Duration ackTimeout) { this.ackTimeout = ackTimeout; }

        public int getMaxAttemptsPerTier() { return maxAttemptsPerTier; }
        public void setMaxAttemptsPerTier(int maxAttemptsPerTier) { this.maxAttemptsPerTier = maxAttemptsPerTier; }

        public Duration getRetryDelay() { return retryDelay; }
        public void setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; }
    }

    public static class AlertProperties {
        private Set<AlertStatus> handledStatuses = EnumSet.of(AlertStatus.ACCEPTED, AlertStatus.RESOLVED);

        public Set<AlertStatus> getHandledStatuses() { return handledStatuses; }
        public void setHandledStatuses(Set<AlertStatus> handledStatuses) { this.handledStatuses = handledStatuses; }
    }

    public static class HorizonProperties {
        private boolean enabled = true;
        private int days = 45;
        private String cron = "0 0 2 * * *";
        private String zone = "UTC";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getDays() { return days; }
        public void setDays(int days) { this.days = days; }

        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }

        public String getZone() { return zone; }
        public void setZone(String zone) { this.zone = zone; }
    }

    public static class NotificationProperties {
        private String subjectPrefix = "[On-Call]";
        private int smsTitleMaxLength = 50;

        public String getSubjectPrefix() { return subjectPrefix; }
        public void setSubjectPrefix(String subjectPrefix) { this.subjectPrefix = subjectPrefix; }

        public int getSmsTitleMaxLength() { return smsTitleMaxLength; }
        public void setSmsTitleMaxLength(int smsTitleMaxLength) { this.smsTitleMaxLength = smsTitleMaxLength; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class HealthProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
