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
package org.fireflyframework.escalation.persistence.redis;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.escalation.core.model.ExecutionStatus;
import org.fireflyframework.escalation.core.persistence.ExecutionPersistenceProvider;
import org.fireflyframework.escalation.core.persistence.ExecutionState;
import org.fireflyframework.escalation.core.persistence.StateSerializer;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Redis-backed run store.
 *
 * <p>Key structure:
 * <ul>
 *   <li>{@code {prefix}state:{instanceId}} holds the serialized run record, journal included</li>
 *   <li>{@code {prefix}meta:{instanceId}} holds {@code workflow|status|updatedAt} for scans</li>
 * </ul>
 */
@Slf4j
public class RedisPersistenceProvider implements ExecutionPersistenceProvider {

    private static final String DEFAULT_PREFIX = "escalation:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final StateSerializer serializer;
    private final String keyPrefix;
    private final String stateKeyPrefix;
    private final String metaKeyPrefix;
    private final Duration keyTtl;
    private final Clock clock;

    public RedisPersistenceProvider(ReactiveRedisTemplate<String, String> redisTemplate,
                                    StateSerializer serializer,
                                    String keyPrefix,
                                    Duration keyTtl,
                                    Clock clock) {
        this.redisTemplate = redisTemplate;
        this.serializer = serializer;
        this.keyPrefix = keyPrefix != null ? keyPrefix : DEFAULT_PREFIX;
        this.stateKeyPrefix = this.keyPrefix + "state:";
        this.metaKeyPrefix = this.keyPrefix + "meta:";
        this.keyTtl = keyTtl;
        this.clock = clock;
        log.info("[persistence] RedisPersistenceProvider initialized with prefix: {}", this.keyPrefix);
    }

    public RedisPersistenceProvider(ReactiveRedisTemplate<String, String> redisTemplate, StateSerializer serializer) {
        this(redisTemplate, serializer, DEFAULT_PREFIX, null, Clock.systemUTC());
    }

    @Override
    public Mono<Void> save(ExecutionState state) {
        String stateKey = stateKeyPrefix + state.instanceId();
        String metaKey = metaKeyPrefix + state.instanceId();

        return Mono.fromCallable(() -> serializer.serialize(state))
                .flatMap(json -> {
                    String meta = state.workflowName() + "|" + state.status().name() + "|" + state.updatedAt();
                    Mono<Boolean> stateOp = redisTemplate.opsForValue().set(stateKey, json);
                    Mono<Boolean> metaOp = redisTemplate.opsForValue().set(metaKey, meta);

                    Mono<Void> ttlOp = Mono.empty();
                    if (keyTtl != null && state.isTerminal()) {
                        ttlOp = redisTemplate.expire(stateKey, keyTtl)
                                .then(redisTemplate.expire(metaKey, keyTtl))
                                .then();
                    }
                    return Mono.when(stateOp, metaOp).then(ttlOp);
                })
                .doOnSuccess(v -> log.debug("[persistence] saved run {} steps={}", state.instanceId(), state.journal().size()))
                .doOnError(e -> log.error("[persistence] failed to save run {}", state.instanceId(), e));
    }

    @Override
    public Mono<Optional<ExecutionState>> findById(String instanceId) {
        return redisTemplate.opsForValue().get(stateKeyPrefix + instanceId)
                .map(json -> Optional.of(serializer.deserialize(json)))
                .defaultIfEmpty(Optional.empty());
    }

    @Override
    public Flux<ExecutionState> findByStatus(ExecutionStatus status) {
        return scanMetadata()
                .filter(meta -> meta.status == status)
                .flatMap(meta -> findById(meta.instanceId))
                .filter(Optional::isPresent)
                .map(Optional::get);
    }

    @Override
    public Flux<ExecutionState> findInFlight() {
        return scanMetadata()
                .filter(meta -> meta.status.isActive())
                .flatMap(meta -> findById(meta.instanceId))
                .filter(Optional::isPresent)
                .map(Optional::get);
    }

    @Override
    public Flux<ExecutionState> findStale(Instant before) {
        return scanMetadata()
                .filter(meta -> meta.status.isActive() && meta.updatedAt != null && meta.updatedAt.isBefore(before))
                .flatMap(meta -> findById(meta.instanceId))
                .filter(Optional::isPresent)
                .map(Optional::get);
    }

    @Override
    public Mono<Long> cleanup(Duration olderThan) {
        return Mono.defer(() -> {
            Instant threshold = clock.instant().minus(olderThan);
            return scanMetadata()
                    .filter(meta -> meta.status.isTerminal()
                            && meta.updatedAt != null && meta.updatedAt.isBefore(threshold))
                    .flatMap(meta -> redisTemplate.delete(stateKeyPrefix + meta.instanceId, metaKeyPrefix + meta.instanceId)
                            .thenReturn(1L))
                    .reduce(0L, Long::sum);
        });
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return redisTemplate.opsForValue()
                .set(keyPrefix + "health", "ok", Duration.ofSeconds(10))
                .onErrorReturn(false);
    }

    private Flux<MetaEntry> scanMetadata() {
        return redisTemplate.scan(ScanOptions.scanOptions().match(metaKeyPrefix + "*").build())
                .flatMap(metaKey -> redisTemplate.opsForValue().get(metaKey)
                        .flatMap(value -> Mono.justOrEmpty(parseMetaEntry(metaKey, value))));
    }

    private Optional<MetaEntry> parseMetaEntry(String metaKey, String value) {
        try {
            String instanceId = metaKey.substring(metaKeyPrefix.length());
            String[] parts = value.split("\\|");
            ExecutionStatus status = ExecutionStatus.valueOf(parts[1]);
            Instant updatedAt = parts.length > 2 && !"null".equals(parts[2]) ? Instant.parse(parts[2]) : null;
            return Optional.of(new MetaEntry(instanceId, status, updatedAt));
        } catch (RuntimeException e) {
            log.warn("[persistence] skipping unreadable meta entry {}: {}", metaKey, e.getMessage());
            return Optional.empty();
        }
    }

    private record MetaEntry(String instanceId, ExecutionStatus status, Instant updatedAt) {}
}
