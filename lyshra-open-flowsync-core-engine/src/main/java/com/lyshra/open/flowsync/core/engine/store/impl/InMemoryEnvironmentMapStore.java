package com.lyshra.open.flowsync.core.engine.store.impl;

import com.lyshra.open.flowsync.integration.contract.store.IEnvironmentMapStore;
import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.exception.DuplicateMappingException;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory environment-map tracker.
 *
 * <p>Rows are partitioned by (tenant, environment). Uniqueness checks and the write
 * happen under the partition monitor, which gives the same guarantees as unique
 * indexes in a database.</p>
 */
@Slf4j
public class InMemoryEnvironmentMapStore implements IEnvironmentMapStore {

    private static final String NATIVE_KEY_PREFIX = "native:";
    private static final String CANONICAL_KEY_PREFIX = "canonical:";

    private final Map<PartitionKey, Map<String, EnvironmentMapping>> partitions = new ConcurrentHashMap<>();

    private record PartitionKey(String tenantId, String environmentId) {
    }

    @Override
    public Mono<EnvironmentMapping> save(EnvironmentMapping mapping) {
        return Mono.fromCallable(() -> {
            validate(mapping);
            Map<String, EnvironmentMapping> partition = partition(mapping.getTenantId(), mapping.getEnvironmentId());
            String rowKey = rowKey(mapping);
            synchronized (partition) {
                if (mapping.getCanonicalId() != null && mapping.getStatus().occupiesCanonicalSlot()) {
                    for (Map.Entry<String, EnvironmentMapping> entry : partition.entrySet()) {
                        EnvironmentMapping other = entry.getValue();
                        if (!entry.getKey().equals(rowKey)
                                && mapping.getCanonicalId().equals(other.getCanonicalId())
                                && other.getStatus().occupiesCanonicalSlot()) {
                            throw new DuplicateMappingException(mapping.getTenantId(), mapping.getEnvironmentId(),
                                    mapping.getCanonicalId(), mapping.getNativeId(), other.getNativeId());
                        }
                    }
                }
                partition.put(rowKey, mapping);
            }
            log.debug("Saved environment mapping {}/{} native={} canonical={} status={}", mapping.getTenantId(),
                    mapping.getEnvironmentId(), mapping.getNativeId(), mapping.getCanonicalId(), mapping.getStatus());
            return mapping;
        });
    }

    @Override
    public Mono<Optional<EnvironmentMapping>> findByNativeId(String tenantId, String environmentId, String nativeId) {
        return Mono.fromCallable(() -> Optional.ofNullable(
                partition(tenantId, environmentId).get(NATIVE_KEY_PREFIX + nativeId)));
    }

    @Override
    public Flux<EnvironmentMapping> findByCanonicalId(String tenantId, String environmentId, String canonicalId) {
        return Flux.defer(() -> Flux.fromIterable(snapshot(tenantId, environmentId)))
                .filter(row -> Objects.equals(row.getCanonicalId(), canonicalId));
    }

    @Override
    public Flux<EnvironmentMapping> findByEnvironment(String tenantId, String environmentId) {
        return Flux.defer(() -> Flux.fromIterable(snapshot(tenantId, environmentId)));
    }

    @Override
    public Flux<EnvironmentMapping> findByStatus(String tenantId, String environmentId, WorkflowMappingStatus status) {
        return findByEnvironment(tenantId, environmentId)
                .filter(row -> row.getStatus() == status);
    }

    private Map<String, EnvironmentMapping> partition(String tenantId, String environmentId) {
        return partitions.computeIfAbsent(new PartitionKey(tenantId, environmentId), key -> new ConcurrentHashMap<>());
    }

    private List<EnvironmentMapping> snapshot(String tenantId, String environmentId) {
        Map<String, EnvironmentMapping> partition = partition(tenantId, environmentId);
        synchronized (partition) {
            return new ArrayList<>(partition.values());
        }
    }

    private static String rowKey(EnvironmentMapping mapping) {
        return mapping.getNativeId() != null
                ? NATIVE_KEY_PREFIX + mapping.getNativeId()
                : CANONICAL_KEY_PREFIX + mapping.getCanonicalId();
    }

    private static void validate(EnvironmentMapping mapping) {
        if (mapping.getTenantId() == null || mapping.getEnvironmentId() == null) {
            throw new IllegalArgumentException("tenantId and environmentId cannot be null");
        }
        if (mapping.getStatus() == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (mapping.getNativeId() == null && mapping.getCanonicalId() == null) {
            throw new IllegalArgumentException("A mapping needs a native id or a canonical id");
        }
        if (mapping.getStatus() == WorkflowMappingStatus.LINKED && mapping.getCanonicalId() == null) {
            throw new IllegalArgumentException("A LINKED mapping requires a canonical id");
        }
    }
}
