package com.lyshra.open.flowsync.integration.contract.store;

import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Environment-map tracker.
 *
 * <p>Implementations must enforce, at the storage level and atomically with the write:</p>
 * <ul>
 *   <li>one row per (tenant, environment, native id) when the native id is known</li>
 *   <li>at most one row per (tenant, environment, canonical id) whose status is not MISSING</li>
 *   <li>a LINKED row always carries a canonical id</li>
 * </ul>
 * A write that violates the second rule fails with
 * {@link com.lyshra.open.flowsync.integration.exception.DuplicateMappingException}.
 */
public interface IEnvironmentMapStore {

    /**
     * Upserts the row. Rows with a native id are keyed by it, rows without one by canonical id.
     */
    Mono<EnvironmentMapping> save(EnvironmentMapping mapping);

    Mono<Optional<EnvironmentMapping>> findByNativeId(String tenantId, String environmentId, String nativeId);

    Flux<EnvironmentMapping> findByCanonicalId(String tenantId, String environmentId, String canonicalId);

    Flux<EnvironmentMapping> findByEnvironment(String tenantId, String environmentId);

    Flux<EnvironmentMapping> findByStatus(String tenantId, String environmentId, WorkflowMappingStatus status);
}
