package com.lyshra.open.flowsync.integration.contract.store;

import com.lyshra.open.flowsync.integration.models.identity.CanonicalWorkflow;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Identity store holding one row per (tenant, canonical id).
 *
 * <p>Rows are soft-deleted through {@code deletedAt}; implementations never
 * remove a canonical workflow and never change its canonical id.</p>
 */
public interface ICanonicalWorkflowStore {

    /**
     * Creates or replaces the row keyed by (tenant, canonical id).
     */
    Mono<CanonicalWorkflow> save(CanonicalWorkflow workflow);

    /**
     * Atomically inserts the workflow unless a row with the same key exists.
     *
     * @return true if the row was created by this call
     */
    Mono<Boolean> insertIfAbsent(CanonicalWorkflow workflow);

    /**
     * Finds a canonical workflow, including soft-deleted ones.
     */
    Mono<Optional<CanonicalWorkflow>> findById(String tenantId, String canonicalId);

    Flux<CanonicalWorkflow> findByTenant(String tenantId);
}
