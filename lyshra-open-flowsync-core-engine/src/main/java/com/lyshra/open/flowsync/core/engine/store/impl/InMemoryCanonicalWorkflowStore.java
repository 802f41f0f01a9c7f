package com.lyshra.open.flowsync.core.engine.store.impl;

import com.lyshra.open.flowsync.integration.contract.store.ICanonicalWorkflowStore;
import com.lyshra.open.flowsync.integration.models.identity.CanonicalWorkflow;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory identity store. State is lost on restart.
 *
 * <h2>Thread Safety</h2>
 * Uses ConcurrentHashMap; {@link #insertIfAbsent} is atomic.
 */
@Slf4j
public class InMemoryCanonicalWorkflowStore implements ICanonicalWorkflowStore {

    private final Map<CanonicalKey, CanonicalWorkflow> store = new ConcurrentHashMap<>();

    private record CanonicalKey(String tenantId, String canonicalId) {
        static CanonicalKey of(CanonicalWorkflow workflow) {
            return new CanonicalKey(workflow.getTenantId(), workflow.getCanonicalId());
        }
    }

    @Override
    public Mono<CanonicalWorkflow> save(CanonicalWorkflow workflow) {
        return Mono.fromCallable(() -> {
            requireKey(workflow);
            store.put(CanonicalKey.of(workflow), workflow);
            log.debug("Saved canonical workflow {}/{}", workflow.getTenantId(), workflow.getCanonicalId());
            return workflow;
        });
    }

    @Override
    public Mono<Boolean> insertIfAbsent(CanonicalWorkflow workflow) {
        return Mono.fromCallable(() -> {
            requireKey(workflow);
            boolean created = store.putIfAbsent(CanonicalKey.of(workflow), workflow) == null;
            if (created) {
                log.debug("Created canonical workflow {}/{}", workflow.getTenantId(), workflow.getCanonicalId());
            }
            return created;
        });
    }

    @Override
    public Mono<Optional<CanonicalWorkflow>> findById(String tenantId, String canonicalId) {
        return Mono.fromCallable(() -> Optional.ofNullable(store.get(new CanonicalKey(tenantId, canonicalId))));
    }

    @Override
    public Flux<CanonicalWorkflow> findByTenant(String tenantId) {
        return Flux.defer(() -> Flux.fromStream(store.values().stream()
                .filter(workflow -> workflow.getTenantId().equals(tenantId))
                .sorted(Comparator.comparing(CanonicalWorkflow::getCanonicalId))));
    }

    private static void requireKey(CanonicalWorkflow workflow) {
        if (workflow.getTenantId() == null || workflow.getCanonicalId() == null) {
            throw new IllegalArgumentException("tenantId and canonicalId cannot be null");
        }
    }
}
