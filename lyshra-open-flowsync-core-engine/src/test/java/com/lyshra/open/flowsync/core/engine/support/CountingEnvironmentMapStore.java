package com.lyshra.open.flowsync.core.engine.support;

import com.lyshra.open.flowsync.integration.contract.store.IEnvironmentMapStore;
import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delegating store that counts writes.
 */
public class CountingEnvironmentMapStore implements IEnvironmentMapStore {

    private final IEnvironmentMapStore delegate;
    private final AtomicInteger saves = new AtomicInteger();

    public CountingEnvironmentMapStore(IEnvironmentMapStore delegate) {
        this.delegate = delegate;
    }

    public int getSaves() {
        return saves.get();
    }

    public void reset() {
        saves.set(0);
    }

    @Override
    public Mono<EnvironmentMapping> save(EnvironmentMapping mapping) {
        return Mono.defer(() -> {
            saves.incrementAndGet();
            return delegate.save(mapping);
        });
    }

    @Override
    public Mono<Optional<EnvironmentMapping>> findByNativeId(String tenantId, String environmentId, String nativeId) {
        return delegate.findByNativeId(tenantId, environmentId, nativeId);
    }

    @Override
    public Flux<EnvironmentMapping> findByCanonicalId(String tenantId, String environmentId, String canonicalId) {
        return delegate.findByCanonicalId(tenantId, environmentId, canonicalId);
    }

    @Override
    public Flux<EnvironmentMapping> findByEnvironment(String tenantId, String environmentId) {
        return delegate.findByEnvironment(tenantId, environmentId);
    }

    @Override
    public Flux<EnvironmentMapping> findByStatus(String tenantId, String environmentId, WorkflowMappingStatus status) {
        return delegate.findByStatus(tenantId, environmentId, status);
    }
}
