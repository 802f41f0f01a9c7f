package com.lyshra.open.flowsync.core.engine.store.impl;

import com.lyshra.open.flowsync.integration.contract.store.IContentHashRegistryStore;
import com.lyshra.open.flowsync.integration.models.identity.ContentHashRegistryEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile registry backing. Entries do not survive a restart.
 */
public class InMemoryContentHashRegistryStore implements IContentHashRegistryStore {

    private final Map<String, ContentHashRegistryEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Mono<Boolean> putIfAbsent(ContentHashRegistryEntry entry) {
        return Mono.fromCallable(() -> entries.putIfAbsent(entry.getContentHash(), entry) == null);
    }

    @Override
    public Flux<ContentHashRegistryEntry> findAll() {
        return Flux.defer(() -> Flux.fromIterable(entries.values()));
    }

    @Override
    public Mono<Void> deleteAll() {
        return Mono.fromRunnable(entries::clear);
    }
}
