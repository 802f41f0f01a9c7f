package com.lyshra.open.flowsync.integration.contract.store;

import com.lyshra.open.flowsync.integration.models.identity.ContentHashRegistryEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable backing for the content hash collision registry: first-seen payload per hash.
 */
public interface IContentHashRegistryStore {

    /**
     * @return true if the entry was stored, false if the hash was already registered
     */
    Mono<Boolean> putIfAbsent(ContentHashRegistryEntry entry);

    Flux<ContentHashRegistryEntry> findAll();

    Mono<Void> deleteAll();
}
