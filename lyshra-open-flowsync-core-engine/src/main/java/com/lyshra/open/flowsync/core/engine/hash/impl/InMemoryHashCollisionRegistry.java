package com.lyshra.open.flowsync.core.engine.hash.impl;

import com.lyshra.open.flowsync.core.engine.hash.IHashCollisionRegistry;
import com.lyshra.open.flowsync.core.exception.codes.FlowSyncErrorCodes;
import com.lyshra.open.flowsync.integration.contract.store.IContentHashRegistryStore;
import com.lyshra.open.flowsync.integration.exception.FlowSyncStorageException;
import com.lyshra.open.flowsync.integration.models.identity.ContentHashRegistryEntry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide collision registry held in a {@link ConcurrentHashMap} and written through
 * to an {@link IContentHashRegistryStore}, which is read back into memory on first use.
 */
@Slf4j
public class InMemoryHashCollisionRegistry implements IHashCollisionRegistry {

    private final Map<String, String> payloadsByHash = new ConcurrentHashMap<>();
    private final IContentHashRegistryStore store;
    private volatile Mono<Void> loading;

    public InMemoryHashCollisionRegistry(IContentHashRegistryStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public Mono<Void> ensureLoaded() {
        Mono<Void> current = loading;
        if (current == null) {
            synchronized (this) {
                if (loading == null) {
                    loading = load()
                            .doOnError(e -> loading = null)
                            .cache();
                }
                current = loading;
            }
        }
        return current;
    }

    private Mono<Void> load() {
        return store.findAll()
                .doOnNext(entry -> payloadsByHash.putIfAbsent(entry.getContentHash(), entry.getNormalizedPayload()))
                .count()
                .doOnNext(count -> log.info("Content hash registry loaded: {} persisted entries, {} in memory",
                        count, payloadsByHash.size()))
                .onErrorMap(e -> !(e instanceof FlowSyncStorageException), e -> new FlowSyncStorageException(
                        FlowSyncErrorCodes.CONTENT_HASH_REGISTRY_UNAVAILABLE,
                        Map.of("reason", String.valueOf(e.getMessage())), e))
                .then();
    }

    @Override
    public Mono<Optional<String>> registerIfAbsent(String contentHash, String canonicalPayload) {
        return Mono.defer(() -> {
            String existing = payloadsByHash.putIfAbsent(contentHash, canonicalPayload);
            if (existing != null) {
                return Mono.just(Optional.of(existing));
            }
            log.debug("Registered new content hash {}", contentHash);
            ContentHashRegistryEntry entry = ContentHashRegistryEntry.builder()
                    .contentHash(contentHash)
                    .normalizedPayload(canonicalPayload)
                    .build();
            return store.putIfAbsent(entry).thenReturn(Optional.<String>empty());
        });
    }

    @Override
    public long size() {
        return payloadsByHash.size();
    }

    @Override
    public Mono<Void> clear() {
        return Mono.defer(() -> {
            log.info("Clearing content hash registry ({} entries)", payloadsByHash.size());
            payloadsByHash.clear();
            return store.deleteAll();
        });
    }
}
