package com.lyshra.open.flowsync.core.engine.hash;

import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Maps each content hash to the first normalized payload seen for it.
 *
 * <p>Shared by every task of every sync run in the process, so implementations must be
 * thread-safe. Must be loaded before the first sync of a process lifetime.</p>
 */
public interface IHashCollisionRegistry {

    /**
     * Loads persisted entries once per process. Later calls complete immediately.
     */
    Mono<Void> ensureLoaded();

    /**
     * Registers the payload unless the hash is already known.
     *
     * @return empty if this call registered the hash, otherwise the payload registered earlier
     */
    Mono<Optional<String>> registerIfAbsent(String contentHash, String canonicalPayload);

    long size();

    Mono<Void> clear();
}
