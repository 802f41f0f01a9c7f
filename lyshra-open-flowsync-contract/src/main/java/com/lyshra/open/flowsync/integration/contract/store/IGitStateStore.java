package com.lyshra.open.flowsync.integration.contract.store;

import com.lyshra.open.flowsync.integration.models.identity.GitState;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Git-state tracker. Exactly one row per (tenant, environment, canonical id).
 */
public interface IGitStateStore {

    /**
     * Upserts the row keyed by (tenant, environment, canonical id).
     */
    Mono<GitState> save(GitState gitState);

    Mono<Optional<GitState>> find(String tenantId, String environmentId, String canonicalId);

    /**
     * Finds the row last recorded for a repository path. Serves as the explicit
     * path to canonical id mapping used by repository sync.
     */
    Mono<Optional<GitState>> findByPath(String tenantId, String environmentId, String path);

    Flux<GitState> findByContentHash(String tenantId, String environmentId, String contentHash);

    Flux<GitState> findByEnvironment(String tenantId, String environmentId);
}
