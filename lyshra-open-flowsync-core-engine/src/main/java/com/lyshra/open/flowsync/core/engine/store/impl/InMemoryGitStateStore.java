package com.lyshra.open.flowsync.core.engine.store.impl;

import com.lyshra.open.flowsync.integration.contract.store.IGitStateStore;
import com.lyshra.open.flowsync.integration.models.identity.GitState;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * In-memory git-state tracker keyed by (tenant, environment, canonical id).
 */
@Slf4j
public class InMemoryGitStateStore implements IGitStateStore {

    private final Map<GitStateKey, GitState> store = new ConcurrentHashMap<>();

    private record GitStateKey(String tenantId, String environmentId, String canonicalId) {
    }

    @Override
    public Mono<GitState> save(GitState gitState) {
        return Mono.fromCallable(() -> {
            if (gitState.getTenantId() == null || gitState.getEnvironmentId() == null || gitState.getCanonicalId() == null) {
                throw new IllegalArgumentException("tenantId, environmentId and canonicalId cannot be null");
            }
            store.put(new GitStateKey(gitState.getTenantId(), gitState.getEnvironmentId(), gitState.getCanonicalId()), gitState);
            log.debug("Saved git state {}/{}/{} hash={}", gitState.getTenantId(), gitState.getEnvironmentId(),
                    gitState.getCanonicalId(), gitState.getContentHash());
            return gitState;
        });
    }

    @Override
    public Mono<Optional<GitState>> find(String tenantId, String environmentId, String canonicalId) {
        return Mono.fromCallable(() -> Optional.ofNullable(store.get(new GitStateKey(tenantId, environmentId, canonicalId))));
    }

    @Override
    public Mono<Optional<GitState>> findByPath(String tenantId, String environmentId, String path) {
        return Mono.fromCallable(() -> inEnvironment(tenantId, environmentId)
                .filter(state -> Objects.equals(state.getPath(), path))
                .findFirst());
    }

    @Override
    public Flux<GitState> findByContentHash(String tenantId, String environmentId, String contentHash) {
        return Flux.defer(() -> Flux.fromStream(inEnvironment(tenantId, environmentId)
                .filter(state -> Objects.equals(state.getContentHash(), contentHash))));
    }

    @Override
    public Flux<GitState> findByEnvironment(String tenantId, String environmentId) {
        return Flux.defer(() -> Flux.fromStream(inEnvironment(tenantId, environmentId)));
    }

    private Stream<GitState> inEnvironment(String tenantId, String environmentId) {
        return store.values().stream()
                .filter(state -> state.getTenantId().equals(tenantId) && state.getEnvironmentId().equals(environmentId))
                .sorted(Comparator.comparing(GitState::getCanonicalId));
    }
}
