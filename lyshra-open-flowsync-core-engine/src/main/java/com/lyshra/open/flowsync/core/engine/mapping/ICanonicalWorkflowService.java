package com.lyshra.open.flowsync.core.engine.mapping;

import com.lyshra.open.flowsync.integration.models.identity.CanonicalWorkflow;
import com.lyshra.open.flowsync.integration.models.identity.GitState;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Administration of canonical workflow identities and read access to their git state.
 */
public interface ICanonicalWorkflowService {

    /**
     * Creates a canonical workflow. A random UUID is minted when {@code canonicalId} is null.
     * Creating an id that already exists returns the existing row unchanged.
     */
    Mono<CanonicalWorkflow> create(String tenantId, String canonicalId, String displayName, String actor);

    /**
     * @return the canonical workflow, empty when unknown or soft-deleted
     */
    Mono<Optional<CanonicalWorkflow>> get(String tenantId, String canonicalId);

    Flux<CanonicalWorkflow> list(String tenantId, boolean includeDeleted);

    Mono<CanonicalWorkflow> updateDisplayName(String tenantId, String canonicalId, String displayName);

    /**
     * Sets {@code deletedAt}. Every mapping of the workflow resolves as DELETED from then on.
     * Deleting twice keeps the first deletion time.
     */
    Mono<CanonicalWorkflow> softDelete(String tenantId, String canonicalId);

    Mono<Optional<GitState>> getGitState(String tenantId, String environmentId, String canonicalId);

    Flux<GitState> listGitStates(String tenantId, String environmentId);
}
