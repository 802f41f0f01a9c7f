package com.lyshra.open.flowsync.core.engine.mapping.impl;

import com.lyshra.open.flowsync.core.engine.mapping.ICanonicalWorkflowService;
import com.lyshra.open.flowsync.core.exception.codes.FlowSyncErrorCodes;
import com.lyshra.open.flowsync.integration.contract.store.ICanonicalWorkflowStore;
import com.lyshra.open.flowsync.integration.contract.store.IGitStateStore;
import com.lyshra.open.flowsync.integration.exception.FlowSyncRuntimeException;
import com.lyshra.open.flowsync.integration.models.identity.CanonicalWorkflow;
import com.lyshra.open.flowsync.integration.models.identity.GitState;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
public class CanonicalWorkflowServiceImpl implements ICanonicalWorkflowService {

    private final ICanonicalWorkflowStore canonicalWorkflowStore;
    private final IGitStateStore gitStateStore;

    public CanonicalWorkflowServiceImpl(ICanonicalWorkflowStore canonicalWorkflowStore, IGitStateStore gitStateStore) {
        this.canonicalWorkflowStore = canonicalWorkflowStore;
        this.gitStateStore = gitStateStore;
    }

    @Override
    public Mono<CanonicalWorkflow> create(String tenantId, String canonicalId, String displayName, String actor) {
        String id = canonicalId != null && !canonicalId.isBlank() ? canonicalId : UUID.randomUUID().toString();
        CanonicalWorkflow workflow = CanonicalWorkflow.builder()
                .tenantId(tenantId)
                .canonicalId(id)
                .displayName(displayName)
                .createdBy(actor)
                .build();
        return canonicalWorkflowStore.insertIfAbsent(workflow)
                .flatMap(created -> {
                    if (created) {
                        log.info("Created canonical workflow {} for tenant {} by {}", id, tenantId, actor);
                        return Mono.just(workflow);
                    }
                    return require(tenantId, id);
                });
    }

    @Override
    public Mono<Optional<CanonicalWorkflow>> get(String tenantId, String canonicalId) {
        return canonicalWorkflowStore.findById(tenantId, canonicalId)
                .map(found -> found.filter(workflow -> !workflow.isDeleted()));
    }

    @Override
    public Flux<CanonicalWorkflow> list(String tenantId, boolean includeDeleted) {
        return canonicalWorkflowStore.findByTenant(tenantId)
                .filter(workflow -> includeDeleted || !workflow.isDeleted());
    }

    @Override
    public Mono<CanonicalWorkflow> updateDisplayName(String tenantId, String canonicalId, String displayName) {
        return require(tenantId, canonicalId)
                .flatMap(workflow -> {
                    if (workflow.isDeleted()) {
                        return Mono.error(new FlowSyncRuntimeException(FlowSyncErrorCodes.CANONICAL_WORKFLOW_DELETED,
                                Map.of("canonicalId", canonicalId)));
                    }
                    return canonicalWorkflowStore.save(workflow.toBuilder().displayName(displayName).build());
                });
    }

    @Override
    public Mono<CanonicalWorkflow> softDelete(String tenantId, String canonicalId) {
        return require(tenantId, canonicalId)
                .flatMap(workflow -> {
                    if (workflow.isDeleted()) {
                        return Mono.just(workflow);
                    }
                    log.info("Soft-deleting canonical workflow {} for tenant {}", canonicalId, tenantId);
                    return canonicalWorkflowStore.save(workflow.toBuilder().deletedAt(Instant.now()).build());
                });
    }

    @Override
    public Mono<Optional<GitState>> getGitState(String tenantId, String environmentId, String canonicalId) {
        return gitStateStore.find(tenantId, environmentId, canonicalId);
    }

    @Override
    public Flux<GitState> listGitStates(String tenantId, String environmentId) {
        return gitStateStore.findByEnvironment(tenantId, environmentId);
    }

    private Mono<CanonicalWorkflow> require(String tenantId, String canonicalId) {
        return canonicalWorkflowStore.findById(tenantId, canonicalId)
                .flatMap(found -> Mono.justOrEmpty(found))
                .switchIfEmpty(Mono.error(() -> new FlowSyncRuntimeException(FlowSyncErrorCodes.CANONICAL_WORKFLOW_NOT_FOUND,
                        Map.of("canonicalId", canonicalId, "tenantId", tenantId))));
    }
}
