package com.lyshra.open.flowsync.core.engine.link.impl;

import com.lyshra.open.flowsync.core.engine.link.IWorkflowAutoLinker;
import com.lyshra.open.flowsync.integration.contract.store.ICanonicalWorkflowStore;
import com.lyshra.open.flowsync.integration.contract.store.IEnvironmentMapStore;
import com.lyshra.open.flowsync.integration.contract.store.IGitStateStore;
import com.lyshra.open.flowsync.integration.models.identity.CanonicalWorkflow;
import com.lyshra.open.flowsync.integration.models.identity.GitState;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Slf4j
public class WorkflowAutoLinkerImpl implements IWorkflowAutoLinker {

    private final IGitStateStore gitStateStore;
    private final IEnvironmentMapStore environmentMapStore;
    private final ICanonicalWorkflowStore canonicalWorkflowStore;

    public WorkflowAutoLinkerImpl(IGitStateStore gitStateStore,
                                  IEnvironmentMapStore environmentMapStore,
                                  ICanonicalWorkflowStore canonicalWorkflowStore) {
        this.gitStateStore = gitStateStore;
        this.environmentMapStore = environmentMapStore;
        this.canonicalWorkflowStore = canonicalWorkflowStore;
    }

    @Override
    public Mono<Optional<String>> tryAutoLink(String tenantId, String environmentId, String nativeId, String contentHash) {
        if (contentHash == null) {
            return Mono.just(Optional.empty());
        }
        return gitStateStore.findByContentHash(tenantId, environmentId, contentHash)
                .map(GitState::getCanonicalId)
                .distinct()
                .collectList()
                .flatMap(candidates -> {
                    if (candidates.size() != 1) {
                        logNoUniqueMatch(environmentId, nativeId, contentHash, candidates);
                        return Mono.just(Optional.<String>empty());
                    }
                    return verifyCandidate(tenantId, environmentId, nativeId, candidates.get(0));
                });
    }

    private Mono<Optional<String>> verifyCandidate(String tenantId, String environmentId, String nativeId, String canonicalId) {
        Mono<Boolean> canonicalLive = canonicalWorkflowStore.findById(tenantId, canonicalId)
                .map(WorkflowAutoLinkerImpl::isLive);
        Mono<Optional<String>> conflictingNativeId = environmentMapStore.findByCanonicalId(tenantId, environmentId, canonicalId)
                .filter(row -> row.getStatus() != null && row.getStatus().occupiesCanonicalSlot())
                .filter(row -> !Objects.equals(row.getNativeId(), nativeId))
                .next()
                .map(row -> Optional.ofNullable(row.getNativeId()).or(() -> Optional.of("<unknown>")))
                .defaultIfEmpty(Optional.empty());

        return Mono.zip(canonicalLive, conflictingNativeId)
                .map(tuple -> {
                    if (!tuple.getT1()) {
                        log.warn("Auto-link of native workflow {} in {} skipped: canonical workflow {} is missing or deleted",
                                nativeId, environmentId, canonicalId);
                        return Optional.<String>empty();
                    }
                    if (tuple.getT2().isPresent()) {
                        log.warn("Auto-link of native workflow {} in {} rejected: canonical workflow {} already mapped to native workflow {}",
                                nativeId, environmentId, canonicalId, tuple.getT2().get());
                        return Optional.<String>empty();
                    }
                    log.info("Auto-linked native workflow {} in {} to canonical workflow {}", nativeId, environmentId, canonicalId);
                    return Optional.of(canonicalId);
                });
    }

    private void logNoUniqueMatch(String environmentId, String nativeId, String contentHash, List<String> candidates) {
        if (candidates.isEmpty()) {
            log.debug("No git state in {} matches hash {} of native workflow {}", environmentId, contentHash, nativeId);
        } else {
            log.warn("Auto-link of native workflow {} in {} is ambiguous: hash {} matches canonical workflows {}",
                    nativeId, environmentId, contentHash, candidates);
        }
    }

    private static boolean isLive(Optional<CanonicalWorkflow> workflow) {
        return workflow.map(w -> !w.isDeleted()).orElse(false);
    }
}
