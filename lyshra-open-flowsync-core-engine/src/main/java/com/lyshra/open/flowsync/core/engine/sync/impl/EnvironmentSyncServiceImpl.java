package com.lyshra.open.flowsync.core.engine.sync.impl;

import com.lyshra.open.flowsync.core.engine.config.FlowSyncConfig;
import com.lyshra.open.flowsync.core.engine.hash.FingerprintResult;
import com.lyshra.open.flowsync.core.engine.hash.IHashCollisionRegistry;
import com.lyshra.open.flowsync.core.engine.hash.WorkflowContentHasher;
import com.lyshra.open.flowsync.core.engine.link.IWorkflowAutoLinker;
import com.lyshra.open.flowsync.core.engine.lock.ISyncLockService;
import com.lyshra.open.flowsync.core.engine.status.WorkflowMappingStatusResolver;
import com.lyshra.open.flowsync.core.engine.sync.IEnvironmentSyncService;
import com.lyshra.open.flowsync.core.engine.sync.ISyncProgressListener;
import com.lyshra.open.flowsync.core.engine.sync.SyncResultCollector;
import com.lyshra.open.flowsync.core.engine.sync.TimestampNormalizer;
import com.lyshra.open.flowsync.integration.contract.source.IRuntimeReader;
import com.lyshra.open.flowsync.integration.contract.store.ICanonicalWorkflowStore;
import com.lyshra.open.flowsync.integration.contract.store.IEnvironmentMapStore;
import com.lyshra.open.flowsync.integration.enumerations.EnvironmentClass;
import com.lyshra.open.flowsync.integration.enumerations.SyncType;
import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.exception.DuplicateMappingException;
import com.lyshra.open.flowsync.integration.models.identity.CanonicalWorkflow;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import com.lyshra.open.flowsync.integration.models.source.RuntimeWorkflow;
import com.lyshra.open.flowsync.integration.models.sync.SyncResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Environment sync.
 *
 * <ol>
 *   <li>List the runtime once.</li>
 *   <li>For each workflow, look up its mapping by native id. A present, non-MISSING row
 *       whose stored timestamp equals the runtime's (after normalization) is skipped
 *       without hashing.</li>
 *   <li>Otherwise fingerprint it, try the auto-linker when the row has no canonical id,
 *       resolve the status and upsert the row.</li>
 *   <li>Mark every row that was present before but not listed now as gone; the resolver
 *       turns it MISSING unless it is ignored or deleted. Skipped when the listing failed.</li>
 * </ol>
 */
@Slf4j
public class EnvironmentSyncServiceImpl extends AbstractSyncService implements IEnvironmentSyncService {

    private final IRuntimeReader runtimeReader;
    private final IEnvironmentMapStore environmentMapStore;
    private final ICanonicalWorkflowStore canonicalWorkflowStore;
    private final WorkflowContentHasher hasher;
    private final IWorkflowAutoLinker autoLinker;

    public EnvironmentSyncServiceImpl(FlowSyncConfig config,
                                      IRuntimeReader runtimeReader,
                                      IEnvironmentMapStore environmentMapStore,
                                      ICanonicalWorkflowStore canonicalWorkflowStore,
                                      WorkflowContentHasher hasher,
                                      IHashCollisionRegistry collisionRegistry,
                                      IWorkflowAutoLinker autoLinker,
                                      ISyncLockService lockService,
                                      ISyncProgressListener progressListener) {
        super(config, lockService, collisionRegistry, progressListener);
        this.runtimeReader = runtimeReader;
        this.environmentMapStore = environmentMapStore;
        this.canonicalWorkflowStore = canonicalWorkflowStore;
        this.hasher = hasher;
        this.autoLinker = autoLinker;
    }

    @Override
    public Mono<SyncResult> syncEnvironment(String tenantId, String environmentId) {
        return runGuarded(tenantId, environmentId, SyncType.ENVIRONMENT,
                collector -> run(tenantId, environmentId, collector));
    }

    private Mono<Void> run(String tenantId, String environmentId, SyncResultCollector collector) {
        EnvironmentClass environmentClass = config.environmentClassOf(environmentId);
        return listSource(runtimeReader.listWorkflows(tenantId, environmentId), tenantId, environmentId, collector)
                .flatMap(listing -> {
                    if (listing.isEmpty()) {
                        log.warn("Runtime listing of {}/{} failed; MISSING detection skipped", tenantId, environmentId);
                        return Mono.empty();
                    }
                    Set<String> seen = ConcurrentHashMap.newKeySet();
                    List<RuntimeWorkflow> workflows = new ArrayList<>();
                    for (RuntimeWorkflow workflow : listing.get()) {
                        if (workflow.getNativeId() == null) {
                            collector.error(environmentId, "Runtime workflow '" + workflow.getName() + "' has no native id");
                        } else if (!seen.add(workflow.getNativeId())) {
                            log.warn("Runtime of {}/{} listed native workflow {} twice; keeping the first",
                                    tenantId, environmentId, workflow.getNativeId());
                        } else {
                            workflows.add(workflow);
                        }
                    }
                    return processInBatches(workflows,
                            RuntimeWorkflow::getNativeId,
                            workflow -> reconcile(tenantId, environmentId, workflow, environmentClass, collector),
                            tenantId, environmentId, SyncType.ENVIRONMENT, collector)
                            .then(markUnseen(tenantId, environmentId, seen, collector));
                });
    }

    private Mono<Void> reconcile(String tenantId, String environmentId, RuntimeWorkflow workflow,
                                 EnvironmentClass environmentClass, SyncResultCollector collector) {
        return environmentMapStore.findByNativeId(tenantId, environmentId, workflow.getNativeId())
                .flatMap(found -> {
                    EnvironmentMapping existing = found.orElse(null);
                    if (isUnchanged(existing, workflow)) {
                        log.debug("Skipping unchanged native workflow {} in {}/{}", workflow.getNativeId(), tenantId, environmentId);
                        collector.skipped();
                        return Mono.empty();
                    }
                    String canonicalId = existing != null ? existing.getCanonicalId() : null;
                    return hasher.computeFingerprint(workflow.getDefinition(), canonicalId)
                            .flatMap(fingerprint -> {
                                if (fingerprint.isCollisionDetected()) {
                                    collector.collision(workflow.getNativeId(), canonicalId, fingerprint);
                                }
                                return linkTarget(tenantId, environmentId, workflow, existing, fingerprint)
                                        .flatMap(linkTarget -> write(tenantId, environmentId, workflow, existing,
                                                fingerprint, linkTarget, environmentClass, collector));
                            });
                });
    }

    private boolean isUnchanged(EnvironmentMapping existing, RuntimeWorkflow workflow) {
        return existing != null
                && existing.isPresentInRuntime()
                && existing.getStatus() != WorkflowMappingStatus.MISSING
                && TimestampNormalizer.isUnchanged(existing.getNativeUpdatedAt(), workflow.getUpdatedAt());
    }

    /**
     * The auto-linker runs for new rows and for UNTRACKED rows whose content changed, never
     * on an unresolved collision hash. A MISSING row without identity that reappears comes
     * back UNTRACKED.
     */
    private Mono<Optional<String>> linkTarget(String tenantId, String environmentId, RuntimeWorkflow workflow,
                                              EnvironmentMapping existing, FingerprintResult fingerprint) {
        boolean eligible = existing == null
                || (existing.getStatus() == WorkflowMappingStatus.UNTRACKED && !existing.isTracked());
        if (!eligible) {
            return Mono.just(Optional.empty());
        }
        if (fingerprint.isUnresolvedCollision()) {
            log.warn("Auto-link of native workflow {} in {} skipped: hash {} collides with a different workflow",
                    workflow.getNativeId(), environmentId, fingerprint.getContentHash());
            return Mono.just(Optional.empty());
        }
        return autoLinker.tryAutoLink(tenantId, environmentId, workflow.getNativeId(), fingerprint.getContentHash());
    }

    private Mono<Void> write(String tenantId, String environmentId, RuntimeWorkflow workflow, EnvironmentMapping existing,
                             FingerprintResult fingerprint, Optional<String> autoLinkTarget,
                             EnvironmentClass environmentClass, SyncResultCollector collector) {
        Instant now = Instant.now();
        String canonicalId = existing != null && existing.isTracked() ? existing.getCanonicalId() : autoLinkTarget.orElse(null);
        boolean autoLinked = autoLinkTarget.isPresent();

        EnvironmentMapping.EnvironmentMappingBuilder builder = existing != null
                ? existing.toBuilder()
                : EnvironmentMapping.builder()
                        .tenantId(tenantId)
                        .environmentId(environmentId)
                        .nativeId(workflow.getNativeId());
        builder.canonicalId(canonicalId)
                .contentHash(fingerprint.getContentHash())
                .nativeUpdatedAt(TimestampNormalizer.normalize(workflow.getUpdatedAt()).orElse(null))
                .presentInRuntime(true)
                .lastEnvSyncAt(now);
        if (autoLinked) {
            builder.linkedAt(now).linkedBy(config.getAutoLinkActor());
        }
        if (environmentClass.cachesPayload()) {
            builder.workflowData(workflow.getDefinition()).displayName(workflow.getName());
        } else {
            builder.workflowData(null);
        }

        return isCanonicalDeleted(tenantId, canonicalId)
                .flatMap(canonicalDeleted -> {
                    EnvironmentMapping draft = builder.build();
                    WorkflowMappingStatus status = WorkflowMappingStatusResolver.resolve(draft, canonicalDeleted);
                    EnvironmentMapping row = draft.toBuilder().status(status).build();
                    return environmentMapStore.save(row)
                            .onErrorResume(DuplicateMappingException.class,
                                    conflict -> saveUntracked(row, existing, conflict));
                })
                .doOnNext(saved -> {
                    if (existing == null) {
                        collector.created();
                    }
                    collector.written(saved.getStatus());
                })
                .then();
    }

    /**
     * Another native workflow took the canonical slot between lookup and write. The row is
     * kept without identity instead of overwriting the other binding.
     */
    private Mono<EnvironmentMapping> saveUntracked(EnvironmentMapping row, EnvironmentMapping existing,
                                                   DuplicateMappingException conflict) {
        log.warn("Mapping of native workflow {} in {} lost canonical workflow {} to native workflow {}; keeping it untracked",
                row.getNativeId(), row.getEnvironmentId(), row.getCanonicalId(), conflict.getConflictingNativeId());
        EnvironmentMapping draft = row.toBuilder()
                .canonicalId(null)
                .linkedAt(existing != null ? existing.getLinkedAt() : null)
                .linkedBy(existing != null ? existing.getLinkedBy() : null)
                .build();
        WorkflowMappingStatus status = WorkflowMappingStatusResolver.resolve(draft, false);
        return environmentMapStore.save(draft.toBuilder().status(status).build());
    }

    private Mono<Void> markUnseen(String tenantId, String environmentId, Set<String> seen, SyncResultCollector collector) {
        Instant now = Instant.now();
        return environmentMapStore.findByEnvironment(tenantId, environmentId)
                .filter(row -> row.getNativeId() != null && !seen.contains(row.getNativeId()) && row.isPresentInRuntime())
                .concatMap(row -> isCanonicalDeleted(tenantId, row.getCanonicalId())
                        .flatMap(canonicalDeleted -> {
                            EnvironmentMapping gone = row.toBuilder().presentInRuntime(false).lastEnvSyncAt(now).build();
                            WorkflowMappingStatus status = WorkflowMappingStatusResolver.resolve(gone, canonicalDeleted);
                            return environmentMapStore.save(gone.toBuilder().status(status).build());
                        })
                        .doOnNext(saved -> {
                            if (saved.getStatus() == WorkflowMappingStatus.MISSING) {
                                log.info("Native workflow {} (canonical {}) disappeared from {}/{}",
                                        saved.getNativeId(), saved.getCanonicalId(), tenantId, environmentId);
                                collector.missing();
                            }
                        })
                        .then()
                        .onErrorResume(AbstractSyncService::isItemScoped, error -> {
                            collector.error(row.getNativeId(), error);
                            return Mono.empty();
                        }))
                .then();
    }

    private Mono<Boolean> isCanonicalDeleted(String tenantId, String canonicalId) {
        if (canonicalId == null) {
            return Mono.just(false);
        }
        return canonicalWorkflowStore.findById(tenantId, canonicalId)
                .map(found -> found.map(CanonicalWorkflow::isDeleted).orElse(false));
    }
}
