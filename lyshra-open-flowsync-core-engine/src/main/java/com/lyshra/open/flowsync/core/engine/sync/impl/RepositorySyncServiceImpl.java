package com.lyshra.open.flowsync.core.engine.sync.impl;

import com.lyshra.open.flowsync.core.engine.config.FlowSyncConfig;
import com.lyshra.open.flowsync.core.engine.hash.IHashCollisionRegistry;
import com.lyshra.open.flowsync.core.engine.hash.WorkflowContentHasher;
import com.lyshra.open.flowsync.core.engine.lock.ISyncLockService;
import com.lyshra.open.flowsync.core.engine.lock.SyncInProgressException;
import com.lyshra.open.flowsync.core.engine.sync.IRepositorySyncService;
import com.lyshra.open.flowsync.core.engine.sync.ISyncProgressListener;
import com.lyshra.open.flowsync.core.engine.sync.SidecarParser;
import com.lyshra.open.flowsync.core.engine.sync.SyncResultCollector;
import com.lyshra.open.flowsync.core.engine.sync.WorkflowDefinitionParser;
import com.lyshra.open.flowsync.core.exception.codes.FlowSyncErrorCodes;
import com.lyshra.open.flowsync.integration.contract.source.IRepositoryReader;
import com.lyshra.open.flowsync.integration.contract.store.ICanonicalWorkflowStore;
import com.lyshra.open.flowsync.integration.contract.store.IEnvironmentMapStore;
import com.lyshra.open.flowsync.integration.contract.store.IGitStateStore;
import com.lyshra.open.flowsync.integration.enumerations.SyncType;
import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.exception.DuplicateMappingException;
import com.lyshra.open.flowsync.integration.exception.FlowSyncRuntimeException;
import com.lyshra.open.flowsync.integration.models.identity.CanonicalWorkflow;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import com.lyshra.open.flowsync.integration.models.identity.GitState;
import com.lyshra.open.flowsync.integration.models.source.RepositoryWorkflowFile;
import com.lyshra.open.flowsync.integration.models.source.SidecarEnvironmentEntry;
import com.lyshra.open.flowsync.integration.models.source.WorkflowSidecar;
import com.lyshra.open.flowsync.integration.models.sync.SyncResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Repository sync.
 *
 * <p>The canonical id of a file comes from the git state already recorded for its path in
 * this environment and otherwise from the file name without extension
 * ({@code workflows/aaaa-1111.json} is {@code aaaa-1111}). The content never decides
 * identity, and two files of one environment may not resolve to the same id. A file
 * whose fingerprint equals the stored git state is skipped without writes; any other
 * file ensures its canonical workflow exists and upserts the git state.
 * A companion metadata file, when present, pre-populates LINKED environment mappings;
 * problems with it are reported against the metadata file and never undo the git state.</p>
 */
@Slf4j
public class RepositorySyncServiceImpl extends AbstractSyncService implements IRepositorySyncService {

    static final String REPOSITORY_SYNC_ACTOR = "system:repository-sync";
    static final String SIDECAR_OPERATION = "metadata-prepopulate";

    private final IRepositoryReader repositoryReader;
    private final ICanonicalWorkflowStore canonicalWorkflowStore;
    private final IGitStateStore gitStateStore;
    private final IEnvironmentMapStore environmentMapStore;
    private final WorkflowContentHasher hasher;

    public RepositorySyncServiceImpl(FlowSyncConfig config,
                                     IRepositoryReader repositoryReader,
                                     ICanonicalWorkflowStore canonicalWorkflowStore,
                                     IGitStateStore gitStateStore,
                                     IEnvironmentMapStore environmentMapStore,
                                     WorkflowContentHasher hasher,
                                     IHashCollisionRegistry collisionRegistry,
                                     ISyncLockService lockService,
                                     ISyncProgressListener progressListener) {
        super(config, lockService, collisionRegistry, progressListener);
        this.repositoryReader = repositoryReader;
        this.canonicalWorkflowStore = canonicalWorkflowStore;
        this.gitStateStore = gitStateStore;
        this.environmentMapStore = environmentMapStore;
        this.hasher = hasher;
    }

    @Override
    public Mono<SyncResult> syncRepository(String tenantId, String environmentId) {
        return runGuarded(tenantId, environmentId, SyncType.REPOSITORY, collector ->
                listSource(repositoryReader.listWorkflowFiles(tenantId, environmentId), tenantId, environmentId, collector)
                        .flatMap(listing -> listing
                                .map(files -> resolveIdentities(tenantId, environmentId, files, collector)
                                        .flatMap(resolved -> processInBatches(resolved,
                                                item -> item.file().getPath(),
                                                item -> ingest(tenantId, environmentId, item, collector),
                                                tenantId, environmentId, SyncType.REPOSITORY, collector)))
                                .orElseGet(Mono::empty)));
    }

    /**
     * Resolves the canonical id of every listed file before any write. Files that share a
     * canonical id in this environment are each reported as an error and left out, so two
     * definitions never take turns on one git state row. A file whose id cannot be resolved
     * here is resolved again, with retries, when it is processed.
     */
    private Mono<List<ResolvedFile>> resolveIdentities(String tenantId, String environmentId,
                                                       List<RepositoryWorkflowFile> files,
                                                       SyncResultCollector collector) {
        return Flux.fromIterable(files)
                .flatMapSequential(file -> resolveCanonicalId(tenantId, environmentId, file.getPath())
                        .map(canonicalId -> new ResolvedFile(file, canonicalId))
                        .onErrorResume(AbstractSyncService::isItemScoped, error -> Mono.just(new ResolvedFile(file, null))),
                        config.getBatchConcurrency())
                .collectList()
                .map(resolved -> {
                    Map<String, List<String>> pathsById = resolved.stream()
                            .filter(item -> item.canonicalId() != null)
                            .collect(Collectors.groupingBy(ResolvedFile::canonicalId, LinkedHashMap::new,
                                    Collectors.mapping(item -> item.file().getPath(), Collectors.toList())));
                    List<ResolvedFile> unique = new ArrayList<>(resolved.size());
                    for (ResolvedFile item : resolved) {
                        List<String> claimants = item.canonicalId() == null
                                ? List.of() : pathsById.get(item.canonicalId());
                        if (claimants.size() > 1) {
                            rejectDuplicate(item, claimants, collector);
                        } else {
                            unique.add(item);
                        }
                    }
                    return unique;
                });
    }

    private void rejectDuplicate(ResolvedFile item, List<String> claimants, SyncResultCollector collector) {
        String path = item.file().getPath();
        String others = claimants.stream()
                .filter(other -> !other.equals(path))
                .collect(Collectors.joining(", "));
        FlowSyncRuntimeException duplicate = new FlowSyncRuntimeException(FlowSyncErrorCodes.DUPLICATE_CANONICAL_ID,
                Map.of("path", path, "canonicalId", item.canonicalId(), "others", others));
        log.warn(duplicate.getMessage());
        collector.processed();
        collector.error(path, duplicate);
    }

    private Mono<Void> ingest(String tenantId, String environmentId, ResolvedFile item, SyncResultCollector collector) {
        if (item.canonicalId() != null) {
            return ingest(tenantId, environmentId, item.file(), item.canonicalId(), collector);
        }
        return resolveCanonicalId(tenantId, environmentId, item.file().getPath())
                .flatMap(canonicalId -> ingest(tenantId, environmentId, item.file(), canonicalId, collector));
    }

    private Mono<Void> ingest(String tenantId, String environmentId, RepositoryWorkflowFile file, String canonicalId,
                              SyncResultCollector collector) {
        Map<String, Object> definition = WorkflowDefinitionParser.parse(file.getPath(), file.getContent());
        return hasher.computeFingerprint(definition, canonicalId)
                .flatMap(fingerprint -> {
                    if (fingerprint.isCollisionDetected()) {
                        collector.collision(null, canonicalId, fingerprint);
                    }
                    return gitStateStore.find(tenantId, environmentId, canonicalId)
                            .flatMap(stored -> {
                                if (stored.isPresent() && fingerprint.getContentHash().equals(stored.get().getContentHash())) {
                                    log.debug("Skipping unchanged {} ({}) in {}/{}", file.getPath(), canonicalId, tenantId, environmentId);
                                    collector.skipped();
                                    return Mono.empty();
                                }
                                return ensureCanonical(tenantId, canonicalId, definition, collector)
                                        .then(gitStateStore.save(GitState.builder()
                                                .tenantId(tenantId)
                                                .environmentId(environmentId)
                                                .canonicalId(canonicalId)
                                                .path(file.getPath())
                                                .commitReference(file.getCommitReference())
                                                .contentHash(fingerprint.getContentHash())
                                                .lastSyncAt(Instant.now())
                                                .build()))
                                        .then(ingestSidecar(tenantId, environmentId, file, canonicalId, collector));
                            });
                });
    }

    private Mono<String> resolveCanonicalId(String tenantId, String environmentId, String path) {
        return gitStateStore.findByPath(tenantId, environmentId, path)
                .flatMap(mapped -> {
                    if (mapped.isPresent()) {
                        return Mono.just(mapped.get().getCanonicalId());
                    }
                    return Mono.justOrEmpty(canonicalIdFromFileName(path))
                            .switchIfEmpty(Mono.error(new FlowSyncRuntimeException(
                                    FlowSyncErrorCodes.CANONICAL_ID_UNRESOLVABLE, Map.of("path", path))));
                });
    }

    static Optional<String> canonicalIdFromFileName(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String fileName = path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\')) + 1);
        int extension = fileName.lastIndexOf('.');
        String stem = extension > 0 ? fileName.substring(0, extension) : fileName;
        return stem.isBlank() ? Optional.empty() : Optional.of(stem.trim());
    }

    private Mono<Void> ensureCanonical(String tenantId, String canonicalId, Map<String, Object> definition,
                                       SyncResultCollector collector) {
        CanonicalWorkflow workflow = CanonicalWorkflow.builder()
                .tenantId(tenantId)
                .canonicalId(canonicalId)
                .displayName(WorkflowDefinitionParser.displayNameOf(definition))
                .createdBy(REPOSITORY_SYNC_ACTOR)
                .build();
        return canonicalWorkflowStore.insertIfAbsent(workflow)
                .doOnNext(created -> {
                    if (created) {
                        log.info("Created canonical workflow {} for tenant {}", canonicalId, tenantId);
                        collector.created();
                    }
                })
                .then();
    }

    private Mono<Void> ingestSidecar(String tenantId, String environmentId, RepositoryWorkflowFile file,
                                     String canonicalId, SyncResultCollector collector) {
        if (!file.hasSidecar()) {
            return Mono.empty();
        }
        String sidecarPath = file.getSidecarPath() != null ? file.getSidecarPath() : file.getPath() + config.getSidecarSuffix();
        return Mono.fromCallable(() -> SidecarParser.parse(sidecarPath, file.getSidecarContent()))
                .flatMap(sidecar -> {
                    if (!canonicalId.equals(sidecar.getCanonicalWorkflowId())) {
                        return Mono.error(new FlowSyncRuntimeException(FlowSyncErrorCodes.SIDECAR_CANONICAL_ID_MISMATCH,
                                Map.of("path", sidecarPath,
                                        "declared", sidecar.getCanonicalWorkflowId(),
                                        "resolved", canonicalId)));
                    }
                    return prepopulate(tenantId, environmentId, canonicalId, sidecar, sidecarPath, collector);
                })
                .onErrorResume(AbstractSyncService::isItemScoped, error -> {
                    log.warn("Companion metadata file {} rejected: {}", sidecarPath, error.getMessage());
                    collector.error(sidecarPath, error);
                    return Mono.empty();
                });
    }

    /**
     * Rows for the environment being synced are written under this run's guard. Rows for any
     * other environment are written under that environment's guard; an environment with a
     * sync in progress is reported against the metadata file and left untouched.
     */
    private Mono<Void> prepopulate(String tenantId, String syncEnvironmentId, String canonicalId,
                                   WorkflowSidecar sidecar, String sidecarPath, SyncResultCollector collector) {
        if (sidecar.getEnvironments() == null || sidecar.getEnvironments().isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(sidecar.getEnvironments().entrySet())
                .filter(entry -> entry.getValue() != null)
                .concatMap(entry -> {
                    String environmentId = entry.getKey();
                    Mono<Void> write = prepopulateEnvironment(tenantId, environmentId, canonicalId, entry.getValue(), collector);
                    if (syncEnvironmentId.equals(environmentId)) {
                        return write;
                    }
                    return lockService.executeWithLock(tenantId, environmentId,
                                    config.getLockOwnerId() + ":" + UUID.randomUUID(),
                                    config.getSyncLockDuration(), SIDECAR_OPERATION, write)
                            .onErrorResume(SyncInProgressException.class, busy -> {
                                log.warn("Metadata entry for {} in {} not applied: {}", canonicalId, environmentId, busy.getMessage());
                                collector.error(sidecarPath, busy);
                                return Mono.empty();
                            });
                })
                .then();
    }

    /**
     * Creates a LINKED row unless the native workflow is already mapped or the canonical id
     * is already bound in that environment. Existing rows always win.
     */
    private Mono<Void> prepopulateEnvironment(String tenantId, String environmentId, String canonicalId,
                                              SidecarEnvironmentEntry entry, SyncResultCollector collector) {
        String nativeId = entry.getNativeId();
        return environmentMapStore.findByNativeId(tenantId, environmentId, nativeId)
                .flatMap(existing -> {
                    if (existing.isPresent()) {
                        log.debug("Native workflow {} in {} already mapped; metadata entry ignored", nativeId, environmentId);
                        return Mono.empty();
                    }
                    return environmentMapStore.findByCanonicalId(tenantId, environmentId, canonicalId)
                            .filter(row -> row.getStatus().occupiesCanonicalSlot())
                            .hasElements()
                            .flatMap(bound -> {
                                if (bound) {
                                    log.warn("Canonical workflow {} already bound in {}; metadata entry for native workflow {} ignored",
                                            canonicalId, environmentId, nativeId);
                                    return Mono.empty();
                                }
                                Instant now = Instant.now();
                                return environmentMapStore.save(EnvironmentMapping.builder()
                                                .tenantId(tenantId)
                                                .environmentId(environmentId)
                                                .canonicalId(canonicalId)
                                                .nativeId(nativeId)
                                                .contentHash(entry.getContentHash())
                                                .status(WorkflowMappingStatus.LINKED)
                                                .presentInRuntime(true)
                                                .linkedAt(now)
                                                .linkedBy(config.getSidecarActor())
                                                .build())
                                        .doOnNext(saved -> {
                                            log.info("Pre-populated mapping {} -> native workflow {} in {}", canonicalId, nativeId, environmentId);
                                            collector.written(saved.getStatus());
                                        })
                                        .onErrorResume(DuplicateMappingException.class, conflict -> {
                                            log.warn("Metadata entry for native workflow {} in {} lost to a concurrent mapping: {}",
                                                    nativeId, environmentId, conflict.getMessage());
                                            return Mono.empty();
                                        })
                                        .then();
                            });
                });
    }

    private record ResolvedFile(RepositoryWorkflowFile file, String canonicalId) {
    }
}
