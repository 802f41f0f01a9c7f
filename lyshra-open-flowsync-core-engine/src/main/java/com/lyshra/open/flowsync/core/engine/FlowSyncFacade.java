package com.lyshra.open.flowsync.core.engine;

import com.lyshra.open.flowsync.core.engine.config.FlowSyncConfig;
import com.lyshra.open.flowsync.core.engine.hash.IContentDigester;
import com.lyshra.open.flowsync.core.engine.hash.IHashCollisionRegistry;
import com.lyshra.open.flowsync.core.engine.hash.Sha256ContentDigester;
import com.lyshra.open.flowsync.core.engine.hash.WorkflowContentHasher;
import com.lyshra.open.flowsync.core.engine.hash.impl.InMemoryHashCollisionRegistry;
import com.lyshra.open.flowsync.core.engine.link.impl.WorkflowAutoLinkerImpl;
import com.lyshra.open.flowsync.core.engine.lock.ISyncLockService;
import com.lyshra.open.flowsync.core.engine.lock.impl.InMemorySyncLockService;
import com.lyshra.open.flowsync.core.engine.mapping.ICanonicalWorkflowService;
import com.lyshra.open.flowsync.core.engine.mapping.IWorkflowMappingService;
import com.lyshra.open.flowsync.core.engine.mapping.impl.CanonicalWorkflowServiceImpl;
import com.lyshra.open.flowsync.core.engine.mapping.impl.WorkflowMappingServiceImpl;
import com.lyshra.open.flowsync.core.engine.normalize.impl.WorkflowNormalizerImpl;
import com.lyshra.open.flowsync.core.engine.status.WorkflowMappingStatusResolver;
import com.lyshra.open.flowsync.core.engine.store.impl.InMemoryCanonicalWorkflowStore;
import com.lyshra.open.flowsync.core.engine.store.impl.InMemoryContentHashRegistryStore;
import com.lyshra.open.flowsync.core.engine.store.impl.InMemoryEnvironmentMapStore;
import com.lyshra.open.flowsync.core.engine.store.impl.InMemoryGitStateStore;
import com.lyshra.open.flowsync.core.engine.sync.IEnvironmentSyncService;
import com.lyshra.open.flowsync.core.engine.sync.IRepositorySyncService;
import com.lyshra.open.flowsync.core.engine.sync.ISyncProgressListener;
import com.lyshra.open.flowsync.core.engine.sync.impl.EnvironmentSyncServiceImpl;
import com.lyshra.open.flowsync.core.engine.sync.impl.RepositorySyncServiceImpl;
import com.lyshra.open.flowsync.integration.contract.source.IRepositoryReader;
import com.lyshra.open.flowsync.integration.contract.source.IRuntimeReader;
import com.lyshra.open.flowsync.integration.contract.store.ICanonicalWorkflowStore;
import com.lyshra.open.flowsync.integration.contract.store.IContentHashRegistryStore;
import com.lyshra.open.flowsync.integration.contract.store.IEnvironmentMapStore;
import com.lyshra.open.flowsync.integration.contract.store.IGitStateStore;
import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.models.sync.SyncResult;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.Optional;

/**
 * Wires the sync engine from its seams. Both readers are required; every store,
 * the lock service and the digester fall back to the in-memory or default
 * implementation when not supplied.
 *
 * <pre>{@code
 * IFlowSyncFacade flowSync = FlowSyncFacade.builder()
 *         .config(FlowSyncConfig.defaultConfig())
 *         .repositoryReader(new FileSystemRepositoryReader(root, config, resolver))
 *         .runtimeReader(runtimeClient)
 *         .build();
 * }</pre>
 */
@Slf4j
public class FlowSyncFacade implements IFlowSyncFacade {

    @Getter
    private final FlowSyncConfig config;
    @Getter
    private final ICanonicalWorkflowService canonicalWorkflowService;
    @Getter
    private final IWorkflowMappingService mappingService;
    @Getter
    private final IHashCollisionRegistry collisionRegistry;
    @Getter
    private final ISyncLockService syncLockService;
    private final IRepositorySyncService repositorySyncService;
    private final IEnvironmentSyncService environmentSyncService;

    @Builder
    private FlowSyncFacade(FlowSyncConfig config,
                           IRepositoryReader repositoryReader,
                           IRuntimeReader runtimeReader,
                           ICanonicalWorkflowStore canonicalWorkflowStore,
                           IGitStateStore gitStateStore,
                           IEnvironmentMapStore environmentMapStore,
                           IContentHashRegistryStore contentHashRegistryStore,
                           ISyncLockService syncLockService,
                           IContentDigester digester,
                           ISyncProgressListener progressListener) {
        this.config = config != null ? config : FlowSyncConfig.defaultConfig();
        this.config.validate();
        Objects.requireNonNull(repositoryReader, "repositoryReader is required");
        Objects.requireNonNull(runtimeReader, "runtimeReader is required");

        ICanonicalWorkflowStore canonicalStore = canonicalWorkflowStore != null
                ? canonicalWorkflowStore : new InMemoryCanonicalWorkflowStore();
        IGitStateStore gitStore = gitStateStore != null ? gitStateStore : new InMemoryGitStateStore();
        IEnvironmentMapStore mapStore = environmentMapStore != null
                ? environmentMapStore : new InMemoryEnvironmentMapStore();
        IContentHashRegistryStore registryStore = contentHashRegistryStore != null
                ? contentHashRegistryStore : new InMemoryContentHashRegistryStore();
        ISyncProgressListener listener = progressListener != null ? progressListener : ISyncProgressListener.NO_OP;

        this.syncLockService = syncLockService != null ? syncLockService : new InMemorySyncLockService();
        this.collisionRegistry = new InMemoryHashCollisionRegistry(registryStore);
        WorkflowContentHasher hasher = new WorkflowContentHasher(
                WorkflowNormalizerImpl.getInstance(),
                digester != null ? digester : Sha256ContentDigester.getInstance(),
                collisionRegistry);

        this.canonicalWorkflowService = new CanonicalWorkflowServiceImpl(canonicalStore, gitStore);
        this.mappingService = new WorkflowMappingServiceImpl(mapStore, canonicalStore);
        this.repositorySyncService = new RepositorySyncServiceImpl(this.config, repositoryReader,
                canonicalStore, gitStore, mapStore, hasher, collisionRegistry, this.syncLockService, listener);
        this.environmentSyncService = new EnvironmentSyncServiceImpl(this.config, runtimeReader,
                mapStore, canonicalStore, hasher, collisionRegistry,
                new WorkflowAutoLinkerImpl(gitStore, mapStore, canonicalStore),
                this.syncLockService, listener);
        log.info("Flow sync engine initialized: {}", this.config);
    }

    @Override
    public Mono<SyncResult> syncRepository(String tenantId, String environmentId) {
        return repositorySyncService.syncRepository(tenantId, environmentId);
    }

    @Override
    public Mono<SyncResult> syncEnvironment(String tenantId, String environmentId) {
        return environmentSyncService.syncEnvironment(tenantId, environmentId);
    }

    @Override
    public Mono<Optional<WorkflowMappingStatus>> getMappingStatus(String tenantId, String environmentId, String canonicalId) {
        return mappingService.getMappingStatus(tenantId, environmentId, canonicalId);
    }

    @Override
    public WorkflowMappingStatus resolveStatus(String canonicalId, String nativeId,
                                               boolean presentInRuntime, boolean deleted, boolean ignored) {
        return WorkflowMappingStatusResolver.resolve(canonicalId, nativeId, presentInRuntime, deleted, ignored);
    }

    @Override
    public Mono<Boolean> forceReleaseSyncLock(String tenantId, String environmentId, String reason) {
        return syncLockService.forceRelease(ISyncLockService.lockKey(tenantId, environmentId), reason);
    }
}
