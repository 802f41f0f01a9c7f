package com.lyshra.open.flowsync.core.engine;

import com.lyshra.open.flowsync.core.engine.config.FlowSyncConfig;
import com.lyshra.open.flowsync.core.engine.hash.IHashCollisionRegistry;
import com.lyshra.open.flowsync.core.engine.lock.ISyncLockService;
import com.lyshra.open.flowsync.core.engine.mapping.ICanonicalWorkflowService;
import com.lyshra.open.flowsync.core.engine.mapping.IWorkflowMappingService;
import com.lyshra.open.flowsync.core.engine.status.WorkflowMappingStatusResolver;
import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.models.sync.SyncResult;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Entry point for embedding applications.
 */
public interface IFlowSyncFacade {

    FlowSyncConfig getConfig();

    Mono<SyncResult> syncRepository(String tenantId, String environmentId);

    Mono<SyncResult> syncEnvironment(String tenantId, String environmentId);

    /**
     * Effective mapping status of a canonical workflow in an environment; empty when it
     * has never been mapped there.
     */
    Mono<Optional<WorkflowMappingStatus>> getMappingStatus(String tenantId, String environmentId, String canonicalId);

    /**
     * Pure status computation over caller-supplied facts; see {@link WorkflowMappingStatusResolver}.
     */
    WorkflowMappingStatus resolveStatus(String canonicalId, String nativeId,
                                        boolean presentInRuntime, boolean deleted, boolean ignored);

    ICanonicalWorkflowService getCanonicalWorkflowService();

    IWorkflowMappingService getMappingService();

    IHashCollisionRegistry getCollisionRegistry();

    ISyncLockService getSyncLockService();

    /**
     * Administrative override for a sync guard left behind by a crashed process.
     */
    Mono<Boolean> forceReleaseSyncLock(String tenantId, String environmentId, String reason);
}
