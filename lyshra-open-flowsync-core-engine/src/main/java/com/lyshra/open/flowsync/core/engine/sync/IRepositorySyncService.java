package com.lyshra.open.flowsync.core.engine.sync;

import com.lyshra.open.flowsync.integration.models.sync.SyncResult;
import reactor.core.publisher.Mono;

/**
 * Ingests version-controlled workflow definitions into the identity store and the
 * git-state tracker, plus optional companion metadata files.
 */
public interface IRepositorySyncService {

    /**
     * Walks every definition file of the environment. Unchanged files (same content hash
     * as the stored git state) cause no writes. Failures of single files are reported in
     * {@link SyncResult#getErrors()}.
     *
     * @return aggregate result; errors with
     *         {@link com.lyshra.open.flowsync.core.engine.lock.SyncInProgressException} when another
     *         sync of the environment is running, or with
     *         {@link com.lyshra.open.flowsync.integration.exception.FlowSyncStorageException}
     *         when storage is unavailable
     */
    Mono<SyncResult> syncRepository(String tenantId, String environmentId);
}
