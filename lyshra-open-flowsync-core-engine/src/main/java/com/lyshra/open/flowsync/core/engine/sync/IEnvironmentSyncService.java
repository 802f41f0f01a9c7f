package com.lyshra.open.flowsync.core.engine.sync;

import com.lyshra.open.flowsync.integration.models.sync.SyncResult;
import reactor.core.publisher.Mono;

/**
 * Reconciles the environment-map tracker with the workflows currently deployed in a
 * runtime environment.
 */
public interface IEnvironmentSyncService {

    /**
     * Updates content hashes of changed workflows, auto-links untracked ones where
     * possible and marks mappings no longer visible in the runtime as MISSING.
     * Running it twice without runtime changes performs no writes the second time.
     *
     * @return aggregate result; same error signals as
     *         {@link IRepositorySyncService#syncRepository(String, String)}
     */
    Mono<SyncResult> syncEnvironment(String tenantId, String environmentId);
}
