package com.lyshra.open.flowsync.core.engine.sync;

import com.lyshra.open.flowsync.integration.models.sync.SyncProgressEvent;

/**
 * Receives a STARTED event, one BATCH_COMPLETED event per batch and a COMPLETED event
 * for every sync run. Called from reactor threads; implementations must not block.
 */
@FunctionalInterface
public interface ISyncProgressListener {

    ISyncProgressListener NO_OP = event -> { };

    void onProgress(SyncProgressEvent event);
}
