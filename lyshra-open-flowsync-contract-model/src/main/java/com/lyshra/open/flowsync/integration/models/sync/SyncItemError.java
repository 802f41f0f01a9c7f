package com.lyshra.open.flowsync.integration.models.sync;

import lombok.Builder;
import lombok.Data;

/**
 * Failure of a single item inside a sync batch. Never aborts the batch.
 */
@Data
@Builder
public class SyncItemError {

    /**
     * Native id, repository path or sidecar path of the failed item.
     */
    private final String itemId;

    private final String message;

    public static SyncItemError of(String itemId, String message) {
        return SyncItemError.builder().itemId(itemId).message(message).build();
    }
}
