package com.lyshra.open.flowsync.core.engine.lock;

import com.lyshra.open.flowsync.core.exception.codes.FlowSyncErrorCodes;
import com.lyshra.open.flowsync.integration.exception.FlowSyncRuntimeException;
import lombok.Getter;

import java.util.Map;

/**
 * Thrown when a sync cannot start because another sync for the same
 * (tenant, environment) holds the guard.
 */
@Getter
public class SyncInProgressException extends FlowSyncRuntimeException {

    private final String tenantId;
    private final String environmentId;
    private final transient SyncLock lockInfo;

    public SyncInProgressException(String tenantId, String environmentId, SyncLock lockInfo) {
        super(FlowSyncErrorCodes.SYNC_IN_PROGRESS, Map.of(
                "tenantId", tenantId,
                "environmentId", environmentId,
                "owner", lockInfo != null ? lockInfo.getOwnerId() + " since " + lockInfo.getAcquiredAt() : "unknown"));
        this.tenantId = tenantId;
        this.environmentId = environmentId;
        this.lockInfo = lockInfo;
    }
}
