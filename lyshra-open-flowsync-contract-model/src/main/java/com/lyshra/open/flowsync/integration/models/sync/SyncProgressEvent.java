package com.lyshra.open.flowsync.integration.models.sync;

import com.lyshra.open.flowsync.integration.enumerations.SyncPhase;
import com.lyshra.open.flowsync.integration.enumerations.SyncType;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SyncProgressEvent {

    private final String tenantId;

    private final String environmentId;

    private final SyncType syncType;

    private final SyncPhase phase;

    /**
     * Items handled so far.
     */
    private final int current;

    /**
     * Items discovered for this run.
     */
    private final int total;

    private final String message;
}
