package com.lyshra.open.flowsync.integration.enumerations;

public enum SyncPhase {
    STARTED,
    BATCH_COMPLETED,
    COMPLETED
}
