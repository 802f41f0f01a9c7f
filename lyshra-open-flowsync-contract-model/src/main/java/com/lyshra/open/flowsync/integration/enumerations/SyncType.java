package com.lyshra.open.flowsync.integration.enumerations;

public enum SyncType {
    REPOSITORY,
    ENVIRONMENT
}
