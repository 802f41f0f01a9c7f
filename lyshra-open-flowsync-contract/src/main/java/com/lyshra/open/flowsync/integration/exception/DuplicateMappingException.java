package com.lyshra.open.flowsync.integration.exception;

import lombok.Getter;

/**
 * A write would bind one canonical workflow to two different native workflows
 * in the same environment, or duplicate a row keyed by native id.
 * Raised by the store, never by application-level checks alone.
 */
@Getter
public class DuplicateMappingException extends FlowSyncRuntimeException {

    private final String tenantId;
    private final String environmentId;
    private final String canonicalId;
    private final String nativeId;
    private final String conflictingNativeId;

    public DuplicateMappingException(String tenantId,
                                     String environmentId,
                                     String canonicalId,
                                     String nativeId,
                                     String conflictingNativeId) {
        super(String.format("Canonical workflow %s is already mapped to native workflow %s in %s/%s; rejected mapping to %s",
                canonicalId, conflictingNativeId, tenantId, environmentId, nativeId));
        this.tenantId = tenantId;
        this.environmentId = environmentId;
        this.canonicalId = canonicalId;
        this.nativeId = nativeId;
        this.conflictingNativeId = conflictingNativeId;
    }
}
