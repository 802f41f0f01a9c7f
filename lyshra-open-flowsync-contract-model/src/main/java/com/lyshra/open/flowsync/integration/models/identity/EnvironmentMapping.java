package com.lyshra.open.flowsync.integration.models.identity;

import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Live runtime representation of a workflow in one environment.
 *
 * <p>Storage constraints:</p>
 * <ul>
 *   <li>unique per (tenantId, environmentId, nativeId) when the native id is known</li>
 *   <li>at most one row per (tenantId, environmentId, canonicalId) whose status is not MISSING</li>
 *   <li>a LINKED row always carries a canonical id</li>
 * </ul>
 */
@Data
@Builder(toBuilder = true)
public class EnvironmentMapping implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String tenantId;

    private final String environmentId;

    /**
     * Null while the workflow is untracked.
     */
    private final String canonicalId;

    /**
     * The runtime's own identifier for this workflow instance.
     */
    private final String nativeId;

    private final String contentHash;

    /**
     * Runtime last-modified timestamp, normalized to UTC millisecond precision.
     */
    private final Instant nativeUpdatedAt;

    private final WorkflowMappingStatus status;

    /**
     * Whether the last environment sync saw this workflow in the runtime.
     */
    private final boolean presentInRuntime;

    private final Instant linkedAt;

    private final String linkedBy;

    private final String displayName;

    /**
     * Cached runtime payload, only kept for FULL environments.
     */
    private final Map<String, Object> workflowData;

    private final Instant lastEnvSyncAt;

    public boolean isDeleted() {
        return status == WorkflowMappingStatus.DELETED;
    }

    public boolean isIgnored() {
        return status == WorkflowMappingStatus.IGNORED;
    }

    public boolean isTracked() {
        return canonicalId != null;
    }
}
