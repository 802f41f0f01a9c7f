package com.lyshra.open.flowsync.core.engine.status;

import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.models.identity.EnvironmentMapping;
import lombok.extern.slf4j.Slf4j;

/**
 * Pure lifecycle status computation. No I/O.
 *
 * <p>Precedence, highest first: deleted, ignored, gone from the runtime after being
 * known there, present without identity, present with identity. Any other combination
 * is inconsistent and resolves to UNTRACKED, never LINKED.</p>
 */
@Slf4j
public final class WorkflowMappingStatusResolver {

    private WorkflowMappingStatusResolver() {
        // Utility class
    }

    public static WorkflowMappingStatus resolve(String canonicalId,
                                                String nativeId,
                                                boolean presentInRuntime,
                                                boolean deleted,
                                                boolean ignored) {
        if (deleted) {
            return WorkflowMappingStatus.DELETED;
        }
        if (ignored) {
            return WorkflowMappingStatus.IGNORED;
        }
        if (!presentInRuntime && nativeId != null) {
            return WorkflowMappingStatus.MISSING;
        }
        if (canonicalId == null && presentInRuntime) {
            return WorkflowMappingStatus.UNTRACKED;
        }
        if (canonicalId != null && presentInRuntime) {
            return WorkflowMappingStatus.LINKED;
        }
        log.warn("Inconsistent mapping state (canonicalId={}, nativeId={}, present={}); defaulting to UNTRACKED",
                canonicalId, nativeId, presentInRuntime);
        return WorkflowMappingStatus.UNTRACKED;
    }

    /**
     * Resolves from the stored facts of a mapping row.
     *
     * @param canonicalDeleted whether the canonical workflow the row points to is soft-deleted
     */
    public static WorkflowMappingStatus resolve(EnvironmentMapping mapping, boolean canonicalDeleted) {
        return resolve(mapping.getCanonicalId(),
                mapping.getNativeId(),
                mapping.isPresentInRuntime(),
                mapping.isDeleted() || canonicalDeleted,
                mapping.isIgnored());
    }
}
