package com.lyshra.open.flowsync.integration.models.identity;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;

/**
 * Identity anchor for a workflow, independent of any environment.
 *
 * <p>The {@code canonicalId} never changes once assigned. Rows are soft-deleted
 * through {@code deletedAt} and never removed.</p>
 */
@Data
@Builder(toBuilder = true)
public class CanonicalWorkflow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String tenantId;

    private final String canonicalId;

    /**
     * Cached label for display, not authoritative.
     */
    private final String displayName;

    @Builder.Default
    private final Instant createdAt = Instant.now();

    private final String createdBy;

    private final Instant deletedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
