package com.lyshra.open.flowsync.integration.models.identity;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;

/**
 * First-seen normalized payload for a content hash.
 * Persisted so collision detection survives a restart.
 */
@Data
@Builder
public class ContentHashRegistryEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String contentHash;

    /**
     * Canonical (sorted-key, compact) JSON of the normalized definition.
     */
    private final String normalizedPayload;

    @Builder.Default
    private final Instant registeredAt = Instant.now();
}
