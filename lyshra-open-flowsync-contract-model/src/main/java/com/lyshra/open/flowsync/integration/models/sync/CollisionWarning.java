package com.lyshra.open.flowsync.integration.models.sync;

import lombok.Builder;
import lombok.Data;

/**
 * Two different normalized payloads produced the same content hash during a sync.
 *
 * <p>When {@code resolved} is true a salted fallback hash was derived from the
 * canonical id and returned instead of {@code contentHash}. When false the
 * colliding hash was returned and must not be treated as proof of identity.</p>
 */
@Data
@Builder
public class CollisionWarning {

    private final String nativeId;

    private final String canonicalId;

    private final String contentHash;

    private final boolean resolved;

    private final String fallbackHash;
}
