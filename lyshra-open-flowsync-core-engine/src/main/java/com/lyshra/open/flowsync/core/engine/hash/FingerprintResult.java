package com.lyshra.open.flowsync.core.engine.hash;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Content fingerprint of a workflow definition plus the collision signal raised while computing it.
 */
@Getter
@Builder
@ToString
public final class FingerprintResult {

    /**
     * Hash to persist: the digest, or the salted fallback when a collision was resolved.
     */
    private final String contentHash;

    /**
     * Digest of the normalized payload before any fallback.
     */
    private final String originalHash;

    private final boolean collisionDetected;

    private final boolean resolved;

    /**
     * A collision was seen and no canonical id was available to salt a fallback hash.
     * The returned hash is shared with a different payload and proves nothing about identity.
     */
    public boolean isUnresolvedCollision() {
        return collisionDetected && !resolved;
    }

    static FingerprintResult clean(String hash) {
        return FingerprintResult.builder()
                .contentHash(hash)
                .originalHash(hash)
                .build();
    }
}
