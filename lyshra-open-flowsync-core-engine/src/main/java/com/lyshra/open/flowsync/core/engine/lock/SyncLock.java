package com.lyshra.open.flowsync.core.engine.lock;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Sync-in-progress guard held for one (tenant, environment).
 */
@Data
@Builder(toBuilder = true)
public class SyncLock {

    /**
     * Lock key, see {@link ISyncLockService#lockKey(String, String)}.
     */
    private final String lockKey;

    /**
     * Owner token of the sync run holding the lock.
     */
    private final String ownerId;

    private final Instant acquiredAt;

    private final Instant expiresAt;

    /**
     * The operation that acquired the lock, e.g. {@code repository-sync}.
     */
    private final String operation;

    private final String holderThreadId;

    /**
     * Number of times the running sync renewed the lock.
     */
    @Builder.Default
    private final int extensionCount = 0;

    private final Instant lastExtendedAt;

    public boolean isExpired() {
        return expiresAt != null && Instant.now().isAfter(expiresAt);
    }

    public Duration getRemainingTime() {
        if (expiresAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(Instant.now(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Copy of this lock expiring {@code duration} from now.
     */
    public SyncLock extend(Duration duration) {
        Instant now = Instant.now();
        return toBuilder()
                .expiresAt(now.plus(duration))
                .extensionCount(extensionCount + 1)
                .lastExtendedAt(now)
                .build();
    }

    public static SyncLock create(String lockKey, String ownerId, Duration duration, String operation) {
        Instant now = Instant.now();
        return SyncLock.builder()
                .lockKey(lockKey)
                .ownerId(ownerId)
                .acquiredAt(now)
                .expiresAt(now.plus(duration))
                .operation(operation)
                .holderThreadId(Thread.currentThread().getName())
                .build();
    }
}
