package com.lyshra.open.flowsync.integration.models.sync;

import com.lyshra.open.flowsync.integration.enumerations.SyncType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate outcome of one repository or environment sync run.
 *
 * <p>Counters:</p>
 * <ul>
 *   <li>{@code processed} - items examined, including skipped ones</li>
 *   <li>{@code skipped} - items short-circuited without any write</li>
 *   <li>{@code created} - canonical workflows (repository sync) or mapping rows (environment sync) created</li>
 *   <li>{@code linked}, {@code untracked} - written mappings that ended in that status</li>
 *   <li>{@code missing} - mappings that transitioned to MISSING in this run</li>
 * </ul>
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class SyncResult {

    private final String tenantId;

    private final String environmentId;

    private final SyncType syncType;

    private final int processed;

    private final int skipped;

    private final int created;

    private final int linked;

    private final int untracked;

    private final int missing;

    private final List<SyncItemError> errors;

    private final List<CollisionWarning> collisionWarnings;

    private final Instant startedAt;

    private final Instant completedAt;

    private SyncResult(String tenantId,
                       String environmentId,
                       SyncType syncType,
                       int processed,
                       int skipped,
                       int created,
                       int linked,
                       int untracked,
                       int missing,
                       List<SyncItemError> errors,
                       List<CollisionWarning> collisionWarnings,
                       Instant startedAt,
                       Instant completedAt) {
        this.tenantId = tenantId;
        this.environmentId = environmentId;
        this.syncType = syncType;
        this.processed = processed;
        this.skipped = skipped;
        this.created = created;
        this.linked = linked;
        this.untracked = untracked;
        this.missing = missing;
        this.errors = errors != null
                ? Collections.unmodifiableList(new ArrayList<>(errors))
                : Collections.emptyList();
        this.collisionWarnings = collisionWarnings != null
                ? Collections.unmodifiableList(new ArrayList<>(collisionWarnings))
                : Collections.emptyList();
        this.startedAt = startedAt;
        this.completedAt = completedAt;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasCollisionWarnings() {
        return !collisionWarnings.isEmpty();
    }

    public Duration getDuration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}
