package com.lyshra.open.flowsync.core.engine.sync;

import com.lyshra.open.flowsync.core.engine.hash.FingerprintResult;
import com.lyshra.open.flowsync.integration.enumerations.SyncType;
import com.lyshra.open.flowsync.integration.enumerations.WorkflowMappingStatus;
import com.lyshra.open.flowsync.integration.models.sync.CollisionWarning;
import com.lyshra.open.flowsync.integration.models.sync.SyncItemError;
import com.lyshra.open.flowsync.integration.models.sync.SyncResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe accumulator for the counters of one sync run. Items of a batch are
 * processed concurrently and all report here.
 */
public final class SyncResultCollector {

    private final String tenantId;
    private final String environmentId;
    private final SyncType syncType;
    private final String runOwnerId;
    private final Instant startedAt = Instant.now();

    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger created = new AtomicInteger();
    private final AtomicInteger linked = new AtomicInteger();
    private final AtomicInteger untracked = new AtomicInteger();
    private final AtomicInteger missing = new AtomicInteger();
    private final Queue<SyncItemError> errors = new ConcurrentLinkedQueue<>();
    private final Queue<CollisionWarning> collisionWarnings = new ConcurrentLinkedQueue<>();

    public SyncResultCollector(String tenantId, String environmentId, SyncType syncType, String runOwnerId) {
        this.tenantId = tenantId;
        this.environmentId = environmentId;
        this.syncType = syncType;
        this.runOwnerId = runOwnerId;
    }

    /**
     * Owner token under which this run holds the sync guard.
     */
    public String getRunOwnerId() {
        return runOwnerId;
    }

    public void processed() {
        processed.incrementAndGet();
    }

    public void skipped() {
        skipped.incrementAndGet();
    }

    public void created() {
        created.incrementAndGet();
    }

    public void missing() {
        missing.incrementAndGet();
    }

    /**
     * Counts a written mapping under the status it ended in.
     */
    public void written(WorkflowMappingStatus status) {
        if (status == WorkflowMappingStatus.LINKED) {
            linked.incrementAndGet();
        } else if (status == WorkflowMappingStatus.UNTRACKED) {
            untracked.incrementAndGet();
        }
    }

    public void error(String itemId, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        errors.add(SyncItemError.of(itemId, message));
    }

    public void error(String itemId, String message) {
        errors.add(SyncItemError.of(itemId, message));
    }

    public void collision(String nativeId, String canonicalId, FingerprintResult fingerprint) {
        collisionWarnings.add(CollisionWarning.builder()
                .nativeId(nativeId)
                .canonicalId(canonicalId)
                .contentHash(fingerprint.getOriginalHash())
                .resolved(fingerprint.isResolved())
                .fallbackHash(fingerprint.isResolved() ? fingerprint.getContentHash() : null)
                .build());
    }

    public int processedCount() {
        return processed.get();
    }

    public SyncResult toResult() {
        return SyncResult.builder()
                .tenantId(tenantId)
                .environmentId(environmentId)
                .syncType(syncType)
                .processed(processed.get())
                .skipped(skipped.get())
                .created(created.get())
                .linked(linked.get())
                .untracked(untracked.get())
                .missing(missing.get())
                .errors(new ArrayList<>(errors))
                .collisionWarnings(new ArrayList<>(collisionWarnings))
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .build();
    }
}
