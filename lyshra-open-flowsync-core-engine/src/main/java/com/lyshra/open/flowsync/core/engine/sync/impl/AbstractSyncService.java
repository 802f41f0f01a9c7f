package com.lyshra.open.flowsync.core.engine.sync.impl;

import com.lyshra.open.flowsync.core.engine.config.FlowSyncConfig;
import com.lyshra.open.flowsync.core.engine.hash.IHashCollisionRegistry;
import com.lyshra.open.flowsync.core.engine.lock.ISyncLockService;
import com.lyshra.open.flowsync.core.engine.sync.ISyncProgressListener;
import com.lyshra.open.flowsync.core.engine.sync.SyncResultCollector;
import com.lyshra.open.flowsync.core.engine.sync.SyncRetryFactory;
import com.lyshra.open.flowsync.core.exception.codes.FlowSyncErrorCodes;
import com.lyshra.open.flowsync.integration.enumerations.SyncPhase;
import com.lyshra.open.flowsync.integration.enumerations.SyncType;
import com.lyshra.open.flowsync.integration.exception.FlowSyncRuntimeException;
import com.lyshra.open.flowsync.integration.exception.FlowSyncStorageException;
import com.lyshra.open.flowsync.integration.models.sync.SyncProgressEvent;
import com.lyshra.open.flowsync.integration.models.sync.SyncResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Shared driver of both sync orchestrators.
 *
 * <p>A run holds the (tenant, environment) guard for its whole duration, lists the source
 * once under the listing timeout, then walks the items in batches of
 * {@code batchSize}. Batches run one after another; items inside a batch run with
 * {@code batchConcurrency}. Each item gets the item timeout and transient-failure retries.
 * An item that still fails is recorded in the result and the batch continues. Only
 * {@link FlowSyncStorageException} aborts the run.</p>
 */
@Slf4j
abstract class AbstractSyncService {

    protected final FlowSyncConfig config;
    protected final ISyncLockService lockService;
    protected final IHashCollisionRegistry collisionRegistry;
    protected final ISyncProgressListener progressListener;
    private final Retry retry;

    protected AbstractSyncService(FlowSyncConfig config,
                                  ISyncLockService lockService,
                                  IHashCollisionRegistry collisionRegistry,
                                  ISyncProgressListener progressListener) {
        config.validate();
        this.config = config;
        this.lockService = lockService;
        this.collisionRegistry = collisionRegistry;
        this.progressListener = progressListener != null ? progressListener : ISyncProgressListener.NO_OP;
        this.retry = SyncRetryFactory.buildRetry(config);
    }

    protected Mono<SyncResult> runGuarded(String tenantId, String environmentId, SyncType syncType,
                                          Function<SyncResultCollector, Mono<Void>> body) {
        if (tenantId == null || environmentId == null) {
            return Mono.error(new IllegalArgumentException("tenantId and environmentId cannot be null"));
        }
        String ownerId = config.getLockOwnerId() + ":" + UUID.randomUUID();
        String operation = syncType.name().toLowerCase(Locale.ROOT) + "-sync";
        Mono<SyncResult> run = Mono.defer(() -> {
            SyncResultCollector collector = new SyncResultCollector(tenantId, environmentId, syncType, ownerId);
            log.info("Starting {} for {}/{}", operation, tenantId, environmentId);
            return collisionRegistry.ensureLoaded()
                    .then(body.apply(collector))
                    .then(Mono.fromCallable(() -> {
                        SyncResult result = collector.toResult();
                        progress(tenantId, environmentId, syncType, SyncPhase.COMPLETED,
                                result.getProcessed(), result.getProcessed(), result.getErrors().size() + " errors");
                        log.info("Finished {} for {}/{}: processed={}, skipped={}, created={}, linked={}, untracked={}, missing={}, errors={}, collisions={}",
                                operation, tenantId, environmentId, result.getProcessed(), result.getSkipped(),
                                result.getCreated(), result.getLinked(), result.getUntracked(), result.getMissing(),
                                result.getErrors().size(), result.getCollisionWarnings().size());
                        return result;
                    }));
        });
        return lockService.executeWithLock(tenantId, environmentId, ownerId, config.getSyncLockDuration(), operation, run);
    }

    /**
     * Lists the source once. A listing that still fails after retries is recorded as an
     * error of the run and yields empty, so callers skip every phase that relies on a
     * complete listing.
     */
    protected <T> Mono<Optional<List<T>>> listSource(Flux<T> source, String tenantId, String environmentId,
                                                     SyncResultCollector collector) {
        return Flux.defer(() -> source)
                .collectList()
                .timeout(config.getListingTimeout())
                .retryWhen(retry)
                .map(Optional::of)
                .onErrorResume(AbstractSyncService::isItemScoped, error -> {
                    FlowSyncRuntimeException failure = new FlowSyncRuntimeException(FlowSyncErrorCodes.SOURCE_LISTING_FAILED,
                            Map.of("tenantId", tenantId, "environmentId", environmentId,
                                    "reason", String.valueOf(error.getMessage())), error);
                    log.error(failure.getMessage(), error);
                    collector.error(environmentId, failure);
                    return Mono.just(Optional.empty());
                });
    }

    protected <T> Mono<Void> processInBatches(List<T> items,
                                              Function<T, String> itemId,
                                              Function<T, Mono<Void>> handler,
                                              String tenantId,
                                              String environmentId,
                                              SyncType syncType,
                                              SyncResultCollector collector) {
        int total = items.size();
        AtomicInteger done = new AtomicInteger();
        progress(tenantId, environmentId, syncType, SyncPhase.STARTED, 0, total, total + " items discovered");
        return Flux.fromIterable(items)
                .buffer(config.getBatchSize())
                .concatMap(batch -> Flux.fromIterable(batch)
                        .flatMap(item -> processItem(item, itemId.apply(item), handler, collector), config.getBatchConcurrency())
                        .then(Mono.fromRunnable(() -> progress(tenantId, environmentId, syncType,
                                SyncPhase.BATCH_COMPLETED, done.addAndGet(batch.size()), total, null)))
                        .then(renewGuard(tenantId, environmentId, collector)))
                .then();
    }

    /**
     * Extends the run's guard after each batch. A run that no longer holds its guard stops,
     * since another run may already be writing the same rows.
     */
    private Mono<Void> renewGuard(String tenantId, String environmentId, SyncResultCollector collector) {
        return lockService.extend(ISyncLockService.lockKey(tenantId, environmentId), collector.getRunOwnerId(),
                        config.getSyncLockDuration())
                .flatMap(extended -> extended
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new FlowSyncRuntimeException(FlowSyncErrorCodes.SYNC_LOCK_LOST,
                                Map.of("tenantId", tenantId, "environmentId", environmentId))));
    }

    private <T> Mono<Void> processItem(T item, String itemId, Function<T, Mono<Void>> handler, SyncResultCollector collector) {
        return Mono.defer(() -> {
                    collector.processed();
                    return Mono.defer(() -> handler.apply(item))
                            .timeout(config.getItemTimeout())
                            .retryWhen(retry);
                })
                .onErrorResume(AbstractSyncService::isItemScoped, error -> {
                    log.warn("Sync of item {} failed: {}", itemId, error.toString());
                    collector.error(itemId, error);
                    return Mono.empty();
                });
    }

    /**
     * Everything but storage unavailability stays scoped to the item that raised it.
     */
    protected static boolean isItemScoped(Throwable error) {
        return !(error instanceof FlowSyncStorageException);
    }

    private void progress(String tenantId, String environmentId, SyncType syncType, SyncPhase phase,
                          int current, int total, String message) {
        try {
            progressListener.onProgress(SyncProgressEvent.builder()
                    .tenantId(tenantId)
                    .environmentId(environmentId)
                    .syncType(syncType)
                    .phase(phase)
                    .current(current)
                    .total(total)
                    .message(message)
                    .build());
        } catch (RuntimeException e) {
            log.warn("Sync progress listener failed on {} event: {}", phase, e.toString());
        }
    }
}
