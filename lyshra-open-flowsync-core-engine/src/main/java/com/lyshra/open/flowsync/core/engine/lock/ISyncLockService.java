package com.lyshra.open.flowsync.core.engine.lock;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Guard ensuring that two sync runs for the same (tenant, environment) never overlap.
 *
 * <p>Repository sync and environment sync share one key per environment, so the
 * MISSING-detection phase of one run can never contradict the in-flight writes of
 * another. Locks expire so a crashed run cannot block an environment forever.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * lockService.executeWithLock(tenantId, environmentId, ownerId, Duration.ofMinutes(15),
 *         "environment-sync", runSync());
 * }</pre>
 */
public interface ISyncLockService {

    /**
     * @return true if acquired, false if held by another owner and not expired
     */
    Mono<Boolean> tryAcquire(String lockKey, String ownerId, Duration duration, String operation);

    /**
     * @return true if released, false if not held by this owner
     */
    Mono<Boolean> release(String lockKey, String ownerId);

    /**
     * Pushes the expiry of a held lock to {@code duration} from now.
     *
     * @return true if extended, false if not held by this owner or already expired
     */
    Mono<Boolean> extend(String lockKey, String ownerId, Duration duration);

    /**
     * @return the lock if held and not expired
     */
    Mono<Optional<SyncLock>> getLockInfo(String lockKey);

    /**
     * Releases a lock regardless of owner (admin operation).
     *
     * @return true if a lock was released
     */
    Mono<Boolean> forceRelease(String lockKey, String reason);

    static String lockKey(String tenantId, String environmentId) {
        return "sync:" + tenantId + ":" + environmentId;
    }

    /**
     * Runs the action while holding the guard for (tenant, environment). The guard is
     * released before the action's result, completion or error reaches the subscriber, so
     * a caller may start the next run for the same key as soon as this one returns. A
     * cancelled action releases the guard asynchronously.
     *
     * @throws SyncInProgressException (as an error signal) if the guard is held elsewhere
     */
    default <T> Mono<T> executeWithLock(String tenantId, String environmentId, String ownerId,
                                        Duration duration, String operation, Mono<T> action) {
        String lockKey = lockKey(tenantId, environmentId);
        return tryAcquire(lockKey, ownerId, duration, operation)
                .flatMap(acquired -> {
                    if (!acquired) {
                        return getLockInfo(lockKey)
                                .flatMap(info -> Mono.<T>error(new SyncInProgressException(
                                        tenantId, environmentId, info.orElse(null))));
                    }
                    return action
                            .materialize()
                            .flatMap(signal -> release(lockKey, ownerId).thenReturn(signal))
                            .<T>dematerialize()
                            .doOnCancel(() -> release(lockKey, ownerId).subscribe());
                });
    }
}
