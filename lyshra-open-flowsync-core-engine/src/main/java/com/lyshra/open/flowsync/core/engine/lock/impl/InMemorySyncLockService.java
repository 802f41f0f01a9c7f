package com.lyshra.open.flowsync.core.engine.lock.impl;

import com.lyshra.open.flowsync.core.engine.lock.ISyncLockService;
import com.lyshra.open.flowsync.core.engine.lock.SyncLock;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory sync guard for single-instance deployments. A multi-instance deployment
 * needs a persisted implementation sharing the same lock keys.
 *
 * <h2>Thread Safety</h2>
 * Acquisition and release are atomic via {@link ConcurrentHashMap#compute}.
 */
@Slf4j
public class InMemorySyncLockService implements ISyncLockService {

    private final Map<String, SyncLock> locks = new ConcurrentHashMap<>();

    @Override
    public Mono<Boolean> tryAcquire(String lockKey, String ownerId, Duration duration, String operation) {
        return Mono.fromCallable(() -> tryAcquireSync(lockKey, ownerId, duration, operation));
    }

    private boolean tryAcquireSync(String lockKey, String ownerId, Duration duration, String operation) {
        if (lockKey == null || ownerId == null) {
            throw new IllegalArgumentException("lockKey and ownerId cannot be null");
        }
        return locks.compute(lockKey, (key, existingLock) -> {
            if (existingLock == null) {
                log.debug("Acquiring sync lock: key={}, owner={}, duration={}", lockKey, ownerId, duration);
                return SyncLock.create(lockKey, ownerId, duration, operation);
            }
            if (existingLock.isExpired()) {
                log.warn("Taking over expired sync lock: key={}, previousOwner={}, newOwner={}",
                        lockKey, existingLock.getOwnerId(), ownerId);
                return SyncLock.create(lockKey, ownerId, duration, operation);
            }
            log.debug("Sync lock held by another run: key={}, holder={}", lockKey, existingLock.getOwnerId());
            return existingLock;
        }).getOwnerId().equals(ownerId);
    }

    @Override
    public Mono<Boolean> release(String lockKey, String ownerId) {
        return Mono.fromCallable(() -> {
            boolean[] released = {false};
            locks.computeIfPresent(lockKey, (key, existingLock) -> {
                if (existingLock.getOwnerId().equals(ownerId)) {
                    log.debug("Releasing sync lock: key={}, owner={}", lockKey, ownerId);
                    released[0] = true;
                    return null;
                }
                log.warn("Cannot release sync lock - not owner: key={}, holder={}, requester={}",
                        lockKey, existingLock.getOwnerId(), ownerId);
                return existingLock;
            });
            return released[0];
        });
    }

    @Override
    public Mono<Boolean> extend(String lockKey, String ownerId, Duration duration) {
        return Mono.fromCallable(() -> {
            if (lockKey == null || ownerId == null) {
                return false;
            }
            boolean[] extended = {false};
            locks.computeIfPresent(lockKey, (key, existingLock) -> {
                if (existingLock.getOwnerId().equals(ownerId) && !existingLock.isExpired()) {
                    log.debug("Extending sync lock: key={}, owner={}, duration={}", lockKey, ownerId, duration);
                    extended[0] = true;
                    return existingLock.extend(duration);
                }
                return existingLock;
            });
            return extended[0];
        });
    }

    @Override
    public Mono<Optional<SyncLock>> getLockInfo(String lockKey) {
        return Mono.fromCallable(() -> {
            SyncLock lock = locks.get(lockKey);
            if (lock != null && !lock.isExpired()) {
                return Optional.of(lock);
            }
            return Optional.<SyncLock>empty();
        });
    }

    @Override
    public Mono<Boolean> forceRelease(String lockKey, String reason) {
        return Mono.fromCallable(() -> {
            SyncLock removed = locks.remove(lockKey);
            if (removed != null) {
                log.warn("Force released sync lock: key={}, owner={}, reason={}", lockKey, removed.getOwnerId(), reason);
                return true;
            }
            return false;
        });
    }
}
