package com.flagship.crypto_ledger.lot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per asset symbol. Operations on different assets never wait on each other.
 *
 * Locks are kept for the life of the process; the set of traded assets is small.
 */
@Component
@Slf4j
public class AssetLockRegistry {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration lockTimeout;

    public AssetLockRegistry(@Value("${lots.lock-timeout:5s}") Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    /**
     * Waits up to the configured timeout for the asset's lock.
     *
     * @return the held lock; the caller must unlock it on the same thread
     * @throws CannotAcquireLockException if the wait timed out or was interrupted
     */
    public ReentrantLock acquire(String asset) {
        ReentrantLock lock = locks.computeIfAbsent(asset, key -> new ReentrantLock(true));
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timed out waiting for asset lock: asset={}, timeout={}ms", asset, lockTimeout.toMillis());
                throw new CannotAcquireLockException(String.format(
                    "Timed out after %dms waiting for the %s lot lock", lockTimeout.toMillis(), asset));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CannotAcquireLockException("Interrupted while waiting for the " + asset + " lot lock", e);
        }
        return lock;
    }

    boolean isLocked(String asset) {
        ReentrantLock lock = locks.get(asset);
        return lock != null && lock.isLocked();
    }
}
