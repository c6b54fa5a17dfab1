package com.facttracker.service.lock;

import com.facttracker.exception.BusyException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process write lock backed by a fixed array of striped {@link ReentrantLock}s.
 *
 * Users hash onto stripes, so memory stays bounded no matter how many users
 * exist. Two users sharing a stripe only wait on each other; correctness per
 * user is unaffected. Only serializes writers inside one JVM; use
 * {@link RedisUserWriteLock} when several instances share the database.
 */
@Slf4j
public class LocalUserWriteLock implements UserWriteLock {

    private final ReentrantLock[] stripes;
    private final Duration acquireTimeout;

    public LocalUserWriteLock(int stripeCount, Duration acquireTimeout) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("Stripe count must be at least 1");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
        this.acquireTimeout = acquireTimeout;
        log.info("Local user write lock initialized: stripes={}, acquireTimeout={}", stripeCount, acquireTimeout);
    }

    @Override
    public <T> T executeLocked(Long userId, Supplier<T> action) {
        ReentrantLock lock = stripeFor(userId);
        boolean acquired;
        try {
            acquired = lock.tryLock(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw BusyException.lockUnavailable(userId, e);
        }

        if (!acquired) {
            log.warn("Timed out waiting for user write lock: userId={}, timeout={}", userId, acquireTimeout);
            throw BusyException.lockTimeout(userId, acquireTimeout.toMillis());
        }

        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock stripeFor(Long userId) {
        return stripes[Math.floorMod(userId.hashCode(), stripes.length)];
    }
}
