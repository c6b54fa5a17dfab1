package com.facttracker.service.lock;

import com.facttracker.exception.BusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Write lock shared by all service instances through Redis.
 *
 * Acquire: {@code SET facts:lock:user:{id} <token> NX PX <lease>}, retried
 * until the acquire timeout elapses. Release: a Lua script deletes the key
 * only if it still holds this holder's token, so an expired lease never
 * releases someone else's lock.
 *
 * The lease must exceed the longest expected append transaction. If it
 * expires mid-write, the row version check still rejects the stale write.
 *
 * Redis Key Structure:
 * - Lock: "facts:lock:user:{userId}" → random holder token
 */
@Slf4j
public class RedisUserWriteLock implements UserWriteLock {

    static final String LOCK_KEY_PREFIX = "facts:lock:user:";

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end",
            Long.class);

    private final RedisTemplate<String, String> redisStringTemplate;
    private final Duration acquireTimeout;
    private final Duration lease;
    private final Duration retryInterval;

    public RedisUserWriteLock(RedisTemplate<String, String> redisStringTemplate,
                              Duration acquireTimeout,
                              Duration lease,
                              Duration retryInterval) {
        this.redisStringTemplate = redisStringTemplate;
        this.acquireTimeout = acquireTimeout;
        this.lease = lease;
        this.retryInterval = retryInterval;
        log.info("Redis user write lock initialized: acquireTimeout={}, lease={}", acquireTimeout, lease);
    }

    @Override
    public <T> T executeLocked(Long userId, Supplier<T> action) {
        String key = LOCK_KEY_PREFIX + userId;
        String token = UUID.randomUUID().toString();

        acquire(userId, key, token);
        try {
            return action.get();
        } finally {
            release(userId, key, token);
        }
    }

    private void acquire(Long userId, String key, String token) {
        long deadline = System.nanoTime() + acquireTimeout.toNanos();
        try {
            while (true) {
                Boolean acquired = redisStringTemplate.opsForValue()
                        .setIfAbsent(key, token, lease.toMillis(), TimeUnit.MILLISECONDS);
                if (Boolean.TRUE.equals(acquired)) {
                    log.debug("Acquired user write lock: key={}", key);
                    return;
                }
                if (System.nanoTime() >= deadline) {
                    log.warn("Timed out waiting for user write lock: userId={}, timeout={}",
                            userId, acquireTimeout);
                    throw BusyException.lockTimeout(userId, acquireTimeout.toMillis());
                }
                Thread.sleep(retryInterval.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw BusyException.lockUnavailable(userId, e);
        } catch (DataAccessException e) {
            log.error("Redis unavailable while acquiring user write lock: userId={}", userId, e);
            throw BusyException.lockUnavailable(userId, e);
        }
    }

    private void release(Long userId, String key, String token) {
        try {
            Long released = redisStringTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(key), token);
            if (released == null || released == 0L) {
                log.warn("User write lock lease had already expired on release: userId={}", userId);
            }
        } catch (DataAccessException e) {
            // Lease expiry frees the key even when the delete is lost.
            log.error("Failed to release user write lock: userId={}, key={}", userId, key, e);
        }
    }
}
