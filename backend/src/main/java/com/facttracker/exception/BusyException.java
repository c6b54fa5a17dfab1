package com.facttracker.exception;

/**
 * Exception thrown when an append for a user cannot be serialized in time.
 *
 * Raised when the per-user write lock is not acquired within the configured
 * timeout, when the lock backend is unreachable, or when the row version check
 * detects a concurrent write. GlobalExceptionHandler maps this to HTTP 503
 * Service Unavailable with a {@code Retry-After} header.
 *
 * @see com.facttracker.service.lock.UserWriteLock
 */
public class BusyException extends RuntimeException {

    private final Long userId;

    public BusyException(Long userId, String message) {
        super(message);
        this.userId = userId;
    }

    public BusyException(Long userId, String message, Throwable cause) {
        super(message, cause);
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }

    public ErrorCode getErrorCode() {
        return ErrorCode.BUSY;
    }

    public static BusyException lockTimeout(Long userId, long waitedMillis) {
        return new BusyException(userId, String.format(
                "Another update for user %d is in progress (waited %d ms). Please try again.",
                userId, waitedMillis));
    }

    public static BusyException lockUnavailable(Long userId, Throwable cause) {
        return new BusyException(userId, String.format(
                "Write lock for user %d is unavailable. Please try again later.", userId), cause);
    }

    public static BusyException concurrentUpdate(Long userId, Throwable cause) {
        return new BusyException(userId, String.format(
                "User %d was modified concurrently. Please try again.", userId), cause);
    }
}
