package com.facttracker.service.lock;

import com.facttracker.exception.BusyException;

import java.util.function.Supplier;

/**
 * Serializes ledger appends per user id.
 *
 * An append reads the whole user row, computes new values in memory and
 * writes the row back. Two unserialized appends for the same user would both
 * read the same prior state and one would overwrite the other. Implementations
 * hold a lock keyed by user id for the whole read-modify-write, including the
 * transaction commit, and give up after a bounded wait.
 *
 * @see LocalUserWriteLock
 * @see RedisUserWriteLock
 */
public interface UserWriteLock {

    /**
     * Runs {@code action} while holding the write lock of {@code userId}.
     *
     * @param userId the user whose ledger is modified
     * @param action the read-modify-write to run
     * @param <T> the action result type
     * @return the action result
     * @throws BusyException if the lock cannot be acquired within the configured timeout
     */
    <T> T executeLocked(Long userId, Supplier<T> action);
}
