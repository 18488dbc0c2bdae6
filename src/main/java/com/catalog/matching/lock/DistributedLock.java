package com.catalog.matching.lock;

import java.util.function.Supplier;

/**
 * Per-key mutual exclusion for training writes. Writes to different keys never contend.
 */
public interface DistributedLock {

    /**
     * Acquires the lock for the key, waiting up to the configured timeout.
     *
     * @throws LockAcquisitionException if the lock is not acquired in time
     */
    void lock(String key);

    void unlock(String key);

    /**
     * Runs the action while holding the key's lock.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        lock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
