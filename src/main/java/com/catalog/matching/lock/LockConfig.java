package com.catalog.matching.lock;

/**
 * Configuration for key locks.
 *
 * @param timeoutMs maximum time to wait for a lock before giving up
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000);
    }
}
