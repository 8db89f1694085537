package com.invoice.memory.lock;

/**
 * Settings for {@link LocalDistributedLock}.
 *
 * @param timeoutMs maximum time to wait for a memory lock
 * @param fair      whether waiting learners acquire the lock in arrival order
 */
public record LockConfig(long timeoutMs, boolean fair) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout, fair ordering.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, true);
    }
}
