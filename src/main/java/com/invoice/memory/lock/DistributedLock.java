package com.invoice.memory.lock;

import java.util.function.Supplier;

/**
 * Keyed mutual exclusion around the learn stage's read-modify-write of a memory.
 * Keys are {@code vendor::pattern}.
 */
public interface DistributedLock {

    /**
     * Attempts to acquire the lock for a key.
     *
     * @param key the lock key
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    boolean tryLock(String key);

    /**
     * Releases the lock for a key. Releasing a lock not held by the caller is ignored.
     *
     * @param key the lock key
     */
    void unlock(String key);

    /**
     * Runs an action while holding the lock for a key.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        tryLock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
