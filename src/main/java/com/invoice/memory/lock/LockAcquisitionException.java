package com.invoice.memory.lock;

/**
 * Thrown when the learn stage cannot enter a memory's critical section in time.
 * Nothing has been written for the memory when this is raised, so the verdict
 * can be retried.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String lockKey;

    public LockAcquisitionException(String lockKey, String message) {
        super(message);
        this.lockKey = lockKey;
    }

    public LockAcquisitionException(String lockKey, String message, Throwable cause) {
        super(message, cause);
        this.lockKey = lockKey;
    }

    /**
     * The {@code vendor::pattern} key that could not be locked.
     */
    public String getLockKey() {
        return lockKey;
    }
}
