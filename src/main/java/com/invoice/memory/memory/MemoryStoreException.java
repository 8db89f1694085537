package com.invoice.memory.memory;

/**
 * Thrown when the persistence layer behind a {@link MemoryStore} cannot be reached
 * or rejects an operation.
 */
public class MemoryStoreException extends RuntimeException {

    public MemoryStoreException(String message) {
        super(message);
    }

    public MemoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
