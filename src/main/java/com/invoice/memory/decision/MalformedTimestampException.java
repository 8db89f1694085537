package com.invoice.memory.decision;

/**
 * Thrown when a memory's last-updated timestamp is missing or cannot be parsed,
 * so its age (and therefore its decay) cannot be computed.
 */
public class MalformedTimestampException extends RuntimeException {

    public MalformedTimestampException(String message) {
        super(message);
    }

    public MalformedTimestampException(String message, Throwable cause) {
        super(message, cause);
    }
}
