package com.invoice.memory.rules;

/**
 * Thrown when a correction's field cannot be traced back to a registered pattern,
 * so its feedback cannot be attributed to any memory.
 */
public class UnknownPatternException extends RuntimeException {

    public UnknownPatternException(String message) {
        super(message);
    }
}
