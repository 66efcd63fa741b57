package com.deepansh.memory.exception;

/**
 * Transient: the external decision dependency did not answer usefully.
 * Absorbed at the boundary, never surfaced on the write path.
 */
public class DecisionUnavailableException extends MemoryException {

    public DecisionUnavailableException(String message) {
        super(message);
    }

    public DecisionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
