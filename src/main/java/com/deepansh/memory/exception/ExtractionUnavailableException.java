package com.deepansh.memory.exception;

/**
 * Transient: the external extraction dependency did not answer usefully.
 * Absorbed at the boundary, never surfaced on the write path.
 */
public class ExtractionUnavailableException extends MemoryException {

    public ExtractionUnavailableException(String message) {
        super(message);
    }

    public ExtractionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
