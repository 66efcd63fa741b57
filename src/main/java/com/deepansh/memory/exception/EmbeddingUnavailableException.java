package com.deepansh.memory.exception;

/**
 * Transient: the external embedding dependency did not answer usefully.
 * Absorbed at the boundary, never surfaced on the write path.
 */
public class EmbeddingUnavailableException extends MemoryException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
