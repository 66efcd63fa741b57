package com.deepansh.memory.exception;

/**
 * Base type for every failure raised by the memory engine.
 */
public class MemoryException extends RuntimeException {

    public MemoryException(String message) {
        super(message);
    }

    public MemoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
