package com.deepansh.memory.exception;

/**
 * Raised by the resilient LLM client once retries are exhausted or the
 * circuit is open. Each adapter translates it into its own failure type.
 */
public class LlmUnavailableException extends MemoryException {

    public LlmUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
