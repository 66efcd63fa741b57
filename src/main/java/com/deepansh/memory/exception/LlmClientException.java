package com.deepansh.memory.exception;

/**
 * Non-retryable provider error (bad key, bad request, decommissioned model).
 * Listed under ignoreExceptions for retry and circuit breaker.
 */
public class LlmClientException extends MemoryException {

    public LlmClientException(String message) {
        super(message);
    }

    public LlmClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
