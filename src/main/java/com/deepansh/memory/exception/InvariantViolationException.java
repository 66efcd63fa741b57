package com.deepansh.memory.exception;

/**
 * A write would break a store invariant (second active record in a slot,
 * cycle in a version chain). Rejected and logged; never repaired silently.
 */
public class InvariantViolationException extends MemoryException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
