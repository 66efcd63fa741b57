package com.deepansh.memory.model;

/**
 * Outcome recorded on an audit entry.
 * SKIPPED is a decided NOOP; REJECTED means a deterministic guard refused the
 * write; FAILED means an external dependency never answered.
 */
public enum OperationStatus {
    APPLIED, SKIPPED, REJECTED, FAILED
}
