package com.deepansh.memory.audit;

import com.deepansh.memory.model.MemoryOperation;

import java.util.List;

/**
 * Append-only log of engine decisions. Entries are never updated or removed.
 */
public interface AuditLog {

    MemoryOperation append(MemoryOperation operation);

    /** Newest first. */
    List<MemoryOperation> findByOwner(String ownerId, int limit);

    /** Every entry that targeted or produced the record, oldest first. */
    List<MemoryOperation> findByRecord(String recordId);
}
