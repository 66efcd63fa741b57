package com.deepansh.memory.store;

import com.deepansh.memory.model.ArchivedReason;
import com.deepansh.memory.model.MemoryCategory;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.MemoryStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable, versioned record store. Owns the slot and version-chain invariants:
 * every mutating call either commits completely or throws, and no call can
 * leave two ACTIVE records in one slot.
 *
 * Concurrency contract: writers racing on a slot get SlotConflictException and
 * are expected to re-read and retry. Attempts to break an invariant outright
 * get InvariantViolationException.
 */
public interface MemoryStore {

    /**
     * Inserts a new ACTIVE record.
     *
     * @throws com.deepansh.memory.exception.SlotConflictException the slot already has an active record
     * @throws com.deepansh.memory.exception.InvariantViolationException the record claims a predecessor
     */
    MemoryRecord insert(MemoryRecord record);

    /**
     * In-place change of an ACTIVE record.
     *
     * @throws com.deepansh.memory.exception.SlotConflictException record no longer active or version moved on
     */
    MemoryRecord update(String id, RecordPatch patch);

    /**
     * Flips {@code oldId} to SUPERSEDED and inserts {@code newRecord} as the
     * active head of the chain, atomically. newRecord.version must be
     * old.version + 1.
     *
     * @throws com.deepansh.memory.exception.SlotConflictException old record no longer the active head
     * @throws com.deepansh.memory.exception.InvariantViolationException the link would form a cycle
     */
    MemoryRecord supersede(String oldId, MemoryRecord newRecord);

    /** ACTIVE -> ARCHIVED. Idempotent: archiving a non-active record returns it unchanged. */
    Optional<MemoryRecord> softDelete(String id, ArchivedReason reason);

    /** Physical removal. Returns what was removed so the caller can audit it. */
    Optional<MemoryRecord> hardDelete(String id);

    /** Archives a consolidated duplicate and links it to its keeper. */
    Optional<MemoryRecord> markMerged(String id, String keeperId);

    MemoryRecord addAlias(String id, String alias);

    /** Access bookkeeping: count, timestamp, importance boost (reset of the decay anchor). */
    void recordAccess(String ownerId, Collection<String> ids, double importanceBoost);

    Optional<MemoryRecord> getById(String id);

    Optional<MemoryRecord> getActiveBySlot(String ownerId, String subjectName, String predicate);

    List<MemoryRecord> findActive(String ownerId);

    /** All records of the owner when status is null. */
    List<MemoryRecord> findByOwner(String ownerId, MemoryStatus status);

    List<MemoryRecord> findActiveWithEmbedding(String ownerId);

    List<MemoryRecord> findActiveByCategory(String ownerId, MemoryCategory category);

    List<MemoryRecord> searchByKeyword(String ownerId, String term, int limit);

    /** The version chain containing the record, oldest first. */
    List<MemoryRecord> findChain(String id);

    List<String> findOwnerIds();

    List<String> findSubjectNames(String ownerId, int limit);
}
