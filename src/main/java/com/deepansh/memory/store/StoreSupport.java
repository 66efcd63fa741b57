package com.deepansh.memory.store;

import com.deepansh.memory.exception.InvariantViolationException;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.MemoryStatus;

import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Checks and preparation shared by every MemoryStore implementation.
 */
final class StoreSupport {

    private StoreSupport() {}

    /** Fills id, slot key, status and timestamps for a record about to become ACTIVE. */
    static MemoryRecord prepareActive(MemoryRecord source, Instant now) {
        MemoryRecord record = source.copy();
        if (record.getOwnerId() == null || record.getOwnerId().isBlank()) {
            throw new InvariantViolationException("Record has no owner");
        }
        if (record.getId() == null) {
            record.setId(UUID.randomUUID().toString());
        }
        record.setStatus(MemoryStatus.ACTIVE);
        record.setSupersededById(null);
        record.setArchivedReason(null);
        record.setSlotKey(SlotKeys.slotKeyOf(record));
        if (record.getVersion() < 1) record.setVersion(1);
        if (record.getBaseImportance() <= 0) record.setBaseImportance(record.getImportance());
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        return record;
    }

    /**
     * Walks supersedesId back from {@code head}; the new record's id must not
     * already be in that ancestry, and the chain itself must terminate.
     */
    static void assertNoCycle(MemoryRecord head, String newId,
                              Function<String, Optional<MemoryRecord>> lookup) {
        Set<String> seen = new HashSet<>();
        MemoryRecord current = head;
        while (current != null) {
            if (!seen.add(current.getId())) {
                throw new InvariantViolationException("Version chain already cyclic at record " + current.getId());
            }
            if (current.getId().equals(newId)) {
                throw new InvariantViolationException(
                        "Superseding " + head.getId() + " with " + newId + " would create a cycle");
            }
            String previous = current.getSupersedesId();
            current = previous == null ? null : lookup.apply(previous).orElse(null);
        }
    }
}
