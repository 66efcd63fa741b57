package com.deepansh.memory.store;

import com.deepansh.memory.exception.InvariantViolationException;
import com.deepansh.memory.exception.RecordNotFoundException;
import com.deepansh.memory.exception.SlotConflictException;
import com.deepansh.memory.model.ArchivedReason;
import com.deepansh.memory.model.MemoryCategory;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.MemoryStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owner-partitioned in-process store, for local runs and tests.
 *
 * - Records live in one ConcurrentHashMap per owner; owners share nothing.
 * - Every mutation runs under the lock of the slot(s) it touches, and
 *   re-checks status and version inside the lock, so two writers on one slot
 *   are serialized and the loser sees SlotConflictException.
 * - Stored objects are never mutated: each write replaces the map entry with a
 *   fresh copy and readers always get copies.
 */
@Component
@ConditionalOnProperty(name = "memory.store.backend", havingValue = "in-memory")
@Slf4j
public class InMemoryMemoryStore implements MemoryStore {

    private final Map<String, Map<String, MemoryRecord>> recordsByOwner = new ConcurrentHashMap<>();
    private final Map<String, String> ownerById = new ConcurrentHashMap<>();
    private final Map<String, String> activeBySlot = new ConcurrentHashMap<>();
    private static final int LOCK_STRIPES = 64;

    private final ReentrantLock[] slotLocks = new ReentrantLock[LOCK_STRIPES];
    private final Clock clock;

    public InMemoryMemoryStore(Clock clock) {
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            slotLocks[i] = new ReentrantLock();
        }
    }

    @Override
    public MemoryRecord insert(MemoryRecord source) {
        if (source.getSupersedesId() != null) {
            throw new InvariantViolationException("insert() cannot link a predecessor; use supersede()");
        }
        MemoryRecord record = StoreSupport.prepareActive(source, clock.instant());
        return withSlotLocks(List.of(record.getSlotKey()), () -> {
            String occupant = activeBySlot.get(record.getSlotKey());
            if (occupant != null) {
                throw new SlotConflictException(record.getSlotKey(),
                        "Slot already has active record " + occupant);
            }
            put(record);
            activeBySlot.put(record.getSlotKey(), record.getId());
            log.info("Inserted memory record [id={}] for owner: {}", record.getId(), record.getOwnerId());
            return record.copy();
        });
    }

    @Override
    public MemoryRecord update(String id, RecordPatch patch) {
        MemoryRecord snapshot = require(id);
        return withSlotLocks(List.of(snapshot.getSlotKey()), () -> {
            MemoryRecord current = require(id);
            if (!current.isActive()) {
                throw new SlotConflictException(current.getSlotKey(), "Record " + id + " is " + current.getStatus());
            }
            if (patch.getExpectedVersion() != null && patch.getExpectedVersion() != current.getVersion()) {
                throw new SlotConflictException(current.getSlotKey(), "Record " + id + " is at version "
                        + current.getVersion() + ", expected " + patch.getExpectedVersion());
            }
            MemoryRecord updated = current.copy();
            patch.applyTo(updated, clock.instant());
            put(updated);
            return updated.copy();
        });
    }

    @Override
    public MemoryRecord supersede(String oldId, MemoryRecord newRecord) {
        MemoryRecord snapshot = require(oldId);
        MemoryRecord prepared = StoreSupport.prepareActive(newRecord, clock.instant());
        prepared.setSupersedesId(oldId);

        List<String> keys = new ArrayList<>(new LinkedHashSet<>(List.of(snapshot.getSlotKey(), prepared.getSlotKey())));
        return withSlotLocks(keys, () -> {
            MemoryRecord old = require(oldId);
            if (!old.isActive() || old.getVersion() != prepared.getVersion() - 1) {
                throw new SlotConflictException(old.getSlotKey(), "Record " + oldId + " is no longer the active head "
                        + "[status=" + old.getStatus() + ", version=" + old.getVersion() + "]");
            }
            if (!old.getOwnerId().equals(prepared.getOwnerId())) {
                throw new InvariantViolationException("Cannot supersede across owners: " + oldId);
            }
            StoreSupport.assertNoCycle(old, prepared.getId(), this::getStored);
            if (!prepared.getSlotKey().equals(old.getSlotKey()) && activeBySlot.containsKey(prepared.getSlotKey())) {
                throw new SlotConflictException(prepared.getSlotKey(), "Target slot already occupied");
            }

            MemoryRecord retired = old.copy();
            retired.setStatus(MemoryStatus.SUPERSEDED);
            retired.setHistorical(true);
            retired.setSupersededById(prepared.getId());
            retired.setUpdatedAt(prepared.getCreatedAt());
            put(retired);
            activeBySlot.remove(old.getSlotKey());

            put(prepared);
            activeBySlot.put(prepared.getSlotKey(), prepared.getId());
            log.info("Superseded memory record [id={}] with [id={}] version={} for owner: {}",
                    oldId, prepared.getId(), prepared.getVersion(), prepared.getOwnerId());
            return prepared.copy();
        });
    }

    @Override
    public Optional<MemoryRecord> softDelete(String id, ArchivedReason reason) {
        return archive(id, reason, null);
    }

    @Override
    public Optional<MemoryRecord> markMerged(String id, String keeperId) {
        return archive(id, ArchivedReason.CONSOLIDATED, keeperId);
    }

    private Optional<MemoryRecord> archive(String id, ArchivedReason reason, String keeperId) {
        Optional<MemoryRecord> snapshot = getStored(id);
        if (snapshot.isEmpty()) return Optional.empty();
        return withSlotLocks(List.of(snapshot.get().getSlotKey()), () -> {
            MemoryRecord current = require(id);
            if (!current.isActive()) {
                return Optional.of(current.copy());
            }
            MemoryRecord archived = current.copy();
            archived.setStatus(MemoryStatus.ARCHIVED);
            archived.setArchivedReason(reason);
            if (keeperId != null) archived.setSupersededById(keeperId);
            archived.setUpdatedAt(clock.instant());
            put(archived);
            activeBySlot.remove(current.getSlotKey(), id);
            log.info("Archived memory record [id={}] reason={}", id, reason);
            return Optional.of(archived.copy());
        });
    }

    @Override
    public Optional<MemoryRecord> hardDelete(String id) {
        Optional<MemoryRecord> snapshot = getStored(id);
        if (snapshot.isEmpty()) return Optional.empty();
        return withSlotLocks(List.of(snapshot.get().getSlotKey()), () -> {
            String owner = ownerById.remove(id);
            if (owner == null) return Optional.empty();
            MemoryRecord removed = recordsByOwner.get(owner).remove(id);
            if (removed != null) {
                activeBySlot.remove(removed.getSlotKey(), id);
                log.info("Hard-deleted memory record [id={}] for owner: {}", id, owner);
            }
            return Optional.ofNullable(removed);
        });
    }

    @Override
    public MemoryRecord addAlias(String id, String alias) {
        MemoryRecord snapshot = require(id);
        return withSlotLocks(List.of(snapshot.getSlotKey()), () -> {
            MemoryRecord updated = require(id).copy();
            updated.getAliases().add(alias.trim());
            updated.setUpdatedAt(clock.instant());
            put(updated);
            return updated.copy();
        });
    }

    @Override
    public void recordAccess(String ownerId, Collection<String> ids, double importanceBoost) {
        Instant now = clock.instant();
        for (String id : ids) {
            Optional<MemoryRecord> snapshot = getStored(id);
            if (snapshot.isEmpty() || !ownerId.equals(snapshot.get().getOwnerId())) continue;
            withSlotLocks(List.of(snapshot.get().getSlotKey()), () -> {
                MemoryRecord updated = require(id).copy();
                double boosted = Math.min(1.0, updated.getImportance() + importanceBoost);
                updated.setAccessCount(updated.getAccessCount() + 1);
                updated.setLastAccessedAt(now);
                updated.setImportance(boosted);
                updated.setBaseImportance(boosted);
                put(updated);
                return null;
            });
        }
    }

    // ─── Reads ──────────────────────────────────────────────────────────────

    @Override
    public Optional<MemoryRecord> getById(String id) {
        return getStored(id).map(MemoryRecord::copy);
    }

    @Override
    public Optional<MemoryRecord> getActiveBySlot(String ownerId, String subjectName, String predicate) {
        String key = SlotKeys.slotKey(ownerId, subjectName, predicate);
        if (key == null) return Optional.empty();
        String id = activeBySlot.get(key);
        return id == null ? Optional.empty() : getById(id)
                .filter(MemoryRecord::isActive)
                .filter(r -> ownerId.equals(r.getOwnerId()));
    }

    @Override
    public List<MemoryRecord> findActive(String ownerId) {
        return findByOwner(ownerId, MemoryStatus.ACTIVE);
    }

    @Override
    public List<MemoryRecord> findByOwner(String ownerId, MemoryStatus status) {
        return ownerRecords(ownerId).stream()
                .filter(r -> status == null || r.getStatus() == status)
                .sorted(Comparator.comparing(MemoryRecord::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .map(MemoryRecord::copy)
                .toList();
    }

    @Override
    public List<MemoryRecord> findActiveWithEmbedding(String ownerId) {
        return findActive(ownerId).stream().filter(MemoryRecord::hasEmbedding).toList();
    }

    @Override
    public List<MemoryRecord> findActiveByCategory(String ownerId, MemoryCategory category) {
        return findActive(ownerId).stream().filter(r -> r.getCategory() == category).toList();
    }

    @Override
    public List<MemoryRecord> searchByKeyword(String ownerId, String term, int limit) {
        String needle = term.toLowerCase(Locale.ROOT);
        return findActive(ownerId).stream()
                .filter(r -> r.getContent() != null && r.getContent().toLowerCase(Locale.ROOT).contains(needle)
                        || r.getSubjectName() != null && r.getSubjectName().toLowerCase(Locale.ROOT).contains(needle))
                .limit(limit)
                .toList();
    }

    @Override
    public List<MemoryRecord> findChain(String id) {
        return ChainWalker.walk(id, this::getById);
    }

    @Override
    public List<String> findOwnerIds() {
        return recordsByOwner.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    @Override
    public List<String> findSubjectNames(String ownerId, int limit) {
        return findActive(ownerId).stream()
                .map(MemoryRecord::getSubjectName)
                .filter(Objects::nonNull)
                .distinct()
                .limit(limit)
                .toList();
    }

    // ─── Internals ──────────────────────────────────────────────────────────

    private Collection<MemoryRecord> ownerRecords(String ownerId) {
        Map<String, MemoryRecord> records = recordsByOwner.get(ownerId);
        return records == null ? Collections.emptyList() : records.values();
    }

    private Optional<MemoryRecord> getStored(String id) {
        String owner = ownerById.get(id);
        if (owner == null) return Optional.empty();
        return Optional.ofNullable(recordsByOwner.get(owner).get(id));
    }

    private MemoryRecord require(String id) {
        return getStored(id).orElseThrow(() -> new RecordNotFoundException("Memory record", id));
    }

    private void put(MemoryRecord record) {
        recordsByOwner.computeIfAbsent(record.getOwnerId(), k -> new ConcurrentHashMap<>())
                .put(record.getId(), record);
        ownerById.put(record.getId(), record.getOwnerId());
    }

    /**
     * Slot keys hash onto a fixed set of stripes. Stripes are taken once each, in
     * index order, so two multi-slot writers cannot deadlock.
     */
    private <T> T withSlotLocks(List<String> keys, Supplier<T> action) {
        List<ReentrantLock> locks = keys.stream()
                .mapToInt(k -> Math.floorMod(k.hashCode(), LOCK_STRIPES))
                .distinct()
                .sorted()
                .mapToObj(i -> slotLocks[i])
                .toList();
        locks.forEach(ReentrantLock::lock);
        try {
            return action.get();
        } finally {
            for (int i = locks.size() - 1; i >= 0; i--) {
                locks.get(i).unlock();
            }
        }
    }
}
