package com.deepansh.memory.store;

import com.deepansh.memory.exception.InvariantViolationException;
import com.deepansh.memory.exception.SlotConflictException;
import com.deepansh.memory.model.ArchivedReason;
import com.deepansh.memory.model.MemoryCategory;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.MemoryStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * MongoDB-backed store.
 *
 * Slot safety rests on two things:
 * 1. idx_active_slot, a unique index on slotKey filtered to status=ACTIVE.
 *    A second active record for a slot fails with a duplicate key, which is
 *    mapped to SlotConflictException.
 * 2. Conditional writes: every in-place change is a findAndModify whose query
 *    includes status=ACTIVE (and the expected version when given). A null
 *    result means another writer got there first.
 *
 * Supersede touches two documents and runs in a Mongo transaction, so the
 * flip of the old record is rolled back when the insert of the new one fails.
 */
@Repository
@ConditionalOnProperty(name = "memory.store.backend", havingValue = "mongo", matchIfMissing = true)
@Slf4j
public class MongoMemoryStore implements MemoryStore {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoMemoryStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    @Transactional
    public MemoryRecord insert(MemoryRecord source) {
        if (source.getSupersedesId() != null) {
            throw new InvariantViolationException("insert() cannot link a predecessor; use supersede()");
        }
        MemoryRecord record = StoreSupport.prepareActive(source, clock.instant());
        try {
            MemoryRecord saved = mongoTemplate.insert(record);
            log.info("Inserted memory record [id={}] for owner: {}", saved.getId(), saved.getOwnerId());
            return saved;
        } catch (DuplicateKeyException e) {
            throw new SlotConflictException(record.getSlotKey(), "Slot already has an active record", e);
        }
    }

    @Override
    @Transactional
    public MemoryRecord update(String id, RecordPatch patch) {
        Criteria criteria = Criteria.where("_id").is(id).and("status").is(MemoryStatus.ACTIVE);
        if (patch.getExpectedVersion() != null) {
            criteria = criteria.and("version").is(patch.getExpectedVersion());
        }

        MemoryRecord updated = mongoTemplate.findAndModify(
                new Query(criteria), toUpdate(patch), RETURN_NEW, MemoryRecord.class);
        if (updated == null) {
            MemoryRecord current = mongoTemplate.findById(id, MemoryRecord.class);
            String slot = current == null ? null : current.getSlotKey();
            throw new SlotConflictException(slot, "Record " + id + " changed or is no longer active");
        }
        return updated;
    }

    @Override
    @Transactional
    public MemoryRecord supersede(String oldId, MemoryRecord newRecord) {
        Instant now = clock.instant();
        MemoryRecord prepared = StoreSupport.prepareActive(newRecord, now);
        prepared.setSupersedesId(oldId);

        MemoryRecord old = mongoTemplate.findById(oldId, MemoryRecord.class);
        if (old == null || !old.isActive() || old.getVersion() != prepared.getVersion() - 1) {
            throw new SlotConflictException(old == null ? null : old.getSlotKey(),
                    "Record " + oldId + " is no longer the active head");
        }
        if (!old.getOwnerId().equals(prepared.getOwnerId())) {
            throw new InvariantViolationException("Cannot supersede across owners: " + oldId);
        }
        StoreSupport.assertNoCycle(old, prepared.getId(), this::getById);

        Query head = new Query(Criteria.where("_id").is(oldId)
                .and("status").is(MemoryStatus.ACTIVE)
                .and("version").is(old.getVersion()));
        Update retire = new Update()
                .set("status", MemoryStatus.SUPERSEDED)
                .set("historical", true)
                .set("supersededById", prepared.getId())
                .set("updatedAt", now);
        if (mongoTemplate.findAndModify(head, retire, RETURN_NEW, MemoryRecord.class) == null) {
            throw new SlotConflictException(old.getSlotKey(), "Record " + oldId + " changed during supersede");
        }

        try {
            MemoryRecord saved = mongoTemplate.insert(prepared);
            log.info("Superseded memory record [id={}] with [id={}] version={} for owner: {}",
                    oldId, saved.getId(), saved.getVersion(), saved.getOwnerId());
            return saved;
        } catch (DuplicateKeyException e) {
            throw new SlotConflictException(prepared.getSlotKey(), "Target slot already occupied", e);
        }
    }

    @Override
    @Transactional
    public Optional<MemoryRecord> softDelete(String id, ArchivedReason reason) {
        return archive(id, new Update().set("archivedReason", reason));
    }

    @Override
    @Transactional
    public Optional<MemoryRecord> markMerged(String id, String keeperId) {
        return archive(id, new Update()
                .set("archivedReason", ArchivedReason.CONSOLIDATED)
                .set("supersededById", keeperId));
    }

    private Optional<MemoryRecord> archive(String id, Update update) {
        Query query = new Query(Criteria.where("_id").is(id).and("status").is(MemoryStatus.ACTIVE));
        update.set("status", MemoryStatus.ARCHIVED).set("updatedAt", clock.instant());
        MemoryRecord archived = mongoTemplate.findAndModify(query, update, RETURN_NEW, MemoryRecord.class);
        if (archived == null) {
            return getById(id);
        }
        log.info("Archived memory record [id={}] reason={}", id, archived.getArchivedReason());
        return Optional.of(archived);
    }

    @Override
    @Transactional
    public Optional<MemoryRecord> hardDelete(String id) {
        MemoryRecord removed = mongoTemplate.findAndRemove(
                new Query(Criteria.where("_id").is(id)), MemoryRecord.class);
        if (removed != null) {
            log.info("Hard-deleted memory record [id={}] for owner: {}", id, removed.getOwnerId());
        }
        return Optional.ofNullable(removed);
    }

    @Override
    public MemoryRecord addAlias(String id, String alias) {
        return mongoTemplate.findAndModify(
                new Query(Criteria.where("_id").is(id)),
                new Update().addToSet("aliases", alias.trim()).set("updatedAt", clock.instant()),
                RETURN_NEW, MemoryRecord.class);
    }

    /**
     * Importance boost is read-modify-write per record; a concurrent decay may
     * interleave, which only makes the score approximate, never the content.
     */
    @Override
    public void recordAccess(String ownerId, Collection<String> ids, double importanceBoost) {
        Instant now = clock.instant();
        List<MemoryRecord> records = mongoTemplate.find(
                new Query(Criteria.where("ownerId").is(ownerId).and("_id").in(ids)), MemoryRecord.class);
        for (MemoryRecord record : records) {
            double boosted = Math.min(1.0, record.getImportance() + importanceBoost);
            mongoTemplate.updateFirst(
                    new Query(Criteria.where("_id").is(record.getId())),
                    new Update()
                            .inc("accessCount", 1)
                            .set("lastAccessedAt", now)
                            .set("importance", boosted)
                            .set("baseImportance", boosted),
                    MemoryRecord.class);
        }
    }

    // ─── Reads ──────────────────────────────────────────────────────────────

    @Override
    public Optional<MemoryRecord> getById(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, MemoryRecord.class));
    }

    @Override
    public Optional<MemoryRecord> getActiveBySlot(String ownerId, String subjectName, String predicate) {
        String key = SlotKeys.slotKey(ownerId, subjectName, predicate);
        if (key == null) return Optional.empty();
        return Optional.ofNullable(mongoTemplate.findOne(
                new Query(Criteria.where("slotKey").is(key)
                        .and("ownerId").is(ownerId)
                        .and("status").is(MemoryStatus.ACTIVE)),
                MemoryRecord.class));
    }

    @Override
    public List<MemoryRecord> findActive(String ownerId) {
        return findByOwner(ownerId, MemoryStatus.ACTIVE);
    }

    @Override
    public List<MemoryRecord> findByOwner(String ownerId, MemoryStatus status) {
        Criteria criteria = Criteria.where("ownerId").is(ownerId);
        if (status != null) criteria = criteria.and("status").is(status);
        return mongoTemplate.find(new Query(criteria).with(Sort.by(Sort.Direction.DESC, "createdAt")),
                MemoryRecord.class);
    }

    @Override
    public List<MemoryRecord> findActiveWithEmbedding(String ownerId) {
        return mongoTemplate.find(new Query(Criteria.where("ownerId").is(ownerId)
                .and("status").is(MemoryStatus.ACTIVE)
                .and("embedding").exists(true).ne(null)), MemoryRecord.class);
    }

    @Override
    public List<MemoryRecord> findActiveByCategory(String ownerId, MemoryCategory category) {
        return mongoTemplate.find(new Query(Criteria.where("ownerId").is(ownerId)
                .and("status").is(MemoryStatus.ACTIVE)
                .and("category").is(category)), MemoryRecord.class);
    }

    @Override
    public List<MemoryRecord> searchByKeyword(String ownerId, String term, int limit) {
        Pattern pattern = Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE);
        Query query = new Query(Criteria.where("ownerId").is(ownerId)
                .and("status").is(MemoryStatus.ACTIVE)
                .orOperator(Criteria.where("content").regex(pattern),
                        Criteria.where("subjectName").regex(pattern)))
                .limit(limit);
        return mongoTemplate.find(query, MemoryRecord.class);
    }

    @Override
    public List<MemoryRecord> findChain(String id) {
        return ChainWalker.walk(id, this::getById);
    }

    @Override
    public List<String> findOwnerIds() {
        return mongoTemplate.findDistinct(new Query(), "ownerId", MemoryRecord.class, String.class);
    }

    @Override
    public List<String> findSubjectNames(String ownerId, int limit) {
        return mongoTemplate.findDistinct(
                        new Query(Criteria.where("ownerId").is(ownerId).and("status").is(MemoryStatus.ACTIVE)),
                        "subjectName", MemoryRecord.class, String.class)
                .stream()
                .filter(Objects::nonNull)
                .limit(limit)
                .toList();
    }

    private Update toUpdate(RecordPatch patch) {
        Update update = new Update().set("updatedAt", clock.instant());
        if (patch.getContent() != null) update.set("content", patch.getContent());
        if (patch.getEmbedding() != null) update.set("embedding", patch.getEmbedding());
        if (patch.getEmbeddingModel() != null) update.set("embeddingModel", patch.getEmbeddingModel());
        if (patch.getImportance() != null) update.set("importance", patch.getImportance());
        if (patch.getBaseImportance() != null) update.set("baseImportance", patch.getBaseImportance());
        if (patch.getAccessCount() != null) update.set("accessCount", patch.getAccessCount());
        if (patch.getSentiment() != null) update.set("sentiment", patch.getSentiment());
        if (patch.getHistorical() != null) update.set("historical", patch.getHistorical());
        if (patch.isBumpVersion()) update.inc("version", 1);
        return update;
    }
}
