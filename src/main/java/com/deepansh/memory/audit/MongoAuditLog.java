package com.deepansh.memory.audit;

import com.deepansh.memory.model.MemoryOperation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Repository
@ConditionalOnProperty(name = "memory.store.backend", havingValue = "mongo", matchIfMissing = true)
@Slf4j
public class MongoAuditLog implements AuditLog {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoAuditLog(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    public MemoryOperation append(MemoryOperation operation) {
        if (operation.getId() == null) operation.setId(UUID.randomUUID().toString());
        if (operation.getCreatedAt() == null) operation.setCreatedAt(clock.instant());
        // insert, never save: an existing id must fail rather than overwrite history
        return mongoTemplate.insert(operation);
    }

    @Override
    public List<MemoryOperation> findByOwner(String ownerId, int limit) {
        return mongoTemplate.find(new Query(Criteria.where("ownerId").is(ownerId))
                .with(Sort.by(Sort.Direction.DESC, "createdAt"))
                .limit(limit), MemoryOperation.class);
    }

    @Override
    public List<MemoryOperation> findByRecord(String recordId) {
        return mongoTemplate.find(new Query(new Criteria().orOperator(
                        Criteria.where("targetRecordId").is(recordId),
                        Criteria.where("resultRecordIds").is(recordId)))
                .with(Sort.by(Sort.Direction.ASC, "createdAt")), MemoryOperation.class);
    }
}
