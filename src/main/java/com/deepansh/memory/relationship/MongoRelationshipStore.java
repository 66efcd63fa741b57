package com.deepansh.memory.relationship;

import com.deepansh.memory.model.RecordRelationship;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Repository
@ConditionalOnProperty(name = "memory.store.backend", havingValue = "mongo", matchIfMissing = true)
@Slf4j
public class MongoRelationshipStore implements RelationshipStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoRelationshipStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    public void recordCoAccess(String ownerId, Collection<String> recordIds) {
        List<String> ids = new ArrayList<>(recordIds);
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                String[] pair = RelationshipStore.orderedPair(ids.get(i), ids.get(j));
                mongoTemplate.findAndModify(
                        new Query(Criteria.where("ownerId").is(ownerId)
                                .and("recordAId").is(pair[0])
                                .and("recordBId").is(pair[1])),
                        new Update().inc("coAccessCount", 1).set("updatedAt", clock.instant()),
                        FindAndModifyOptions.options().upsert(true),
                        RecordRelationship.class);
            }
        }
        log.debug("Recorded co-access for owner={} records={}", ownerId, ids.size());
    }

    @Override
    public List<RecordRelationship> findByOwner(String ownerId) {
        return mongoTemplate.find(new Query(Criteria.where("ownerId").is(ownerId)), RecordRelationship.class);
    }

    @Override
    public List<RecordRelationship> findByRecord(String ownerId, String recordId) {
        return mongoTemplate.find(new Query(Criteria.where("ownerId").is(ownerId)
                        .orOperator(Criteria.where("recordAId").is(recordId), Criteria.where("recordBId").is(recordId)))
                .with(Sort.by(Sort.Direction.DESC, "strength")), RecordRelationship.class);
    }

    @Override
    public void updateStrength(String relationshipId, double strength) {
        mongoTemplate.updateFirst(new Query(Criteria.where("_id").is(relationshipId)),
                new Update().set("strength", strength).set("updatedAt", clock.instant()),
                RecordRelationship.class);
    }
}
