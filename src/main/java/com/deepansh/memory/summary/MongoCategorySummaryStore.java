package com.deepansh.memory.summary;

import com.deepansh.memory.model.CategorySummary;
import com.deepansh.memory.model.MemoryCategory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "memory.store.backend", havingValue = "mongo", matchIfMissing = true)
public class MongoCategorySummaryStore implements CategorySummaryStore {

    private final MongoTemplate mongoTemplate;

    public MongoCategorySummaryStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<CategorySummary> find(String ownerId, MemoryCategory category) {
        return Optional.ofNullable(mongoTemplate.findOne(byKey(ownerId, category), CategorySummary.class));
    }

    @Override
    public List<CategorySummary> findByOwner(String ownerId) {
        return mongoTemplate.find(new Query(Criteria.where("ownerId").is(ownerId))
                .with(Sort.by("category")), CategorySummary.class);
    }

    /** Upsert on (owner, category) so concurrent resummarize jobs never create a second document. */
    @Override
    public CategorySummary save(CategorySummary summary) {
        Update update = new Update()
                .set("summaryText", summary.getSummaryText())
                .set("memberRecordIds", summary.getMemberRecordIds())
                .set("version", summary.getVersion())
                .set("lastSynthesizedAt", summary.getLastSynthesizedAt());
        return mongoTemplate.findAndModify(byKey(summary.getOwnerId(), summary.getCategory()), update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), CategorySummary.class);
    }

    private Query byKey(String ownerId, MemoryCategory category) {
        return new Query(Criteria.where("ownerId").is(ownerId).and("category").is(category));
    }
}
