package com.deepansh.memory.maintenance.handler;

import com.deepansh.memory.embedding.EmbeddingClient;
import com.deepansh.memory.embedding.VectorMath;
import com.deepansh.memory.exception.SlotConflictException;
import com.deepansh.memory.maintenance.MaintenanceJobHandler;
import com.deepansh.memory.model.JobType;
import com.deepansh.memory.model.MaintenanceJob;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.RecordRelationship;
import com.deepansh.memory.relationship.RelationshipStore;
import com.deepansh.memory.store.MemoryStore;
import com.deepansh.memory.store.RecordPatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Re-embeds records produced by another model (or never embedded), then
 * recomputes co-access strengths:
 *
 *   strength = min(1, coAccess / sqrt(accessA * accessB))
 *
 * Payload force=true re-embeds every active record.
 */
@Component
@Slf4j
public class ReindexHandler implements MaintenanceJobHandler {

    private final MemoryStore store;
    private final EmbeddingClient embeddingClient;
    private final RelationshipStore relationshipStore;

    public ReindexHandler(MemoryStore store, EmbeddingClient embeddingClient, RelationshipStore relationshipStore) {
        this.store = store;
        this.embeddingClient = embeddingClient;
        this.relationshipStore = relationshipStore;
    }

    @Override
    public JobType type() {
        return JobType.REINDEX;
    }

    @Override
    public Map<String, Object> handle(MaintenanceJob job) {
        boolean force = job.payloadFlag("force");
        String model = embeddingClient.modelName();
        int reembedded = 0;
        int relationships = 0;

        for (String ownerId : owners(job, store)) {
            for (MemoryRecord record : store.findActive(ownerId)) {
                if (!force && record.hasEmbedding() && model.equals(record.getEmbeddingModel())) continue;
                // EmbeddingUnavailable propagates: the job retries with backoff
                float[] vector = embeddingClient.embed(record.getContent());
                try {
                    store.update(record.getId(), RecordPatch.builder()
                            .embedding(VectorMath.toDoubleList(vector))
                            .embeddingModel(model)
                            .build());
                    reembedded++;
                } catch (SlotConflictException e) {
                    log.debug("Record [id={}] changed during reindex, skipping", record.getId());
                }
            }
            for (RecordRelationship rel : relationshipStore.findByOwner(ownerId)) {
                relationshipStore.updateStrength(rel.getId(), strength(rel));
                relationships++;
            }
        }
        log.info("Reindex re-embedded {} records, refreshed {} relationships", reembedded, relationships);
        return Map.of("reembedded", reembedded, "relationships", relationships);
    }

    double strength(RecordRelationship rel) {
        long a = accessCount(rel.getRecordAId());
        long b = accessCount(rel.getRecordBId());
        double denominator = Math.sqrt((double) Math.max(1, a) * Math.max(1, b));
        return Math.min(1.0, rel.getCoAccessCount() / denominator);
    }

    private long accessCount(String recordId) {
        Optional<MemoryRecord> record = store.getById(recordId);
        return record.map(MemoryRecord::getAccessCount).orElse(0L);
    }
}
