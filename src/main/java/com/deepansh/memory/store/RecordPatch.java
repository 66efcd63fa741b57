package com.deepansh.memory.store;

import com.deepansh.memory.model.MemoryRecord;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Partial in-place change to an ACTIVE record. Null fields are left alone.
 *
 * expectedVersion turns the write into a compare-and-set: the store rejects it
 * with SlotConflictException when the record moved on. bumpVersion marks a
 * content change, which advances the record's version.
 */
@Data
@Builder
public class RecordPatch {

    private String content;
    private List<Double> embedding;
    private String embeddingModel;
    private Double importance;
    private Double baseImportance;
    private Long accessCount;
    private Double sentiment;
    private Boolean historical;
    private Long expectedVersion;
    private boolean bumpVersion;

    void applyTo(MemoryRecord record, Instant now) {
        if (content != null) record.setContent(content);
        if (embedding != null) record.setEmbedding(embedding);
        if (embeddingModel != null) record.setEmbeddingModel(embeddingModel);
        if (importance != null) record.setImportance(importance);
        if (baseImportance != null) record.setBaseImportance(baseImportance);
        if (accessCount != null) record.setAccessCount(accessCount);
        if (sentiment != null) record.setSentiment(sentiment);
        if (historical != null) record.setHistorical(historical);
        if (bumpVersion) record.setVersion(record.getVersion() + 1);
        record.setUpdatedAt(now);
    }
}
