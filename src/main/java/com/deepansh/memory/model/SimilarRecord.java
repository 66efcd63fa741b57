package com.deepansh.memory.model;

/**
 * A record together with its cosine similarity to a query vector.
 */
public record SimilarRecord(MemoryRecord record, double similarity) {

    public String id() {
        return record.getId();
    }
}
