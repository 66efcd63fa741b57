package com.deepansh.memory.retrieval;

import com.deepansh.memory.model.MemoryRecord;

public record ScoredRecord(MemoryRecord record, double similarity, double score, int tokens) {

    public double valuePerToken() {
        return tokens == 0 ? score : score / tokens;
    }
}
