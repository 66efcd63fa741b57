package com.deepansh.memory.decision;

/**
 * Where a candidate came from and how many times the engine has tried it.
 */
public record DecisionContext(String sourceId, String jobId, int attempt) {

    public static DecisionContext first(String sourceId) {
        return new DecisionContext(sourceId, null, 1);
    }

    public DecisionContext nextAttempt() {
        return new DecisionContext(sourceId, jobId, attempt + 1);
    }
}
