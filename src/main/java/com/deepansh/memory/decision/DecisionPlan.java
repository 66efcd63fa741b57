package com.deepansh.memory.decision;

import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.MergeStrategy;
import com.deepansh.memory.model.OperationType;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A validated decision, ready to execute against the store.
 */
@Data
@Builder(toBuilder = true)
public class DecisionPlan {

    private OperationType operation;

    private MergeStrategy strategy;

    /** Record the plan acts on, as last read. Null for ADD and target-less NOOP. */
    private MemoryRecord target;

    /** Resulting content for ADD and UPDATE. */
    private String content;

    /** Set for alias-only UPDATEs: link the subject, merge nothing. */
    private String alias;

    private boolean hardDelete;

    private String reasoning;

    @Builder.Default
    private List<String> overrides = new ArrayList<>();

    public boolean isAliasOnly() {
        return alias != null;
    }

    public String targetId() {
        return target == null ? null : target.getId();
    }

    DecisionPlan override(String note) {
        overrides.add(note);
        return this;
    }
}
