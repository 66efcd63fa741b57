package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the decision collaborator proposed for one candidate. The engine
 * validates it before anything touches the store.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MemoryDecision {

    private OperationType operation;

    private MergeStrategy mergeStrategy;

    private String targetId;

    /** Content for the updated record; defaults to the candidate content. */
    private String newContent;

    private String reasoning;

    /** Collaborator asserts the candidate's subject and the target's are the same entity. */
    private boolean sameEntity;

    private boolean hardDelete;

    public static MemoryDecision noop(String reasoning) {
        return MemoryDecision.builder().operation(OperationType.NOOP).reasoning(reasoning).build();
    }
}
