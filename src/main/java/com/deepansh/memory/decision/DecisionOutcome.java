package com.deepansh.memory.decision;

import com.deepansh.memory.model.MergeStrategy;
import com.deepansh.memory.model.OperationStatus;
import com.deepansh.memory.model.OperationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What happened to one candidate. A requeued candidate has no status yet and
 * no audit entry; the final attempt writes one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionOutcome {

    private OperationType operation;

    private OperationStatus status;

    private MergeStrategy mergeStrategy;

    private String targetRecordId;

    @Builder.Default
    private List<String> resultRecordIds = new ArrayList<>();

    private String reasoning;

    private String auditId;

    private boolean requeued;
}
