package com.deepansh.memory.decision;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResult {

    private String ownerId;

    private String sourceId;

    private int candidatesExtracted;

    @Builder.Default
    private List<DecisionOutcome> outcomes = new ArrayList<>();

    private long processingTimeMs;
}
