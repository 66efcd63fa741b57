package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Immutable audit row: one per decision taken by the update engine and one
 * per consolidation merge. Inserted once, never updated.
 *
 * Collection: memory_operations
 */
@Document(collection = "memory_operations")
@CompoundIndexes({
    @CompoundIndex(name = "idx_owner_date", def = "{'ownerId': 1, 'createdAt': -1}"),
    @CompoundIndex(name = "idx_target", def = "{'targetRecordId': 1}"),
    @CompoundIndex(name = "idx_results", def = "{'resultRecordIds': 1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryOperation {

    @Id
    private String id;

    private String ownerId;

    private OperationType operation;

    private OperationStatus status;

    private MergeStrategy mergeStrategy;

    private String candidateSubject;

    private String candidateContent;

    private MemoryKind candidateKind;

    @Builder.Default
    private List<ConsideredRecord> similarRecords = new ArrayList<>();

    /** Reasoning text returned by the decision collaborator. */
    private String reasoning;

    /** Deterministic rules that changed the collaborator's decision. */
    @Builder.Default
    private List<String> overrides = new ArrayList<>();

    private String targetRecordId;

    @Builder.Default
    private List<String> resultRecordIds = new ArrayList<>();

    private String previousContent;

    private String newContent;

    private Long previousVersion;

    private Long newVersion;

    private String aliasAdded;

    private boolean hardDelete;

    /** Only place the content of a hard-deleted record survives. */
    private Map<String, Object> deletedSnapshot;

    private int attempts;

    private String errorMessage;

    private String sourceId;

    private String jobId;

    private long processingTimeMs;

    private Instant createdAt;

    public record ConsideredRecord(String recordId, String content, double similarity) {}
}
