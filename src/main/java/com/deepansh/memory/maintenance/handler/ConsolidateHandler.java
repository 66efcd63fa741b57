package com.deepansh.memory.maintenance.handler;

import com.deepansh.memory.audit.AuditLog;
import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.embedding.EmbeddingClient;
import com.deepansh.memory.embedding.VectorMath;
import com.deepansh.memory.exception.EmbeddingUnavailableException;
import com.deepansh.memory.exception.SlotConflictException;
import com.deepansh.memory.maintenance.MaintenanceJobHandler;
import com.deepansh.memory.model.JobType;
import com.deepansh.memory.model.MaintenanceJob;
import com.deepansh.memory.model.MemoryOperation;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.OperationStatus;
import com.deepansh.memory.model.OperationType;
import com.deepansh.memory.model.Sensitivity;
import com.deepansh.memory.store.ContentMatch;
import com.deepansh.memory.store.MemoryStore;
import com.deepansh.memory.store.RecordPatch;
import com.deepansh.memory.store.SlotKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges near-duplicate active records of one owner.
 *
 * A pair qualifies when both share a subject (directly or by alias) and a
 * predicate, neither is PRIVATE, and cosine similarity is at least the
 * configured threshold. Pairs are taken greedily by similarity and a record
 * takes part in at most one merge per run. The keeper absorbs the other's
 * content when it adds anything; the other is archived as CONSOLIDATED and
 * points at the keeper. Nothing is ever hard-deleted here.
 *
 * Payload dryRun=true returns the pairs that would merge and changes nothing.
 */
@Component
@Slf4j
public class ConsolidateHandler implements MaintenanceJobHandler {

    private final MemoryStore store;
    private final EmbeddingClient embeddingClient;
    private final AuditLog auditLog;
    private final MemoryProperties props;
    private final Clock clock;

    public ConsolidateHandler(MemoryStore store, EmbeddingClient embeddingClient, AuditLog auditLog,
                              MemoryProperties props, Clock clock) {
        this.store = store;
        this.embeddingClient = embeddingClient;
        this.auditLog = auditLog;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public JobType type() {
        return JobType.CONSOLIDATE;
    }

    @Override
    public Map<String, Object> handle(MaintenanceJob job) {
        boolean dryRun = job.payloadFlag("dryRun");
        List<Map<String, Object>> preview = new ArrayList<>();
        int merged = 0;

        for (String ownerId : owners(job, store)) {
            Set<String> used = new HashSet<>();
            for (Candidate pair : findPairs(ownerId)) {
                if (used.contains(pair.a().getId()) || used.contains(pair.b().getId())) continue;
                used.add(pair.a().getId());
                used.add(pair.b().getId());

                MemoryRecord keeper = keeperOf(pair.a(), pair.b());
                MemoryRecord other = keeper == pair.a() ? pair.b() : pair.a();
                if (dryRun) {
                    preview.add(previewOf(keeper, other, pair.similarity()));
                } else if (merge(job, keeper, other, pair.similarity())) {
                    merged++;
                }
            }
        }

        if (dryRun) {
            log.info("Consolidation dry run found {} pairs", preview.size());
            return Map.of("dryRun", true, "pairs", preview);
        }
        log.info("Consolidation merged {} pairs", merged);
        return Map.of("merged", merged);
    }

    List<Candidate> findPairs(String ownerId) {
        double threshold = props.getConsolidation().getSimilarityThreshold();
        List<MemoryRecord> records = store.findActiveWithEmbedding(ownerId).stream()
                .filter(r -> r.getSensitivity() != Sensitivity.PRIVATE)
                .toList();

        List<Candidate> pairs = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            for (int j = i + 1; j < records.size(); j++) {
                MemoryRecord a = records.get(i);
                MemoryRecord b = records.get(j);
                if (!SlotKeys.sameSubject(a, b)) continue;
                if (!Objects.equals(SlotKeys.normalizePredicate(a.getPredicate()),
                        SlotKeys.normalizePredicate(b.getPredicate()))) continue;
                double similarity = VectorMath.cosineSimilarity(
                        VectorMath.toFloatArray(a.getEmbedding()), b.getEmbedding());
                if (similarity >= threshold) {
                    pairs.add(new Candidate(a, b, similarity));
                }
            }
        }
        pairs.sort(Comparator.comparingDouble(Candidate::similarity).reversed());
        return pairs;
    }

    /** Higher importance, then more accesses, then the older record. */
    static MemoryRecord keeperOf(MemoryRecord a, MemoryRecord b) {
        Comparator<MemoryRecord> order = Comparator
                .comparingDouble(MemoryRecord::getImportance).reversed()
                .thenComparing(Comparator.comparingLong(MemoryRecord::getAccessCount).reversed())
                .thenComparing(MemoryRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));
        return order.compare(a, b) <= 0 ? a : b;
    }

    private boolean merge(MaintenanceJob job, MemoryRecord keeper, MemoryRecord other, double similarity) {
        boolean grows = !ContentMatch.contains(keeper.getContent(), other.getContent());
        String content = grows ? ContentMatch.append(keeper.getContent(), other.getContent()) : keeper.getContent();

        RecordPatch.RecordPatchBuilder patch = RecordPatch.builder()
                .importance(Math.max(keeper.getImportance(), other.getImportance()))
                .baseImportance(Math.max(keeper.getBaseImportance(), other.getBaseImportance()))
                .accessCount(keeper.getAccessCount() + other.getAccessCount())
                .expectedVersion(keeper.getVersion())
                .bumpVersion(true);
        if (grows) {
            patch.content(content);
            try {
                patch.embedding(VectorMath.toDoubleList(embeddingClient.embed(content)))
                        .embeddingModel(embeddingClient.modelName());
            } catch (EmbeddingUnavailableException e) {
                log.warn("Could not re-embed keeper [id={}], reindex will pick it up: {}", keeper.getId(), e.getMessage());
            }
        }

        MemoryRecord updated;
        try {
            updated = store.update(keeper.getId(), patch.build());
        } catch (SlotConflictException e) {
            log.info("Keeper [id={}] changed during consolidation, pair skipped", keeper.getId());
            return false;
        }
        store.markMerged(other.getId(), keeper.getId());

        auditLog.append(MemoryOperation.builder()
                .ownerId(keeper.getOwnerId())
                .operation(OperationType.CONSOLIDATE)
                .status(OperationStatus.APPLIED)
                .candidateSubject(other.getSubjectName())
                .candidateContent(other.getContent())
                .candidateKind(other.getKind())
                .reasoning(String.format("Near-duplicate of [id=%s] (similarity %.3f)", keeper.getId(), similarity))
                .targetRecordId(other.getId())
                .resultRecordIds(new ArrayList<>(List.of(keeper.getId())))
                .previousContent(keeper.getContent())
                .newContent(updated.getContent())
                .previousVersion(keeper.getVersion())
                .newVersion(updated.getVersion())
                .jobId(job.getId())
                .createdAt(clock.instant())
                .build());
        log.info("Consolidated [id={}] into [id={}] owner={}", other.getId(), keeper.getId(), keeper.getOwnerId());
        return true;
    }

    private Map<String, Object> previewOf(MemoryRecord keeper, MemoryRecord other, double similarity) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("keeperId", keeper.getId());
        entry.put("mergedId", other.getId());
        entry.put("keeperContent", keeper.getContent());
        entry.put("mergedContent", other.getContent());
        entry.put("similarity", similarity);
        return entry;
    }

    record Candidate(MemoryRecord a, MemoryRecord b, double similarity) {}
}
