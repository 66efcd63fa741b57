package com.deepansh.memory.decision;

import com.deepansh.memory.extraction.FactExtractor;
import com.deepansh.memory.model.CandidateFact;
import com.deepansh.memory.store.MemoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Write path entry point: free text in, one decision per extracted candidate out.
 * Candidates of one observation are processed in extraction order.
 */
@Service
@Slf4j
public class ObservationService {

    /** Known subjects passed to extraction so it reuses their spelling. */
    private static final int KNOWN_ENTITY_LIMIT = 50;

    private final FactExtractor factExtractor;
    private final MemoryUpdateEngine engine;
    private final MemoryStore store;

    public ObservationService(FactExtractor factExtractor, MemoryUpdateEngine engine, MemoryStore store) {
        this.factExtractor = factExtractor;
        this.engine = engine;
        this.store = store;
    }

    public IngestResult ingest(String ownerId, String text, String sourceId) {
        long start = System.currentTimeMillis();
        String source = sourceId == null || sourceId.isBlank() ? UUID.randomUUID().toString() : sourceId;

        List<String> known = store.findSubjectNames(ownerId, KNOWN_ENTITY_LIMIT);
        List<CandidateFact> candidates = factExtractor.extract(text, known);

        List<DecisionOutcome> outcomes = new ArrayList<>();
        for (CandidateFact candidate : candidates) {
            if (candidate.getSourceId() == null) candidate.setSourceId(source);
            outcomes.add(engine.process(ownerId, candidate));
        }

        log.info("Observation ingested for owner={} source={} candidates={}", ownerId, source, candidates.size());
        return IngestResult.builder()
                .ownerId(ownerId)
                .sourceId(source)
                .candidatesExtracted(candidates.size())
                .outcomes(outcomes)
                .processingTimeMs(System.currentTimeMillis() - start)
                .build();
    }

    @Async("decisionTaskExecutor")
    public CompletableFuture<IngestResult> ingestAsync(String ownerId, String text, String sourceId) {
        return CompletableFuture.completedFuture(ingest(ownerId, text, sourceId));
    }

    /** Structured candidate submitted directly, skipping extraction. */
    public DecisionOutcome submit(String ownerId, CandidateFact candidate) {
        return engine.process(ownerId, candidate);
    }
}
