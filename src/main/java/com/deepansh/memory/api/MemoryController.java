package com.deepansh.memory.api;

import com.deepansh.memory.decision.DecisionOutcome;
import com.deepansh.memory.decision.MemoryUpdateEngine;
import com.deepansh.memory.decision.ObservationService;
import com.deepansh.memory.exception.RecordNotFoundException;
import com.deepansh.memory.export.ExportBundle;
import com.deepansh.memory.export.ExportService;
import com.deepansh.memory.model.CandidateFact;
import com.deepansh.memory.model.CategorySummary;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.MemoryStatus;
import com.deepansh.memory.retrieval.RetrievalComposer;
import com.deepansh.memory.retrieval.RetrievalResult;
import com.deepansh.memory.store.MemoryStore;
import com.deepansh.memory.summary.CategorySummaryStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/memory")
@RequiredArgsConstructor
public class MemoryController {

    private final ObservationService observationService;
    private final MemoryUpdateEngine engine;
    private final MemoryStore store;
    private final RetrievalComposer retrievalComposer;
    private final CategorySummaryStore summaryStore;
    private final ExportService exportService;

    // ─── Write ───────────────────────────────────────────────────────────────

    @PostMapping("/{ownerId}/candidates")
    public ResponseEntity<DecisionOutcome> submitCandidate(
            @PathVariable String ownerId,
            @Valid @RequestBody CandidateFact candidate) {
        return ResponseEntity.ok(observationService.submit(ownerId, candidate));
    }

    @DeleteMapping("/records/{id}")
    public ResponseEntity<DecisionOutcome> deleteRecord(
            @PathVariable String id,
            @RequestParam(defaultValue = "false") boolean hard) {
        return ResponseEntity.ok(engine.deleteRecord(id, hard));
    }

    // ─── Records ─────────────────────────────────────────────────────────────

    @GetMapping("/{ownerId}/records")
    public ResponseEntity<List<MemoryRecord>> getRecords(
            @PathVariable String ownerId,
            @RequestParam(required = false) MemoryStatus status) {
        return ResponseEntity.ok(store.findByOwner(ownerId, status));
    }

    @GetMapping("/records/{id}")
    public ResponseEntity<MemoryRecord> getRecord(@PathVariable String id) {
        return ResponseEntity.ok(store.getById(id)
                .orElseThrow(() -> new RecordNotFoundException("Memory record", id)));
    }

    /** Version chain, oldest first. */
    @GetMapping("/records/{id}/history")
    public ResponseEntity<List<MemoryRecord>> getHistory(@PathVariable String id) {
        if (store.getById(id).isEmpty()) throw new RecordNotFoundException("Memory record", id);
        return ResponseEntity.ok(store.findChain(id));
    }

    // ─── Read path ───────────────────────────────────────────────────────────

    @GetMapping("/{ownerId}/retrieve")
    public ResponseEntity<RetrievalResult> retrieve(
            @PathVariable String ownerId,
            @RequestParam String q,
            @RequestParam(required = false) Integer budget) {
        if (q.isBlank()) throw new IllegalArgumentException("q must not be blank");
        return ResponseEntity.ok(retrievalComposer.retrieve(ownerId, q, budget));
    }

    @GetMapping("/{ownerId}/summaries")
    public ResponseEntity<List<CategorySummary>> getSummaries(@PathVariable String ownerId) {
        return ResponseEntity.ok(summaryStore.findByOwner(ownerId));
    }

    @GetMapping("/{ownerId}/export")
    public ResponseEntity<ExportBundle> export(@PathVariable String ownerId) {
        return ResponseEntity.ok(exportService.export(ownerId));
    }
}
