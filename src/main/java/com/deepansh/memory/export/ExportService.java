package com.deepansh.memory.export;

import com.deepansh.memory.model.CategorySummary;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.MemoryStatus;
import com.deepansh.memory.model.Sensitivity;
import com.deepansh.memory.store.MemoryStore;
import com.deepansh.memory.summary.CategorySummaryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/**
 * Portable dump of what the engine knows about an owner: current and
 * historical records plus summaries. PRIVATE records and archived records are
 * withheld, and vectors are stripped.
 */
@Service
@Slf4j
public class ExportService {

    private final MemoryStore store;
    private final CategorySummaryStore summaryStore;
    private final Clock clock;

    public ExportService(MemoryStore store, CategorySummaryStore summaryStore, Clock clock) {
        this.store = store;
        this.summaryStore = summaryStore;
        this.clock = clock;
    }

    public ExportBundle export(String ownerId) {
        List<MemoryRecord> candidates = store.findByOwner(ownerId, null).stream()
                .filter(r -> r.getStatus() == MemoryStatus.ACTIVE || r.getStatus() == MemoryStatus.SUPERSEDED)
                .toList();
        List<MemoryRecord> exported = candidates.stream()
                .filter(r -> r.getSensitivity() != Sensitivity.PRIVATE)
                .map(this::withoutVector)
                .sorted(Comparator.comparing(MemoryRecord::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
        List<CategorySummary> summaries = summaryStore.findByOwner(ownerId).stream()
                .filter(CategorySummary::hasText)
                .toList();

        int withheld = candidates.size() - exported.size();
        log.info("Exported {} records and {} summaries for owner={} ({} private withheld)",
                exported.size(), summaries.size(), ownerId, withheld);
        return ExportBundle.builder()
                .ownerId(ownerId)
                .exportedAt(clock.instant())
                .records(exported)
                .summaries(summaries)
                .privateRecordsWithheld(withheld)
                .build();
    }

    private MemoryRecord withoutVector(MemoryRecord record) {
        MemoryRecord copy = record.copy();
        copy.setEmbedding(null);
        return copy;
    }
}
