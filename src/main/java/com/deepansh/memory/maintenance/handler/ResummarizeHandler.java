package com.deepansh.memory.maintenance.handler;

import com.deepansh.memory.maintenance.MaintenanceJobHandler;
import com.deepansh.memory.model.CategorySummary;
import com.deepansh.memory.model.JobType;
import com.deepansh.memory.model.MaintenanceJob;
import com.deepansh.memory.model.MemoryCategory;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.Sensitivity;
import com.deepansh.memory.store.MemoryStore;
import com.deepansh.memory.summary.CategorySummarizer;
import com.deepansh.memory.summary.CategorySummaryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rebuilds category summaries whose member set changed. PRIVATE records are
 * never members. A summarizer failure propagates so the job retries.
 */
@Component
@Slf4j
public class ResummarizeHandler implements MaintenanceJobHandler {

    private final MemoryStore store;
    private final CategorySummaryStore summaryStore;
    private final CategorySummarizer summarizer;
    private final Clock clock;

    public ResummarizeHandler(MemoryStore store, CategorySummaryStore summaryStore,
                              CategorySummarizer summarizer, Clock clock) {
        this.store = store;
        this.summaryStore = summaryStore;
        this.summarizer = summarizer;
        this.clock = clock;
    }

    @Override
    public JobType type() {
        return JobType.RESUMMARIZE;
    }

    @Override
    public Map<String, Object> handle(MaintenanceJob job) {
        List<MemoryCategory> categories = categoriesOf(job);
        int rewritten = 0;
        int unchanged = 0;
        for (String ownerId : owners(job, store)) {
            for (MemoryCategory category : categories) {
                if (resummarize(ownerId, category)) rewritten++;
                else unchanged++;
            }
        }
        return Map.of("rewritten", rewritten, "unchanged", unchanged);
    }

    private boolean resummarize(String ownerId, MemoryCategory category) {
        List<MemoryRecord> members = store.findActiveByCategory(ownerId, category).stream()
                .filter(r -> r.getSensitivity() != Sensitivity.PRIVATE)
                .sorted(Comparator.comparing(MemoryRecord::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
        List<String> memberIds = members.stream().map(MemoryRecord::getId).toList();
        Optional<CategorySummary> existing = summaryStore.find(ownerId, category);

        if (existing.isEmpty() && members.isEmpty()) return false;
        if (existing.isPresent()
                && new HashSet<>(existing.get().getMemberRecordIds()).equals(new HashSet<>(memberIds))) {
            return false;
        }

        String previous = existing.map(CategorySummary::getSummaryText).orElse(null);
        String text = members.isEmpty() ? null : summarizer.summarize(category, previous, members);
        long version = existing.map(CategorySummary::getVersion).orElse(0L) + 1;

        summaryStore.save(CategorySummary.builder()
                .ownerId(ownerId)
                .category(category)
                .summaryText(text)
                .memberRecordIds(new ArrayList<>(memberIds))
                .version(version)
                .lastSynthesizedAt(clock.instant())
                .build());
        log.info("Summary for owner={} category={} rewritten to version {} from {} records",
                ownerId, category, version, members.size());
        return true;
    }

    private List<MemoryCategory> categoriesOf(MaintenanceJob job) {
        String named = job.payloadString("category");
        if (named == null || named.isBlank()) return Arrays.asList(MemoryCategory.values());
        return List.of(MemoryCategory.valueOf(named.trim().toUpperCase()));
    }
}
