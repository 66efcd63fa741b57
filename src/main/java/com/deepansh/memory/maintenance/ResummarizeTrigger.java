package com.deepansh.memory.maintenance;

import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.model.CategorySummary;
import com.deepansh.memory.model.JobType;
import com.deepansh.memory.model.MemoryCategory;
import com.deepansh.memory.model.Sensitivity;
import com.deepansh.memory.store.MemoryStore;
import com.deepansh.memory.summary.CategorySummaryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Enqueues a RESUMMARIZE once enough new records have landed in a category
 * since its last synthesis. At most one pending resummarize per owner.
 */
@Component
@Slf4j
public class ResummarizeTrigger {

    private final MemoryStore store;
    private final CategorySummaryStore summaryStore;
    private final JobQueue jobQueue;
    private final MemoryProperties props;

    public ResummarizeTrigger(MemoryStore store, CategorySummaryStore summaryStore,
                              JobQueue jobQueue, MemoryProperties props) {
        this.store = store;
        this.summaryStore = summaryStore;
        this.jobQueue = jobQueue;
        this.props = props;
    }

    /** Best effort: a failure here never undoes the write that triggered it. */
    public void afterWrite(String ownerId, MemoryCategory category) {
        if (category == null) return;
        try {
            Instant since = summaryStore.find(ownerId, category)
                    .map(CategorySummary::getLastSynthesizedAt)
                    .orElse(Instant.EPOCH);
            long fresh = store.findActiveByCategory(ownerId, category).stream()
                    .filter(r -> r.getSensitivity() != Sensitivity.PRIVATE)
                    .filter(r -> r.getCreatedAt() != null && r.getCreatedAt().isAfter(since))
                    .count();
            if (fresh < props.getSummary().getResummarizeThreshold()) return;
            if (jobQueue.hasPending(ownerId, JobType.RESUMMARIZE)) return;

            jobQueue.enqueue(ownerId, JobType.RESUMMARIZE, Map.of(), null, null);
            log.info("Resummarize queued for owner={}: {} new records in {}", ownerId, fresh, category);
        } catch (RuntimeException e) {
            log.warn("Could not evaluate resummarize trigger for owner={} category={}: {}",
                    ownerId, category, e.getMessage());
        }
    }
}
