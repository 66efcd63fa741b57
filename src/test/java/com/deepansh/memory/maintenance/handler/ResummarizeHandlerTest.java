package com.deepansh.memory.maintenance.handler;

import com.deepansh.memory.exception.MemoryException;
import com.deepansh.memory.model.CategorySummary;
import com.deepansh.memory.model.JobType;
import com.deepansh.memory.model.MaintenanceJob;
import com.deepansh.memory.model.MemoryCategory;
import com.deepansh.memory.model.MemoryKind;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.Sensitivity;
import com.deepansh.memory.store.InMemoryMemoryStore;
import com.deepansh.memory.summary.CategorySummarizer;
import com.deepansh.memory.summary.InMemoryCategorySummaryStore;
import com.deepansh.memory.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResummarizeHandlerTest {

    private static final String OWNER = "owner-1";

    @Mock CategorySummarizer summarizer;

    MutableClock clock;
    InMemoryMemoryStore store;
    InMemoryCategorySummaryStore summaryStore;
    ResummarizeHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new InMemoryMemoryStore(clock);
        summaryStore = new InMemoryCategorySummaryStore();
        handler = new ResummarizeHandler(store, summaryStore, summarizer, clock);
    }

    @Test
    void handle_changedMembers_rewritesSummaryWithoutPrivateRecords() {
        MemoryRecord job = store.insert(work("works at Notion", Sensitivity.NORMAL));
        store.insert(work("negotiating a raise in secret", Sensitivity.PRIVATE));
        when(summarizer.summarize(eq(MemoryCategory.WORK_LIFE), isNull(), anyList()))
                .thenReturn("The user works at Notion.");

        Map<String, Object> result = handler.handle(job(MemoryCategory.WORK_LIFE));

        assertThat(result).containsEntry("rewritten", 1).containsEntry("unchanged", 0);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<MemoryRecord>> members = ArgumentCaptor.forClass(List.class);
        verify(summarizer).summarize(eq(MemoryCategory.WORK_LIFE), isNull(), members.capture());
        assertThat(members.getValue()).extracting(MemoryRecord::getId).containsExactly(job.getId());

        CategorySummary summary = summaryStore.find(OWNER, MemoryCategory.WORK_LIFE).orElseThrow();
        assertThat(summary.getSummaryText()).isEqualTo("The user works at Notion.");
        assertThat(summary.getMemberRecordIds()).containsExactly(job.getId());
        assertThat(summary.getVersion()).isEqualTo(1);
        assertThat(summary.getLastSynthesizedAt()).isEqualTo(clock.instant());
    }

    @Test
    void handle_sameMemberSet_leavesSummaryAlone() {
        store.insert(work("works at Notion", Sensitivity.NORMAL));
        when(summarizer.summarize(any(), any(), anyList())).thenReturn("The user works at Notion.");
        handler.handle(job(MemoryCategory.WORK_LIFE));

        Map<String, Object> second = handler.handle(job(MemoryCategory.WORK_LIFE));

        assertThat(second).containsEntry("rewritten", 0).containsEntry("unchanged", 1);
        verify(summarizer, times(1)).summarize(any(), any(), anyList());
    }

    @Test
    void handle_newMember_passesPreviousSummaryAndBumpsVersion() {
        store.insert(work("works at Notion", Sensitivity.NORMAL));
        when(summarizer.summarize(any(), any(), anyList())).thenReturn("v1 text", "v2 text");
        handler.handle(job(MemoryCategory.WORK_LIFE));
        store.insert(work("leads the billing team", Sensitivity.NORMAL));

        handler.handle(job(MemoryCategory.WORK_LIFE));

        verify(summarizer).summarize(eq(MemoryCategory.WORK_LIFE), eq("v1 text"), anyList());
        CategorySummary summary = summaryStore.find(OWNER, MemoryCategory.WORK_LIFE).orElseThrow();
        assertThat(summary.getVersion()).isEqualTo(2);
        assertThat(summary.getSummaryText()).isEqualTo("v2 text");
        assertThat(summary.getMemberRecordIds()).hasSize(2);
    }

    @Test
    void handle_summarizerFailure_propagatesForRetry() {
        store.insert(work("works at Notion", Sensitivity.NORMAL));
        when(summarizer.summarize(any(), any(), anyList())).thenThrow(new MemoryException("llm down"));

        assertThatThrownBy(() -> handler.handle(job(MemoryCategory.WORK_LIFE)))
                .isInstanceOf(MemoryException.class);
        assertThat(summaryStore.find(OWNER, MemoryCategory.WORK_LIFE)).isEmpty();
    }

    private MaintenanceJob job(MemoryCategory category) {
        return MaintenanceJob.builder()
                .id("job-1")
                .ownerId(OWNER)
                .jobType(JobType.RESUMMARIZE)
                .payload(Map.of("category", category.name()))
                .build();
    }

    private MemoryRecord work(String content, Sensitivity sensitivity) {
        return MemoryRecord.builder()
                .ownerId(OWNER)
                .kind(MemoryKind.FACT)
                .subjectName("user")
                .content(content)
                .category(MemoryCategory.WORK_LIFE)
                .sensitivity(sensitivity)
                .importance(0.5)
                .build();
    }
}
