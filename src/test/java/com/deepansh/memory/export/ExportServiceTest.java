package com.deepansh.memory.export;

import com.deepansh.memory.embedding.VectorMath;
import com.deepansh.memory.model.ArchivedReason;
import com.deepansh.memory.model.CategorySummary;
import com.deepansh.memory.model.MemoryCategory;
import com.deepansh.memory.model.MemoryKind;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.Sensitivity;
import com.deepansh.memory.store.InMemoryMemoryStore;
import com.deepansh.memory.summary.InMemoryCategorySummaryStore;
import com.deepansh.memory.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ExportServiceTest {

    private static final String OWNER = "owner-1";

    @Test
    void export_currentAndHistoricalRecordsWithoutVectorsOrPrivateData() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        InMemoryMemoryStore store = new InMemoryMemoryStore(clock);
        InMemoryCategorySummaryStore summaryStore = new InMemoryCategorySummaryStore();
        ExportService service = new ExportService(store, summaryStore, clock);

        MemoryRecord stripe = store.insert(record("works at Stripe", Sensitivity.NORMAL));
        store.supersede(stripe.getId(), record("works at Notion", Sensitivity.NORMAL).toBuilder().version(2).build());
        store.insert(record("salary negotiation notes", Sensitivity.PRIVATE));
        MemoryRecord archived = store.insert(record("saw a red car", Sensitivity.NORMAL));
        store.softDelete(archived.getId(), ArchivedReason.UNUSED);
        summaryStore.save(CategorySummary.builder().ownerId(OWNER).category(MemoryCategory.WORK_LIFE)
                .summaryText("Works at Notion.").version(1).build());
        summaryStore.save(CategorySummary.builder().ownerId(OWNER).category(MemoryCategory.HEALTH_WELLNESS)
                .version(1).build());

        ExportBundle bundle = service.export(OWNER);

        assertThat(bundle.getRecords()).extracting(MemoryRecord::getContent)
                .containsExactlyInAnyOrder("works at Stripe", "works at Notion");
        assertThat(bundle.getRecords()).allSatisfy(r -> assertThat(r.getEmbedding()).isNull());
        assertThat(bundle.getPrivateRecordsWithheld()).isEqualTo(1);
        assertThat(bundle.getSummaries()).extracting(CategorySummary::getCategory)
                .containsExactly(MemoryCategory.WORK_LIFE);
        assertThat(bundle.getExportedAt()).isEqualTo(clock.instant());
        assertThat(store.getById(stripe.getId()).orElseThrow().getEmbedding()).isNotNull();
    }

    private MemoryRecord record(String content, Sensitivity sensitivity) {
        return MemoryRecord.builder()
                .ownerId(OWNER)
                .kind(MemoryKind.FACT)
                .subjectName("user")
                .content(content)
                .sensitivity(sensitivity)
                .importance(0.5)
                .embedding(VectorMath.toDoubleList(new float[]{1f, 0f}))
                .build();
    }
}
