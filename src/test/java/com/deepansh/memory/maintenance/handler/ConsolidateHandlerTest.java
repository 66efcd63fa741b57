package com.deepansh.memory.maintenance.handler;

import com.deepansh.memory.audit.InMemoryAuditLog;
import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.embedding.VectorMath;
import com.deepansh.memory.model.ArchivedReason;
import com.deepansh.memory.model.JobType;
import com.deepansh.memory.model.MaintenanceJob;
import com.deepansh.memory.model.MemoryKind;
import com.deepansh.memory.model.MemoryOperation;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.MemoryStatus;
import com.deepansh.memory.model.OperationType;
import com.deepansh.memory.model.Sensitivity;
import com.deepansh.memory.store.InMemoryMemoryStore;
import com.deepansh.memory.support.FakeEmbeddingClient;
import com.deepansh.memory.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConsolidateHandlerTest {

    private static final String OWNER = "owner-1";

    MutableClock clock;
    InMemoryMemoryStore store;
    InMemoryAuditLog auditLog;
    ConsolidateHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new InMemoryMemoryStore(clock);
        auditLog = new InMemoryAuditLog(clock);
        handler = new ConsolidateHandler(store, new FakeEmbeddingClient(), auditLog, new MemoryProperties(), clock);
    }

    @Test
    void handle_nearDuplicates_mergedIntoMoreImportantRecord() {
        MemoryRecord keeper = store.insert(record("user", "likes espresso", 0.7, 1f, 0f).toBuilder().accessCount(2).build());
        MemoryRecord dup = store.insert(record("user", "enjoys strong espresso", 0.4, 0.95f, 0.1f).toBuilder().accessCount(3).build());

        Map<String, Object> result = handler.handle(job(Map.of()));

        assertThat(result).containsEntry("merged", 1);
        MemoryRecord merged = store.getById(keeper.getId()).orElseThrow();
        assertThat(merged.getContent()).isEqualTo("likes espresso. enjoys strong espresso");
        assertThat(merged.getImportance()).isEqualTo(0.7);
        assertThat(merged.getAccessCount()).isEqualTo(5);
        assertThat(merged.getVersion()).isEqualTo(2);

        MemoryRecord archived = store.getById(dup.getId()).orElseThrow();
        assertThat(archived.getStatus()).isEqualTo(MemoryStatus.ARCHIVED);
        assertThat(archived.getArchivedReason()).isEqualTo(ArchivedReason.CONSOLIDATED);
        assertThat(archived.getSupersededById()).isEqualTo(keeper.getId());

        MemoryOperation entry = auditLog.all().get(0);
        assertThat(entry.getOperation()).isEqualTo(OperationType.CONSOLIDATE);
        assertThat(entry.getTargetRecordId()).isEqualTo(dup.getId());
        assertThat(entry.getResultRecordIds()).containsExactly(keeper.getId());
        assertThat(entry.getJobId()).isEqualTo("job-1");
    }

    @Test
    void handle_dryRun_reportsPairsAndChangesNothing() {
        MemoryRecord a = store.insert(record("user", "likes espresso", 0.7, 1f, 0f));
        store.insert(record("user", "enjoys strong espresso", 0.4, 0.95f, 0.1f));

        Map<String, Object> result = handler.handle(job(Map.of("dryRun", true)));

        assertThat(result).containsEntry("dryRun", true);
        assertThat((List<?>) result.get("pairs")).hasSize(1);
        assertThat(store.findActive(OWNER)).hasSize(2);
        assertThat(store.getById(a.getId()).orElseThrow().getVersion()).isEqualTo(1);
        assertThat(auditLog.all()).isEmpty();
    }

    @Test
    void findPairs_differentSubjectsOrPrivateRecords_neverPaired() {
        store.insert(record("Robert", "is a pediatrician", 0.5, 1f, 0f));
        store.insert(record("Alice", "is a pediatrician too", 0.5, 1f, 0f));
        store.insert(record("user", "sees a therapist", 0.5, 0f, 1f).toBuilder().sensitivity(Sensitivity.PRIVATE).build());
        store.insert(record("user", "sees a therapist weekly", 0.5, 0f, 1f));

        assertThat(handler.findPairs(OWNER)).isEmpty();
    }

    @Test
    void findPairs_aliasCountsAsSameSubject() {
        store.insert(record("Robert", "is a pediatrician", 0.5, 1f, 0f).toBuilder()
                .aliases(new java.util.LinkedHashSet<>(List.of("Bob"))).build());
        store.insert(record("Bob", "works as a pediatrician", 0.5, 1f, 0.05f));

        assertThat(handler.findPairs(OWNER)).hasSize(1);
    }

    @Test
    void keeperOf_prefersImportanceThenAccessesThenAge() {
        MemoryRecord older = MemoryRecord.builder().importance(0.5).accessCount(1)
                .createdAt(Instant.parse("2025-01-01T00:00:00Z")).build();
        MemoryRecord newer = MemoryRecord.builder().importance(0.5).accessCount(1)
                .createdAt(Instant.parse("2025-06-01T00:00:00Z")).build();
        MemoryRecord busier = newer.toBuilder().accessCount(4).build();

        assertThat(ConsolidateHandler.keeperOf(newer, older)).isSameAs(older);
        assertThat(ConsolidateHandler.keeperOf(older, busier)).isSameAs(busier);
    }

    private MaintenanceJob job(Map<String, Object> payload) {
        return MaintenanceJob.builder().id("job-1").ownerId(OWNER).jobType(JobType.CONSOLIDATE).payload(payload).build();
    }

    private MemoryRecord record(String subject, String content, double importance, float... vector) {
        return MemoryRecord.builder()
                .ownerId(OWNER)
                .kind(MemoryKind.PREFERENCE)
                .subjectName(subject)
                .content(content)
                .importance(importance)
                .embedding(VectorMath.toDoubleList(FakeEmbeddingClient.pad(vector)))
                .embeddingModel(FakeEmbeddingClient.MODEL)
                .build();
    }
}
