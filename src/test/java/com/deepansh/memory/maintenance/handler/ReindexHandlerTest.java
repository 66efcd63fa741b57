package com.deepansh.memory.maintenance.handler;

import com.deepansh.memory.embedding.VectorMath;
import com.deepansh.memory.exception.EmbeddingUnavailableException;
import com.deepansh.memory.model.JobType;
import com.deepansh.memory.model.MaintenanceJob;
import com.deepansh.memory.model.MemoryKind;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.RecordRelationship;
import com.deepansh.memory.relationship.InMemoryRelationshipStore;
import com.deepansh.memory.store.InMemoryMemoryStore;
import com.deepansh.memory.support.FakeEmbeddingClient;
import com.deepansh.memory.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ReindexHandlerTest {

    private static final String OWNER = "owner-1";

    MutableClock clock;
    InMemoryMemoryStore store;
    InMemoryRelationshipStore relationships;
    FakeEmbeddingClient embeddings;
    ReindexHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new InMemoryMemoryStore(clock);
        relationships = new InMemoryRelationshipStore(clock);
        embeddings = new FakeEmbeddingClient();
        handler = new ReindexHandler(store, embeddings, relationships);
    }

    @Test
    void handle_reembedsStaleModelAndMissingVectorsOnly() {
        MemoryRecord current = store.insert(record("likes tea", FakeEmbeddingClient.MODEL));
        MemoryRecord stale = store.insert(record("likes coffee", "ada-002"));
        MemoryRecord missing = store.insert(record("likes juice", null).toBuilder().embedding(null).build());

        Map<String, Object> result = handler.handle(job(Map.of()));

        assertThat(result).containsEntry("reembedded", 2);
        assertThat(store.getById(stale.getId()).orElseThrow().getEmbeddingModel()).isEqualTo(FakeEmbeddingClient.MODEL);
        assertThat(store.getById(missing.getId()).orElseThrow().hasEmbedding()).isTrue();
        assertThat(store.getById(current.getId()).orElseThrow().getEmbedding())
                .isEqualTo(current.getEmbedding());
    }

    @Test
    void handle_force_reembedsEverything() {
        store.insert(record("likes tea", FakeEmbeddingClient.MODEL));
        store.insert(record("likes coffee", FakeEmbeddingClient.MODEL));

        assertThat(handler.handle(job(Map.of("force", true)))).containsEntry("reembedded", 2);
    }

    @Test
    void handle_providerDown_propagatesSoJobRetries() {
        store.insert(record("likes coffee", "ada-002"));
        embeddings.setUnavailable(true);

        assertThatThrownBy(() -> handler.handle(job(Map.of())))
                .isInstanceOf(EmbeddingUnavailableException.class);
    }

    @Test
    void handle_refreshesCoAccessStrength() {
        MemoryRecord a = store.insert(record("likes tea", FakeEmbeddingClient.MODEL));
        MemoryRecord b = store.insert(record("likes scones", FakeEmbeddingClient.MODEL));
        for (int i = 0; i < 4; i++) {
            store.recordAccess(OWNER, List.of(a.getId(), b.getId()), 0.0);
        }
        relationships.recordCoAccess(OWNER, List.of(a.getId(), b.getId()));
        relationships.recordCoAccess(OWNER, List.of(a.getId(), b.getId()));

        Map<String, Object> result = handler.handle(job(Map.of()));

        assertThat(result).containsEntry("relationships", 1);
        RecordRelationship rel = relationships.findByOwner(OWNER).get(0);
        assertThat(rel.getStrength()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void strength_neverExceedsOne() {
        RecordRelationship rel = RecordRelationship.builder()
                .recordAId("missing-a").recordBId("missing-b").coAccessCount(7).build();

        assertThat(handler.strength(rel)).isEqualTo(1.0);
    }

    private MaintenanceJob job(Map<String, Object> payload) {
        return MaintenanceJob.builder().id("job-1").ownerId(OWNER).jobType(JobType.REINDEX).payload(payload).build();
    }

    private MemoryRecord record(String content, String model) {
        return MemoryRecord.builder()
                .ownerId(OWNER)
                .kind(MemoryKind.PREFERENCE)
                .subjectName("user")
                .content(content)
                .importance(0.5)
                .embedding(VectorMath.toDoubleList(FakeEmbeddingClient.pad(1f)))
                .embeddingModel(model)
                .build();
    }
}
