package com.deepansh.memory.store;

import com.deepansh.memory.exception.InvariantViolationException;
import com.deepansh.memory.exception.SlotConflictException;
import com.deepansh.memory.model.ArchivedReason;
import com.deepansh.memory.model.MemoryKind;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.MemoryStatus;
import com.deepansh.memory.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMemoryStoreTest {

    private static final String OWNER = "owner-1";

    MutableClock clock;
    InMemoryMemoryStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        store = new InMemoryMemoryStore(clock);
    }

    @Test
    void insert_secondActiveRecordInSameSlot_throwsSlotConflict() {
        store.insert(slotted("works at Stripe"));

        assertThatThrownBy(() -> store.insert(slotted("works at Notion")))
                .isInstanceOf(SlotConflictException.class);
        assertThat(store.findActive(OWNER)).hasSize(1);
    }

    @Test
    void insert_slotKeyIgnoresCaseAndSpacingOfSubjectAndPredicate() {
        store.insert(slotted("works at Stripe"));
        MemoryRecord variant = slotted("works at Notion").toBuilder()
                .subjectName("  marcus ")
                .predicate("Works At")
                .build();

        assertThatThrownBy(() -> store.insert(variant)).isInstanceOf(SlotConflictException.class);
    }

    @Test
    void insert_ownerIdContainingSeparator_doesNotCollideWithAnotherOwnersSlot() {
        store.insert(slotted("works at Stripe").toBuilder().ownerId("auth0|123").build());

        MemoryRecord other = store.insert(slotted("works at Notion").toBuilder()
                .ownerId("auth0")
                .subjectName("123|Marcus")
                .build());

        assertThat(other.getStatus()).isEqualTo(MemoryStatus.ACTIVE);
        assertThat(store.getActiveBySlot("auth0", "123|Marcus", "works_at"))
                .map(MemoryRecord::getContent).contains("works at Notion");
        assertThat(store.getActiveBySlot("auth0|123", "Marcus", "works_at"))
                .map(MemoryRecord::getContent).contains("works at Stripe");
    }

    @Test
    void getActiveBySlot_neverReturnsAnotherOwnersRecord() {
        store.insert(slotted("works at Stripe").toBuilder().ownerId("auth0|123").build());

        assertThat(store.getActiveBySlot("auth0", "123|Marcus", "works_at")).isEmpty();
    }

    @Test
    void insert_unslottedRecordsForSameSubject_coexist() {
        store.insert(unslotted("likes climbing"));
        store.insert(unslotted("has a dog named Pixel"));

        assertThat(store.findActive(OWNER)).hasSize(2);
    }

    @Test
    void insert_recordClaimingPredecessor_throwsInvariantViolation() {
        MemoryRecord linked = unslotted("x").toBuilder().supersedesId("somewhere").build();

        assertThatThrownBy(() -> store.insert(linked)).isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void supersede_flipsOldRecordAndLinksChain() {
        MemoryRecord v1 = store.insert(slotted("works at Stripe"));

        MemoryRecord v2 = store.supersede(v1.getId(), slotted("works at Notion").toBuilder().version(2).build());

        MemoryRecord old = store.getById(v1.getId()).orElseThrow();
        assertThat(old.getStatus()).isEqualTo(MemoryStatus.SUPERSEDED);
        assertThat(old.isHistorical()).isTrue();
        assertThat(old.getSupersededById()).isEqualTo(v2.getId());
        assertThat(v2.getSupersedesId()).isEqualTo(v1.getId());
        assertThat(store.getActiveBySlot(OWNER, "Marcus", "works_at")).map(MemoryRecord::getId).contains(v2.getId());
        assertThat(store.findChain(v2.getId())).extracting(MemoryRecord::getContent)
                .containsExactly("works at Stripe", "works at Notion");
    }

    @Test
    void supersede_staleVersion_throwsSlotConflictAndChangesNothing() {
        MemoryRecord v1 = store.insert(slotted("works at Stripe"));
        store.supersede(v1.getId(), slotted("works at Notion").toBuilder().version(2).build());

        assertThatThrownBy(() -> store.supersede(v1.getId(), slotted("works at Figma").toBuilder().version(2).build()))
                .isInstanceOf(SlotConflictException.class);
        assertThat(store.findActive(OWNER)).extracting(MemoryRecord::getContent).containsExactly("works at Notion");
    }

    @Test
    void supersede_acrossOwners_throwsInvariantViolation() {
        MemoryRecord v1 = store.insert(slotted("works at Stripe"));
        MemoryRecord foreign = slotted("works at Notion").toBuilder().ownerId("owner-2").version(2).build();

        assertThatThrownBy(() -> store.supersede(v1.getId(), foreign))
                .isInstanceOf(InvariantViolationException.class);
        assertThat(store.getById(v1.getId())).map(MemoryRecord::isActive).contains(true);
    }

    @Test
    void supersede_reusingAncestorId_throwsInvariantViolation() {
        MemoryRecord v1 = store.insert(unslotted("lives in Lisbon"));
        MemoryRecord v2 = store.supersede(v1.getId(), unslotted("lives in Porto").toBuilder().version(2).build());

        MemoryRecord cyclic = unslotted("lives in Lisbon again").toBuilder().id(v1.getId()).version(3).build();

        assertThatThrownBy(() -> store.supersede(v2.getId(), cyclic))
                .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void update_withExpectedVersion_rejectsStaleWriter() {
        MemoryRecord record = store.insert(unslotted("likes tea"));
        store.update(record.getId(), RecordPatch.builder().content("likes green tea")
                .expectedVersion(1L).bumpVersion(true).build());

        assertThatThrownBy(() -> store.update(record.getId(), RecordPatch.builder().content("likes coffee")
                .expectedVersion(1L).bumpVersion(true).build()))
                .isInstanceOf(SlotConflictException.class);
        assertThat(store.getById(record.getId())).map(MemoryRecord::getContent).contains("likes green tea");
    }

    @Test
    void softDelete_freesSlotAndIsIdempotent() {
        MemoryRecord record = store.insert(slotted("works at Stripe"));

        store.softDelete(record.getId(), ArchivedReason.DELETED);
        MemoryRecord again = store.softDelete(record.getId(), ArchivedReason.EXPIRED).orElseThrow();

        assertThat(again.getArchivedReason()).isEqualTo(ArchivedReason.DELETED);
        assertThat(store.getActiveBySlot(OWNER, "Marcus", "works_at")).isEmpty();
        store.insert(slotted("works at Notion"));
        assertThat(store.findActive(OWNER)).hasSize(1);
    }

    @Test
    void hardDelete_removesRecordAndReturnsIt() {
        MemoryRecord record = store.insert(unslotted("secret hobby"));

        assertThat(store.hardDelete(record.getId())).map(MemoryRecord::getContent).contains("secret hobby");
        assertThat(store.getById(record.getId())).isEmpty();
        assertThat(store.hardDelete(record.getId())).isEmpty();
    }

    @Test
    void recordAccess_boostsImportanceAndResetsDecayAnchor() {
        MemoryRecord record = store.insert(unslotted("likes tea").toBuilder().importance(0.5).build());
        clock.advance(java.time.Duration.ofDays(3));

        store.recordAccess(OWNER, List.of(record.getId()), 0.05);

        MemoryRecord accessed = store.getById(record.getId()).orElseThrow();
        assertThat(accessed.getAccessCount()).isEqualTo(1);
        assertThat(accessed.getImportance()).isEqualTo(0.55, org.assertj.core.data.Offset.offset(1e-9));
        assertThat(accessed.getBaseImportance()).isEqualTo(accessed.getImportance());
        assertThat(accessed.getLastAccessedAt()).isEqualTo(clock.instant());
    }

    @Test
    void recordAccess_ignoresOtherOwnersRecords() {
        MemoryRecord record = store.insert(unslotted("likes tea"));

        store.recordAccess("owner-2", List.of(record.getId()), 0.05);

        assertThat(store.getById(record.getId()).orElseThrow().getAccessCount()).isZero();
    }

    @Test
    void readsAreScopedToOwner() {
        store.insert(unslotted("likes tea"));
        store.insert(unslotted("likes coffee").toBuilder().ownerId("owner-2").build());

        assertThat(store.findActive(OWNER)).extracting(MemoryRecord::getContent).containsExactly("likes tea");
        assertThat(store.findOwnerIds()).containsExactlyInAnyOrder(OWNER, "owner-2");
    }

    @Test
    void insert_concurrentWritersOnOneSlot_exactlyOneWins() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                String content = "works at company " + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        store.insert(slotted(content));
                    } catch (SlotConflictException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(conflicts.get()).isEqualTo(writers - 1);
        assertThat(store.findActive(OWNER)).hasSize(1);
    }

    @Test
    void insert_manyDistinctSlotsFromConcurrentWriters_allSucceed() throws Exception {
        int slots = 300;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < slots; i++) {
                MemoryRecord record = slotted("fact " + i).toBuilder().subjectName("subject " + i).build();
                futures.add(pool.submit(() -> {
                    start.await();
                    MemoryRecord inserted = store.insert(record);
                    store.hardDelete(store.insert(unslotted("scratch " + inserted.getId())).getId());
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.findActive(OWNER)).hasSize(slots);
    }

    @Test
    void supersede_concurrentWritersOnOneHead_exactlyOneWins() throws Exception {
        MemoryRecord head = store.insert(slotted("works at Stripe"));
        int writers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger wins = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                String content = "works at company " + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        store.supersede(head.getId(), slotted(content).toBuilder().version(2).build());
                        wins.incrementAndGet();
                    } catch (SlotConflictException e) {
                        // expected for the losers
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(wins.get()).isEqualTo(1);
        assertThat(store.findActive(OWNER)).hasSize(1);
        assertThat(store.findByOwner(OWNER, null)).hasSize(2);
    }

    private MemoryRecord slotted(String content) {
        return MemoryRecord.builder()
                .ownerId(OWNER)
                .kind(MemoryKind.FACT)
                .subjectName("Marcus")
                .predicate("works_at")
                .content(content)
                .importance(0.5)
                .build();
    }

    private MemoryRecord unslotted(String content) {
        return MemoryRecord.builder()
                .ownerId(OWNER)
                .kind(MemoryKind.PREFERENCE)
                .subjectName("user")
                .content(content)
                .importance(0.5)
                .build();
    }
}
