package com.deepansh.memory.decision;

import com.deepansh.memory.audit.InMemoryAuditLog;
import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.embedding.VectorMath;
import com.deepansh.memory.exception.DecisionUnavailableException;
import com.deepansh.memory.maintenance.ResummarizeTrigger;
import com.deepansh.memory.model.ArchivedReason;
import com.deepansh.memory.model.CandidateFact;
import com.deepansh.memory.model.MemoryDecision;
import com.deepansh.memory.model.MemoryKind;
import com.deepansh.memory.model.MemoryOperation;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.MemoryStatus;
import com.deepansh.memory.model.MergeStrategy;
import com.deepansh.memory.model.OperationStatus;
import com.deepansh.memory.model.OperationType;
import com.deepansh.memory.store.InMemoryMemoryStore;
import com.deepansh.memory.store.SimilarityRetriever;
import com.deepansh.memory.summary.CategoryClassifier;
import com.deepansh.memory.support.FakeEmbeddingClient;
import com.deepansh.memory.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MemoryUpdateEngineTest {

    private static final String OWNER = "owner-1";

    @Mock DecisionClient decisionClient;
    @Mock ResummarizeTrigger resummarizeTrigger;
    @Mock TaskScheduler taskScheduler;

    MutableClock clock;
    MemoryProperties props;
    InMemoryMemoryStore store;
    InMemoryAuditLog auditLog;
    FakeEmbeddingClient embeddings;
    MemoryUpdateEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"));
        props = new MemoryProperties();
        store = new InMemoryMemoryStore(clock);
        auditLog = new InMemoryAuditLog(clock);
        embeddings = new FakeEmbeddingClient();
        engine = new MemoryUpdateEngine(store, new SimilarityRetriever(store), embeddings, decisionClient,
                new DecisionValidator(store), new RecordFactory(new CategoryClassifier()), auditLog,
                resummarizeTrigger, taskScheduler, props, clock);
    }

    @Test
    void process_newFact_addsRecordAndNotifiesResummarize() {
        when(decisionClient.decide(any(), anyList())).thenReturn(add());

        DecisionOutcome outcome = engine.process(OWNER, fact("Marcus", "works at Stripe"));

        assertThat(outcome.getStatus()).isEqualTo(OperationStatus.APPLIED);
        assertThat(outcome.getOperation()).isEqualTo(OperationType.ADD);
        MemoryRecord saved = store.getById(outcome.getResultRecordIds().get(0)).orElseThrow();
        assertThat(saved.getContent()).isEqualTo("works at Stripe");
        assertThat(saved.getVersion()).isEqualTo(1);
        assertThat(saved.getEmbeddingModel()).isEqualTo(FakeEmbeddingClient.MODEL);
        verify(resummarizeTrigger).afterWrite(eq(OWNER), any());
        assertThat(auditLog.all()).hasSize(1);
    }

    @Test
    void process_jobChange_supersedesAndKeepsHistoryChain() {
        embeddings.register("works at Stripe", 1f, 0f)
                .register("accepted an offer at Notion", 0.8f, 0.6f)
                .register("works at Notion", 0.8f, 0.6f);
        when(decisionClient.decide(any(), anyList())).thenReturn(add());
        MemoryRecord stripe = added(engine.process(OWNER, fact("Marcus", "works at Stripe")));

        when(decisionClient.decide(any(), anyList())).thenReturn(MemoryDecision.builder()
                .operation(OperationType.UPDATE)
                .targetId(stripe.getId())
                .mergeStrategy(MergeStrategy.SUPERSEDE)
                .newContent("works at Notion")
                .reasoning("Job changed")
                .build());
        DecisionOutcome outcome = engine.process(OWNER, fact("Marcus", "accepted an offer at Notion"));

        assertThat(outcome.getStatus()).isEqualTo(OperationStatus.APPLIED);
        assertThat(outcome.getMergeStrategy()).isEqualTo(MergeStrategy.SUPERSEDE);
        assertThat(outcome.getTargetRecordId()).isEqualTo(stripe.getId());

        List<MemoryRecord> active = store.findActive(OWNER);
        assertThat(active).extracting(MemoryRecord::getContent).containsExactly("works at Notion");
        MemoryRecord notion = active.get(0);
        assertThat(notion.getVersion()).isEqualTo(2);
        assertThat(notion.getSupersedesId()).isEqualTo(stripe.getId());

        MemoryRecord old = store.getById(stripe.getId()).orElseThrow();
        assertThat(old.getStatus()).isEqualTo(MemoryStatus.SUPERSEDED);
        assertThat(old.isHistorical()).isTrue();
        assertThat(old.getSupersededById()).isEqualTo(notion.getId());
        assertThat(store.findChain(notion.getId())).extracting(MemoryRecord::getContent)
                .containsExactly("works at Stripe", "works at Notion");

        MemoryOperation entry = auditLog.all().get(1);
        assertThat(entry.getPreviousContent()).isEqualTo("works at Stripe");
        assertThat(entry.getNewContent()).isEqualTo("works at Notion");
        assertThat(entry.getPreviousVersion()).isEqualTo(1L);
        assertThat(entry.getNewVersion()).isEqualTo(2L);
        assertThat(entry.getSimilarRecords()).hasSize(1);
    }

    @Test
    void process_verbatimDuplicate_skipsWithSingleAuditEntryEach() {
        when(decisionClient.decide(any(), anyList())).thenReturn(add());
        MemoryRecord first = added(engine.process(OWNER, fact("user", "likes sushi")));

        DecisionOutcome outcome = engine.process(OWNER, fact("user", "likes sushi"));

        assertThat(outcome.getOperation()).isEqualTo(OperationType.NOOP);
        assertThat(outcome.getStatus()).isEqualTo(OperationStatus.SKIPPED);
        assertThat(store.findActive(OWNER)).hasSize(1);
        assertThat(store.getById(first.getId()).orElseThrow().getVersion()).isEqualTo(1);
        assertThat(auditLog.all()).hasSize(2);
        assertThat(auditLog.all().get(1).getOverrides()).anyMatch(n -> n.contains("identical"));
    }

    @Test
    void process_forgetInstruction_hardDeletesBestMatchWithoutConsultingCollaborator() {
        when(decisionClient.decide(any(), anyList())).thenReturn(add());
        MemoryRecord record = added(engine.process(OWNER, fact("user", "likes sushi")));

        CandidateFact forget = fact("user", "likes sushi").toBuilder().forget(true).build();
        DecisionOutcome outcome = engine.process(OWNER, forget);

        verify(decisionClient, times(1)).decide(any(), anyList());
        assertThat(outcome.getOperation()).isEqualTo(OperationType.DELETE);
        assertThat(outcome.getStatus()).isEqualTo(OperationStatus.APPLIED);
        assertThat(store.getById(record.getId())).isEmpty();

        MemoryOperation entry = auditLog.all().get(1);
        assertThat(entry.isHardDelete()).isTrue();
        assertThat(entry.getDeletedSnapshot()).containsEntry("content", "likes sushi");
        assertThat(entry.getOverrides()).anyMatch(n -> n.contains("forget"));
    }

    @Test
    void process_forgetWithNothingSimilar_isNoop() {
        DecisionOutcome outcome = engine.process(OWNER,
                fact("user", "likes sushi").toBuilder().forget(true).build());

        assertThat(outcome.getOperation()).isEqualTo(OperationType.NOOP);
        assertThat(outcome.getStatus()).isEqualTo(OperationStatus.SKIPPED);
        verifyNoInteractions(decisionClient);
    }

    @Test
    void process_updateTargetOutsideSimilarSet_becomesAdd() {
        when(decisionClient.decide(any(), anyList())).thenReturn(MemoryDecision.builder()
                .operation(OperationType.UPDATE)
                .targetId("made-up-id")
                .mergeStrategy(MergeStrategy.REPLACE)
                .build());

        DecisionOutcome outcome = engine.process(OWNER, fact("user", "likes sushi"));

        assertThat(outcome.getOperation()).isEqualTo(OperationType.ADD);
        assertThat(outcome.getStatus()).isEqualTo(OperationStatus.APPLIED);
        assertThat(auditLog.all().get(0).getOverrides()).anyMatch(n -> n.contains("not among similar"));
    }

    @Test
    void process_collaboratorHardDeleteWithoutOwnerRequest_archivesInstead() {
        when(decisionClient.decide(any(), anyList())).thenReturn(add());
        MemoryRecord record = added(engine.process(OWNER, fact("user", "likes sushi")));

        when(decisionClient.decide(any(), anyList())).thenReturn(MemoryDecision.builder()
                .operation(OperationType.DELETE)
                .targetId(record.getId())
                .hardDelete(true)
                .build());
        DecisionOutcome outcome = engine.process(OWNER, fact("user", "likes sushi"));

        assertThat(outcome.getOperation()).isEqualTo(OperationType.DELETE);
        MemoryRecord archived = store.getById(record.getId()).orElseThrow();
        assertThat(archived.getStatus()).isEqualTo(MemoryStatus.ARCHIVED);
        assertThat(archived.getArchivedReason()).isEqualTo(ArchivedReason.DELETED);
        assertThat(auditLog.all().get(1).isHardDelete()).isFalse();
    }

    @Test
    void process_historicalCandidateAgainstCurrentRecord_forcesSupersede() {
        embeddings.register("lives in Lisbon", 1f, 0f)
                .register("used to live in Lisbon", 0.9f, 0.1f);
        when(decisionClient.decide(any(), anyList())).thenReturn(add());
        MemoryRecord current = added(engine.process(OWNER, fact("user", "lives in Lisbon")));

        when(decisionClient.decide(any(), anyList())).thenReturn(MemoryDecision.builder()
                .operation(OperationType.UPDATE)
                .targetId(current.getId())
                .mergeStrategy(MergeStrategy.REPLACE)
                .build());
        CandidateFact historical = fact("user", "used to live in Lisbon").toBuilder().historical(true).build();
        DecisionOutcome outcome = engine.process(OWNER, historical);

        assertThat(outcome.getMergeStrategy()).isEqualTo(MergeStrategy.SUPERSEDE);
        assertThat(store.getById(current.getId()).orElseThrow().getStatus()).isEqualTo(MemoryStatus.SUPERSEDED);
        assertThat(auditLog.all().get(1).getOverrides()).anyMatch(n -> n.contains("forced SUPERSEDE"));
    }

    @Test
    void process_differentSubjectDeclaredSameEntity_addsAliasWithoutMergingContent() {
        embeddings.register("is a pediatrician", 1f, 0f)
                .register("works as a children's doctor", 0.95f, 0.05f);
        when(decisionClient.decide(any(), anyList())).thenReturn(add());
        MemoryRecord robert = added(engine.process(OWNER, fact("Robert", "is a pediatrician")));

        when(decisionClient.decide(any(), anyList())).thenReturn(MemoryDecision.builder()
                .operation(OperationType.UPDATE)
                .targetId(robert.getId())
                .mergeStrategy(MergeStrategy.REPLACE)
                .sameEntity(true)
                .build());
        DecisionOutcome outcome = engine.process(OWNER, fact("Bob", "works as a children's doctor"));

        assertThat(outcome.getStatus()).isEqualTo(OperationStatus.APPLIED);
        MemoryRecord linked = store.getById(robert.getId()).orElseThrow();
        assertThat(linked.getAliases()).containsExactly("Bob");
        assertThat(linked.getContent()).isEqualTo("is a pediatrician");
        assertThat(auditLog.all().get(1).getAliasAdded()).isEqualTo("Bob");
    }

    @Test
    void process_differentSubjectWithoutSameEntity_becomesAdd() {
        embeddings.register("is a pediatrician", 1f, 0f)
                .register("is a doctor", 0.95f, 0.05f);
        when(decisionClient.decide(any(), anyList())).thenReturn(add());
        MemoryRecord robert = added(engine.process(OWNER, fact("Robert", "is a pediatrician")));

        when(decisionClient.decide(any(), anyList())).thenReturn(MemoryDecision.builder()
                .operation(OperationType.UPDATE)
                .targetId(robert.getId())
                .mergeStrategy(MergeStrategy.REPLACE)
                .build());
        DecisionOutcome outcome = engine.process(OWNER, fact("Alice", "is a doctor"));

        assertThat(outcome.getOperation()).isEqualTo(OperationType.ADD);
        assertThat(store.findActive(OWNER)).hasSize(2);
        assertThat(store.getById(robert.getId()).orElseThrow().getContent()).isEqualTo("is a pediatrician");
    }

    @Test
    void process_appendStrategy_joinsDetailOntoTargetAndBumpsVersion() {
        embeddings.register("likes hiking", 1f, 0f)
                .register("also enjoys trail running", 0.9f, 0.2f);
        when(decisionClient.decide(any(), anyList())).thenReturn(add());
        MemoryRecord record = added(engine.process(OWNER, fact("user", "likes hiking")));

        when(decisionClient.decide(any(), anyList())).thenReturn(MemoryDecision.builder()
                .operation(OperationType.UPDATE)
                .targetId(record.getId())
                .mergeStrategy(MergeStrategy.APPEND)
                .build());
        engine.process(OWNER, fact("user", "also enjoys trail running"));

        MemoryRecord updated = store.getById(record.getId()).orElseThrow();
        assertThat(updated.getContent()).isEqualTo("likes hiking. also enjoys trail running");
        assertThat(updated.getVersion()).isEqualTo(2);
        assertThat(store.findActive(OWNER)).hasSize(1);
    }

    @Test
    void process_appendOfDetailAlreadyPresent_isNoop() {
        embeddings.register("likes hiking in the Alps", 1f, 0f)
                .register("likes hiking", 0.9f, 0.2f);
        when(decisionClient.decide(any(), anyList())).thenReturn(add());
        MemoryRecord record = added(engine.process(OWNER, fact("user", "likes hiking in the Alps")));

        when(decisionClient.decide(any(), anyList())).thenReturn(MemoryDecision.builder()
                .operation(OperationType.UPDATE)
                .targetId(record.getId())
                .mergeStrategy(MergeStrategy.APPEND)
                .build());
        DecisionOutcome outcome = engine.process(OWNER, fact("user", "likes hiking"));

        assertThat(outcome.getOperation()).isEqualTo(OperationType.NOOP);
        assertThat(store.getById(record.getId()).orElseThrow().getVersion()).isEqualTo(1);
    }

    @Test
    void process_addIntoOccupiedSlot_supersedesSlotHead() {
        when(decisionClient.decide(any(), anyList())).thenReturn(add());
        MemoryRecord stripe = added(engine.process(OWNER,
                fact("Marcus", "works at Stripe").toBuilder().predicate("works_at").build()));

        DecisionOutcome outcome = engine.process(OWNER,
                fact("Marcus", "joined Notion last week").toBuilder().predicate("works_at").build());

        assertThat(outcome.getOperation()).isEqualTo(OperationType.UPDATE);
        assertThat(outcome.getMergeStrategy()).isEqualTo(MergeStrategy.SUPERSEDE);
        assertThat(store.getActiveBySlot(OWNER, "Marcus", "works_at"))
                .map(MemoryRecord::getContent).contains("joined Notion last week");
        assertThat(store.getById(stripe.getId()).orElseThrow().getStatus()).isEqualTo(MemoryStatus.SUPERSEDED);
    }

    @Test
    void process_concurrentSupersedeWonByOtherWriter_reappliesAgainstNewHead() {
        embeddings.register("works at Stripe", 1f, 0f)
                .register("is now a PM at Notion", 0.8f, 0.6f);
        when(decisionClient.decide(any(), anyList())).thenReturn(add());
        MemoryRecord stripe = added(engine.process(OWNER, fact("Marcus", "works at Stripe")));

        when(decisionClient.decide(any(), anyList())).thenAnswer(invocation -> {
            // another writer supersedes the same head while this decision is in flight
            store.supersede(stripe.getId(), MemoryRecord.builder()
                    .ownerId(OWNER)
                    .kind(MemoryKind.FACT)
                    .subjectName("Marcus")
                    .content("works at Notion")
                    .embedding(VectorMath.toDoubleList(FakeEmbeddingClient.pad(0.8f, 0.6f)))
                    .version(2)
                    .build());
            return MemoryDecision.builder()
                    .operation(OperationType.UPDATE)
                    .targetId(stripe.getId())
                    .mergeStrategy(MergeStrategy.SUPERSEDE)
                    .build();
        });
        DecisionOutcome outcome = engine.process(OWNER, fact("Marcus", "is now a PM at Notion"));

        assertThat(outcome.getStatus()).isEqualTo(OperationStatus.APPLIED);
        List<MemoryRecord> active = store.findActive(OWNER);
        assertThat(active).extracting(MemoryRecord::getContent).containsExactly("is now a PM at Notion");
        assertThat(active.get(0).getVersion()).isEqualTo(3);
        assertThat(store.findChain(active.get(0).getId())).hasSize(3);
        assertThat(auditLog.all().get(1).getOverrides()).anyMatch(n -> n.contains("re-applied against head"));
    }

    @Test
    void process_concurrentWriterAlreadyStoredSameContent_becomesNoop() {
        embeddings.register("works at Stripe", 1f, 0f)
                .register("works at Notion", 0.8f, 0.6f);
        when(decisionClient.decide(any(), anyList())).thenReturn(add());
        MemoryRecord stripe = added(engine.process(OWNER, fact("Marcus", "works at Stripe")));

        when(decisionClient.decide(any(), anyList())).thenAnswer(invocation -> {
            store.supersede(stripe.getId(), MemoryRecord.builder()
                    .ownerId(OWNER)
                    .kind(MemoryKind.FACT)
                    .subjectName("Marcus")
                    .content("works at Notion")
                    .version(2)
                    .build());
            return MemoryDecision.builder()
                    .operation(OperationType.UPDATE)
                    .targetId(stripe.getId())
                    .mergeStrategy(MergeStrategy.SUPERSEDE)
                    .build();
        });
        DecisionOutcome outcome = engine.process(OWNER, fact("Marcus", "works at Notion"));

        assertThat(outcome.getOperation()).isEqualTo(OperationType.NOOP);
        assertThat(outcome.getStatus()).isEqualTo(OperationStatus.SKIPPED);
        assertThat(store.findActive(OWNER)).hasSize(1);
    }

    @Test
    void process_collaboratorUnavailable_requeuesOnceThenRecordsFailure() {
        when(decisionClient.decide(any(), anyList()))
                .thenThrow(new DecisionUnavailableException("circuit open"));

        DecisionOutcome first = engine.process(OWNER, fact("user", "likes sushi"));

        assertThat(first.isRequeued()).isTrue();
        assertThat(auditLog.all()).isEmpty();
        ArgumentCaptor<Runnable> retry = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(retry.capture(), eq(clock.instant().plus(props.getDecision().getRequeueDelay())));

        retry.getValue().run();

        assertThat(auditLog.all()).hasSize(1);
        MemoryOperation entry = auditLog.all().get(0);
        assertThat(entry.getStatus()).isEqualTo(OperationStatus.FAILED);
        assertThat(entry.getAttempts()).isEqualTo(2);
        assertThat(entry.getErrorMessage()).contains("circuit open");
        verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
        assertThat(store.findActive(OWNER)).isEmpty();
    }

    @Test
    void process_embeddingUnavailable_requeuesWithoutConsultingCollaborator() {
        embeddings.setUnavailable(true);

        DecisionOutcome outcome = engine.process(OWNER, fact("user", "likes sushi"));

        assertThat(outcome.isRequeued()).isTrue();
        verifyNoInteractions(decisionClient);
        verify(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void process_secretContent_rejectedAndNeverStored() {
        DecisionOutcome outcome = engine.process(OWNER, fact("user", "my password is hunter2!"));

        assertThat(outcome.getStatus()).isEqualTo(OperationStatus.REJECTED);
        verifyNoInteractions(decisionClient);
        assertThat(store.findByOwner(OWNER, null)).isEmpty();
        assertThat(auditLog.all().get(0).getCandidateContent()).isEqualTo("[redacted]");
    }

    @Test
    void process_unexpectedFailure_recordedAsFailedAndNotThrown() {
        when(decisionClient.decide(any(), anyList())).thenThrow(new IllegalStateException("boom"));

        DecisionOutcome outcome = engine.process(OWNER, fact("user", "likes sushi"));

        assertThat(outcome.getStatus()).isEqualTo(OperationStatus.FAILED);
        verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void deleteRecord_softThenSoftAgain_secondIsSkipped() {
        when(decisionClient.decide(any(), anyList())).thenReturn(add());
        MemoryRecord record = added(engine.process(OWNER, fact("user", "likes sushi")));

        DecisionOutcome first = engine.deleteRecord(record.getId(), false);
        DecisionOutcome second = engine.deleteRecord(record.getId(), false);

        assertThat(first.getStatus()).isEqualTo(OperationStatus.APPLIED);
        assertThat(second.getStatus()).isEqualTo(OperationStatus.SKIPPED);
        assertThat(auditLog.findByRecord(record.getId())).hasSize(3);
    }

    private MemoryDecision add() {
        return MemoryDecision.builder().operation(OperationType.ADD).reasoning("new information").build();
    }

    private MemoryRecord added(DecisionOutcome outcome) {
        assertThat(outcome.getStatus()).isEqualTo(OperationStatus.APPLIED);
        return store.getById(outcome.getResultRecordIds().get(0)).orElseThrow();
    }

    private CandidateFact fact(String subject, String content) {
        return CandidateFact.builder()
                .kind(MemoryKind.FACT)
                .subjectName(subject)
                .content(content)
                .build();
    }
}
