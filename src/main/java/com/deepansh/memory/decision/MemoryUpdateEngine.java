package com.deepansh.memory.decision;

import com.deepansh.memory.audit.AuditLog;
import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.embedding.EmbeddingClient;
import com.deepansh.memory.embedding.VectorMath;
import com.deepansh.memory.exception.DecisionUnavailableException;
import com.deepansh.memory.exception.EmbeddingUnavailableException;
import com.deepansh.memory.exception.InvariantViolationException;
import com.deepansh.memory.exception.MemoryException;
import com.deepansh.memory.exception.RecordNotFoundException;
import com.deepansh.memory.exception.SlotConflictException;
import com.deepansh.memory.maintenance.ResummarizeTrigger;
import com.deepansh.memory.model.ArchivedReason;
import com.deepansh.memory.model.CandidateFact;
import com.deepansh.memory.model.MemoryDecision;
import com.deepansh.memory.model.MemoryOperation;
import com.deepansh.memory.model.MemoryOperation.ConsideredRecord;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.MergeStrategy;
import com.deepansh.memory.model.OperationStatus;
import com.deepansh.memory.model.OperationType;
import com.deepansh.memory.model.SimilarRecord;
import com.deepansh.memory.store.ContentMatch;
import com.deepansh.memory.store.MemoryStore;
import com.deepansh.memory.store.RecordPatch;
import com.deepansh.memory.store.SimilarityRetriever;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides and applies ADD / UPDATE / DELETE / NOOP for one candidate fact.
 *
 * Flow:
 *   1. Reject secrets outright.
 *   2. Embed the candidate and fetch similar active records.
 *   3. Ask the decision collaborator (or force a hard delete for "forget").
 *   4. Validate the proposal into a plan (DecisionValidator).
 *   5. Execute; on SlotConflict re-read the head and re-plan, bounded.
 *   6. Write exactly one audit entry.
 *
 * Nothing thrown here reaches the caller. Transient collaborator failures
 * requeue the candidate once on the TaskScheduler; invariant violations are
 * logged and rejected.
 */
@Service
@Slf4j
public class MemoryUpdateEngine {

    private final MemoryStore store;
    private final SimilarityRetriever retriever;
    private final EmbeddingClient embeddingClient;
    private final DecisionClient decisionClient;
    private final DecisionValidator validator;
    private final RecordFactory recordFactory;
    private final AuditLog auditLog;
    private final ResummarizeTrigger resummarizeTrigger;
    private final TaskScheduler taskScheduler;
    private final MemoryProperties props;
    private final Clock clock;

    public MemoryUpdateEngine(MemoryStore store,
                              SimilarityRetriever retriever,
                              EmbeddingClient embeddingClient,
                              DecisionClient decisionClient,
                              DecisionValidator validator,
                              RecordFactory recordFactory,
                              AuditLog auditLog,
                              ResummarizeTrigger resummarizeTrigger,
                              TaskScheduler taskScheduler,
                              MemoryProperties props,
                              Clock clock) {
        this.store = store;
        this.retriever = retriever;
        this.embeddingClient = embeddingClient;
        this.decisionClient = decisionClient;
        this.validator = validator;
        this.recordFactory = recordFactory;
        this.auditLog = auditLog;
        this.resummarizeTrigger = resummarizeTrigger;
        this.taskScheduler = taskScheduler;
        this.props = props;
        this.clock = clock;
    }

    public DecisionOutcome process(String ownerId, CandidateFact candidate) {
        return process(ownerId, candidate, DecisionContext.first(candidate.getSourceId()));
    }

    public DecisionOutcome process(String ownerId, CandidateFact candidate, DecisionContext context) {
        long start = System.currentTimeMillis();
        MemoryOperation.MemoryOperationBuilder audit = MemoryOperation.builder()
                .ownerId(ownerId)
                .candidateSubject(candidate.getSubjectName())
                .candidateContent(candidate.getContent())
                .candidateKind(candidate.getKind())
                .sourceId(context.sourceId())
                .jobId(context.jobId())
                .attempts(context.attempt());

        Optional<String> secret = SecretContentGuard.detect(candidate.getContent());
        if (secret.isPresent()) {
            log.warn("Rejected candidate for owner={}: content contains {}", ownerId, secret.get());
            return finish(audit.operation(OperationType.NOOP)
                    .status(OperationStatus.REJECTED)
                    .candidateContent("[redacted]")
                    .reasoning("Content contains " + secret.get() + "; never stored"), start);
        }

        try {
            float[] embedding = candidate.getEmbedding() != null
                    ? candidate.getEmbedding()
                    : embeddingClient.embed(candidate.getContent());

            List<SimilarRecord> similar = retriever.findSimilar(ownerId, embedding,
                    props.getDecision().getSimilarTopK(), props.getDecision().getSimilarThreshold());
            audit.similarRecords(considered(similar));

            DecisionPlan plan;
            if (candidate.isForget()) {
                plan = validator.forgetPlan(similar);
            } else {
                MemoryDecision decision = decisionClient.decide(candidate, similar);
                plan = validator.validate(ownerId, candidate, similar, decision);
            }
            return execute(ownerId, candidate, embedding, plan, audit, start);

        } catch (DecisionUnavailableException | EmbeddingUnavailableException e) {
            return requeueOrFail(ownerId, candidate, context, e, audit, start);
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing candidate for owner={} subject='{}': {}",
                    ownerId, candidate.getSubjectName(), e.getMessage(), e);
            return finish(audit.operation(OperationType.NOOP)
                    .status(OperationStatus.FAILED)
                    .errorMessage(e.getMessage()), start);
        }
    }

    /**
     * Owner-initiated delete of one record, outside the candidate flow.
     * Audited like any other DELETE.
     *
     * @throws RecordNotFoundException the record does not exist
     */
    public DecisionOutcome deleteRecord(String recordId, boolean hard) {
        long start = System.currentTimeMillis();
        MemoryRecord target = store.getById(recordId)
                .orElseThrow(() -> new RecordNotFoundException("Memory record", recordId));
        DecisionPlan plan = DecisionPlan.builder()
                .operation(OperationType.DELETE)
                .target(target)
                .hardDelete(hard)
                .reasoning("Deleted on request")
                .build();
        MemoryOperation.MemoryOperationBuilder audit = MemoryOperation.builder()
                .ownerId(target.getOwnerId())
                .candidateSubject(target.getSubjectName())
                .candidateKind(target.getKind())
                .attempts(1);
        if (!target.isActive() && !hard) {
            describe(audit, plan.override("record already " + target.getStatus()), Applied.none());
            return finish(audit.operation(OperationType.NOOP).status(OperationStatus.SKIPPED), start);
        }
        Applied applied = apply(target.getOwnerId(), null, null, plan);
        describe(audit, plan, applied);
        return finish(audit.status(OperationStatus.APPLIED), start);
    }

    private DecisionOutcome execute(String ownerId, CandidateFact candidate, float[] embedding,
                                    DecisionPlan plan, MemoryOperation.MemoryOperationBuilder audit, long start) {
        int maxAttempts = props.getDecision().getMaxSlotRetries();
        for (int attempt = 1; ; attempt++) {
            try {
                Applied applied = apply(ownerId, candidate, embedding, plan);
                describe(audit, plan, applied);
                return finish(audit.status(plan.getOperation() == OperationType.NOOP
                        ? OperationStatus.SKIPPED : OperationStatus.APPLIED), start);

            } catch (SlotConflictException | RecordNotFoundException e) {
                String slot = e instanceof SlotConflictException conflict ? conflict.getSlotKey() : null;
                if (attempt >= maxAttempts) {
                    log.warn("Slot conflict persisted after {} attempts for owner={} slot={}",
                            attempt, ownerId, slot);
                    describe(audit, plan, Applied.none());
                    return finish(audit.status(OperationStatus.FAILED).errorMessage(e.getMessage()), start);
                }
                log.info("Slot conflict on attempt {} for owner={} slot={}, re-reading head",
                        attempt, ownerId, slot);
                plan = validator.replan(ownerId, candidate, plan);

            } catch (InvariantViolationException e) {
                log.error("Invariant violation for owner={} operation={} target={} candidate='{}': {}",
                        ownerId, plan.getOperation(), plan.targetId(), candidate.getContent(), e.getMessage());
                describe(audit, plan, Applied.none());
                return finish(audit.status(OperationStatus.REJECTED).errorMessage(e.getMessage()), start);
            }
        }
    }

    private Applied apply(String ownerId, CandidateFact candidate, float[] embedding, DecisionPlan plan) {
        MemoryRecord target = plan.getTarget();
        switch (plan.getOperation()) {
            case ADD -> {
                MemoryRecord saved = store.insert(recordFactory.fromCandidate(
                        ownerId, candidate, plan.getContent(), embedding, embeddingClient.modelName()));
                resummarizeTrigger.afterWrite(ownerId, saved.getCategory());
                return new Applied(List.of(saved.getId()), null, saved.getContent(), null, saved.getVersion(), null);
            }
            case UPDATE -> {
                if (plan.isAliasOnly()) {
                    MemoryRecord linked = store.addAlias(target.getId(), plan.getAlias());
                    return new Applied(List.of(target.getId()), null, null,
                            target.getVersion(), linked == null ? null : linked.getVersion(), null);
                }
                float[] vector = embeddingFor(plan.getContent(), candidate, embedding);
                if (plan.getStrategy() == MergeStrategy.SUPERSEDE) {
                    MemoryRecord next = recordFactory.successor(
                            target, candidate, plan.getContent(), vector, embeddingClient.modelName());
                    MemoryRecord saved = store.supersede(target.getId(), next);
                    resummarizeTrigger.afterWrite(ownerId, saved.getCategory());
                    return new Applied(List.of(saved.getId()), target.getContent(), saved.getContent(),
                            target.getVersion(), saved.getVersion(), null);
                }
                MemoryRecord updated = store.update(target.getId(), RecordPatch.builder()
                        .content(plan.getContent())
                        .embedding(VectorMath.toDoubleList(vector))
                        .embeddingModel(embeddingClient.modelName())
                        .expectedVersion(target.getVersion())
                        .bumpVersion(true)
                        .build());
                return new Applied(List.of(updated.getId()), target.getContent(), updated.getContent(),
                        target.getVersion(), updated.getVersion(), null);
            }
            case DELETE -> {
                if (plan.isHardDelete()) {
                    MemoryRecord removed = store.hardDelete(target.getId())
                            .orElseThrow(() -> new SlotConflictException(target.getSlotKey(),
                                    "Record " + target.getId() + " already removed"));
                    return new Applied(List.of(), removed.getContent(), null,
                            removed.getVersion(), null, snapshot(removed));
                }
                MemoryRecord archived = store.softDelete(target.getId(), ArchivedReason.DELETED)
                        .orElseThrow(() -> new SlotConflictException(target.getSlotKey(),
                                "Record " + target.getId() + " already removed"));
                return new Applied(List.of(archived.getId()), target.getContent(), null,
                        target.getVersion(), archived.getVersion(), null);
            }
            default -> {
                return Applied.none();
            }
        }
    }

    /** Content rewritten by the plan gets its own vector; the candidate's stands in if that fails. */
    private float[] embeddingFor(String content, CandidateFact candidate, float[] candidateEmbedding) {
        if (ContentMatch.same(content, candidate.getContent())) return candidateEmbedding;
        try {
            return embeddingClient.embed(content);
        } catch (EmbeddingUnavailableException e) {
            log.warn("Could not embed merged content, using candidate vector until reindex: {}", e.getMessage());
            return candidateEmbedding;
        }
    }

    private DecisionOutcome requeueOrFail(String ownerId, CandidateFact candidate, DecisionContext context,
                                          MemoryException cause, MemoryOperation.MemoryOperationBuilder audit,
                                          long start) {
        if (context.attempt() < props.getDecision().getMaxAttempts()) {
            Instant at = clock.instant().plus(props.getDecision().getRequeueDelay());
            DecisionContext next = context.nextAttempt();
            log.warn("Collaborator unavailable for owner={} ({}), requeueing attempt {} at {}",
                    ownerId, cause.getMessage(), next.attempt(), at);
            taskScheduler.schedule(() -> process(ownerId, candidate, next), at);
            return DecisionOutcome.builder()
                    .operation(OperationType.NOOP)
                    .requeued(true)
                    .reasoning("Requeued: " + cause.getMessage())
                    .build();
        }
        log.warn("Dropping candidate for owner={} after {} attempts: {}",
                ownerId, context.attempt(), cause.getMessage());
        return finish(audit.operation(OperationType.NOOP)
                .status(OperationStatus.FAILED)
                .errorMessage(cause.getMessage()), start);
    }

    private void describe(MemoryOperation.MemoryOperationBuilder audit, DecisionPlan plan, Applied applied) {
        audit.operation(plan.getOperation())
                .mergeStrategy(plan.getOperation() == OperationType.UPDATE && !plan.isAliasOnly()
                        ? plan.getStrategy() : null)
                .reasoning(plan.getReasoning())
                .overrides(new ArrayList<>(plan.getOverrides()))
                .targetRecordId(plan.targetId())
                .resultRecordIds(new ArrayList<>(applied.resultIds()))
                .previousContent(applied.previousContent())
                .newContent(applied.newContent())
                .previousVersion(applied.previousVersion())
                .newVersion(applied.newVersion())
                .aliasAdded(plan.getAlias())
                .hardDelete(plan.isHardDelete())
                .deletedSnapshot(applied.deletedSnapshot());
    }

    private DecisionOutcome finish(MemoryOperation.MemoryOperationBuilder audit, long start) {
        MemoryOperation entry = auditLog.append(audit
                .processingTimeMs(System.currentTimeMillis() - start)
                .createdAt(clock.instant())
                .build());
        log.info("Memory operation [id={}] owner={} op={} status={} target={}",
                entry.getId(), entry.getOwnerId(), entry.getOperation(), entry.getStatus(), entry.getTargetRecordId());
        return DecisionOutcome.builder()
                .operation(entry.getOperation())
                .status(entry.getStatus())
                .mergeStrategy(entry.getMergeStrategy())
                .targetRecordId(entry.getTargetRecordId())
                .resultRecordIds(entry.getResultRecordIds())
                .reasoning(entry.getReasoning())
                .auditId(entry.getId())
                .build();
    }

    private List<ConsideredRecord> considered(List<SimilarRecord> similar) {
        return similar.stream()
                .map(s -> new ConsideredRecord(s.id(), s.record().getContent(), s.similarity()))
                .toList();
    }

    private Map<String, Object> snapshot(MemoryRecord removed) {
        Map<String, Object> snap = new HashMap<>();
        snap.put("id", removed.getId());
        snap.put("subjectName", removed.getSubjectName());
        snap.put("kind", String.valueOf(removed.getKind()));
        snap.put("content", removed.getContent());
        snap.put("version", removed.getVersion());
        snap.put("createdAt", String.valueOf(removed.getCreatedAt()));
        return snap;
    }

    private record Applied(List<String> resultIds, String previousContent, String newContent,
                           Long previousVersion, Long newVersion, Map<String, Object> deletedSnapshot) {
        static Applied none() {
            return new Applied(List.of(), null, null, null, null, null);
        }
    }
}
