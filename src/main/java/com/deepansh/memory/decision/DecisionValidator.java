package com.deepansh.memory.decision;

import com.deepansh.memory.model.CandidateFact;
import com.deepansh.memory.model.MemoryDecision;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.MergeStrategy;
import com.deepansh.memory.model.OperationType;
import com.deepansh.memory.model.SimilarRecord;
import com.deepansh.memory.store.ContentMatch;
import com.deepansh.memory.store.MemoryStore;
import com.deepansh.memory.store.SlotKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Turns a collaborator proposal into an executable plan. The collaborator is
 * advisory: targets must come from the similar set, subjects must agree, and
 * redundant writes collapse to NOOP. Every rule that fires leaves a note in
 * the plan's overrides.
 */
@Component
@Slf4j
public class DecisionValidator {

    static final double SIMILARITY_TIE = 1e-6;

    /** Bound on supersededBy hops when following a stale target to its head. */
    private static final int MAX_HEAD_HOPS = 32;

    private final MemoryStore store;

    public DecisionValidator(MemoryStore store) {
        this.store = store;
    }

    public DecisionPlan validate(String ownerId, CandidateFact candidate,
                                 List<SimilarRecord> similar, MemoryDecision decision) {
        OperationType op = decision == null || decision.getOperation() == null
                ? OperationType.NOOP : decision.getOperation();
        String reasoning = decision == null ? null : decision.getReasoning();

        return switch (op) {
            case ADD -> planAdd(ownerId, candidate, similar, reasoning);
            case UPDATE -> planUpdate(ownerId, candidate, similar, decision);
            case DELETE -> planDelete(ownerId, candidate, similar, decision);
            default -> DecisionPlan.builder().operation(OperationType.NOOP).reasoning(reasoning).build();
        };
    }

    /** Explicit forget: hard DELETE of the best match, without asking the collaborator. */
    public DecisionPlan forgetPlan(List<SimilarRecord> similar) {
        Optional<SimilarRecord> best = best(similar);
        if (best.isEmpty()) {
            return DecisionPlan.builder()
                    .operation(OperationType.NOOP)
                    .reasoning("Forget requested but nothing similar is stored")
                    .build()
                    .override("forget instruction: collaborator not consulted");
        }
        return DecisionPlan.builder()
                .operation(OperationType.DELETE)
                .target(best.get().record())
                .hardDelete(true)
                .reasoning("Explicit forget instruction")
                .build()
                .override("forget instruction: collaborator not consulted");
    }

    /**
     * Re-plans after a concurrent writer won the slot. The target is followed
     * to its current head; a plan that has become redundant turns into NOOP.
     */
    public DecisionPlan replan(String ownerId, CandidateFact candidate, DecisionPlan plan) {
        return switch (plan.getOperation()) {
            case ADD -> planAdd(ownerId, candidate, List.of(), plan.getReasoning())
                    .override("re-planned after slot conflict");
            case UPDATE -> {
                MemoryRecord head = currentHead(plan.getTarget()).orElse(null);
                if (head == null) {
                    yield planAdd(ownerId, candidate, List.of(), plan.getReasoning())
                            .override("target removed concurrently; treated as ADD");
                }
                DecisionPlan rebased = plan.toBuilder().target(head).build();
                if (!rebased.isAliasOnly() && (ContentMatch.contains(head.getContent(), candidate.getContent())
                        || ContentMatch.same(head.getContent(), rebased.getContent()))) {
                    yield noop(rebased, "already reflected in concurrently written record " + head.getId());
                }
                if (!rebased.isAliasOnly() && rebased.getStrategy() == MergeStrategy.APPEND) {
                    rebased.setContent(ContentMatch.append(head.getContent(), candidate.getContent()));
                }
                yield rebased.override("re-applied against head " + head.getId() + " after slot conflict");
            }
            case DELETE -> {
                Optional<MemoryRecord> current = store.getById(plan.targetId());
                if (current.isEmpty() || !current.get().isActive()) {
                    yield noop(plan, "target already removed concurrently");
                }
                plan.setTarget(current.get());
                yield plan;
            }
            default -> plan;
        };
    }

    private DecisionPlan planAdd(String ownerId, CandidateFact candidate,
                                 List<SimilarRecord> similar, String reasoning) {
        DecisionPlan plan = DecisionPlan.builder()
                .operation(OperationType.ADD)
                .content(candidate.getContent())
                .reasoning(reasoning)
                .build();

        Optional<SimilarRecord> duplicate = similar.stream()
                .filter(s -> SlotKeys.sameSubject(s.record(), candidate.getSubjectName()))
                .filter(s -> ContentMatch.same(s.record().getContent(), candidate.getContent()))
                .findFirst();
        if (duplicate.isPresent()) {
            plan.setTarget(duplicate.get().record());
            return noop(plan, "identical to active record " + duplicate.get().id());
        }

        if (SlotKeys.isSlotted(candidate.getPredicate())) {
            Optional<MemoryRecord> head = store.getActiveBySlot(
                    ownerId, candidate.getSubjectName(), candidate.getPredicate());
            if (head.isPresent()) {
                plan.setTarget(head.get());
                if (ContentMatch.same(head.get().getContent(), candidate.getContent())) {
                    return noop(plan, "slot head " + head.get().getId() + " already holds this content");
                }
                plan.setOperation(OperationType.UPDATE);
                plan.setStrategy(MergeStrategy.SUPERSEDE);
                return plan.override("slot occupied by " + head.get().getId() + "; ADD became SUPERSEDE");
            }
        }
        return plan;
    }

    private DecisionPlan planUpdate(String ownerId, CandidateFact candidate,
                                    List<SimilarRecord> similar, MemoryDecision decision) {
        DecisionPlan plan = DecisionPlan.builder()
                .operation(OperationType.UPDATE)
                .reasoning(decision.getReasoning())
                .build();

        MemoryRecord target;
        if (decision.getTargetId() == null) {
            Optional<SimilarRecord> best = best(similar);
            if (best.isEmpty()) {
                return carryNotes(plan, planAdd(ownerId, candidate, similar, decision.getReasoning()))
                        .override("UPDATE without target and nothing similar; treated as ADD");
            }
            target = best.get().record();
            plan.override("UPDATE without target; chose " + target.getId() + " by tie-break");
        } else {
            Optional<MemoryRecord> found = findIn(similar, ownerId, decision.getTargetId());
            if (found.isEmpty()) {
                return carryNotes(plan, planAdd(ownerId, candidate, similar, decision.getReasoning()))
                        .override("UPDATE target " + decision.getTargetId() + " not among similar records; treated as ADD");
            }
            target = found.get();
        }
        plan.setTarget(target);

        if (!SlotKeys.sameSubject(target, candidate.getSubjectName())) {
            if (decision.isSameEntity()) {
                plan.setAlias(candidate.getSubjectName().trim());
                return plan.override("subjects differ; '" + candidate.getSubjectName()
                        + "' linked as alias of " + target.getId() + ", content not merged");
            }
            return carryNotes(plan, planAdd(ownerId, candidate, similar, decision.getReasoning()))
                    .override("subject differs from target " + target.getId() + "; treated as ADD");
        }

        MergeStrategy strategy = decision.getMergeStrategy();
        if (strategy == null) {
            strategy = MergeStrategy.REPLACE;
            plan.override("no merge strategy given; defaulted to REPLACE");
        }
        if (candidate.isHistorical() && target.isActive() && !target.isHistorical()
                && strategy != MergeStrategy.SUPERSEDE) {
            strategy = MergeStrategy.SUPERSEDE;
            plan.override("historical candidate against current record; forced SUPERSEDE");
        }
        plan.setStrategy(strategy);

        String proposed = decision.getNewContent() == null || decision.getNewContent().isBlank()
                ? candidate.getContent() : decision.getNewContent().strip();

        if (strategy == MergeStrategy.APPEND) {
            if (ContentMatch.contains(target.getContent(), candidate.getContent())
                    || ContentMatch.same(target.getContent(), proposed)) {
                return noop(plan, "appended content already contained in " + target.getId());
            }
            // The collaborator may already have written the merged text
            plan.setContent(ContentMatch.contains(proposed, target.getContent())
                    ? proposed : ContentMatch.append(target.getContent(), proposed));
            return plan;
        }

        if (ContentMatch.same(target.getContent(), proposed)) {
            return noop(plan, "content identical to " + target.getId());
        }
        plan.setContent(proposed);
        return plan;
    }

    private DecisionPlan planDelete(String ownerId, CandidateFact candidate,
                                    List<SimilarRecord> similar, MemoryDecision decision) {
        DecisionPlan plan = DecisionPlan.builder()
                .operation(OperationType.DELETE)
                .reasoning(decision.getReasoning())
                .build();

        Optional<MemoryRecord> target = decision.getTargetId() == null
                ? Optional.empty() : findIn(similar, ownerId, decision.getTargetId());
        if (target.isEmpty()) {
            return noop(plan, "DELETE target " + decision.getTargetId() + " not among similar records");
        }
        plan.setTarget(target.get());

        boolean requested = candidate.isForget() || candidate.isHardDeleteRequested();
        plan.setHardDelete(requested);
        if (decision.isHardDelete() && !requested) {
            plan.override("hard delete not requested by the owner; archived instead");
        }
        return plan;
    }

    /** Highest similarity; ties broken by most recent access, then importance. */
    static Optional<SimilarRecord> best(List<SimilarRecord> similar) {
        if (similar.isEmpty()) return Optional.empty();
        double top = similar.stream().mapToDouble(SimilarRecord::similarity).max().orElse(0);
        return similar.stream()
                .filter(s -> top - s.similarity() <= SIMILARITY_TIE)
                .min(Comparator
                        .comparing((SimilarRecord s) -> lastTouched(s.record()), Comparator.reverseOrder())
                        .thenComparing(s -> s.record().getImportance(), Comparator.reverseOrder()));
    }

    private static Instant lastTouched(MemoryRecord record) {
        if (record.getLastAccessedAt() != null) return record.getLastAccessedAt();
        return record.getCreatedAt() == null ? Instant.EPOCH : record.getCreatedAt();
    }

    private Optional<MemoryRecord> findIn(List<SimilarRecord> similar, String ownerId, String id) {
        return similar.stream()
                .map(SimilarRecord::record)
                .filter(r -> id.equals(r.getId()) && ownerId.equals(r.getOwnerId()))
                .findFirst();
    }

    private Optional<MemoryRecord> currentHead(MemoryRecord target) {
        if (target == null) return Optional.empty();
        Optional<MemoryRecord> current = store.getById(target.getId());
        for (int hops = 0; hops < MAX_HEAD_HOPS && current.isPresent(); hops++) {
            MemoryRecord r = current.get();
            if (r.isActive()) return current;
            if (r.getSupersededById() == null) return Optional.empty();
            current = store.getById(r.getSupersededById());
        }
        return Optional.empty();
    }

    private DecisionPlan noop(DecisionPlan plan, String note) {
        plan.setOperation(OperationType.NOOP);
        plan.setStrategy(null);
        plan.setContent(null);
        plan.setAlias(null);
        plan.setHardDelete(false);
        return plan.override(note);
    }

    private DecisionPlan carryNotes(DecisionPlan from, DecisionPlan to) {
        to.getOverrides().addAll(0, from.getOverrides());
        return to;
    }
}
