package com.deepansh.memory.decision;

import com.deepansh.memory.embedding.VectorMath;
import com.deepansh.memory.model.CandidateFact;
import com.deepansh.memory.model.Importance;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.Sensitivity;
import com.deepansh.memory.summary.CategoryClassifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;

/**
 * Builds records from candidates: fresh ones for ADD and chain successors for SUPERSEDE.
 */
@Component
public class RecordFactory {

    private final CategoryClassifier classifier;

    public RecordFactory(CategoryClassifier classifier) {
        this.classifier = classifier;
    }

    public MemoryRecord fromCandidate(String ownerId, CandidateFact candidate, String content,
                                      float[] embedding, String embeddingModel) {
        double importance = Importance.score(candidate.getImportance());
        return MemoryRecord.builder()
                .ownerId(ownerId)
                .kind(candidate.getKind())
                .subjectName(candidate.getSubjectName().trim())
                .content(content)
                .predicate(candidate.getPredicate())
                .object(candidate.getObject())
                .category(classifier.classify(candidate.getKind(), candidate.getSubjectName() + " " + content))
                .embedding(embedding == null ? null : VectorMath.toDoubleList(embedding))
                .embeddingModel(embedding == null ? null : embeddingModel)
                .importance(importance)
                .baseImportance(importance)
                .pinned(candidate.isPinned())
                .sentiment(clampSentiment(candidate.getSentiment()))
                .historical(candidate.isHistorical())
                .effectiveFrom(candidate.getEffectiveFrom())
                .expiresAt(candidate.getExpiresAt())
                .recurrence(candidate.getRecurrence())
                .sensitivity(candidate.getSensitivity() == null ? Sensitivity.NORMAL : candidate.getSensitivity())
                .sourceId(candidate.getSourceId())
                .build();
    }

    /**
     * Next version of {@code previous}. Subject, aliases and the relation carry
     * over unless the candidate names them; sensitivity never loosens along a chain.
     */
    public MemoryRecord successor(MemoryRecord previous, CandidateFact candidate, String content,
                                  float[] embedding, String embeddingModel) {
        MemoryRecord next = fromCandidate(previous.getOwnerId(), candidate, content, embedding, embeddingModel);
        next.setSubjectName(previous.getSubjectName());
        if (previous.getAliases() != null) next.setAliases(new LinkedHashSet<>(previous.getAliases()));
        if (candidate.getPredicate() == null) {
            next.setPredicate(previous.getPredicate());
            next.setObject(previous.getObject());
        }
        if (candidate.getImportance() == null) {
            next.setImportance(previous.getImportance());
            next.setBaseImportance(previous.getBaseImportance());
        }
        next.setPinned(candidate.isPinned() || previous.isPinned());
        next.setSensitivity(stricter(previous.getSensitivity(), next.getSensitivity()));
        next.setVersion(previous.getVersion() + 1);
        return next;
    }

    private Sensitivity stricter(Sensitivity a, Sensitivity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    private Double clampSentiment(Double sentiment) {
        if (sentiment == null) return null;
        return Math.max(-1.0, Math.min(1.0, sentiment));
    }
}
