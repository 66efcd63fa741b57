package com.deepansh.memory.retrieval;

import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.embedding.EmbeddingClient;
import com.deepansh.memory.exception.EmbeddingUnavailableException;
import com.deepansh.memory.model.CategorySummary;
import com.deepansh.memory.model.MemoryCategory;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.Sensitivity;
import com.deepansh.memory.model.SimilarRecord;
import com.deepansh.memory.relationship.RelationshipStore;
import com.deepansh.memory.store.MemoryStore;
import com.deepansh.memory.store.SimilarityRetriever;
import com.deepansh.memory.summary.CategoryClassifier;
import com.deepansh.memory.summary.CategorySummaryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Builds the context for a query within a token budget.
 *
 * Tier 1: summaries of the query's categories, when the sufficiency judge
 *         says they answer it.
 * Tier 2: individual records, scored
 *           0.5 * similarity + 0.2 * importance + 0.15 * recency + 0.15 * access
 *         and packed greedily until the budget or the value-per-token floor stops it.
 *
 * Returned records have their access recorded; that is the only write.
 */
@Service
@Slf4j
public class RetrievalComposer {

    static final double W_SIMILARITY = 0.5;
    static final double W_IMPORTANCE = 0.2;
    static final double W_RECENCY = 0.15;
    static final double W_ACCESS = 0.15;

    private static final int MAX_CATEGORIES = 3;
    private static final int KNOWN_SUBJECT_LIMIT = 200;

    private final MemoryStore store;
    private final SimilarityRetriever retriever;
    private final EmbeddingClient embeddingClient;
    private final CategoryClassifier classifier;
    private final CategorySummaryStore summaryStore;
    private final SummarySufficiencyJudge judge;
    private final RelationshipStore relationshipStore;
    private final MemoryProperties props;
    private final Clock clock;

    public RetrievalComposer(MemoryStore store,
                             SimilarityRetriever retriever,
                             EmbeddingClient embeddingClient,
                             CategoryClassifier classifier,
                             CategorySummaryStore summaryStore,
                             SummarySufficiencyJudge judge,
                             RelationshipStore relationshipStore,
                             MemoryProperties props,
                             Clock clock) {
        this.store = store;
        this.retriever = retriever;
        this.embeddingClient = embeddingClient;
        this.classifier = classifier;
        this.summaryStore = summaryStore;
        this.judge = judge;
        this.relationshipStore = relationshipStore;
        this.props = props;
        this.clock = clock;
    }

    public RetrievalResult retrieve(String ownerId, String query, Integer tokenBudget) {
        int budget = tokenBudget == null || tokenBudget <= 0
                ? props.getRetrieval().getDefaultTokenBudget() : tokenBudget;

        Optional<RetrievalResult> fromSummaries = summaryTier(ownerId, query, budget);
        if (fromSummaries.isPresent()) {
            return fromSummaries.get();
        }
        return recordTier(ownerId, query, budget);
    }

    private Optional<RetrievalResult> summaryTier(String ownerId, String query, int budget) {
        List<MemoryCategory> categories = classifier.relevantCategories(query, MAX_CATEGORIES);
        List<CategorySummary> summaries = categories.stream()
                .map(c -> summaryStore.find(ownerId, c))
                .flatMap(Optional::stream)
                .filter(CategorySummary::hasText)
                .toList();
        if (summaries.isEmpty()) return Optional.empty();

        SummarySufficiencyJudge.Verdict verdict =
                judge.judge(query, summaries, store.findSubjectNames(ownerId, KNOWN_SUBJECT_LIMIT));
        log.debug("Sufficiency verdict owner={} sufficient={} reason={}", ownerId, verdict.sufficient(), verdict.reason());
        if (!verdict.sufficient()) return Optional.empty();

        List<CategorySummary> packed = new ArrayList<>();
        int used = 0;
        for (CategorySummary summary : summaries) {
            int tokens = TokenEstimator.estimate(summary.getSummaryText());
            if (used + tokens > budget) break;
            packed.add(summary);
            used += tokens;
        }
        if (packed.isEmpty()) return Optional.empty();

        return Optional.of(RetrievalResult.builder()
                .tier(RetrievalResult.Tier.SUMMARY)
                .summaries(packed)
                .tokensUsed(used)
                .tokenBudget(budget)
                .reason(verdict.reason())
                .build());
    }

    private RetrievalResult recordTier(String ownerId, String query, int budget) {
        Instant now = clock.instant();
        MemoryProperties.Retrieval cfg = props.getRetrieval();

        String reason;
        List<SimilarRecord> similar;
        try {
            float[] vector = embeddingClient.embed(query);
            similar = retriever.findSimilar(ownerId, vector, cfg.getCandidatePool(), cfg.getSimilarityThreshold());
            reason = "semantic match";
        } catch (EmbeddingUnavailableException e) {
            log.warn("Query embedding unavailable for owner={}, falling back to keyword search: {}", ownerId, e.getMessage());
            similar = retriever.keywordSearch(ownerId, query, cfg.getCandidatePool());
            reason = "keyword match (embedding unavailable)";
        }

        List<ScoredRecord> ranked = similar.stream()
                .filter(s -> !s.record().isEffectiveAfter(now))
                .filter(s -> s.record().getSensitivity() != Sensitivity.PRIVATE)
                .map(s -> score(s, now))
                .sorted(Comparator.comparingDouble(ScoredRecord::score).reversed())
                .toList();

        List<ScoredRecord> packed = new ArrayList<>();
        int used = 0;
        for (ScoredRecord candidate : ranked) {
            if (used + candidate.tokens() > budget) break;
            if (candidate.valuePerToken() < cfg.getMinValuePerToken()) break;
            packed.add(candidate);
            used += candidate.tokens();
        }

        if (packed.isEmpty()) {
            return RetrievalResult.builder()
                    .tier(RetrievalResult.Tier.EMPTY)
                    .tokenBudget(budget)
                    .reason(ranked.isEmpty() ? "no relevant records" : "no record fits the budget")
                    .build();
        }

        recordAccess(ownerId, packed);
        log.info("Retrieved {} records ({} tokens of {}) for owner={}", packed.size(), used, budget, ownerId);
        return RetrievalResult.builder()
                .tier(RetrievalResult.Tier.RECORDS)
                .records(packed)
                .tokensUsed(used)
                .tokenBudget(budget)
                .reason(reason)
                .build();
    }

    ScoredRecord score(SimilarRecord similar, Instant now) {
        MemoryRecord record = similar.record();
        Instant touched = record.getUpdatedAt() != null ? record.getUpdatedAt() : record.getCreatedAt();
        double weeks = touched == null ? 0 : Math.max(0, Duration.between(touched, now).toHours() / (24.0 * 7));
        double recency = Math.pow(0.95, weeks);
        double access = Math.min(1.0, 0.5 + Math.log(Math.max(1, record.getAccessCount())) / 10.0);

        double score = W_SIMILARITY * similar.similarity()
                + W_IMPORTANCE * record.getImportance()
                + W_RECENCY * recency
                + W_ACCESS * access;
        return new ScoredRecord(record, similar.similarity(), score, TokenEstimator.estimate(record.getContent()));
    }

    private void recordAccess(String ownerId, List<ScoredRecord> returned) {
        List<String> ids = returned.stream().map(s -> s.record().getId()).toList();
        try {
            store.recordAccess(ownerId, ids, props.getDecay().getAccessBoost());
            if (ids.size() > 1) {
                relationshipStore.recordCoAccess(ownerId, ids);
            }
        } catch (RuntimeException e) {
            log.warn("Access bookkeeping failed for owner={}: {}", ownerId, e.getMessage());
        }
    }
}
