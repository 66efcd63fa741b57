package com.deepansh.memory.store;

import com.deepansh.memory.embedding.VectorMath;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.SimilarRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Top-K similarity over one owner's active records.
 *
 * In-process cosine similarity: the store returns the owner's active records
 * that have an embedding and the scoring happens here. Personal stores are
 * small (hundreds to low thousands of records per owner), so this stays cheap
 * and works against any MongoDB. For Atlas, swap the candidate fetch for a
 * $vectorSearch stage filtered on ownerId.
 *
 * Owner scoping is by construction: candidates are only ever read with an
 * ownerId filter.
 */
@Service
@Slf4j
public class SimilarityRetriever {

    private final MemoryStore store;

    public SimilarityRetriever(MemoryStore store) {
        this.store = store;
    }

    /**
     * Up to k active records of the owner with similarity strictly above
     * threshold, most similar first.
     */
    public List<SimilarRecord> findSimilar(String ownerId, float[] embedding, int k, double threshold) {
        List<MemoryRecord> candidates = store.findActiveWithEmbedding(ownerId);
        List<SimilarRecord> result = candidates.stream()
                .filter(r -> ownerId.equals(r.getOwnerId()) && r.isActive())
                .map(r -> new SimilarRecord(r, VectorMath.cosineSimilarity(embedding, r.getEmbedding())))
                .filter(s -> s.similarity() > threshold)
                .sorted(Comparator.comparingDouble(SimilarRecord::similarity).reversed())
                .limit(k)
                .toList();
        log.debug("findSimilar owner={} candidates={} matches={}", ownerId, candidates.size(), result.size());
        return result;
    }

    /**
     * Fallback when no query vector is available: term overlap stands in for
     * similarity (fraction of query terms found in the record).
     */
    public List<SimilarRecord> keywordSearch(String ownerId, String query, int k) {
        List<String> terms = Arrays.stream(query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(t -> t.length() > 2)
                .distinct()
                .toList();
        if (terms.isEmpty()) return List.of();

        Map<String, MemoryRecord> hits = new LinkedHashMap<>();
        for (String term : terms) {
            store.searchByKeyword(ownerId, term, k).forEach(r -> hits.putIfAbsent(r.getId(), r));
        }
        return hits.values().stream()
                .map(r -> new SimilarRecord(r, overlap(terms, r)))
                .sorted(Comparator.comparingDouble(SimilarRecord::similarity).reversed())
                .limit(k)
                .toList();
    }

    private double overlap(List<String> terms, MemoryRecord record) {
        String text = (record.getSubjectName() + " " + record.getContent()).toLowerCase(Locale.ROOT);
        long found = terms.stream().filter(text::contains).count();
        return (double) found / terms.size();
    }
}
