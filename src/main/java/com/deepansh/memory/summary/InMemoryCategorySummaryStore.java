package com.deepansh.memory.summary;

import com.deepansh.memory.model.CategorySummary;
import com.deepansh.memory.model.MemoryCategory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "memory.store.backend", havingValue = "in-memory")
public class InMemoryCategorySummaryStore implements CategorySummaryStore {

    private final Map<String, CategorySummary> summaries = new ConcurrentHashMap<>();

    @Override
    public Optional<CategorySummary> find(String ownerId, MemoryCategory category) {
        return Optional.ofNullable(summaries.get(key(ownerId, category))).map(this::copy);
    }

    @Override
    public List<CategorySummary> findByOwner(String ownerId) {
        return summaries.values().stream()
                .filter(s -> ownerId.equals(s.getOwnerId()))
                .sorted(Comparator.comparing(CategorySummary::getCategory))
                .map(this::copy)
                .toList();
    }

    @Override
    public CategorySummary save(CategorySummary summary) {
        CategorySummary stored = summaries.compute(key(summary.getOwnerId(), summary.getCategory()),
                (k, existing) -> copy(summary).toBuilder()
                        .id(existing != null ? existing.getId()
                                : summary.getId() != null ? summary.getId() : UUID.randomUUID().toString())
                        .build());
        return copy(stored);
    }

    private CategorySummary copy(CategorySummary s) {
        return s.toBuilder()
                .memberRecordIds(s.getMemberRecordIds() == null ? new ArrayList<>() : new ArrayList<>(s.getMemberRecordIds()))
                .build();
    }

    private String key(String ownerId, MemoryCategory category) {
        return ownerId + "|" + category;
    }
}
