package com.deepansh.memory.summary;

import com.deepansh.memory.model.CategorySummary;
import com.deepansh.memory.model.MemoryCategory;

import java.util.List;
import java.util.Optional;

/**
 * One summary per (owner, category). save() replaces the stored one.
 */
public interface CategorySummaryStore {

    Optional<CategorySummary> find(String ownerId, MemoryCategory category);

    List<CategorySummary> findByOwner(String ownerId);

    CategorySummary save(CategorySummary summary);
}
