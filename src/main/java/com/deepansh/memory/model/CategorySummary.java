package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Synthesized narrative over the active, non-private records of one category.
 * One document per (owner, category).
 */
@Document(collection = "category_summaries")
@CompoundIndex(name = "idx_owner_category", def = "{'ownerId': 1, 'category': 1}", unique = true)
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CategorySummary {

    @Id
    private String id;

    private String ownerId;

    private MemoryCategory category;

    private String summaryText;

    @Builder.Default
    private List<String> memberRecordIds = new ArrayList<>();

    private long version;

    private Instant lastSynthesizedAt;

    public boolean hasText() {
        return summaryText != null && !summaryText.isBlank();
    }
}
