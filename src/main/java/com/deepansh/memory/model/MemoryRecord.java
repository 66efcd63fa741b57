package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The atomic unit of stored knowledge.
 *
 * Collection: memory_records
 *
 * Slot uniqueness is enforced by the database, not by application code:
 * idx_active_slot is a unique index on slotKey restricted to ACTIVE
 * documents, so two writers racing to activate the same slot cannot both
 * commit. The loser gets a duplicate-key error which the store maps to
 * SlotConflictException.
 *
 * Version chain: supersedesId points to the previous version (strictly
 * older), supersededById to the next. version increases by one along the
 * chain and on every in-place content change.
 */
@Document(collection = "memory_records")
@CompoundIndexes({
    @CompoundIndex(name = "idx_active_slot", def = "{'slotKey': 1}", unique = true,
            partialFilter = "{ 'status': 'ACTIVE' }"),
    @CompoundIndex(name = "idx_owner_status", def = "{'ownerId': 1, 'status': 1}"),
    @CompoundIndex(name = "idx_owner_category", def = "{'ownerId': 1, 'category': 1, 'status': 1}"),
    @CompoundIndex(name = "idx_owner_expiry", def = "{'ownerId': 1, 'expiresAt': 1}")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MemoryRecord {

    @Id
    private String id;

    private String ownerId;

    private MemoryKind kind;

    private String subjectName;

    @Builder.Default
    private Set<String> aliases = new LinkedHashSet<>();

    private String content;

    /** Optional (subject, predicate, object) triple, e.g. works_at -> "Acme". */
    private String predicate;

    private String object;

    private String slotKey;

    private MemoryCategory category;

    /**
     * Vector for content. Null until computed.
     * Stored as List<Double> so Atlas Vector Search can index it directly.
     */
    private List<Double> embedding;

    private String embeddingModel;

    private double importance;

    /** Starting point of the decay curve; reset by access boosts. */
    private double baseImportance;

    /** Explicitly marked high-importance by the user. */
    private boolean pinned;

    private Double sentiment;

    private boolean historical;

    private Instant effectiveFrom;

    private Instant expiresAt;

    private Recurrence recurrence;

    @Builder.Default
    private Sensitivity sensitivity = Sensitivity.NORMAL;

    @Builder.Default
    private MemoryStatus status = MemoryStatus.ACTIVE;

    private ArchivedReason archivedReason;

    private String supersedesId;

    private String supersededById;

    @Builder.Default
    private long version = 1;

    private long accessCount;

    private Instant lastAccessedAt;

    private String sourceId;

    private Instant createdAt;

    private Instant updatedAt;

    public boolean isActive() {
        return status == MemoryStatus.ACTIVE;
    }

    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }

    /** True when the record has an effective date that has not arrived yet. */
    public boolean isEffectiveAfter(Instant now) {
        return effectiveFrom != null && effectiveFrom.isAfter(now);
    }

    /** Detached copy so callers never share mutable state with a store. */
    public MemoryRecord copy() {
        return toBuilder()
                .aliases(aliases == null ? new LinkedHashSet<>() : new LinkedHashSet<>(aliases))
                .embedding(embedding == null ? null : new ArrayList<>(embedding))
                .build();
    }
}
