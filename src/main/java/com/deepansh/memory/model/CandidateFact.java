package com.deepansh.memory.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A normalized, not-yet-committed unit of information produced by extraction
 * (or submitted directly through the API).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CandidateFact {

    @Builder.Default
    private MemoryKind kind = MemoryKind.FACT;

    @NotBlank
    @JsonAlias("subject_name")
    private String subjectName;

    @NotBlank
    private String content;

    private String predicate;

    private String object;

    @JsonAlias("is_historical")
    private boolean historical;

    @JsonAlias("effective_from")
    private Instant effectiveFrom;

    @JsonAlias("expires_at")
    private Instant expiresAt;

    private Recurrence recurrence;

    @Builder.Default
    private Sensitivity sensitivity = Sensitivity.NORMAL;

    /** Label (critical/high/medium/low/trivial) or numeric score. */
    private String importance;

    /** User explicitly marked this as important to keep. */
    private boolean pinned;

    private Double sentiment;

    /** Explicit "forget this" / "don't remember this" instruction. */
    private boolean forget;

    @JsonAlias("hard_delete_requested")
    private boolean hardDeleteRequested;

    /** Reused by the engine when already computed upstream. */
    private float[] embedding;

    private String sourceId;
}
