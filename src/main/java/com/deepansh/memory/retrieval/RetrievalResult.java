package com.deepansh.memory.retrieval;

import com.deepansh.memory.model.CategorySummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalResult {

    public enum Tier {
        /** Category summaries alone answer the query. */
        SUMMARY,
        /** Individual records, ranked and packed into the budget. */
        RECORDS,
        /** Nothing relevant is stored. */
        EMPTY
    }

    private Tier tier;

    @Builder.Default
    private List<CategorySummary> summaries = new ArrayList<>();

    @Builder.Default
    private List<ScoredRecord> records = new ArrayList<>();

    private int tokensUsed;

    private int tokenBudget;

    private String reason;
}
