package com.deepansh.memory.retrieval;

import com.deepansh.memory.model.CategorySummary;

import java.util.List;

/**
 * Decides whether category summaries alone answer a query, so retrieval can
 * skip the record tier.
 */
public interface SummarySufficiencyJudge {

    Verdict judge(String query, List<CategorySummary> summaries, List<String> knownSubjects);

    record Verdict(boolean sufficient, double confidence, String reason) {}
}
