package com.deepansh.memory.retrieval;

import com.deepansh.memory.model.CategorySummary;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Summaries are general by nature: queries that name a specific known entity
 * or ask for a precise detail need records. Anything else is answered by the
 * summaries of the categories it matched.
 */
@Component
@ConditionalOnProperty(name = "memory.retrieval.judge", havingValue = "heuristic", matchIfMissing = true)
public class HeuristicSufficiencyJudge implements SummarySufficiencyJudge {

    private static final Pattern SPECIFIC_DETAIL = Pattern.compile(
            "\\b(when|what date|which date|date|exactly|how many|how much|which|what time|what year)\\b");

    /** Subjects too generic to count as naming a specific entity. */
    private static final List<String> GENERIC_SUBJECTS = List.of("user", "me", "i", "myself");

    @Override
    public Verdict judge(String query, List<CategorySummary> summaries, List<String> knownSubjects) {
        if (summaries == null || summaries.isEmpty()) {
            return new Verdict(false, 1.0, "no summaries for the query's categories");
        }
        String lower = query == null ? "" : query.toLowerCase(Locale.ROOT);

        if (SPECIFIC_DETAIL.matcher(lower).find()) {
            return new Verdict(false, 0.8, "query asks for a specific detail");
        }
        if (knownSubjects != null) {
            for (String subject : knownSubjects) {
                String s = subject == null ? "" : subject.trim().toLowerCase(Locale.ROOT);
                if (s.length() < 2 || GENERIC_SUBJECTS.contains(s)) continue;
                if (Pattern.compile("\\b" + Pattern.quote(s) + "\\b").matcher(lower).find()) {
                    return new Verdict(false, 0.8, "query names known entity '" + subject + "'");
                }
            }
        }
        return new Verdict(true, 0.7, "summaries cover the query's categories");
    }
}
