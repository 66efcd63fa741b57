package com.deepansh.memory.retrieval;

import com.deepansh.memory.model.CategorySummary;
import com.deepansh.memory.model.MemoryCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicSufficiencyJudgeTest {

    private final HeuristicSufficiencyJudge judge = new HeuristicSufficiencyJudge();

    private final List<CategorySummary> summaries = List.of(CategorySummary.builder()
            .ownerId("owner-1").category(MemoryCategory.WORK_LIFE).summaryText("Busy at work.").build());

    @Test
    void judge_generalQuery_sufficient() {
        assertThat(judge.judge("how is work going for me", summaries, List.of("user", "me")).sufficient()).isTrue();
    }

    @Test
    void judge_specificDetail_insufficient() {
        assertThat(judge.judge("when did I start this job", summaries, List.of()).sufficient()).isFalse();
    }

    @Test
    void judge_namesKnownSubject_insufficient() {
        SummarySufficiencyJudge.Verdict verdict = judge.judge("how is Marcus doing at work", summaries, List.of("Marcus"));

        assertThat(verdict.sufficient()).isFalse();
        assertThat(verdict.reason()).contains("Marcus");
    }

    @Test
    void judge_noSummaries_insufficient() {
        assertThat(judge.judge("how is work", List.of(), List.of()).sufficient()).isFalse();
    }
}
