package com.deepansh.memory.retrieval;

import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.llm.LlmClient;
import com.deepansh.memory.model.CategorySummary;
import com.deepansh.memory.model.LlmResponse;
import com.deepansh.memory.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Asks the model whether the summaries answer the query. Only a confident
 * "yes" short-circuits to the summary tier; any failure falls back to the
 * heuristic judge.
 */
@Component
@ConditionalOnProperty(name = "memory.retrieval.judge", havingValue = "llm")
@Slf4j
public class LlmSufficiencyJudge implements SummarySufficiencyJudge {

    private static final String SYSTEM_PROMPT =
            "You judge whether context answers a question. Respond with a single JSON object only.";

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;
    private final MemoryProperties props;
    private final HeuristicSufficiencyJudge fallback = new HeuristicSufficiencyJudge();

    public LlmSufficiencyJudge(LlmClient llmClient, ObjectMapper objectMapper, MemoryProperties props) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    @Override
    public Verdict judge(String query, List<CategorySummary> summaries, List<String> knownSubjects) {
        if (summaries == null || summaries.isEmpty()) {
            return fallback.judge(query, summaries, knownSubjects);
        }
        String context = summaries.stream()
                .map(s -> s.getCategory() + ": " + s.getSummaryText())
                .collect(Collectors.joining("\n"));
        String prompt = """
                Question: %s

                Context:
                %s

                Can the question be fully answered from the context alone?
                Respond exactly as {"sufficient": true|false, "confidence": 0.0-1.0, "reason": "..."}
                """.formatted(query, context);

        try {
            LlmResponse response = llmClient.chat(List.of(Message.system(SYSTEM_PROMPT), Message.user(prompt)), List.of());
            Verdict verdict = parse(response == null ? null : response.getContent());
            if (verdict.sufficient() && verdict.confidence() < props.getRetrieval().getJudgeMinConfidence()) {
                return new Verdict(false, verdict.confidence(), "judge not confident enough: " + verdict.reason());
            }
            return verdict;
        } catch (RuntimeException | JsonProcessingException e) {
            log.warn("Sufficiency judge unavailable, using heuristic: {}", e.getMessage());
            return fallback.judge(query, summaries, knownSubjects);
        }
    }

    Verdict parse(String raw) throws JsonProcessingException {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("empty judge response");
        }
        String cleaned = raw.strip()
                .replaceAll("(?s)^```json\\s*", "")
                .replaceAll("(?s)^```\\s*", "")
                .replaceAll("(?s)```\\s*$", "")
                .strip();
        JsonNode node = objectMapper.readTree(cleaned);
        return new Verdict(
                node.path("sufficient").asBoolean(false),
                node.path("confidence").asDouble(0.0),
                node.path("reason").asText(""));
    }
}
