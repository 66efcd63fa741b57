package com.deepansh.memory.extraction;

import com.deepansh.memory.exception.ExtractionUnavailableException;
import com.deepansh.memory.exception.MemoryException;
import com.deepansh.memory.llm.LlmClient;
import com.deepansh.memory.model.CandidateFact;
import com.deepansh.memory.model.LlmResponse;
import com.deepansh.memory.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Extracts candidate facts with one LLM call that must answer with a JSON array.
 *
 * All failures are caught and logged, never propagated: extraction must not
 * block note capture. Three guards run before JSON parsing so prose answers
 * (or an empty answer) degrade to "nothing learned" instead of an exception.
 */
@Service
@Slf4j
public class LlmFactExtractor implements FactExtractor {

    private static final String SYSTEM_PROMPT =
            "You extract durable personal facts for a memory store. Output only valid JSON arrays. Nothing else.";

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    public LlmFactExtractor(LlmClient llmClient, ObjectMapper objectMapper) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<CandidateFact> extract(String text, List<String> knownEntities) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        try {
            String raw = callCollaborator(text, knownEntities);
            List<CandidateFact> candidates = parse(raw).stream()
                    .filter(Objects::nonNull)
                    .filter(c -> c.getContent() != null && !c.getContent().isBlank())
                    .filter(c -> c.getSubjectName() != null && !c.getSubjectName().isBlank())
                    .toList();
            log.info("Extracted {} candidate facts from text length={}", candidates.size(), text.length());
            return candidates;
        } catch (ExtractionUnavailableException e) {
            log.warn("Extraction unavailable, nothing learned from this observation: {}", e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            log.error("Extraction failed unexpectedly, nothing learned: {}", e.getMessage());
            return List.of();
        }
    }

    private String callCollaborator(String text, List<String> knownEntities) {
        String prompt = """
                Extract facts worth remembering about the user and the people, places, projects,
                preferences and events in their life.

                Respond with ONLY a JSON array. Each element:
                {
                  "kind": "entity|fact|preference|event|goal|procedure|decision|action",
                  "subject_name": "who or what the fact is about",
                  "content": "the fact, short and self-contained",
                  "predicate": "optional relation such as works_at, lives_in",
                  "object": "optional relation target",
                  "is_historical": false,
                  "effective_from": "optional ISO-8601 instant",
                  "expires_at": "optional ISO-8601 instant",
                  "recurrence": {"frequency": "WEEKLY", "dayOfWeek": "MONDAY"},
                  "sensitivity": "normal|sensitive|private",
                  "importance": "critical|high|medium|low|trivial",
                  "pinned": false,
                  "forget": false,
                  "hard_delete_requested": false
                }

                Rules:
                - "used to", "previously", "no longer" -> is_historical = true
                - "forget", "don't remember", "delete this" -> forget = true, and hard_delete_requested = true
                - health, finances, intimate matters -> sensitive; "keep this private" -> private
                - never include passwords, SSNs, card numbers or API keys
                - reuse the exact spelling of known entities when they are meant
                If nothing is worth remembering, respond with exactly: []

                Known entities: %s

                Text:
                %s
                """.formatted(knownEntities == null || knownEntities.isEmpty() ? "none" : String.join(", ", knownEntities), text);

        try {
            LlmResponse response = llmClient.chat(List.of(Message.system(SYSTEM_PROMPT), Message.user(prompt)), List.of());
            return response.getContent();
        } catch (MemoryException e) {
            throw new ExtractionUnavailableException("Extraction collaborator unavailable", e);
        }
    }

    List<CandidateFact> parse(String raw) {
        // Guard 1: null/blank
        if (raw == null || raw.isBlank()) {
            log.debug("Empty extraction response, skipping");
            return List.of();
        }

        String cleaned = raw.strip()
                .replaceAll("(?s)^```json\\s*", "")
                .replaceAll("(?s)^```\\s*", "")
                .replaceAll("(?s)```\\s*$", "")
                .strip();

        // Guard 2: not a JSON array
        if (!cleaned.startsWith("[")) {
            log.warn("Extraction response is not a JSON array, skipping. First 100 chars: '{}'",
                    cleaned.substring(0, Math.min(100, cleaned.length())));
            return List.of();
        }

        // Guard 3: parse
        try {
            return objectMapper.readValue(cleaned, new TypeReference<List<CandidateFact>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse extraction JSON, skipping. Error: {}", e.getMessage());
            return List.of();
        }
    }
}
