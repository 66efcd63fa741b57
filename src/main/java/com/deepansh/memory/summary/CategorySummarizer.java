package com.deepansh.memory.summary;

import com.deepansh.memory.exception.MemoryException;
import com.deepansh.memory.llm.LlmClient;
import com.deepansh.memory.model.LlmResponse;
import com.deepansh.memory.model.MemoryCategory;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Rewrites a category summary from its current members. The summary evolves:
 * the previous text is context, and new information wins where they disagree.
 */
@Service
@Slf4j
public class CategorySummarizer {

    private static final String SYSTEM_PROMPT =
            "You maintain short third-person profiles of a user's life. Respond with plain prose only.";

    private final LlmClient llmClient;

    public CategorySummarizer(LlmClient llmClient) {
        this.llmClient = llmClient;
    }

    /**
     * @throws MemoryException when the collaborator fails or answers with nothing;
     *         the resummarize job retries with backoff
     */
    public String summarize(MemoryCategory category, String previousSummary, List<MemoryRecord> members) {
        String facts = members.stream()
                .map(r -> "- " + r.getSubjectName() + ": " + r.getContent()
                        + (r.isHistorical() ? " (in the past)" : ""))
                .collect(Collectors.joining("\n"));

        String prompt = """
                Category: %s

                Current summary:
                %s

                Facts currently known in this category:
                %s

                Rewrite the summary in 2 to 4 sentences. Keep what the facts still support,
                integrate the new facts, and where old and new disagree the new facts win.
                Facts marked "in the past" describe history, not the present.
                """.formatted(category.name().toLowerCase().replace('_', ' '),
                previousSummary == null || previousSummary.isBlank() ? "(none yet)" : previousSummary,
                facts);

        LlmResponse response = llmClient.chat(List.of(Message.system(SYSTEM_PROMPT), Message.user(prompt)), List.of());
        String text = response == null ? null : response.getContent();
        if (text == null || text.isBlank()) {
            throw new MemoryException("Summarizer returned no text for category " + category);
        }
        log.debug("Summarized category={} from {} records", category, members.size());
        return text.strip();
    }
}
