package com.deepansh.memory.decision;

import com.deepansh.memory.exception.DecisionUnavailableException;
import com.deepansh.memory.llm.LlmClient;
import com.deepansh.memory.llm.ToolDefinition;
import com.deepansh.memory.model.CandidateFact;
import com.deepansh.memory.model.LlmResponse;
import com.deepansh.memory.model.MemoryDecision;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.model.MergeStrategy;
import com.deepansh.memory.model.Message;
import com.deepansh.memory.model.OperationType;
import com.deepansh.memory.model.SimilarRecord;
import com.deepansh.memory.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Decision collaborator realised as tool calling: the model must pick exactly
 * one of add_memory, update_memory, delete_memory or no_operation.
 *
 * A response without a tool call is read as NOOP.
 */
@Service
@Slf4j
public class LlmDecisionClient implements DecisionClient {

    static final String ADD = "add_memory";
    static final String UPDATE = "update_memory";
    static final String DELETE = "delete_memory";
    static final String NOOP = "no_operation";

    private static final String SYSTEM_PROMPT = """
            You maintain a personal memory store. For each new fact decide exactly one operation
            by calling one tool:
            - add_memory: genuinely new information
            - update_memory: refines, corrects or changes an existing memory
                merge_strategy "replace" when the old content was wrong,
                "append" when the new fact adds detail,
                "supersede" when the state changed over time (new job, moved city)
            - delete_memory: the new fact says an existing memory is no longer true and nothing replaces it
            - no_operation: already known, or not worth storing
            Only reference memory ids from the list you are given.
            Set same_entity=true only when two different names clearly refer to the same person or thing.
            """;

    private static final List<ToolDefinition> TOOLS = List.of(
            ToolDefinition.of(ADD, "Store the fact as a new memory.",
                    Map.of("reasoning", Map.of("type", "string")),
                    List.of("reasoning")),
            ToolDefinition.of(UPDATE, "Update an existing memory with the new fact.",
                    Map.of(
                            "memory_id", Map.of("type", "string", "description", "id of the memory to update"),
                            "new_content", Map.of("type", "string", "description", "content after the update"),
                            "merge_strategy", Map.of("type", "string",
                                    "enum", List.of("replace", "append", "supersede")),
                            "same_entity", Map.of("type", "boolean",
                                    "description", "the fact's subject is another name for the memory's subject"),
                            "reasoning", Map.of("type", "string")),
                    List.of("memory_id", "merge_strategy", "reasoning")),
            ToolDefinition.of(DELETE, "Remove a memory that is no longer true.",
                    Map.of(
                            "memory_id", Map.of("type", "string"),
                            "hard_delete", Map.of("type", "boolean",
                                    "description", "true only when the user asked to forget it entirely"),
                            "reasoning", Map.of("type", "string")),
                    List.of("memory_id", "reasoning")),
            ToolDefinition.of(NOOP, "Do nothing with this fact.",
                    Map.of("reasoning", Map.of("type", "string")),
                    List.of("reasoning"))
    );

    private final LlmClient llmClient;

    public LlmDecisionClient(LlmClient llmClient) {
        this.llmClient = llmClient;
    }

    @Override
    public MemoryDecision decide(CandidateFact candidate, List<SimilarRecord> similar) {
        LlmResponse response;
        try {
            response = llmClient.chat(
                    List.of(Message.system(SYSTEM_PROMPT), Message.user(buildPrompt(candidate, similar))),
                    TOOLS);
        } catch (RuntimeException e) {
            throw new DecisionUnavailableException("Decision collaborator unavailable: " + e.getMessage(), e);
        }

        if (response == null || !response.isToolCallRequired() || response.getToolCall() == null) {
            log.debug("No tool selected for candidate '{}', treating as NOOP", candidate.getContent());
            return MemoryDecision.noop("No tool selected");
        }
        return toDecision(response.getToolCall());
    }

    MemoryDecision toDecision(ToolCall call) {
        String reasoning = call.stringArg("reasoning");
        String tool = call.getToolName() == null ? "" : call.getToolName();
        return switch (tool) {
            case ADD -> MemoryDecision.builder()
                    .operation(OperationType.ADD)
                    .reasoning(reasoning)
                    .build();
            case UPDATE -> MemoryDecision.builder()
                    .operation(OperationType.UPDATE)
                    .targetId(call.stringArg("memory_id"))
                    .newContent(call.stringArg("new_content"))
                    .mergeStrategy(MergeStrategy.from(call.stringArg("merge_strategy")))
                    .sameEntity(call.booleanArg("same_entity"))
                    .reasoning(reasoning)
                    .build();
            case DELETE -> MemoryDecision.builder()
                    .operation(OperationType.DELETE)
                    .targetId(call.stringArg("memory_id"))
                    .hardDelete(call.booleanArg("hard_delete"))
                    .reasoning(reasoning)
                    .build();
            case NOOP -> MemoryDecision.noop(reasoning);
            default -> {
                log.warn("Unknown decision tool '{}', treating as NOOP", tool);
                yield MemoryDecision.noop("Unknown tool: " + tool);
            }
        };
    }

    private String buildPrompt(CandidateFact candidate, List<SimilarRecord> similar) {
        StringBuilder sb = new StringBuilder();
        sb.append("New fact:\n")
                .append("  subject: ").append(candidate.getSubjectName()).append('\n')
                .append("  kind: ").append(candidate.getKind()).append('\n')
                .append("  content: ").append(candidate.getContent()).append('\n');
        if (candidate.getPredicate() != null) {
            sb.append("  relation: ").append(candidate.getPredicate())
                    .append(" -> ").append(candidate.getObject()).append('\n');
        }
        if (candidate.isHistorical()) {
            sb.append("  (describes the past)\n");
        }

        if (similar.isEmpty()) {
            sb.append("\nNo similar memories exist.\n");
            return sb.toString();
        }
        sb.append("\nSimilar existing memories:\n");
        for (SimilarRecord s : similar) {
            MemoryRecord r = s.record();
            sb.append(String.format("- id=%s similarity=%.2f subject=%s%s: %s%n",
                    r.getId(), s.similarity(), r.getSubjectName(),
                    r.isHistorical() ? " (historical)" : "", r.getContent()));
        }
        return sb.toString();
    }
}
