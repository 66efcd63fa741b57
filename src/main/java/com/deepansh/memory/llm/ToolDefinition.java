package com.deepansh.memory.llm;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Schema of one tool offered to the model.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    /**
     * Convenience for the flat object schemas used by the decision tools.
     */
    public static ToolDefinition of(String name, String description,
                                    Map<String, Object> properties, List<String> required) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", required))
                .build();
    }

    /**
     * OpenAI tool format: { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", inputSchema
                )
        );
    }
}
