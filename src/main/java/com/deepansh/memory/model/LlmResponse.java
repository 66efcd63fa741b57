package com.deepansh.memory.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LlmResponse {

    /** Non-null when the model answered in text */
    private String content;

    /** Non-null when the model selected a tool */
    private ToolCall toolCall;

    /**
     * Named "toolCallRequired" rather than "isToolCall" so Lombok does not
     * generate an isIsToolCall() getter.
     */
    private boolean toolCallRequired;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;
}
