package com.deepansh.memory.llm;

import com.deepansh.memory.model.LlmResponse;
import com.deepansh.memory.model.Message;

import java.util.List;

public interface LlmClient {

    /**
     * Single-shot completion.
     *
     * @param messages  system + user prompt
     * @param tools     tool schemas the model may select; empty for plain text/JSON answers
     * @return either a text answer or the selected ToolCall
     */
    LlmResponse chat(List<Message> messages, List<ToolDefinition> tools);
}
