package com.deepansh.memory.llm;

import com.deepansh.memory.exception.LlmClientException;
import com.deepansh.memory.model.LlmResponse;
import com.deepansh.memory.model.Message;
import com.deepansh.memory.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenAI-compatible chat client (OpenAI, Groq, Gemini compat endpoint).
 *
 * Error handling:
 *
 * | Error                  | Action                                             |
 * |------------------------|----------------------------------------------------|
 * | 401 / other 4xx        | LlmClientException (not retried, not a CB failure) |
 * | 400 tool_use_failed    | Recover tool call from failed_generation           |
 * | 429                    | RuntimeException (retried)                         |
 * | 5xx                    | RuntimeException (retried, counts as failure)      |
 * | network error          | ResourceAccessException (retried)                  |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    // Groq sometimes emits <function=name({...})</function> or <function=name{...}></function>
    private static final Pattern XML_TOOL_PATTERN =
            Pattern.compile("<function=(\\w+)\\(?(\\{.+?\\})\\)?(?:</function>|>)", Pattern.DOTALL);

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            ObjectMapper objectMapper,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        Map<String, Object> requestBody = buildRequestBody(messages, tools);
        String provider = props.getProvider();

        log.debug("Sending {} messages and {} tools to {} [model={}]",
                messages.size(), tools.size(), provider, props.getModel());

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", provider, res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", provider, res.getStatusCode(), body);
                        throw new RuntimeException(
                                provider + " server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});

            return parseResponse(response);

        } catch (ToolUseFailedException e) {
            return recoverFromToolUseFailure(e.getErrorBody());
        }
    }

    private void handle4xxError(String body, int statusCode) {
        if (body.contains("tool_use_failed")) {
            throw new ToolUseFailedException(body);
        }
        if (statusCode == 401) {
            throw new LlmClientException(props.getProvider() + " API key is invalid. Check LLM_API_KEY.");
        }
        if (statusCode == 429) {
            throw new RuntimeException(props.getProvider() + " rate limit exceeded. Will retry.");
        }
        if (body.contains("model_decommissioned") || body.contains("model_not_found")) {
            throw new LlmClientException("Model '" + props.getModel() + "' is not available. Set LLM_MODEL.");
        }
        throw new LlmClientException(props.getProvider() + " client error [" + statusCode + "]: " + body);
    }

    /**
     * The provider rejected its own malformed tool call but returned the raw
     * generation; parse the XML-ish form and hand back a normal ToolCall.
     * Unrecoverable generations become a plain-text answer, which the decision
     * client reads as "no tool selected".
     */
    @SuppressWarnings("unchecked")
    private LlmResponse recoverFromToolUseFailure(String errorBody) {
        try {
            Map<String, Object> errorMap = objectMapper.readValue(errorBody, new TypeReference<>() {});
            Map<String, Object> error = (Map<String, Object>) errorMap.get("error");
            String failedGeneration = error == null ? null : (String) error.get("failed_generation");

            if (failedGeneration == null || failedGeneration.isBlank()) {
                log.warn("tool_use_failed with no failed_generation, cannot recover");
                return plainText("");
            }

            Matcher matcher = XML_TOOL_PATTERN.matcher(failedGeneration);
            if (!matcher.find()) {
                log.warn("Could not parse tool call from failed_generation: {}", failedGeneration);
                return plainText("");
            }

            Map<String, Object> args = objectMapper.readValue(matcher.group(2), new TypeReference<>() {});
            log.info("Recovered malformed tool call: tool={}", matcher.group(1));

            return LlmResponse.builder()
                    .toolCallRequired(true)
                    .toolCall(ToolCall.builder()
                            .id("recovered-" + UUID.randomUUID().toString().substring(0, 8))
                            .toolName(matcher.group(1))
                            .arguments(args)
                            .build())
                    .build();

        } catch (JsonProcessingException e) {
            log.error("Failed to recover from tool_use_failed: {}", e.getMessage());
            return plainText("");
        }
    }

    private LlmResponse plainText(String content) {
        return LlmResponse.builder().toolCallRequired(false).content(content).build();
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, List<ToolDefinition> tools) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(m -> Map.<String, Object>of(
                        "role", m.getRole().name(),
                        "content", m.getContent() != null ? m.getContent() : ""))
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", formattedMessages);

        if (!tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            // Decision calls must pick exactly one tool
            body.put("tool_choice", "required");
        }
        return body;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = response == null ? null
                : (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new RuntimeException(props.getProvider() + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        List<Map<String, Object>> toolCalls = message == null ? null
                : (List<Map<String, Object>>) message.get("tool_calls");

        if (toolCalls != null && !toolCalls.isEmpty()) {
            Map<String, Object> first    = toolCalls.get(0);
            Map<String, Object> function = (Map<String, Object>) first.get("function");

            Map<String, Object> args;
            try {
                args = objectMapper.readValue((String) function.get("arguments"), new TypeReference<>() {});
            } catch (JsonProcessingException e) {
                throw new LlmClientException("Failed to parse tool arguments", e);
            }

            return LlmResponse.builder()
                    .toolCallRequired(true)
                    .promptTokens(promptTokens)
                    .completionTokens(completionTokens)
                    .toolCall(ToolCall.builder()
                            .id((String) first.get("id"))
                            .toolName((String) function.get("name"))
                            .arguments(args)
                            .build())
                    .build();
        }

        return LlmResponse.builder()
                .toolCallRequired(false)
                .content(message == null ? null : (String) message.get("content"))
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    private static class ToolUseFailedException extends RuntimeException {
        private final String errorBody;

        ToolUseFailedException(String errorBody) {
            super("tool_use_failed");
            this.errorBody = errorBody;
        }

        String getErrorBody() {
            return errorBody;
        }
    }
}
