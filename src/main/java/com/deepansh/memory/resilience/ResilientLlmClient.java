package com.deepansh.memory.resilience;

import com.deepansh.memory.exception.LlmUnavailableException;
import com.deepansh.memory.llm.LlmClient;
import com.deepansh.memory.llm.ToolDefinition;
import com.deepansh.memory.model.LlmResponse;
import com.deepansh.memory.model.Message;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the provider client that adds retry + circuit breaker.
 *
 * Unlike a chat front end there is no useful text to fall back to: every
 * caller (extraction, decision, summarizer, sufficiency judge) needs a real
 * answer or nothing. The fallbacks therefore throw LlmUnavailableException
 * and each adapter degrades in its own way (empty extraction, requeued
 * decision, retried job, heuristic judge).
 *
 * Instance "llmClient" is configured in application.yml.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("providerLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "llmClient", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "llmClient", fallbackMethod = "circuitBreakerFallback")
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        return delegate.chat(messages, tools);
    }

    public LlmResponse retryFallback(List<Message> messages, List<ToolDefinition> tools, Exception ex) {
        log.error("LLM call failed after all retries: {}", ex.getMessage());
        throw new LlmUnavailableException("LLM call failed after retries", ex);
    }

    public LlmResponse circuitBreakerFallback(List<Message> messages, List<ToolDefinition> tools, Exception ex) {
        log.error("LLM circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        throw new LlmUnavailableException("LLM circuit breaker open", ex);
    }
}
