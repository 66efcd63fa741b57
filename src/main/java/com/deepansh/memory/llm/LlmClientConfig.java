package com.deepansh.memory.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Builds the raw provider client. ResilientLlmClient wraps it and is the
 * @Primary LlmClient the adapters receive.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Bean("providerLlmClient")
    public LlmClient providerLlmClient(LlmProviderProperties props,
                                       ObjectMapper objectMapper,
                                       RestClient.Builder builder) {
        log.info("================================================================");
        log.info("  LLM provider : {}", props.getProvider().toUpperCase());
        log.info("  Model        : {}", props.getModel());
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            log.error("  LLM API key not set! Set env var LLM_API_KEY");
        }
        log.info("================================================================");
        return new GenericLlmClient(props, objectMapper, builder.clone());
    }
}
