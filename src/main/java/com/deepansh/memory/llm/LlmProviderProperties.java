package com.deepansh.memory.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * The OpenAI-compatible chat provider (OpenAI, Groq, Gemini's compat endpoint).
 * Bound from application.yml under "llm".
 */
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProviderProperties {
    private String provider = "openai";
    private String apiKey;
    private String baseUrl = "https://api.openai.com/v1";
    private String model = "gpt-4o-mini";
    private int maxTokens = 1024;
    private double temperature = 0.1;
}
