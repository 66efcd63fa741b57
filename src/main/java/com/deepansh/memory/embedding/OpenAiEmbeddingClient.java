package com.deepansh.memory.embedding;

import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.exception.EmbeddingUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Embeddings via an OpenAI-compatible /embeddings endpoint.
 *
 * Caching: embeddings are deterministic per (model, text), so they are cached
 * in Redis under embed:{model}:{sha256(text)} with a 7 day TTL. Repeated
 * candidates and repeated queries cost no API calls. Cache failures are
 * logged and ignored; Redis being down must not stop embedding.
 *
 * Resilience: instance "embedding" (own retry + circuit breaker, independent of
 * the chat model). The fallback throws EmbeddingUnavailableException.
 */
@Service
@Slf4j
public class OpenAiEmbeddingClient implements EmbeddingClient {

    private static final String CACHE_PREFIX = "embed:";

    private final RestClient restClient;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String model;
    private final Duration cacheTtl;

    public OpenAiEmbeddingClient(
            @Value("${openai.base-url}") String baseUrl,
            @Value("${openai.api-key:}") String apiKey,
            RestClient.Builder restClientBuilder,
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            MemoryProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.model = properties.getEmbedding().getModel();
        this.cacheTtl = properties.getEmbedding().getCacheTtl();
        this.restClient = restClientBuilder.clone()
                .baseUrl(baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    @Retry(name = "embedding", fallbackMethod = "embedFallback")
    @CircuitBreaker(name = "embedding", fallbackMethod = "embedFallback")
    public float[] embed(String text) {
        String cacheKey = CACHE_PREFIX + model + ":" + sha256(text);

        float[] cached = readCache(cacheKey);
        if (cached != null) {
            log.debug("Embedding cache hit for text length={}", text.length());
            return cached;
        }

        float[] embedding = fetchEmbedding(text);
        writeCache(cacheKey, embedding);
        return embedding;
    }

    public float[] embedFallback(String text, Exception ex) {
        log.warn("Embedding unavailable for text length={}: {}", text == null ? 0 : text.length(), ex.getMessage());
        throw new EmbeddingUnavailableException("Embedding provider unavailable", ex);
    }

    @Override
    public String modelName() {
        return model;
    }

    @SuppressWarnings("unchecked")
    private float[] fetchEmbedding(String text) {
        log.debug("Fetching embedding for text length={}", text.length());

        Map<String, Object> response = restClient.post()
                .uri("/embeddings")
                .body(Map.of("model", model, "input", text))
                .retrieve()
                .body(new ParameterizedTypeReference<>() {});

        List<Map<String, Object>> data = response == null ? null : (List<Map<String, Object>>) response.get("data");
        if (data == null || data.isEmpty()) {
            throw new EmbeddingUnavailableException("Embedding response contained no data");
        }
        List<Number> raw = (List<Number>) data.get(0).get("embedding");

        float[] result = new float[raw.size()];
        for (int i = 0; i < raw.size(); i++) {
            result[i] = raw.get(i).floatValue();
        }
        log.debug("Fetched embedding: {} dimensions", result.length);
        return result;
    }

    private float[] readCache(String key) {
        try {
            String cached = redisTemplate.opsForValue().get(key);
            return cached == null ? null : objectMapper.readValue(cached, float[].class);
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Embedding cache read failed, re-fetching: {}", e.getMessage());
            return null;
        }
    }

    private void writeCache(String key, float[] embedding) {
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(embedding), cacheTtl);
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Failed to cache embedding: {}", e.getMessage());
        }
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
