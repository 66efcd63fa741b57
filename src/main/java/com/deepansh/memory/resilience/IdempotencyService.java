package com.deepansh.memory.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-based idempotency for observation ingestion.
 *
 * A client retrying a POST after a timeout must not feed the same text through
 * extraction twice: the second pass would usually NOOP, but it still costs LLM
 * calls and audit rows. Clients send Idempotency-Key; the first request claims
 * it with SET NX, stores the result, and repeats get the cached result.
 *
 * Key pattern: memory:idempotency:{key}, TTL 24h.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "memory:idempotency:";
    private static final Duration TTL = Duration.ofHours(24);
    private static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;

    public IdempotencyService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Cached response JSON for a completed request, empty when the key is new
     * or still in flight.
     */
    public Optional<String> getCachedResponse(String idempotencyKey) {
        String existing = redisTemplate.opsForValue().get(buildKey(idempotencyKey));
        if (existing == null) {
            return Optional.empty();
        }
        if (IN_FLIGHT_SENTINEL.equals(existing)) {
            log.warn("Idempotency key {} is in-flight", idempotencyKey);
            return Optional.empty();
        }
        log.info("Idempotency hit for key={}", idempotencyKey);
        return Optional.of(existing);
    }

    /** SET NX claim. False means another request holds the key. */
    public boolean claimKey(String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue()
                .setIfAbsent(buildKey(idempotencyKey), IN_FLIGHT_SENTINEL, TTL);
        return Boolean.TRUE.equals(claimed);
    }

    public void storeResponse(String idempotencyKey, String responseJson) {
        redisTemplate.opsForValue().set(buildKey(idempotencyKey), responseJson, TTL);
        log.debug("Stored idempotency response for key={}", idempotencyKey);
    }

    /** Release after a failure so the client can retry. */
    public void releaseKey(String idempotencyKey) {
        redisTemplate.delete(buildKey(idempotencyKey));
        log.debug("Released idempotency key={}", idempotencyKey);
    }

    private String buildKey(String idempotencyKey) {
        return KEY_PREFIX + idempotencyKey;
    }
}
