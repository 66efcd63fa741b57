package com.deepansh.memory.api;

import com.deepansh.memory.decision.IngestResult;
import com.deepansh.memory.decision.ObservationService;
import com.deepansh.memory.model.ObservationRequest;
import com.deepansh.memory.resilience.IdempotencyService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * Write path entry point.
 *
 * POST /api/v1/observations/{ownerId}
 *   Optional header: Idempotency-Key: <uuid>
 *   If provided, a repeat within 24h returns the first result instead of
 *   extracting again.
 *   Body "async": true hands the observation to the decision pool and returns 202.
 */
@RestController
@RequestMapping("/api/v1/observations")
@RequiredArgsConstructor
@Slf4j
public class ObservationController {

    private final ObservationService observationService;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @PostMapping("/{ownerId}")
    public ResponseEntity<?> observe(
            @PathVariable String ownerId,
            @Valid @RequestBody ObservationRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        log.info("Observation received [owner={}, length={}, async={}, idempotencyKey={}]",
                ownerId, request.getText().length(), request.isAsync(), idempotencyKey);

        if (request.isAsync()) {
            String sourceId = request.getSourceId() != null ? request.getSourceId() : UUID.randomUUID().toString();
            observationService.ingestAsync(ownerId, request.getText(), sourceId);
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(Map.of("status", "ACCEPTED", "sourceId", sourceId));
        }

        boolean keyed = idempotencyKey != null && !idempotencyKey.isBlank();
        if (keyed) {
            var cached = idempotencyService.getCachedResponse(idempotencyKey);
            if (cached.isPresent()) {
                try {
                    return ResponseEntity.ok(objectMapper.readValue(cached.get(), IngestResult.class));
                } catch (JsonProcessingException e) {
                    log.warn("Failed to deserialize cached result, processing fresh", e);
                }
            }
            if (!idempotencyService.claimKey(idempotencyKey)) {
                log.info("Observation with idempotencyKey={} is already in flight", idempotencyKey);
                return ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(Map.of("status", "IN_PROGRESS", "idempotencyKey", idempotencyKey));
            }
        }

        IngestResult result;
        try {
            result = observationService.ingest(ownerId, request.getText(), request.getSourceId());
        } catch (RuntimeException e) {
            // Release so the client can retry
            if (keyed) idempotencyService.releaseKey(idempotencyKey);
            throw e;
        }

        if (keyed) {
            try {
                idempotencyService.storeResponse(idempotencyKey, objectMapper.writeValueAsString(result));
            } catch (JsonProcessingException e) {
                log.warn("Failed to cache idempotency result", e);
            }
        }
        return ResponseEntity.ok(result);
    }
}
