package com.deepansh.memory.api;

import com.deepansh.memory.audit.AuditLog;
import com.deepansh.memory.model.MemoryOperation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * GET /api/v1/audit/{ownerId}?limit=50      newest decisions first
 * GET /api/v1/audit/records/{recordId}      every decision that touched the record
 */
@RestController
@RequestMapping("/api/v1/audit")
@RequiredArgsConstructor
public class AuditController {

    private static final int MAX_LIMIT = 500;

    private final AuditLog auditLog;

    @GetMapping("/{ownerId}")
    public ResponseEntity<List<MemoryOperation>> byOwner(
            @PathVariable String ownerId,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(auditLog.findByOwner(ownerId, Math.max(1, Math.min(limit, MAX_LIMIT))));
    }

    @GetMapping("/records/{recordId}")
    public ResponseEntity<List<MemoryOperation>> byRecord(@PathVariable String recordId) {
        return ResponseEntity.ok(auditLog.findByRecord(recordId));
    }
}
