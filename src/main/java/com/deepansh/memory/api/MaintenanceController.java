package com.deepansh.memory.api;

import com.deepansh.memory.exception.RecordNotFoundException;
import com.deepansh.memory.maintenance.JobQueue;
import com.deepansh.memory.model.JobRequest;
import com.deepansh.memory.model.MaintenanceJob;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * POST /api/v1/maintenance/jobs              enqueue a job (ownerId optional)
 * GET  /api/v1/maintenance/jobs/{id}         job status and result
 * GET  /api/v1/maintenance/{ownerId}/jobs    an owner's jobs, newest first
 * GET  /api/v1/maintenance/jobs/failed       jobs that exhausted their attempts
 */
@RestController
@RequestMapping("/api/v1/maintenance")
@RequiredArgsConstructor
@Slf4j
public class MaintenanceController {

    private final JobQueue jobQueue;

    @PostMapping("/jobs")
    public ResponseEntity<Map<String, String>> enqueue(@Valid @RequestBody JobRequest request) {
        String jobId = jobQueue.enqueue(request.getOwnerId(), request.getJobType(),
                request.getPayload(), request.getScheduledFor(), request.getDependsOn());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("jobId", jobId));
    }

    @GetMapping("/jobs/failed")
    public ResponseEntity<List<MaintenanceJob>> failedJobs() {
        return ResponseEntity.ok(jobQueue.findFailed());
    }

    @GetMapping("/jobs/{id}")
    public ResponseEntity<MaintenanceJob> getJob(@PathVariable String id) {
        return ResponseEntity.ok(jobQueue.findById(id)
                .orElseThrow(() -> new RecordNotFoundException("Maintenance job", id)));
    }

    @GetMapping("/{ownerId}/jobs")
    public ResponseEntity<List<MaintenanceJob>> ownerJobs(@PathVariable String ownerId) {
        return ResponseEntity.ok(jobQueue.findByOwner(ownerId));
    }
}
