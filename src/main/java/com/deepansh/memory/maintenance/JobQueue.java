package com.deepansh.memory.maintenance;

import com.deepansh.memory.model.JobType;
import com.deepansh.memory.model.MaintenanceJob;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable queue of maintenance jobs.
 *
 * A job is claimed by at most one worker (PENDING to RUNNING is atomic), only
 * once its scheduledFor has passed and its dependsOn job is DONE. A job whose
 * dependency FAILED fails with it. Claiming counts an attempt.
 */
public interface JobQueue {

    /** @param scheduledFor null for "now" */
    String enqueue(String ownerId, JobType jobType, Map<String, Object> payload,
                   Instant scheduledFor, String dependsOn);

    Optional<MaintenanceJob> claimNext(Instant now);

    void complete(String jobId, Map<String, Object> result);

    /** RUNNING back to PENDING, not before {@code at}. */
    void retryLater(String jobId, String error, Instant at);

    void fail(String jobId, String error);

    Optional<MaintenanceJob> findById(String jobId);

    List<MaintenanceJob> findByOwner(String ownerId);

    List<MaintenanceJob> findFailed();

    /** PENDING or RUNNING job of the type exists for the owner. */
    boolean hasPending(String ownerId, JobType jobType);
}
