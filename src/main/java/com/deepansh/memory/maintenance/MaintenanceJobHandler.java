package com.deepansh.memory.maintenance;

import com.deepansh.memory.model.JobType;
import com.deepansh.memory.model.MaintenanceJob;
import com.deepansh.memory.store.MemoryStore;

import java.util.List;
import java.util.Map;

/**
 * One maintenance job type. Handlers must be idempotent: a job retried after a
 * partial run must converge to the same store state.
 */
public interface MaintenanceJobHandler {

    JobType type();

    /**
     * Runs the job and returns a small result map for the job record.
     * Throwing marks the attempt failed; the worker retries with backoff.
     */
    Map<String, Object> handle(MaintenanceJob job);

    /** Owners the job covers: its own owner, or every owner when it has none. */
    default List<String> owners(MaintenanceJob job, MemoryStore store) {
        return job.getOwnerId() != null ? List.of(job.getOwnerId()) : store.findOwnerIds();
    }
}
