package com.deepansh.memory.exception;

import com.deepansh.memory.model.JobType;
import lombok.Getter;

/**
 * A maintenance job exhausted its attempts. Surfaced to operators, not retried.
 */
@Getter
public class JobFailedException extends MemoryException {

    private final String jobId;
    private final JobType jobType;

    public JobFailedException(String jobId, JobType jobType, int attempts, Throwable cause) {
        super("Job " + jobType + " [id=" + jobId + "] failed after " + attempts + " attempts: "
                + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.jobId = jobId;
        this.jobType = jobType;
    }
}
