package com.deepansh.memory.model;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
public class JobRequest {

    /** Null runs the job across every owner. */
    private String ownerId;

    @NotNull(message = "jobType is required")
    private JobType jobType;

    private Map<String, Object> payload = new HashMap<>();

    private Instant scheduledFor;

    private String dependsOn;
}
