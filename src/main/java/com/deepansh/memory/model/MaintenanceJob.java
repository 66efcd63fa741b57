package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Durable unit of background work.
 *
 * Collection: maintenance_jobs
 *
 * Claiming is a single findAndModify from PENDING to RUNNING, so a job is
 * picked up by at most one worker. dependsOn holds back a job until the
 * referenced job is DONE.
 */
@Document(collection = "maintenance_jobs")
@CompoundIndexes({
    @CompoundIndex(name = "idx_status_schedule", def = "{'status': 1, 'scheduledFor': 1, 'createdAt': 1}"),
    @CompoundIndex(name = "idx_owner_type", def = "{'ownerId': 1, 'jobType': 1, 'status': 1}")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceJob {

    @Id
    private String id;

    private String ownerId;

    private JobType jobType;

    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    private int attempts;

    private int maxAttempts;

    private Instant scheduledFor;

    private String dependsOn;

    private String lastError;

    private Map<String, Object> result;

    private Instant createdAt;

    private Instant startedAt;

    private Instant completedAt;

    public boolean payloadFlag(String key) {
        Object value = payload == null ? null : payload.get(key);
        if (value instanceof Boolean b) return b;
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public String payloadString(String key) {
        Object value = payload == null ? null : payload.get(key);
        return value == null ? null : value.toString();
    }
}
