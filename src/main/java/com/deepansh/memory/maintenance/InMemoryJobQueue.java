package com.deepansh.memory.maintenance;

import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.model.JobStatus;
import com.deepansh.memory.model.JobType;
import com.deepansh.memory.model.MaintenanceJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Single-process queue; all state changes happen under the instance monitor.
 */
@Component
@ConditionalOnProperty(name = "memory.store.backend", havingValue = "in-memory")
@Slf4j
public class InMemoryJobQueue implements JobQueue {

    private final Map<String, MaintenanceJob> jobs = new LinkedHashMap<>();
    private final MemoryProperties props;
    private final Clock clock;

    public InMemoryJobQueue(MemoryProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    @Override
    public synchronized String enqueue(String ownerId, JobType jobType, Map<String, Object> payload,
                                       Instant scheduledFor, String dependsOn) {
        Instant now = clock.instant();
        MaintenanceJob job = MaintenanceJob.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .jobType(jobType)
                .payload(payload == null ? new HashMap<>() : new HashMap<>(payload))
                .maxAttempts(props.getMaintenance().getMaxAttempts())
                .scheduledFor(scheduledFor == null ? now : scheduledFor)
                .dependsOn(dependsOn)
                .createdAt(now)
                .build();
        jobs.put(job.getId(), job);
        log.info("Enqueued job {} [id={}] owner={} dependsOn={}", jobType, job.getId(), ownerId, dependsOn);
        return job.getId();
    }

    @Override
    public synchronized Optional<MaintenanceJob> claimNext(Instant now) {
        List<MaintenanceJob> due = jobs.values().stream()
                .filter(j -> j.getStatus() == JobStatus.PENDING && !j.getScheduledFor().isAfter(now))
                .sorted(Comparator.comparing(MaintenanceJob::getScheduledFor)
                        .thenComparing(MaintenanceJob::getCreatedAt))
                .toList();

        for (MaintenanceJob candidate : due) {
            MaintenanceJob dep = candidate.getDependsOn() == null ? null : jobs.get(candidate.getDependsOn());
            if (dep != null && dep.getStatus() == JobStatus.FAILED) {
                fail(candidate.getId(), "Dependency " + candidate.getDependsOn() + " failed");
                continue;
            }
            if (dep != null && dep.getStatus() != JobStatus.DONE) continue;

            MaintenanceJob claimed = change(candidate.getId(), j -> j.toBuilder()
                    .status(JobStatus.RUNNING)
                    .startedAt(now)
                    .attempts(j.getAttempts() + 1)
                    .build());
            return Optional.of(claimed);
        }
        return Optional.empty();
    }

    @Override
    public synchronized void complete(String jobId, Map<String, Object> result) {
        change(jobId, j -> j.toBuilder().status(JobStatus.DONE).result(result).completedAt(clock.instant()).build());
    }

    @Override
    public synchronized void retryLater(String jobId, String error, Instant at) {
        change(jobId, j -> j.toBuilder().status(JobStatus.PENDING).lastError(error).scheduledFor(at).build());
    }

    @Override
    public synchronized void fail(String jobId, String error) {
        change(jobId, j -> j.toBuilder().status(JobStatus.FAILED).lastError(error).completedAt(clock.instant()).build());
    }

    @Override
    public synchronized Optional<MaintenanceJob> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(this::copy);
    }

    @Override
    public synchronized List<MaintenanceJob> findByOwner(String ownerId) {
        return jobs.values().stream()
                .filter(j -> Objects.equals(ownerId, j.getOwnerId()))
                .sorted(Comparator.comparing(MaintenanceJob::getCreatedAt).reversed())
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized List<MaintenanceJob> findFailed() {
        return jobs.values().stream()
                .filter(j -> j.getStatus() == JobStatus.FAILED)
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized boolean hasPending(String ownerId, JobType jobType) {
        return jobs.values().stream().anyMatch(j -> Objects.equals(ownerId, j.getOwnerId())
                && j.getJobType() == jobType
                && (j.getStatus() == JobStatus.PENDING || j.getStatus() == JobStatus.RUNNING));
    }

    private MaintenanceJob change(String jobId, UnaryOperator<MaintenanceJob> mutation) {
        MaintenanceJob updated = jobs.computeIfPresent(jobId, (id, j) -> mutation.apply(j));
        return updated == null ? null : copy(updated);
    }

    private MaintenanceJob copy(MaintenanceJob job) {
        return job.toBuilder().payload(job.getPayload() == null ? new HashMap<>() : new HashMap<>(job.getPayload())).build();
    }
}
