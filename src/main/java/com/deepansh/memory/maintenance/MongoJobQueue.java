package com.deepansh.memory.maintenance;

import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.model.JobStatus;
import com.deepansh.memory.model.JobType;
import com.deepansh.memory.model.MaintenanceJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Claim = findAndModify(status PENDING -> RUNNING) on one eligible job id, so two
 * workers polling at once never run the same job.
 */
@Repository
@ConditionalOnProperty(name = "memory.store.backend", havingValue = "mongo", matchIfMissing = true)
@Slf4j
public class MongoJobQueue implements JobQueue {

    /** Due jobs examined per claim; blocked ones (waiting on a dependency) are skipped. */
    private static final int CLAIM_SCAN = 20;

    private final MongoTemplate mongoTemplate;
    private final MemoryProperties props;
    private final Clock clock;

    public MongoJobQueue(MongoTemplate mongoTemplate, MemoryProperties props, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public String enqueue(String ownerId, JobType jobType, Map<String, Object> payload,
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
        mongoTemplate.insert(job);
        log.info("Enqueued job {} [id={}] owner={} dependsOn={}", jobType, job.getId(), ownerId, dependsOn);
        return job.getId();
    }

    @Override
    public Optional<MaintenanceJob> claimNext(Instant now) {
        List<MaintenanceJob> due = mongoTemplate.find(new Query(Criteria.where("status").is(JobStatus.PENDING)
                        .and("scheduledFor").lte(now))
                .with(Sort.by("scheduledFor", "createdAt"))
                .limit(CLAIM_SCAN), MaintenanceJob.class);

        for (MaintenanceJob candidate : due) {
            JobStatus dependency = dependencyStatus(candidate);
            if (dependency == JobStatus.FAILED) {
                fail(candidate.getId(), "Dependency " + candidate.getDependsOn() + " failed");
                continue;
            }
            if (dependency != JobStatus.DONE) continue;

            MaintenanceJob claimed = mongoTemplate.findAndModify(
                    new Query(Criteria.where("_id").is(candidate.getId()).and("status").is(JobStatus.PENDING)),
                    new Update().set("status", JobStatus.RUNNING).set("startedAt", now).inc("attempts", 1),
                    FindAndModifyOptions.options().returnNew(true),
                    MaintenanceJob.class);
            if (claimed != null) {
                log.debug("Claimed job {} [id={}] attempt={}", claimed.getJobType(), claimed.getId(), claimed.getAttempts());
                return Optional.of(claimed);
            }
        }
        return Optional.empty();
    }

    /** DONE when there is no dependency (or it was purged). */
    private JobStatus dependencyStatus(MaintenanceJob job) {
        if (job.getDependsOn() == null) return JobStatus.DONE;
        MaintenanceJob dep = mongoTemplate.findById(job.getDependsOn(), MaintenanceJob.class);
        return dep == null ? JobStatus.DONE : dep.getStatus();
    }

    @Override
    public void complete(String jobId, Map<String, Object> result) {
        mongoTemplate.updateFirst(byId(jobId), new Update()
                .set("status", JobStatus.DONE)
                .set("result", result)
                .set("completedAt", clock.instant()), MaintenanceJob.class);
    }

    @Override
    public void retryLater(String jobId, String error, Instant at) {
        mongoTemplate.updateFirst(byId(jobId), new Update()
                .set("status", JobStatus.PENDING)
                .set("lastError", error)
                .set("scheduledFor", at), MaintenanceJob.class);
    }

    @Override
    public void fail(String jobId, String error) {
        mongoTemplate.updateFirst(byId(jobId), new Update()
                .set("status", JobStatus.FAILED)
                .set("lastError", error)
                .set("completedAt", clock.instant()), MaintenanceJob.class);
    }

    @Override
    public Optional<MaintenanceJob> findById(String jobId) {
        return Optional.ofNullable(mongoTemplate.findById(jobId, MaintenanceJob.class));
    }

    @Override
    public List<MaintenanceJob> findByOwner(String ownerId) {
        return mongoTemplate.find(new Query(Criteria.where("ownerId").is(ownerId))
                .with(Sort.by(Sort.Direction.DESC, "createdAt")), MaintenanceJob.class);
    }

    @Override
    public List<MaintenanceJob> findFailed() {
        return mongoTemplate.find(new Query(Criteria.where("status").is(JobStatus.FAILED))
                .with(Sort.by(Sort.Direction.DESC, "completedAt")), MaintenanceJob.class);
    }

    @Override
    public boolean hasPending(String ownerId, JobType jobType) {
        return mongoTemplate.exists(new Query(Criteria.where("ownerId").is(ownerId)
                .and("jobType").is(jobType)
                .and("status").in(JobStatus.PENDING, JobStatus.RUNNING)), MaintenanceJob.class);
    }

    private Query byId(String jobId) {
        return new Query(Criteria.where("_id").is(jobId));
    }
}
