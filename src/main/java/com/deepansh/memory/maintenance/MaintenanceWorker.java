package com.deepansh.memory.maintenance;

import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.exception.JobFailedException;
import com.deepansh.memory.model.MaintenanceJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Polls the job queue and runs claimed jobs on the maintenance pool.
 *
 * Failure handling: the attempt is already counted by the claim. Below
 * maxAttempts the job goes back to PENDING, scheduled
 * backoffBase * 2^(attempts-1) later (capped at backoffMax). At maxAttempts
 * it is FAILED and logged at ERROR.
 */
@Component
@Slf4j
public class MaintenanceWorker {

    private final JobQueue jobQueue;
    private final MaintenanceJobRegistry registry;
    private final Executor executor;
    private final MemoryProperties props;
    private final Clock clock;

    public MaintenanceWorker(JobQueue jobQueue,
                             MaintenanceJobRegistry registry,
                             @Qualifier("maintenanceTaskExecutor") Executor executor,
                             MemoryProperties props,
                             Clock clock) {
        this.jobQueue = jobQueue;
        this.registry = registry;
        this.executor = executor;
        this.props = props;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${memory.maintenance.poll-interval-ms:5000}")
    public void poll() {
        if (!props.getMaintenance().isEnabled()) return;

        for (int i = 0; i < props.getMaintenance().getBatchSize(); i++) {
            Optional<MaintenanceJob> claimed = jobQueue.claimNext(clock.instant());
            if (claimed.isEmpty()) return;
            MaintenanceJob job = claimed.get();
            try {
                executor.execute(() -> run(job));
            } catch (RejectedExecutionException e) {
                log.warn("Maintenance pool saturated, deferring job [id={}]", job.getId());
                jobQueue.retryLater(job.getId(), "executor saturated", clock.instant());
                return;
            }
        }
    }

    /** Runs one claimed job to DONE, back to PENDING, or FAILED. */
    public void run(MaintenanceJob job) {
        long start = System.currentTimeMillis();
        log.info("Running job {} [id={}] owner={} attempt={}/{}",
                job.getJobType(), job.getId(), job.getOwnerId(), job.getAttempts(), job.getMaxAttempts());
        try {
            MaintenanceJobHandler handler = registry.find(job.getJobType())
                    .orElseThrow(() -> new IllegalStateException("No handler for job type " + job.getJobType()));
            Map<String, Object> result = handler.handle(job);
            jobQueue.complete(job.getId(), result);
            log.info("Job {} [id={}] done in {}ms: {}",
                    job.getJobType(), job.getId(), System.currentTimeMillis() - start, result);
        } catch (RuntimeException e) {
            onFailure(job, e);
        }
    }

    private void onFailure(MaintenanceJob job, RuntimeException cause) {
        int maxAttempts = job.getMaxAttempts() > 0 ? job.getMaxAttempts() : props.getMaintenance().getMaxAttempts();
        if (job.getAttempts() >= maxAttempts) {
            JobFailedException failed = new JobFailedException(job.getId(), job.getJobType(), job.getAttempts(), cause);
            log.error(failed.getMessage(), cause);
            jobQueue.fail(job.getId(), cause.getMessage());
            return;
        }
        Instant next = clock.instant().plus(backoff(job.getAttempts()));
        log.warn("Job {} [id={}] attempt {} failed, retrying at {}: {}",
                job.getJobType(), job.getId(), job.getAttempts(), next, cause.getMessage());
        jobQueue.retryLater(job.getId(), cause.getMessage(), next);
    }

    Duration backoff(int attempts) {
        Duration base = props.getMaintenance().getBackoffBase();
        Duration max = props.getMaintenance().getBackoffMax();
        int exponent = Math.max(0, Math.min(attempts - 1, 20));
        Duration delay = base.multipliedBy(1L << exponent);
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
