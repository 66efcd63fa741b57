package com.deepansh.memory.maintenance;

import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.model.JobType;
import com.deepansh.memory.store.MemoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Enqueues the periodic maintenance runs for every owner:
 *   daily   DECAY -> CLEANUP
 *   weekly  CONSOLIDATE -> RESUMMARIZE
 *   monthly REINDEX
 * The arrows are dependsOn links, so cleanup sees decayed importances and the
 * summaries are rebuilt from consolidated records.
 */
@Component
@Slf4j
public class MaintenanceScheduler {

    private final JobQueue jobQueue;
    private final MemoryStore store;
    private final MemoryProperties props;

    public MaintenanceScheduler(JobQueue jobQueue, MemoryStore store, MemoryProperties props) {
        this.jobQueue = jobQueue;
        this.store = store;
        this.props = props;
    }

    @Scheduled(cron = "${memory.maintenance.daily-cron:0 0 3 * * *}")
    public void daily() {
        forEachOwner("daily", this::enqueueDaily);
    }

    @Scheduled(cron = "${memory.maintenance.weekly-cron:0 0 4 * * SUN}")
    public void weekly() {
        forEachOwner("weekly", this::enqueueWeekly);
    }

    @Scheduled(cron = "${memory.maintenance.monthly-cron:0 0 5 1 * *}")
    public void monthly() {
        forEachOwner("monthly", ownerId -> List.of(
                jobQueue.enqueue(ownerId, JobType.REINDEX, Map.of(), null, null)));
    }

    public List<String> enqueueDaily(String ownerId) {
        String decay = jobQueue.enqueue(ownerId, JobType.DECAY, Map.of(), null, null);
        String cleanup = jobQueue.enqueue(ownerId, JobType.CLEANUP, Map.of(), null, decay);
        return List.of(decay, cleanup);
    }

    public List<String> enqueueWeekly(String ownerId) {
        String consolidate = jobQueue.enqueue(ownerId, JobType.CONSOLIDATE, Map.of(), null, null);
        String resummarize = jobQueue.enqueue(ownerId, JobType.RESUMMARIZE, Map.of(), null, consolidate);
        return List.of(consolidate, resummarize);
    }

    private void forEachOwner(String cadence, Function<String, List<String>> enqueue) {
        if (!props.getMaintenance().isEnabled()) return;
        List<String> owners = store.findOwnerIds();
        owners.forEach(enqueue::apply);
        log.info("Scheduled {} maintenance for {} owners", cadence, owners.size());
    }
}
