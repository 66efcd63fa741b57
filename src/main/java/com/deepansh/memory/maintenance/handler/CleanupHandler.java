package com.deepansh.memory.maintenance.handler;

import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.maintenance.MaintenanceJobHandler;
import com.deepansh.memory.model.ArchivedReason;
import com.deepansh.memory.model.JobType;
import com.deepansh.memory.model.MaintenanceJob;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.store.MemoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Archives expired records and records that are both unimportant and unused.
 * Archived records stay readable through history; nothing is physically removed.
 */
@Component
@Slf4j
public class CleanupHandler implements MaintenanceJobHandler {

    private final MemoryStore store;
    private final MemoryProperties props;
    private final Clock clock;

    public CleanupHandler(MemoryStore store, MemoryProperties props, Clock clock) {
        this.store = store;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public JobType type() {
        return JobType.CLEANUP;
    }

    @Override
    public Map<String, Object> handle(MaintenanceJob job) {
        Instant now = clock.instant();
        Instant unusedBefore = now.minus(props.getCleanup().getUnusedAfter());
        int expired = 0;
        int unused = 0;

        for (String ownerId : owners(job, store)) {
            for (MemoryRecord record : store.findActive(ownerId)) {
                if (record.getExpiresAt() != null && record.getExpiresAt().isBefore(now)) {
                    store.softDelete(record.getId(), ArchivedReason.EXPIRED);
                    expired++;
                } else if (isUnused(record, unusedBefore)) {
                    store.softDelete(record.getId(), ArchivedReason.UNUSED);
                    unused++;
                }
            }
        }
        log.info("Cleanup archived {} expired and {} unused records", expired, unused);
        return Map.of("expired", expired, "unused", unused);
    }

    private boolean isUnused(MemoryRecord record, Instant unusedBefore) {
        if (record.isPinned()) return false;
        if (record.getImportance() >= props.getCleanup().getLowImportance()) return false;
        Instant lastTouch = record.getLastAccessedAt() != null ? record.getLastAccessedAt() : record.getCreatedAt();
        return lastTouch != null && lastTouch.isBefore(unusedBefore);
    }
}
