package com.deepansh.memory.maintenance.handler;

import com.deepansh.memory.config.MemoryProperties;
import com.deepansh.memory.exception.SlotConflictException;
import com.deepansh.memory.maintenance.MaintenanceJobHandler;
import com.deepansh.memory.model.Importance;
import com.deepansh.memory.model.JobType;
import com.deepansh.memory.model.MaintenanceJob;
import com.deepansh.memory.model.MemoryKind;
import com.deepansh.memory.model.MemoryRecord;
import com.deepansh.memory.store.MemoryStore;
import com.deepansh.memory.store.RecordPatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Exponential importance decay:
 *
 *   decayed = max(floor, baseImportance * 0.5^(ageDays / halfLife(kind)))
 *
 * The age anchor is the last access (or creation). Events hold their value
 * until their date and then fade on a short half-life. Importance is only
 * ever lowered here; access raises it again.
 */
@Component
@Slf4j
public class DecayHandler implements MaintenanceJobHandler {

    private static final double EPSILON = 1e-9;
    private static final double MILLIS_PER_DAY = 86_400_000d;

    private final MemoryStore store;
    private final MemoryProperties props;
    private final Clock clock;

    public DecayHandler(MemoryStore store, MemoryProperties props, Clock clock) {
        this.store = store;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public JobType type() {
        return JobType.DECAY;
    }

    @Override
    public Map<String, Object> handle(MaintenanceJob job) {
        Instant now = clock.instant();
        int examined = 0;
        int decayed = 0;
        for (String ownerId : owners(job, store)) {
            for (MemoryRecord record : store.findActive(ownerId)) {
                examined++;
                Double next = decayedImportance(record, now);
                if (next == null || next >= record.getImportance() - EPSILON) continue;
                try {
                    store.update(record.getId(), RecordPatch.builder().importance(next).build());
                    decayed++;
                } catch (SlotConflictException e) {
                    log.debug("Record [id={}] changed during decay, skipping", record.getId());
                }
            }
        }
        log.info("Decay examined {} records, lowered {}", examined, decayed);
        return Map.of("examined", examined, "decayed", decayed);
    }

    /** New importance, or null when the record is exempt right now. */
    Double decayedImportance(MemoryRecord record, Instant now) {
        MemoryProperties.Decay cfg = props.getDecay();
        if (record.isPinned() && record.getBaseImportance() >= Importance.CRITICAL) return null;

        Instant lastAccess = record.getLastAccessedAt();
        if (lastAccess != null && lastAccess.isAfter(now.minus(cfg.getRecentAccessWindow()))) return null;

        Instant anchor;
        double halfLife;
        if (record.getKind() == MemoryKind.EVENT && record.getEffectiveFrom() != null) {
            if (record.getEffectiveFrom().isAfter(now)) return null;
            anchor = lastAccess != null && lastAccess.isAfter(record.getEffectiveFrom())
                    ? lastAccess : record.getEffectiveFrom();
            halfLife = cfg.getEventHalfLifeDays();
        } else {
            anchor = lastAccess != null ? lastAccess : record.getCreatedAt();
            halfLife = cfg.halfLifeFor(record.getKind());
        }
        if (anchor == null || halfLife <= 0) return null;

        double ageDays = Duration.between(anchor, now).toMillis() / MILLIS_PER_DAY;
        if (ageDays <= 0) return null;

        double floor = record.isPinned() ? Math.max(cfg.getPinnedFloor(), cfg.getFloor()) : cfg.getFloor();
        return Math.max(floor, record.getBaseImportance() * Math.pow(0.5, ageDays / halfLife));
    }
}
