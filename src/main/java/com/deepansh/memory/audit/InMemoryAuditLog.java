package com.deepansh.memory.audit;

import com.deepansh.memory.model.MemoryOperation;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
@ConditionalOnProperty(name = "memory.store.backend", havingValue = "in-memory")
public class InMemoryAuditLog implements AuditLog {

    private final List<MemoryOperation> entries = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public InMemoryAuditLog(Clock clock) {
        this.clock = clock;
    }

    @Override
    public MemoryOperation append(MemoryOperation operation) {
        if (operation.getId() == null) operation.setId(UUID.randomUUID().toString());
        if (operation.getCreatedAt() == null) operation.setCreatedAt(clock.instant());
        entries.add(operation);
        return operation;
    }

    @Override
    public List<MemoryOperation> findByOwner(String ownerId, int limit) {
        return entries.stream()
                .filter(e -> ownerId.equals(e.getOwnerId()))
                .sorted(Comparator.comparing(MemoryOperation::getCreatedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<MemoryOperation> findByRecord(String recordId) {
        return entries.stream()
                .filter(e -> recordId.equals(e.getTargetRecordId())
                        || (e.getResultRecordIds() != null && e.getResultRecordIds().contains(recordId)))
                .sorted(Comparator.comparing(MemoryOperation::getCreatedAt))
                .toList();
    }

    public List<MemoryOperation> all() {
        return List.copyOf(entries);
    }
}
