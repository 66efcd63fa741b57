package com.deepansh.memory.relationship;

import com.deepansh.memory.model.RecordRelationship;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "memory.store.backend", havingValue = "in-memory")
public class InMemoryRelationshipStore implements RelationshipStore {

    private final Map<String, RecordRelationship> byPair = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRelationshipStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void recordCoAccess(String ownerId, Collection<String> recordIds) {
        List<String> ids = new ArrayList<>(recordIds);
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                String[] pair = RelationshipStore.orderedPair(ids.get(i), ids.get(j));
                byPair.compute(ownerId + "|" + pair[0] + "|" + pair[1], (k, existing) -> {
                    RecordRelationship base = existing != null ? existing : RecordRelationship.builder()
                            .id(UUID.randomUUID().toString())
                            .ownerId(ownerId)
                            .recordAId(pair[0])
                            .recordBId(pair[1])
                            .build();
                    return base.toBuilder()
                            .coAccessCount(base.getCoAccessCount() + 1)
                            .updatedAt(clock.instant())
                            .build();
                });
            }
        }
    }

    @Override
    public List<RecordRelationship> findByOwner(String ownerId) {
        return byPair.values().stream()
                .filter(r -> ownerId.equals(r.getOwnerId()))
                .map(r -> r.toBuilder().build())
                .toList();
    }

    @Override
    public List<RecordRelationship> findByRecord(String ownerId, String recordId) {
        return byPair.values().stream()
                .filter(r -> ownerId.equals(r.getOwnerId()))
                .filter(r -> recordId.equals(r.getRecordAId()) || recordId.equals(r.getRecordBId()))
                .sorted(Comparator.comparingDouble(RecordRelationship::getStrength).reversed())
                .map(r -> r.toBuilder().build())
                .toList();
    }

    @Override
    public void updateStrength(String relationshipId, double strength) {
        byPair.replaceAll((k, r) -> relationshipId.equals(r.getId())
                ? r.toBuilder().strength(strength).updatedAt(clock.instant()).build()
                : r);
    }
}
