package com.deepansh.memory.relationship;

import com.deepansh.memory.model.RecordRelationship;

import java.util.Collection;
import java.util.List;

/**
 * Co-access bookkeeping between records returned together by retrieval.
 */
public interface RelationshipStore {

    /** Increments the co-access count of every unordered pair in {@code recordIds}. */
    void recordCoAccess(String ownerId, Collection<String> recordIds);

    List<RecordRelationship> findByOwner(String ownerId);

    /** Relationships touching the record, strongest first. */
    List<RecordRelationship> findByRecord(String ownerId, String recordId);

    void updateStrength(String relationshipId, double strength);

    /** Ordered pair so (a, b) and (b, a) land on the same document. */
    static String[] orderedPair(String a, String b) {
        return a.compareTo(b) <= 0 ? new String[]{a, b} : new String[]{b, a};
    }
}
