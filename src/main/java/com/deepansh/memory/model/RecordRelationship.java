package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Co-access statistics for a pair of records returned together by retrieval.
 * The pair is stored ordered (recordAId < recordBId) so each pair has one document.
 */
@Document(collection = "record_relationships")
@CompoundIndex(name = "idx_owner_pair", def = "{'ownerId': 1, 'recordAId': 1, 'recordBId': 1}", unique = true)
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecordRelationship {

    @Id
    private String id;

    private String ownerId;

    private String recordAId;

    private String recordBId;

    private long coAccessCount;

    private double strength;

    private Instant updatedAt;
}
