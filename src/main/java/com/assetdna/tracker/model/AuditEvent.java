package com.assetdna.tracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only record of a create, update or snapshot append.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "audit_events")
public class AuditEvent {

    @Id
    private String id;

    private EntityType entityType;

    @Indexed
    private String entityId;

    @Indexed
    private String assetId;

    private Action action;

    private Map<String, Object> oldValues;
    private Map<String, Object> newValues;

    private String summary;

    // Set for events produced by a hierarchy ingestion batch
    private String batchId;

    @Indexed
    private Instant occurredAt;

    public enum EntityType {
        ASSET,
        BOM_SNAPSHOT
    }

    public enum Action {
        CREATE,
        UPDATE,
        APPEND,
        BACKFILL
    }
}
