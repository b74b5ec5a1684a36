package com.assetdna.tracker.service.audit;

import com.assetdna.tracker.model.Asset;
import com.assetdna.tracker.model.AuditEvent;
import com.assetdna.tracker.model.BomSnapshot;
import com.assetdna.tracker.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Writes and reads the audit trail of asset and snapshot changes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditTrailService {

    private final AuditEventRepository auditEventRepository;
    private final Clock clock;

    public AuditEvent recordAssetCreated(Asset asset, String batchId) {
        return save(AuditEvent.builder()
                .entityType(AuditEvent.EntityType.ASSET)
                .entityId(asset.getId())
                .assetId(asset.getId())
                .action(AuditEvent.Action.CREATE)
                .newValues(describe(asset))
                .summary("Created " + asset.getAssetType().getLabel() + " '" + asset.getName() + "'")
                .batchId(batchId)
                .build());
    }

    public AuditEvent recordAssetUpdated(Map<String, Object> before, Asset after, String batchId) {
        Map<String, Object> afterValues = describe(after);
        Map<String, Object> oldValues = new LinkedHashMap<>();
        Map<String, Object> newValues = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : afterValues.entrySet()) {
            Object previous = before.get(entry.getKey());
            if (!Objects.equals(previous, entry.getValue())) {
                oldValues.put(entry.getKey(), previous);
                newValues.put(entry.getKey(), entry.getValue());
            }
        }
        String summary = newValues.isEmpty()
                ? "Re-imported '" + after.getName() + "' without changes"
                : "Updated " + String.join(", ", newValues.keySet()) + " of '" + after.getName() + "'";
        return save(AuditEvent.builder()
                .entityType(AuditEvent.EntityType.ASSET)
                .entityId(after.getId())
                .assetId(after.getId())
                .action(AuditEvent.Action.UPDATE)
                .oldValues(oldValues)
                .newValues(newValues)
                .summary(summary)
                .batchId(batchId)
                .build());
    }

    public AuditEvent recordSnapshotAppended(BomSnapshot snapshot) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("timestamp", snapshot.getTimestamp());
        values.put("sequence", snapshot.getSequence());
        values.put("itemCount", snapshot.getItems().size());
        values.put("source", snapshot.getSource());
        AuditEvent.Action action = snapshot.isBackfill() ? AuditEvent.Action.BACKFILL : AuditEvent.Action.APPEND;
        return save(AuditEvent.builder()
                .entityType(AuditEvent.EntityType.BOM_SNAPSHOT)
                .entityId(snapshot.getId())
                .assetId(snapshot.getAssetId())
                .action(action)
                .newValues(values)
                .summary((snapshot.isBackfill() ? "Backfilled" : "Appended") + " BOM snapshot with "
                        + snapshot.getItems().size() + " items as of " + snapshot.getTimestamp())
                .build());
    }

    public List<AuditEvent> historyFor(String entityId) {
        return auditEventRepository.findByEntityIdOrderByOccurredAtAsc(entityId);
    }

    public List<AuditEvent> historyForAsset(String assetId) {
        return auditEventRepository.findByAssetIdOrderByOccurredAtAsc(assetId);
    }

    public List<AuditEvent> historyForBatch(String batchId) {
        return auditEventRepository.findByBatchIdOrderByOccurredAtAsc(batchId);
    }

    public List<AuditEvent> between(Instant from, Instant to) {
        return auditEventRepository.findByOccurredAtBetweenOrderByOccurredAtAsc(from, to);
    }

    /**
     * Flat view of the audited asset fields.
     */
    public Map<String, Object> describe(Asset asset) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", asset.getName());
        values.put("urn", asset.getUrn());
        values.put("assetType", asset.getAssetType() != null ? asset.getAssetType().getLabel() : null);
        values.put("parentId", asset.getParentId());
        values.put("status", asset.getStatus() != null ? asset.getStatus().name() : null);
        values.put("description", asset.getDescription());
        values.put("version", asset.getVersion());
        values.put("externalId", asset.getExternalId());
        values.put("externalSystem", asset.getExternalSystem());
        values.put("lifecycleStage", asset.getLifecycleStage());
        values.put("properties", asset.getProperties() != null ? new LinkedHashMap<>(asset.getProperties()) : null);
        values.put("tags", asset.getTags() != null ? new ArrayList<>(asset.getTags()) : null);
        return values;
    }

    private AuditEvent save(AuditEvent event) {
        event.setOccurredAt(clock.instant());
        AuditEvent saved = auditEventRepository.save(event);
        log.debug("[audit] {} {} {}: {}", event.getAction(), event.getEntityType(), event.getEntityId(), event.getSummary());
        return saved;
    }
}
