package com.assetdna.tracker.service.hierarchy;

import com.assetdna.tracker.config.AssetDnaProperties;
import com.assetdna.tracker.dto.asset.IngestionOutcome;
import com.assetdna.tracker.dto.asset.IngestionReport;
import com.assetdna.tracker.dto.asset.RawAssetRecord;
import com.assetdna.tracker.exception.AssetDnaException;
import com.assetdna.tracker.exception.InvalidHierarchyException;
import com.assetdna.tracker.exception.InvalidRecordException;
import com.assetdna.tracker.exception.OrphanAssetException;
import com.assetdna.tracker.model.Asset;
import com.assetdna.tracker.model.AssetStatus;
import com.assetdna.tracker.model.AssetType;
import com.assetdna.tracker.repository.AssetRepository;
import com.assetdna.tracker.service.audit.AuditTrailService;
import com.assetdna.tracker.service.hierarchy.IngestionPlan.PlannedRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Ingests batches of asset records into the asset tree.
 *
 * The batch is planned first (see {@link IngestionPlanner}); a cyclic batch fails there, before any
 * write. Records are then applied parent-first: type check against the parent, identity resolution,
 * create or update. A failing record is reported and skipped, its descendants fail as orphans and
 * unrelated records carry on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HierarchyBuilder {

    private final IngestionPlanner ingestionPlanner;
    private final TaxonomyValidator taxonomyValidator;
    private final IdentityResolver identityResolver;
    private final AssetRepository assetRepository;
    private final AuditTrailService auditTrailService;
    private final AssetDnaProperties properties;
    private final Clock clock;

    @Transactional
    public IngestionReport ingest(List<RawAssetRecord> batch) {
        String batchId = UUID.randomUUID().toString();
        log.info("[ingest] begin batchId={} records={}", batchId, batch.size());

        IngestionPlan plan = ingestionPlanner.plan(batch);

        IngestionReport report = IngestionReport.builder()
                .batchId(batchId)
                .totalRecords(batch.size())
                .build();
        plan.getRejected().forEach(report::add);

        Map<PlannedRecord, ResolvedNode> resolved = new IdentityHashMap<>();
        for (PlannedRecord planned : plan.getOrder()) {
            IngestionOutcome outcome = apply(planned, resolved, batchId);
            if (outcome.getStatus() == IngestionOutcome.Status.FAILED) {
                log.warn("[ingest] batchId={} record #{} '{}' failed: {} {}", batchId, planned.getIndex(),
                        planned.name(), outcome.getErrorCode(), outcome.getMessage());
            }
            report.add(outcome);
        }

        report.getCreated().sort(Comparator.comparingInt(IngestionOutcome::getRecordIndex));
        report.getUpdated().sort(Comparator.comparingInt(IngestionOutcome::getRecordIndex));
        report.getFailed().sort(Comparator.comparingInt(IngestionOutcome::getRecordIndex));
        report.setCompletedAt(clock.instant());

        log.info("[ingest] end batchId={} created={} updated={} failed={}", batchId,
                report.getCreated().size(), report.getUpdated().size(), report.getFailed().size());
        return report;
    }

    /**
     * Explicit single-asset creation or update.
     *
     * @throws AssetDnaException the record's failure, unwrapped from the report
     */
    @Transactional
    public IngestionOutcome ingestOne(RawAssetRecord record) {
        IngestionReport report = ingest(List.of(record));
        if (!report.getFailed().isEmpty()) {
            throw report.getFailed().get(0).getFailure();
        }
        return !report.getCreated().isEmpty() ? report.getCreated().get(0) : report.getUpdated().get(0);
    }

    private IngestionOutcome apply(PlannedRecord planned, Map<PlannedRecord, ResolvedNode> resolved, String batchId) {
        RawAssetRecord record = planned.getRecord();
        if (planned.hasFailed()) {
            return IngestionOutcome.failed(planned.getIndex(), record, planned.getFailure());
        }

        ResolvedNode parent = planned.getAnchor();
        PlannedRecord batchParent = planned.getBatchParent();
        if (batchParent != null) {
            parent = resolved.get(batchParent);
            if (parent == null) {
                return IngestionOutcome.failed(planned.getIndex(), record, new OrphanAssetException(String.format(
                        "Parent '%s' of '%s' could not be ingested (record #%d)",
                        batchParent.name(), planned.name(), batchParent.getIndex())));
            }
        }

        try {
            return upsert(planned, parent, resolved, batchId);
        } catch (DuplicateKeyException e) {
            // Lost a race with a concurrent writer for the same (parent, name); last write wins
            log.info("[ingest] concurrent insert of '{}' detected, retrying as update", planned.name());
            try {
                return upsert(planned, parent, resolved, batchId);
            } catch (DuplicateKeyException retryFailure) {
                return IngestionOutcome.failed(planned.getIndex(), record, new InvalidRecordException(
                        "Conflicting concurrent write for '" + planned.name() + "'", retryFailure));
            } catch (AssetDnaException retryFailure) {
                return IngestionOutcome.failed(planned.getIndex(), record, retryFailure);
            }
        } catch (AssetDnaException e) {
            return IngestionOutcome.failed(planned.getIndex(), record, e);
        }
    }

    private IngestionOutcome upsert(PlannedRecord planned, ResolvedNode parent,
                                    Map<PlannedRecord, ResolvedNode> resolved, String batchId) {
        AssetType type = planned.getAssetType();
        taxonomyValidator.validate(parent != null ? parent.assetType() : null, type);

        IdentityResolution identity = identityResolver.resolve(planned.name(), type, parent);
        Instant now = clock.instant();

        Asset saved;
        IngestionOutcome.Status status;
        if (identity.isCreation()) {
            Asset asset = Asset.builder()
                    .id(identity.assetId())
                    .urn(identity.urn())
                    .name(planned.name())
                    .assetType(type)
                    .parentId(parent != null ? parent.assetId() : null)
                    .createdAt(now)
                    .build();
            applyOptionalFields(asset, planned, true);
            asset.setUpdatedAt(now);
            saved = assetRepository.insert(asset);
            auditTrailService.recordAssetCreated(saved, batchId);
            status = IngestionOutcome.Status.CREATED;
        } else {
            Asset asset = identity.existing();
            Map<String, Object> before = auditTrailService.describe(asset);
            if (asset.getAssetType() != type) {
                // The URN embeds the type code, so a retyped asset would keep a stale URN
                throw new InvalidHierarchyException(String.format(
                        "Cannot change '%s' from '%s' to '%s': the asset type is fixed once created",
                        asset.getName(), asset.getAssetType().getLabel(), type.getLabel()));
            }
            applyOptionalFields(asset, planned, false);
            asset.setUpdatedAt(now);
            saved = assetRepository.save(asset);
            auditTrailService.recordAssetUpdated(before, saved, batchId);
            status = IngestionOutcome.Status.UPDATED;
        }

        ResolvedNode node = parent != null
                ? parent.child(saved.getId(), saved.getName(), type)
                : new ResolvedNode(saved.getId(), saved.getName(), type, List.of(saved.getName()));
        resolved.put(planned, node);

        return IngestionOutcome.builder()
                .recordIndex(planned.getIndex())
                .name(saved.getName())
                .parentName(planned.getRecord().getParentName())
                .status(status)
                .assetId(saved.getId())
                .urn(saved.getUrn())
                .assetType(type.getLabel())
                .build();
    }

    private void applyOptionalFields(Asset asset, PlannedRecord planned, boolean creation) {
        RawAssetRecord record = planned.getRecord();
        if (planned.getStatus() != null) {
            asset.setStatus(planned.getStatus());
        } else if (creation) {
            asset.setStatus(AssetStatus.ACTIVE);
        }
        if (record.getDescription() != null) {
            asset.setDescription(record.getDescription());
        }
        if (record.getVersion() != null) {
            asset.setVersion(record.getVersion());
        }
        if (record.getExternalId() != null) {
            asset.setExternalId(record.getExternalId());
        }
        if (RawAssetRecord.isPresent(record.getExternalSystem())) {
            asset.setExternalSystem(record.getExternalSystem());
        } else if (creation) {
            asset.setExternalSystem(properties.getDefaultExternalSystem());
        }
        if (record.getLifecycleStage() != null) {
            asset.setLifecycleStage(record.getLifecycleStage());
        }
        if (record.getProperties() != null) {
            asset.setProperties(new HashMap<>(record.getProperties()));
        }
        if (record.getTags() != null) {
            Set<String> tags = new LinkedHashSet<>();
            record.getTags().stream()
                    .filter(RawAssetRecord::isPresent)
                    .map(String::trim)
                    .forEach(tags::add);
            asset.setTags(tags);
        }
    }
}
