package com.assetdna.tracker.service.bom;

import com.assetdna.tracker.config.AssetDnaProperties;
import com.assetdna.tracker.dto.report.ChangeRecord;
import com.assetdna.tracker.dto.report.ChangeReport;
import com.assetdna.tracker.dto.report.ChangeSummary;
import com.assetdna.tracker.dto.report.TimelineEntry;
import com.assetdna.tracker.model.Asset;
import com.assetdna.tracker.model.BomItem;
import com.assetdna.tracker.model.BomSnapshot;
import com.assetdna.tracker.service.hierarchy.AssetHierarchyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Window-based BOM change analysis.
 *
 * A report compares exactly two snapshots, the state at the window start and the state at its end,
 * so intermediate edits that cancel out do not appear. Both bounds are captured once, at the start
 * of the request; snapshots appended afterwards cannot leak into a report already in progress.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChangeAnalysisService {

    private final SnapshotStore snapshotStore;
    private final AssetHierarchyService hierarchyService;
    private final BomDiffCalculator diffCalculator;
    private final AssetDnaProperties properties;
    private final Clock clock;

    public ChangeReport changeReport(String assetId, int months) {
        return changeReport(assetId, months, properties.getReports().isIncludeUnchangedByDefault());
    }

    /**
     * Net change over the {@code months} calendar months ending at the asset's latest snapshot
     * (or now, when it has none).
     */
    public ChangeReport changeReport(String assetId, int months, boolean includeUnchanged) {
        int maxMonths = properties.getReports().getMaxWindowMonths();
        if (months < 1 || months > maxMonths) {
            throw new IllegalArgumentException("months must be between 1 and " + maxMonths + ", was " + months);
        }
        hierarchyService.getAsset(assetId);

        Instant to = snapshotStore.latest(assetId)
                .map(BomSnapshot::getTimestamp)
                .orElseGet(clock::instant);
        Instant from = to.atZone(ZoneOffset.UTC).minusMonths(months).toInstant();
        return changeReportBetween(assetId, from, to, includeUnchanged);
    }

    public ChangeReport changeReportBetween(String assetId, Instant from, Instant to) {
        return changeReportBetween(assetId, from, to, properties.getReports().isIncludeUnchangedByDefault());
    }

    public ChangeReport changeReportBetween(String assetId, Instant from, Instant to, boolean includeUnchanged) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Window start " + from + " is after its end " + to);
        }
        Asset asset = hierarchyService.getAsset(assetId);
        log.info("Building change report for asset {} from {} to {} (includeUnchanged={})",
                assetId, from, to, includeUnchanged);

        Optional<BomSnapshot> baseline = snapshotStore.latestBefore(assetId, from);
        Optional<BomSnapshot> current = snapshotStore.latestBefore(assetId, to);
        int inWindow = snapshotStore.allBetween(assetId, from, to).size();

        List<BomItem> baselineItems = baseline.map(BomSnapshot::getItems).orElse(List.of());
        List<BomItem> currentItems = current.map(BomSnapshot::getItems).orElse(List.of());

        List<ChangeRecord> changes;
        if (baseline.isPresent() && current.isPresent() && baseline.get().getId().equals(current.get().getId())) {
            // Nothing happened inside the window
            changes = includeUnchanged ? diffCalculator.diff(baselineItems, baselineItems, true) : new ArrayList<>();
        } else {
            changes = diffCalculator.diff(baselineItems, currentItems, includeUnchanged);
        }
        ChangeSummary summary = diffCalculator.summarize(baselineItems, currentItems);

        log.info("Change report for asset {}: {} added, {} removed, {} modified, {} unchanged",
                assetId, summary.getAdded(), summary.getRemoved(), summary.getModified(), summary.getUnchanged());

        return ChangeReport.builder()
                .assetId(asset.getId())
                .assetName(asset.getName())
                .assetUrn(asset.getUrn())
                .from(from)
                .to(to)
                .baselineSnapshotId(baseline.map(BomSnapshot::getId).orElse(null))
                .baselineTimestamp(baseline.map(BomSnapshot::getTimestamp).orElse(null))
                .currentSnapshotId(current.map(BomSnapshot::getId).orElse(null))
                .currentTimestamp(current.map(BomSnapshot::getTimestamp).orElse(null))
                .snapshotsInWindow(inWindow)
                .includeUnchanged(includeUnchanged)
                .changes(changes)
                .summary(summary)
                .build();
    }

    /**
     * Diff two explicit snapshots of the same asset.
     */
    public ChangeReport diffSnapshots(String assetId, String fromSnapshotId, String toSnapshotId, boolean includeUnchanged) {
        Asset asset = hierarchyService.getAsset(assetId);
        BomSnapshot baseline = snapshotStore.get(assetId, fromSnapshotId);
        BomSnapshot current = snapshotStore.get(assetId, toSnapshotId);

        return ChangeReport.builder()
                .assetId(asset.getId())
                .assetName(asset.getName())
                .assetUrn(asset.getUrn())
                .from(baseline.getTimestamp())
                .to(current.getTimestamp())
                .baselineSnapshotId(baseline.getId())
                .baselineTimestamp(baseline.getTimestamp())
                .currentSnapshotId(current.getId())
                .currentTimestamp(current.getTimestamp())
                .snapshotsInWindow(2)
                .includeUnchanged(includeUnchanged)
                .changes(diffCalculator.diff(baseline.getItems(), current.getItems(), includeUnchanged))
                .summary(diffCalculator.summarize(baseline.getItems(), current.getItems()))
                .build();
    }

    /**
     * Step-by-step change counts for every snapshot in the window, each against its predecessor.
     * The first entry is compared with the last snapshot before the window, if any.
     */
    public List<TimelineEntry> timeline(String assetId, Instant from, Instant to) {
        hierarchyService.getAsset(assetId);
        List<BomSnapshot> snapshots = snapshotStore.allBetween(assetId, from, to);

        BomSnapshot previous = snapshotStore.latestBefore(assetId, from)
                .filter(s -> s.getTimestamp().isBefore(from))
                .orElse(null);

        List<TimelineEntry> entries = new ArrayList<>(snapshots.size());
        for (BomSnapshot snapshot : snapshots) {
            List<BomItem> previousItems = previous != null ? previous.getItems() : List.of();
            ChangeSummary step = diffCalculator.summarize(previousItems, snapshot.getItems());
            entries.add(TimelineEntry.builder()
                    .snapshotId(snapshot.getId())
                    .previousSnapshotId(previous != null ? previous.getId() : null)
                    .timestamp(snapshot.getTimestamp())
                    .sequence(snapshot.getSequence())
                    .backfill(snapshot.isBackfill())
                    .totalItems(snapshot.getItems().size())
                    .added(step.getAdded())
                    .removed(step.getRemoved())
                    .modified(step.getModified())
                    .build());
            previous = snapshot;
        }
        return entries;
    }
}
