package com.assetdna.tracker.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Net BOM change of an asset across a time window.
 *
 * Only the two bounding snapshots are compared: the last one at or before {@code from} (the
 * baseline, empty when absent) and the last one at or before {@code to}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeReport {
    private String assetId;
    private String assetName;
    private String assetUrn;

    private Instant from;
    private Instant to;

    private String baselineSnapshotId;      // null when the asset had no BOM at window start
    private Instant baselineTimestamp;
    private String currentSnapshotId;
    private Instant currentTimestamp;

    private int snapshotsInWindow;
    private boolean includeUnchanged;

    @Builder.Default
    private List<ChangeRecord> changes = new ArrayList<>();

    private ChangeSummary summary;
}
