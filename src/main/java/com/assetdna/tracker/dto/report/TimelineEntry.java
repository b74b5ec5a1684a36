package com.assetdna.tracker.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Change counts of one snapshot relative to the snapshot before it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelineEntry {
    private String snapshotId;
    private String previousSnapshotId;
    private Instant timestamp;
    private long sequence;
    private boolean backfill;
    private int totalItems;
    private int added;
    private int removed;
    private int modified;
}
