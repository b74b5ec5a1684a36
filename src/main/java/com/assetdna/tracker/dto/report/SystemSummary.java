package com.assetdna.tracker.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemSummary {
    private long totalAssets;
    private long totalBomSnapshots;
    private long recentBomUpdates;
    private Instant generatedAt;
}
