package com.assetdna.tracker.service.report;

import com.assetdna.tracker.dto.report.SystemSummary;
import com.assetdna.tracker.repository.AssetRepository;
import com.assetdna.tracker.repository.BomSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    static final Duration RECENT_WINDOW = Duration.ofDays(7);

    private final AssetRepository assetRepository;
    private final BomSnapshotRepository snapshotRepository;
    private final Clock clock;

    public SystemSummary summary() {
        Instant now = clock.instant();
        SystemSummary summary = SystemSummary.builder()
                .totalAssets(assetRepository.count())
                .totalBomSnapshots(snapshotRepository.count())
                .recentBomUpdates(snapshotRepository.countByCreatedAtAfter(now.minus(RECENT_WINDOW)))
                .generatedAt(now)
                .build();
        log.debug("System summary: {}", summary);
        return summary;
    }
}
