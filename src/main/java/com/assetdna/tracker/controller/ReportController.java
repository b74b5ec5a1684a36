package com.assetdna.tracker.controller;

import com.assetdna.tracker.config.AssetDnaProperties;
import com.assetdna.tracker.dto.report.ChangeReport;
import com.assetdna.tracker.dto.report.SystemSummary;
import com.assetdna.tracker.dto.report.TimelineEntry;
import com.assetdna.tracker.service.bom.ChangeAnalysisService;
import com.assetdna.tracker.service.report.ReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * BOM change reports. Read-only.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Slf4j
public class ReportController {

    private final ChangeAnalysisService changeAnalysisService;
    private final ReportService reportService;
    private final AssetDnaProperties properties;

    /**
     * Net BOM changes over the last {@code months} calendar months of the asset's history.
     *
     * @param months window length; defaults to {@code assetdna.reports.default-window-months}
     * @param includeUnchanged also list items that did not change
     */
    @GetMapping("/assets/{assetId}/changes")
    public ResponseEntity<ChangeReport> getChangeReport(
            @PathVariable String assetId,
            @RequestParam(required = false) Integer months,
            @RequestParam(required = false) Boolean includeUnchanged) {
        int window = months != null ? months : properties.getReports().getDefaultWindowMonths();
        log.info("Getting change report for asset: {}, months: {}", assetId, window);
        return ResponseEntity.ok(changeAnalysisService.changeReport(assetId, window, includeUnchanged(includeUnchanged)));
    }

    @GetMapping("/assets/{assetId}/changes/between")
    public ResponseEntity<ChangeReport> getChangeReportBetween(
            @PathVariable String assetId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) Boolean includeUnchanged) {
        log.info("Getting change report for asset: {}, from: {}, to: {}", assetId, from, to);
        return ResponseEntity.ok(changeAnalysisService.changeReportBetween(
                assetId, from, to, includeUnchanged(includeUnchanged)));
    }

    @GetMapping("/assets/{assetId}/diff")
    public ResponseEntity<ChangeReport> diffSnapshots(
            @PathVariable String assetId,
            @RequestParam String fromSnapshot,
            @RequestParam String toSnapshot,
            @RequestParam(required = false) Boolean includeUnchanged) {
        log.info("Diffing snapshots {} and {} of asset: {}", fromSnapshot, toSnapshot, assetId);
        return ResponseEntity.ok(changeAnalysisService.diffSnapshots(
                assetId, fromSnapshot, toSnapshot, includeUnchanged(includeUnchanged)));
    }

    @GetMapping("/assets/{assetId}/timeline")
    public ResponseEntity<List<TimelineEntry>> getTimeline(
            @PathVariable String assetId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        log.info("Getting BOM timeline for asset: {}, from: {}, to: {}", assetId, from, to);
        return ResponseEntity.ok(changeAnalysisService.timeline(assetId, from, to));
    }

    @GetMapping("/summary")
    public ResponseEntity<SystemSummary> getSummary() {
        return ResponseEntity.ok(reportService.summary());
    }

    private boolean includeUnchanged(Boolean requested) {
        return requested != null ? requested : properties.getReports().isIncludeUnchangedByDefault();
    }
}
