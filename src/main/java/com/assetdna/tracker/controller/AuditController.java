package com.assetdna.tracker.controller;

import com.assetdna.tracker.model.AuditEvent;
import com.assetdna.tracker.service.audit.AuditTrailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
@Slf4j
public class AuditController {

    private final AuditTrailService auditTrailService;

    /**
     * Audit events filtered by exactly one of entity, asset, batch or time range.
     */
    @GetMapping
    public ResponseEntity<List<AuditEvent>> getAuditEvents(
            @RequestParam(required = false) String entityId,
            @RequestParam(required = false) String assetId,
            @RequestParam(required = false) String batchId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        log.info("Getting audit events entityId: {}, assetId: {}, batchId: {}, from: {}, to: {}",
                entityId, assetId, batchId, from, to);
        if (entityId != null) {
            return ResponseEntity.ok(auditTrailService.historyFor(entityId));
        }
        if (assetId != null) {
            return ResponseEntity.ok(auditTrailService.historyForAsset(assetId));
        }
        if (batchId != null) {
            return ResponseEntity.ok(auditTrailService.historyForBatch(batchId));
        }
        if (from != null && to != null) {
            return ResponseEntity.ok(auditTrailService.between(from, to));
        }
        throw new IllegalArgumentException("Provide entityId, assetId, batchId, or both from and to");
    }
}
