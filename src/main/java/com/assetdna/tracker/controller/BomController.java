package com.assetdna.tracker.controller;

import com.assetdna.tracker.dto.bom.AppendSnapshotRequest;
import com.assetdna.tracker.exception.SnapshotNotFoundException;
import com.assetdna.tracker.model.BomSnapshot;
import com.assetdna.tracker.service.bom.SnapshotStore;
import com.assetdna.tracker.service.hierarchy.AssetHierarchyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * BOM snapshots of one asset. Snapshots are append-only; there is no update or delete.
 */
@RestController
@RequestMapping("/api/assets/{assetId}/bom")
@RequiredArgsConstructor
@Slf4j
public class BomController {

    private final SnapshotStore snapshotStore;
    private final AssetHierarchyService hierarchyService;

    @PostMapping
    public ResponseEntity<BomSnapshot> appendSnapshot(
            @PathVariable String assetId,
            @Valid @RequestBody AppendSnapshotRequest request) {
        log.info("Appending BOM snapshot for asset: {}, timestamp: {}, items: {}",
                assetId, request.getTimestamp(), request.getItems().size());
        String snapshotId = snapshotStore.append(assetId, request.getTimestamp(), request.getItems(), request.getSource());
        return new ResponseEntity<>(snapshotStore.get(snapshotId), HttpStatus.CREATED);
    }

    /**
     * Insert a historical snapshot; the timestamp may precede existing snapshots.
     */
    @PostMapping("/backfill")
    public ResponseEntity<BomSnapshot> backfillSnapshot(
            @PathVariable String assetId,
            @Valid @RequestBody AppendSnapshotRequest request) {
        log.info("Backfilling BOM snapshot for asset: {}, timestamp: {}", assetId, request.getTimestamp());
        String snapshotId = snapshotStore.backfill(assetId, request.getTimestamp(), request.getItems(), request.getSource());
        return new ResponseEntity<>(snapshotStore.get(snapshotId), HttpStatus.CREATED);
    }

    @GetMapping("/history")
    public ResponseEntity<List<BomSnapshot>> getHistory(@PathVariable String assetId) {
        log.info("Getting BOM history for asset: {}", assetId);
        return ResponseEntity.ok(snapshotStore.history(assetId));
    }

    @GetMapping("/latest")
    public ResponseEntity<BomSnapshot> getLatest(@PathVariable String assetId) {
        hierarchyService.getAsset(assetId);
        BomSnapshot latest = snapshotStore.latest(assetId)
                .orElseThrow(() -> new SnapshotNotFoundException("Asset " + assetId + " has no BOM snapshots"));
        return ResponseEntity.ok(latest);
    }

    @GetMapping("/{snapshotId}")
    public ResponseEntity<BomSnapshot> getSnapshot(@PathVariable String assetId, @PathVariable String snapshotId) {
        return ResponseEntity.ok(snapshotStore.get(assetId, snapshotId));
    }
}
