package com.assetdna.tracker.controller;

import com.assetdna.tracker.dto.asset.AssetPage;
import com.assetdna.tracker.dto.asset.AssetPosition;
import com.assetdna.tracker.dto.asset.AssetSearchCriteria;
import com.assetdna.tracker.dto.asset.AssetTreeNode;
import com.assetdna.tracker.dto.asset.AssetTypeResponse;
import com.assetdna.tracker.dto.asset.CopyAssetRequest;
import com.assetdna.tracker.dto.asset.CopyResult;
import com.assetdna.tracker.dto.asset.IngestionOutcome;
import com.assetdna.tracker.dto.asset.IngestionReport;
import com.assetdna.tracker.dto.asset.RawAssetRecord;
import com.assetdna.tracker.model.Asset;
import com.assetdna.tracker.model.AssetStatus;
import com.assetdna.tracker.model.AssetType;
import com.assetdna.tracker.service.hierarchy.AssetCopyService;
import com.assetdna.tracker.service.hierarchy.AssetHierarchyService;
import com.assetdna.tracker.service.hierarchy.HierarchyBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Asset registry: ingestion and tree navigation.
 */
@RestController
@RequestMapping("/api/assets")
@RequiredArgsConstructor
@Slf4j
public class AssetController {

    static final int MAX_PAGE_SIZE = 1000;

    // Accepted sortBy values and the stored field each one orders by
    private static final Map<String, String> SORT_FIELDS = Map.of(
            "name", "name",
            "urn", "urn",
            "assetType", "assetType",
            "status", "status",
            "createdAt", "createdAt",
            "updatedAt", "updatedAt");

    private final HierarchyBuilder hierarchyBuilder;
    private final AssetHierarchyService hierarchyService;
    private final AssetCopyService assetCopyService;

    /**
     * Filtered asset listing with a BOM snapshot count per asset.
     *
     * @param type     type label, constant or URN code
     * @param search   case-insensitive part of the name
     * @param page     page number, from 1
     * @param pageSize rows per page, 1 to 1000 (default: 50)
     */
    @GetMapping
    public ResponseEntity<AssetPage> listAssets(
            @RequestParam(required = false) String parentId,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int pageSize,
            @RequestParam(defaultValue = "name") String sortBy,
            @RequestParam(defaultValue = "false") boolean sortDesc) {
        log.info("Listing assets parentId: {}, type: {}, status: {}, search: {}, page: {}", parentId, type, status, search, page);
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        AssetSearchCriteria criteria = AssetSearchCriteria.builder()
                .parentId(parentId)
                .assetType(type != null ? AssetType.fromJson(type) : null)
                .status(status != null ? AssetStatus.parse(status)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown status: " + status)) : null)
                .nameContains(search)
                .build();
        PageRequest pageable = PageRequest.of(page - 1, pageSize, parseSort(sortBy, sortDesc));
        return ResponseEntity.ok(hierarchyService.search(criteria, pageable));
    }

    @GetMapping("/types")
    public ResponseEntity<List<AssetTypeResponse>> getAssetTypes() {
        return ResponseEntity.ok(hierarchyService.listTypes());
    }

    /**
     * Tree below {@code rootId}, or the whole forest when omitted.
     *
     * @param depth levels to expand below the starting nodes (default: 10)
     */
    @GetMapping("/tree")
    public ResponseEntity<List<AssetTreeNode>> getTree(
            @RequestParam(required = false) String rootId,
            @RequestParam(defaultValue = "10") int depth) {
        log.info("Getting asset tree rootId: {}, depth: {}", rootId, depth);
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative");
        }
        return ResponseEntity.ok(hierarchyService.getTree(rootId, depth));
    }

    @GetMapping("/by-urn")
    public ResponseEntity<Asset> getAssetByUrn(@RequestParam String urn) {
        log.info("Getting asset by urn: {}", urn);
        return ResponseEntity.ok(hierarchyService.getByUrn(urn));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Asset> getAsset(@PathVariable String id) {
        return ResponseEntity.ok(hierarchyService.getAsset(id));
    }

    @GetMapping("/{id}/position")
    public ResponseEntity<AssetPosition> getPosition(@PathVariable String id) {
        log.info("Getting position of asset: {}", id);
        return ResponseEntity.ok(hierarchyService.getPosition(id));
    }

    @GetMapping("/{id}/children")
    public ResponseEntity<List<Asset>> getChildren(@PathVariable String id) {
        return ResponseEntity.ok(hierarchyService.getChildren(id));
    }

    /**
     * Copy the asset and its whole subtree under {@code new_parent_id}. Responds 201 with the copy's root.
     */
    @PostMapping("/{id}/copy")
    public ResponseEntity<CopyResult> copyAsset(@PathVariable String id, @RequestBody CopyAssetRequest request) {
        log.info("Copying asset {} under parent {}", id, request.getNewParentId());
        return new ResponseEntity<>(assetCopyService.copySubtree(id, request.getNewParentId()), HttpStatus.CREATED);
    }

    /**
     * Create or update one asset. Responds 201 on creation and 200 on update.
     */
    @PostMapping
    public ResponseEntity<IngestionOutcome> upsertAsset(@RequestBody RawAssetRecord record) {
        log.info("Upserting asset '{}' of type {}", record.getName(), record.getAssetType());
        IngestionOutcome outcome = hierarchyBuilder.ingestOne(record);
        HttpStatus status = outcome.getStatus() == IngestionOutcome.Status.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
        return new ResponseEntity<>(outcome, status);
    }

    /**
     * Ingest a batch. Per-record failures are reported in the body; the batch itself only fails
     * on a parent cycle.
     */
    @PostMapping("/ingest")
    public ResponseEntity<IngestionReport> ingest(@RequestBody List<RawAssetRecord> records) {
        log.info("Ingesting batch of {} asset records", records.size());
        return ResponseEntity.ok(hierarchyBuilder.ingest(records));
    }

    private static Sort parseSort(String sortBy, boolean descending) {
        String field = SORT_FIELDS.get(sortBy);
        if (field == null) {
            throw new IllegalArgumentException("Cannot sort by '" + sortBy + "'; use one of " + SORT_FIELDS.keySet());
        }
        Sort.Order order = descending ? Sort.Order.desc(field) : Sort.Order.asc(field);
        // URN is unique, so pages never overlap between requests
        return field.equals("urn") ? Sort.by(order) : Sort.by(order, Sort.Order.asc("urn"));
    }
}
