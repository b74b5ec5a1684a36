package com.assetdna.tracker.service.hierarchy;

import com.assetdna.tracker.dto.asset.AssetListItem;
import com.assetdna.tracker.dto.asset.AssetPage;
import com.assetdna.tracker.dto.asset.AssetPosition;
import com.assetdna.tracker.dto.asset.AssetSearchCriteria;
import com.assetdna.tracker.dto.asset.AssetTreeNode;
import com.assetdna.tracker.dto.asset.AssetTypeResponse;
import com.assetdna.tracker.exception.AssetNotFoundException;
import com.assetdna.tracker.model.Asset;
import com.assetdna.tracker.model.AssetType;
import com.assetdna.tracker.repository.AssetRepository;
import com.assetdna.tracker.repository.BomSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Read side of the asset tree.
 * Parent links are followed by query, one level at a time, never by recursion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetHierarchyService {

    private final AssetRepository assetRepository;
    private final BomSnapshotRepository snapshotRepository;

    public List<AssetTypeResponse> listTypes() {
        return Arrays.stream(AssetType.values())
                .map(type -> AssetTypeResponse.builder()
                        .name(type.name())
                        .label(type.getLabel())
                        .code(type.getCode())
                        .rank(type.getRank())
                        .leaf(type.isLeafVariant())
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Filtered, sorted page of assets, each with the number of BOM snapshots recorded for it.
     */
    public AssetPage search(AssetSearchCriteria criteria, Pageable pageable) {
        log.info("Searching assets criteria={} page={}", criteria, pageable);
        Page<Asset> page = assetRepository.search(criteria, pageable);
        List<AssetListItem> items = page.getContent().stream()
                .map(asset -> AssetListItem.builder()
                        .asset(asset)
                        .bomCount(snapshotRepository.countByAssetId(asset.getId()))
                        .build())
                .collect(Collectors.toList());
        return AssetPage.builder()
                .content(items)
                .page(pageable.isPaged() ? pageable.getPageNumber() + 1 : 1)
                .pageSize(pageable.isPaged() ? pageable.getPageSize() : items.size())
                .totalElements(page.getTotalElements())
                .totalPages(page.getTotalPages())
                .build();
    }

    public Asset getAsset(String assetId) {
        return assetRepository.findById(assetId)
                .orElseThrow(() -> AssetNotFoundException.forId(assetId));
    }

    public Asset getByUrn(String urn) {
        return assetRepository.findByUrn(urn)
                .orElseThrow(() -> new AssetNotFoundException("Asset not found with urn: " + urn));
    }

    public List<Asset> getChildren(String assetId) {
        getAsset(assetId);
        return assetRepository.findByParentIdOrderByNameAsc(assetId);
    }

    /**
     * Ancestors of the asset ordered from the root down to the direct parent.
     */
    public List<Asset> getAncestors(String assetId) {
        return ancestorsOf(getAsset(assetId));
    }

    public List<Asset> ancestorsOf(Asset asset) {
        LinkedList<Asset> ancestors = new LinkedList<>();
        Set<String> seen = new HashSet<>();
        seen.add(asset.getId());

        String parentId = asset.getParentId();
        while (parentId != null) {
            if (!seen.add(parentId)) {
                log.error("Corrupt hierarchy: parent loop detected above asset {}", asset.getId());
                break;
            }
            String missingId = parentId;
            Asset parent = assetRepository.findById(parentId)
                    .orElseThrow(() -> new AssetNotFoundException(
                            "Dangling parent reference " + missingId + " above asset " + asset.getId()));
            ancestors.addFirst(parent);
            parentId = parent.getParentId();
        }
        return ancestors;
    }

    public List<String> ancestorNamesOf(Asset asset) {
        return ancestorsOf(asset).stream()
                .map(Asset::getName)
                .collect(Collectors.toList());
    }

    public AssetPosition getPosition(String assetId) {
        Asset asset = getAsset(assetId);
        List<Asset> ancestors = ancestorsOf(asset);

        List<String> names = ancestors.stream().map(Asset::getName).collect(Collectors.toCollection(ArrayList::new));
        names.add(asset.getName());

        return AssetPosition.builder()
                .asset(asset)
                .ancestors(ancestors)
                .childCount(assetRepository.countByParentId(assetId))
                .depth(ancestors.size())
                .path(String.join(" / ", names))
                .build();
    }

    /**
     * Build the tree below {@code rootId}, or below every root asset when it is null.
     *
     * @param maxDepth levels to expand below the starting nodes; 0 returns the starting nodes only
     */
    public List<AssetTreeNode> getTree(String rootId, int maxDepth) {
        log.info("Building asset tree rootId={} maxDepth={}", rootId, maxDepth);
        List<Asset> starts = rootId != null
                ? List.of(getAsset(rootId))
                : assetRepository.findByParentIdIsNullOrderByNameAsc();

        List<AssetTreeNode> roots = new ArrayList<>();
        Deque<AssetTreeNode> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();

        for (Asset start : starts) {
            AssetTreeNode node = toTreeNode(start, 0);
            roots.add(node);
            queue.add(node);
            visited.add(start.getId());
        }

        while (!queue.isEmpty()) {
            AssetTreeNode current = queue.poll();
            List<Asset> children = assetRepository.findByParentIdOrderByNameAsc(current.getId());
            if (children.isEmpty()) {
                continue;
            }
            if (current.getDepth() >= maxDepth) {
                current.setTruncated(true);
                continue;
            }
            for (Asset child : children) {
                if (!visited.add(child.getId())) {
                    continue;
                }
                AssetTreeNode childNode = toTreeNode(child, current.getDepth() + 1);
                current.getChildren().add(childNode);
                queue.add(childNode);
            }
        }
        return roots;
    }

    private AssetTreeNode toTreeNode(Asset asset, int depth) {
        return AssetTreeNode.builder()
                .id(asset.getId())
                .urn(asset.getUrn())
                .name(asset.getName())
                .assetType(asset.getAssetType())
                .status(asset.getStatus())
                .depth(depth)
                .build();
    }
}
