package com.assetdna.tracker.service.hierarchy;

import com.assetdna.tracker.dto.asset.RawAssetRecord;
import com.assetdna.tracker.exception.AmbiguousParentException;
import com.assetdna.tracker.exception.OrphanAssetException;
import com.assetdna.tracker.model.Asset;
import com.assetdna.tracker.model.AssetType;
import com.assetdna.tracker.repository.AssetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Finds or mints asset identities. Read-only: the caller performs every write.
 *
 * An asset is identified by {@code (parentId, name)}. A match yields the stored id and URN; no match
 * yields a new UUID and a URN derived from the parent's path.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdentityResolver {

    private final AssetRepository assetRepository;
    private final AssetHierarchyService hierarchyService;
    private final UrnGenerator urnGenerator;

    /**
     * @param parent resolved parent, or null for a root asset
     */
    public IdentityResolution resolve(String name, AssetType type, ResolvedNode parent) {
        String parentId = parent != null ? parent.assetId() : null;
        Optional<Asset> existing = assetRepository.findByParentIdAndName(parentId, name);
        if (existing.isPresent()) {
            Asset asset = existing.get();
            log.debug("Resolved '{}' under parent {} to existing asset {}", name, parentId, asset.getId());
            return new IdentityResolution(asset.getId(), asset.getUrn(), asset);
        }

        List<String> ancestorNames = parent != null ? parent.path() : List.of();
        String urn = urnGenerator.generate(type, ancestorNames, name);
        String assetId = UUID.randomUUID().toString();
        log.debug("Minted asset {} ({}) for '{}' under parent {}", assetId, urn, name, parentId);
        return new IdentityResolution(assetId, urn, null);
    }

    /**
     * Parent named explicitly by id or URN. Empty when the record carries neither.
     *
     * @throws OrphanAssetException when the referenced asset does not exist
     */
    public Optional<ResolvedNode> findExplicitParent(RawAssetRecord record) {
        if (RawAssetRecord.isPresent(record.getParentId())) {
            Asset parent = assetRepository.findById(record.getParentId())
                    .orElseThrow(() -> new OrphanAssetException(String.format(
                            "Parent asset with id '%s' not found for '%s'", record.getParentId(), record.getName())));
            return Optional.of(anchorFor(parent));
        }
        if (RawAssetRecord.isPresent(record.getParentUrn())) {
            Asset parent = assetRepository.findByUrn(record.getParentUrn())
                    .orElseThrow(() -> new OrphanAssetException(String.format(
                            "Parent asset with urn '%s' not found for '%s'", record.getParentUrn(), record.getName())));
            return Optional.of(anchorFor(parent));
        }
        return Optional.empty();
    }

    /**
     * Look up a stored parent by name alone. Only used when the batch itself has no asset of that name.
     *
     * @throws OrphanAssetException when no stored asset has the name
     * @throws AmbiguousParentException when several stored assets share it
     */
    public ResolvedNode findParentByName(String parentName, String childName) {
        List<Asset> candidates = assetRepository.findByName(parentName);
        if (candidates.isEmpty()) {
            throw new OrphanAssetException(String.format(
                    "Parent '%s' of '%s' is neither stored nor present in the batch", parentName, childName));
        }
        if (candidates.size() > 1) {
            String urns = candidates.stream().map(Asset::getUrn).sorted().collect(Collectors.joining(", "));
            throw new AmbiguousParentException(String.format(
                    "Parent name '%s' of '%s' matches %d assets (%s); reference the parent by parent_id or parent_urn",
                    parentName, childName, candidates.size(), urns));
        }
        return anchorFor(candidates.get(0));
    }

    public ResolvedNode anchorFor(Asset asset) {
        return ResolvedNode.of(asset, hierarchyService.ancestorNamesOf(asset));
    }
}
