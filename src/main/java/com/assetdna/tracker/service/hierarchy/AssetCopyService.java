package com.assetdna.tracker.service.hierarchy;

import com.assetdna.tracker.dto.asset.CopyResult;
import com.assetdna.tracker.exception.InvalidHierarchyException;
import com.assetdna.tracker.exception.InvalidRecordException;
import com.assetdna.tracker.exception.OrphanAssetException;
import com.assetdna.tracker.model.Asset;
import com.assetdna.tracker.repository.AssetRepository;
import com.assetdna.tracker.service.audit.AuditTrailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Deep copy of an asset and everything below it under a new parent.
 *
 * Copies get fresh ids and URNs derived from their new position. External ids are cleared and BOM
 * snapshots stay with the originals. Moving an asset is not offered: a URN never changes once minted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetCopyService {

    static final String COPY_SUFFIX = " (Copy)";

    private final AssetRepository assetRepository;
    private final AssetHierarchyService hierarchyService;
    private final IdentityResolver identityResolver;
    private final TaxonomyValidator taxonomyValidator;
    private final UrnGenerator urnGenerator;
    private final AuditTrailService auditTrailService;
    private final Clock clock;

    /**
     * @param newParentId parent of the copy, or null to copy as a root
     * @throws OrphanAssetException when the new parent does not exist
     * @throws InvalidHierarchyException when the new parent is the asset itself or one of its
     *                                   descendants, or its type does not accept the asset's type
     */
    @Transactional
    public CopyResult copySubtree(String assetId, String newParentId) {
        Asset source = hierarchyService.getAsset(assetId);
        ResolvedNode parent = null;
        if (newParentId != null) {
            Asset target = assetRepository.findById(newParentId)
                    .orElseThrow(() -> new OrphanAssetException("Parent asset with id '" + newParentId + "' not found"));
            checkNotInsideSource(source, target);
            taxonomyValidator.validate(target.getAssetType(), source.getAssetType());
            parent = identityResolver.anchorFor(target);
        }

        String batchId = UUID.randomUUID().toString();
        log.info("[copy] begin batchId={} source={} newParent={}", batchId, assetId, newParentId);

        String rootName = Objects.equals(newParentId, source.getParentId()) ? source.getName() + COPY_SUFFIX : source.getName();
        Asset rootCopy = insertCopy(source, parent, freeName(newParentId, rootName), batchId);

        // Breadth-first over the originals; each entry pairs an original with its copy's node
        int copied = 1;
        Deque<Map.Entry<Asset, ResolvedNode>> queue = new ArrayDeque<>();
        queue.add(Map.entry(source, nodeOf(rootCopy, parent)));
        Set<String> visited = new HashSet<>(Set.of(source.getId(), rootCopy.getId()));
        while (!queue.isEmpty()) {
            Map.Entry<Asset, ResolvedNode> entry = queue.poll();
            for (Asset child : assetRepository.findByParentIdOrderByNameAsc(entry.getKey().getId())) {
                if (!visited.add(child.getId())) {
                    continue;
                }
                Asset childCopy = insertCopy(child, entry.getValue(), child.getName(), batchId);
                visited.add(childCopy.getId());
                queue.add(Map.entry(child, nodeOf(childCopy, entry.getValue())));
                copied++;
            }
        }

        log.info("[copy] end batchId={} source={} copy={} assets={}", batchId, assetId, rootCopy.getId(), copied);
        return CopyResult.builder()
                .sourceId(source.getId())
                .assetId(rootCopy.getId())
                .urn(rootCopy.getUrn())
                .name(rootCopy.getName())
                .parentId(rootCopy.getParentId())
                .copiedCount(copied)
                .batchId(batchId)
                .build();
    }

    private void checkNotInsideSource(Asset source, Asset target) {
        if (target.getId().equals(source.getId())) {
            throw new InvalidHierarchyException("Cannot copy '" + source.getName() + "' under itself");
        }
        for (Asset ancestor : hierarchyService.ancestorsOf(target)) {
            if (ancestor.getId().equals(source.getId())) {
                throw new InvalidHierarchyException(String.format(
                        "Cannot copy '%s' under its own descendant '%s'", source.getName(), target.getName()));
            }
        }
    }

    // First of name, "name (2)", "name (3)", ... not taken under the parent
    private String freeName(String parentId, String name) {
        String candidate = name;
        int counter = 2;
        while (assetRepository.findByParentIdAndName(parentId, candidate).isPresent()) {
            candidate = name + " (" + counter++ + ")";
        }
        return candidate;
    }

    private Asset insertCopy(Asset original, ResolvedNode parent, String name, String batchId) {
        List<String> ancestorNames = parent != null ? parent.path() : List.of();
        Instant now = clock.instant();
        Asset copy = Asset.builder()
                .id(UUID.randomUUID().toString())
                .urn(urnGenerator.generate(original.getAssetType(), ancestorNames, name))
                .name(name)
                .assetType(original.getAssetType())
                .parentId(parent != null ? parent.assetId() : null)
                .status(original.getStatus())
                .description(original.getDescription())
                .version(original.getVersion())
                .externalSystem(original.getExternalSystem())
                .lifecycleStage(original.getLifecycleStage())
                .properties(original.getProperties() != null ? new HashMap<>(original.getProperties()) : new HashMap<>())
                .tags(original.getTags() != null ? new LinkedHashSet<>(original.getTags()) : new LinkedHashSet<>())
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            Asset saved = assetRepository.insert(copy);
            auditTrailService.recordAssetCreated(saved, batchId);
            return saved;
        } catch (DuplicateKeyException e) {
            throw new InvalidRecordException("Conflicting concurrent write while copying '" + name + "'", e);
        }
    }

    private static ResolvedNode nodeOf(Asset copy, ResolvedNode parent) {
        return parent != null
                ? parent.child(copy.getId(), copy.getName(), copy.getAssetType())
                : new ResolvedNode(copy.getId(), copy.getName(), copy.getAssetType(), List.of(copy.getName()));
    }
}
