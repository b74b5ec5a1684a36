package com.assetdna.tracker.service.hierarchy;

import com.assetdna.tracker.config.AssetDnaProperties;
import com.assetdna.tracker.dto.asset.CopyResult;
import com.assetdna.tracker.exception.InvalidHierarchyException;
import com.assetdna.tracker.exception.OrphanAssetException;
import com.assetdna.tracker.model.Asset;
import com.assetdna.tracker.model.AssetType;
import com.assetdna.tracker.model.AuditEvent;
import com.assetdna.tracker.model.BomSnapshot;
import com.assetdna.tracker.repository.AssetRepository;
import com.assetdna.tracker.repository.BomSnapshotRepository;
import com.assetdna.tracker.service.audit.AuditTrailService;
import com.assetdna.tracker.support.InMemoryRepositories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssetCopyServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    private Map<String, Asset> assets;
    private List<BomSnapshot> snapshots;
    private List<AuditEvent> auditEvents;
    private AssetCopyService copyService;

    @BeforeEach
    void setUp() {
        assets = new HashMap<>();
        snapshots = new ArrayList<>();
        auditEvents = new ArrayList<>();
        AssetRepository assetRepository = InMemoryRepositories.assets(assets);
        BomSnapshotRepository snapshotRepository = InMemoryRepositories.snapshots(snapshots);
        AssetDnaProperties properties = new AssetDnaProperties();
        AssetHierarchyService hierarchyService = new AssetHierarchyService(assetRepository, snapshotRepository);
        UrnGenerator urnGenerator = new UrnGenerator(properties);
        copyService = new AssetCopyService(assetRepository, hierarchyService,
                new IdentityResolver(assetRepository, hierarchyService, urnGenerator), new TaxonomyValidator(),
                urnGenerator, new AuditTrailService(InMemoryRepositories.auditEvents(auditEvents), CLOCK), CLOCK);

        put("nato", "NATO", null, AssetType.DOMAIN_SYSTEM_OF_SYSTEMS, "urn:assetdna:domain:NATO");
        put("awacs", "AWACS", "nato", AssetType.SYSTEM_ENVIRONMENT, "urn:assetdna:sys:NATO/AWACS");
        put("awacs2", "AWACS-2", "nato", AssetType.SYSTEM_ENVIRONMENT, "urn:assetdna:sys:NATO/AWACS-2");
        put("radar", "Radar", "awacs", AssetType.SUBSYSTEM_SERVICE, "urn:assetdna:subsys:NATO/AWACS/Radar");
        put("router", "Router-1", "radar", AssetType.CONFIGURATION_ITEM, "urn:assetdna:ci:NATO/AWACS/Radar/Router-1");
        assets.get("radar").setExternalId("OTOBO-7");
        assets.get("radar").getProperties().put("band", "S");
        snapshots.add(BomSnapshot.builder().id("s1").assetId("radar").sequence(1)
                .timestamp(CLOCK.instant()).createdAt(CLOCK.instant()).build());
    }

    @Test
    void copyUnderNewParentDerivesUrnsFromTheNewPath() {
        CopyResult result = copyService.copySubtree("radar", "awacs2");

        assertThat(result.getName()).isEqualTo("Radar");
        assertThat(result.getUrn()).isEqualTo("urn:assetdna:subsys:NATO/AWACS-2/Radar");
        assertThat(result.getParentId()).isEqualTo("awacs2");
        assertThat(result.getCopiedCount()).isEqualTo(2);

        Asset radarCopy = assets.get(result.getAssetId());
        assertThat(radarCopy.getExternalId()).isNull();
        assertThat(radarCopy.getProperties()).containsEntry("band", "S");
        Asset routerCopy = assets.values().stream()
                .filter(a -> result.getAssetId().equals(a.getParentId()))
                .findFirst().orElseThrow();
        assertThat(routerCopy.getName()).isEqualTo("Router-1");
        assertThat(routerCopy.getUrn()).isEqualTo("urn:assetdna:ci:NATO/AWACS-2/Radar/Router-1");
        assertThat(routerCopy.getId()).isNotEqualTo("router");
    }

    @Test
    void originalsAndTheirSnapshotsAreLeftAlone() {
        CopyResult result = copyService.copySubtree("radar", "awacs2");

        assertThat(assets).hasSize(7);
        assertThat(assets.get("radar").getUrn()).isEqualTo("urn:assetdna:subsys:NATO/AWACS/Radar");
        assertThat(assets.get("radar").getExternalId()).isEqualTo("OTOBO-7");
        assertThat(snapshots).extracting(BomSnapshot::getAssetId).containsExactly("radar");
        assertThat(auditEvents).hasSize(2)
                .allSatisfy(event -> assertThat(event.getBatchId()).isEqualTo(result.getBatchId()));
    }

    @Test
    void copyBesideTheOriginalGetsSuffixThenCounter() {
        CopyResult first = copyService.copySubtree("radar", "awacs");
        CopyResult second = copyService.copySubtree("radar", "awacs");

        assertThat(first.getName()).isEqualTo("Radar (Copy)");
        assertThat(second.getName()).isEqualTo("Radar (Copy) (2)");
        assertThat(first.getUrn()).isNotEqualTo(second.getUrn()).startsWith("urn:assetdna:subsys:NATO/AWACS/");
    }

    @Test
    void copyOfARootAsRootKeepsTheWholeTree() {
        CopyResult result = copyService.copySubtree("nato", null);

        assertThat(result.getName()).isEqualTo("NATO (Copy)");
        assertThat(result.getParentId()).isNull();
        assertThat(result.getCopiedCount()).isEqualTo(5);
        assertThat(assets).hasSize(10);
    }

    @Test
    void copyUnderItselfOrADescendantIsRefused() {
        assertThatThrownBy(() -> copyService.copySubtree("awacs", "router"))
                .isInstanceOf(InvalidHierarchyException.class)
                .hasMessageContaining("descendant");
        assertThatThrownBy(() -> copyService.copySubtree("awacs", "awacs"))
                .isInstanceOf(InvalidHierarchyException.class);
        assertThat(assets).hasSize(5);
        assertThat(auditEvents).isEmpty();
    }

    @Test
    void parentMustExistAndAcceptTheType() {
        assertThatThrownBy(() -> copyService.copySubtree("radar", "missing"))
                .isInstanceOf(OrphanAssetException.class);
        assertThatThrownBy(() -> copyService.copySubtree("awacs2", "radar"))
                .isInstanceOf(InvalidHierarchyException.class);
        assertThat(assets).hasSize(5);
    }

    private void put(String id, String name, String parentId, AssetType type, String urn) {
        assets.put(id, Asset.builder()
                .id(id)
                .name(name)
                .parentId(parentId)
                .assetType(type)
                .urn(urn)
                .build());
    }
}
