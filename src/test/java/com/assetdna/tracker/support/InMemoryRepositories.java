package com.assetdna.tracker.support;

import com.assetdna.tracker.dto.asset.AssetSearchCriteria;
import com.assetdna.tracker.model.Asset;
import com.assetdna.tracker.model.AuditEvent;
import com.assetdna.tracker.model.BomSnapshot;
import com.assetdna.tracker.repository.AssetRepository;
import com.assetdna.tracker.repository.AuditEventRepository;
import com.assetdna.tracker.repository.BomSnapshotRepository;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

/**
 * Mockito-backed repositories that keep their rows in plain collections, including the unique
 * indexes the services rely on.
 */
public final class InMemoryRepositories {

    private static final Comparator<BomSnapshot> SNAPSHOT_ORDER = Comparator
            .comparing(BomSnapshot::getTimestamp)
            .thenComparingLong(BomSnapshot::getSequence);

    private InMemoryRepositories() {
    }

    public static AssetRepository assets(Map<String, Asset> rows) {
        AssetRepository repository = mock(AssetRepository.class);

        lenient().when(repository.insert(any(Asset.class))).thenAnswer(invocation -> {
            Asset asset = invocation.getArgument(0);
            boolean clash = rows.values().stream().anyMatch(existing ->
                    Objects.equals(existing.getParentId(), asset.getParentId())
                            && existing.getName().equals(asset.getName()));
            if (clash || rows.containsKey(asset.getId())) {
                throw new DuplicateKeyException("E11000 duplicate key: " + asset.getName());
            }
            rows.put(asset.getId(), asset);
            return asset;
        });
        lenient().when(repository.save(any(Asset.class))).thenAnswer(invocation -> {
            Asset asset = invocation.getArgument(0);
            rows.put(asset.getId(), asset);
            return asset;
        });
        lenient().when(repository.findById(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(rows.get(invocation.<String>getArgument(0))));
        lenient().when(repository.existsById(anyString()))
                .thenAnswer(invocation -> rows.containsKey(invocation.<String>getArgument(0)));
        lenient().when(repository.findAll()).thenAnswer(invocation -> new ArrayList<>(rows.values()));
        lenient().when(repository.count()).thenAnswer(invocation -> (long) rows.size());
        lenient().when(repository.findByParentIdAndName(any(), any())).thenAnswer(invocation -> {
            String parentId = invocation.getArgument(0);
            String name = invocation.getArgument(1);
            return rows.values().stream()
                    .filter(a -> Objects.equals(a.getParentId(), parentId) && a.getName().equals(name))
                    .findFirst();
        });
        lenient().when(repository.findByName(anyString())).thenAnswer(invocation -> rows.values().stream()
                .filter(a -> a.getName().equals(invocation.getArgument(0)))
                .toList());
        lenient().when(repository.findByUrn(anyString())).thenAnswer(invocation -> rows.values().stream()
                .filter(a -> a.getUrn().equals(invocation.getArgument(0)))
                .findFirst());
        lenient().when(repository.findByParentIdOrderByNameAsc(anyString())).thenAnswer(invocation -> rows.values().stream()
                .filter(a -> invocation.getArgument(0).equals(a.getParentId()))
                .sorted(Comparator.comparing(Asset::getName))
                .toList());
        lenient().when(repository.findByParentIdIsNullOrderByNameAsc()).thenAnswer(invocation -> rows.values().stream()
                .filter(a -> a.getParentId() == null)
                .sorted(Comparator.comparing(Asset::getName))
                .toList());
        lenient().when(repository.countByParentId(anyString())).thenAnswer(invocation -> rows.values().stream()
                .filter(a -> invocation.getArgument(0).equals(a.getParentId()))
                .count());
        lenient().when(repository.search(any(AssetSearchCriteria.class), any(Pageable.class))).thenAnswer(invocation -> {
            AssetSearchCriteria criteria = invocation.getArgument(0);
            Pageable pageable = invocation.getArgument(1);
            List<Asset> matches = rows.values().stream()
                    .filter(a -> criteria.getParentId() == null || criteria.getParentId().equals(a.getParentId()))
                    .filter(a -> criteria.getAssetType() == null || criteria.getAssetType() == a.getAssetType())
                    .filter(a -> criteria.getStatus() == null || criteria.getStatus() == a.getStatus())
                    .filter(a -> criteria.getNameContains() == null || a.getName().toLowerCase(Locale.ROOT)
                            .contains(criteria.getNameContains().toLowerCase(Locale.ROOT)))
                    .sorted(assetOrder(pageable.getSort()))
                    .toList();
            if (pageable.isUnpaged()) {
                return new PageImpl<>(matches, pageable, matches.size());
            }
            int from = (int) Math.min(pageable.getOffset(), matches.size());
            int to = Math.min(from + pageable.getPageSize(), matches.size());
            return new PageImpl<>(matches.subList(from, to), pageable, matches.size());
        });
        return repository;
    }

    private static Comparator<Asset> assetOrder(Sort sort) {
        Comparator<Asset> order = (a, b) -> 0;
        for (Sort.Order field : sort) {
            Function<Asset, String> key = switch (field.getProperty()) {
                case "urn" -> Asset::getUrn;
                case "assetType" -> a -> a.getAssetType().name();
                case "status" -> a -> a.getStatus().name();
                case "createdAt" -> a -> String.valueOf(a.getCreatedAt());
                case "updatedAt" -> a -> String.valueOf(a.getUpdatedAt());
                default -> Asset::getName;
            };
            Comparator<Asset> byField = Comparator.comparing(key);
            order = order.thenComparing(field.isDescending() ? byField.reversed() : byField);
        }
        return order;
    }

    public static BomSnapshotRepository snapshots(List<BomSnapshot> rows) {
        BomSnapshotRepository repository = mock(BomSnapshotRepository.class);

        lenient().when(repository.insert(any(BomSnapshot.class))).thenAnswer(invocation -> {
            BomSnapshot snapshot = invocation.getArgument(0);
            boolean clash = rows.stream().anyMatch(existing ->
                    existing.getAssetId().equals(snapshot.getAssetId())
                            && existing.getSequence() == snapshot.getSequence());
            if (clash) {
                throw new DuplicateKeyException("E11000 duplicate key: sequence " + snapshot.getSequence());
            }
            rows.add(snapshot);
            return snapshot;
        });
        lenient().when(repository.findById(anyString())).thenAnswer(invocation -> rows.stream()
                .filter(s -> s.getId().equals(invocation.getArgument(0)))
                .findFirst());
        lenient().when(repository.count()).thenAnswer(invocation -> (long) rows.size());
        lenient().when(repository.findTopByAssetIdOrderByTimestampDescSequenceDesc(anyString()))
                .thenAnswer(invocation -> forAsset(rows, invocation.getArgument(0)).max(SNAPSHOT_ORDER));
        lenient().when(repository.findTopByAssetIdOrderBySequenceDesc(anyString()))
                .thenAnswer(invocation -> forAsset(rows, invocation.getArgument(0))
                        .max(Comparator.comparingLong(BomSnapshot::getSequence)));
        lenient().when(repository.findTopByAssetIdAndTimestampLessThanEqualOrderByTimestampDescSequenceDesc(anyString(), any()))
                .thenAnswer(invocation -> {
                    Instant at = invocation.getArgument(1);
                    return forAsset(rows, invocation.getArgument(0))
                            .filter(s -> !s.getTimestamp().isAfter(at))
                            .max(SNAPSHOT_ORDER);
                });
        lenient().when(repository.findInWindow(anyString(), any(), any())).thenAnswer(invocation -> {
            Instant from = invocation.getArgument(1);
            Instant to = invocation.getArgument(2);
            return forAsset(rows, invocation.getArgument(0))
                    .filter(s -> !s.getTimestamp().isBefore(from) && !s.getTimestamp().isAfter(to))
                    .sorted(SNAPSHOT_ORDER)
                    .toList();
        });
        lenient().when(repository.findByAssetIdOrderByTimestampAscSequenceAsc(anyString()))
                .thenAnswer(invocation -> forAsset(rows, invocation.getArgument(0)).sorted(SNAPSHOT_ORDER).toList());
        lenient().when(repository.countByAssetId(anyString()))
                .thenAnswer(invocation -> forAsset(rows, invocation.getArgument(0)).count());
        lenient().when(repository.countByCreatedAtAfter(any())).thenAnswer(invocation -> {
            Instant since = invocation.getArgument(0);
            return rows.stream().filter(s -> s.getCreatedAt().isAfter(since)).count();
        });
        return repository;
    }

    public static AuditEventRepository auditEvents(List<AuditEvent> rows) {
        AuditEventRepository repository = mock(AuditEventRepository.class);
        lenient().when(repository.save(any(AuditEvent.class))).thenAnswer(invocation -> {
            AuditEvent event = invocation.getArgument(0);
            rows.add(event);
            return event;
        });
        return repository;
    }

    private static Stream<BomSnapshot> forAsset(List<BomSnapshot> rows, String assetId) {
        return rows.stream().filter(s -> s.getAssetId().equals(assetId));
    }
}
