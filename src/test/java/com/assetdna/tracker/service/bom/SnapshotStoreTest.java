package com.assetdna.tracker.service.bom;

import com.assetdna.tracker.exception.AssetNotFoundException;
import com.assetdna.tracker.exception.DuplicateBomItemException;
import com.assetdna.tracker.exception.InvalidRecordException;
import com.assetdna.tracker.exception.NonMonotonicSnapshotException;
import com.assetdna.tracker.exception.SnapshotNotFoundException;
import com.assetdna.tracker.model.Asset;
import com.assetdna.tracker.model.BomItem;
import com.assetdna.tracker.model.BomSnapshot;
import com.assetdna.tracker.repository.BomSnapshotRepository;
import com.assetdna.tracker.service.audit.AuditTrailService;
import com.assetdna.tracker.support.InMemoryRepositories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SnapshotStoreTest {

    private static final Instant JAN = Instant.parse("2024-01-15T00:00:00Z");
    private static final Instant FEB = Instant.parse("2024-02-15T00:00:00Z");
    private static final Instant MAR = Instant.parse("2024-03-15T00:00:00Z");

    @Mock
    private AuditTrailService auditTrailService;

    private List<BomSnapshot> snapshots;
    private BomSnapshotRepository snapshotRepository;
    private SnapshotStore snapshotStore;

    @BeforeEach
    void setUp() {
        Map<String, Asset> assets = new HashMap<>();
        assets.put("router", Asset.builder().id("router").name("Router-1").build());
        snapshots = new ArrayList<>();
        snapshotRepository = InMemoryRepositories.snapshots(snapshots);
        snapshotStore = new SnapshotStore(snapshotRepository, InMemoryRepositories.assets(assets),
                auditTrailService, Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void appendAssignsIncreasingSequenceAndAudits() {
        String first = snapshotStore.append("router", JAN, List.of(item("fw-1.0", 1)));
        String second = snapshotStore.append("router", FEB, List.of(item("fw-1.0", 1), item("psu-2", 2)), "otobo-sync");

        assertThat(snapshotStore.get(first).getSequence()).isEqualTo(1);
        BomSnapshot latest = snapshotStore.get(second);
        assertThat(latest.getSequence()).isEqualTo(2);
        assertThat(latest.getSource()).isEqualTo("otobo-sync");
        assertThat(latest.isBackfill()).isFalse();
        assertThat(latest.getCreatedAt()).isEqualTo(Instant.parse("2024-06-01T00:00:00Z"));

        ArgumentCaptor<BomSnapshot> audited = ArgumentCaptor.forClass(BomSnapshot.class);
        verify(auditTrailService, times(2)).recordSnapshotAppended(audited.capture());
        assertThat(audited.getAllValues()).extracting(BomSnapshot::getId).containsExactly(first, second);
    }

    @Test
    void appendAtOrBeforeLatestIsRejected() {
        snapshotStore.append("router", FEB, List.of(item("fw-1.0", 1)));

        assertThatThrownBy(() -> snapshotStore.append("router", FEB, List.of()))
                .isInstanceOf(NonMonotonicSnapshotException.class);
        assertThatThrownBy(() -> snapshotStore.append("router", JAN, List.of()))
                .isInstanceOf(NonMonotonicSnapshotException.class)
                .hasMessageContaining("backfill");
        assertThat(snapshots).hasSize(1);
    }

    @Test
    void backfillInsertsIntoThePast() {
        snapshotStore.append("router", MAR, List.of(item("fw-1.0", 1)));
        String backfilled = snapshotStore.backfill("router", JAN, List.of(item("fw-0.9", 1)));

        BomSnapshot snapshot = snapshotStore.get(backfilled);
        assertThat(snapshot.isBackfill()).isTrue();
        assertThat(snapshot.getSequence()).isEqualTo(2);
        assertThat(snapshotStore.history("router")).extracting(BomSnapshot::getTimestamp).containsExactly(JAN, MAR);
        assertThat(snapshotStore.latestBefore("router", FEB)).map(BomSnapshot::getId).contains(backfilled);
    }

    @Test
    void latestBeforePrefersLastInsertedAmongEqualTimestamps() {
        snapshotStore.append("router", FEB, List.of(item("a", 1)));
        String later = snapshotStore.backfill("router", FEB, List.of(item("b", 1)));

        assertThat(snapshotStore.latestBefore("router", FEB)).map(BomSnapshot::getId).contains(later);
        assertThat(snapshotStore.latestBefore("router", JAN)).isEmpty();
    }

    @Test
    void allBetweenIsInclusiveAndOrdered() {
        snapshotStore.append("router", JAN, List.of());
        snapshotStore.append("router", FEB, List.of());
        snapshotStore.append("router", MAR, List.of());

        assertThat(snapshotStore.allBetween("router", JAN, FEB)).extracting(BomSnapshot::getTimestamp)
                .containsExactly(JAN, FEB);
        assertThatThrownBy(() -> snapshotStore.allBetween("router", MAR, JAN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void duplicateItemKeyIsRejected() {
        assertThatThrownBy(() -> snapshotStore.append("router", JAN, List.of(item("fw-1.0", 1), item("fw-1.0", 2))))
                .isInstanceOf(DuplicateBomItemException.class)
                .hasMessageContaining("fw-1.0");
        assertThat(snapshots).isEmpty();
    }

    @Test
    void samePartInDifferentPositionsIsAllowed() {
        BomItem left = item("fan-80", 1).toBuilder().position("L").build();
        BomItem right = item("fan-80", 1).toBuilder().position("R").build();

        String id = snapshotStore.append("router", JAN, List.of(left, right));

        assertThat(snapshotStore.get(id).getItems()).extracting(BomItem::identityKey)
                .containsExactly("fan-80@L", "fan-80@R");
    }

    @Test
    void partIdContainingSeparatorDoesNotCollideWithPositionedPart() {
        BomItem plain = item("pkg@slot1", 1);
        BomItem positioned = item("pkg", 1).toBuilder().position("slot1").build();

        String id = snapshotStore.append("router", JAN, List.of(plain, positioned));

        assertThat(snapshotStore.get(id).getItems()).extracting(BomItem::identityKey)
                .containsExactly("pkg\\@slot1", "pkg@slot1");
    }

    @Test
    void appendRacingAnotherWriterIsRejected() {
        snapshotStore.append("router", JAN, List.of(item("fw-1.0", 1)));

        // Another process appends MAR right after this one has read the next sequence
        lenient().when(snapshotRepository.findTopByAssetIdOrderBySequenceDesc("router")).thenAnswer(invocation -> {
            Optional<BomSnapshot> top = snapshots.stream().max(Comparator.comparingLong(BomSnapshot::getSequence));
            snapshots.add(BomSnapshot.builder()
                    .id("other-writer")
                    .assetId("router")
                    .timestamp(MAR)
                    .sequence(top.map(BomSnapshot::getSequence).orElse(0L) + 1)
                    .createdAt(MAR)
                    .build());
            return top;
        });

        assertThatThrownBy(() -> snapshotStore.append("router", FEB, List.of(item("fw-1.1", 1))))
                .isInstanceOf(NonMonotonicSnapshotException.class);
        assertThat(snapshots).extracting(BomSnapshot::getTimestamp).containsExactly(JAN, MAR);
    }

    @Test
    void invalidItemsAreRejected() {
        assertThatThrownBy(() -> snapshotStore.append("router", JAN, List.of(item("fw-1.0", 0))))
                .isInstanceOf(InvalidRecordException.class);
        assertThatThrownBy(() -> snapshotStore.append("router", JAN, List.of(item(" ", 1))))
                .isInstanceOf(InvalidRecordException.class);
        assertThatThrownBy(() -> snapshotStore.append("router", null, List.of()))
                .isInstanceOf(InvalidRecordException.class);
        verify(auditTrailService, never()).recordSnapshotAppended(any());
    }

    @Test
    void storedItemsAreDetachedFromTheCallersList() {
        BomItem item = item("fw-1.0", 1);
        item.getProperties().put("vendor", "Acme");
        String id = snapshotStore.append("router", JAN, List.of(item));

        item.setQuantity(5);
        item.getProperties().put("vendor", "Other");

        BomItem stored = snapshotStore.get(id).getItems().get(0);
        assertThat(stored.getQuantity()).isEqualTo(1);
        assertThat(stored.getProperties()).containsEntry("vendor", "Acme");
    }

    @Test
    void unknownAssetOrForeignSnapshotIsNotFound() {
        assertThatThrownBy(() -> snapshotStore.append("ghost", JAN, List.of()))
                .isInstanceOf(AssetNotFoundException.class);

        String id = snapshotStore.append("router", JAN, List.of());
        assertThatThrownBy(() -> snapshotStore.get("other-asset", id))
                .isInstanceOf(SnapshotNotFoundException.class);
        assertThatThrownBy(() -> snapshotStore.get("missing"))
                .isInstanceOf(SnapshotNotFoundException.class);
    }

    static BomItem item(String partId, int quantity) {
        return BomItem.builder().partId(partId).name(partId).quantity(quantity).build();
    }
}
