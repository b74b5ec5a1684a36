package com.assetdna.tracker.service.bom;

import com.assetdna.tracker.exception.AssetNotFoundException;
import com.assetdna.tracker.exception.DuplicateBomItemException;
import com.assetdna.tracker.exception.InvalidRecordException;
import com.assetdna.tracker.exception.NonMonotonicSnapshotException;
import com.assetdna.tracker.exception.SnapshotNotFoundException;
import com.assetdna.tracker.model.BomItem;
import com.assetdna.tracker.model.BomSnapshot;
import com.assetdna.tracker.repository.AssetRepository;
import com.assetdna.tracker.repository.BomSnapshotRepository;
import com.assetdna.tracker.service.audit.AuditTrailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only store of BOM snapshots.
 *
 * A snapshot is the full BOM of an asset as of its timestamp and is never modified. Regular appends
 * must move forward in time; {@link #backfill} is the only way to insert into the past.
 * Appends for one asset are serialized by an in-process lock, and across processes by the unique
 * (assetId, sequence) index. The next sequence is read before the latest timestamp: a snapshot
 * written by another process after the sequence read either shows up in the timestamp check or
 * takes the same sequence and makes this insert fail. Locks are striped by asset id, so their
 * number stays fixed however many assets are written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotStore {

    private final BomSnapshotRepository snapshotRepository;
    private final AssetRepository assetRepository;
    private final AuditTrailService auditTrailService;
    private final Clock clock;

    static final int LOCK_STRIPES = 64;

    private final ReentrantLock[] assetLocks = newLockStripes();

    public String append(String assetId, Instant timestamp, List<BomItem> items) {
        return append(assetId, timestamp, items, null);
    }

    /**
     * @return id of the new snapshot
     * @throws NonMonotonicSnapshotException when {@code timestamp} is not after the latest snapshot
     */
    public String append(String assetId, Instant timestamp, List<BomItem> items, String source) {
        return write(assetId, timestamp, items, source, false);
    }

    public String backfill(String assetId, Instant timestamp, List<BomItem> items) {
        return backfill(assetId, timestamp, items, null);
    }

    /**
     * Insert a snapshot at any point in time, including before existing ones.
     */
    public String backfill(String assetId, Instant timestamp, List<BomItem> items, String source) {
        return write(assetId, timestamp, items, source, true);
    }

    /**
     * Latest snapshot at or before {@code timestamp}; among equal timestamps the last inserted wins.
     */
    public Optional<BomSnapshot> latestBefore(String assetId, Instant timestamp) {
        return snapshotRepository.findTopByAssetIdAndTimestampLessThanEqualOrderByTimestampDescSequenceDesc(
                assetId, timestamp);
    }

    /**
     * Snapshots with {@code from <= timestamp <= to}, by timestamp then insertion sequence.
     */
    public List<BomSnapshot> allBetween(String assetId, Instant from, Instant to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Window start " + from + " is after its end " + to);
        }
        return snapshotRepository.findInWindow(assetId, from, to);
    }

    public Optional<BomSnapshot> latest(String assetId) {
        return snapshotRepository.findTopByAssetIdOrderByTimestampDescSequenceDesc(assetId);
    }

    public List<BomSnapshot> history(String assetId) {
        requireAsset(assetId);
        return snapshotRepository.findByAssetIdOrderByTimestampAscSequenceAsc(assetId);
    }

    public BomSnapshot get(String snapshotId) {
        return snapshotRepository.findById(snapshotId)
                .orElseThrow(() -> new SnapshotNotFoundException("BOM snapshot not found with id: " + snapshotId));
    }

    public BomSnapshot get(String assetId, String snapshotId) {
        BomSnapshot snapshot = get(snapshotId);
        if (!snapshot.getAssetId().equals(assetId)) {
            throw new SnapshotNotFoundException(
                    "BOM snapshot " + snapshotId + " does not belong to asset " + assetId);
        }
        return snapshot;
    }

    private String write(String assetId, Instant timestamp, List<BomItem> items, String source, boolean backfill) {
        if (timestamp == null) {
            throw new InvalidRecordException("Snapshot timestamp is required");
        }
        requireAsset(assetId);
        List<BomItem> validated = validateItems(items);

        ReentrantLock lock = lockFor(assetId);
        lock.lock();
        try {
            long sequence = snapshotRepository.findTopByAssetIdOrderBySequenceDesc(assetId)
                    .map(s -> s.getSequence() + 1)
                    .orElse(1L);

            if (!backfill) {
                Optional<BomSnapshot> latest = latest(assetId);
                if (latest.isPresent() && !timestamp.isAfter(latest.get().getTimestamp())) {
                    log.warn("Rejected snapshot for asset {} at {}: latest is {}",
                            assetId, timestamp, latest.get().getTimestamp());
                    throw new NonMonotonicSnapshotException(String.format(
                            "Snapshot timestamp %s is not after the latest snapshot (%s) of asset %s; use backfill to insert history",
                            timestamp, latest.get().getTimestamp(), assetId));
                }
            }

            BomSnapshot snapshot = BomSnapshot.builder()
                    .id(UUID.randomUUID().toString())
                    .assetId(assetId)
                    .timestamp(timestamp)
                    .sequence(sequence)
                    .backfill(backfill)
                    .source(source)
                    .items(validated)
                    .createdAt(clock.instant())
                    .build();

            BomSnapshot saved;
            try {
                saved = snapshotRepository.insert(snapshot);
            } catch (DuplicateKeyException e) {
                throw new NonMonotonicSnapshotException(
                        "Concurrent snapshot append for asset " + assetId + "; retry the request", e);
            }
            auditTrailService.recordSnapshotAppended(saved);
            log.info("{} BOM snapshot {} for asset {} at {} (sequence={}, items={})",
                    backfill ? "Backfilled" : "Appended", saved.getId(), assetId, timestamp, sequence,
                    validated.size());
            return saved.getId();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String assetId) {
        return assetLocks[Math.floorMod(assetId.hashCode(), LOCK_STRIPES)];
    }

    private static ReentrantLock[] newLockStripes() {
        ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
        return stripes;
    }

    private List<BomItem> validateItems(List<BomItem> items) {
        if (items == null) {
            return new ArrayList<>();
        }
        Set<String> keys = new HashSet<>();
        List<BomItem> copies = new ArrayList<>(items.size());
        for (BomItem item : items) {
            if (item == null || item.getPartId() == null || item.getPartId().isBlank()) {
                throw new InvalidRecordException("Every BOM item needs a partId");
            }
            if (item.getQuantity() < 1) {
                throw new InvalidRecordException(String.format(
                        "Quantity of BOM item '%s' must be at least 1, was %d", item.identityKey(), item.getQuantity()));
            }
            if (!keys.add(item.identityKey())) {
                throw new DuplicateBomItemException(
                        "BOM item '" + item.identityKey() + "' appears more than once in the snapshot");
            }
            copies.add(item.toBuilder()
                    .properties(item.getProperties() != null ? new HashMap<>(item.getProperties()) : new HashMap<>())
                    .build());
        }
        return copies;
    }

    private void requireAsset(String assetId) {
        if (!assetRepository.existsById(assetId)) {
            throw AssetNotFoundException.forId(assetId);
        }
    }
}
