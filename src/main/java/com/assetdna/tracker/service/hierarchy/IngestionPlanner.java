package com.assetdna.tracker.service.hierarchy;

import com.assetdna.tracker.dto.asset.IngestionOutcome;
import com.assetdna.tracker.dto.asset.RawAssetRecord;
import com.assetdna.tracker.exception.AmbiguousParentException;
import com.assetdna.tracker.exception.AssetDnaException;
import com.assetdna.tracker.exception.CyclicHierarchyException;
import com.assetdna.tracker.exception.InvalidRecordException;
import com.assetdna.tracker.model.AssetStatus;
import com.assetdna.tracker.model.AssetType;
import com.assetdna.tracker.service.hierarchy.IngestionPlan.PlannedRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Turns an unordered batch of records into a parent-first apply order.
 *
 * Pass 1 indexes every record by name and rejects malformed or duplicate rows.
 * Pass 2 links each record to its parent, either another record of the batch or a stored asset,
 * then orders the in-batch links with an iterative walk using in-progress/done marking.
 * Records are visited in canonical key order, so the plan does not depend on input order.
 * Nothing is written here; a cycle aborts planning before the batch touches the store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestionPlanner {

    private enum VisitState {
        IN_PROGRESS,
        DONE
    }

    private final IdentityResolver identityResolver;

    /**
     * @throws CyclicHierarchyException when parent references inside the batch form a loop
     */
    public IngestionPlan plan(List<RawAssetRecord> batch) {
        List<IngestionOutcome> rejected = new ArrayList<>();
        Map<String, PlannedRecord> byKey = new HashMap<>();
        Map<String, List<PlannedRecord>> byName = new HashMap<>();
        Map<String, PlannedRecord> byUrn = new HashMap<>();

        for (int i = 0; i < batch.size(); i++) {
            RawAssetRecord record = normalize(batch.get(i));
            if (!RawAssetRecord.isPresent(record.getName())) {
                rejected.add(IngestionOutcome.failed(i, record,
                        new InvalidRecordException("Record #" + i + " has no name")));
                continue;
            }

            PlannedRecord planned = new PlannedRecord(i, record);
            PlannedRecord first = byKey.putIfAbsent(planned.sortKey(), planned);
            if (first != null) {
                // The earliest occurrence of a key wins
                rejected.add(IngestionOutcome.failed(i, record, new InvalidRecordException(String.format(
                        "Duplicate record in batch: '%s' has the same parent as record #%d",
                        record.getName(), first.getIndex()))));
                continue;
            }
            byName.computeIfAbsent(record.getName(), k -> new ArrayList<>()).add(planned);
            if (record.getUrn() != null) {
                byUrn.putIfAbsent(record.getUrn(), planned);
            }
            parseFields(planned);
        }

        List<PlannedRecord> records = new ArrayList<>(byKey.values());
        records.sort(Comparator.comparing(PlannedRecord::sortKey));

        for (PlannedRecord planned : records) {
            if (!planned.getRecord().hasParentReference()) {
                continue;
            }
            try {
                linkParent(planned, byName, byUrn);
            } catch (AssetDnaException e) {
                if (!planned.hasFailed()) {
                    planned.setFailure(e);
                }
            }
        }

        List<PlannedRecord> order = topologicalOrder(records);
        log.debug("Planned {} records ({} rejected before planning)", order.size(), rejected.size());
        return new IngestionPlan(order, rejected);
    }

    private void parseFields(PlannedRecord planned) {
        RawAssetRecord record = planned.getRecord();
        Optional<AssetType> type = AssetType.fromLabel(record.getAssetType());
        if (type.isEmpty()) {
            planned.setFailure(new InvalidRecordException(String.format(
                    "Unknown asset type '%s' for '%s'", record.getAssetType(), record.getName())));
            return;
        }
        planned.setAssetType(type.get());

        if (RawAssetRecord.isPresent(record.getStatus())) {
            Optional<AssetStatus> status = AssetStatus.parse(record.getStatus());
            if (status.isEmpty()) {
                planned.setFailure(new InvalidRecordException(String.format(
                        "Unknown status '%s' for '%s'", record.getStatus(), record.getName())));
                return;
            }
            planned.setStatus(status.get());
        }
    }

    private void linkParent(PlannedRecord planned, Map<String, List<PlannedRecord>> byName,
                            Map<String, PlannedRecord> byUrn) {
        RawAssetRecord record = planned.getRecord();

        // An exported row names its parent by the URN the parent row carries in the same file
        if (!RawAssetRecord.isPresent(record.getParentId()) && record.getParentUrn() != null) {
            PlannedRecord byParentUrn = byUrn.get(record.getParentUrn());
            if (byParentUrn != null && byParentUrn != planned) {
                planned.setBatchParent(byParentUrn);
                return;
            }
        }

        Optional<ResolvedNode> explicit = identityResolver.findExplicitParent(record);
        if (explicit.isPresent()) {
            planned.setAnchor(explicit.get());
            return;
        }

        String parentName = record.getParentName();
        List<PlannedRecord> inBatch = byName.getOrDefault(parentName, List.of());
        if (inBatch.size() == 1) {
            planned.setBatchParent(inBatch.get(0));
            return;
        }
        if (inBatch.size() > 1) {
            String indexes = inBatch.stream()
                    .map(p -> "#" + p.getIndex())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new AmbiguousParentException(String.format(
                    "Parent name '%s' of '%s' matches several records in the batch (%s)",
                    parentName, record.getName(), indexes));
        }
        planned.setAnchor(identityResolver.findParentByName(parentName, record.getName()));
    }

    private List<PlannedRecord> topologicalOrder(List<PlannedRecord> records) {
        Map<PlannedRecord, VisitState> state = new IdentityHashMap<>();
        List<PlannedRecord> order = new ArrayList<>(records.size());

        for (PlannedRecord start : records) {
            if (state.get(start) == VisitState.DONE) {
                continue;
            }
            Deque<PlannedRecord> chain = new ArrayDeque<>();
            PlannedRecord current = start;
            while (current != null && state.get(current) != VisitState.DONE) {
                if (state.get(current) == VisitState.IN_PROGRESS) {
                    List<String> cycle = describeCycle(chain, current);
                    log.warn("Cyclic parent references detected: {}", cycle);
                    throw new CyclicHierarchyException(cycle);
                }
                state.put(current, VisitState.IN_PROGRESS);
                chain.push(current);
                current = current.getBatchParent();
            }
            // Topmost unvisited ancestor sits at the head of the chain
            while (!chain.isEmpty()) {
                PlannedRecord next = chain.pop();
                state.put(next, VisitState.DONE);
                order.add(next);
            }
        }
        return order;
    }

    private List<String> describeCycle(Deque<PlannedRecord> chain, PlannedRecord reentered) {
        List<PlannedRecord> walked = new ArrayList<>(chain);
        Collections.reverse(walked);
        int start = walked.indexOf(reentered);
        List<String> names = walked.subList(start, walked.size()).stream()
                .map(PlannedRecord::name)
                .collect(Collectors.toCollection(ArrayList::new));
        names.add(reentered.name());
        return names;
    }

    private RawAssetRecord normalize(RawAssetRecord record) {
        return record.toBuilder()
                .name(trimToNull(record.getName()))
                .urn(trimToNull(record.getUrn()))
                .assetType(trimToNull(record.getAssetType()))
                .parentName(trimToNull(record.getParentName()))
                .parentId(trimToNull(record.getParentId()))
                .parentUrn(trimToNull(record.getParentUrn()))
                .build();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
