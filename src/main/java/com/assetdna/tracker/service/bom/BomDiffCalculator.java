package com.assetdna.tracker.service.bom;

import com.assetdna.tracker.dto.report.ChangeRecord;
import com.assetdna.tracker.dto.report.ChangeRecord.Classification;
import com.assetdna.tracker.dto.report.ChangeRecord.FieldChange;
import com.assetdna.tracker.dto.report.ChangeSummary;
import com.assetdna.tracker.model.BomItem;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Diffs two BOM item sets by item identity key.
 *
 * Compared fields are quantity, version and each property key (reported as {@code properties.<key>}).
 * A missing version equals a null version. Numbers compare by value, so 2 and 2L are equal.
 */
@Component
public class BomDiffCalculator {

    private static final Comparator<ChangeRecord> REPORT_ORDER = Comparator
            .comparing(ChangeRecord::getClassification)
            .thenComparing(ChangeRecord::getItemKey);

    public List<ChangeRecord> diff(List<BomItem> baseline, List<BomItem> current, boolean includeUnchanged) {
        Map<String, BomItem> baselineMap = index(baseline);
        Map<String, BomItem> currentMap = index(current);
        List<ChangeRecord> changes = new ArrayList<>();

        // Added: only in current
        for (Map.Entry<String, BomItem> entry : currentMap.entrySet()) {
            if (!baselineMap.containsKey(entry.getKey())) {
                changes.add(ChangeRecord.builder()
                        .classification(Classification.ADDED)
                        .itemKey(entry.getKey())
                        .after(entry.getValue())
                        .build());
            }
        }

        // Removed: only in baseline
        for (Map.Entry<String, BomItem> entry : baselineMap.entrySet()) {
            if (!currentMap.containsKey(entry.getKey())) {
                changes.add(ChangeRecord.builder()
                        .classification(Classification.REMOVED)
                        .itemKey(entry.getKey())
                        .before(entry.getValue())
                        .build());
            }
        }

        // Modified or unchanged: in both
        for (Map.Entry<String, BomItem> entry : currentMap.entrySet()) {
            BomItem before = baselineMap.get(entry.getKey());
            if (before == null) {
                continue;
            }
            List<FieldChange> fieldChanges = compareItems(before, entry.getValue());
            if (!fieldChanges.isEmpty()) {
                changes.add(ChangeRecord.builder()
                        .classification(Classification.MODIFIED)
                        .itemKey(entry.getKey())
                        .before(before)
                        .after(entry.getValue())
                        .fieldChanges(fieldChanges)
                        .build());
            } else if (includeUnchanged) {
                changes.add(ChangeRecord.builder()
                        .classification(Classification.UNCHANGED)
                        .itemKey(entry.getKey())
                        .before(before)
                        .after(entry.getValue())
                        .build());
            }
        }

        changes.sort(REPORT_ORDER);
        return changes;
    }

    /**
     * Counts per classification. Unchanged items are counted even when not listed in {@code changes}.
     */
    public ChangeSummary summarize(List<BomItem> baseline, List<BomItem> current) {
        Map<String, Long> counts = diff(baseline, current, true).stream()
                .collect(Collectors.groupingBy(c -> c.getClassification().name(), Collectors.counting()));
        return ChangeSummary.builder()
                .added(counts.getOrDefault(Classification.ADDED.name(), 0L).intValue())
                .removed(counts.getOrDefault(Classification.REMOVED.name(), 0L).intValue())
                .modified(counts.getOrDefault(Classification.MODIFIED.name(), 0L).intValue())
                .unchanged(counts.getOrDefault(Classification.UNCHANGED.name(), 0L).intValue())
                .build();
    }

    List<FieldChange> compareItems(BomItem before, BomItem after) {
        List<FieldChange> changes = new ArrayList<>();
        if (before.getQuantity() != after.getQuantity()) {
            changes.add(fieldChange("quantity", before.getQuantity(), after.getQuantity()));
        }
        if (!Objects.equals(blankToNull(before.getVersion()), blankToNull(after.getVersion()))) {
            changes.add(fieldChange("version", blankToNull(before.getVersion()), blankToNull(after.getVersion())));
        }

        Map<String, Object> beforeProps = before.getProperties() != null ? before.getProperties() : Map.of();
        Map<String, Object> afterProps = after.getProperties() != null ? after.getProperties() : Map.of();
        SortedSet<String> keys = new TreeSet<>(beforeProps.keySet());
        keys.addAll(afterProps.keySet());
        for (String key : keys) {
            Object oldValue = beforeProps.get(key);
            Object newValue = afterProps.get(key);
            if (!valuesEqual(oldValue, newValue)) {
                changes.add(fieldChange("properties." + key, oldValue, newValue));
            }
        }
        return changes;
    }

    static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            if (!Double.isFinite(l.doubleValue()) || !Double.isFinite(r.doubleValue())) {
                return Double.compare(l.doubleValue(), r.doubleValue()) == 0;
            }
            return toBigDecimal(l).compareTo(toBigDecimal(r)) == 0;
        }
        if (left instanceof Map<?, ?> l && right instanceof Map<?, ?> r) {
            if (!l.keySet().equals(r.keySet())) {
                return false;
            }
            return l.keySet().stream().allMatch(k -> valuesEqual(l.get(k), r.get(k)));
        }
        if (left instanceof List<?> l && right instanceof List<?> r) {
            if (l.size() != r.size()) {
                return false;
            }
            for (int i = 0; i < l.size(); i++) {
                if (!valuesEqual(l.get(i), r.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }

    private Map<String, BomItem> index(List<BomItem> items) {
        Map<String, BomItem> byKey = new LinkedHashMap<>();
        if (items != null) {
            for (BomItem item : items) {
                byKey.putIfAbsent(item.identityKey(), item);
            }
        }
        return byKey;
    }

    private FieldChange fieldChange(String field, Object before, Object after) {
        return FieldChange.builder().field(field).before(before).after(after).build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
