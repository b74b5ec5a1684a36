package com.assetdna.tracker.service.hierarchy;

import com.assetdna.tracker.dto.asset.IngestionOutcome;
import com.assetdna.tracker.dto.asset.RawAssetRecord;
import com.assetdna.tracker.exception.AssetDnaException;
import com.assetdna.tracker.model.AssetStatus;
import com.assetdna.tracker.model.AssetType;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Output of {@link IngestionPlanner}: records in apply order, parents first, plus the records that
 * were rejected before they could enter the dependency graph.
 */
@Getter
@RequiredArgsConstructor
public class IngestionPlan {

    private final List<PlannedRecord> order;
    private final List<IngestionOutcome> rejected;

    @Getter
    @Setter
    @RequiredArgsConstructor
    public static class PlannedRecord {
        private final int index;
        private final RawAssetRecord record;

        private AssetType assetType;
        private AssetStatus status;

        // At most one of these is set; neither for a root record
        private PlannedRecord batchParent;
        private ResolvedNode anchor;

        // Set when the record already failed during planning
        private AssetDnaException failure;

        public String name() {
            return record.getName();
        }

        /**
         * How the record names its parent: {@code id:}, {@code urn:} or {@code name:} prefixed, empty for roots.
         */
        public String parentReference() {
            if (RawAssetRecord.isPresent(record.getParentId())) {
                return "id:" + record.getParentId();
            }
            if (RawAssetRecord.isPresent(record.getParentUrn())) {
                return "urn:" + record.getParentUrn();
            }
            if (RawAssetRecord.isPresent(record.getParentName())) {
                return "name:" + record.getParentName();
            }
            return "";
        }

        /**
         * Canonical key of the record, independent of its input position.
         */
        public String sortKey() {
            return parentReference() + '\u0000' + record.getName();
        }

        public boolean hasFailed() {
            return failure != null;
        }
    }
}
