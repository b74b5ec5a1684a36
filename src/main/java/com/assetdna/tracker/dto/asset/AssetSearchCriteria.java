package com.assetdna.tracker.dto.asset;

import com.assetdna.tracker.model.AssetStatus;
import com.assetdna.tracker.model.AssetType;
import lombok.Builder;
import lombok.Value;

/**
 * Filters of the asset listing. A null field does not filter.
 */
@Value
@Builder
public class AssetSearchCriteria {
    String parentId;
    AssetType assetType;
    AssetStatus status;
    // Case-insensitive substring of the asset name
    String nameContains;
}
