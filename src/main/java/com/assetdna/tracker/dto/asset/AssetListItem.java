package com.assetdna.tracker.dto.asset;

import com.assetdna.tracker.model.Asset;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetListItem {
    @JsonUnwrapped
    private Asset asset;
    private long bomCount;
}
