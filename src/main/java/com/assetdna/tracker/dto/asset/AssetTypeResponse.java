package com.assetdna.tracker.dto.asset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetTypeResponse {
    private String name;
    private String label;
    private String code;
    private int rank;
    private boolean leaf;
}
