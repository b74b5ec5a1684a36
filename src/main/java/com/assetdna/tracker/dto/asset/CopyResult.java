package com.assetdna.tracker.dto.asset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CopyResult {
    private String sourceId;
    private String assetId;
    private String urn;
    private String name;
    private String parentId;
    private int copiedCount;
    private String batchId;
}
