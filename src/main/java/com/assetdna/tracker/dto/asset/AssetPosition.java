package com.assetdna.tracker.dto.asset;

import com.assetdna.tracker.model.Asset;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Where an asset sits in the tree: its ancestors (root first), child count and display path.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetPosition {
    private Asset asset;
    private List<Asset> ancestors;
    private long childCount;
    private int depth;
    private String path;
}
