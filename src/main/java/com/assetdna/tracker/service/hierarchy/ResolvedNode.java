package com.assetdna.tracker.service.hierarchy;

import com.assetdna.tracker.model.Asset;
import com.assetdna.tracker.model.AssetType;

import java.util.ArrayList;
import java.util.List;

/**
 * An asset whose identity is settled, as seen by its future children.
 *
 * @param path names from the root down to and including this asset
 */
public record ResolvedNode(String assetId, String name, AssetType assetType, List<String> path) {

    public ResolvedNode {
        path = List.copyOf(path);
    }

    public static ResolvedNode of(Asset asset, List<String> ancestorNames) {
        List<String> path = new ArrayList<>(ancestorNames);
        path.add(asset.getName());
        return new ResolvedNode(asset.getId(), asset.getName(), asset.getAssetType(), path);
    }

    public ResolvedNode child(String childId, String childName, AssetType childType) {
        List<String> childPath = new ArrayList<>(path);
        childPath.add(childName);
        return new ResolvedNode(childId, childName, childType, childPath);
    }
}
