package com.assetdna.tracker.dto.asset;

import com.assetdna.tracker.model.AssetStatus;
import com.assetdna.tracker.model.AssetType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AssetTreeNode {
    private String id;
    private String urn;
    private String name;
    private AssetType assetType;
    private AssetStatus status;
    private int depth;

    // Set when the node has children beyond the requested depth
    private Boolean truncated;

    @Builder.Default
    private List<AssetTreeNode> children = new ArrayList<>();
}
