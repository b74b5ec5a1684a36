package com.assetdna.tracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-only seed row mirroring one {@link AssetType} constant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "asset_types")
public class AssetTypeDefinition {

    @Id
    private String code;

    private String label;

    private int rank;

    private boolean leaf;

    public static AssetTypeDefinition of(AssetType type) {
        return AssetTypeDefinition.builder()
                .code(type.getCode())
                .label(type.getLabel())
                .rank(type.getRank())
                .leaf(type.isLeafVariant())
                .build();
    }
}
