package com.assetdna.tracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A node of the managed infrastructure hierarchy.
 * The tree edge lives in the child through {@code parentId}; parents hold no child references.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "assets")
@CompoundIndex(name = "asset_parent_name_idx", def = "{'parentId': 1, 'name': 1}", unique = true)
public class Asset {

    @Id
    private String id;

    @Indexed(unique = true)
    private String urn;

    @Indexed
    private String name;

    private AssetType assetType;

    private String parentId;

    @Builder.Default
    private AssetStatus status = AssetStatus.ACTIVE;

    private String description;
    private String version;
    private String externalId;
    private String externalSystem;
    private String lifecycleStage;

    @Builder.Default
    private Map<String, Object> properties = new HashMap<>();

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    private Instant createdAt;
    private Instant updatedAt;

    public boolean isRoot() {
        return parentId == null;
    }
}
