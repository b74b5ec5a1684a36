package com.assetdna.tracker.dto.asset;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One undecoded asset row as produced by an import adapter or API call.
 *
 * Values are kept as given; type and status parsing happens during ingestion so that a bad
 * value fails only its own record. Optional fields left null are not touched on update.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawAssetRecord {

    private String name;

    // URN of this row in an earlier export; lets later rows of the same batch name it as parent_urn
    private String urn;

    @JsonProperty("asset_type")
    @JsonAlias({"assetType", "type"})
    private String assetType;

    @JsonProperty("parent_name")
    @JsonAlias({"parentName", "parent"})
    private String parentName;

    // Explicit parent identity; wins over parent_name when present
    @JsonProperty("parent_id")
    @JsonAlias("parentId")
    private String parentId;

    @JsonProperty("parent_urn")
    @JsonAlias("parentUrn")
    private String parentUrn;

    private String description;

    private String status;

    private String version;

    @JsonProperty("external_id")
    @JsonAlias("externalId")
    private String externalId;

    @JsonProperty("external_system")
    @JsonAlias("externalSystem")
    private String externalSystem;

    private Map<String, Object> properties;

    private List<String> tags;

    @JsonProperty("lifecycle_stage")
    @JsonAlias("lifecycleStage")
    private String lifecycleStage;

    public boolean hasParentReference() {
        return isPresent(parentName) || isPresent(parentId) || isPresent(parentUrn);
    }

    public static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
