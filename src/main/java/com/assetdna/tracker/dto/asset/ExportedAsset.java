package com.assetdna.tracker.dto.asset;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Export row. Field names match the import columns so an export can be re-imported as is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "urn", "name", "description", "asset_type", "parent_name", "parent_urn", "status", "lifecycle_stage",
        "external_id", "external_system", "version", "properties", "tags", "created_at", "updated_at"})
public class ExportedAsset {

    @JacksonXmlProperty(isAttribute = true)
    private String id;

    @JacksonXmlProperty(isAttribute = true)
    private String urn;

    private String name;

    private String description;

    @JsonProperty("asset_type")
    private String assetType;

    @JsonProperty("parent_name")
    private String parentName;

    @JsonProperty("parent_urn")
    private String parentUrn;

    private String status;

    @JsonProperty("lifecycle_stage")
    private String lifecycleStage;

    @JsonProperty("external_id")
    private String externalId;

    @JsonProperty("external_system")
    private String externalSystem;

    private String version;

    private Map<String, Object> properties;

    @JacksonXmlElementWrapper(localName = "tags")
    @JacksonXmlProperty(localName = "tag")
    private List<String> tags;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;
}
