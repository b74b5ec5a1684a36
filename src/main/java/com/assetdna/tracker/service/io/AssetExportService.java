package com.assetdna.tracker.service.io;

import com.assetdna.tracker.dto.asset.ExportedAsset;
import com.assetdna.tracker.exception.InvalidRecordException;
import com.assetdna.tracker.model.Asset;
import com.assetdna.tracker.repository.AssetRepository;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes the whole asset registry as CSV, JSON or XML, ordered by URN.
 */
@Service
@Slf4j
public class AssetExportService {

    private final AssetRepository assetRepository;
    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;
    private final XmlMapper xmlMapper;

    public AssetExportService(AssetRepository assetRepository, ObjectMapper objectMapper) {
        this.assetRepository = assetRepository;
        this.objectMapper = objectMapper;
        this.csvMapper = new CsvMapper();
        this.xmlMapper = new XmlMapper();
        this.xmlMapper.registerModule(new JavaTimeModule());
        this.xmlMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public byte[] export(DataFormat format) {
        List<ExportedAsset> rows = exportRows();
        log.info("Exporting {} assets as {}", rows.size(), format);
        try {
            return switch (format) {
                case JSON -> objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(rows);
                case XML -> xmlMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(new AssetsDocument(rows));
                case CSV -> writeCsv(rows);
            };
        } catch (JsonProcessingException e) {
            throw new InvalidRecordException("Could not write " + format + " export: " + e.getOriginalMessage(), e);
        }
    }

    List<ExportedAsset> exportRows() {
        List<Asset> assets = assetRepository.findAll();
        Map<String, Asset> byId = assets.stream()
                .collect(Collectors.toMap(Asset::getId, Function.identity(), (a, b) -> a));

        return assets.stream()
                .sorted(Comparator.comparing(Asset::getUrn, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(asset -> ExportedAsset.builder()
                        .id(asset.getId())
                        .urn(asset.getUrn())
                        .name(asset.getName())
                        .description(asset.getDescription())
                        .assetType(asset.getAssetType() != null ? asset.getAssetType().getLabel() : null)
                        .parentName(parentOf(asset, byId).map(Asset::getName).orElse(null))
                        .parentUrn(parentOf(asset, byId).map(Asset::getUrn).orElse(null))
                        .status(asset.getStatus() != null ? asset.getStatus().name().toLowerCase(Locale.ROOT) : null)
                        .lifecycleStage(asset.getLifecycleStage())
                        .externalId(asset.getExternalId())
                        .externalSystem(asset.getExternalSystem())
                        .version(asset.getVersion())
                        .properties(asset.getProperties() != null ? new TreeMap<>(asset.getProperties()) : Map.of())
                        .tags(asset.getTags() != null ? new ArrayList<>(asset.getTags()) : List.of())
                        .createdAt(asset.getCreatedAt())
                        .updatedAt(asset.getUpdatedAt())
                        .build())
                .toList();
    }

    private static Optional<Asset> parentOf(Asset asset, Map<String, Asset> byId) {
        return asset.getParentId() != null ? Optional.ofNullable(byId.get(asset.getParentId())) : Optional.empty();
    }

    private byte[] writeCsv(List<ExportedAsset> rows) throws JsonProcessingException {
        List<CsvRow> csvRows = new ArrayList<>(rows.size());
        for (ExportedAsset row : rows) {
            csvRows.add(CsvRow.of(row, objectMapper.writeValueAsString(row.getProperties())));
        }
        CsvSchema schema = csvMapper.schemaFor(CsvRow.class).withHeader();
        return csvMapper.writer(schema).writeValueAsBytes(csvRows);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JacksonXmlRootElement(localName = "assets")
    static class AssetsDocument {
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "asset")
        private List<ExportedAsset> asset;
    }

    /**
     * Flat CSV line; properties as a JSON object string, tags comma-separated.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"id", "urn", "name", "description", "asset_type", "parent_name", "parent_urn", "status", "lifecycle_stage",
            "external_id", "external_system", "version", "properties", "tags", "created_at", "updated_at"})
    static class CsvRow {
        private String id;
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
        private String properties;
        private String tags;
        @JsonProperty("created_at")
        private String createdAt;
        @JsonProperty("updated_at")
        private String updatedAt;

        static CsvRow of(ExportedAsset asset, String propertiesJson) {
            Function<Object, String> text = value -> value != null ? value.toString() : "";
            return new CsvRow(
                    text.apply(asset.getId()),
                    text.apply(asset.getUrn()),
                    text.apply(asset.getName()),
                    text.apply(asset.getDescription()),
                    text.apply(asset.getAssetType()),
                    text.apply(asset.getParentName()),
                    text.apply(asset.getParentUrn()),
                    text.apply(asset.getStatus()),
                    text.apply(asset.getLifecycleStage()),
                    text.apply(asset.getExternalId()),
                    text.apply(asset.getExternalSystem()),
                    text.apply(asset.getVersion()),
                    propertiesJson,
                    asset.getTags() != null ? String.join(",", asset.getTags()) : "",
                    text.apply(asset.getCreatedAt()),
                    text.apply(asset.getUpdatedAt()));
        }
    }
}
