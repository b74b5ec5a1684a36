package com.assetdna.tracker.service.io;

import com.assetdna.tracker.dto.asset.RawAssetRecord;
import com.assetdna.tracker.exception.InvalidRecordException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Turns an uploaded CSV, JSON or XML document into raw asset records.
 *
 * Decoding only reshapes the input. Type, status and parent checks happen during ingestion, so a
 * row with a bad value still reaches the ingestion report with its own error.
 */
@Component
@Slf4j
public class AssetRecordDecoder {

    static final List<String> REQUIRED_CSV_COLUMNS = List.of("name", "asset_type", "parent_name");

    private static final TypeReference<Map<String, Object>> PROPERTIES_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();
    private final XmlMapper xmlMapper = new XmlMapper();

    public AssetRecordDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<RawAssetRecord> decode(DataFormat format, InputStream content) {
        try {
            List<RawAssetRecord> records = switch (format) {
                case CSV -> decodeCsv(content);
                case JSON -> decodeJson(content);
                case XML -> decodeXml(content);
            };
            log.info("Decoded {} asset records from {}", records.size(), format);
            return records;
        } catch (JsonProcessingException e) {
            throw new InvalidRecordException("Could not read " + format + " content: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidRecordException("Could not read " + format + " content: " + e.getMessage(), e);
        }
    }

    private List<RawAssetRecord> decodeCsv(InputStream content) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<RawAssetRecord> records = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerFor(Map.class).with(schema).readValues(content)) {
            if (!rows.hasNextValue()) {
                return records;
            }
            CsvSchema header = (CsvSchema) rows.getParserSchema();
            List<String> missing = REQUIRED_CSV_COLUMNS.stream()
                    .filter(column -> header.column(column) == null)
                    .toList();
            if (!missing.isEmpty()) {
                throw new InvalidRecordException("CSV must contain columns " + REQUIRED_CSV_COLUMNS + "; missing " + missing);
            }
            int line = 1;
            while (rows.hasNextValue()) {
                line++;
                records.add(fromCsvRow(rows.nextValue(), line));
            }
        }
        return records;
    }

    private RawAssetRecord fromCsvRow(Map<String, String> row, int line) {
        Map<String, Object> properties = null;
        String rawProperties = cell(row, "properties");
        if (rawProperties != null) {
            try {
                properties = objectMapper.readValue(rawProperties, PROPERTIES_TYPE);
            } catch (JsonProcessingException e) {
                throw new InvalidRecordException("Line " + line + ": properties is not a JSON object", e);
            }
        }

        List<String> tags = null;
        String rawTags = cell(row, "tags");
        if (rawTags != null) {
            tags = Arrays.stream(rawTags.split(","))
                    .map(String::trim)
                    .filter(tag -> !tag.isEmpty())
                    .toList();
        }

        return RawAssetRecord.builder()
                .name(cell(row, "name"))
                .urn(cell(row, "urn"))
                .assetType(cell(row, "asset_type"))
                .parentName(cell(row, "parent_name"))
                .parentId(cell(row, "parent_id"))
                .parentUrn(cell(row, "parent_urn"))
                .description(cell(row, "description"))
                .status(cell(row, "status"))
                .version(cell(row, "version"))
                .externalId(cell(row, "external_id"))
                .externalSystem(cell(row, "external_system"))
                .lifecycleStage(cell(row, "lifecycle_stage"))
                .properties(properties)
                .tags(tags)
                .build();
    }

    // Empty cells mean "not given"
    private static String cell(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private List<RawAssetRecord> decodeJson(InputStream content) throws IOException {
        JsonNode root = objectMapper.readTree(content);
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new ArrayList<>();
        }
        if (root.isObject()) {
            return List.of(objectMapper.treeToValue(root, RawAssetRecord.class));
        }
        if (!root.isArray()) {
            throw new InvalidRecordException("JSON import must be an object or an array of objects");
        }
        List<RawAssetRecord> records = new ArrayList<>(root.size());
        for (JsonNode element : root) {
            records.add(objectMapper.treeToValue(element, RawAssetRecord.class));
        }
        return records;
    }

    /**
     * Expects {@code <assets><asset>...</asset></assets>}. A single child element is read back by
     * Jackson as an object rather than a one-element array, so both shapes are accepted.
     */
    private List<RawAssetRecord> decodeXml(InputStream content) throws IOException {
        JsonNode root = xmlMapper.readTree(content);
        List<RawAssetRecord> records = new ArrayList<>();
        if (root == null || !root.has("asset")) {
            return records;
        }
        for (JsonNode element : asList(root.get("asset"))) {
            if (!element.isObject()) {
                throw new InvalidRecordException("Every <asset> element needs child elements");
            }
            ObjectNode asset = (ObjectNode) element;
            normalizeXmlTags(asset);
            normalizeXmlProperties(asset);
            records.add(objectMapper.treeToValue(asset, RawAssetRecord.class));
        }
        return records;
    }

    private void normalizeXmlTags(ObjectNode asset) {
        JsonNode tags = asset.get("tags");
        if (tags == null) {
            return;
        }
        ArrayNode normalized = JsonNodeFactory.instance.arrayNode();
        if (tags.isObject() && tags.has("tag")) {
            asList(tags.get("tag")).forEach(tag -> normalized.add(tag.asText()));
        } else if (tags.isTextual() && !tags.asText().isBlank()) {
            Arrays.stream(tags.asText().split(","))
                    .map(String::trim)
                    .filter(tag -> !tag.isEmpty())
                    .forEach(normalized::add);
        }
        asset.set("tags", normalized);
    }

    private void normalizeXmlProperties(ObjectNode asset) {
        JsonNode properties = asset.get("properties");
        if (properties != null && !properties.isObject()) {
            // <properties/> comes back as an empty string
            asset.set("properties", JsonNodeFactory.instance.objectNode());
        }
    }

    private static List<JsonNode> asList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            List<JsonNode> items = new ArrayList<>(node.size());
            node.forEach(items::add);
            return items;
        }
        return List.of(node);
    }
}
