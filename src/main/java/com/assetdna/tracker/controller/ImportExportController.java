package com.assetdna.tracker.controller;

import com.assetdna.tracker.dto.asset.IngestionReport;
import com.assetdna.tracker.dto.asset.RawAssetRecord;
import com.assetdna.tracker.exception.InvalidRecordException;
import com.assetdna.tracker.service.hierarchy.HierarchyBuilder;
import com.assetdna.tracker.service.io.AssetExportService;
import com.assetdna.tracker.service.io.AssetRecordDecoder;
import com.assetdna.tracker.service.io.DataFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Bulk exchange with external asset systems (OTOBO and similar) as CSV, JSON or XML.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ImportExportController {

    private final AssetRecordDecoder recordDecoder;
    private final AssetExportService exportService;
    private final HierarchyBuilder hierarchyBuilder;

    @PostMapping(value = "/import/{format}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<IngestionReport> importAssets(
            @PathVariable String format,
            @RequestParam("file") MultipartFile file) {
        DataFormat dataFormat = DataFormat.parse(format);
        log.info("Importing {} file '{}' ({} bytes)", dataFormat, file.getOriginalFilename(), file.getSize());

        List<RawAssetRecord> records;
        try (InputStream content = file.getInputStream()) {
            records = recordDecoder.decode(dataFormat, content);
        } catch (IOException e) {
            throw new InvalidRecordException("Could not read uploaded file: " + e.getMessage(), e);
        }
        return ResponseEntity.ok(hierarchyBuilder.ingest(records));
    }

    @GetMapping("/export/{format}")
    public ResponseEntity<byte[]> exportAssets(@PathVariable String format) {
        DataFormat dataFormat = DataFormat.parse(format);
        log.info("Exporting assets as {}", dataFormat);

        byte[] body = exportService.export(dataFormat);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(dataFormat.getMediaType());
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename("assets." + dataFormat.getExtension())
                .build());
        return ResponseEntity.ok().headers(headers).body(body);
    }
}
