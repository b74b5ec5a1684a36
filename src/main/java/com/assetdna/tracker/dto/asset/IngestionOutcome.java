package com.assetdna.tracker.dto.asset;

import com.assetdna.tracker.exception.AssetDnaException;
import com.assetdna.tracker.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result for a single record of an ingestion batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionOutcome {

    public enum Status {
        CREATED,
        UPDATED,
        FAILED
    }

    private int recordIndex;
    private String name;
    private String parentName;
    private Status status;

    private String assetId;
    private String urn;
    private String assetType;

    private ErrorCode errorCode;
    private String message;

    @JsonIgnore
    private AssetDnaException failure;

    public static IngestionOutcome failed(int recordIndex, RawAssetRecord record, AssetDnaException failure) {
        return IngestionOutcome.builder()
                .recordIndex(recordIndex)
                .name(record.getName())
                .parentName(record.getParentName())
                .status(Status.FAILED)
                .errorCode(failure.getErrorCode())
                .message(failure.getMessage())
                .failure(failure)
                .build();
    }
}
