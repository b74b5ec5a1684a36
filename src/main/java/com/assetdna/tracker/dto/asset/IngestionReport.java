package com.assetdna.tracker.dto.asset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one ingestion batch. Every input record appears in exactly one of the lists.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionReport {

    private String batchId;
    private int totalRecords;
    private Instant completedAt;

    @Builder.Default
    private List<IngestionOutcome> created = new ArrayList<>();

    @Builder.Default
    private List<IngestionOutcome> updated = new ArrayList<>();

    @Builder.Default
    private List<IngestionOutcome> failed = new ArrayList<>();

    public boolean isSuccess() {
        return failed.isEmpty();
    }

    public void add(IngestionOutcome outcome) {
        switch (outcome.getStatus()) {
            case CREATED -> created.add(outcome);
            case UPDATED -> updated.add(outcome);
            case FAILED -> failed.add(outcome);
        }
    }
}
