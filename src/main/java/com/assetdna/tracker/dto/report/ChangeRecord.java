package com.assetdna.tracker.dto.report;

import com.assetdna.tracker.model.BomItem;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Net change of one BOM line between a baseline and a current snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChangeRecord {

    public enum Classification {
        ADDED,
        REMOVED,
        MODIFIED,
        UNCHANGED
    }

    private Classification classification;
    private String itemKey;

    private BomItem before;
    private BomItem after;

    // Only for MODIFIED
    private List<FieldChange> fieldChanges;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldChange {
        private String field;
        private Object before;
        private Object after;
    }
}
