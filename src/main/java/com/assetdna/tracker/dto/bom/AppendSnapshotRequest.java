package com.assetdna.tracker.dto.bom;

import com.assetdna.tracker.model.BomItem;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppendSnapshotRequest {

    @NotNull(message = "timestamp is required")
    private Instant timestamp;

    // The complete BOM as of timestamp; an empty list records an emptied BOM
    @NotNull(message = "items is required")
    @Builder.Default
    private List<BomItem> items = new ArrayList<>();

    private String source;
}
