package com.assetdna.tracker.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeSummary {
    private int added;
    private int removed;
    private int modified;
    private int unchanged;

    public int getTotalChanges() {
        return added + removed + modified;
    }
}
