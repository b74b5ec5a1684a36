package com.assetdna.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * One line of a BOM snapshot. Embedded in {@link BomSnapshot}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BomItem {

    // Tracked asset id or external part number
    private String partId;

    // Slot designator when the same part is fitted more than once
    private String position;

    private String name;

    @Builder.Default
    private int quantity = 1;

    private String version;

    @Builder.Default
    private Map<String, Object> properties = new HashMap<>();

    /**
     * Identity of this line within a snapshot: {@code partId} or {@code partId@position}.
     * A literal {@code @} or backslash inside either part is backslash-escaped, so distinct
     * (partId, position) pairs never share a key.
     */
    @JsonIgnore
    public String identityKey() {
        if (position == null || position.isBlank()) {
            return escape(partId);
        }
        return escape(partId) + "@" + escape(position);
    }

    private static String escape(String value) {
        if (value == null) {
            return null;
        }
        return value.replace("\\", "\\\\").replace("@", "\\@");
    }
}
