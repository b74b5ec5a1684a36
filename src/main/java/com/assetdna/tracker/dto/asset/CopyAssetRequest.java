package com.assetdna.tracker.dto.asset;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Target of a subtree copy; a null parent makes the copy a root.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CopyAssetRequest {

    @JsonProperty("new_parent_id")
    @JsonAlias("newParentId")
    private String newParentId;
}
