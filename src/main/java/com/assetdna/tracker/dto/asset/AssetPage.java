package com.assetdna.tracker.dto.asset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of the asset listing. {@code page} counts from 1.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetPage {
    private List<AssetListItem> content;
    private int page;
    private int pageSize;
    private long totalElements;
    private int totalPages;
}
