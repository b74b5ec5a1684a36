package com.assetdna.tracker.repository;

import com.assetdna.tracker.dto.asset.AssetSearchCriteria;
import com.assetdna.tracker.model.Asset;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface AssetSearchRepository {

    Page<Asset> search(AssetSearchCriteria criteria, Pageable pageable);
}
