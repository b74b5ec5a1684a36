package com.assetdna.tracker.repository;

import com.assetdna.tracker.dto.asset.AssetSearchCriteria;
import com.assetdna.tracker.model.Asset;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Filtered listing over the assets collection; only the filters that are set become criteria.
 */
@RequiredArgsConstructor
public class AssetSearchRepositoryImpl implements AssetSearchRepository {

    private final MongoTemplate mongoTemplate;

    @Override
    public Page<Asset> search(AssetSearchCriteria criteria, Pageable pageable) {
        Query query = new Query();
        if (criteria.getParentId() != null) {
            query.addCriteria(Criteria.where("parentId").is(criteria.getParentId()));
        }
        if (criteria.getAssetType() != null) {
            query.addCriteria(Criteria.where("assetType").is(criteria.getAssetType().name()));
        }
        if (criteria.getStatus() != null) {
            query.addCriteria(Criteria.where("status").is(criteria.getStatus().name()));
        }
        if (criteria.getNameContains() != null && !criteria.getNameContains().isBlank()) {
            query.addCriteria(Criteria.where("name")
                    .regex(Pattern.compile(Pattern.quote(criteria.getNameContains().trim()), Pattern.CASE_INSENSITIVE)));
        }

        // Count before paging is applied to the query
        long total = mongoTemplate.count(query, Asset.class);
        if (total == 0) {
            return new PageImpl<>(List.of(), pageable, 0);
        }
        List<Asset> content = mongoTemplate.find(query.with(pageable), Asset.class);
        return new PageImpl<>(content, pageable, total);
    }
}
