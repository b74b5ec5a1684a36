package com.assetdna.tracker.repository;

import com.assetdna.tracker.model.Asset;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AssetRepository extends MongoRepository<Asset, String>, AssetSearchRepository {

    // A null parentId matches root assets
    Optional<Asset> findByParentIdAndName(String parentId, String name);

    List<Asset> findByName(String name);

    List<Asset> findByParentIdOrderByNameAsc(String parentId);

    List<Asset> findByParentIdIsNullOrderByNameAsc();

    Optional<Asset> findByUrn(String urn);

    long countByParentId(String parentId);
}
