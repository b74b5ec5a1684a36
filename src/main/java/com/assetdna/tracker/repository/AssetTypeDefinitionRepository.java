package com.assetdna.tracker.repository;

import com.assetdna.tracker.model.AssetTypeDefinition;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AssetTypeDefinitionRepository extends MongoRepository<AssetTypeDefinition, String> {
}
