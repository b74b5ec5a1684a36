package com.assetdna.tracker.repository;

import com.assetdna.tracker.model.BomSnapshot;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface BomSnapshotRepository extends MongoRepository<BomSnapshot, String> {

    Optional<BomSnapshot> findTopByAssetIdOrderByTimestampDescSequenceDesc(String assetId);

    Optional<BomSnapshot> findTopByAssetIdOrderBySequenceDesc(String assetId);

    Optional<BomSnapshot> findTopByAssetIdAndTimestampLessThanEqualOrderByTimestampDescSequenceDesc(
            String assetId, Instant timestamp);

    // Both bounds inclusive; derived "Between" queries exclude them
    @Query(value = "{ 'assetId': ?0, 'timestamp': { '$gte': ?1, '$lte': ?2 } }",
            sort = "{ 'timestamp': 1, 'sequence': 1 }")
    List<BomSnapshot> findInWindow(String assetId, Instant from, Instant to);

    List<BomSnapshot> findByAssetIdOrderByTimestampAscSequenceAsc(String assetId);

    long countByCreatedAtAfter(Instant since);

    long countByAssetId(String assetId);
}
