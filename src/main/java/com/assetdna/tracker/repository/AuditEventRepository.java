package com.assetdna.tracker.repository;

import com.assetdna.tracker.model.AuditEvent;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface AuditEventRepository extends MongoRepository<AuditEvent, String> {

    List<AuditEvent> findByEntityIdOrderByOccurredAtAsc(String entityId);

    List<AuditEvent> findByAssetIdOrderByOccurredAtAsc(String assetId);

    List<AuditEvent> findByOccurredAtBetweenOrderByOccurredAtAsc(Instant from, Instant to);

    List<AuditEvent> findByBatchIdOrderByOccurredAtAsc(String batchId);
}
