package com.chicu.streamcore.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Optional;

public interface AuditSnapshotRepository extends JpaRepository<AuditSnapshotEntity, String> {

    Optional<AuditSnapshotEntity> findFirstByAggregateIdOrderBySequenceDesc(String aggregateId);

    Optional<AuditSnapshotEntity> findFirstByAggregateIdAndTimestampLessThanEqualOrderBySequenceDesc(String aggregateId, Instant timestamp);
}
