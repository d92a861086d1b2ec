package com.chicu.streamcore.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface AuditEventRepository extends JpaRepository<AuditEventEntity, String> {

    List<AuditEventEntity> findByAggregateIdOrderBySequenceAsc(String aggregateId);

    List<AuditEventEntity> findByAggregateIdAndTimestampLessThanEqualOrderBySequenceAsc(String aggregateId, Instant timestamp);

    List<AuditEventEntity> findByAggregateIdAndSequenceGreaterThanOrderBySequenceAsc(String aggregateId, Long sequence);

    long countByTimestampGreaterThanEqual(Instant since);

    /**
     * [aggregateId, max(sequence)]: счётчики при старте.
     */
    @Query("""
           select e.aggregateId, max(e.sequence)
           from AuditEventEntity e
           group by e.aggregateId
           """)
    List<Object[]> findMaxSequencePerAggregate();

    @Query("""
           select e.eventType, count(e)
           from AuditEventEntity e
           group by e.eventType
           """)
    List<Object[]> countPerType();
}
