package com.chicu.streamcore.compression;

import com.chicu.streamcore.audit.AuditEventEntity;
import com.chicu.streamcore.orders.OrderRecordEntity;
import com.chicu.streamcore.orders.OrderStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface CompressionRecordRepository extends JpaRepository<CompressionRecordEntity, CompressionRecordId> {

    /**
     * События старше порога, ещё не попавшие в архив. Самые старые первыми.
     */
    @Query("""
           select e from AuditEventEntity e
           where e.timestamp < :before
             and not exists (
                 select 1 from CompressionRecordEntity c
                 where c.recordId = e.id
                   and c.recordType = com.chicu.streamcore.compression.CompressedRecordType.EVENT
             )
           order by e.timestamp asc
           """)
    List<AuditEventEntity> findUncompressedEvents(@Param("before") Instant before, Pageable page);

    @Query("""
           select o from OrderRecordEntity o
           where o.status in :statuses
             and o.createdAt < :before
             and not exists (
                 select 1 from CompressionRecordEntity c
                 where c.recordId = o.id
                   and c.recordType = com.chicu.streamcore.compression.CompressedRecordType.TRADE
             )
           order by o.createdAt asc
           """)
    List<OrderRecordEntity> findUncompressedClosedOrders(@Param("statuses") Collection<OrderStatus> statuses,
                                                         @Param("before") Instant before,
                                                         Pageable page);

    /**
     * [sum(original), sum(compressed), count]
     */
    @Query("""
           select coalesce(sum(c.originalSize), 0), coalesce(sum(c.compressedSize), 0), count(c)
           from CompressionRecordEntity c
           """)
    List<Object[]> totals();

    long countByRecordType(CompressedRecordType recordType);
}
