package com.chicu.streamcore.audit;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "audit_event",
        indexes = {
                @Index(name = "ix_audit_event_aggregate", columnList = "aggregate_id"),
                @Index(name = "ix_audit_event_type", columnList = "event_type"),
                @Index(name = "ix_audit_event_ts", columnList = "event_timestamp")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_audit_event_agg_seq", columnNames = {"aggregate_id", "sequence"})
        }
)
public class AuditEventEntity {

    /** UUID */
    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "aggregate_id", nullable = false, length = 128)
    private String aggregateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 64)
    private AuditEventType eventType;

    @Lob
    @Column(name = "payload", columnDefinition = "text")
    private String payload;

    /** монотонно по aggregateId, с 1 */
    @Column(name = "sequence", nullable = false)
    private Long sequence;

    @Column(name = "event_timestamp", nullable = false)
    private Instant timestamp;

    @PrePersist
    void prePersist() {
        if (aggregateId != null) aggregateId = aggregateId.trim();
    }
}
