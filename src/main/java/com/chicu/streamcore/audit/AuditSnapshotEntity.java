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
        name = "audit_snapshot",
        indexes = {
                @Index(name = "ix_audit_snapshot_agg_seq", columnList = "aggregate_id,sequence")
        }
)
public class AuditSnapshotEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "aggregate_id", nullable = false, length = 128)
    private String aggregateId;

    @Lob
    @Column(name = "state_json", columnDefinition = "text")
    private String stateJson;

    /** последний sequence, вошедший в состояние */
    @Column(name = "sequence", nullable = false)
    private Long sequence;

    @Column(name = "snapshot_timestamp", nullable = false)
    private Instant timestamp;

    @Column(name = "automatic", nullable = false)
    private boolean automatic;
}
