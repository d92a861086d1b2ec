package com.chicu.streamcore.compression;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Журнал прогонов компрессии.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "compression_run")
public class CompressionRunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_type", nullable = false, length = 16)
    private CompressedRecordType recordType;

    @Column(name = "records_compressed", nullable = false)
    private Integer recordsCompressed;

    @Column(name = "space_saved_bytes", nullable = false)
    private Long spaceSavedBytes;

    @Column(name = "duration_ms", nullable = false)
    private Long durationMs;

    @Column(name = "run_at", nullable = false)
    private Instant runAt;

    @Column(name = "error_message", length = 512)
    private String errorMessage;
}
