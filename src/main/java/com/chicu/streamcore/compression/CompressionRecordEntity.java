package com.chicu.streamcore.compression;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@IdClass(CompressionRecordId.class)
@Table(
        name = "compressed_record",
        indexes = {
                @Index(name = "ix_compressed_type", columnList = "record_type")
        }
)
public class CompressionRecordEntity {

    @Id
    @Enumerated(EnumType.STRING)
    @Column(name = "record_type", nullable = false, length = 16)
    private CompressedRecordType recordType;

    /** id исходной записи (событие аудита или ордер) */
    @Id
    @Column(name = "record_id", length = 64)
    private String recordId;

    @Enumerated(EnumType.STRING)
    @Column(name = "algorithm", nullable = false, length = 16)
    private CompressionAlgorithm algorithm;

    @Lob
    @Column(name = "data", nullable = false)
    private byte[] data;

    @Column(name = "original_size", nullable = false)
    private Long originalSize;

    @Column(name = "compressed_size", nullable = false)
    private Long compressedSize;

    @Column(name = "compressed_at", nullable = false)
    private Instant compressedAt;

    @Column(name = "original_timestamp")
    private Instant originalTimestamp;
}
