package com.chicu.streamcore.compression;

import java.time.Instant;

/**
 * @param compressionRatio доля сэкономленного места в процентах
 */
public record CompressionStats(
        long totalUncompressedBytes,
        long totalCompressedBytes,
        double compressionRatio,
        long compressedRecords,
        double spaceSavedMb,
        Instant lastRun
) {}
