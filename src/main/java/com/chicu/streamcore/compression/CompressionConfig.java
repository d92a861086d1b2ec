package com.chicu.streamcore.compression;

import com.chicu.streamcore.config.StreamCoreProperties;

/**
 * Настройки, которые можно менять на лету.
 */
public record CompressionConfig(
        boolean enabled,
        boolean autoCompress,
        int eventAgeDays,
        int tradeAgeDays,
        CompressionAlgorithm algorithm,
        int level
) {

    public static CompressionConfig from(StreamCoreProperties.Compression cfg) {
        return new CompressionConfig(
                cfg.isEnabled(),
                cfg.isAutoCompress(),
                cfg.getEventAgeDays(),
                cfg.getTradeAgeDays(),
                cfg.getAlgorithm(),
                cfg.getLevel()
        );
    }

    public CompressionConfig validate() {
        if (eventAgeDays < 1 || tradeAgeDays < 1) {
            throw new IllegalArgumentException("age thresholds must be >= 1 day");
        }
        if (level < 1 || level > 9) {
            throw new IllegalArgumentException("compression level must be in 1..9");
        }
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm is required");
        }
        return this;
    }
}
