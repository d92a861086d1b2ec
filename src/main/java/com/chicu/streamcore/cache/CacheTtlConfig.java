package com.chicu.streamcore.cache;

import com.chicu.streamcore.config.StreamCoreProperties;

import java.time.Duration;

/**
 * TTL по классам. Допустимый диапазон: от 100 мс до 7 дней.
 */
public record CacheTtlConfig(Duration prices, Duration metadata, Duration history) {

    public static final Duration MIN_TTL = Duration.ofMillis(100);
    public static final Duration MAX_TTL = Duration.ofDays(7);

    public static CacheTtlConfig defaults() {
        return new CacheTtlConfig(Duration.ofSeconds(1), Duration.ofHours(1), Duration.ofDays(1));
    }

    public static CacheTtlConfig from(StreamCoreProperties.Cache cfg) {
        return new CacheTtlConfig(cfg.getPricesTtl(), cfg.getMetadataTtl(), cfg.getHistoryTtl());
    }

    public Duration ttlFor(CacheType type) {
        return switch (type.ttlClass()) {
            case PRICES -> prices;
            case METADATA -> metadata;
            case HISTORY -> history;
        };
    }

    /**
     * @throws IllegalArgumentException с именем поля, которое вне диапазона
     */
    public CacheTtlConfig validate() {
        check("prices", prices);
        check("metadata", metadata);
        check("history", history);
        return this;
    }

    private static void check(String name, Duration ttl) {
        if (ttl == null) {
            throw new IllegalArgumentException(name + " TTL is required");
        }
        if (ttl.compareTo(MIN_TTL) < 0 || ttl.compareTo(MAX_TTL) > 0) {
            throw new IllegalArgumentException(
                    name + " TTL must be between " + MIN_TTL.toMillis() + " ms and " + MAX_TTL.toDays() + " days, got " + ttl);
        }
    }
}
