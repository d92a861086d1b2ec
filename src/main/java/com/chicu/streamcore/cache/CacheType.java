package com.chicu.streamcore.cache;

/**
 * Тип записи кэша → класс TTL.
 */
public enum CacheType {

    PRICE(TtlClass.PRICES),
    TOKEN_INFO(TtlClass.METADATA),
    MARKET_DATA(TtlClass.METADATA),
    TOP_COINS(TtlClass.METADATA),
    TRENDING_COINS(TtlClass.METADATA),
    HISTORY(TtlClass.HISTORY),
    USER_DATA(TtlClass.HISTORY);

    public enum TtlClass {
        PRICES,
        METADATA,
        HISTORY
    }

    private final TtlClass ttlClass;

    CacheType(TtlClass ttlClass) {
        this.ttlClass = ttlClass;
    }

    public TtlClass ttlClass() {
        return ttlClass;
    }

    /**
     * Имя из URL / конфигурации: price, token-info, TOKEN_INFO: всё одно.
     */
    public static CacheType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("cache type is empty");
        }
        String norm = raw.trim().toUpperCase().replace('-', '_');
        return CacheType.valueOf(norm);
    }
}
