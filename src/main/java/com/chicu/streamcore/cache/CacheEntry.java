package com.chicu.streamcore.cache;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Запись кэша. TTL фиксируется в момент записи.
 * Счётчики доступа меняются только под локом шарда.
 */
@Getter
public class CacheEntry {

    private final String key;
    private final JsonNode value;
    private final CacheType type;
    private final Instant insertedAt;
    private final Duration ttl;
    private final long sizeBytes;

    private Instant lastAccessedAt;
    private long accessCount;
    /** глобальный порядок доступа для LRU между шардами */
    private long accessTick;

    public CacheEntry(String key, JsonNode value, CacheType type, Instant insertedAt, Duration ttl, long sizeBytes) {
        this.key = key;
        this.value = value;
        this.type = type;
        this.insertedAt = insertedAt;
        this.ttl = ttl;
        this.sizeBytes = sizeBytes;
        this.lastAccessedAt = insertedAt;
    }

    public Instant expiresAt() {
        return insertedAt.plus(ttl);
    }

    /**
     * Истекла ровно в момент insertedAt + ttl.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }

    void touch(Instant now, long tick) {
        lastAccessedAt = now;
        accessCount++;
        accessTick = tick;
    }

    void stamp(long tick) {
        accessTick = tick;
    }
}
