package com.chicu.streamcore.core;

import com.chicu.streamcore.merge.PriceSnapshot;

import java.time.Instant;

/**
 * Согласованное состояние ключа после merge: то, что видят подписчики.
 */
public record Update(String provider, String key, PriceSnapshot snapshot, Source source, Instant at) {

    public enum Source {
        STREAM,
        FALLBACK
    }
}
