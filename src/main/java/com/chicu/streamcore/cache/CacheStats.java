package com.chicu.streamcore.cache;

import java.time.Instant;
import java.util.Map;

public record CacheStats(
        long hits,
        long misses,
        double hitRate,
        long evictions,
        long entries,
        long sizeBytes,
        long diskHits,
        long diskMisses,
        long warmLoads,
        Instant lastWarmed,
        Map<CacheType, TypeStats> perType
) {}
