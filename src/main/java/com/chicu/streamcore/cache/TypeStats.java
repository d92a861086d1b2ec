package com.chicu.streamcore.cache;

public record TypeStats(long hits, long misses, double hitRate, long entries, long sizeBytes) {}
