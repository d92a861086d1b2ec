package com.chicu.streamcore.audit;

import java.util.Map;

public record EventStoreStats(long totalEvents, long eventsLast24h, Map<String, Long> perType) {}
