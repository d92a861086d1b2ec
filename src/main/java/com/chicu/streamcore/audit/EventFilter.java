package com.chicu.streamcore.audit;

import java.time.Instant;

/**
 * Все поля необязательны. from/to включительно.
 */
public record EventFilter(
        String aggregateId,
        AuditEventType type,
        Instant from,
        Instant to,
        Integer limit,
        Integer offset
) {

    public static EventFilter all() {
        return new EventFilter(null, null, null, null, null, null);
    }

    public static EventFilter forAggregate(String aggregateId) {
        return new EventFilter(aggregateId, null, null, null, null, null);
    }
}
