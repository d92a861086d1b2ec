package com.chicu.streamcore.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Событие на запись. sequence и timestamp назначает хранилище.
 */
public record DomainEvent(String aggregateId, AuditEventType type, Map<String, Object> payload) {

    public DomainEvent {
        if (aggregateId == null || aggregateId.isBlank()) {
            throw new IllegalArgumentException("aggregateId is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("event type is required");
        }
        // null-значения в payload допустимы (цена market-ордера)
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static DomainEvent of(String aggregateId, AuditEventType type, Map<String, Object> payload) {
        return new DomainEvent(aggregateId, type, payload);
    }
}
