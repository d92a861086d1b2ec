package com.chicu.streamcore.audit;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record StoredEvent(
        String id,
        String aggregateId,
        AuditEventType type,
        JsonNode payload,
        long sequence,
        Instant timestamp
) {

    public String description() {
        return type.describe(payload);
    }
}
