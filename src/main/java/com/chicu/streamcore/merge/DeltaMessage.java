package com.chicu.streamcore.merge;

import java.time.Instant;
import java.util.Map;

/**
 * Только изменившиеся поля. Применима лишь поверх sequence - 1.
 */
public record DeltaMessage(String key, long sequence, Map<String, Object> changedFields, Instant observedAt) {

    public DeltaMessage {
        changedFields = changedFields == null ? Map.of() : Map.copyOf(changedFields);
    }
}
