package com.chicu.streamcore.merge;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Полное состояние по ключу на момент sequence. Неизменяемое.
 */
public record PriceSnapshot(String key, Map<String, Object> fields, long sequence, Instant observedAt) {

    public PriceSnapshot {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public BigDecimal price() {
        Object v = fields.get("price");
        if (v instanceof BigDecimal bd) {
            return bd;
        }
        // после JSON (диск, кэш) число может прийти как Double
        return v instanceof Number n ? new BigDecimal(n.toString()) : null;
    }
}
