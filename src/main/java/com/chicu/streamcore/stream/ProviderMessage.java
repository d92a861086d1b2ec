package com.chicu.streamcore.stream;

import java.util.Map;

/**
 * Сообщение провайдера, приведённое к канонической модели snapshot/delta.
 */
public record ProviderMessage(Kind kind, String key, long sequence, Map<String, Object> fields) {

    public enum Kind {
        SNAPSHOT,
        DELTA,
        PING,
        PONG,
        /** провайдер принял подписку; key == null: ключи в ответе не названы */
        ACK
    }

    public ProviderMessage {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public static ProviderMessage snapshot(String key, long sequence, Map<String, Object> fields) {
        return new ProviderMessage(Kind.SNAPSHOT, key, sequence, fields);
    }

    public static ProviderMessage delta(String key, long sequence, Map<String, Object> fields) {
        return new ProviderMessage(Kind.DELTA, key, sequence, fields);
    }

    public static ProviderMessage ping() {
        return new ProviderMessage(Kind.PING, null, 0L, Map.of());
    }

    public static ProviderMessage pong() {
        return new ProviderMessage(Kind.PONG, null, 0L, Map.of());
    }

    public static ProviderMessage ack(String key) {
        return new ProviderMessage(Kind.ACK, key, 0L, Map.of());
    }
}
