package com.chicu.streamcore.stream;

import java.util.List;

/**
 * Команда в соединение (core → StreamConnection).
 */
public record StreamCommand(Type type, List<String> keys) {

    public enum Type {
        SUBSCRIBE,
        UNSUBSCRIBE,
        PING,
        PONG,
        DISCONNECT
    }

    public StreamCommand {
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public static StreamCommand subscribe(List<String> keys) {
        return new StreamCommand(Type.SUBSCRIBE, keys);
    }

    public static StreamCommand unsubscribe(List<String> keys) {
        return new StreamCommand(Type.UNSUBSCRIBE, keys);
    }

    public static StreamCommand ping() {
        return new StreamCommand(Type.PING, List.of());
    }

    public static StreamCommand pong() {
        return new StreamCommand(Type.PONG, List.of());
    }

    public static StreamCommand disconnect() {
        return new StreamCommand(Type.DISCONNECT, List.of());
    }
}
