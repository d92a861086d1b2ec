package com.chicu.streamcore.stream;

import java.time.Instant;

/**
 * Событие от соединения (StreamConnection → supervisor).
 *
 * @param local true, если разрыв инициирован нами (ручной/heartbeat): такой разрыв
 *              не должен повторно запускать реконнект
 */
public record StreamEvent(
        Type type,
        String provider,
        String raw,
        ConnectionState state,
        String reason,
        boolean local,
        Instant at
) {

    public enum Type {
        CONNECTED,
        DISCONNECTED,
        MESSAGE,
        PONG,
        /** сокет так и не открылся */
        CONNECT_FAILED,
        /** ошибка уже открытого сокета */
        ERROR,
        STATE_CHANGED
    }

    /**
     * Данные можно потерять при переполнении очереди, управляющие события нельзя:
     * без них не будет ни resubscribe, ни реконнекта.
     */
    public boolean droppable() {
        return type == Type.MESSAGE || type == Type.PONG;
    }

    public static StreamEvent connected(String provider, Instant at) {
        return new StreamEvent(Type.CONNECTED, provider, null, ConnectionState.CONNECTED, null, false, at);
    }

    public static StreamEvent disconnected(String provider, String reason, boolean local, Instant at) {
        return new StreamEvent(Type.DISCONNECTED, provider, null, ConnectionState.DISCONNECTED, reason, local, at);
    }

    public static StreamEvent message(String provider, String raw, Instant at) {
        return new StreamEvent(Type.MESSAGE, provider, raw, null, null, false, at);
    }

    public static StreamEvent pong(String provider, Instant at) {
        return new StreamEvent(Type.PONG, provider, null, null, null, false, at);
    }

    public static StreamEvent connectFailed(String provider, String reason, Instant at) {
        return new StreamEvent(Type.CONNECT_FAILED, provider, null, null, reason, false, at);
    }

    public static StreamEvent error(String provider, String reason, Instant at) {
        return new StreamEvent(Type.ERROR, provider, null, null, reason, false, at);
    }

    public static StreamEvent stateChanged(String provider, ConnectionState state, String reason, Instant at) {
        return new StreamEvent(Type.STATE_CHANGED, provider, null, state, reason, false, at);
    }
}
