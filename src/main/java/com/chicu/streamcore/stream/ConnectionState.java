package com.chicu.streamcore.stream;

/**
 * Состояние одного стрим-соединения.
 * Меняется только через {@link StreamConnection#transition}.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    FALLBACK;

    public boolean isLive() {
        return this == CONNECTED;
    }
}
