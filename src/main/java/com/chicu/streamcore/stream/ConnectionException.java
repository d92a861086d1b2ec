package com.chicu.streamcore.stream;

/**
 * Транзиентная ошибка сокета (обрыв, таймаут). Лечится реконнектом.
 */
public class ConnectionException extends RuntimeException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
