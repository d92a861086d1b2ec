package com.chicu.streamcore.stream;

/**
 * Битое или неожиданное сообщение провайдера.
 * Отбрасывается одно сообщение, соединение продолжает работать.
 */
public class ProtocolException extends Exception {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
