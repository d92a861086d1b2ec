package com.chicu.streamcore.stream;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Транспорт WebSocket. Прод: {@link JdkWsTransport}, в тестах: фейк.
 */
public interface WsTransport {

    CompletableFuture<Session> open(URI uri, Handler handler);

    interface Session {

        CompletableFuture<Void> sendText(String text);

        CompletableFuture<Void> sendPing();

        void close(String reason);
    }

    interface Handler {

        void onOpen();

        void onText(String text);

        void onPong();

        void onClose(int statusCode, String reason);

        void onError(Throwable error);
    }
}
