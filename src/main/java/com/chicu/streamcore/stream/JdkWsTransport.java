package com.chicu.streamcore.stream;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * WebSocket на java.net.http. Склеивает фрагменты текста, отвечает pong на ping.
 */
@Slf4j
public class JdkWsTransport implements WsTransport {

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkWsTransport(HttpClient httpClient, Duration connectTimeout) {
        this.httpClient = httpClient;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public CompletableFuture<Session> open(URI uri, Handler handler) {
        return httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, new Listener(handler))
                .thenApply(JdkSession::new);
    }

    private static final class JdkSession implements Session {

        private final WebSocket ws;

        private JdkSession(WebSocket ws) {
            this.ws = ws;
        }

        @Override
        public CompletableFuture<Void> sendText(String text) {
            return ws.sendText(text, true).thenApply(w -> null);
        }

        @Override
        public CompletableFuture<Void> sendPing() {
            return ws.sendPing(ByteBuffer.allocate(0)).thenApply(w -> null);
        }

        @Override
        public void close(String reason) {
            if (ws.isOutputClosed()) {
                ws.abort();
                return;
            }
            ws.sendClose(WebSocket.NORMAL_CLOSURE, reason)
                    .orTimeout(5, java.util.concurrent.TimeUnit.SECONDS)
                    .whenComplete((w, ex) -> {
                        if (ex != null) {
                            log.debug("WS close handshake failed, abort: {}", ex.getMessage());
                            ws.abort();
                        }
                    });
        }
    }

    private static final class Listener implements WebSocket.Listener {

        private final Handler handler;
        private final StringBuilder partial = new StringBuilder();

        private Listener(Handler handler) {
            this.handler = handler;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            handler.onOpen();
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String text = partial.toString();
                partial.setLength(0);
                handler.onText(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            // бинарные кадры приходят как UTF-8 JSON у обоих провайдеров
            byte[] bytes = new byte[data.remaining()];
            data.get(bytes);
            partial.append(new String(bytes, StandardCharsets.UTF_8));
            if (last) {
                String text = partial.toString();
                partial.setLength(0);
                handler.onText(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPing(WebSocket webSocket, ByteBuffer message) {
            webSocket.sendPong(message);
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
            handler.onPong();
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            handler.onClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            handler.onError(error);
        }
    }
}
