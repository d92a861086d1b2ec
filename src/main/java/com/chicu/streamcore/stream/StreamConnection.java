package com.chicu.streamcore.stream;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Одно соединение с провайдером: сокет, очередь записи, исходящие события.
 *
 * Наружу соединение ничего не отдаёт по ссылке: только события в
 * {@link MessageQueue} и команды через {@link #send(StreamCommand)}.
 * Колбэки от старого сокета (после реконнекта) отбрасываются по номеру поколения.
 */
@Slf4j
public class StreamConnection {

    private final StreamProvider provider;
    private final WsTransport transport;
    private final MessageQueue<StreamEvent> events;
    private final Clock clock;
    private final StreamStatistics statistics = new StreamStatistics();

    private final Object lock = new Object();

    // guarded by lock
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private WsTransport.Session session;
    private long generation;
    private CompletableFuture<Void> writeChain = CompletableFuture.completedFuture(null);

    public StreamConnection(StreamProvider provider,
                            WsTransport transport,
                            MessageQueue<StreamEvent> events,
                            Clock clock) {
        this.provider = provider;
        this.transport = transport;
        this.events = events;
        this.clock = clock;
    }

    public String providerId() {
        return provider.id();
    }

    public StreamProvider provider() {
        return provider;
    }

    public MessageQueue<StreamEvent> events() {
        return events;
    }

    public StreamStatistics statistics() {
        return statistics;
    }

    public ConnectionState state() {
        synchronized (lock) {
            return state;
        }
    }

    // =====================================================================
    // CONNECT
    // =====================================================================

    /**
     * Открывает сокет. Результат (успех или ошибка) приходит событием,
     * возвращаемый future никогда не завершается исключением.
     */
    public CompletableFuture<Void> connect() {
        final long gen;
        synchronized (lock) {
            if (state == ConnectionState.CONNECTING || session != null) {
                log.debug("[{}] connect skipped, state={}", provider.id(), state);
                return CompletableFuture.completedFuture(null);
            }
            gen = ++generation;
            transitionLocked(ConnectionState.CONNECTING, null);
        }

        URI uri = provider.streamUri();
        log.info("🌐 [{}] WS connecting {}", provider.id(), safe(uri));

        CompletableFuture<WsTransport.Session> opening;
        try {
            opening = transport.open(uri, new Handler(gen));
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }

        return opening
                .thenAccept(s -> onOpened(gen, s))
                .exceptionally(ex -> {
                    onFailure(gen, "connect failed: " + rootMessage(ex), false);
                    return null;
                });
    }

    private void onOpened(long gen, WsTransport.Session s) {
        synchronized (lock) {
            if (gen != generation) {
                s.close("superseded");
                return;
            }
            session = s;
            writeChain = CompletableFuture.completedFuture(null);
            provider.onConnected();
            transitionLocked(ConnectionState.CONNECTED, null);
        }
        statistics.onConnected(clock.instant());
        log.info("🟢 [{}] WS CONNECTED", provider.id());
        events.offer(StreamEvent.connected(provider.id(), clock.instant()));
    }

    // =====================================================================
    // SEND (последовательная запись)
    // =====================================================================

    public CompletableFuture<Void> send(StreamCommand command) {
        if (command.type() == StreamCommand.Type.DISCONNECT) {
            disconnect("disconnect command");
            return CompletableFuture.completedFuture(null);
        }

        synchronized (lock) {
            WsTransport.Session s = session;
            if (s == null) {
                return CompletableFuture.failedFuture(
                        new ConnectionException("[" + provider.id() + "] not connected, state=" + state));
            }
            Optional<String> text = provider.formatCommand(command);
            CompletableFuture<Void> next = writeChain
                    .handle((v, ex) -> (Void) null)
                    .thenCompose(v -> write(s, command, text));
            writeChain = next;
            return next;
        }
    }

    private CompletableFuture<Void> write(WsTransport.Session s, StreamCommand command, Optional<String> text) {
        if (text.isPresent()) {
            String payload = text.get();
            return s.sendText(payload)
                    .thenRun(() -> {
                        statistics.onSent(payload.getBytes(StandardCharsets.UTF_8).length);
                        log.debug("➡ [{}] {} {}", provider.id(), command.type(), command.keys().size());
                    });
        }
        if (command.type() == StreamCommand.Type.PING) {
            return s.sendPing();
        }
        return CompletableFuture.completedFuture(null);
    }

    // =====================================================================
    // DISCONNECT / STATE
    // =====================================================================

    /**
     * Локальный разрыв (ручной, heartbeat, остановка). Старый сокет после этого молчит.
     */
    public void disconnect(String reason) {
        WsTransport.Session s;
        synchronized (lock) {
            generation++;
            s = session;
            session = null;
            transitionLocked(ConnectionState.DISCONNECTED, reason);
        }
        if (s != null) {
            try {
                s.close(reason);
            } catch (RuntimeException e) {
                log.debug("[{}] close failed: {}", provider.id(), e.getMessage());
            }
        }
        statistics.onDisconnected();
        log.warn("🔌 [{}] WS disconnected locally: {}", provider.id(), reason);
        events.offer(StreamEvent.disconnected(provider.id(), reason, true, clock.instant()));
    }

    public void transition(ConnectionState next, String reason) {
        synchronized (lock) {
            transitionLocked(next, reason);
        }
    }

    private void transitionLocked(ConnectionState next, String reason) {
        if (state == next) {
            return;
        }
        ConnectionState prev = state;
        state = next;
        log.info("🔁 [{}] state {} → {}{}", provider.id(), prev, next, reason == null ? "" : " (" + reason + ")");
        events.offer(StreamEvent.stateChanged(provider.id(), next, reason, clock.instant()));
    }

    /**
     * Провал до открытия сокета: {@link StreamEvent.Type#CONNECT_FAILED}; обрыв открытого: DISCONNECTED или ERROR.
     */
    private void onFailure(long gen, String reason, boolean closed) {
        boolean duringConnect;
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            duringConnect = state == ConnectionState.CONNECTING;
            generation++;
            session = null;
            transitionLocked(ConnectionState.DISCONNECTED, reason);
        }
        if (duringConnect) {
            log.error("❌ [{}] WS CONNECT FAILED {}", provider.id(), reason);
            events.offer(StreamEvent.connectFailed(provider.id(), reason, clock.instant()));
            return;
        }
        statistics.onDisconnected();
        if (closed) {
            log.warn("⚠ [{}] WS CLOSED {}", provider.id(), reason);
            events.offer(StreamEvent.disconnected(provider.id(), reason, false, clock.instant()));
        } else {
            log.error("❌ [{}] WS ERROR {}", provider.id(), reason);
            events.offer(StreamEvent.error(provider.id(), reason, clock.instant()));
        }
    }

    private boolean isCurrent(long gen) {
        synchronized (lock) {
            return gen == generation;
        }
    }

    private final class Handler implements WsTransport.Handler {

        private final long gen;

        private Handler(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen() {
            log.debug("[{}] WS handshake done", provider.id());
        }

        @Override
        public void onText(String text) {
            if (!isCurrent(gen)) {
                return;
            }
            statistics.onReceived(text.getBytes(StandardCharsets.UTF_8).length, clock.instant());
            if (!events.offer(StreamEvent.message(provider.id(), text, clock.instant()))) {
                log.debug("[{}] event queue full, oldest dropped", provider.id());
            }
        }

        @Override
        public void onPong() {
            if (!isCurrent(gen)) {
                return;
            }
            events.offer(StreamEvent.pong(provider.id(), clock.instant()));
        }

        @Override
        public void onClose(int statusCode, String reason) {
            onFailure(gen, "closed by provider code=" + statusCode + " reason=" + reason, true);
        }

        @Override
        public void onError(Throwable error) {
            onFailure(gen, rootMessage(error), false);
        }
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    private static String rootMessage(Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null) {
            t = t.getCause();
        }
        return t.getClass().getSimpleName() + ": " + t.getMessage();
    }

    /**
     * api-key в query не светим в логах.
     */
    private static String safe(URI uri) {
        String s = uri.toString();
        int q = s.indexOf('?');
        return q < 0 ? s : s.substring(0, q) + "?…";
    }
}
