package com.chicu.streamcore.stream;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Счётчики одного соединения. Пишутся из WS-потока, читаются кем угодно.
 */
public class StreamStatistics {

    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();
    private final AtomicLong bytesSent = new AtomicLong();
    private final AtomicLong reconnectCount = new AtomicLong();
    private final AtomicLong protocolErrors = new AtomicLong();
    private final AtomicReference<Instant> lastMessageAt = new AtomicReference<>();
    private final AtomicReference<Instant> connectedAt = new AtomicReference<>();

    void onReceived(int bytes, Instant at) {
        messagesReceived.incrementAndGet();
        bytesReceived.addAndGet(bytes);
        lastMessageAt.set(at);
    }

    void onSent(int bytes) {
        messagesSent.incrementAndGet();
        bytesSent.addAndGet(bytes);
    }

    void onConnected(Instant at) {
        connectedAt.set(at);
    }

    void onDisconnected() {
        connectedAt.set(null);
    }

    public void onReconnect() {
        reconnectCount.incrementAndGet();
    }

    public void onProtocolError() {
        protocolErrors.incrementAndGet();
    }

    public Snapshot snapshot(long droppedMessages) {
        return new Snapshot(
                messagesReceived.get(),
                messagesSent.get(),
                bytesReceived.get(),
                bytesSent.get(),
                reconnectCount.get(),
                protocolErrors.get(),
                droppedMessages,
                lastMessageAt.get(),
                connectedAt.get()
        );
    }

    public record Snapshot(
            long messagesReceived,
            long messagesSent,
            long bytesReceived,
            long bytesSent,
            long reconnectCount,
            long protocolErrors,
            long droppedMessages,
            Instant lastMessageAt,
            Instant connectedAt
    ) {}
}
