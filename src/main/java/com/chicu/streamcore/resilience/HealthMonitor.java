package com.chicu.streamcore.resilience;

import com.chicu.streamcore.config.StreamCoreProperties;

import java.time.Duration;
import java.time.Instant;

/**
 * Heartbeat одного соединения.
 *
 * Любое входящее сообщение (включая pong) обновляет lastMessageAt.
 * Каждые pingInterval: ping; тишина дольше staleThreshold: соединение мёртвое,
 * даже если сокет формально открыт.
 */
public class HealthMonitor {

    public static final String STALE_REASON = "heartbeat-stale";

    private final Duration pingInterval;
    private final Duration staleThreshold;

    private Instant lastMessageAt;
    private Instant lastPingAt;

    public HealthMonitor(Duration pingInterval, Duration staleThreshold) {
        if (pingInterval.isNegative() || pingInterval.isZero()) {
            throw new IllegalArgumentException("pingInterval must be > 0");
        }
        if (staleThreshold.compareTo(pingInterval) < 0) {
            throw new IllegalArgumentException("staleThreshold must be >= pingInterval");
        }
        this.pingInterval = pingInterval;
        this.staleThreshold = staleThreshold;
    }

    public static HealthMonitor from(StreamCoreProperties.Health cfg) {
        return new HealthMonitor(cfg.getPingInterval(), cfg.getStaleThreshold());
    }

    /**
     * Новое соединение: отсчёт тишины и пинга начинается заново.
     */
    public synchronized void onConnected(Instant now) {
        lastMessageAt = now;
        lastPingAt = now;
    }

    public synchronized void onMessage(Instant now) {
        if (lastMessageAt == null || now.isAfter(lastMessageAt)) {
            lastMessageAt = now;
        }
    }

    public synchronized void onPingSent(Instant now) {
        lastPingAt = now;
    }

    public synchronized void onDisconnected() {
        lastMessageAt = null;
        lastPingAt = null;
    }

    /**
     * @return true, если соединение было поднято и молчит дольше staleThreshold
     */
    public synchronized boolean isStale(Instant now) {
        return lastMessageAt != null
                && Duration.between(lastMessageAt, now).compareTo(staleThreshold) > 0;
    }

    public synchronized HealthAction tick(Instant now) {
        if (lastMessageAt == null) {
            return HealthAction.NONE;
        }
        if (isStale(now)) {
            return HealthAction.FORCE_RECONNECT;
        }
        Instant pingBase = lastPingAt != null ? lastPingAt : lastMessageAt;
        if (Duration.between(pingBase, now).compareTo(pingInterval) >= 0) {
            return HealthAction.SEND_PING;
        }
        return HealthAction.NONE;
    }

    public synchronized Instant lastMessageAt() {
        return lastMessageAt;
    }

    public Duration pingInterval() {
        return pingInterval;
    }

    public Duration staleThreshold() {
        return staleThreshold;
    }
}
