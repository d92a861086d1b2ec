package com.chicu.streamcore.web;

import com.chicu.streamcore.core.StatusChange;
import com.chicu.streamcore.core.Update;
import com.chicu.streamcore.core.UpdateBus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Мост UpdateBus → STOMP: согласованные обновления и смены статуса провайдеров.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamUpdatePublisher {

    public static final String UPDATES_PREFIX = "/topic/stream/";
    public static final String STATUS_TOPIC = "/topic/stream-status";

    private final SimpMessagingTemplate ws;
    private final UpdateBus bus;

    @PostConstruct
    public void register() {
        bus.addGlobalListener(this::onUpdate);
        bus.addStatusListener(this::onStatus);
        log.info("📡 STOMP bridge: {}{{key}}, {}", UPDATES_PREFIX, STATUS_TOPIC);
    }

    void onUpdate(Update u) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("provider", u.provider());
        body.put("key", u.key());
        body.put("source", u.source().name());
        body.put("sequence", u.snapshot().sequence());
        body.put("fields", u.snapshot().fields());
        body.put("time", u.at().toEpochMilli());
        send(UPDATES_PREFIX + u.key(), body);
    }

    void onStatus(StatusChange c) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("provider", c.provider());
        body.put("from", c.from() == null ? null : c.from().name());
        body.put("to", c.to().name());
        body.put("reason", c.reason());
        body.put("time", c.at().toEpochMilli());
        send(STATUS_TOPIC, body);
    }

    private void send(String destination, Object body) {
        try {
            ws.convertAndSend(destination, body);
        } catch (MessagingException e) {
            log.warn("⚠ STOMP send {} failed: {}", destination, e.getMessage());
        }
    }
}
