package com.chicu.streamcore.web;

import com.chicu.streamcore.audit.AuditEventType;
import com.chicu.streamcore.audit.EventFilter;
import com.chicu.streamcore.audit.EventStore;
import com.chicu.streamcore.audit.EventStoreStats;
import com.chicu.streamcore.audit.ExportFormat;
import com.chicu.streamcore.audit.StoredEvent;
import com.chicu.streamcore.cache.CacheStats;
import com.chicu.streamcore.cache.CacheType;
import com.chicu.streamcore.compression.CompressionManager;
import com.chicu.streamcore.compression.CompressionStats;
import com.chicu.streamcore.core.MarketDataCore;
import com.chicu.streamcore.core.StreamStatus;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class StreamCoreController {

    private final MarketDataCore core;
    private final EventStore eventStore;
    private final CompressionManager compression;

    // =====================================================================
    // STREAM
    // =====================================================================

    @GetMapping("/stream/status")
    public List<StreamStatus> status() {
        return core.status();
    }

    /**
     * 🔄 Ручной реконнект; сбрасывает backoff и окончательный отказ.
     * Пример: POST /api/stream/birdeye/reconnect
     */
    @PostMapping("/stream/{provider}/reconnect")
    public ResponseEntity<Map<String, Object>> reconnect(@PathVariable String provider) {
        core.reconnect(provider);
        return ResponseEntity.accepted().body(Map.of("status", "ok", "provider", provider));
    }

    // =====================================================================
    // CACHE
    // =====================================================================

    @GetMapping("/cache/{type}/{key}")
    public ResponseEntity<JsonNode> cached(@PathVariable String type, @PathVariable String key) {
        return core.getCached(key, CacheType.parse(type))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/cache/stats")
    public CacheStats cacheStats() {
        return core.cache().stats();
    }

    @GetMapping("/cache/top")
    public List<String> topKeys(@RequestParam(defaultValue = "10") int limit) {
        return core.cache().topAccessedKeys(limit);
    }

    /**
     * 🧹 Сброс ключей по префиксу, например birdeye: после смены провайдера.
     */
    @DeleteMapping("/cache")
    public Map<String, Object> purge(@RequestParam String prefix) {
        if (prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be empty");
        }
        int removed = core.cache().purgePrefix(prefix);
        log.info("🧹 cache purge '{}': {}", prefix, removed);
        return Map.of("prefix", prefix, "removed", removed);
    }

    // =====================================================================
    // AUDIT
    // =====================================================================

    /**
     * Пример: GET /api/events?aggregateId=wallet:abc&type=order_placed&limit=50
     */
    @GetMapping("/events")
    public List<StoredEvent> events(@RequestParam(required = false) String aggregateId,
                                    @RequestParam(required = false) String type,
                                    @RequestParam(required = false) Instant from,
                                    @RequestParam(required = false) Instant to,
                                    @RequestParam(required = false) Integer limit,
                                    @RequestParam(required = false) Integer offset) {
        return core.getEvents(filter(aggregateId, type, from, to, limit, offset));
    }

    @GetMapping("/events/export")
    public ResponseEntity<byte[]> export(@RequestParam(required = false) String format,
                                         @RequestParam(required = false) String aggregateId,
                                         @RequestParam(required = false) String type,
                                         @RequestParam(required = false) Instant from,
                                         @RequestParam(required = false) Instant to) {
        ExportFormat fmt = ExportFormat.parse(format);
        byte[] body = core.exportAudit(filter(aggregateId, type, from, to, null, null), fmt);
        String file = "audit-events." + fmt.name().toLowerCase();
        MediaType contentType = fmt == ExportFormat.CSV
                ? MediaType.parseMediaType("text/csv; charset=UTF-8")
                : MediaType.APPLICATION_JSON;
        log.info("📤 Экспорт аудита {}: {} байт", fmt, body.length);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file + "\"")
                .contentType(contentType)
                .body(body);
    }

    @GetMapping("/events/stats")
    public EventStoreStats eventStats() {
        return eventStore.stats();
    }

    /**
     * История агрегата; с at: только события не позже этого момента.
     * Пример: GET /api/events/aggregate/wallet:abc?at=2024-05-01T12:00:00Z
     */
    @GetMapping("/events/aggregate/{aggregateId}")
    public List<StoredEvent> aggregate(@PathVariable String aggregateId,
                                       @RequestParam(required = false) Instant at) {
        return at == null ? eventStore.replay(aggregateId) : eventStore.stateAt(aggregateId, at);
    }

    @GetMapping("/events/aggregate/{aggregateId}/state")
    public JsonNode aggregateState(@PathVariable String aggregateId) {
        return eventStore.rebuildState(aggregateId);
    }

    // =====================================================================
    // COMPRESSION
    // =====================================================================

    @GetMapping("/compression/stats")
    public CompressionStats compressionStats() {
        return compression.stats();
    }

    @PostMapping("/compression/run")
    public CompressionManager.RunResult compressNow() {
        log.info("🗜 Ручной запуск компрессии");
        return compression.runAll();
    }

    private static EventFilter filter(String aggregateId, String type, Instant from, Instant to,
                                      Integer limit, Integer offset) {
        AuditEventType t = type == null || type.isBlank() ? null : AuditEventType.parse(type);
        String agg = aggregateId == null || aggregateId.isBlank() ? null : aggregateId;
        return new EventFilter(agg, t, from, to, limit, offset);
    }
}
