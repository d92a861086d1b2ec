package com.chicu.streamcore.compression;

import com.chicu.streamcore.audit.AuditEventEntity;
import com.chicu.streamcore.audit.StorageException;
import com.chicu.streamcore.config.StreamCoreProperties;
import com.chicu.streamcore.core.StreamScheduler;
import com.chicu.streamcore.orders.OrderRecordEntity;
import com.chicu.streamcore.orders.OrderStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Фоновое сжатие старых данных: события аудита и закрытые ордера.
 *
 * Исходные строки не удаляются: рядом кладётся сжатая копия.
 * Работа best-effort: ошибка прогона логируется и пишется в журнал прогонов,
 * следующий прогон начнёт с того же места. Ingestion это не касается.
 */
@Service
@Slf4j
public class CompressionManager {

    public record RunResult(int events, int trades) {}

    private record CachedData(Instant cachedAt, byte[] data) {}

    private record CachedStats(Instant cachedAt, CompressionStats stats) {}

    static final Duration DECOMPRESS_CACHE_TTL = Duration.ofMinutes(5);
    static final int DECOMPRESS_CACHE_SIZE = 100;
    static final Duration STATS_CACHE_TTL = Duration.ofSeconds(30);

    private final CompressionRecordRepository recordRepository;
    private final CompressionRunRepository runRepository;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final StreamScheduler scheduler;
    private final StreamCoreProperties.Compression props;

    private final AtomicReference<CompressionConfig> config;
    private final AtomicReference<CachedStats> statsCache = new AtomicReference<>();
    private final LinkedHashMap<String, CachedData> decompressCache = new LinkedHashMap<>();
    private final Object runLock = new Object();

    private volatile StreamScheduler.Handle job;

    public CompressionManager(CompressionRecordRepository recordRepository,
                              CompressionRunRepository runRepository,
                              ObjectMapper mapper,
                              Clock clock,
                              StreamScheduler scheduler,
                              StreamCoreProperties properties) {
        this.recordRepository = recordRepository;
        this.runRepository = runRepository;
        this.mapper = mapper;
        this.clock = clock;
        this.scheduler = scheduler;
        this.props = properties.getCompression();
        this.config = new AtomicReference<>(CompressionConfig.from(props).validate());
    }

    @PostConstruct
    public void start() {
        CompressionConfig cfg = config.get();
        if (!cfg.enabled() || !cfg.autoCompress()) {
            log.info("🗜 Компрессия по расписанию выключена");
            return;
        }
        job = scheduler.scheduleAtFixedRate("compression", this::runScheduled, props.getInitialDelay(), props.getRunInterval());
        log.info("🗜 Компрессия по расписанию: старт через {}, каждые {}", props.getInitialDelay(), props.getRunInterval());
    }

    @PreDestroy
    public void stop() {
        StreamScheduler.Handle h = job;
        if (h != null) {
            h.cancel();
            job = null;
        }
    }

    void runScheduled() {
        try {
            RunResult r = runAll();
            log.info("🗜 Компрессия: events={} trades={}", r.events(), r.trades());
        } catch (RuntimeException e) {
            log.error("❌ Компрессия упала, повторим в следующий прогон: {}", e.getMessage(), e);
        }
        cleanupCache();
    }

    public RunResult runAll() {
        return new RunResult(compressOldEvents(), compressOldTrades());
    }

    // =====================================================================
    // COMPRESS
    // =====================================================================

    public int compressOldEvents() {
        return compressOlderThan(config.get().eventAgeDays());
    }

    /**
     * События аудита старше days дней, не больше batchSize за вызов.
     *
     * @return сколько записей сжато
     */
    public int compressOlderThan(int days) {
        CompressionConfig cfg = config.get();
        if (!cfg.enabled()) {
            return 0;
        }
        Instant threshold = clock.instant().minus(Duration.ofDays(days));
        synchronized (runLock) {
            long started = System.currentTimeMillis();
            List<AuditEventEntity> batch;
            try {
                batch = recordRepository.findUncompressedEvents(threshold, PageRequest.of(0, props.getBatchSize()));
            } catch (DataAccessException e) {
                throw new StorageException("compression: failed to load old events", e);
            }

            int count = 0;
            long saved = 0;
            String error = null;
            for (AuditEventEntity e : batch) {
                try {
                    saved += store(e.getId(), CompressedRecordType.EVENT, eventBytes(e), e.getTimestamp(), cfg);
                    count++;
                } catch (StorageException ex) {
                    error = ex.getMessage();
                    log.error("❌ compress event {} failed: {}", e.getId(), ex.getMessage());
                    break;
                }
            }
            logRun(CompressedRecordType.EVENT, count, saved, System.currentTimeMillis() - started, error);
            return count;
        }
    }

    /**
     * Закрытые ордера (FILLED / CANCELLED / FAILED) старше tradeAgeDays.
     */
    public int compressOldTrades() {
        CompressionConfig cfg = config.get();
        if (!cfg.enabled()) {
            return 0;
        }
        Instant threshold = clock.instant().minus(Duration.ofDays(cfg.tradeAgeDays()));
        synchronized (runLock) {
            long started = System.currentTimeMillis();
            List<OrderRecordEntity> batch;
            try {
                batch = recordRepository.findUncompressedClosedOrders(OrderStatus.CLOSED, threshold, PageRequest.of(0, props.getBatchSize()));
            } catch (DataAccessException e) {
                throw new StorageException("compression: failed to load old orders", e);
            }

            int count = 0;
            long saved = 0;
            String error = null;
            for (OrderRecordEntity o : batch) {
                try {
                    saved += store(o.getId(), CompressedRecordType.TRADE, json(o), o.getCreatedAt(), cfg);
                    count++;
                } catch (StorageException ex) {
                    error = ex.getMessage();
                    log.error("❌ compress order {} failed: {}", o.getId(), ex.getMessage());
                    break;
                }
            }
            logRun(CompressedRecordType.TRADE, count, saved, System.currentTimeMillis() - started, error);
            return count;
        }
    }

    /**
     * @return сэкономлено байт
     */
    private long store(String id, CompressedRecordType type, byte[] data, Instant originalTs, CompressionConfig cfg) {
        byte[] packed;
        try {
            packed = cfg.algorithm().compress(data, cfg.level());
        } catch (IOException e) {
            throw new StorageException("compress " + id + " failed", e);
        }
        CompressionRecordEntity rec = CompressionRecordEntity.builder()
                .recordId(id)
                .recordType(type)
                .algorithm(cfg.algorithm())
                .data(packed)
                .originalSize((long) data.length)
                .compressedSize((long) packed.length)
                .compressedAt(clock.instant())
                .originalTimestamp(originalTs)
                .build();
        try {
            recordRepository.save(rec);
        } catch (DataAccessException e) {
            throw new StorageException("save compressed " + id + " failed", e);
        }
        statsCache.set(null);
        return data.length - (long) packed.length;
    }

    private void logRun(CompressedRecordType type, int count, long saved, long durationMs, String error) {
        if (count == 0 && error == null) {
            return;
        }
        try {
            runRepository.save(CompressionRunEntity.builder()
                    .recordType(type)
                    .recordsCompressed(count)
                    .spaceSavedBytes(saved)
                    .durationMs(durationMs)
                    .runAt(clock.instant())
                    .errorMessage(error == null ? null : truncate(error, 512))
                    .build());
        } catch (DataAccessException e) {
            log.error("❌ compression run log not saved: {}", e.getMessage());
        }
    }

    // =====================================================================
    // DECOMPRESS
    // =====================================================================

    /**
     * Исходные байты записи; повторные запросы в течение 5 минут: из кэша.
     */
    public Optional<byte[]> decompress(CompressedRecordType type, String recordId) {
        CompressionRecordId id = new CompressionRecordId(type, recordId);
        String cacheKey = id.toString();
        Instant now = clock.instant();
        synchronized (decompressCache) {
            CachedData cached = decompressCache.get(cacheKey);
            if (cached != null && Duration.between(cached.cachedAt(), now).compareTo(DECOMPRESS_CACHE_TTL) < 0) {
                return Optional.of(cached.data().clone());
            }
        }

        Optional<CompressionRecordEntity> rec;
        try {
            rec = recordRepository.findById(id);
        } catch (DataAccessException e) {
            throw new StorageException("load compressed " + id + " failed", e);
        }
        if (rec.isEmpty()) {
            return Optional.empty();
        }

        byte[] data;
        try {
            data = rec.get().getAlgorithm().decompress(rec.get().getData());
        } catch (IOException e) {
            throw new StorageException("decompress " + id + " failed", e);
        }

        synchronized (decompressCache) {
            decompressCache.put(cacheKey, new CachedData(now, data));
            while (decompressCache.size() > DECOMPRESS_CACHE_SIZE) {
                decompressCache.remove(decompressCache.keySet().iterator().next());
            }
        }
        return Optional.of(data.clone());
    }

    /**
     * Выкинуть просроченные записи кэша распаковки.
     */
    public void cleanupCache() {
        Instant now = clock.instant();
        synchronized (decompressCache) {
            decompressCache.values().removeIf(c -> Duration.between(c.cachedAt(), now).compareTo(DECOMPRESS_CACHE_TTL) >= 0);
        }
    }

    // =====================================================================
    // STATS / CONFIG
    // =====================================================================

    public CompressionStats stats() {
        Instant now = clock.instant();
        CachedStats cached = statsCache.get();
        if (cached != null && Duration.between(cached.cachedAt(), now).compareTo(STATS_CACHE_TTL) < 0) {
            return cached.stats();
        }

        CompressionStats stats;
        try {
            Object[] row = recordRepository.totals().get(0);
            long original = ((Number) row[0]).longValue();
            long compressed = ((Number) row[1]).longValue();
            long records = ((Number) row[2]).longValue();
            double ratio = original > 0 ? (original - compressed) * 100.0 / original : 0.0;
            Instant lastRun = runRepository.findFirstByOrderByRunAtDesc()
                    .map(CompressionRunEntity::getRunAt)
                    .orElse(null);
            stats = new CompressionStats(original, compressed, ratio, records,
                    (original - compressed) / 1024.0 / 1024.0, lastRun);
        } catch (DataAccessException e) {
            throw new StorageException("compression stats failed", e);
        }
        statsCache.set(new CachedStats(now, stats));
        return stats;
    }

    public CompressionConfig config() {
        return config.get();
    }

    public void updateConfig(CompressionConfig cfg) {
        config.set(cfg.validate());
        log.info("⚙ compression config: enabled={} events>{}d trades>{}d {} level={}",
                cfg.enabled(), cfg.eventAgeDays(), cfg.tradeAgeDays(), cfg.algorithm(), cfg.level());
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    private byte[] eventBytes(AuditEventEntity e) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", e.getId());
        row.put("aggregateId", e.getAggregateId());
        row.put("eventType", e.getEventType().wireName());
        row.put("sequence", e.getSequence());
        row.put("timestamp", e.getTimestamp().toString());
        row.put("payload", e.getPayload());
        return json(row);
    }

    private byte[] json(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("serialize for compression failed", e);
        }
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
