package com.chicu.streamcore.audit;

import com.chicu.streamcore.config.StreamCoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Append-only журнал событий с воспроизведением и снимками.
 *
 * Все записи идут через один поток-писатель: sequence по агрегату назначается
 * там же, поэтому он строго монотонен без блокировок в БД.
 * Чтение: напрямую из репозиториев.
 */
@Service
@Slf4j
public class EventStore {

    private record PitKey(String aggregateId, Instant at) {}

    private record PitValue(Instant cachedAt, List<StoredEvent> events) {}

    private final AuditEventRepository eventRepository;
    private final AuditSnapshotRepository snapshotRepository;
    private final EntityManager em;
    private final ObjectMapper mapper;
    private final Clock clock;

    private final int snapshotEvery;
    private final Duration pitTtl;
    private final int pitMaxSize;
    private final StateProjector projector;

    /** aggregateId → последний выданный sequence; трогает только поток-писатель */
    private final Map<String, Long> counters = new ConcurrentHashMap<>();

    /** кэш stateAt, вытеснение: самая старая вставка */
    private final LinkedHashMap<PitKey, PitValue> pitCache = new LinkedHashMap<>();

    /** aggregateId → номер инвалидации; guarded by pitCache */
    private final Map<String, Long> pitVersions = new HashMap<>();

    private final ExecutorService writer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "event-store-writer");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public EventStore(AuditEventRepository eventRepository,
                      AuditSnapshotRepository snapshotRepository,
                      EntityManager em,
                      ObjectMapper mapper,
                      Clock clock,
                      StreamCoreProperties properties) {
        this(eventRepository, snapshotRepository, em, mapper, clock, properties.getEventStore(), StateProjector.jsonMerge());
    }

    public EventStore(AuditEventRepository eventRepository,
                      AuditSnapshotRepository snapshotRepository,
                      EntityManager em,
                      ObjectMapper mapper,
                      Clock clock,
                      StreamCoreProperties.EventStore cfg,
                      StateProjector projector) {
        this.eventRepository = eventRepository;
        this.snapshotRepository = snapshotRepository;
        this.em = em;
        this.mapper = mapper;
        this.clock = clock;
        this.snapshotEvery = cfg.getSnapshotEvery();
        this.pitTtl = cfg.getPointInTimeCacheTtl();
        this.pitMaxSize = cfg.getPointInTimeCacheSize();
        this.projector = projector;
    }

    /**
     * Счётчики sequence поднимаются из БД, чтобы после рестарта не было повторов.
     */
    @PostConstruct
    public void init() {
        try {
            for (Object[] row : eventRepository.findMaxSequencePerAggregate()) {
                counters.put((String) row[0], ((Number) row[1]).longValue());
            }
        } catch (DataAccessException e) {
            throw new StorageException("event store: failed to load sequence counters", e);
        }
        log.info("📒 EventStore готов: агрегатов={}", counters.size());
    }

    @PreDestroy
    public void shutdown() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("⚠ EventStore writer не успел дописать, останавливаем принудительно");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // =====================================================================
    // APPEND
    // =====================================================================

    /**
     * Записать событие и дождаться подтверждения.
     *
     * @return id события
     * @throws StorageException если запись не удалась
     */
    public String append(DomainEvent event) {
        return await(appendAsync(event));
    }

    /**
     * Неблокирующая запись: для горячего пути (смены состояния соединений).
     */
    public CompletableFuture<String> appendAsync(DomainEvent event) {
        return submit(() -> doAppend(event));
    }

    private String doAppend(DomainEvent event) {
        String aggregateId = event.aggregateId().trim();
        long sequence = counters.getOrDefault(aggregateId, 0L) + 1;

        AuditEventEntity entity = AuditEventEntity.builder()
                .id(UUID.randomUUID().toString())
                .aggregateId(aggregateId)
                .eventType(event.type())
                .payload(toJson(event.payload()))
                .sequence(sequence)
                .timestamp(now())
                .build();

        try {
            eventRepository.save(entity);
        } catch (DataAccessException e) {
            throw new StorageException("append " + event.type() + " for " + aggregateId + " failed", e);
        }
        counters.put(aggregateId, sequence);
        invalidatePit(aggregateId);
        log.debug("📝 event {} {} seq={}", aggregateId, event.type().wireName(), sequence);

        if (snapshotEvery > 0 && sequence % snapshotEvery == 0) {
            try {
                JsonNode state = rebuildState(aggregateId);
                saveSnapshot(aggregateId, state, sequence, true);
                log.info("📸 авто-снимок {} seq={}", aggregateId, sequence);
            } catch (RuntimeException e) {
                // событие уже записано, снимок будет на следующем кратном
                log.error("❌ авто-снимок {} не создан: {}", aggregateId, e.getMessage(), e);
            }
        }
        return entity.getId();
    }

    // =====================================================================
    // QUERY / REPLAY
    // =====================================================================

    public List<StoredEvent> query(EventFilter filter) {
        StringBuilder jpql = new StringBuilder("select e from AuditEventEntity e where 1 = 1");
        Map<String, Object> params = new LinkedHashMap<>();
        if (filter.aggregateId() != null && !filter.aggregateId().isBlank()) {
            jpql.append(" and e.aggregateId = :aggregateId");
            params.put("aggregateId", filter.aggregateId().trim());
        }
        if (filter.type() != null) {
            jpql.append(" and e.eventType = :type");
            params.put("type", filter.type());
        }
        if (filter.from() != null) {
            jpql.append(" and e.timestamp >= :from");
            params.put("from", filter.from());
        }
        if (filter.to() != null) {
            jpql.append(" and e.timestamp <= :to");
            params.put("to", filter.to());
        }
        jpql.append(" order by e.timestamp asc, e.aggregateId asc, e.sequence asc");

        try {
            TypedQuery<AuditEventEntity> q = em.createQuery(jpql.toString(), AuditEventEntity.class);
            params.forEach(q::setParameter);
            if (filter.offset() != null && filter.offset() > 0) {
                q.setFirstResult(filter.offset());
            }
            if (filter.limit() != null && filter.limit() > 0) {
                q.setMaxResults(filter.limit());
            }
            return q.getResultList().stream().map(this::toStored).toList();
        } catch (RuntimeException e) {
            throw new StorageException("event query failed", e);
        }
    }

    /**
     * Все события агрегата в порядке sequence.
     */
    public List<StoredEvent> replay(String aggregateId) {
        try {
            return eventRepository.findByAggregateIdOrderBySequenceAsc(aggregateId).stream()
                    .map(this::toStored)
                    .toList();
        } catch (DataAccessException e) {
            throw new StorageException("replay " + aggregateId + " failed", e);
        }
    }

    /**
     * События с timestamp ≤ at, в порядке sequence: префикс {@link #replay(String)}.
     * Результат, прочитанный до записи в этот агрегат, в кэш не попадает.
     */
    public List<StoredEvent> stateAt(String aggregateId, Instant at) {
        PitKey key = new PitKey(aggregateId, at);
        Instant now = clock.instant();
        final long version;
        synchronized (pitCache) {
            version = pitVersions.getOrDefault(aggregateId, 0L);
            PitValue cached = pitCache.get(key);
            if (cached != null && Duration.between(cached.cachedAt(), now).compareTo(pitTtl) < 0) {
                return cached.events();
            }
        }

        List<StoredEvent> events;
        try {
            events = eventRepository.findByAggregateIdAndTimestampLessThanEqualOrderBySequenceAsc(aggregateId, at)
                    .stream()
                    .map(this::toStored)
                    .toList();
        } catch (DataAccessException e) {
            throw new StorageException("stateAt " + aggregateId + " failed", e);
        }

        synchronized (pitCache) {
            if (pitVersions.getOrDefault(aggregateId, 0L) != version) {
                log.debug("stateAt {}: агрегат изменился во время чтения, не кэшируем", aggregateId);
                return events;
            }
            pitCache.put(key, new PitValue(now, events));
            while (pitCache.size() > pitMaxSize) {
                PitKey eldest = pitCache.keySet().iterator().next();
                pitCache.remove(eldest);
            }
        }
        return events;
    }

    private void invalidatePit(String aggregateId) {
        synchronized (pitCache) {
            pitVersions.merge(aggregateId, 1L, Long::sum);
            pitCache.keySet().removeIf(k -> k.aggregateId().equals(aggregateId));
        }
    }

    // =====================================================================
    // SNAPSHOTS
    // =====================================================================

    /**
     * Снимок состояния на текущем sequence агрегата.
     *
     * @return id снимка
     */
    public String snapshot(String aggregateId, JsonNode state) {
        return await(submit(() -> {
            long sequence = counters.getOrDefault(aggregateId, 0L);
            return saveSnapshot(aggregateId, state, sequence, false);
        }));
    }

    public Optional<StoredSnapshot> latestSnapshot(String aggregateId) {
        try {
            return snapshotRepository.findFirstByAggregateIdOrderBySequenceDesc(aggregateId).map(this::toStored);
        } catch (DataAccessException e) {
            throw new StorageException("latest snapshot " + aggregateId + " failed", e);
        }
    }

    /**
     * Ближайший снимок + события после него.
     */
    public ObjectNode rebuildState(String aggregateId) {
        Optional<StoredSnapshot> snap = latestSnapshot(aggregateId);
        ObjectNode state = snap
                .filter(s -> s.state() != null && s.state().isObject())
                .map(s -> (ObjectNode) s.state().deepCopy())
                .orElseGet(mapper::createObjectNode);
        long from = snap.map(StoredSnapshot::sequence).orElse(0L);

        List<AuditEventEntity> tail;
        try {
            tail = eventRepository.findByAggregateIdAndSequenceGreaterThanOrderBySequenceAsc(aggregateId, from);
        } catch (DataAccessException e) {
            throw new StorageException("rebuild " + aggregateId + " failed", e);
        }
        for (AuditEventEntity e : tail) {
            state = projector.apply(state, toStored(e));
        }
        return state;
    }

    public ObjectNode rebuildStateFromScratch(String aggregateId) {
        ObjectNode state = mapper.createObjectNode();
        for (StoredEvent e : replay(aggregateId)) {
            state = projector.apply(state, e);
        }
        return state;
    }

    private String saveSnapshot(String aggregateId, JsonNode state, long sequence, boolean automatic) {
        AuditSnapshotEntity entity = AuditSnapshotEntity.builder()
                .id(UUID.randomUUID().toString())
                .aggregateId(aggregateId)
                .stateJson(toJson(state))
                .sequence(sequence)
                .timestamp(now())
                .automatic(automatic)
                .build();
        try {
            snapshotRepository.save(entity);
        } catch (DataAccessException e) {
            throw new StorageException("snapshot " + aggregateId + " failed", e);
        }
        return entity.getId();
    }

    // =====================================================================
    // EXPORT / STATS
    // =====================================================================

    public byte[] export(EventFilter filter, ExportFormat format) {
        List<StoredEvent> events = query(filter);
        return switch (format) {
            case JSON -> exportJson(events);
            case CSV -> exportCsv(events);
        };
    }

    private byte[] exportJson(List<StoredEvent> events) {
        ArrayNode arr = mapper.createArrayNode();
        for (StoredEvent e : events) {
            ObjectNode o = arr.addObject();
            o.put("id", e.id());
            o.put("eventType", e.type().wireName());
            o.put("aggregateId", e.aggregateId());
            o.put("sequence", e.sequence());
            o.put("timestamp", e.timestamp().toString());
            o.set("data", e.payload());
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(arr);
        } catch (JsonProcessingException e) {
            throw new StorageException("export JSON failed", e);
        }
    }

    private static byte[] exportCsv(List<StoredEvent> events) {
        StringBuilder sb = new StringBuilder("ID,Event Type,Aggregate ID,Sequence,Timestamp,Description\n");
        for (StoredEvent e : events) {
            sb.append(e.id()).append(',')
                    .append(e.type().wireName()).append(',')
                    .append(csvCell(e.aggregateId())).append(',')
                    .append(e.sequence()).append(',')
                    .append(e.timestamp()).append(',')
                    .append('"').append(e.description().replace("\"", "\"\"")).append('"')
                    .append('\n');
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static String csvCell(String s) {
        if (s.indexOf(',') < 0 && s.indexOf('"') < 0 && s.indexOf('\n') < 0) {
            return s;
        }
        return '"' + s.replace("\"", "\"\"") + '"';
    }

    public EventStoreStats stats() {
        try {
            Map<String, Long> perType = new LinkedHashMap<>();
            for (Object[] row : eventRepository.countPerType()) {
                perType.put(((AuditEventType) row[0]).wireName(), ((Number) row[1]).longValue());
            }
            long total = eventRepository.count();
            long last24h = eventRepository.countByTimestampGreaterThanEqual(clock.instant().minus(Duration.ofHours(24)));
            return new EventStoreStats(total, last24h, perType);
        } catch (DataAccessException e) {
            throw new StorageException("event stats failed", e);
        }
    }

    public long currentSequence(String aggregateId) {
        return counters.getOrDefault(aggregateId, 0L);
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    private <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> f = new CompletableFuture<>();
        try {
            writer.execute(() -> {
                try {
                    f.complete(task.call());
                } catch (Exception e) {
                    f.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            f.completeExceptionally(new StorageException("event store is shut down", e));
        }
        return f;
    }

    private static <T> T await(CompletableFuture<T> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("interrupted while writing event", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StorageException se) {
                throw se;
            }
            throw new StorageException("event store write failed", cause);
        }
    }

    private Instant now() {
        // точность БД: микросекунды, храним миллисекунды, чтобы сравнения были стабильными
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("payload is not serializable", e);
        }
    }

    private JsonNode readJson(String json) {
        if (json == null || json.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StorageException("stored JSON is corrupted", e);
        }
    }

    private StoredEvent toStored(AuditEventEntity e) {
        return new StoredEvent(e.getId(), e.getAggregateId(), e.getEventType(), readJson(e.getPayload()), e.getSequence(), e.getTimestamp());
    }

    private StoredSnapshot toStored(AuditSnapshotEntity s) {
        return new StoredSnapshot(s.getId(), s.getAggregateId(), readJson(s.getStateJson()), s.getSequence(), s.getTimestamp(), s.isAutomatic());
    }
}
