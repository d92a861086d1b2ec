package com.chicu.streamcore.cache;

import com.chicu.streamcore.config.StreamCoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Двухуровневый кэш: память (шардированный LRU) + опционально диск.
 *
 * Память ограничена и числом записей, и байтами; вытеснение по LRU не зависит от TTL.
 * Каждый шард под своим локом, глобальный LRU выбирает самую старую голову среди шардов.
 * Промах в памяти идёт на диск, найденное поднимается обратно в память.
 */
@Slf4j
public class CacheManager {

    private static final class Shard {
        final ReentrantLock lock = new ReentrantLock();
        /** accessOrder = true: первая запись: самая давно использованная */
        final LinkedHashMap<String, CacheEntry> map = new LinkedHashMap<>(64, 0.75f, true);
    }

    private static final class TypeCounters {
        final LongAdder hits = new LongAdder();
        final LongAdder misses = new LongAdder();
        final AtomicLong entries = new AtomicLong();
        final AtomicLong bytes = new AtomicLong();
    }

    private final Shard[] shards;
    private final int maxEntries;
    private final long maxSizeBytes;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final DiskCacheTier disk;

    private final AtomicReference<CacheTtlConfig> ttlConfig;
    private final AtomicLong ticks = new AtomicLong();

    private final AtomicLong entries = new AtomicLong();
    private final AtomicLong sizeBytes = new AtomicLong();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder diskHits = new LongAdder();
    private final LongAdder diskMisses = new LongAdder();
    private final LongAdder warmLoads = new LongAdder();
    private final AtomicReference<Instant> lastWarmed = new AtomicReference<>();
    private final Map<CacheType, TypeCounters> perType = new EnumMap<>(CacheType.class);

    /**
     * @param disk null: без дискового уровня
     */
    public CacheManager(int shardCount,
                        int maxEntries,
                        long maxSizeBytes,
                        CacheTtlConfig ttlConfig,
                        ObjectMapper mapper,
                        Clock clock,
                        DiskCacheTier disk) {
        if (shardCount <= 0 || maxEntries <= 0 || maxSizeBytes <= 0) {
            throw new IllegalArgumentException("cache bounds must be > 0");
        }
        this.shards = new Shard[shardCount];
        for (int i = 0; i < shardCount; i++) {
            shards[i] = new Shard();
        }
        this.maxEntries = maxEntries;
        this.maxSizeBytes = maxSizeBytes;
        this.ttlConfig = new AtomicReference<>(ttlConfig.validate());
        this.mapper = mapper;
        this.clock = clock;
        this.disk = disk;
        for (CacheType t : CacheType.values()) {
            perType.put(t, new TypeCounters());
        }
        if (disk != null) {
            disk.pruneExpired();
        }
    }

    public static CacheManager from(StreamCoreProperties.Cache cfg, ObjectMapper mapper, Clock clock, DiskCacheTier disk) {
        return new CacheManager(
                cfg.getShards(),
                cfg.getMaxEntries(),
                cfg.getMaxSizeBytes(),
                CacheTtlConfig.from(cfg),
                mapper,
                clock,
                disk
        );
    }

    // =====================================================================
    // GET / SET
    // =====================================================================

    public Optional<JsonNode> get(String key, CacheType type) {
        Instant now = clock.instant();
        Shard shard = shardFor(key);

        CacheEntry hit = null;
        CacheEntry expired = null;
        shard.lock.lock();
        try {
            CacheEntry e = shard.map.get(key);
            if (e != null) {
                if (e.isExpired(now)) {
                    shard.map.remove(key);
                    expired = e;
                } else {
                    e.touch(now, ticks.incrementAndGet());
                    hit = e;
                }
            }
        } finally {
            shard.lock.unlock();
        }

        if (expired != null) {
            onRemoved(expired);
        }
        if (hit != null) {
            hits.increment();
            perType.get(type).hits.increment();
            return Optional.of(hit.getValue());
        }

        misses.increment();
        perType.get(type).misses.increment();

        if (disk == null) {
            return Optional.empty();
        }
        Optional<CacheEntry> fromDisk = disk.read(key);
        if (fromDisk.isEmpty()) {
            diskMisses.increment();
            return Optional.empty();
        }
        diskHits.increment();
        CacheEntry hydrated = fromDisk.get();
        insert(hydrated);
        log.debug("💾 cache {} поднят с диска", key);
        return Optional.of(hydrated.getValue());
    }

    public <T> Optional<T> get(String key, CacheType type, Class<T> valueType) {
        return get(key, type).map(node -> mapper.convertValue(node, valueType));
    }

    /**
     * @return false, если значение больше всего бюджета памяти и не сохранено
     */
    public boolean set(String key, Object value, CacheType type) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("cache key is empty");
        }
        JsonNode node = value instanceof JsonNode n ? n : mapper.valueToTree(value);
        long size;
        try {
            size = mapper.writeValueAsBytes(node).length;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value for " + key + " is not serializable", e);
        }
        if (size > maxSizeBytes) {
            log.warn("⚠ cache {}: {} bytes больше лимита {}: не кэшируем", key, size, maxSizeBytes);
            return false;
        }

        Duration ttl = ttlConfig.get().ttlFor(type);
        CacheEntry entry = new CacheEntry(key, node, type, clock.instant(), ttl, size);
        insert(entry);
        if (disk != null) {
            disk.write(entry);
        }
        return true;
    }

    private void insert(CacheEntry entry) {
        entry.stamp(ticks.incrementAndGet());
        Shard shard = shardFor(entry.getKey());
        CacheEntry old;
        shard.lock.lock();
        try {
            old = shard.map.put(entry.getKey(), entry);
        } finally {
            shard.lock.unlock();
        }
        if (old != null) {
            onRemoved(old);
        }
        onAdded(entry);
        enforceBounds();
    }

    // =====================================================================
    // EVICTION
    // =====================================================================

    private void enforceBounds() {
        while (entries.get() > maxEntries || sizeBytes.get() > maxSizeBytes) {
            if (!evictOne()) {
                return;
            }
        }
    }

    /**
     * Глобальный LRU: голова каждого шарда: его самая старая запись,
     * из них берём с наименьшим тиком доступа.
     */
    private boolean evictOne() {
        CacheEntry victim = null;
        Shard victimShard = null;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                Iterator<CacheEntry> it = shard.map.values().iterator();
                if (it.hasNext()) {
                    CacheEntry eldest = it.next();
                    if (victim == null || eldest.getAccessTick() < victim.getAccessTick()) {
                        victim = eldest;
                        victimShard = shard;
                    }
                }
            } finally {
                shard.lock.unlock();
            }
        }
        if (victim == null) {
            return false;
        }

        boolean removed;
        victimShard.lock.lock();
        try {
            removed = victimShard.map.remove(victim.getKey(), victim);
        } finally {
            victimShard.lock.unlock();
        }
        // кто-то успел тронуть запись: просто пробуем ещё раз
        if (removed) {
            onRemoved(victim);
            evictions.increment();
            if (disk != null) {
                disk.remove(victim.getKey());
            }
            log.debug("🧹 cache evict {} ({} bytes)", victim.getKey(), victim.getSizeBytes());
        }
        return true;
    }

    private void onAdded(CacheEntry e) {
        entries.incrementAndGet();
        sizeBytes.addAndGet(e.getSizeBytes());
        TypeCounters tc = perType.get(e.getType());
        tc.entries.incrementAndGet();
        tc.bytes.addAndGet(e.getSizeBytes());
    }

    private void onRemoved(CacheEntry e) {
        entries.decrementAndGet();
        sizeBytes.addAndGet(-e.getSizeBytes());
        TypeCounters tc = perType.get(e.getType());
        tc.entries.decrementAndGet();
        tc.bytes.addAndGet(-e.getSizeBytes());
    }

    // =====================================================================
    // INVALIDATE / CLEAR
    // =====================================================================

    public void invalidate(String key) {
        Shard shard = shardFor(key);
        CacheEntry old;
        shard.lock.lock();
        try {
            old = shard.map.remove(key);
        } finally {
            shard.lock.unlock();
        }
        if (old != null) {
            onRemoved(old);
        }
        if (disk != null) {
            disk.remove(key);
        }
    }

    /**
     * @return сколько записей удалено из памяти
     */
    public int purgePrefix(String prefix) {
        int removed = 0;
        for (Shard shard : shards) {
            List<CacheEntry> gone = new ArrayList<>();
            shard.lock.lock();
            try {
                Iterator<Map.Entry<String, CacheEntry>> it = shard.map.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<String, CacheEntry> e = it.next();
                    if (e.getKey().startsWith(prefix)) {
                        gone.add(e.getValue());
                        it.remove();
                    }
                }
            } finally {
                shard.lock.unlock();
            }
            gone.forEach(this::onRemoved);
            removed += gone.size();
        }
        if (disk != null) {
            disk.purgePrefix(prefix);
        }
        log.info("🧹 cache purge '{}': {} записей", prefix, removed);
        return removed;
    }

    public void clear() {
        for (Shard shard : shards) {
            List<CacheEntry> gone;
            shard.lock.lock();
            try {
                gone = new ArrayList<>(shard.map.values());
                shard.map.clear();
            } finally {
                shard.lock.unlock();
            }
            gone.forEach(this::onRemoved);
        }
        if (disk != null) {
            disk.clear();
        }
        log.info("🧹 cache cleared");
    }

    // =====================================================================
    // WARM
    // =====================================================================

    /**
     * Прогрев перед стартом. Ошибка по одному ключу не останавливает остальные.
     */
    public WarmProgress warm(Collection<String> keys, CacheLoader loader) {
        int completed = 0;
        for (String key : keys) {
            try {
                Optional<CacheLoader.Loaded> loaded = loader.load(key);
                if (loaded.isPresent() && set(key, loaded.get().value(), loaded.get().type())) {
                    completed++;
                }
            } catch (Exception e) {
                log.warn("⚠ warm {} failed: {}", key, e.getMessage());
            }
        }
        warmLoads.add(completed);
        lastWarmed.set(clock.instant());
        WarmProgress progress = WarmProgress.of(keys.size(), completed);
        log.info("🔥 cache warm {}/{}", progress.completed(), progress.total());
        return progress;
    }

    /**
     * Поднять в память самые свежие записи с диска.
     */
    public int populateFromDisk(int limit) {
        if (disk == null) {
            return 0;
        }
        int warmed = 0;
        for (CacheEntry e : disk.loadRecent(limit)) {
            insert(e);
            warmed++;
        }
        warmLoads.add(warmed);
        return warmed;
    }

    // =====================================================================
    // STATS / CONFIG
    // =====================================================================

    public CacheStats stats() {
        Map<CacheType, TypeStats> types = new EnumMap<>(CacheType.class);
        perType.forEach((t, c) -> {
            long h = c.hits.sum();
            long m = c.misses.sum();
            types.put(t, new TypeStats(h, m, rate(h, m), c.entries.get(), c.bytes.get()));
        });
        long h = hits.sum();
        long m = misses.sum();
        return new CacheStats(
                h,
                m,
                rate(h, m),
                evictions.sum(),
                entries.get(),
                sizeBytes.get(),
                diskHits.sum(),
                diskMisses.sum(),
                warmLoads.sum(),
                lastWarmed.get(),
                types
        );
    }

    public List<String> topAccessedKeys(int limit) {
        List<CacheEntry> all = new ArrayList<>();
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                all.addAll(shard.map.values());
            } finally {
                shard.lock.unlock();
            }
        }
        return all.stream()
                .sorted(Comparator.comparingLong(CacheEntry::getAccessCount).reversed())
                .limit(limit)
                .map(CacheEntry::getKey)
                .toList();
    }

    public CacheTtlConfig ttlConfig() {
        return ttlConfig.get();
    }

    /**
     * Новые TTL действуют на следующие записи; уже лежащие доживают со своим.
     *
     * @throws IllegalArgumentException если TTL вне [100 мс, 7 дней]
     */
    public void updateTtlConfig(CacheTtlConfig cfg) {
        ttlConfig.set(cfg.validate());
        log.info("⚙ cache TTL: prices={} metadata={} history={}", cfg.prices(), cfg.metadata(), cfg.history());
    }

    public int maxEntries() {
        return maxEntries;
    }

    public long maxSizeBytes() {
        return maxSizeBytes;
    }

    private Shard shardFor(String key) {
        return shards[(key.hashCode() & 0x7fffffff) % shards.length];
    }

    private static double rate(long hits, long misses) {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
