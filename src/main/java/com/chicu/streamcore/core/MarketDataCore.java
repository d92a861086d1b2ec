package com.chicu.streamcore.core;

import com.chicu.streamcore.audit.DomainEvent;
import com.chicu.streamcore.audit.EventFilter;
import com.chicu.streamcore.audit.EventStore;
import com.chicu.streamcore.audit.ExportFormat;
import com.chicu.streamcore.audit.StoredEvent;
import com.chicu.streamcore.cache.CacheLoader;
import com.chicu.streamcore.cache.CacheManager;
import com.chicu.streamcore.cache.CacheType;
import com.chicu.streamcore.cache.WarmProgress;
import com.chicu.streamcore.merge.PriceSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Точка входа ядра: подписки, кэш, аудит, статус провайдеров.
 *
 * Владеет жизненным циклом всех {@link StreamSupervisor}: start() поднимает
 * соединения, stop() гасит их в обратном порядке.
 */
@Slf4j
public class MarketDataCore {

    private final Map<String, StreamSupervisor> supervisors = new LinkedHashMap<>();
    private final CacheManager cache;
    private final EventStore eventStore;
    private final UpdateBus bus;

    private volatile boolean started;

    public MarketDataCore(Collection<StreamSupervisor> supervisors,
                          CacheManager cache,
                          EventStore eventStore,
                          UpdateBus bus) {
        for (StreamSupervisor s : supervisors) {
            if (this.supervisors.putIfAbsent(s.providerId(), s) != null) {
                throw new IllegalArgumentException("duplicate provider: " + s.providerId());
            }
        }
        this.cache = cache;
        this.eventStore = eventStore;
        this.bus = bus;
    }

    // =====================================================================
    // LIFECYCLE
    // =====================================================================

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        supervisors.values().forEach(StreamSupervisor::start);
        log.info("🚀 MarketDataCore started, providers={}", supervisors.keySet());
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        List<StreamSupervisor> list = new ArrayList<>(supervisors.values());
        for (int i = list.size() - 1; i >= 0; i--) {
            try {
                list.get(i).stop();
            } catch (RuntimeException e) {
                log.error("❌ stop {} failed: {}", list.get(i).providerId(), e.getMessage(), e);
            }
        }
        log.info("🛑 MarketDataCore stopped");
    }

    public boolean isStarted() {
        return started;
    }

    // =====================================================================
    // SUBSCRIPTIONS
    // =====================================================================

    /**
     * Подписка на ключи провайдера. Слушатель получает каждое согласованное
     * состояние ключа; закрытие хэндла снимает слушателя и подписку.
     */
    public UpdateSubscription subscribe(String provider, Collection<String> keys, Consumer<Update> listener) {
        StreamSupervisor s = supervisor(provider);
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("keys must not be empty");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        List<String> list = List.copyOf(keys);
        list.forEach(k -> bus.addListener(provider, k, listener));
        s.subscribe(list);
        return new UpdateSubscription(provider, list, () -> {
            list.forEach(k -> bus.removeListener(provider, k, listener));
            s.unsubscribe(list);
        });
    }

    // =====================================================================
    // CACHE
    // =====================================================================

    /**
     * Последнее согласованное состояние ключа: сначала из merger, потом из кэша.
     */
    public Optional<PriceSnapshot> getCached(String provider, String key) {
        StreamSupervisor s = supervisor(provider);
        Optional<PriceSnapshot> live = s.merger().get(key);
        if (live.isPresent()) {
            return live;
        }
        return cache.get(StreamSupervisor.cacheKey(provider, key), CacheType.PRICE, PriceSnapshot.class);
    }

    public Optional<JsonNode> getCached(String key, CacheType type) {
        return cache.get(key, type);
    }

    public boolean putCached(String key, Object value, CacheType type) {
        return cache.set(key, value, type);
    }

    public CompletableFuture<WarmProgress> warmCache(Collection<String> keys, CacheLoader loader) {
        List<String> copy = List.copyOf(keys);
        return CompletableFuture.supplyAsync(() -> cache.warm(copy, loader));
    }

    public CacheManager cache() {
        return cache;
    }

    // =====================================================================
    // AUDIT
    // =====================================================================

    public String recordEvent(DomainEvent event) {
        return eventStore.append(event);
    }

    public List<StoredEvent> getEvents(EventFilter filter) {
        return eventStore.query(filter);
    }

    public byte[] exportAudit(EventFilter filter, ExportFormat format) {
        return eventStore.export(filter, format);
    }

    // =====================================================================
    // STATUS
    // =====================================================================

    public List<StreamStatus> status() {
        List<StreamStatus> out = new ArrayList<>(supervisors.size());
        supervisors.values().forEach(s -> out.add(s.status()));
        return out;
    }

    public StreamStatus status(String provider) {
        return supervisor(provider).status();
    }

    public void reconnect(String provider) {
        log.info("🔄 manual reconnect {}", provider);
        supervisor(provider).reconnect();
    }

    public void addStatusListener(Consumer<StatusChange> listener) {
        bus.addStatusListener(listener);
    }

    public Set<String> providers() {
        return supervisors.keySet();
    }

    private StreamSupervisor supervisor(String provider) {
        StreamSupervisor s = provider == null ? null : supervisors.get(provider);
        if (s == null) {
            throw new IllegalArgumentException("unknown provider: " + provider);
        }
        return s;
    }
}
