package com.chicu.streamcore.merge;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Сборка состояния из snapshot + delta.
 *
 * Delta принимается только если sequence == last + 1. Любой разрыв или повтор:
 * delta выбрасывается, ключ помечается stale, resync-колбэк зовётся один раз
 * на эпизод. Поля не угадываем. Stale снимает только новый snapshot.
 */
@Slf4j
public class DeltaMerger {

    private record Entry(PriceSnapshot snapshot, boolean stale) {}

    private final Map<String, Entry> states = new ConcurrentHashMap<>();
    private final Consumer<String> resyncCallback;

    public DeltaMerger(Consumer<String> resyncCallback) {
        this.resyncCallback = resyncCallback == null ? k -> { } : resyncCallback;
    }

    public PriceSnapshot applySnapshot(String key, PriceSnapshot snapshot) {
        PriceSnapshot normalized = key.equals(snapshot.key())
                ? snapshot
                : new PriceSnapshot(key, snapshot.fields(), snapshot.sequence(), snapshot.observedAt());
        states.put(key, new Entry(normalized, false));
        log.debug("📸 snapshot {} seq={}", key, normalized.sequence());
        return normalized;
    }

    public MergeResult applyDelta(String key, DeltaMessage delta) {
        // true, если именно этот вызов перевёл ключ в stale
        boolean[] newlyStale = new boolean[1];
        String[] reason = new String[1];

        Entry result = states.compute(key, (k, current) -> {
            if (current == null) {
                reason[0] = "no base snapshot";
                newlyStale[0] = true;
                return new Entry(null, true);
            }
            if (current.stale()) {
                reason[0] = "awaiting snapshot";
                return current;
            }
            long expected = current.snapshot().sequence() + 1;
            if (delta.sequence() != expected) {
                reason[0] = "sequence gap: expected " + expected + ", got " + delta.sequence();
                newlyStale[0] = true;
                return new Entry(current.snapshot(), true);
            }
            Map<String, Object> merged = new LinkedHashMap<>(current.snapshot().fields());
            merged.putAll(delta.changedFields());
            Instant at = delta.observedAt() != null ? delta.observedAt() : current.snapshot().observedAt();
            return new Entry(new PriceSnapshot(k, merged, delta.sequence(), at), false);
        });

        if (!result.stale()) {
            return MergeResult.applied(result.snapshot());
        }
        if (newlyStale[0]) {
            log.warn("⚠ {} stale ({}), requesting resync", key, reason[0]);
            resyncCallback.accept(key);
        }
        return MergeResult.stale(reason[0]);
    }

    /**
     * Последнее согласованное состояние. Для stale-ключа: empty.
     */
    public Optional<PriceSnapshot> get(String key) {
        Entry e = states.get(key);
        if (e == null || e.stale()) {
            return Optional.empty();
        }
        return Optional.ofNullable(e.snapshot());
    }

    public boolean isStale(String key) {
        Entry e = states.get(key);
        return e != null && e.stale();
    }

    /**
     * Пометить stale без колбэка: ждём snapshot после переподписки.
     */
    public void invalidate(String key) {
        states.computeIfPresent(key, (k, e) -> new Entry(e.snapshot(), true));
    }

    public void remove(String key) {
        states.remove(key);
    }

    public Set<String> keys() {
        return Set.copyOf(states.keySet());
    }
}
