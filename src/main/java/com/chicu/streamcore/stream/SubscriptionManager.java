package com.chicu.streamcore.stream;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Подсчёт ссылок на подписки (символы / адреса).
 *
 * Держит только ключи, соединение не знает: наружу отдаёт готовые команды,
 * в которых только чистые изменения, порезанные на пачки по maxBatchSize.
 */
@Slf4j
public class SubscriptionManager {

    private final int maxBatchSize;

    /** key → refcount, порядок подписки сохраняется */
    private final Map<String, Integer> refcounts = new LinkedHashMap<>();

    public SubscriptionManager(int maxBatchSize) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be > 0");
        }
        this.maxBatchSize = maxBatchSize;
    }

    /**
     * @return команды SUBSCRIBE для ключей, у которых refcount стал 1
     */
    public synchronized List<StreamCommand> subscribe(Collection<String> keys) {
        Set<String> added = new LinkedHashSet<>();
        for (String raw : keys) {
            String key = normalize(raw);
            if (key.isEmpty()) {
                log.warn("⚠ Пустой ключ: пропускаем подписку");
                continue;
            }
            int next = refcounts.merge(key, 1, Integer::sum);
            if (next == 1) {
                added.add(key);
            }
        }
        return batch(StreamCommand.Type.SUBSCRIBE, added);
    }

    /**
     * @return команды UNSUBSCRIBE для ключей, у которых refcount дошёл до 0
     */
    public synchronized List<StreamCommand> unsubscribe(Collection<String> keys) {
        Set<String> removed = new LinkedHashSet<>();
        for (String raw : keys) {
            String key = normalize(raw);
            Integer current = refcounts.get(key);
            if (current == null) {
                continue;
            }
            if (current <= 1) {
                refcounts.remove(key);
                removed.add(key);
            } else {
                refcounts.put(key, current - 1);
            }
        }
        return batch(StreamCommand.Type.UNSUBSCRIBE, removed);
    }

    /**
     * После нового рукопожатия провайдер ничего не помнит: шлём весь набор.
     */
    public synchronized List<StreamCommand> resubscribeAll() {
        return batch(StreamCommand.Type.SUBSCRIBE, refcounts.keySet());
    }

    public synchronized Set<String> activeKeys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(refcounts.keySet()));
    }

    public synchronized boolean isActive(String key) {
        return refcounts.containsKey(normalize(key));
    }

    public synchronized int refcount(String key) {
        return refcounts.getOrDefault(normalize(key), 0);
    }

    public synchronized int size() {
        return refcounts.size();
    }

    private List<StreamCommand> batch(StreamCommand.Type type, Collection<String> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        List<StreamCommand> out = new ArrayList<>();
        List<String> current = new ArrayList<>(maxBatchSize);
        for (String key : keys) {
            current.add(key);
            if (current.size() >= maxBatchSize) {
                out.add(new StreamCommand(type, current));
                current = new ArrayList<>(maxBatchSize);
            }
        }
        if (!current.isEmpty()) {
            out.add(new StreamCommand(type, current));
        }
        return out;
    }

    // адреса Solana регистрозависимы: только trim
    private static String normalize(String key) {
        return key == null ? "" : key.trim();
    }
}
