package com.chicu.streamcore.core;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Раздача обновлений подписчикам. Ошибка одного слушателя не мешает остальным.
 */
@Slf4j
public class UpdateBus {

    /** provider|key → слушатели */
    private final Map<String, List<Consumer<Update>>> byKey = new ConcurrentHashMap<>();
    private final List<Consumer<Update>> global = new CopyOnWriteArrayList<>();
    private final List<Consumer<StatusChange>> statusListeners = new CopyOnWriteArrayList<>();

    public void addListener(String provider, String key, Consumer<Update> listener) {
        byKey.computeIfAbsent(id(provider, key), k -> new CopyOnWriteArrayList<>()).add(listener);
    }

    public void removeListener(String provider, String key, Consumer<Update> listener) {
        byKey.computeIfPresent(id(provider, key), (k, list) -> {
            list.remove(listener);
            return list.isEmpty() ? null : list;
        });
    }

    /**
     * Слушатель всех ключей всех провайдеров (STOMP-мост).
     */
    public void addGlobalListener(Consumer<Update> listener) {
        global.add(listener);
    }

    public void addStatusListener(Consumer<StatusChange> listener) {
        statusListeners.add(listener);
    }

    public void publish(Update update) {
        List<Consumer<Update>> listeners = byKey.get(id(update.provider(), update.key()));
        if (listeners != null) {
            listeners.forEach(l -> deliver(l, update));
        }
        global.forEach(l -> deliver(l, update));
    }

    public void publishStatus(StatusChange change) {
        statusListeners.forEach(l -> deliver(l, change));
    }

    private static <T> void deliver(Consumer<T> listener, T value) {
        try {
            listener.accept(value);
        } catch (RuntimeException e) {
            log.error("❗ Ошибка в слушателе обновлений: {}", e.getMessage(), e);
        }
    }

    private static String id(String provider, String key) {
        return provider + "|" + key;
    }
}
