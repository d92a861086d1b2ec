package com.chicu.streamcore.cache;

import java.util.Optional;

/**
 * Источник значения для прогрева. Empty: грузить нечего, исключение: ключ пропускается.
 */
@FunctionalInterface
public interface CacheLoader {

    Optional<Loaded> load(String key) throws Exception;

    record Loaded(Object value, CacheType type) {}
}
