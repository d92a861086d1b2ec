package com.chicu.streamcore.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Второй уровень кэша: один JSON-файл на ключ, имя файла: SHA-256 ключа.
 *
 * Ошибки диска не роняют кэш: логируем и считаем промахом.
 */
@Slf4j
public class DiskCacheTier {

    private static final String SUFFIX = ".json";

    /** Формат файла на диске */
    public record StoredEntry(String key, CacheType type, long insertedAtMs, long ttlMs, JsonNode value) {

        boolean isExpired(Instant now) {
            return now.toEpochMilli() >= insertedAtMs + ttlMs;
        }

        CacheEntry toEntry(long sizeBytes) {
            return new CacheEntry(key, value, type, Instant.ofEpochMilli(insertedAtMs), Duration.ofMillis(ttlMs), sizeBytes);
        }
    }

    private final Path dir;
    private final ObjectMapper mapper;
    private final Clock clock;

    public DiskCacheTier(Path dir, ObjectMapper mapper, Clock clock) {
        this.dir = dir;
        this.mapper = mapper;
        this.clock = clock;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.warn("⚠ Не удалось создать каталог дискового кэша {}: {}", dir, e.getMessage());
        }
    }

    public Path dir() {
        return dir;
    }

    public void write(CacheEntry entry) {
        StoredEntry stored = new StoredEntry(
                entry.getKey(),
                entry.getType(),
                entry.getInsertedAt().toEpochMilli(),
                entry.getTtl().toMillis(),
                entry.getValue()
        );
        Path path = pathFor(entry.getKey());
        try {
            Files.createDirectories(dir);
            Files.write(path, mapper.writeValueAsBytes(stored));
        } catch (IOException e) {
            log.warn("⚠ disk cache write {} failed: {}", entry.getKey(), e.getMessage());
        }
    }

    /**
     * Живая запись с диска. Просроченная удаляется сразу.
     */
    public Optional<CacheEntry> read(String key) {
        Path path = pathFor(key);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        Optional<StoredEntry> stored = load(path);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        StoredEntry s = stored.get();
        // коллизия хеша или чужой файл
        if (!key.equals(s.key())) {
            return Optional.empty();
        }
        if (s.isExpired(clock.instant())) {
            delete(path);
            return Optional.empty();
        }
        return Optional.of(s.toEntry(sizeOf(s.value())));
    }

    public void remove(String key) {
        delete(pathFor(key));
    }

    /**
     * Имена файлов: хеши, поэтому префикс проверяем по содержимому.
     */
    public int purgePrefix(String prefix) {
        int removed = 0;
        for (Path path : files()) {
            Optional<StoredEntry> stored = load(path);
            if (stored.isPresent() && stored.get().key().startsWith(prefix)) {
                delete(path);
                removed++;
            }
        }
        return removed;
    }

    public int pruneExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Path path : files()) {
            Optional<StoredEntry> stored = load(path);
            if (stored.isEmpty() || stored.get().isExpired(now)) {
                delete(path);
                removed++;
            }
        }
        if (removed > 0) {
            log.info("🧹 disk cache: удалено {} просроченных записей", removed);
        }
        return removed;
    }

    /**
     * Самые свежие живые записи: для прогрева памяти при старте.
     */
    public List<CacheEntry> loadRecent(int limit) {
        Instant now = clock.instant();
        List<CacheEntry> out = new ArrayList<>();
        for (Path path : files()) {
            load(path)
                    .filter(s -> !s.isExpired(now))
                    .ifPresent(s -> out.add(s.toEntry(sizeOf(s.value()))));
        }
        out.sort(Comparator.comparing(CacheEntry::getInsertedAt).reversed());
        return out.size() > limit ? new ArrayList<>(out.subList(0, limit)) : out;
    }

    public void clear() {
        files().forEach(this::delete);
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    Path pathFor(String key) {
        return dir.resolve(sha256(key) + SUFFIX);
    }

    private Optional<StoredEntry> load(Path path) {
        try {
            return Optional.of(mapper.readValue(Files.readAllBytes(path), StoredEntry.class));
        } catch (IOException e) {
            log.warn("⚠ disk cache read {} failed: {}", path.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<Path> files() {
        List<Path> out = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            stream.forEach(out::add);
        } catch (IOException e) {
            log.warn("⚠ disk cache list {} failed: {}", dir, e.getMessage());
        }
        return out;
    }

    private void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("⚠ disk cache delete {} failed: {}", path.getFileName(), e.getMessage());
        }
    }

    private long sizeOf(JsonNode value) {
        try {
            return mapper.writeValueAsBytes(value).length;
        } catch (IOException e) {
            log.debug("disk cache size of value failed: {}", e.getMessage());
            return value.toString().length();
        }
    }

    static String sha256(String key) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
