package com.chicu.streamcore.config;

import com.chicu.streamcore.compression.CompressionAlgorithm;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Все настройки ядра стрима в одном месте (prefix = stream-core).
 * Значения по умолчанию: рабочие, application.yml только переопределяет.
 */
@Data
@ConfigurationProperties(prefix = "stream-core")
public class StreamCoreProperties {

    private Backoff backoff = new Backoff();
    private Health health = new Health();
    private Fallback fallback = new Fallback();
    private Subscription subscription = new Subscription();
    private Queue queue = new Queue();
    private Cache cache = new Cache();
    private EventStore eventStore = new EventStore();
    private Compression compression = new Compression();
    private Http http = new Http();

    /** id провайдера (birdeye / helius) → настройки */
    private Map<String, Provider> providers = new LinkedHashMap<>();

    @Data
    public static class Backoff {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        /** доля ±, 0.2 = ±20% */
        private double jitter = 0.2;
        private int maxAttempts = 100;
    }

    @Data
    public static class Health {
        private Duration pingInterval = Duration.ofSeconds(30);
        private Duration staleThreshold = Duration.ofSeconds(60);
        private Duration tickInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class Fallback {
        private Duration pollInterval = Duration.ofSeconds(5);
        /** сколько подряд неудачных коннектов до включения REST-поллинга */
        private int failureThreshold = 3;
    }

    @Data
    public static class Subscription {
        private int maxBatchSize = 100;
    }

    @Data
    public static class Queue {
        private int capacity = 1000;
    }

    @Data
    public static class Cache {
        private int maxEntries = 1000;
        private long maxSizeBytes = 100L * 1024 * 1024;
        private int shards = 16;
        private Duration pricesTtl = Duration.ofSeconds(1);
        private Duration metadataTtl = Duration.ofHours(1);
        private Duration historyTtl = Duration.ofDays(1);
        private boolean diskEnabled = true;
        private String diskDir = "./cache/disk";
    }

    @Data
    public static class EventStore {
        private int snapshotEvery = 1000;
        private Duration pointInTimeCacheTtl = Duration.ofMinutes(5);
        private int pointInTimeCacheSize = 100;
    }

    @Data
    public static class Compression {
        private boolean enabled = true;
        private boolean autoCompress = true;
        private int eventAgeDays = 7;
        private int tradeAgeDays = 30;
        private CompressionAlgorithm algorithm = CompressionAlgorithm.DEFLATE;
        private int level = 3;
        private int batchSize = 1000;
        private Duration initialDelay = Duration.ofMinutes(10);
        private Duration runInterval = Duration.ofDays(1);
    }

    @Data
    public static class Http {
        private int maxTotal = 200;
        private int maxPerRoute = 50;
        private Duration connectTimeout = Duration.ofSeconds(3);
        /** ожидание свободного соединения из пула */
        private Duration poolTimeout = Duration.ofSeconds(3);
        private Duration responseTimeout = Duration.ofSeconds(12);
        private Duration evictIdle = Duration.ofSeconds(20);
        private Duration wsConnectTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Provider {
        private boolean enabled = true;
        private String wsUrl;
        private String restUrl;
        private String apiKey;
    }
}
