package com.chicu.streamcore.config;

import com.chicu.streamcore.audit.EventStore;
import com.chicu.streamcore.cache.CacheManager;
import com.chicu.streamcore.cache.DiskCacheTier;
import com.chicu.streamcore.core.MarketDataCore;
import com.chicu.streamcore.core.StreamScheduler;
import com.chicu.streamcore.core.StreamSupervisor;
import com.chicu.streamcore.core.UpdateBus;
import com.chicu.streamcore.resilience.HealthMonitor;
import com.chicu.streamcore.resilience.ReconnectPolicy;
import com.chicu.streamcore.resilience.RestFallbackFetcher;
import com.chicu.streamcore.stream.JdkWsTransport;
import com.chicu.streamcore.stream.MessageQueue;
import com.chicu.streamcore.stream.StreamConnection;
import com.chicu.streamcore.stream.StreamEvent;
import com.chicu.streamcore.stream.StreamProvider;
import com.chicu.streamcore.stream.SubscriptionManager;
import com.chicu.streamcore.stream.WsTransport;
import com.chicu.streamcore.stream.provider.birdeye.BirdeyeStreamProvider;
import com.chicu.streamcore.stream.provider.helius.HeliusStreamProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Сборка ядра: провайдеры из stream-core.providers, по супервизору на каждого.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(StreamCoreProperties.class)
public class StreamCoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public UpdateBus updateBus() {
        return new UpdateBus();
    }

    @Bean
    public CacheManager cacheManager(StreamCoreProperties props, ObjectMapper mapper, Clock clock) {
        StreamCoreProperties.Cache cfg = props.getCache();
        DiskCacheTier disk = null;
        if (cfg.isDiskEnabled()) {
            disk = new DiskCacheTier(Path.of(cfg.getDiskDir()), mapper, clock);
            log.info("💾 Дисковый кэш: {}", disk.dir().toAbsolutePath());
        }
        CacheManager cache = CacheManager.from(cfg, mapper, clock, disk);
        if (disk != null) {
            int loaded = cache.populateFromDisk(cfg.getMaxEntries());
            log.info("💾 Из дискового кэша поднято {} записей", loaded);
        }
        return cache;
    }

    @Bean
    public WsTransport wsTransport(StreamCoreProperties props) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(props.getHttp().getWsConnectTimeout())
                .build();
        return new JdkWsTransport(client, props.getHttp().getWsConnectTimeout());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public MarketDataCore marketDataCore(StreamCoreProperties props,
                                         WsTransport transport,
                                         @Qualifier("fallbackRestTemplate") RestTemplate restTemplate,
                                         CacheManager cache,
                                         UpdateBus bus,
                                         EventStore eventStore,
                                         StreamScheduler scheduler,
                                         Clock clock) {
        List<StreamSupervisor> supervisors = new ArrayList<>();
        for (Map.Entry<String, StreamCoreProperties.Provider> e : props.getProviders().entrySet()) {
            if (!e.getValue().isEnabled()) {
                log.info("⏸ Провайдер {} выключен", e.getKey());
                continue;
            }
            StreamProvider provider = provider(e.getKey(), e.getValue());
            StreamConnection connection = new StreamConnection(
                    provider,
                    transport,
                    new MessageQueue<StreamEvent>(props.getQueue().getCapacity(), StreamEvent::droppable),
                    clock
            );
            supervisors.add(new StreamSupervisor(
                    connection,
                    new SubscriptionManager(props.getSubscription().getMaxBatchSize()),
                    ReconnectPolicy.from(props.getBackoff()),
                    HealthMonitor.from(props.getHealth()),
                    new RestFallbackFetcher(provider, restTemplate),
                    cache,
                    bus,
                    eventStore,
                    scheduler,
                    clock,
                    props.getFallback(),
                    props.getHealth().getTickInterval()
            ));
            log.info("🧩 Провайдер {} подключён", provider.id());
        }
        return new MarketDataCore(supervisors, cache, eventStore, bus);
    }

    static StreamProvider provider(String id, StreamCoreProperties.Provider cfg) {
        return switch (id) {
            case BirdeyeStreamProvider.ID -> new BirdeyeStreamProvider(cfg.getWsUrl(), cfg.getRestUrl(), cfg.getApiKey());
            case HeliusStreamProvider.ID -> new HeliusStreamProvider(cfg.getWsUrl(), cfg.getRestUrl(), cfg.getApiKey());
            default -> throw new IllegalStateException("Неизвестный провайдер в stream-core.providers: " + id);
        };
    }
}
