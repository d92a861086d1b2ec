package com.chicu.streamcore.core;

import com.chicu.streamcore.audit.AuditEventType;
import com.chicu.streamcore.audit.DomainEvent;
import com.chicu.streamcore.audit.EventStore;
import com.chicu.streamcore.cache.CacheManager;
import com.chicu.streamcore.cache.CacheTtlConfig;
import com.chicu.streamcore.cache.CacheType;
import com.chicu.streamcore.config.StreamCoreProperties;
import com.chicu.streamcore.merge.PriceSnapshot;
import com.chicu.streamcore.resilience.HealthMonitor;
import com.chicu.streamcore.resilience.ReconnectPolicy;
import com.chicu.streamcore.stream.ConnectionState;
import com.chicu.streamcore.stream.MessageQueue;
import com.chicu.streamcore.stream.StreamConnection;
import com.chicu.streamcore.stream.StreamEvent;
import com.chicu.streamcore.stream.SubscriptionManager;
import com.chicu.streamcore.stream.provider.birdeye.BirdeyeStreamProvider;
import com.chicu.streamcore.support.FakeWsTransport;
import com.chicu.streamcore.support.ManualStreamScheduler;
import com.chicu.streamcore.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MarketDataCoreTest {

    @Mock private EventStore eventStore;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final ManualStreamScheduler scheduler = new ManualStreamScheduler(clock);
    private final FakeWsTransport transport = new FakeWsTransport();
    private final UpdateBus bus = new UpdateBus();

    private CacheManager cache;
    private StreamSupervisor birdeye;
    private MarketDataCore core;

    @BeforeEach
    void setUp() {
        cache = new CacheManager(4, 100, 1_000_000, CacheTtlConfig.defaults(),
                new ObjectMapper().findAndRegisterModules(), clock, null);
        birdeye = birdeyeSupervisor();
        core = new MarketDataCore(List.of(birdeye), cache, eventStore, bus);
    }

    private StreamSupervisor birdeyeSupervisor() {
        StreamCoreProperties.Fallback fallbackCfg = new StreamCoreProperties.Fallback();
        fallbackCfg.setPollInterval(Duration.ofSeconds(5));
        fallbackCfg.setFailureThreshold(3);

        StreamConnection connection = new StreamConnection(
                new BirdeyeStreamProvider(null, null, null),
                transport,
                new MessageQueue<StreamEvent>(100, StreamEvent::droppable),
                clock
        );
        return new StreamSupervisor(
                connection,
                new SubscriptionManager(100),
                new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.0, 100, () -> 0.5),
                new HealthMonitor(Duration.ofSeconds(30), Duration.ofSeconds(60)),
                key -> Optional.empty(),
                cache,
                bus,
                null,
                scheduler,
                clock,
                fallbackCfg,
                Duration.ofSeconds(5)
        );
    }

    private static String snapshot(String key, long seq, String price) {
        return "{\"type\":\"snapshot\",\"key\":\"" + key + "\",\"sequence\":" + seq + ",\"payload\":{\"price\":" + price + "}}";
    }

    private void connect() {
        birdeye.startManual();
        birdeye.drainEvents();
        assertEquals(ConnectionState.CONNECTED, core.status(BirdeyeStreamProvider.ID).state());
    }

    @Test
    void subscribe_shouldDeliverOnlyRequestedKeys_toListener() {
        connect();
        List<Update> received = new ArrayList<>();

        core.subscribe(BirdeyeStreamProvider.ID, List.of("SOL"), received::add);
        birdeye.subscribe(List.of("BONK"));
        birdeye.drainEvents();

        transport.serverText(snapshot("SOL", 1, "150.0"));
        transport.serverText(snapshot("BONK", 1, "0.00002"));
        birdeye.drainEvents();

        assertEquals(1, received.size(), "слушатель SOL не должен видеть BONK");
        assertEquals("SOL", received.get(0).key());
        assertEquals(Update.Source.STREAM, received.get(0).source());
    }

    @Test
    void closeSubscription_shouldSendUnsubscribe_andStopDelivery() {
        connect();
        List<Update> received = new ArrayList<>();
        UpdateSubscription sub = core.subscribe(BirdeyeStreamProvider.ID, List.of("SOL"), received::add);

        sub.close();
        sub.close();

        List<String> sent = transport.lastSession().sent();
        JSONObject last = new JSONObject(sent.get(sent.size() - 1));
        assertEquals("unsubscribe", last.getString("type"));
        assertEquals(1, sent.stream().filter(s -> s.contains("\"unsubscribe\"")).count(), "повторный close: no-op");
        assertTrue(sub.isClosed());

        transport.serverText(snapshot("SOL", 1, "150.0"));
        birdeye.drainEvents();
        assertTrue(received.isEmpty());
        assertTrue(core.status(BirdeyeStreamProvider.ID).activeKeys() == 0);
    }

    @Test
    void getCached_shouldPreferMergerState_thenCache() {
        connect();
        core.subscribe(BirdeyeStreamProvider.ID, List.of("SOL"), u -> { });
        transport.serverText(snapshot("SOL", 1, "150.0"));
        birdeye.drainEvents();

        Optional<PriceSnapshot> live = core.getCached(BirdeyeStreamProvider.ID, "SOL");
        assertTrue(live.isPresent());
        assertEquals(0, new BigDecimal("150.0").compareTo(live.get().price()));

        // ключ, которого нет в merger, берётся из кэша
        PriceSnapshot stored = new PriceSnapshot("JUP", Map.of("price", new BigDecimal("0.9")), 3, clock.instant());
        cache.set(StreamSupervisor.cacheKey(BirdeyeStreamProvider.ID, "JUP"), stored, CacheType.PRICE);
        Optional<PriceSnapshot> fromCache = core.getCached(BirdeyeStreamProvider.ID, "JUP");
        assertTrue(fromCache.isPresent());
        assertEquals(3, fromCache.get().sequence());

        assertTrue(core.getCached(BirdeyeStreamProvider.ID, "WIF").isEmpty());
    }

    @Test
    void putCached_thenGetByType_shouldReturnJson() {
        assertTrue(core.putCached("wallet:abc", Map.of("sol", 12), CacheType.USER_DATA));

        assertEquals(12, core.getCached("wallet:abc", CacheType.USER_DATA).orElseThrow().get("sol").asInt());

        // USER_DATA живёт сутки, PRICE: секунду
        clock.advance(Duration.ofHours(2));
        assertTrue(core.getCached("wallet:abc", CacheType.USER_DATA).isPresent());
    }

    @Test
    void unknownProvider_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> core.subscribe("kraken", List.of("SOL"), u -> { }));
        assertThrows(IllegalArgumentException.class, () -> core.status("kraken"));
        assertThrows(IllegalArgumentException.class, () -> core.reconnect("kraken"));
    }

    @Test
    void subscribe_shouldRejectEmptyKeysAndNullListener() {
        assertThrows(IllegalArgumentException.class, () -> core.subscribe(BirdeyeStreamProvider.ID, List.of(), u -> { }));
        assertThrows(IllegalArgumentException.class, () -> core.subscribe(BirdeyeStreamProvider.ID, List.of("SOL"), null));
    }

    @Test
    void duplicateProvider_shouldFailConstruction() {
        StreamSupervisor second = birdeyeSupervisor();
        assertThrows(IllegalArgumentException.class,
                () -> new MarketDataCore(List.of(birdeye, second), cache, eventStore, bus));
    }

    @Test
    void recordEvent_shouldDelegateToEventStore() {
        when(eventStore.append(any(DomainEvent.class))).thenReturn("evt-1");

        String id = core.recordEvent(DomainEvent.of("wallet:abc", AuditEventType.WALLET_CONNECTED,
                Map.of("walletAddress", "abc", "walletType", "phantom")));

        assertEquals("evt-1", id);
        verify(eventStore).append(argThat(e -> e.aggregateId().equals("wallet:abc")
                && e.type() == AuditEventType.WALLET_CONNECTED));
    }

    @Test
    void status_shouldListEveryProvider() {
        connect();
        core.subscribe(BirdeyeStreamProvider.ID, List.of("SOL", "BONK"), u -> { });

        List<StreamStatus> all = core.status();
        assertEquals(1, all.size());
        StreamStatus s = all.get(0);
        assertEquals(BirdeyeStreamProvider.ID, s.provider());
        assertEquals(2, s.activeKeys());
        assertFalse(s.fallbackActive());
        assertEquals(0, s.consecutiveFailures());
        assertEquals(List.of(BirdeyeStreamProvider.ID), List.copyOf(core.providers()));
    }

    @Test
    void statusListener_shouldSeeConnectionStates() {
        List<StatusChange> changes = new ArrayList<>();
        core.addStatusListener(changes::add);

        connect();

        assertFalse(changes.isEmpty());
        assertEquals(ConnectionState.CONNECTED, changes.get(changes.size() - 1).to());
    }
}
