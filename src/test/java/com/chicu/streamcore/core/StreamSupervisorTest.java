package com.chicu.streamcore.core;

import com.chicu.streamcore.cache.CacheManager;
import com.chicu.streamcore.cache.CacheTtlConfig;
import com.chicu.streamcore.cache.CacheType;
import com.chicu.streamcore.config.StreamCoreProperties;
import com.chicu.streamcore.merge.PriceSnapshot;
import com.chicu.streamcore.resilience.HealthMonitor;
import com.chicu.streamcore.resilience.ReconnectPolicy;
import com.chicu.streamcore.stream.ConnectionState;
import com.chicu.streamcore.stream.MessageQueue;
import com.chicu.streamcore.stream.ProviderMessage;
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

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class StreamSupervisorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final ManualStreamScheduler scheduler = new ManualStreamScheduler(clock);
    private final FakeWsTransport transport = new FakeWsTransport();
    private final UpdateBus bus = new UpdateBus();
    private final List<Update> updates = new ArrayList<>();
    private final List<StatusChange> statusChanges = new ArrayList<>();
    private final List<String> fallbackFetches = new ArrayList<>();

    private CacheManager cache;
    private StreamConnection connection;
    private StreamSupervisor supervisor;

    @BeforeEach
    void setUp() {
        build(100);
    }

    private void build(int maxAttempts) {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        cache = new CacheManager(4, 100, 1_000_000, CacheTtlConfig.defaults(), mapper, clock, null);

        connection = new StreamConnection(
                new BirdeyeStreamProvider(null, null, null),
                transport,
                new MessageQueue<StreamEvent>(100, StreamEvent::droppable),
                clock
        );

        StreamCoreProperties.Fallback fallbackCfg = new StreamCoreProperties.Fallback();
        fallbackCfg.setPollInterval(Duration.ofSeconds(5));
        fallbackCfg.setFailureThreshold(3);

        supervisor = new StreamSupervisor(
                connection,
                new SubscriptionManager(100),
                new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.0, maxAttempts, () -> 0.5),
                new HealthMonitor(Duration.ofSeconds(30), Duration.ofSeconds(60)),
                key -> {
                    fallbackFetches.add(key);
                    return Optional.of(ProviderMessage.snapshot(key, 0, Map.of("price", new BigDecimal("99"))));
                },
                cache,
                bus,
                null,
                scheduler,
                clock,
                fallbackCfg,
                Duration.ofSeconds(5)
        );
        bus.addGlobalListener(updates::add);
        bus.addStatusListener(statusChanges::add);
    }

    private void connectAndSubscribe(String... keys) {
        supervisor.startManual();
        supervisor.subscribe(List.of(keys));
        supervisor.drainEvents();
        assertEquals(ConnectionState.CONNECTED, connection.state());
    }

    private static String snapshot(String key, long seq, String price) {
        return "{\"type\":\"snapshot\",\"key\":\"" + key + "\",\"sequence\":" + seq + ",\"payload\":{\"price\":" + price + "}}";
    }

    private static String delta(String key, long seq, String price) {
        return "{\"type\":\"delta\",\"key\":\"" + key + "\",\"sequence\":" + seq + ",\"payload\":{\"price\":" + price + "}}";
    }

    private static String subscribedAck(String... keys) {
        return new JSONObject()
                .put("type", "subscribed")
                .put("data", new JSONObject().put("channel", "prices").put("symbols", List.of(keys)))
                .toString();
    }

    /**
     * Обрыв и три неудачных коннекта подряд: fallback включён, следующая попытка через 8 с.
     */
    private void dropAndFailThreeTimes() {
        transport.serverClose(1006, "abnormal");
        supervisor.drainEvents();
        for (long s : new long[]{1, 2, 4}) {
            scheduler.advance(Duration.ofSeconds(s));
            supervisor.drainEvents();
        }
    }

    private static List<String> subscribedSymbols(List<String> sent) {
        List<String> out = new ArrayList<>();
        for (String s : sent) {
            JSONObject o = new JSONObject(s);
            if ("subscribe".equals(o.getString("type"))) {
                o.getJSONObject("data").getJSONArray("symbols").forEach(x -> out.add((String) x));
            }
        }
        return out;
    }

    @Test
    void snapshotAndDelta_shouldPublishMergedUpdate_andFillCache() {
        connectAndSubscribe("SOL");

        transport.serverText(snapshot("SOL", 1, "150.0"));
        transport.serverText(delta("SOL", 2, "151.5"));
        supervisor.drainEvents();

        assertEquals(2, updates.size());
        Update last = updates.get(1);
        assertEquals(Update.Source.STREAM, last.source());
        assertEquals(2, last.snapshot().sequence());
        assertEquals(0, new BigDecimal("151.5").compareTo(last.snapshot().price()));
        assertTrue(cache.get(StreamSupervisor.cacheKey("birdeye", "SOL"), CacheType.PRICE).isPresent());
        assertEquals(List.of("SOL"), subscribedSymbols(transport.lastSession().sent()));
    }

    @Test
    void subscribeBeforeConnect_shouldBeSentOnConnect() {
        supervisor.subscribe(List.of("SOL", "BONK"));
        supervisor.startManual();
        supervisor.drainEvents();

        assertEquals(List.of("SOL", "BONK"), subscribedSymbols(transport.lastSession().sent()));
    }

    @Test
    void messagesForUnsubscribedKeys_andBrokenFrames_shouldBeDropped() {
        connectAndSubscribe("SOL");

        transport.serverText(snapshot("BONK", 1, "0.1"));
        transport.serverText("{oops");
        transport.serverText(snapshot("SOL", 1, "150"));
        supervisor.drainEvents();

        assertEquals(1, updates.size());
        assertEquals("SOL", updates.get(0).key());
        assertEquals(1, supervisor.status().statistics().protocolErrors());
        assertEquals(ConnectionState.CONNECTED, connection.state(), "битый кадр не рвёт соединение");
    }

    @Test
    void sequenceGap_shouldRequestResync() {
        connectAndSubscribe("SOL");
        transport.serverText(snapshot("SOL", 10, "1"));
        transport.serverText(delta("SOL", 12, "2"));
        supervisor.drainEvents();

        assertEquals(1, updates.size(), "delta с разрывом не публикуется");
        assertTrue(supervisor.merger().isStale("SOL"));
        assertEquals(List.of("SOL", "SOL"), subscribedSymbols(transport.lastSession().sent()), "повторная подписка = resync");
    }

    @Test
    void providerPing_shouldBeAnsweredWithPong() {
        connectAndSubscribe("SOL");

        transport.serverText("{\"type\":\"ping\"}");
        supervisor.drainEvents();

        List<String> sent = transport.lastSession().sent();
        assertEquals("pong", new JSONObject(sent.get(sent.size() - 1)).getString("type"));
    }

    @Test
    void drop_thenFailedAttempt_thenSuccess_shouldBackOffAndResubscribe() {
        connectAndSubscribe("SOL");
        transport.failNext().succeedNext();

        transport.serverClose(1006, "abnormal");
        supervisor.drainEvents();

        StreamStatus st = supervisor.status();
        assertEquals(ConnectionState.RECONNECTING, st.state());
        assertEquals(0, st.consecutiveFailures(), "обрыв открытой сессии не считается неудачным коннектом");
        assertEquals(1, transport.opens());

        scheduler.advance(Duration.ofMillis(999));
        assertEquals(1, transport.opens(), "первая попытка через 1 с");
        scheduler.advance(Duration.ofMillis(1));
        assertEquals(2, transport.opens());

        supervisor.drainEvents();
        assertEquals(1, supervisor.status().consecutiveFailures());

        scheduler.advance(Duration.ofMillis(1999));
        assertEquals(2, transport.opens(), "вторая попытка через 2 с");
        scheduler.advance(Duration.ofMillis(1));
        assertEquals(3, transport.opens());

        supervisor.drainEvents();
        st = supervisor.status();
        assertEquals(ConnectionState.CONNECTED, st.state());
        assertEquals(0, st.consecutiveFailures());
        assertEquals(0, st.reconnectAttempts(), "backoff сброшен");
        assertFalse(st.fallbackActive());
        assertEquals(2, st.statistics().reconnectCount());
        assertEquals(List.of("SOL"), subscribedSymbols(transport.lastSession().sent()), "подписки восстановлены");

        List<ConnectionState> states = statusChanges.stream().map(StatusChange::to).toList();
        assertTrue(states.contains(ConnectionState.RECONNECTING));
        assertEquals(ConnectionState.CONNECTED, states.get(states.size() - 1));
    }

    @Test
    void reconnect_shouldDropStateFromOldConnection() {
        connectAndSubscribe("SOL");
        transport.serverText(snapshot("SOL", 5, "1"));
        supervisor.drainEvents();

        transport.serverClose(1001, "going away");
        supervisor.drainEvents();
        scheduler.advance(Duration.ofSeconds(1));
        supervisor.drainEvents();

        // после нового рукопожатия sequence с нуля: delta без snapshot не применяется
        transport.serverText(delta("SOL", 6, "2"));
        supervisor.drainEvents();

        assertEquals(1, updates.size());
        transport.serverText(snapshot("SOL", 1, "3"));
        supervisor.drainEvents();
        assertEquals(2, updates.size());
        assertEquals(1, updates.get(1).snapshot().sequence());
    }

    @Test
    void threeFailedConnectAttempts_shouldActivateFallback_andAckedResubscribeDeactivatesIt() {
        connectAndSubscribe("SOL");
        transport.failNext().failNext().failNext().succeedNext();

        transport.serverClose(1006, "abnormal");
        supervisor.drainEvents();
        scheduler.advance(Duration.ofSeconds(1));
        supervisor.drainEvents();
        scheduler.advance(Duration.ofSeconds(2));
        supervisor.drainEvents();
        assertFalse(supervisor.isFallbackActive(), "две неудачи: ещё без fallback");
        assertEquals(2, supervisor.status().consecutiveFailures());

        scheduler.advance(Duration.ofSeconds(4));
        supervisor.drainEvents();

        StreamStatus st = supervisor.status();
        assertTrue(st.fallbackActive());
        assertEquals(ConnectionState.FALLBACK, st.state());
        assertEquals(3, st.consecutiveFailures());

        scheduler.runDue();
        assertEquals(List.of("SOL"), fallbackFetches);
        Update fromRest = updates.get(updates.size() - 1);
        assertEquals(Update.Source.FALLBACK, fromRest.source());
        assertEquals(0, new BigDecimal("99").compareTo(fromRest.snapshot().price()));

        // реконнект продолжается в фоне: 8 с
        scheduler.advance(Duration.ofSeconds(8));
        supervisor.drainEvents();

        st = supervisor.status();
        assertEquals(ConnectionState.CONNECTED, st.state());
        assertEquals(0, st.consecutiveFailures());
        assertTrue(st.fallbackActive(), "до подтверждения подписки данные идут из REST");

        transport.serverText(subscribedAck("SOL"));
        supervisor.drainEvents();
        assertFalse(supervisor.isFallbackActive(), "провайдер подтвердил подписку: fallback выключен");

        int fetches = fallbackFetches.size();
        scheduler.advance(Duration.ofSeconds(30));
        assertEquals(fetches, fallbackFetches.size(), "поллинг остановлен");
    }

    @Test
    void dropThenTwoFailedAttempts_shouldRecoverWithoutFallback() {
        connectAndSubscribe("SOL");
        transport.serverText(snapshot("SOL", 1, "150"));
        transport.serverText(delta("SOL", 2, "151"));
        transport.serverText(delta("SOL", 3, "152"));
        supervisor.drainEvents();
        assertEquals(3, updates.size());

        transport.failNext().failNext().succeedNext();
        transport.serverClose(1006, "abnormal");
        supervisor.drainEvents();

        scheduler.advance(Duration.ofSeconds(1));
        supervisor.drainEvents();
        scheduler.advance(Duration.ofSeconds(2));
        supervisor.drainEvents();
        assertEquals(2, supervisor.status().consecutiveFailures());
        scheduler.advance(Duration.ofSeconds(4));
        supervisor.drainEvents();

        StreamStatus st = supervisor.status();
        assertEquals(ConnectionState.CONNECTED, st.state());
        assertEquals(0, st.consecutiveFailures());
        assertFalse(st.fallbackActive(), "две неудачные попытки ниже порога");
        assertTrue(fallbackFetches.isEmpty(), "REST не опрашивался");
        assertTrue(statusChanges.stream().noneMatch(c -> c.to() == ConnectionState.FALLBACK));
        assertEquals(4, transport.opens());
        assertEquals(List.of("SOL"), subscribedSymbols(transport.lastSession().sent()), "подписка восстановлена");
    }

    @Test
    void fallback_shouldStayActiveUntilProviderAcksResubscribe() {
        connectAndSubscribe("SOL", "BONK");
        transport.failNext().failNext().failNext();
        dropAndFailThreeTimes();
        assertTrue(supervisor.isFallbackActive());

        scheduler.advance(Duration.ofSeconds(8));
        supervisor.drainEvents();
        assertEquals(ConnectionState.CONNECTED, connection.state());
        assertTrue(supervisor.isFallbackActive(), "resubscribe отправлен, но не подтверждён");

        int before = updates.size();
        transport.serverText(snapshot("SOL", 1, "150"));
        supervisor.drainEvents();
        assertEquals(before, updates.size(), "пока fallback активен, стрим не публикуется");

        transport.serverText(subscribedAck("SOL"));
        supervisor.drainEvents();
        assertTrue(supervisor.isFallbackActive(), "BONK ещё не подтверждён");

        transport.serverText(subscribedAck("BONK"));
        supervisor.drainEvents();
        assertFalse(supervisor.isFallbackActive());

        transport.serverText(snapshot("SOL", 1, "151"));
        supervisor.drainEvents();
        Update last = updates.get(updates.size() - 1);
        assertEquals(Update.Source.STREAM, last.source());
        assertEquals(0, new BigDecimal("151").compareTo(last.snapshot().price()));
    }

    @Test
    void fallbackListener_callingSupervisor_shouldNotDeadlockWithStatusReader() throws Exception {
        connectAndSubscribe("SOL");
        transport.failNext().failNext().failNext().failNext();
        dropAndFailThreeTimes();
        assertTrue(supervisor.isFallbackActive());

        AtomicReference<Thread> reader = new AtomicReference<>();
        bus.addGlobalListener(u -> {
            if (u.source() != Update.Source.FALLBACK || reader.get() != null) {
                return;
            }
            // читатель берёт лок супервизора, затем лок поллера
            Thread t = new Thread(() -> supervisor.status(), "status-reader");
            reader.set(t);
            t.start();
            long deadline = System.nanoTime() + Duration.ofSeconds(1).toNanos();
            while (t.getState() != Thread.State.BLOCKED && t.isAlive() && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            supervisor.unsubscribe(List.of("SOL"));
        });

        Thread poll = new Thread(scheduler::runDue, "fallback-poll");
        poll.start();
        poll.join(5000);
        assertFalse(poll.isAlive(), "поток поллинга не завис");

        Thread t = reader.get();
        assertNotNull(t, "fallback опубликовал результат");
        t.join(5000);
        assertFalse(t.isAlive(), "читатель статуса не завис");
        assertTrue(supervisor.activeKeys().isEmpty());
        assertEquals(1, supervisor.fallback().status().polls());
    }

    @Test
    void exhaustedAttempts_shouldBePermanent_untilManualReconnect() {
        build(2);
        connectAndSubscribe("SOL");
        transport.failNext().failNext();

        transport.serverClose(1006, "abnormal");
        supervisor.drainEvents();
        scheduler.advance(Duration.ofSeconds(1));
        supervisor.drainEvents();
        scheduler.advance(Duration.ofSeconds(2));
        supervisor.drainEvents();

        StreamStatus st = supervisor.status();
        assertTrue(st.permanentFailure());
        assertTrue(st.fallbackActive());
        assertEquals(ConnectionState.FALLBACK, st.state());
        assertEquals(0, scheduler.pending("reconnect-"), "больше попыток не планируем");

        supervisor.reconnect();
        supervisor.drainEvents();
        transport.serverText(subscribedAck("SOL"));
        supervisor.drainEvents();

        st = supervisor.status();
        assertFalse(st.permanentFailure());
        assertEquals(ConnectionState.CONNECTED, st.state());
        assertFalse(st.fallbackActive());
    }

    @Test
    void silentConnection_shouldBePingedThenForciblyReconnected() {
        connectAndSubscribe("SOL");
        FakeWsTransport.FakeSession first = transport.lastSession();

        scheduler.advance(Duration.ofSeconds(30));
        assertTrue(first.pings() >= 1, "ping после 30 с тишины");
        assertEquals(ConnectionState.CONNECTED, connection.state());

        scheduler.advance(Duration.ofSeconds(35));
        assertEquals(HealthMonitor.STALE_REASON, first.closeReason());
        assertEquals(ConnectionState.RECONNECTING, connection.state());

        supervisor.drainEvents();
        assertEquals(0, supervisor.status().consecutiveFailures(), "обрыв по тишине не считается неудачным коннектом");

        scheduler.advance(Duration.ofSeconds(1));
        supervisor.drainEvents();
        assertEquals(ConnectionState.CONNECTED, connection.state());
        assertNotSame(first, transport.lastSession());
    }

    @Test
    void pongs_shouldKeepConnectionAlive() {
        connectAndSubscribe("SOL");

        for (int i = 0; i < 6; i++) {
            scheduler.advance(Duration.ofSeconds(20));
            transport.serverPong();
            supervisor.drainEvents();
        }

        assertEquals(ConnectionState.CONNECTED, connection.state());
        assertEquals(1, transport.opens());
    }

    @Test
    void unsubscribe_shouldSendNetCommand_andForgetState() {
        connectAndSubscribe("SOL");
        supervisor.subscribe(List.of("SOL"));
        transport.serverText(snapshot("SOL", 1, "1"));
        supervisor.drainEvents();

        supervisor.unsubscribe(List.of("SOL"));
        assertTrue(supervisor.merger().get("SOL").isPresent(), "ещё одна ссылка осталась");

        supervisor.unsubscribe(List.of("SOL"));
        List<String> sent = transport.lastSession().sent();
        assertEquals("unsubscribe", new JSONObject(sent.get(sent.size() - 1)).getString("type"));
        assertTrue(supervisor.merger().get("SOL").isEmpty());
        assertTrue(supervisor.activeKeys().isEmpty());
    }

    @Test
    void stop_shouldDisconnectAndCancelTimers() {
        connectAndSubscribe("SOL");

        supervisor.stop();
        supervisor.drainEvents();

        assertEquals(ConnectionState.DISCONNECTED, connection.state());
        assertEquals("shutdown", transport.lastSession().closeReason());
        assertEquals(0, scheduler.pending("health-"));
        assertEquals(0, scheduler.pending("reconnect-"));
        Optional<PriceSnapshot> none = supervisor.merger().get("SOL");
        assertTrue(none.isEmpty());
    }
}
