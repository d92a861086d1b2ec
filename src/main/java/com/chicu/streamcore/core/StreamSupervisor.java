package com.chicu.streamcore.core;

import com.chicu.streamcore.audit.AuditEventType;
import com.chicu.streamcore.audit.DomainEvent;
import com.chicu.streamcore.audit.EventStore;
import com.chicu.streamcore.cache.CacheManager;
import com.chicu.streamcore.cache.CacheType;
import com.chicu.streamcore.config.StreamCoreProperties;
import com.chicu.streamcore.merge.DeltaMerger;
import com.chicu.streamcore.merge.DeltaMessage;
import com.chicu.streamcore.merge.MergeResult;
import com.chicu.streamcore.merge.PriceSnapshot;
import com.chicu.streamcore.resilience.FallbackFetcher;
import com.chicu.streamcore.resilience.FallbackPoller;
import com.chicu.streamcore.resilience.HealthAction;
import com.chicu.streamcore.resilience.HealthMonitor;
import com.chicu.streamcore.resilience.PermanentFailureException;
import com.chicu.streamcore.resilience.ReconnectPolicy;
import com.chicu.streamcore.stream.ConnectionState;
import com.chicu.streamcore.stream.MessageQueue;
import com.chicu.streamcore.stream.ProtocolException;
import com.chicu.streamcore.stream.ProviderMessage;
import com.chicu.streamcore.stream.StreamCommand;
import com.chicu.streamcore.stream.StreamConnection;
import com.chicu.streamcore.stream.StreamEvent;
import com.chicu.streamcore.stream.SubscriptionManager;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Жизненный цикл одного провайдера: соединение, подписки, heartbeat,
 * реконнект с backoff, REST-fallback и сборка состояния.
 *
 * Все решения принимаются под одним локом: события соединения (поток pump),
 * тики heartbeat, попытки реконнекта и результаты fallback не пересекаются.
 * Порядок локов всегда супервизор, затем поллер; поллер зовёт приёмник без своего лока.
 *
 * Пока fallback активен, данные стрима игнорируются: у ключа один источник.
 * Fallback выключается, когда провайдер подтвердил все пакеты resubscribe.
 * В порог fallback идут только неудачные попытки коннекта, обрыв открытой сессии не считается.
 */
@Slf4j
public class StreamSupervisor {

    private final StreamConnection connection;
    private final SubscriptionManager subscriptions;
    private final ReconnectPolicy policy;
    private final HealthMonitor health;
    private final DeltaMerger merger;
    private final FallbackPoller fallback;
    private final CacheManager cache;
    private final UpdateBus bus;
    private final EventStore eventStore;
    private final StreamScheduler scheduler;
    private final Clock clock;

    private final int failureThreshold;
    private final Duration healthTick;

    private final Object lock = new Object();

    // guarded by lock
    private boolean running;
    private int consecutiveFailures;
    private boolean permanentFailure;
    private String lastError;
    /** пакеты resubscribe, ещё не подтверждённые провайдером */
    private final Deque<Set<String>> pendingResubscribe = new ArrayDeque<>();
    /** CONNECTED уже обработан и resubscribe ушёл: можно слать команды напрямую */
    private boolean sessionReady;
    private ConnectionState lastState = ConnectionState.DISCONNECTED;
    private StreamScheduler.Handle reconnectHandle;
    private StreamScheduler.Handle healthHandle;
    private Thread pump;

    public StreamSupervisor(StreamConnection connection,
                            SubscriptionManager subscriptions,
                            ReconnectPolicy policy,
                            HealthMonitor health,
                            FallbackFetcher fallbackFetcher,
                            CacheManager cache,
                            UpdateBus bus,
                            EventStore eventStore,
                            StreamScheduler scheduler,
                            Clock clock,
                            StreamCoreProperties.Fallback fallbackCfg,
                            Duration healthTick) {
        this.connection = connection;
        this.subscriptions = subscriptions;
        this.policy = policy;
        this.health = health;
        this.cache = cache;
        this.bus = bus;
        this.eventStore = eventStore;
        this.scheduler = scheduler;
        this.clock = clock;
        this.failureThreshold = fallbackCfg.getFailureThreshold();
        this.healthTick = healthTick;
        this.merger = new DeltaMerger(this::requestResync);
        this.fallback = new FallbackPoller(
                connection.providerId(),
                fallbackFetcher,
                subscriptions::activeKeys,
                subscriptions::isActive,
                this::onFallbackMessage,
                scheduler,
                fallbackCfg.getPollInterval(),
                clock
        );
    }

    public String providerId() {
        return connection.providerId();
    }

    // =====================================================================
    // LIFECYCLE
    // =====================================================================

    /**
     * Соединение + собственный поток разбора событий.
     */
    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            startInternal();
            pump = new Thread(this::pumpLoop, "stream-pump-" + providerId());
            pump.setDaemon(true);
            pump.start();
        }
        connection.connect();
    }

    /**
     * Без своего потока: события разбирает тот, кто зовёт {@link #drainEvents()}.
     */
    public void startManual() {
        synchronized (lock) {
            if (running) {
                return;
            }
            startInternal();
        }
        connection.connect();
    }

    private void startInternal() {
        running = true;
        healthHandle = scheduler.scheduleAtFixedRate("health-" + providerId(), this::healthTick, healthTick, healthTick);
        log.info("▶️ [{}] supervisor started", providerId());
    }

    public void stop() {
        Thread t;
        synchronized (lock) {
            if (!running) {
                return;
            }
            running = false;
            sessionReady = false;
            pendingResubscribe.clear();
            cancel(reconnectHandle);
            cancel(healthHandle);
            reconnectHandle = null;
            healthHandle = null;
            fallback.deactivate();
            t = pump;
            pump = null;
        }
        connection.disconnect("shutdown");
        if (t != null) {
            t.interrupt();
            try {
                t.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("■ [{}] supervisor stopped", providerId());
    }

    private void pumpLoop() {
        MessageQueue<StreamEvent> events = connection.events();
        while (!Thread.currentThread().isInterrupted()) {
            StreamEvent ev;
            try {
                ev = events.poll(250, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (ev != null) {
                handleSafely(ev);
            }
        }
    }

    /**
     * Разобрать всё, что накопилось в очереди соединения, в текущем потоке.
     *
     * @return сколько событий обработано
     */
    public int drainEvents() {
        int n = 0;
        StreamEvent ev;
        while ((ev = connection.events().poll()) != null) {
            handleSafely(ev);
            n++;
        }
        return n;
    }

    private void handleSafely(StreamEvent ev) {
        try {
            handle(ev);
        } catch (RuntimeException e) {
            log.error("❗ [{}] ошибка обработки события {}: {}", providerId(), ev.type(), e.getMessage(), e);
        }
    }

    // =====================================================================
    // SUBSCRIPTIONS
    // =====================================================================

    public void subscribe(Collection<String> keys) {
        synchronized (lock) {
            sendIfReady(subscriptions.subscribe(keys));
        }
    }

    public void unsubscribe(Collection<String> keys) {
        synchronized (lock) {
            List<StreamCommand> commands = subscriptions.unsubscribe(keys);
            for (StreamCommand cmd : commands) {
                cmd.keys().forEach(merger::remove);
            }
            sendIfReady(commands);
        }
    }

    private void sendIfReady(List<StreamCommand> commands) {
        if (commands.isEmpty() || !sessionReady || connection.state() != ConnectionState.CONNECTED) {
            // после коннекта уйдёт resubscribeAll
            return;
        }
        for (StreamCommand cmd : commands) {
            connection.send(cmd).whenComplete((v, ex) -> {
                if (ex != null) {
                    log.warn("⚠ [{}] {} not sent: {}", providerId(), cmd.type(), ex.getMessage());
                }
            });
        }
    }

    private void requestResync(String key) {
        if (!subscriptions.isActive(key) || connection.state() != ConnectionState.CONNECTED) {
            return;
        }
        log.info("🔄 [{}] resync {}", providerId(), key);
        connection.send(StreamCommand.subscribe(List.of(key))).whenComplete((v, ex) -> {
            if (ex != null) {
                log.warn("⚠ [{}] resync {} not sent: {}", providerId(), key, ex.getMessage());
            }
        });
    }

    // =====================================================================
    // EVENTS
    // =====================================================================

    void handle(StreamEvent ev) {
        synchronized (lock) {
            switch (ev.type()) {
                case STATE_CHANGED -> onStateChanged(ev);
                case CONNECTED -> onConnected(ev);
                case MESSAGE -> onMessage(ev);
                case PONG -> health.onMessage(ev.at());
                case CONNECT_FAILED -> {
                    onSessionGone();
                    onConnectFailure(ev.reason());
                }
                case DISCONNECTED -> {
                    onSessionGone();
                    // локальный разрыв (ручной / heartbeat / стоп) реконнект сам решает
                    if (!ev.local()) {
                        onConnectionLost(ev.reason());
                    }
                }
                case ERROR -> {
                    onSessionGone();
                    onConnectionLost(ev.reason());
                }
            }
        }
    }

    private void onSessionGone() {
        sessionReady = false;
        pendingResubscribe.clear();
        health.onDisconnected();
    }

    private void onStateChanged(StreamEvent ev) {
        ConnectionState from = lastState;
        lastState = ev.state();
        bus.publishStatus(new StatusChange(providerId(), from, ev.state(), ev.reason(), ev.at()));
        if (eventStore == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("provider", providerId());
        payload.put("from", from.name());
        payload.put("to", ev.state().name());
        payload.put("reason", ev.reason());
        eventStore.appendAsync(DomainEvent.of("stream:" + providerId(), AuditEventType.CONNECTION_STATE_CHANGED, payload))
                .whenComplete((id, ex) -> {
                    if (ex != null) {
                        log.error("❌ [{}] state change not recorded: {}", providerId(), ex.getMessage());
                    }
                });
    }

    private void onConnected(StreamEvent ev) {
        if (!running) {
            return;
        }
        consecutiveFailures = 0;
        permanentFailure = false;
        lastError = null;
        policy.reset();
        cancel(reconnectHandle);
        reconnectHandle = null;
        health.onConnected(ev.at());

        sessionReady = true;
        // после нового рукопожатия sequence начинается заново: базу берём из свежих snapshot
        subscriptions.activeKeys().forEach(merger::remove);

        List<StreamCommand> commands = subscriptions.resubscribeAll();
        pendingResubscribe.clear();
        for (StreamCommand cmd : commands) {
            pendingResubscribe.add(new LinkedHashSet<>(cmd.keys()));
            connection.send(cmd).whenComplete((v, ex) -> {
                if (ex != null) {
                    log.warn("⚠ [{}] resubscribe not sent: {}", providerId(), ex.getMessage());
                }
            });
        }
        log.info("📡 [{}] resubscribe {} keys in {} batches", providerId(), subscriptions.size(), commands.size());
        if (commands.isEmpty()) {
            onResubscribeConfirmed();
        }
    }

    /**
     * Подтверждение подписки. Ключ null закрывает самый старый пакет.
     */
    private void onAck(ProviderMessage m) {
        if (pendingResubscribe.isEmpty()) {
            return;
        }
        if (m.key() == null) {
            pendingResubscribe.poll();
        } else {
            Iterator<Set<String>> it = pendingResubscribe.iterator();
            while (it.hasNext()) {
                Set<String> batch = it.next();
                batch.remove(m.key());
                if (batch.isEmpty()) {
                    it.remove();
                }
            }
        }
        if (pendingResubscribe.isEmpty()) {
            onResubscribeConfirmed();
        }
    }

    private void onResubscribeConfirmed() {
        log.info("✅ [{}] resubscribe confirmed", providerId());
        if (fallback.isActive()) {
            fallback.deactivate();
            // состояние из REST без sequence: дальше только стрим
            subscriptions.activeKeys().forEach(merger::remove);
        }
    }

    private void onMessage(StreamEvent ev) {
        health.onMessage(ev.at());

        List<ProviderMessage> messages;
        try {
            messages = connection.provider().parse(ev.raw());
        } catch (ProtocolException e) {
            connection.statistics().onProtocolError();
            log.warn("⚠ [{}] bad message discarded: {}", providerId(), e.getMessage());
            return;
        }

        for (ProviderMessage m : messages) {
            switch (m.kind()) {
                case PING -> connection.send(StreamCommand.pong());
                case PONG -> { }
                case ACK -> onAck(m);
                case SNAPSHOT -> {
                    if (!fallback.isActive() && subscriptions.isActive(m.key())) {
                        PriceSnapshot snap = merger.applySnapshot(m.key(), new PriceSnapshot(m.key(), m.fields(), m.sequence(), ev.at()));
                        publish(snap, Update.Source.STREAM);
                    }
                }
                case DELTA -> {
                    if (!fallback.isActive() && subscriptions.isActive(m.key())) {
                        MergeResult r = merger.applyDelta(m.key(), new DeltaMessage(m.key(), m.sequence(), m.fields(), ev.at()));
                        if (r.isApplied()) {
                            publish(r.snapshot(), Update.Source.STREAM);
                        }
                    }
                }
            }
        }
    }

    /**
     * Из потока fallback, лок поллера при этом не держится.
     * Результат включения, которое уже выключено, отбрасывается.
     */
    private boolean onFallbackMessage(ProviderMessage m, long activation) {
        synchronized (lock) {
            if (!running || !fallback.isCurrent(activation) || !subscriptions.isActive(m.key())) {
                return false;
            }
            PriceSnapshot snap = merger.applySnapshot(m.key(), new PriceSnapshot(m.key(), m.fields(), m.sequence(), clock.instant()));
            publish(snap, Update.Source.FALLBACK);
            return true;
        }
    }

    private void publish(PriceSnapshot snap, Update.Source source) {
        cache.set(cacheKey(providerId(), snap.key()), snap, CacheType.PRICE);
        bus.publish(new Update(providerId(), snap.key(), snap, source, snap.observedAt()));
    }

    public static String cacheKey(String provider, String key) {
        return provider + ":" + key;
    }

    // =====================================================================
    // FAILURE / RECONNECT
    // =====================================================================

    /**
     * Попытка коннекта не удалась: считается в порог fallback.
     */
    private void onConnectFailure(String reason) {
        if (!running) {
            return;
        }
        consecutiveFailures++;
        if (consecutiveFailures >= failureThreshold) {
            fallback.activate(consecutiveFailures + " consecutive failures: " + reason);
        }
        scheduleNextAttempt(reason);
    }

    /**
     * Открытая сессия оборвалась: только следующая попытка.
     */
    private void onConnectionLost(String reason) {
        if (!running) {
            return;
        }
        scheduleNextAttempt(reason);
    }

    private void scheduleNextAttempt(String reason) {
        lastError = reason;

        Duration delay;
        try {
            delay = policy.nextDelay();
        } catch (PermanentFailureException e) {
            permanentFailure = true;
            fallback.activate("reconnect attempts exhausted");
            connection.transition(ConnectionState.FALLBACK, e.getMessage());
            log.error("⛔ [{}] {}: только REST fallback", providerId(), e.getMessage());
            return;
        }

        connection.transition(fallback.isActive() ? ConnectionState.FALLBACK : ConnectionState.RECONNECTING, reason);
        scheduleReconnect(delay);
    }

    private void scheduleReconnect(Duration delay) {
        cancel(reconnectHandle);
        log.info("🔄 [{}] reconnect #{} in {} ms", providerId(), policy.attempts(), delay.toMillis());
        reconnectHandle = scheduler.schedule("reconnect-" + providerId(), this::attemptReconnect, delay);
    }

    private void attemptReconnect() {
        synchronized (lock) {
            if (!running) {
                return;
            }
            reconnectHandle = null;
        }
        connection.statistics().onReconnect();
        connection.connect();
    }

    /**
     * Ручной реконнект: сбрасывает backoff и признак окончательного отказа.
     */
    public void reconnect() {
        synchronized (lock) {
            if (!running) {
                return;
            }
            permanentFailure = false;
            sessionReady = false;
            pendingResubscribe.clear();
            policy.reset();
            cancel(reconnectHandle);
            reconnectHandle = null;
        }
        connection.disconnect("manual reconnect");
        connection.connect();
    }

    private void healthTick() {
        synchronized (lock) {
            if (!running || connection.state() != ConnectionState.CONNECTED) {
                return;
            }
            Instant now = clock.instant();
            HealthAction action = health.tick(now);
            switch (action) {
                case NONE -> { }
                case SEND_PING -> {
                    health.onPingSent(now);
                    connection.send(StreamCommand.ping()).whenComplete((v, ex) -> {
                        if (ex != null) {
                            log.debug("[{}] ping failed: {}", providerId(), ex.getMessage());
                        }
                    });
                }
                case FORCE_RECONNECT -> {
                    log.warn("💤 [{}] no messages for {}s: reconnecting", providerId(), health.staleThreshold().toSeconds());
                    connection.disconnect(HealthMonitor.STALE_REASON);
                    onSessionGone();
                    onConnectionLost(HealthMonitor.STALE_REASON);
                }
            }
        }
    }

    // =====================================================================
    // QUERIES
    // =====================================================================

    public StreamStatus status() {
        synchronized (lock) {
            boolean fb = fallback.isActive();
            return new StreamStatus(
                    providerId(),
                    connection.state(),
                    fb,
                    consecutiveFailures,
                    policy.attempts(),
                    permanentFailure,
                    lastError,
                    subscriptions.size(),
                    connection.statistics().snapshot(connection.events().droppedCount()),
                    fallback.status()
            );
        }
    }

    public boolean isFallbackActive() {
        return fallback.isActive();
    }

    public FallbackPoller fallback() {
        return fallback;
    }

    public DeltaMerger merger() {
        return merger;
    }

    public Set<String> activeKeys() {
        return subscriptions.activeKeys();
    }

    private static void cancel(StreamScheduler.Handle h) {
        if (h != null) {
            h.cancel();
        }
    }
}
