package com.chicu.streamcore.resilience;

import com.chicu.streamcore.core.StreamScheduler;
import com.chicu.streamcore.stream.ProtocolException;
import com.chicu.streamcore.stream.ProviderMessage;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * REST-поллинг вместо мёртвого стрима.
 *
 * Пока активен: единственный источник данных по ключам провайдера.
 * Приёмник вызывается без лока поллера. Каждое включение получает свой номер,
 * и приёмник под своим локом проверяет {@link #isCurrent(long)}: результат,
 * доставленный после deactivate(), отбрасывается там же.
 */
@Slf4j
public class FallbackPoller {

    public enum State {
        INACTIVE,
        ACTIVE
    }

    /**
     * Куда уходят результаты поллинга.
     */
    @FunctionalInterface
    public interface Sink {

        /**
         * @param activation номер включения, в котором сделан запрос
         * @return false, если результат отброшен
         */
        boolean deliver(ProviderMessage message, long activation);
    }

    public record Status(
            State state,
            String reason,
            Duration interval,
            Instant activatedAt,
            Instant lastSuccess,
            long polls,
            long failures,
            long discarded
    ) {}

    private final String providerId;
    private final FallbackFetcher fetcher;
    private final Supplier<Set<String>> activeKeys;
    private final Predicate<String> stillSubscribed;
    private final Sink sink;
    private final StreamScheduler scheduler;
    private final Duration interval;
    private final Clock clock;

    private final Object lock = new Object();

    // guarded by lock
    private State state = State.INACTIVE;
    private long activation;
    private String reason;
    private Instant activatedAt;
    private Instant lastSuccess;
    private long polls;
    private long failures;
    private long discarded;
    private StreamScheduler.Handle handle;

    public FallbackPoller(String providerId,
                          FallbackFetcher fetcher,
                          Supplier<Set<String>> activeKeys,
                          Predicate<String> stillSubscribed,
                          Sink sink,
                          StreamScheduler scheduler,
                          Duration interval,
                          Clock clock) {
        this.providerId = providerId;
        this.fetcher = fetcher;
        this.activeKeys = activeKeys;
        this.stillSubscribed = stillSubscribed;
        this.sink = sink;
        this.scheduler = scheduler;
        this.interval = interval;
        this.clock = clock;
    }

    /**
     * Включить поллинг. Повторный вызов только обновляет причину.
     */
    public void activate(String reason) {
        synchronized (lock) {
            this.reason = reason;
            if (state == State.ACTIVE) {
                return;
            }
            state = State.ACTIVE;
            activation++;
            activatedAt = clock.instant();
            handle = scheduler.scheduleAtFixedRate(
                    "fallback-" + providerId,
                    () -> pollOnce(activeKeys.get()),
                    Duration.ZERO,
                    interval
            );
        }
        log.warn("🛟 [{}] FALLBACK ON ({}), REST every {}s", providerId, reason, interval.toSeconds());
    }

    public void deactivate() {
        synchronized (lock) {
            if (state == State.INACTIVE) {
                return;
            }
            state = State.INACTIVE;
            if (handle != null) {
                handle.cancel();
                handle = null;
            }
        }
        log.info("✅ [{}] FALLBACK OFF, stream is back", providerId);
    }

    public boolean isActive() {
        synchronized (lock) {
            return state == State.ACTIVE;
        }
    }

    /**
     * Включение с этим номером ещё действует.
     */
    public boolean isCurrent(long activationNo) {
        synchronized (lock) {
            return state == State.ACTIVE && activation == activationNo;
        }
    }

    /**
     * Один проход по ключам. Ошибка по одному ключу не мешает остальным.
     *
     * @return сколько результатов опубликовано
     */
    public int pollOnce(Collection<String> keys) {
        final long current;
        synchronized (lock) {
            if (state != State.ACTIVE) {
                return 0;
            }
            current = activation;
        }
        int published = 0;
        for (String key : keys) {
            Optional<ProviderMessage> result;
            try {
                result = fetcher.fetch(key);
            } catch (ProtocolException | RuntimeException e) {
                synchronized (lock) {
                    failures++;
                }
                log.warn("⚠ [{}] fallback {} failed: {}", providerId, key, e.getMessage());
                continue;
            }
            if (result.isEmpty()) {
                continue;
            }
            // ключ отписали или стрим вернулся, пока запрос летел: результат выбрасываем
            boolean delivered = isCurrent(current)
                    && stillSubscribed.test(key)
                    && sink.deliver(result.get(), current);
            synchronized (lock) {
                polls++;
                if (delivered) {
                    lastSuccess = clock.instant();
                    published++;
                } else {
                    discarded++;
                }
            }
            if (!delivered) {
                log.debug("[{}] fallback result for {} discarded", providerId, key);
            }
        }
        return published;
    }

    public Status status() {
        synchronized (lock) {
            return new Status(state, reason, interval, activatedAt, lastSuccess, polls, failures, discarded);
        }
    }
}
