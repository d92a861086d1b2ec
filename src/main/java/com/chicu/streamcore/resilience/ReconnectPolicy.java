package com.chicu.streamcore.resilience;

import com.chicu.streamcore.config.StreamCoreProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Экспоненциальный backoff с джиттером.
 *
 * delay(n) = min(max, base * 2^n) * (1 + U(-jitter, +jitter))
 *
 * Счётчик попыток внутри; после maxAttempts: {@link PermanentFailureException}.
 * Не потокобезопасен: один экземпляр на соединение, дёргается из потока супервизора.
 */
public class ReconnectPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitter;
    private final int maxAttempts;
    /** U[0,1) */
    private final DoubleSupplier random;

    private int attempts;

    public ReconnectPolicy(Duration baseDelay, Duration maxDelay, double jitter, int maxAttempts, DoubleSupplier random) {
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be > 0");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1)");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.maxAttempts = maxAttempts;
        this.random = random;
    }

    public static ReconnectPolicy from(StreamCoreProperties.Backoff cfg) {
        return new ReconnectPolicy(
                cfg.getBaseDelay(),
                cfg.getMaxDelay(),
                cfg.getJitter(),
                cfg.getMaxAttempts(),
                () -> ThreadLocalRandom.current().nextDouble()
        );
    }

    /**
     * Задержка для попытки номер attempt (с нуля), счётчик не трогает.
     */
    public Duration nextDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        return applyJitter(ceiling(attempt));
    }

    /**
     * Задержка перед следующей попыткой, счётчик +1.
     *
     * @throws PermanentFailureException если попытки кончились
     */
    public Duration nextDelay() {
        if (attempts >= maxAttempts) {
            throw new PermanentFailureException(attempts);
        }
        return nextDelay(attempts++);
    }

    /**
     * Без джиттера: min(max, base * 2^attempt). Не убывает по attempt.
     */
    public Duration ceiling(int attempt) {
        long baseMs = baseDelay.toMillis();
        long maxMs = maxDelay.toMillis();
        // 2^63 переполнит long, дальше всё равно упираемся в max
        if (attempt >= 62 || baseMs > (maxMs >> Math.min(attempt, 62))) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(maxMs, baseMs << attempt));
    }

    private Duration applyJitter(Duration d) {
        if (jitter == 0) {
            return d;
        }
        double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofMillis(Math.round(d.toMillis() * factor));
    }

    public void reset() {
        attempts = 0;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean exhausted() {
        return attempts >= maxAttempts;
    }
}
