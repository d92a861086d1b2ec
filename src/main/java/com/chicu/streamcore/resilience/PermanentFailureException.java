package com.chicu.streamcore.resilience;

/**
 * Попытки реконнекта исчерпаны: стрим больше не поднимаем, остаётся только fallback.
 */
public class PermanentFailureException extends RuntimeException {

    private final int attempts;

    public PermanentFailureException(int attempts) {
        super("reconnect attempts exhausted: " + attempts);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
