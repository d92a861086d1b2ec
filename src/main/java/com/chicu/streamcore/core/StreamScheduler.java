package com.chicu.streamcore.core;

import java.time.Duration;

/**
 * Отложенные и периодические задачи ядра: реконнект, heartbeat, fallback, компрессия.
 */
public interface StreamScheduler {

    Handle schedule(String name, Runnable task, Duration delay);

    Handle scheduleAtFixedRate(String name, Runnable task, Duration initialDelay, Duration period);

    /**
     * Отмена кооперативная: уже запущенная задача доработает.
     */
    interface Handle {

        void cancel();

        boolean isCancelled();

        boolean isDone();
    }
}
