package com.chicu.streamcore.core;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class ExecutorStreamScheduler implements StreamScheduler {

    /**
     * Имена вида: stream-sched-1, stream-sched-2, ...
     */
    private static final class StreamThreadFactory implements ThreadFactory {
        private final AtomicLong ctr = new AtomicLong(1);
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName("stream-sched-" + ctr.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private final ScheduledThreadPoolExecutor executor;

    public ExecutorStreamScheduler() {
        this(Math.max(2, Runtime.getRuntime().availableProcessors()));
    }

    public ExecutorStreamScheduler(int threads) {
        executor = new ScheduledThreadPoolExecutor(threads, new StreamThreadFactory());
        // отменённые задачи не держим в очереди до срока
        executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public Handle schedule(String name, Runnable task, Duration delay) {
        ScheduledFuture<?> f = executor.schedule(wrap(name, task), Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        return new FutureHandle(f);
    }

    @Override
    public Handle scheduleAtFixedRate(String name, Runnable task, Duration initialDelay, Duration period) {
        ScheduledFuture<?> f = executor.scheduleAtFixedRate(
                wrap(name, task),
                Math.max(0, initialDelay.toMillis()),
                period.toMillis(),
                TimeUnit.MILLISECONDS
        );
        return new FutureHandle(f);
    }

    /**
     * Исключение в периодической задаче убило бы её навсегда: логируем и живём дальше.
     */
    private static Runnable wrap(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Throwable t) {
                log.error("❗ Ошибка в задаче {}: {}", name, t.getMessage(), t);
            }
        };
    }

    @PreDestroy
    public void shutdown() {
        log.info("🧹 Остановка планировщика стрима...");
        executor.shutdownNow();
    }

    private record FutureHandle(ScheduledFuture<?> future) implements Handle {

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }
    }
}
