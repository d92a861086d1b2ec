package com.chicu.streamcore.support;

import com.chicu.streamcore.core.StreamScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Планировщик на виртуальном времени: задачи выполняются только в advance(),
 * в порядке срока, в потоке теста. Часы двигаются вместе с ним.
 */
public class ManualStreamScheduler implements StreamScheduler {

    private final MutableClock clock;
    private final List<Task> tasks = new ArrayList<>();

    public ManualStreamScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Handle schedule(String name, Runnable task, Duration delay) {
        Task t = new Task(name, task, clock.instant().plus(delay), null);
        tasks.add(t);
        return t;
    }

    @Override
    public synchronized Handle scheduleAtFixedRate(String name, Runnable task, Duration initialDelay, Duration period) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }
        Task t = new Task(name, task, clock.instant().plus(initialDelay), period);
        tasks.add(t);
        return t;
    }

    /**
     * Прокрутить время вперёд, выполняя всё, что созрело.
     */
    public void advance(Duration d) {
        Instant target = clock.instant().plus(d);
        while (true) {
            Task next = nextDue(target);
            if (next == null) {
                break;
            }
            if (next.due.isAfter(clock.instant())) {
                clock.set(next.due);
            }
            if (next.period == null) {
                next.done = true;
            } else {
                next.due = next.due.plus(next.period);
            }
            next.runnable.run();
        }
        clock.set(target);
    }

    /**
     * Выполнить то, что уже должно было выполниться.
     */
    public void runDue() {
        advance(Duration.ZERO);
    }

    public synchronized long pending(String namePrefix) {
        return tasks.stream()
                .filter(t -> !t.cancelled && !t.done && t.name.startsWith(namePrefix))
                .count();
    }

    private synchronized Task nextDue(Instant target) {
        Task best = null;
        for (Task t : tasks) {
            if (t.cancelled || t.done || t.due.isAfter(target)) {
                continue;
            }
            if (best == null || t.due.isBefore(best.due)) {
                best = t;
            }
        }
        return best;
    }

    private static final class Task implements Handle {

        private final String name;
        private final Runnable runnable;
        private final Duration period;
        private volatile Instant due;
        private volatile boolean cancelled;
        private volatile boolean done;

        private Task(String name, Runnable runnable, Instant due, Duration period) {
            this.name = name;
            this.runnable = runnable;
            this.due = due;
            this.period = period;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }
    }
}
