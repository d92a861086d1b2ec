package com.chicu.streamcore.stream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Ограниченная очередь: много писателей, много читателей.
 * При переполнении выкидывается самый старый элемент из тех, что разрешено терять,
 * потеря считается. Если терять нечего, элемент всё равно добавляется сверх ёмкости.
 */
public class MessageQueue<T> {

    private final int capacity;
    private final ArrayDeque<T> queue;
    private final Predicate<? super T> droppable;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    private long dropped;

    public MessageQueue(int capacity) {
        this(capacity, item -> true);
    }

    public MessageQueue(int capacity, Predicate<? super T> droppable) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(capacity);
        this.droppable = droppable;
    }

    /**
     * @return false, если ради нового элемента пришлось выбросить старый
     */
    public boolean offer(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        lock.lock();
        try {
            boolean overflow = queue.size() >= capacity && dropOldest();
            queue.addLast(item);
            notEmpty.signal();
            return !overflow;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false, если в очереди нет ни одного элемента, который можно выбросить
     */
    private boolean dropOldest() {
        Iterator<T> it = queue.iterator();
        while (it.hasNext()) {
            if (droppable.test(it.next())) {
                it.remove();
                dropped++;
                return true;
            }
        }
        return false;
    }

    public T poll() {
        lock.lock();
        try {
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public List<T> drain() {
        lock.lock();
        try {
            List<T> out = new ArrayList<>(queue);
            queue.clear();
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public long droppedCount() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
