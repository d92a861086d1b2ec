package com.chicu.streamcore.core;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Хэндл подписки. close() снимает слушателя и уменьшает refcount ключей; повторный close: no-op.
 */
public class UpdateSubscription implements AutoCloseable {

    private final String provider;
    private final List<String> keys;
    private final Runnable onClose;
    private final AtomicBoolean closed = new AtomicBoolean();

    UpdateSubscription(String provider, List<String> keys, Runnable onClose) {
        this.provider = provider;
        this.keys = List.copyOf(keys);
        this.onClose = onClose;
    }

    public String provider() {
        return provider;
    }

    public List<String> keys() {
        return keys;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            onClose.run();
        }
    }
}
