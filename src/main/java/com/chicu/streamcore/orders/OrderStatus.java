package com.chicu.streamcore.orders;

import java.util.EnumSet;
import java.util.Set;

public enum OrderStatus {
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    FAILED;

    /** закрытые ордера: кандидаты на компрессию */
    public static final Set<OrderStatus> CLOSED = EnumSet.of(FILLED, CANCELLED, FAILED);

    public boolean isClosed() {
        return CLOSED.contains(this);
    }
}
