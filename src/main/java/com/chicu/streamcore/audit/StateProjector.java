package com.chicu.streamcore.audit;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Свёртка событий агрегата в состояние. Должна быть детерминированной:
 * от этого зависит равенство «снимок + хвост» и «всё с нуля».
 */
@FunctionalInterface
public interface StateProjector {

    /**
     * @param state изменяемое состояние, возвращать можно его же
     */
    ObjectNode apply(ObjectNode state, StoredEvent event);

    /**
     * Поля payload поверх состояния + служебные lastEventType / lastSequence / eventCount.
     */
    static StateProjector jsonMerge() {
        return (state, event) -> {
            if (event.payload() != null && event.payload().isObject()) {
                state.setAll((ObjectNode) event.payload().deepCopy());
            }
            state.put("lastEventType", event.type().wireName());
            state.put("lastSequence", event.sequence());
            state.put("eventCount", state.path("eventCount").asLong(0) + 1);
            return state;
        };
    }
}
