package com.chicu.streamcore.stream;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Возможности конкретного провайдера (Birdeye, Helius, ...).
 * Выбирается при создании соединения, разбор и формат команд: здесь.
 * Экземпляр принадлежит одному соединению и может хранить его состояние.
 */
public interface StreamProvider {

    String id();

    URI streamUri();

    /**
     * Разбор одного кадра. Кадр может нести несколько сообщений или ни одного.
     */
    List<ProviderMessage> parse(String raw) throws ProtocolException;

    /**
     * @return текст для сокета или empty, если команда не требует отправки
     */
    Optional<String> formatCommand(StreamCommand command);

    /**
     * Новый сокет: провайдер ничего не помнит о старых подписках.
     */
    default void onConnected() {
    }

    /**
     * REST-запрос для fallback по одному ключу.
     */
    Optional<FallbackRequest> fallbackRequest(String key);

    /**
     * Ответ REST → синтетический snapshot.
     */
    ProviderMessage parseFallback(String key, String body) throws ProtocolException;

    record FallbackRequest(URI uri, Map<String, String> headers) {
        public FallbackRequest {
            headers = headers == null ? Map.of() : Map.copyOf(headers);
        }
    }
}
