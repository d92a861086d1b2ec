package com.chicu.streamcore.resilience;

import com.chicu.streamcore.stream.ProtocolException;
import com.chicu.streamcore.stream.ProviderMessage;

import java.util.Optional;

/**
 * Разовый REST-запрос состояния по ключу. Empty: у провайдера нет REST для такого ключа.
 */
@FunctionalInterface
public interface FallbackFetcher {

    Optional<ProviderMessage> fetch(String key) throws ProtocolException;
}
