package com.chicu.streamcore.resilience;

import com.chicu.streamcore.stream.ConnectionException;
import com.chicu.streamcore.stream.ProtocolException;
import com.chicu.streamcore.stream.ProviderMessage;
import com.chicu.streamcore.stream.StreamProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Optional;

/**
 * GET по URL, который собирает провайдер; разбор ответа: тоже провайдер.
 */
@Slf4j
@RequiredArgsConstructor
public class RestFallbackFetcher implements FallbackFetcher {

    private final StreamProvider provider;
    private final RestTemplate restTemplate;

    @Override
    public Optional<ProviderMessage> fetch(String key) throws ProtocolException {
        Optional<StreamProvider.FallbackRequest> request = provider.fallbackRequest(key);
        if (request.isEmpty()) {
            return Optional.empty();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        request.get().headers().forEach(headers::set);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(
                    request.get().uri(),
                    HttpMethod.GET,
                    new HttpEntity<>(headers),
                    String.class
            );
        } catch (RestClientException e) {
            throw new ConnectionException("[" + provider.id() + "] REST " + key + ": " + e.getMessage(), e);
        }

        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw new ProtocolException("[" + provider.id() + "] empty REST body for " + key);
        }
        log.debug("🌐 [{}] REST {} → {} bytes", provider.id(), key, body.length());
        return Optional.of(provider.parseFallback(key, body));
    }
}
