package com.chicu.streamcore.config.http;

import com.chicu.streamcore.config.StreamCoreProperties;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP-клиент для REST-fallback провайдеров: общий пул, жёсткие таймауты.
 */
@Configuration
public class FallbackRestTemplateConfig {

    @Bean(destroyMethod = "close")
    public PoolingHttpClientConnectionManager fallbackConnManager(StreamCoreProperties props) {
        StreamCoreProperties.Http http = props.getHttp();
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(http.getMaxTotal());
        cm.setDefaultMaxPerRoute(http.getMaxPerRoute());
        return cm;
    }

    @Bean
    public CloseableHttpClient fallbackHttpClient(PoolingHttpClientConnectionManager fallbackConnManager,
                                                  StreamCoreProperties props) {
        StreamCoreProperties.Http http = props.getHttp();

        RequestConfig cfg = RequestConfig.custom()
                .setConnectTimeout(timeout(http.getConnectTimeout()))
                .setConnectionRequestTimeout(timeout(http.getPoolTimeout()))
                // поллинг идёт по расписанию: зависший ответ не должен съедать интервал
                .setResponseTimeout(timeout(http.getResponseTimeout()))
                .build();

        return HttpClients.custom()
                .setConnectionManager(fallbackConnManager)
                .setDefaultRequestConfig(cfg)
                .evictExpiredConnections()
                .evictIdleConnections(timeout(http.getEvictIdle()))
                .build();
    }

    @Bean
    @Qualifier("fallbackRestTemplate")
    public RestTemplate fallbackRestTemplate(CloseableHttpClient fallbackHttpClient) {
        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(fallbackHttpClient));
    }

    private static Timeout timeout(Duration d) {
        return Timeout.ofMilliseconds(d.toMillis());
    }
}
