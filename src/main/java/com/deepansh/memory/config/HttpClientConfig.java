package com.deepansh.memory.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient behind every outbound RestClient (LLM and embeddings).
 *
 * Every external call must carry a timeout: a hung provider would otherwise
 * stall a decision thread forever. Connect and response timeouts are applied
 * at the connection-manager and request level; retries live in Resilience4j,
 * not here.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder restClientBuilder(
            @Value("${http.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${http.response-timeout-ms:30000}") long responseTimeoutMs,
            @Value("${http.max-connections:20}") int maxConnections) {

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                                        .setSocketTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
                        .build())
                .build();

        log.info("HttpClient configured [connectTimeoutMs={}, responseTimeoutMs={}, maxConnections={}]",
                connectTimeoutMs, responseTimeoutMs, maxConnections);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
