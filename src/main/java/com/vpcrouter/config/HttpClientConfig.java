package com.vpcrouter.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Pooled client shared by the forwarder and the health probes. Per-attempt timeouts are set on
 * each request; the client itself never retries, redirects, keeps cookies or decompresses.
 */
@Slf4j
@Configuration
public class HttpClientConfig {

    @Value("${gateway.forwarder.max-connections:200}")
    private int maxConnections;

    @Value("${gateway.forwarder.max-connections-per-endpoint:50}")
    private int maxConnectionsPerEndpoint;

    @Value("${gateway.forwarder.connect-timeout:10s}")
    private Duration connectTimeout;

    @Value("${gateway.forwarder.idle-timeout:60s}")
    private Duration idleTimeout;

    @Bean(destroyMethod = "close")
    public CloseableHttpClient gatewayHttpClient() {
        log.info("Configuring backend HTTP client - maxConnections: {}, perEndpoint: {}, connectTimeout: {}",
                maxConnections, maxConnectionsPerEndpoint, connectTimeout);

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(maxConnections)
                .setMaxConnPerRoute(maxConnectionsPerEndpoint)
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.ofMilliseconds(connectTimeout.toMillis()))
                        .build())
                .build();

        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .disableAutomaticRetries()
                .disableRedirectHandling()
                .disableCookieManagement()
                .disableContentCompression()
                .evictExpiredConnections()
                .evictIdleConnections(TimeValue.ofMilliseconds(idleTimeout.toMillis()))
                .build();
    }
}
