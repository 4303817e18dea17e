package com.vpcrouter.health;

import com.vpcrouter.registry.Endpoint;
import com.vpcrouter.registry.HealthCheckSpec;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.util.Timeout;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;

/**
 * GET on the service's health path; any 2xx counts as healthy.
 */
@Slf4j
@Component
public class HttpHealthProbe implements HealthProbe {

    private final CloseableHttpClient httpClient;

    public HttpHealthProbe(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public boolean probe(Endpoint endpoint, HealthCheckSpec spec) {
        HttpGet request = new HttpGet(probeUri(endpoint, spec));
        Timeout timeout = Timeout.ofMilliseconds(spec.getTimeout().toMillis());
        request.setConfig(RequestConfig.custom()
                .setConnectTimeout(timeout)
                .setConnectionRequestTimeout(timeout)
                .setResponseTimeout(timeout)
                .build());
        try {
            int status = httpClient.execute(request, response -> response.getCode());
            log.debug("Health probe {} -> {}", request.getRequestUri(), status);
            return status >= 200 && status < 300;
        } catch (IOException e) {
            log.debug("Health probe {} failed: {}", endpoint, e.toString());
            return false;
        }
    }

    static URI probeUri(Endpoint endpoint, HealthCheckSpec spec) {
        String host = endpoint.getHost().contains(":") ? "[" + endpoint.getHost() + "]" : endpoint.getHost();
        String path = spec.getPath().startsWith("/") ? spec.getPath() : "/" + spec.getPath();
        return URI.create("http://" + host + ":" + endpoint.getPort() + path);
    }
}
