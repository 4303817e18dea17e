package com.vpcrouter.health;

import com.vpcrouter.registry.Endpoint;
import com.vpcrouter.registry.HealthCheckSpec;
import com.vpcrouter.registry.HealthState;
import com.vpcrouter.support.StubBackend;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HttpHealthProbeTest {

    private final HealthCheckSpec spec = HealthCheckSpec.builder().path("ready").timeout(Duration.ofSeconds(2)).build();
    private StubBackend backend;
    private CloseableHttpClient httpClient;
    private HttpHealthProbe probe;

    @BeforeEach
    void setUp() throws IOException {
        backend = new StubBackend();
        httpClient = HttpClients.createDefault();
        probe = new HttpHealthProbe(httpClient);
    }

    @AfterEach
    void tearDown() throws IOException {
        httpClient.close();
        backend.close();
    }

    @Test
    void successStatusIsHealthy() {
        backend.script(202);
        Endpoint endpoint = new Endpoint("orders", backend.host(), backend.port(), HealthState.HEALTHY);

        assertThat(probe.probe(endpoint, spec)).isTrue();
        assertThat(backend.received().get(0).method).isEqualTo("GET");
        assertThat(backend.received().get(0).uri).isEqualTo("/ready");
    }

    @Test
    void errorStatusIsUnhealthy() {
        backend.script(503);
        Endpoint endpoint = new Endpoint("orders", backend.host(), backend.port(), HealthState.HEALTHY);

        assertThat(probe.probe(endpoint, spec)).isFalse();
    }

    @Test
    void unreachableEndpointIsUnhealthy() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        Endpoint endpoint = new Endpoint("orders", backend.host(), closedPort, HealthState.HEALTHY);

        assertThat(probe.probe(endpoint, spec)).isFalse();
    }

    @Test
    void probeUriBracketsIpv6() {
        Endpoint endpoint = new Endpoint("orders", "fd00::12", 9000, HealthState.HEALTHY);

        assertThat(HttpHealthProbe.probeUri(endpoint, HealthCheckSpec.defaults()).toString())
                .isEqualTo("http://[fd00::12]:9000/healthz");
    }
}
