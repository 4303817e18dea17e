package com.vpcrouter.health;

import com.vpcrouter.registry.Endpoint;
import com.vpcrouter.registry.EndpointAddedEvent;
import com.vpcrouter.registry.EndpointRegistry;
import com.vpcrouter.registry.EndpointRemovedEvent;
import com.vpcrouter.registry.HealthCheckSpec;
import com.vpcrouter.registry.HealthState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class HealthMonitorTest {

    private static final HealthCheckSpec FAST = HealthCheckSpec.builder()
            .path("/ping")
            .interval(Duration.ofMillis(20))
            .timeout(Duration.ofMillis(100))
            .build();

    private final AtomicBoolean backendUp = new AtomicBoolean(true);
    private final AtomicInteger probes = new AtomicInteger();
    private ScheduledExecutorService scheduler;
    private EndpointRegistry registry;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        registry = new EndpointRegistry(event -> {
            if (event instanceof EndpointAddedEvent) {
                monitor.onEndpointAdded((EndpointAddedEvent) event);
            } else if (event instanceof EndpointRemovedEvent) {
                monitor.onEndpointRemoved((EndpointRemovedEvent) event);
            }
        });
        HealthProbe probe = (endpoint, spec) -> {
            probes.incrementAndGet();
            return backendUp.get();
        };
        monitor = new HealthMonitor(registry, probe, scheduler);
    }

    @AfterEach
    void tearDown() {
        monitor.shutdown();
        scheduler.shutdownNow();
    }

    @Test
    void failingProbesEjectAndPassingProbesReadmit() {
        registry.upsertService("orders", FAST);
        Endpoint endpoint = registry.upsertEndpoint("orders", "10.0.0.1", 8080, true);
        assertThat(monitor.isMonitored(endpoint)).isTrue();

        backendUp.set(false);
        await().atMost(Duration.ofSeconds(5)).until(() -> endpoint.getHealth() == HealthState.UNHEALTHY);
        assertThat(endpoint.getConsecutiveFailures()).isGreaterThanOrEqualTo(3);

        backendUp.set(true);
        await().atMost(Duration.ofSeconds(5)).until(endpoint::isHealthy);
        assertThat(endpoint.getConsecutiveSuccesses()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void servicesWithoutHealthCheckAreNotProbed() {
        registry.upsertService("static", null);
        Endpoint endpoint = registry.upsertEndpoint("static", "10.0.0.2", 8080, true);

        assertThat(monitor.isMonitored(endpoint)).isFalse();
        assertThat(probes).hasValue(0);
    }

    @Test
    void removedEndpointIsNoLongerProbed() throws InterruptedException {
        registry.upsertService("orders", FAST);
        Endpoint endpoint = registry.upsertEndpoint("orders", "10.0.0.1", 8080, true);
        await().atMost(Duration.ofSeconds(5)).until(() -> probes.get() >= 2);

        registry.removeEndpoint("orders", "10.0.0.1", 8080);
        assertThat(monitor.isMonitored(endpoint)).isFalse();

        Thread.sleep(60);
        int settled = probes.get();
        Thread.sleep(150);
        assertThat(probes).hasValue(settled);
    }

    @Test
    void readdedAddressKeepsItsNewMonitor() {
        registry.upsertService("orders", FAST);
        registry.upsertService("billing", FAST);
        Endpoint original = registry.upsertEndpoint("orders", "10.0.0.1", 8080, true);

        Endpoint moved = registry.upsertEndpoint("billing", "10.0.0.1", 8080, true);

        assertThat(moved).isNotSameAs(original);
        assertThat(monitor.isMonitored(moved)).isTrue();
        assertThat(monitor.isMonitored(original)).isFalse();
    }

    @Test
    void throwingProbeCountsAsFailure() {
        registry.upsertService("orders", HealthCheckSpec.defaults());
        Endpoint endpoint = registry.upsertEndpoint("orders", "10.0.0.3", 8080, true);
        HealthMonitor throwing = new HealthMonitor(registry, (e, spec) -> {
            throw new IllegalStateException("probe exploded");
        }, scheduler);

        for (int i = 0; i < 3; i++) {
            throwing.probeOnce(endpoint, HealthCheckSpec.defaults());
        }

        assertThat(endpoint.getHealth()).isEqualTo(HealthState.UNHEALTHY);
    }
}
