package com.vpcrouter.health;

import com.vpcrouter.registry.Endpoint;
import com.vpcrouter.registry.EndpointAddedEvent;
import com.vpcrouter.registry.EndpointRegistry;
import com.vpcrouter.registry.EndpointRemovedEvent;
import com.vpcrouter.registry.HealthCheckSpec;
import com.vpcrouter.registry.ServiceEntry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically probes every endpoint of services that define a health check and feeds the
 * results through the registry's thresholds. Runs on its own scheduler, off the request path.
 */
@Slf4j
@Component
public class HealthMonitor {

    private final EndpointRegistry registry;
    private final HealthProbe probe;
    private final ScheduledExecutorService scheduler;
    private final Map<String, MonitoredEndpoint> monitored = new ConcurrentHashMap<>();

    public HealthMonitor(EndpointRegistry registry,
                         HealthProbe probe,
                         @Qualifier("healthCheckScheduler") ScheduledExecutorService scheduler) {
        this.registry = registry;
        this.probe = probe;
        this.scheduler = scheduler;
    }

    @EventListener
    public void onEndpointAdded(EndpointAddedEvent event) {
        Endpoint endpoint = event.getEndpoint();
        Optional<HealthCheckSpec> spec = registry.findService(endpoint.getServiceId())
                .flatMap(ServiceEntry::healthCheck);
        if (spec.isEmpty()) {
            stop(endpoint.getId());
            return;
        }
        HealthCheckSpec healthCheck = spec.get();
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(
                () -> probeOnce(endpoint, healthCheck),
                0, healthCheck.getInterval().toMillis(), TimeUnit.MILLISECONDS);
        MonitoredEndpoint previous = monitored.put(endpoint.getId(), new MonitoredEndpoint(endpoint, future));
        if (previous != null) {
            previous.future.cancel(false);
        }
        log.debug("Monitoring {} every {}ms at {}", endpoint, healthCheck.getInterval().toMillis(), healthCheck.getPath());
    }

    @EventListener
    public void onEndpointRemoved(EndpointRemovedEvent event) {
        Endpoint endpoint = event.getEndpoint();
        MonitoredEndpoint current = monitored.get(endpoint.getId());
        // a same-address endpoint may already have replaced it
        if (current != null && current.endpoint == endpoint && monitored.remove(endpoint.getId(), current)) {
            current.future.cancel(false);
            log.debug("Stopped monitoring {}", endpoint);
        }
    }

    public boolean isMonitored(Endpoint endpoint) {
        MonitoredEndpoint current = monitored.get(endpoint.getId());
        return current != null && current.endpoint == endpoint;
    }

    void probeOnce(Endpoint endpoint, HealthCheckSpec spec) {
        if (endpoint.isRemoved()) {
            return;
        }
        boolean healthy;
        try {
            healthy = probe.probe(endpoint, spec);
        } catch (RuntimeException e) {
            log.warn("Health probe for {} threw", endpoint, e);
            healthy = false;
        }
        registry.recordProbe(endpoint, healthy);
    }

    @PreDestroy
    public void shutdown() {
        monitored.values().forEach(m -> m.future.cancel(false));
        monitored.clear();
    }

    private void stop(String endpointId) {
        MonitoredEndpoint previous = monitored.remove(endpointId);
        if (previous != null) {
            previous.future.cancel(false);
        }
    }

    private static final class MonitoredEndpoint {
        private final Endpoint endpoint;
        private final ScheduledFuture<?> future;

        private MonitoredEndpoint(Endpoint endpoint, ScheduledFuture<?> future) {
            this.endpoint = endpoint;
            this.future = future;
        }
    }
}
