package com.vpcrouter.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Service id to endpoints, plus each endpoint's health and connection state.
 *
 * <p>Reads are lock-free: {@link #lookup(String)} returns the service's current immutable
 * snapshot. Adding, moving and removing endpoints goes through one short-lived structural
 * lock; health and connection counts are updated on the endpoint itself and never take it.
 */
@Slf4j
@Component
public class EndpointRegistry {

    private final Map<String, ServiceEntry> services = new ConcurrentHashMap<>();
    private final Map<String, Endpoint> endpointsByAddress = new ConcurrentHashMap<>();
    private final ReentrantLock structureLock = new ReentrantLock();
    private final ApplicationEventPublisher eventPublisher;

    public EndpointRegistry(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    /**
     * Endpoints of a service in registration order; empty when the service is unknown.
     */
    public List<Endpoint> lookup(String serviceId) {
        ServiceEntry entry = services.get(serviceId);
        return entry == null ? List.of() : entry.getEndpoints();
    }

    public Optional<ServiceEntry> findService(String serviceId) {
        return Optional.ofNullable(services.get(serviceId));
    }

    public List<ServiceEntry> listServices() {
        return List.copyOf(services.values());
    }

    public Optional<Endpoint> findEndpoint(String host, int port) {
        return Optional.ofNullable(endpointsByAddress.get(Endpoint.addressKey(host, port)));
    }

    /**
     * Register a service or update its health-check settings. Existing endpoints are kept.
     */
    public ServiceEntry upsertService(String serviceId, HealthCheckSpec healthCheck) {
        List<Object> events = new ArrayList<>();
        ServiceEntry entry;
        structureLock.lock();
        try {
            entry = services.get(serviceId);
            if (entry == null) {
                entry = new ServiceEntry(serviceId, healthCheck);
                services.put(serviceId, entry);
                log.info("Registered service: {}", serviceId);
            } else {
                entry.setHealthCheck(healthCheck);
                log.info("Updated service: {}", serviceId);
                // monitors pick up the new probe settings on re-add
                for (Endpoint endpoint : entry.getEndpoints()) {
                    events.add(new EndpointAddedEvent(endpoint));
                }
            }
        } finally {
            structureLock.unlock();
        }
        events.forEach(eventPublisher::publishEvent);
        return entry;
    }

    /**
     * Drop a service and every endpoint it owns.
     */
    public boolean removeService(String serviceId) {
        List<Object> events = new ArrayList<>();
        structureLock.lock();
        try {
            ServiceEntry entry = services.remove(serviceId);
            if (entry == null) {
                return false;
            }
            for (Endpoint endpoint : entry.getEndpoints()) {
                endpointsByAddress.remove(endpoint.getId());
                endpoint.markRemoved();
                events.add(new EndpointRemovedEvent(endpoint));
            }
            entry.setEndpoints(List.of());
            log.info("Deregistered service: {}", serviceId);
        } finally {
            structureLock.unlock();
        }
        events.forEach(eventPublisher::publishEvent);
        return true;
    }

    /**
     * Add an endpoint reported by discovery. An address already owned by another service
     * moves to this one and starts with fresh state. Re-reporting a known endpoint applies
     * its readiness flag, which can eject it or re-admit it.
     */
    public Endpoint upsertEndpoint(String serviceId, String host, int port, boolean ready) {
        List<Object> events = new ArrayList<>();
        Endpoint result;
        structureLock.lock();
        try {
            String key = Endpoint.addressKey(host, port);
            Endpoint existing = endpointsByAddress.get(key);
            if (existing != null && existing.getServiceId().equals(serviceId)) {
                applyReadiness(existing, ready);
                return existing;
            }
            if (existing != null) {
                detach(existing);
                events.add(new EndpointRemovedEvent(existing));
                log.info("Endpoint {} moved from {} to {}", key, existing.getServiceId(), serviceId);
            }
            ServiceEntry entry = services.computeIfAbsent(serviceId, id -> new ServiceEntry(id, null));
            result = new Endpoint(serviceId, host, port, ready ? HealthState.HEALTHY : HealthState.UNHEALTHY);
            List<Endpoint> next = new ArrayList<>(entry.getEndpoints());
            next.add(result);
            entry.setEndpoints(next);
            endpointsByAddress.put(key, result);
            events.add(new EndpointAddedEvent(result));
            log.info("Added endpoint {} to service {} (ready={})", key, serviceId, ready);
        } finally {
            structureLock.unlock();
        }
        events.forEach(eventPublisher::publishEvent);
        return result;
    }

    public boolean removeEndpoint(String serviceId, String host, int port) {
        Endpoint removed;
        structureLock.lock();
        try {
            removed = endpointsByAddress.get(Endpoint.addressKey(host, port));
            if (removed == null || !removed.getServiceId().equals(serviceId)) {
                return false;
            }
            detach(removed);
            log.info("Removed endpoint {} from service {}", removed.getId(), serviceId);
        } finally {
            structureLock.unlock();
        }
        eventPublisher.publishEvent(new EndpointRemovedEvent(removed));
        return true;
    }

    /**
     * Feed one health-probe result through the service's thresholds.
     */
    public Optional<HealthState> recordProbe(Endpoint endpoint, boolean success) {
        HealthCheckSpec spec = findService(endpoint.getServiceId())
                .flatMap(ServiceEntry::healthCheck)
                .orElseGet(HealthCheckSpec::defaults);
        Optional<HealthState> transition = endpoint.recordProbe(success, spec.getHealthyThreshold(), spec.getUnhealthyThreshold());
        transition.ifPresent(state -> log.info("Endpoint {} is now {}", endpoint, state));
        return transition;
    }

    public void markHealth(Endpoint endpoint, HealthState state) {
        endpoint.markHealth(state);
        log.info("Endpoint {} marked {}", endpoint, state);
    }

    /**
     * Not ready always ejects. Ready re-admits at once when the service has no health check;
     * otherwise the probe streaks restart and the healthy threshold decides. Caller holds
     * {@code structureLock}.
     */
    private void applyReadiness(Endpoint endpoint, boolean ready) {
        if (!ready) {
            endpoint.markHealth(HealthState.UNHEALTHY);
            return;
        }
        if (endpoint.isHealthy()) {
            return;
        }
        boolean healthChecked = findService(endpoint.getServiceId()).flatMap(ServiceEntry::healthCheck).isPresent();
        if (healthChecked) {
            endpoint.resetProbeStreaks();
            log.info("Endpoint {} reported ready, awaiting health checks", endpoint);
        } else {
            endpoint.markHealth(HealthState.HEALTHY);
            log.info("Endpoint {} reported ready", endpoint);
        }
    }

    // caller holds structureLock
    private void detach(Endpoint endpoint) {
        endpointsByAddress.remove(endpoint.getId());
        ServiceEntry owner = services.get(endpoint.getServiceId());
        if (owner != null) {
            List<Endpoint> next = new ArrayList<>(owner.getEndpoints());
            next.remove(endpoint);
            owner.setEndpoints(next);
        }
        endpoint.markRemoved();
    }
}
