package com.vpcrouter.registry;

import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * Registry record of one service. The endpoint list is an immutable snapshot that is
 * swapped as a whole, so readers never see a half-applied change.
 */
@Getter
public class ServiceEntry {

    private final String serviceId;
    private volatile HealthCheckSpec healthCheck;
    private volatile List<Endpoint> endpoints = List.of();

    ServiceEntry(String serviceId, HealthCheckSpec healthCheck) {
        this.serviceId = serviceId;
        this.healthCheck = healthCheck;
    }

    public Optional<HealthCheckSpec> healthCheck() {
        return Optional.ofNullable(healthCheck);
    }

    void setHealthCheck(HealthCheckSpec healthCheck) {
        this.healthCheck = healthCheck;
    }

    void setEndpoints(List<Endpoint> endpoints) {
        this.endpoints = List.copyOf(endpoints);
    }
}
