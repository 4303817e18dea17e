package com.vpcrouter.registry;

public enum HealthState {
    HEALTHY,
    UNHEALTHY
}
