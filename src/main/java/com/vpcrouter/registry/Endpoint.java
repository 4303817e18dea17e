package com.vpcrouter.registry;

import lombok.Getter;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A single backend instance of a service together with its dynamic state.
 * Health and connection count change while the endpoint is registered; identity never does.
 */
@Getter
public class Endpoint {

    private final String serviceId;
    private final String host;
    private final int port;
    private final String id;

    private volatile HealthState health;
    private volatile boolean removed;
    private final AtomicInteger activeConnections = new AtomicInteger();

    // guarded by this
    private int consecutiveSuccesses;
    private int consecutiveFailures;

    public Endpoint(String serviceId, String host, int port, HealthState initialHealth) {
        this.serviceId = serviceId;
        this.host = host;
        this.port = port;
        this.id = addressKey(host, port);
        this.health = initialHealth;
    }

    public static String addressKey(String host, int port) {
        return host + ":" + port;
    }

    public boolean isHealthy() {
        return health == HealthState.HEALTHY;
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    /**
     * Count one more in-flight request against this endpoint.
     */
    public ConnectionLease acquireConnection() {
        return new ConnectionLease(activeConnections);
    }

    /**
     * Apply one probe result. Returns the new state when the thresholds cause a transition.
     */
    public synchronized Optional<HealthState> recordProbe(boolean success, int healthyThreshold, int unhealthyThreshold) {
        if (success) {
            consecutiveFailures = 0;
            consecutiveSuccesses++;
            if (health == HealthState.UNHEALTHY && consecutiveSuccesses >= healthyThreshold) {
                health = HealthState.HEALTHY;
                return Optional.of(HealthState.HEALTHY);
            }
        } else {
            consecutiveSuccesses = 0;
            consecutiveFailures++;
            if (health == HealthState.HEALTHY && consecutiveFailures >= unhealthyThreshold) {
                health = HealthState.UNHEALTHY;
                return Optional.of(HealthState.UNHEALTHY);
            }
        }
        return Optional.empty();
    }

    public synchronized void markHealth(HealthState state) {
        if (health != state) {
            health = state;
            consecutiveSuccesses = 0;
            consecutiveFailures = 0;
        }
    }

    public synchronized void resetProbeStreaks() {
        consecutiveSuccesses = 0;
        consecutiveFailures = 0;
    }

    public synchronized int getConsecutiveSuccesses() {
        return consecutiveSuccesses;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    void markRemoved() {
        removed = true;
    }

    @Override
    public String toString() {
        return serviceId + "@" + id;
    }
}
