package com.vpcrouter.registry;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Active health-check settings of a service.
 */
@Value
@Builder(toBuilder = true)
public class HealthCheckSpec {
    @Builder.Default
    String path = "/healthz";
    @Builder.Default
    Duration interval = Duration.ofSeconds(10);
    @Builder.Default
    Duration timeout = Duration.ofSeconds(5);
    /** Consecutive failed probes before an endpoint is taken out of rotation. */
    @Builder.Default
    int unhealthyThreshold = 3;
    /** Consecutive successful probes before it is admitted again. */
    @Builder.Default
    int healthyThreshold = 2;

    public static HealthCheckSpec defaults() {
        return HealthCheckSpec.builder().build();
    }
}
