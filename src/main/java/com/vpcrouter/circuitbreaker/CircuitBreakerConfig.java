package com.vpcrouter.circuitbreaker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class CircuitBreakerConfig {
    /** Consecutive failures that open a closed breaker. */
    @Builder.Default
    int failureThreshold = 5;
    /** Time an open breaker rejects calls before allowing a trial. */
    @Builder.Default
    Duration cooldown = Duration.ofSeconds(60);
    /** Trials allowed in flight at the same time while half-open. */
    @Builder.Default
    int halfOpenMaxTrials = 1;

    public static CircuitBreakerConfig defaults() {
        return CircuitBreakerConfig.builder().build();
    }
}
