package com.vpcrouter.circuitbreaker;

import lombok.Value;
import lombok.With;

/**
 * Immutable state of one breaker. Every state change bumps {@code generation}, which lets
 * a permit tell whether it still belongs to the episode it was issued in.
 */
@Value
@With
public class CircuitBreakerSnapshot {
    CircuitState state;
    int consecutiveFailures;
    long stateChangedAtMillis;
    int trialsInFlight;
    long generation;

    static CircuitBreakerSnapshot closed(long now) {
        return new CircuitBreakerSnapshot(CircuitState.CLOSED, 0, now, 0, 0);
    }

    CircuitBreakerSnapshot transitionTo(CircuitState next, long now) {
        return new CircuitBreakerSnapshot(next, next == CircuitState.CLOSED ? 0 : consecutiveFailures, now, 0, generation + 1);
    }
}
