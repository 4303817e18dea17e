package com.vpcrouter.circuitbreaker;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Three-state breaker guarding one endpoint.
 *
 * <p>All transitions are compare-and-set on an immutable {@link CircuitBreakerSnapshot}, so
 * Closed to Open and Open to HalfOpen happen exactly once however many threads race on them.
 * A permit is only honoured while the breaker is still in the generation that issued it;
 * verdicts from older episodes are dropped.
 */
@Slf4j
public class EndpointCircuitBreaker {

    @Getter
    private final String endpointId;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final AtomicReference<CircuitBreakerSnapshot> ref;

    public EndpointCircuitBreaker(String endpointId, CircuitBreakerConfig config, Clock clock) {
        this.endpointId = endpointId;
        this.config = config;
        this.clock = clock;
        this.ref = new AtomicReference<>(CircuitBreakerSnapshot.closed(clock.millis()));
    }

    public CircuitState getState() {
        return ref.get().getState();
    }

    public CircuitBreakerSnapshot snapshot() {
        return ref.get();
    }

    /**
     * Whether {@link #tryAcquire()} would currently hand out a permit. Does not change state.
     */
    public boolean isCallPermitted() {
        CircuitBreakerSnapshot s = ref.get();
        return switch (s.getState()) {
            case CLOSED -> true;
            case OPEN -> cooldownElapsed(s, clock.millis());
            case HALF_OPEN -> s.getTrialsInFlight() < config.getHalfOpenMaxTrials();
        };
    }

    /**
     * Ask to send one attempt. Empty means the call must be short-circuited.
     */
    public Optional<CircuitPermit> tryAcquire() {
        while (true) {
            CircuitBreakerSnapshot s = ref.get();
            long now = clock.millis();
            switch (s.getState()) {
                case CLOSED:
                    return Optional.of(new CircuitPermit(endpointId, false, s.getGeneration()));
                case OPEN: {
                    if (!cooldownElapsed(s, now)) {
                        return Optional.empty();
                    }
                    CircuitBreakerSnapshot next = s.transitionTo(CircuitState.HALF_OPEN, now).withTrialsInFlight(1);
                    if (ref.compareAndSet(s, next)) {
                        log.info("Circuit for {} is HALF_OPEN after {}ms cooldown", endpointId, now - s.getStateChangedAtMillis());
                        return Optional.of(new CircuitPermit(endpointId, true, next.getGeneration()));
                    }
                    break;
                }
                case HALF_OPEN: {
                    if (s.getTrialsInFlight() >= config.getHalfOpenMaxTrials()) {
                        return Optional.empty();
                    }
                    CircuitBreakerSnapshot next = s.withTrialsInFlight(s.getTrialsInFlight() + 1);
                    if (ref.compareAndSet(s, next)) {
                        return Optional.of(new CircuitPermit(endpointId, true, next.getGeneration()));
                    }
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown circuit state " + s.getState());
            }
        }
    }

    public void onSuccess(CircuitPermit permit) {
        while (true) {
            CircuitBreakerSnapshot s = ref.get();
            if (s.getGeneration() != permit.getGeneration()) {
                return;
            }
            CircuitBreakerSnapshot next;
            if (s.getState() == CircuitState.CLOSED) {
                if (s.getConsecutiveFailures() == 0) {
                    return;
                }
                next = s.withConsecutiveFailures(0);
            } else if (s.getState() == CircuitState.HALF_OPEN && permit.isTrial()) {
                next = s.transitionTo(CircuitState.CLOSED, clock.millis());
            } else {
                return;
            }
            if (ref.compareAndSet(s, next)) {
                if (next.getState() == CircuitState.CLOSED && s.getState() == CircuitState.HALF_OPEN) {
                    log.info("Circuit for {} is CLOSED after successful trial", endpointId);
                }
                return;
            }
        }
    }

    public void onFailure(CircuitPermit permit) {
        while (true) {
            CircuitBreakerSnapshot s = ref.get();
            if (s.getGeneration() != permit.getGeneration()) {
                return;
            }
            long now = clock.millis();
            CircuitBreakerSnapshot next;
            if (s.getState() == CircuitState.CLOSED) {
                int failures = s.getConsecutiveFailures() + 1;
                next = failures >= config.getFailureThreshold()
                        ? s.withConsecutiveFailures(failures).transitionTo(CircuitState.OPEN, now)
                        : s.withConsecutiveFailures(failures);
            } else if (s.getState() == CircuitState.HALF_OPEN && permit.isTrial()) {
                next = s.withConsecutiveFailures(s.getConsecutiveFailures() + 1).transitionTo(CircuitState.OPEN, now);
            } else {
                return;
            }
            if (ref.compareAndSet(s, next)) {
                if (next.getState() == CircuitState.OPEN) {
                    log.warn("Circuit for {} is OPEN after {} consecutive failures (was {})",
                            endpointId, next.getConsecutiveFailures(), s.getState());
                }
                return;
            }
        }
    }

    /**
     * Give a permit back without a verdict, e.g. when the client went away mid-attempt.
     */
    public void release(CircuitPermit permit) {
        if (!permit.isTrial()) {
            return;
        }
        while (true) {
            CircuitBreakerSnapshot s = ref.get();
            if (s.getGeneration() != permit.getGeneration()
                    || s.getState() != CircuitState.HALF_OPEN
                    || s.getTrialsInFlight() == 0) {
                return;
            }
            if (ref.compareAndSet(s, s.withTrialsInFlight(s.getTrialsInFlight() - 1))) {
                return;
            }
        }
    }

    private boolean cooldownElapsed(CircuitBreakerSnapshot s, long now) {
        return now - s.getStateChangedAtMillis() >= config.getCooldown().toMillis();
    }
}
