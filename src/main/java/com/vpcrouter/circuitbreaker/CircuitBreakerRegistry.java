package com.vpcrouter.circuitbreaker;

import com.vpcrouter.registry.Endpoint;
import com.vpcrouter.registry.EndpointRemovedEvent;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One breaker per endpoint, created on first use and dropped when the endpoint leaves
 * the registry.
 */
@Slf4j
@Component
public class CircuitBreakerRegistry {

    private final Map<String, EndpointCircuitBreaker> breakers = new ConcurrentHashMap<>();
    @Getter
    private final CircuitBreakerConfig config;
    private final Clock clock;

    @Autowired
    public CircuitBreakerRegistry(@Value("${gateway.circuit-breaker.failure-threshold:5}") int failureThreshold,
                                  @Value("${gateway.circuit-breaker.cooldown:60s}") Duration cooldown,
                                  @Value("${gateway.circuit-breaker.half-open-max-trials:1}") int halfOpenMaxTrials,
                                  Clock clock) {
        this(CircuitBreakerConfig.builder()
                .failureThreshold(failureThreshold)
                .cooldown(cooldown)
                .halfOpenMaxTrials(halfOpenMaxTrials)
                .build(), clock);
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        log.info("Circuit breakers: threshold={}, cooldown={}, halfOpenMaxTrials={}",
                config.getFailureThreshold(), config.getCooldown(), config.getHalfOpenMaxTrials());
    }

    public EndpointCircuitBreaker forEndpoint(Endpoint endpoint) {
        return breakers.computeIfAbsent(endpoint.getId(), id -> new EndpointCircuitBreaker(id, config, clock));
    }

    public CircuitState stateOf(Endpoint endpoint) {
        EndpointCircuitBreaker breaker = breakers.get(endpoint.getId());
        return breaker == null ? CircuitState.CLOSED : breaker.getState();
    }

    @EventListener
    public void onEndpointRemoved(EndpointRemovedEvent event) {
        if (breakers.remove(event.getEndpoint().getId()) != null) {
            log.debug("Dropped circuit breaker for {}", event.getEndpoint());
        }
    }
}
