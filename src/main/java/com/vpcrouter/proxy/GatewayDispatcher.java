package com.vpcrouter.proxy;

import com.vpcrouter.circuitbreaker.CircuitBreakerRegistry;
import com.vpcrouter.circuitbreaker.CircuitPermit;
import com.vpcrouter.circuitbreaker.EndpointCircuitBreaker;
import com.vpcrouter.error.GatewayErrorCode;
import com.vpcrouter.error.GatewayException;
import com.vpcrouter.loadbalancer.LoadBalancer;
import com.vpcrouter.loadbalancer.SelectionContext;
import com.vpcrouter.loadbalancer.SelectionResult;
import com.vpcrouter.policy.RetryPolicy;
import com.vpcrouter.policy.TimeoutPolicy;
import com.vpcrouter.registry.Endpoint;
import com.vpcrouter.router.Route;
import com.vpcrouter.router.RouteManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Runs one request through match, selection and the retry loop.
 *
 * <p>Attempts are sequential. Each one selects an endpoint afresh, takes a breaker permit and
 * forwards; the verdict goes back to the breaker before anything else happens. Only the last
 * attempt's outcome reaches the caller: either an open exchange to relay, or a
 * {@link GatewayException}.
 */
@Slf4j
@Component
public class GatewayDispatcher {

    private final RouteManager routeManager;
    private final LoadBalancer loadBalancer;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RequestForwarder forwarder;
    private final BackoffSleeper sleeper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final long maxBufferedBody;

    public GatewayDispatcher(RouteManager routeManager,
                             LoadBalancer loadBalancer,
                             CircuitBreakerRegistry circuitBreakers,
                             RequestForwarder forwarder,
                             BackoffSleeper sleeper,
                             ApplicationEventPublisher eventPublisher,
                             Clock clock,
                             @Value("${gateway.forwarder.max-buffered-body:1MB}") DataSize maxBufferedBody) {
        this.routeManager = routeManager;
        this.loadBalancer = loadBalancer;
        this.circuitBreakers = circuitBreakers;
        this.forwarder = forwarder;
        this.sleeper = sleeper;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxBufferedBody = maxBufferedBody.toBytes();
    }

    /**
     * @return exchange whose response must be relayed and then closed
     * @throws GatewayException when no attempt produced a response to relay
     */
    public BackendExchange dispatch(ProxyRequest request, RequestContext context) {
        Route route = routeManager.findRoute(request.toRouteQuery())
                .orElseThrow(() -> new GatewayException(GatewayErrorCode.ROUTE_NOT_FOUND,
                        "No route matches " + request.getMethod() + " " + request.getPath()));
        context.setRoute(route);
        log.debug("Matched route {} for {} {}", route.getId(), request.getMethod(), request.getPath());

        RetryPolicy retry = route.getRetryPolicy();
        TimeoutPolicy timeouts = route.getTimeoutPolicy();
        ProxyRequest effective = retry.getMaxRetries() > 0 ? withReplayableBody(request) : request;
        context.setDeadline(context.getStartedAt().plus(retry.overallBudget(timeouts)));
        SelectionContext selectionContext = request.toSelectionContext();

        for (int attempt = 0; ; attempt++) {
            if (context.isCancelled()) {
                throw cancelled(route);
            }
            Duration remaining = context.remaining(clock.instant());
            if (remaining.isNegative() || remaining.isZero()) {
                throw new GatewayException(GatewayErrorCode.GATEWAY_TIMEOUT,
                        "Route " + route.getId() + " exhausted its time budget after " + attempt + " attempts");
            }
            context.setAttempts(attempt + 1);

            AttemptOutcome outcome;
            BackendExchange exchange = null;
            SelectionResult selection = loadBalancer.select(route, selectionContext);
            if (selection.getStatus() == SelectionResult.Status.NO_HEALTHY_ENDPOINT) {
                throw new GatewayException(GatewayErrorCode.NO_HEALTHY_ENDPOINT,
                        "Route " + route.getId() + " has no healthy endpoint");
            }
            if (!selection.isSelected()) {
                outcome = AttemptOutcome.circuitOpen(null);
            } else {
                Endpoint endpoint = selection.getEndpoint();
                context.setLastEndpointId(endpoint.getId());
                EndpointCircuitBreaker breaker = circuitBreakers.forEndpoint(endpoint);
                Optional<CircuitPermit> permit = breaker.tryAcquire();
                if (permit.isEmpty()) {
                    outcome = AttemptOutcome.circuitOpen(endpoint.getId());
                } else {
                    Duration attemptTimeout = min(timeouts.getRequestTimeout(), remaining);
                    eventPublisher.publishEvent(new AttemptStartedEvent(route.getId(), endpoint.getId(), attempt + 1));
                    exchange = forwarder.forward(endpoint, effective, context, attemptTimeout, timeouts.getConnectTimeout());
                    outcome = exchange.getOutcome();
                    recordVerdict(breaker, permit.get(), outcome);
                }
            }
            eventPublisher.publishEvent(new AttemptCompletedEvent(route.getId(), attempt + 1, outcome));

            Duration delay = retry.backoff(attempt);
            boolean retryable = retry.isRetryable(outcome) && attempt < retry.getMaxRetries();
            if (retryable && !clock.instant().plus(delay).isBefore(context.getDeadline())) {
                log.debug("Route {} has no time left to retry after {}", route.getId(), outcome.getKind());
                if (exchange != null) {
                    exchange.close();
                }
                throw new GatewayException(GatewayErrorCode.GATEWAY_TIMEOUT,
                        "Route " + route.getId() + " exhausted its time budget after " + (attempt + 1) + " attempts");
            }
            if (!retryable) {
                return finish(route, outcome, exchange, attempt + 1);
            }
            if (exchange != null) {
                exchange.close();
            }
            log.debug("Retrying route {} after {} in {}ms (attempt {} of {})",
                    route.getId(), outcome.getKind(), delay.toMillis(), attempt + 2, retry.getMaxRetries() + 1);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancel();
                throw cancelled(route);
            }
        }
    }

    private BackendExchange finish(Route route, AttemptOutcome outcome, BackendExchange exchange, int attempts) {
        if (exchange != null && exchange.hasResponse()) {
            if (outcome.getKind() == AttemptOutcome.Kind.BACKEND_ERROR) {
                log.info("Route {} relaying backend status {} after {} attempts", route.getId(), outcome.getStatus(), attempts);
            }
            return exchange;
        }
        if (exchange != null) {
            exchange.close();
        }
        String suffix = " after " + attempts + " attempts on route " + route.getId();
        switch (outcome.getKind()) {
            case TIMEOUT:
                throw new GatewayException(GatewayErrorCode.GATEWAY_TIMEOUT, "Endpoint " + outcome.getEndpointId() + " timed out" + suffix);
            case CONNECTION_FAILURE:
                throw new GatewayException(GatewayErrorCode.CONNECTION_FAILURE, "Endpoint " + outcome.getEndpointId() + " unreachable" + suffix,
                        outcome.getCause());
            case CIRCUIT_OPEN:
                throw new GatewayException(GatewayErrorCode.CIRCUIT_OPEN, "All circuits open" + suffix);
            case CANCELLED:
                throw cancelled(route);
            default:
                throw new IllegalStateException("Outcome " + outcome.getKind() + " carries no response");
        }
    }

    private static void recordVerdict(EndpointCircuitBreaker breaker, CircuitPermit permit, AttemptOutcome outcome) {
        if (outcome.getKind() == AttemptOutcome.Kind.CANCELLED) {
            breaker.release(permit);
        } else if (outcome.isBreakerFailure()) {
            breaker.onFailure(permit);
        } else {
            breaker.onSuccess(permit);
        }
    }

    private ProxyRequest withReplayableBody(ProxyRequest request) {
        if (request.getBody().isRepeatable()) {
            return request;
        }
        try {
            return request.withBody(request.getBody().buffer(maxBufferedBody));
        } catch (IOException e) {
            throw new GatewayException(GatewayErrorCode.REQUEST_CANCELLED, "Failed to read request body", e);
        }
    }

    private static GatewayException cancelled(Route route) {
        return new GatewayException(GatewayErrorCode.REQUEST_CANCELLED, "Client cancelled request on route " + route.getId());
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
