package com.vpcrouter.proxy;

import com.vpcrouter.circuitbreaker.CircuitBreakerConfig;
import com.vpcrouter.circuitbreaker.CircuitBreakerRegistry;
import com.vpcrouter.circuitbreaker.CircuitState;
import com.vpcrouter.error.GatewayErrorCode;
import com.vpcrouter.error.GatewayException;
import com.vpcrouter.loadbalancer.ConsistentHashRing;
import com.vpcrouter.loadbalancer.LoadBalancer;
import com.vpcrouter.policy.RetryPolicy;
import com.vpcrouter.policy.TimeoutPolicy;
import com.vpcrouter.registry.Endpoint;
import com.vpcrouter.registry.EndpointRegistry;
import com.vpcrouter.registry.HealthState;
import com.vpcrouter.router.Destination;
import com.vpcrouter.router.PathMatchKind;
import com.vpcrouter.router.Route;
import com.vpcrouter.router.RouteManager;
import com.vpcrouter.router.RouteMatch;
import com.vpcrouter.router.RouteMatcher;
import com.vpcrouter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.util.unit.DataSize;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GatewayDispatcherTest {

    private MutableClock clock;
    private EndpointRegistry registry;
    private RouteManager routeManager;
    private CircuitBreakerRegistry circuitBreakers;
    private RequestForwarder forwarder;
    private ApplicationEventPublisher events;
    private final List<Duration> sleeps = new ArrayList<>();
    private GatewayDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingNow();
        events = mock(ApplicationEventPublisher.class);
        registry = new EndpointRegistry(events);
        routeManager = new RouteManager(new RouteMatcher(), events);
        circuitBreakers = new CircuitBreakerRegistry(
                CircuitBreakerConfig.builder().failureThreshold(3).cooldown(Duration.ofMinutes(1)).build(), clock);
        forwarder = mock(RequestForwarder.class);
        BackoffSleeper sleeper = delay -> {
            sleeps.add(delay);
            clock.advance(delay);
        };
        dispatcher = new GatewayDispatcher(routeManager,
                new LoadBalancer(registry, circuitBreakers, ConsistentHashRing.DEFAULT_REPLICAS),
                circuitBreakers, forwarder, sleeper, events, clock, DataSize.ofKilobytes(64));
        registry.upsertEndpoint("orders", "10.0.0.1", 8080, true);
    }

    private Route installRoute(RetryPolicy retry, TimeoutPolicy timeouts) {
        Route route = Route.builder()
                .id("orders")
                .match(RouteMatch.builder().kind(PathMatchKind.PREFIX).path("/orders").build())
                .destination(Destination.of("orders"))
                .retryPolicy(retry)
                .timeoutPolicy(timeouts)
                .build();
        routeManager.upsertRoute(route);
        return route;
    }

    private ProxyRequest request(String path) {
        return ProxyRequest.builder().method("POST").path(path).clientAddress("192.0.2.10")
                .body(BodySource.buffered("{\"id\":1}".getBytes(StandardCharsets.UTF_8)))
                .build();
    }

    private RequestContext context(ProxyRequest request) {
        return new RequestContext(request.getMethod(), request.getPath(), request.getClientAddress(), clock.instant());
    }

    private static BackendExchange answered(int status) {
        return BackendExchange.failed(AttemptOutcome.response(status, "10.0.0.1:8080", Duration.ofMillis(5)));
    }

    private static BackendExchange refused() {
        return BackendExchange.failed(AttemptOutcome.connectionFailure("10.0.0.1:8080", Duration.ofMillis(1),
                new ConnectException("Connection refused")));
    }

    private BackendExchange dispatch(String path) {
        ProxyRequest request = request(path);
        return dispatcher.dispatch(request, context(request));
    }

    @Test
    void retriesRetryableStatusesWithExponentialBackoff() {
        installRoute(RetryPolicy.defaults(), TimeoutPolicy.defaults());
        when(forwarder.forward(any(), any(), any(), any(), any()))
                .thenReturn(answered(503), answered(503), answered(200));

        BackendExchange exchange = dispatch("/orders/42");

        assertThat(exchange.getStatus()).isEqualTo(200);
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
        verify(forwarder, times(3)).forward(any(), any(), any(), any(), any());
        verify(events, times(3)).publishEvent(any(AttemptStartedEvent.class));
    }

    @Test
    void lastBackendResponseIsRelayedOnceRetriesRunOut() {
        installRoute(RetryPolicy.defaults().toBuilder().maxRetries(1).build(), TimeoutPolicy.defaults());
        when(forwarder.forward(any(), any(), any(), any(), any()))
                .thenReturn(answered(502), answered(503));

        BackendExchange exchange = dispatch("/orders");

        assertThat(exchange.getStatus()).isEqualTo(503);
        assertThat(sleeps).containsExactly(Duration.ofMillis(100));
    }

    @Test
    void nonRetryableStatusIsReturnedImmediately() {
        installRoute(RetryPolicy.defaults(), TimeoutPolicy.defaults());
        when(forwarder.forward(any(), any(), any(), any(), any())).thenReturn(answered(500));

        BackendExchange exchange = dispatch("/orders");

        assertThat(exchange.getStatus()).isEqualTo(500);
        assertThat(sleeps).isEmpty();
        verify(forwarder, times(1)).forward(any(), any(), any(), any(), any());
    }

    @Test
    void unmatchedPathIsRouteNotFound() {
        installRoute(RetryPolicy.defaults(), TimeoutPolicy.defaults());

        assertThatThrownBy(() -> dispatch("/payments"))
                .isInstanceOf(GatewayException.class)
                .extracting(e -> ((GatewayException) e).getErrorCode())
                .isEqualTo(GatewayErrorCode.ROUTE_NOT_FOUND);
        verify(forwarder, never()).forward(any(), any(), any(), any(), any());
    }

    @Test
    void noHealthyEndpointFailsWithoutRetrying() {
        installRoute(RetryPolicy.defaults(), TimeoutPolicy.defaults());
        Endpoint endpoint = registry.lookup("orders").get(0);
        registry.markHealth(endpoint, HealthState.UNHEALTHY);

        assertThatThrownBy(() -> dispatch("/orders"))
                .isInstanceOf(GatewayException.class)
                .extracting(e -> ((GatewayException) e).getErrorCode())
                .isEqualTo(GatewayErrorCode.NO_HEALTHY_ENDPOINT);
        assertThat(sleeps).isEmpty();
        verify(forwarder, never()).forward(any(), any(), any(), any(), any());
    }

    @Test
    void connectionFailuresExhaustRetriesIntoBadGateway() {
        installRoute(RetryPolicy.defaults(), TimeoutPolicy.defaults());
        registry.upsertEndpoint("orders", "10.0.0.2", 8080, true);
        registry.upsertEndpoint("orders", "10.0.0.3", 8080, true);
        when(forwarder.forward(any(), any(), any(), any(), any())).thenAnswer(invocation -> refused());

        assertThatThrownBy(() -> dispatch("/orders"))
                .isInstanceOf(GatewayException.class)
                .extracting(e -> ((GatewayException) e).getErrorCode())
                .isEqualTo(GatewayErrorCode.CONNECTION_FAILURE);
        verify(forwarder, times(4)).forward(any(), any(), any(), any(), any());
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
    }

    @Test
    void openBreakerShortCircuitsRemainingAttempts() {
        installRoute(RetryPolicy.defaults(), TimeoutPolicy.defaults());
        when(forwarder.forward(any(), any(), any(), any(), any())).thenAnswer(invocation -> refused());

        assertThatThrownBy(() -> dispatch("/orders"))
                .isInstanceOf(GatewayException.class)
                .extracting(e -> ((GatewayException) e).getErrorCode())
                .isEqualTo(GatewayErrorCode.CIRCUIT_OPEN);
        // third failure trips the breaker; the last attempt never reaches the forwarder
        verify(forwarder, times(3)).forward(any(), any(), any(), any(), any());
        Endpoint endpoint = registry.lookup("orders").get(0);
        assertThat(circuitBreakers.stateOf(endpoint)).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void timeoutsStopAtTheOverallDeadline() {
        TimeoutPolicy timeouts = TimeoutPolicy.builder().requestTimeout(Duration.ofSeconds(1)).build();
        installRoute(RetryPolicy.defaults(), timeouts);
        registry.upsertEndpoint("orders", "10.0.0.2", 8080, true);
        registry.upsertEndpoint("orders", "10.0.0.3", 8080, true);
        registry.upsertEndpoint("orders", "10.0.0.4", 8080, true);
        List<Duration> attemptTimeouts = new ArrayList<>();
        when(forwarder.forward(any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            Duration timeout = invocation.getArgument(3);
            attemptTimeouts.add(timeout);
            clock.advance(timeout);
            return BackendExchange.failed(AttemptOutcome.timeout("10.0.0.1:8080", timeout, null));
        });

        assertThatThrownBy(() -> dispatch("/orders"))
                .isInstanceOf(GatewayException.class)
                .extracting(e -> ((GatewayException) e).getErrorCode())
                .isEqualTo(GatewayErrorCode.GATEWAY_TIMEOUT);
        assertThat(attemptTimeouts).hasSize(4).allSatisfy(t -> assertThat(t).isLessThanOrEqualTo(Duration.ofSeconds(1)));
    }

    @Test
    void retryableStatusPastTheDeadlineIsGatewayTimeout() {
        TimeoutPolicy timeouts = TimeoutPolicy.builder().requestTimeout(Duration.ofSeconds(1)).build();
        installRoute(RetryPolicy.defaults(), timeouts);
        // overall budget is 4.7s; the only attempt answers after 4.8s
        when(forwarder.forward(any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            clock.advance(Duration.ofMillis(4800));
            return answered(503);
        });

        assertThatThrownBy(() -> dispatch("/orders"))
                .isInstanceOf(GatewayException.class)
                .extracting(e -> ((GatewayException) e).getErrorCode())
                .isEqualTo(GatewayErrorCode.GATEWAY_TIMEOUT);
        verify(forwarder, times(1)).forward(any(), any(), any(), any(), any());
        assertThat(sleeps).isEmpty();
    }

    @Test
    void streamingBodyIsBufferedSoItCanBeReplayed() throws IOException {
        installRoute(RetryPolicy.defaults(), TimeoutPolicy.defaults());
        List<String> bodies = new ArrayList<>();
        when(forwarder.forward(any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            ProxyRequest sent = invocation.getArgument(1);
            bodies.add(new String(sent.getBody().open().readAllBytes(), StandardCharsets.UTF_8));
            return bodies.size() == 1 ? answered(503) : answered(200);
        });
        byte[] payload = "payload".getBytes(StandardCharsets.UTF_8);
        ProxyRequest request = ProxyRequest.builder().method("PUT").path("/orders/1")
                .body(BodySource.streaming(new ByteArrayInputStream(payload), payload.length))
                .build();

        BackendExchange exchange = dispatcher.dispatch(request, context(request));

        assertThat(exchange.getStatus()).isEqualTo(200);
        assertThat(bodies).containsExactly("payload", "payload");
    }

    @Test
    void cancelledRequestStopsBeforeTheNextAttempt() {
        installRoute(RetryPolicy.defaults(), TimeoutPolicy.defaults());
        ProxyRequest request = request("/orders");
        RequestContext context = context(request);
        when(forwarder.forward(any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            context.cancel();
            return BackendExchange.failed(AttemptOutcome.cancelled("10.0.0.1:8080", Duration.ZERO));
        });

        assertThatThrownBy(() -> dispatcher.dispatch(request, context))
                .isInstanceOf(GatewayException.class)
                .extracting(e -> ((GatewayException) e).getErrorCode())
                .isEqualTo(GatewayErrorCode.REQUEST_CANCELLED);
        verify(forwarder, times(1)).forward(any(), any(), any(), any(), any());
        Endpoint endpoint = registry.lookup("orders").get(0);
        assertThat(circuitBreakers.stateOf(endpoint)).isEqualTo(CircuitState.CLOSED);
    }
}
