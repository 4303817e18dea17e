package com.vpcrouter.loadbalancer;

import com.vpcrouter.circuitbreaker.CircuitBreakerConfig;
import com.vpcrouter.circuitbreaker.CircuitBreakerRegistry;
import com.vpcrouter.circuitbreaker.CircuitPermit;
import com.vpcrouter.circuitbreaker.EndpointCircuitBreaker;
import com.vpcrouter.registry.ConnectionLease;
import com.vpcrouter.registry.Endpoint;
import com.vpcrouter.registry.EndpointRegistry;
import com.vpcrouter.registry.HealthState;
import com.vpcrouter.router.Destination;
import com.vpcrouter.router.PathMatchKind;
import com.vpcrouter.router.Route;
import com.vpcrouter.router.RouteMatch;
import com.vpcrouter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpHeaders;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class LoadBalancerTest {

    private EndpointRegistry registry;
    private CircuitBreakerRegistry circuitBreakers;
    private LoadBalancer loadBalancer;
    private List<Endpoint> endpoints;

    @BeforeEach
    void setUp() {
        registry = new EndpointRegistry(mock(ApplicationEventPublisher.class));
        circuitBreakers = new CircuitBreakerRegistry(
                CircuitBreakerConfig.builder().failureThreshold(1).cooldown(Duration.ofMinutes(1)).build(),
                MutableClock.startingNow());
        loadBalancer = new LoadBalancer(registry, circuitBreakers, ConsistentHashRing.DEFAULT_REPLICAS);
        endpoints = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            endpoints.add(registry.upsertEndpoint("orders", "10.0.0." + i, 8080, true));
        }
    }

    private static Route route(LoadBalancingStrategy strategy) {
        return Route.builder()
                .id("orders-" + strategy)
                .match(RouteMatch.builder().kind(PathMatchKind.PREFIX).path("/orders").build())
                .destination(Destination.of("orders"))
                .loadBalancing(strategy)
                .build();
    }

    private static SelectionContext from(String clientAddress) {
        return SelectionContext.builder().clientAddress(clientAddress).path("/orders").build();
    }

    @Test
    void roundRobinVisitsEachEndpointOncePerCycle() {
        Route route = route(LoadBalancingStrategy.ROUND_ROBIN);

        for (int cycle = 0; cycle < 5; cycle++) {
            Set<Endpoint> seen = new HashSet<>();
            for (int i = 0; i < endpoints.size(); i++) {
                seen.add(loadBalancer.select(route, from("1.1.1.1")).getEndpoint());
            }
            assertThat(seen).containsExactlyInAnyOrderElementsOf(endpoints);
        }
    }

    @Test
    void leastConnectionsPicksMinimumActiveCount() {
        Route route = route(LoadBalancingStrategy.LEAST_CONNECTIONS);
        List<ConnectionLease> leases = new ArrayList<>();
        leases.add(endpoints.get(0).acquireConnection());
        leases.add(endpoints.get(0).acquireConnection());
        leases.add(endpoints.get(1).acquireConnection());
        leases.add(endpoints.get(3).acquireConnection());

        assertThat(loadBalancer.select(route, from("1.1.1.1")).getEndpoint()).isSameAs(endpoints.get(2));

        for (int i = 0; i < 20; i++) {
            Endpoint chosen = loadBalancer.select(route, from("1.1.1.1")).getEndpoint();
            for (Endpoint other : endpoints) {
                assertThat(chosen.getActiveConnections()).isLessThanOrEqualTo(other.getActiveConnections());
            }
            leases.add(chosen.acquireConnection());
        }
        leases.forEach(ConnectionLease::release);
    }

    @Test
    void leastConnectionsTieGoesToEarliestEndpoint() {
        Route route = route(LoadBalancingStrategy.LEAST_CONNECTIONS);

        assertThat(loadBalancer.select(route, from("1.1.1.1")).getEndpoint()).isSameAs(endpoints.get(0));
    }

    @Test
    void sourceIpHashIsSticky() {
        Route route = route(LoadBalancingStrategy.SOURCE_IP_HASH);

        for (int client = 0; client < 50; client++) {
            String address = "192.168.1." + client;
            Endpoint first = loadBalancer.select(route, from(address)).getEndpoint();
            for (int repeat = 0; repeat < 5; repeat++) {
                assertThat(loadBalancer.select(route, from(address)).getEndpoint()).isSameAs(first);
            }
        }
    }

    @Test
    void consistentHashKeysOnConfiguredHeader() {
        Route route = route(LoadBalancingStrategy.CONSISTENT_HASH).toBuilder()
                .hashKey(HashKeySource.header("X-User"))
                .build();
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-User", "alice");

        Endpoint fromA = loadBalancer.select(route, SelectionContext.builder().clientAddress("1.1.1.1").headers(headers).build()).getEndpoint();
        Endpoint fromB = loadBalancer.select(route, SelectionContext.builder().clientAddress("2.2.2.2").headers(headers).build()).getEndpoint();

        assertThat(fromB).isSameAs(fromA);
    }

    @Test
    void unhealthyEndpointsAreNeverSelected() {
        Route route = route(LoadBalancingStrategy.ROUND_ROBIN);
        registry.markHealth(endpoints.get(1), HealthState.UNHEALTHY);
        registry.markHealth(endpoints.get(2), HealthState.UNHEALTHY);

        for (int i = 0; i < 20; i++) {
            SelectionResult result = loadBalancer.select(route, from("1.1.1.1"));
            assertThat(result.getCandidateCount()).isEqualTo(2);
            assertThat(result.getEndpoint()).isIn(endpoints.get(0), endpoints.get(3));
        }
    }

    @Test
    void noHealthyEndpointWhenAllAreDown() {
        endpoints.forEach(endpoint -> registry.markHealth(endpoint, HealthState.UNHEALTHY));

        SelectionResult result = loadBalancer.select(route(LoadBalancingStrategy.ROUND_ROBIN), from("1.1.1.1"));

        assertThat(result.getStatus()).isEqualTo(SelectionResult.Status.NO_HEALTHY_ENDPOINT);
        assertThat(result.isSelected()).isFalse();
    }

    @Test
    void openCircuitsAreFilteredAndReportedSeparately() {
        Route route = route(LoadBalancingStrategy.ROUND_ROBIN);
        trip(endpoints.get(0));

        for (int i = 0; i < 12; i++) {
            assertThat(loadBalancer.select(route, from("1.1.1.1")).getEndpoint()).isNotSameAs(endpoints.get(0));
        }

        endpoints.subList(1, endpoints.size()).forEach(this::trip);
        SelectionResult result = loadBalancer.select(route, from("1.1.1.1"));
        assertThat(result.getStatus()).isEqualTo(SelectionResult.Status.ALL_CIRCUITS_OPEN);
    }

    @Test
    void unknownDestinationServiceYieldsNoHealthyEndpoint() {
        Route route = Route.builder()
                .id("ghost")
                .match(RouteMatch.builder().kind(PathMatchKind.PREFIX).path("/ghost").build())
                .destination(Destination.of("ghost"))
                .build();

        assertThat(loadBalancer.select(route, from("1.1.1.1")).getStatus())
                .isEqualTo(SelectionResult.Status.NO_HEALTHY_ENDPOINT);
    }

    private void trip(Endpoint endpoint) {
        EndpointCircuitBreaker breaker = circuitBreakers.forEndpoint(endpoint);
        CircuitPermit permit = breaker.tryAcquire().orElseThrow();
        breaker.onFailure(permit);
    }
}
