package com.vpcrouter.loadbalancer;

import com.vpcrouter.circuitbreaker.CircuitBreakerRegistry;
import com.vpcrouter.registry.Endpoint;
import com.vpcrouter.registry.EndpointRegistry;
import com.vpcrouter.router.Destination;
import com.vpcrouter.router.Route;
import com.vpcrouter.router.RouteTableReplacedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Picks one endpoint for a route.
 *
 * <p>Candidates are the endpoints of every destination service, in destination order and then
 * registration order, narrowed to healthy endpoints whose breaker would admit a call. The
 * route's strategy then chooses among them. Counters and hash rings are kept per route id.
 */
@Slf4j
@Component
public class LoadBalancer {

    private final EndpointRegistry registry;
    private final CircuitBreakerRegistry circuitBreakers;
    private final int ringReplicas;
    private final Map<String, RouteBalancerState> states = new ConcurrentHashMap<>();

    public LoadBalancer(EndpointRegistry registry,
                        CircuitBreakerRegistry circuitBreakers,
                        @Value("${gateway.load-balancer.ring-replicas:100}") int ringReplicas) {
        this.registry = registry;
        this.circuitBreakers = circuitBreakers;
        this.ringReplicas = ringReplicas;
    }

    /**
     * Resolve, filter and choose in one step.
     */
    public SelectionResult select(Route route, SelectionContext context) {
        List<Endpoint> healthy = new ArrayList<>();
        for (Destination destination : route.getDestinations()) {
            for (Endpoint endpoint : registry.lookup(destination.getServiceId())) {
                if (endpoint.isHealthy()) {
                    healthy.add(endpoint);
                }
            }
        }
        if (healthy.isEmpty()) {
            log.debug("Route {} has no healthy endpoint", route.getId());
            return SelectionResult.noHealthyEndpoint();
        }
        List<Endpoint> candidates = new ArrayList<>(healthy.size());
        for (Endpoint endpoint : healthy) {
            if (circuitBreakers.forEndpoint(endpoint).isCallPermitted()) {
                candidates.add(endpoint);
            }
        }
        if (candidates.isEmpty()) {
            log.debug("Route {} has {} healthy endpoints, all with open circuits", route.getId(), healthy.size());
            return SelectionResult.allCircuitsOpen();
        }
        Endpoint chosen = choose(route, candidates, context);
        log.debug("Route {} selected {} out of {} candidates ({})", route.getId(), chosen, candidates.size(), route.getLoadBalancing());
        return SelectionResult.selected(chosen, candidates.size());
    }

    /**
     * Apply the route's strategy to an already filtered, non-empty candidate list.
     */
    public Endpoint choose(Route route, List<Endpoint> candidates, SelectionContext context) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidates for route " + route.getId());
        }
        RouteBalancerState state = states.computeIfAbsent(route.getId(), id -> new RouteBalancerState());
        return switch (route.getLoadBalancing()) {
            case ROUND_ROBIN -> roundRobin(state, candidates);
            case LEAST_CONNECTIONS -> leastConnections(candidates);
            case SOURCE_IP_HASH -> sourceIpHash(candidates, context.getClientAddress());
            case CONSISTENT_HASH -> consistentHash(state, candidates, route.getHashKey().resolve(context));
        };
    }

    private static Endpoint roundRobin(RouteBalancerState state, List<Endpoint> candidates) {
        long ticket = state.counter.getAndIncrement();
        return candidates.get((int) Math.floorMod(ticket, (long) candidates.size()));
    }

    // earliest index wins ties
    private static Endpoint leastConnections(List<Endpoint> candidates) {
        Endpoint best = candidates.get(0);
        int bestCount = best.getActiveConnections();
        for (int i = 1; i < candidates.size(); i++) {
            Endpoint endpoint = candidates.get(i);
            int count = endpoint.getActiveConnections();
            if (count < bestCount) {
                best = endpoint;
                bestCount = count;
            }
        }
        return best;
    }

    private static Endpoint sourceIpHash(List<Endpoint> candidates, String clientAddress) {
        long hash = HashFunctions.fnv1a(clientAddress == null ? "" : clientAddress);
        return candidates.get((int) Long.remainderUnsigned(hash, candidates.size()));
    }

    private Endpoint consistentHash(RouteBalancerState state, List<Endpoint> candidates, String key) {
        ConsistentHashRing ring = state.ring.get();
        if (ring == null || !ring.isBuiltFrom(candidates)) {
            ring = new ConsistentHashRing(candidates, ringReplicas);
            state.ring.set(ring);
        }
        return ring.locate(key == null ? "" : key);
    }

    @EventListener
    public void onRouteTableReplaced(RouteTableReplacedEvent event) {
        Set<String> live = event.getTable().getRoutes().stream()
                .map(Route::getId)
                .collect(Collectors.toSet());
        states.keySet().retainAll(live);
    }

    private static final class RouteBalancerState {
        private final AtomicLong counter = new AtomicLong();
        private final AtomicReference<ConsistentHashRing> ring = new AtomicReference<>();
    }
}
