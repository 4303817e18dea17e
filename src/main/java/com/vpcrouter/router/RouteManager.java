package com.vpcrouter.router;

import com.vpcrouter.error.GatewayErrorCode;
import com.vpcrouter.error.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Route manager for the gateway.
 * Owns the current {@link RouteTable}; readers grab the reference once per request and
 * writers publish a whole new generation.
 */
@Slf4j
@Component
public class RouteManager {

    private final AtomicReference<RouteTable> current = new AtomicReference<>(RouteTable.empty());
    private final Object writeLock = new Object();
    private final RouteMatcher matcher;
    private final ApplicationEventPublisher eventPublisher;

    public RouteManager(RouteMatcher matcher, ApplicationEventPublisher eventPublisher) {
        this.matcher = matcher;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Current snapshot. Callers keep it for the duration of one request.
     */
    public RouteTable snapshot() {
        return current.get();
    }

    /**
     * Find the best matching route in the current snapshot.
     */
    public Optional<Route> findRoute(RouteQuery query) {
        return matcher.match(current.get(), query);
    }

    public Optional<Route> findRouteById(String routeId) {
        return current.get().getRoutes().stream()
                .filter(r -> r.getId().equals(routeId))
                .findFirst();
    }

    public List<Route> getAllRoutes() {
        return current.get().getRoutes();
    }

    /**
     * Replace every route at once.
     */
    public RouteTable replaceRoutes(List<Route> routes) {
        synchronized (writeLock) {
            requireUniqueIds(routes);
            return publish(routes);
        }
    }

    /**
     * Add a route, or replace the route with the same id while keeping its declaration position.
     */
    public RouteTable upsertRoute(Route route) {
        synchronized (writeLock) {
            List<Route> routes = new ArrayList<>(current.get().getRoutes());
            int index = indexOf(routes, route.getId());
            if (index >= 0) {
                routes.set(index, route);
                log.info("Updated route: {}", route.getId());
            } else {
                routes.add(route);
                log.info("Added route: {} -> {}", route.getMatch().getPath(), route.getDestinations());
            }
            return publish(routes);
        }
    }

    public boolean removeRoute(String routeId) {
        synchronized (writeLock) {
            List<Route> routes = new ArrayList<>(current.get().getRoutes());
            int index = indexOf(routes, routeId);
            if (index < 0) {
                return false;
            }
            routes.remove(index);
            publish(routes);
            log.info("Removed route: {}", routeId);
            return true;
        }
    }

    private RouteTable publish(List<Route> routes) {
        RouteTable next = new RouteTable(current.get().getGeneration() + 1, routes);
        current.set(next);
        log.info("Published route table generation {} with {} routes", next.getGeneration(), next.size());
        eventPublisher.publishEvent(new RouteTableReplacedEvent(next));
        return next;
    }

    private static int indexOf(List<Route> routes, String routeId) {
        for (int i = 0; i < routes.size(); i++) {
            if (routes.get(i).getId().equals(routeId)) {
                return i;
            }
        }
        return -1;
    }

    private static void requireUniqueIds(List<Route> routes) {
        Set<String> seen = new HashSet<>();
        for (Route route : routes) {
            if (!seen.add(route.getId())) {
                throw new GatewayException(GatewayErrorCode.INVALID_CONFIGURATION, "Duplicate route id: " + route.getId());
            }
        }
    }
}
