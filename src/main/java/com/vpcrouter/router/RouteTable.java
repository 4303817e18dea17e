package com.vpcrouter.router;

import lombok.Value;

import java.util.List;

/**
 * One generation of the configured routes, in declaration order.
 */
@Value
public class RouteTable {
    long generation;
    List<Route> routes;

    public RouteTable(long generation, List<Route> routes) {
        this.generation = generation;
        this.routes = List.copyOf(routes);
    }

    public static RouteTable empty() {
        return new RouteTable(0, List.of());
    }

    public int size() {
        return routes.size();
    }
}
