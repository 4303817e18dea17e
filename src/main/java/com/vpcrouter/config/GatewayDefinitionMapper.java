package com.vpcrouter.config;

import com.vpcrouter.config.GatewayProperties.DestinationDefinition;
import com.vpcrouter.config.GatewayProperties.HashKeyDefinition;
import com.vpcrouter.config.GatewayProperties.HealthCheckDefinition;
import com.vpcrouter.config.GatewayProperties.MatchDefinition;
import com.vpcrouter.config.GatewayProperties.RetryDefinition;
import com.vpcrouter.config.GatewayProperties.RouteDefinition;
import com.vpcrouter.config.GatewayProperties.TimeoutDefinition;
import com.vpcrouter.error.GatewayErrorCode;
import com.vpcrouter.error.GatewayException;
import com.vpcrouter.loadbalancer.HashKeySource;
import com.vpcrouter.loadbalancer.LoadBalancingStrategy;
import com.vpcrouter.policy.RetryPolicy;
import com.vpcrouter.policy.TimeoutPolicy;
import com.vpcrouter.registry.HealthCheckSpec;
import com.vpcrouter.router.Destination;
import com.vpcrouter.router.PathMatchKind;
import com.vpcrouter.router.Route;
import com.vpcrouter.router.RouteMatch;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Validates configuration definitions and turns them into the immutable routing model, and back.
 */
@Component
public class GatewayDefinitionMapper {

    public Route toRoute(RouteDefinition definition) {
        require(definition != null, "Route definition is missing");
        require(notBlank(definition.getId()), "Route id is required");
        String id = definition.getId();
        MatchDefinition match = definition.getMatch();
        require(match != null && notBlank(match.getPath()), "Route " + id + " needs a match path");
        require(match.getPath().startsWith("/"), "Route " + id + " path must start with '/'");
        require(definition.getDestinations() != null && !definition.getDestinations().isEmpty(),
                "Route " + id + " needs at least one destination");

        RouteMatch.RouteMatchBuilder matchBuilder = RouteMatch.builder()
                .kind(parse(() -> PathMatchKind.fromValue(match.getKind()), "Route " + id + " has unknown match kind " + match.getKind()))
                .path(match.getPath());
        if (match.getMethods() != null) {
            match.getMethods().forEach(method -> matchBuilder.method(method.trim().toUpperCase(Locale.ROOT)));
        }
        if (match.getHeaders() != null) {
            matchBuilder.headers(match.getHeaders());
        }
        if (match.getQueryParams() != null) {
            matchBuilder.queryParams(match.getQueryParams());
        }

        Route.RouteBuilder builder = Route.builder()
                .id(id)
                .match(matchBuilder.build())
                .loadBalancing(parse(() -> LoadBalancingStrategy.fromValue(definition.getLoadBalancing()),
                        "Route " + id + " has unknown load balancing " + definition.getLoadBalancing()));
        for (DestinationDefinition destination : definition.getDestinations()) {
            require(destination != null && notBlank(destination.getService()), "Route " + id + " has a destination without service");
            int weight = destination.getWeight() == null ? Destination.DEFAULT_WEIGHT : destination.getWeight();
            require(weight > 0, "Route " + id + " destination " + destination.getService() + " needs a positive weight");
            builder.destination(new Destination(destination.getService(), weight));
        }
        HashKeyDefinition hashKey = definition.getHashKey();
        if (hashKey != null) {
            HashKeySource source = parse(() -> HashKeySource.of(hashKey.getType(), hashKey.getHeader()),
                    "Route " + id + " has unknown hash key type " + hashKey.getType());
            require(source.getType() != HashKeySource.Type.HEADER || notBlank(source.getHeaderName()),
                    "Route " + id + " hashes on a header but names none");
            builder.hashKey(source);
        }
        builder.retryPolicy(toRetryPolicy(id, definition.getRetry()));
        builder.timeoutPolicy(toTimeoutPolicy(id, definition.getTimeout()));
        return builder.build();
    }

    public List<Route> toRoutes(List<RouteDefinition> definitions) {
        List<Route> routes = new ArrayList<>();
        if (definitions != null) {
            definitions.forEach(definition -> routes.add(toRoute(definition)));
        }
        return routes;
    }

    /**
     * Null when the definition asks for no active health checking.
     */
    public HealthCheckSpec toHealthCheck(String serviceId, HealthCheckDefinition definition) {
        if (definition == null) {
            return null;
        }
        HealthCheckSpec.HealthCheckSpecBuilder builder = HealthCheckSpec.defaults().toBuilder();
        if (notBlank(definition.getPath())) {
            builder.path(definition.getPath());
        }
        if (definition.getInterval() != null) {
            require(isPositive(definition.getInterval()), "Service " + serviceId + " health-check interval must be positive");
            builder.interval(definition.getInterval());
        }
        if (definition.getTimeout() != null) {
            require(isPositive(definition.getTimeout()), "Service " + serviceId + " health-check timeout must be positive");
            builder.timeout(definition.getTimeout());
        }
        if (definition.getUnhealthyThreshold() != null) {
            require(definition.getUnhealthyThreshold() > 0, "Service " + serviceId + " unhealthy threshold must be positive");
            builder.unhealthyThreshold(definition.getUnhealthyThreshold());
        }
        if (definition.getHealthyThreshold() != null) {
            require(definition.getHealthyThreshold() > 0, "Service " + serviceId + " healthy threshold must be positive");
            builder.healthyThreshold(definition.getHealthyThreshold());
        }
        return builder.build();
    }

    public RouteDefinition toDefinition(Route route) {
        RouteDefinition definition = new RouteDefinition();
        definition.setId(route.getId());
        MatchDefinition match = new MatchDefinition();
        match.setKind(route.getMatch().getKind().name().toLowerCase(Locale.ROOT));
        match.setPath(route.getMatch().getPath());
        match.setMethods(new ArrayList<>(route.getMatch().getMethods()));
        match.setHeaders(new LinkedHashMap<>(route.getMatch().getHeaders()));
        match.setQueryParams(new LinkedHashMap<>(route.getMatch().getQueryParams()));
        definition.setMatch(match);
        for (Destination destination : route.getDestinations()) {
            DestinationDefinition d = new DestinationDefinition();
            d.setService(destination.getServiceId());
            d.setWeight(destination.getWeight());
            definition.getDestinations().add(d);
        }
        definition.setLoadBalancing(kebab(route.getLoadBalancing().name()));
        HashKeyDefinition hashKey = new HashKeyDefinition();
        hashKey.setType(kebab(route.getHashKey().getType().name()));
        hashKey.setHeader(route.getHashKey().getHeaderName());
        definition.setHashKey(hashKey);

        RetryPolicy retry = route.getRetryPolicy();
        RetryDefinition r = new RetryDefinition();
        r.setMaxRetries(retry.getMaxRetries());
        r.setRetryableStatuses(retry.getRetryableStatuses().stream().sorted().toList());
        r.setRetryOnTimeout(retry.isRetryOnTimeout());
        r.setRetryOnConnectionFailure(retry.isRetryOnConnectionFailure());
        r.setInitialBackoff(retry.getInitialBackoff());
        r.setMaxBackoff(retry.getMaxBackoff());
        definition.setRetry(r);

        TimeoutDefinition t = new TimeoutDefinition();
        t.setRequest(route.getTimeoutPolicy().getRequestTimeout());
        t.setConnect(route.getTimeoutPolicy().getConnectTimeout());
        definition.setTimeout(t);
        return definition;
    }

    private RetryPolicy toRetryPolicy(String routeId, RetryDefinition definition) {
        if (definition == null) {
            return RetryPolicy.defaults();
        }
        RetryPolicy.RetryPolicyBuilder builder = RetryPolicy.defaults().toBuilder();
        if (definition.getMaxRetries() != null) {
            require(definition.getMaxRetries() >= 0, "Route " + routeId + " max retries cannot be negative");
            builder.maxRetries(definition.getMaxRetries());
        }
        if (definition.getRetryableStatuses() != null) {
            builder.clearRetryableStatuses().retryableStatuses(definition.getRetryableStatuses());
        }
        if (definition.getRetryOnTimeout() != null) {
            builder.retryOnTimeout(definition.getRetryOnTimeout());
        }
        if (definition.getRetryOnConnectionFailure() != null) {
            builder.retryOnConnectionFailure(definition.getRetryOnConnectionFailure());
        }
        if (definition.getInitialBackoff() != null) {
            require(!definition.getInitialBackoff().isNegative(), "Route " + routeId + " initial backoff cannot be negative");
            builder.initialBackoff(definition.getInitialBackoff());
        }
        if (definition.getMaxBackoff() != null) {
            require(!definition.getMaxBackoff().isNegative(), "Route " + routeId + " max backoff cannot be negative");
            builder.maxBackoff(definition.getMaxBackoff());
        }
        return builder.build();
    }

    private TimeoutPolicy toTimeoutPolicy(String routeId, TimeoutDefinition definition) {
        TimeoutPolicy.TimeoutPolicyBuilder builder = TimeoutPolicy.builder();
        if (definition != null && definition.getRequest() != null) {
            require(isPositive(definition.getRequest()), "Route " + routeId + " request timeout must be positive");
            builder.requestTimeout(definition.getRequest());
        }
        if (definition != null && definition.getConnect() != null) {
            require(isPositive(definition.getConnect()), "Route " + routeId + " connect timeout must be positive");
            builder.connectTimeout(definition.getConnect());
        }
        return builder.build();
    }

    private static <T> T parse(Supplier<T> parser, String message) {
        try {
            return parser.get();
        } catch (IllegalArgumentException e) {
            throw new GatewayException(GatewayErrorCode.INVALID_CONFIGURATION, message, e);
        }
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new GatewayException(GatewayErrorCode.INVALID_CONFIGURATION, message);
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }

    private static String kebab(String enumName) {
        return enumName.toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
