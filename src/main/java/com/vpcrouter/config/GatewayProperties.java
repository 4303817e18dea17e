package com.vpcrouter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes and services declared under {@code gateway.*}, applied at startup. The same
 * definition classes are the bodies of the admin API.
 */
@Data
@Component
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private List<RouteDefinition> routes = new ArrayList<>();
    private List<ServiceDefinition> services = new ArrayList<>();

    @Data
    public static class RouteDefinition {
        private String id;
        private MatchDefinition match = new MatchDefinition();
        private List<DestinationDefinition> destinations = new ArrayList<>();
        /** round-robin, least-connections, source-ip-hash or consistent-hash */
        private String loadBalancing;
        private HashKeyDefinition hashKey;
        private RetryDefinition retry;
        private TimeoutDefinition timeout;
    }

    @Data
    public static class MatchDefinition {
        /** exact, prefix or wildcard */
        private String kind;
        private String path;
        private List<String> methods = new ArrayList<>();
        private Map<String, String> headers = new LinkedHashMap<>();
        private Map<String, String> queryParams = new LinkedHashMap<>();
    }

    @Data
    public static class DestinationDefinition {
        private String service;
        private Integer weight;
    }

    @Data
    public static class HashKeyDefinition {
        /** path, header or client-address */
        private String type;
        private String header;
    }

    @Data
    public static class RetryDefinition {
        private Integer maxRetries;
        private List<Integer> retryableStatuses;
        private Boolean retryOnTimeout;
        private Boolean retryOnConnectionFailure;
        private Duration initialBackoff;
        private Duration maxBackoff;
    }

    @Data
    public static class TimeoutDefinition {
        private Duration request;
        private Duration connect;
    }

    @Data
    public static class ServiceDefinition {
        private String id;
        private HealthCheckDefinition healthCheck;
        /** Static endpoints; null leaves the service's endpoints to discovery. */
        private List<EndpointDefinition> endpoints;
    }

    @Data
    public static class HealthCheckDefinition {
        private String path;
        private Duration interval;
        private Duration timeout;
        private Integer unhealthyThreshold;
        private Integer healthyThreshold;
    }

    @Data
    public static class EndpointDefinition {
        private String host;
        private int port;
        private boolean ready = true;
    }
}
