package com.vpcrouter.config;

import com.vpcrouter.config.GatewayProperties.EndpointDefinition;
import com.vpcrouter.config.GatewayProperties.RouteDefinition;
import com.vpcrouter.config.GatewayProperties.ServiceDefinition;
import com.vpcrouter.error.GatewayErrorCode;
import com.vpcrouter.error.GatewayException;
import com.vpcrouter.registry.Endpoint;
import com.vpcrouter.registry.EndpointRegistry;
import com.vpcrouter.registry.HealthCheckSpec;
import com.vpcrouter.registry.ServiceEntry;
import com.vpcrouter.router.Route;
import com.vpcrouter.router.RouteManager;
import com.vpcrouter.router.RouteTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration feed: applies route and service definitions to the route table and the
 * registry. Definitions are validated in full before anything is changed.
 */
@Slf4j
@Service
public class GatewayConfigurationService {

    private final GatewayProperties properties;
    private final GatewayDefinitionMapper mapper;
    private final RouteManager routeManager;
    private final EndpointRegistry registry;

    public GatewayConfigurationService(GatewayProperties properties,
                                       GatewayDefinitionMapper mapper,
                                       RouteManager routeManager,
                                       EndpointRegistry registry) {
        this.properties = properties;
        this.mapper = mapper;
        this.routeManager = routeManager;
        this.registry = registry;
    }

    /**
     * Apply {@code gateway.services} and {@code gateway.routes} once every listener is in
     * place and before the instance reports ready.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void loadStartupConfiguration() {
        properties.getServices().forEach(this::upsertService);
        RouteTable table = replaceRoutes(properties.getRoutes());
        log.info("Loaded {} services and {} routes from configuration", properties.getServices().size(), table.size());
    }

    public RouteTable replaceRoutes(List<RouteDefinition> definitions) {
        return routeManager.replaceRoutes(mapper.toRoutes(definitions));
    }

    public Route upsertRoute(RouteDefinition definition) {
        Route route = mapper.toRoute(definition);
        routeManager.upsertRoute(route);
        return route;
    }

    public boolean removeRoute(String routeId) {
        return routeManager.removeRoute(routeId);
    }

    public List<Route> listRoutes() {
        return routeManager.getAllRoutes();
    }

    /**
     * Create or update a service. A definition that lists endpoints makes that list the
     * service's full endpoint set; one without leaves endpoints to discovery.
     */
    public ServiceEntry upsertService(ServiceDefinition definition) {
        if (definition == null || definition.getId() == null || definition.getId().isBlank()) {
            throw new GatewayException(GatewayErrorCode.INVALID_CONFIGURATION, "Service id is required");
        }
        String serviceId = definition.getId();
        HealthCheckSpec healthCheck = mapper.toHealthCheck(serviceId, definition.getHealthCheck());
        if (definition.getEndpoints() != null) {
            definition.getEndpoints().forEach(endpoint -> validate(serviceId, endpoint));
        }
        ServiceEntry entry = registry.upsertService(serviceId, healthCheck);
        if (definition.getEndpoints() != null) {
            Set<String> wanted = new HashSet<>();
            for (EndpointDefinition endpoint : definition.getEndpoints()) {
                Endpoint registered = registry.upsertEndpoint(serviceId, endpoint.getHost(), endpoint.getPort(), endpoint.isReady());
                wanted.add(registered.getId());
            }
            for (Endpoint stale : entry.getEndpoints()) {
                if (!wanted.contains(stale.getId())) {
                    registry.removeEndpoint(serviceId, stale.getHost(), stale.getPort());
                }
            }
        }
        return entry;
    }

    public boolean removeService(String serviceId) {
        return registry.removeService(serviceId);
    }

    public Endpoint upsertEndpoint(String serviceId, EndpointDefinition definition) {
        validate(serviceId, definition);
        return registry.upsertEndpoint(serviceId, definition.getHost(), definition.getPort(), definition.isReady());
    }

    public boolean removeEndpoint(String serviceId, String host, int port) {
        return registry.removeEndpoint(serviceId, host, port);
    }

    private static void validate(String serviceId, EndpointDefinition endpoint) {
        if (endpoint == null || endpoint.getHost() == null || endpoint.getHost().isBlank()) {
            throw new GatewayException(GatewayErrorCode.INVALID_CONFIGURATION, "Endpoint of service " + serviceId + " needs a host");
        }
        if (endpoint.getPort() < 1 || endpoint.getPort() > 65535) {
            throw new GatewayException(GatewayErrorCode.INVALID_CONFIGURATION,
                    "Endpoint " + endpoint.getHost() + " of service " + serviceId + " has invalid port " + endpoint.getPort());
        }
    }
}
