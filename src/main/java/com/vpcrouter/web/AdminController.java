package com.vpcrouter.web;

import com.vpcrouter.circuitbreaker.CircuitBreakerRegistry;
import com.vpcrouter.config.GatewayConfigurationService;
import com.vpcrouter.config.GatewayDefinitionMapper;
import com.vpcrouter.config.GatewayProperties.EndpointDefinition;
import com.vpcrouter.config.GatewayProperties.RouteDefinition;
import com.vpcrouter.config.GatewayProperties.ServiceDefinition;
import com.vpcrouter.registry.Endpoint;
import com.vpcrouter.registry.EndpointRegistry;
import com.vpcrouter.registry.ServiceEntry;
import com.vpcrouter.router.Route;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;

/**
 * Configuration and discovery feeds over REST, plus read-only views of routes and services.
 */
@RestController
@RequestMapping("/admin")
public class AdminController {

    private final GatewayConfigurationService configurationService;
    private final GatewayDefinitionMapper mapper;
    private final EndpointRegistry registry;
    private final CircuitBreakerRegistry circuitBreakers;

    public AdminController(GatewayConfigurationService configurationService,
                           GatewayDefinitionMapper mapper,
                           EndpointRegistry registry,
                           CircuitBreakerRegistry circuitBreakers) {
        this.configurationService = configurationService;
        this.mapper = mapper;
        this.registry = registry;
        this.circuitBreakers = circuitBreakers;
    }

    /** Routes in declaration order. */
    @GetMapping("/routes")
    public List<RouteDefinition> listRoutes() {
        return configurationService.listRoutes().stream().map(mapper::toDefinition).toList();
    }

    @PutMapping("/routes")
    public List<RouteDefinition> replaceRoutes(@RequestBody List<RouteDefinition> routes) {
        return configurationService.replaceRoutes(routes).getRoutes().stream().map(mapper::toDefinition).toList();
    }

    @PutMapping("/routes/{routeId}")
    public RouteDefinition upsertRoute(@PathVariable String routeId, @RequestBody RouteDefinition route) {
        route.setId(routeId);
        Route applied = configurationService.upsertRoute(route);
        return mapper.toDefinition(applied);
    }

    @DeleteMapping("/routes/{routeId}")
    public ResponseEntity<Void> removeRoute(@PathVariable String routeId) {
        return configurationService.removeRoute(routeId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/services")
    public List<ServiceView> listServices() {
        return registry.listServices().stream()
                .sorted(Comparator.comparing(ServiceEntry::getServiceId))
                .map(this::toView)
                .toList();
    }

    @GetMapping("/services/{serviceId}")
    public ResponseEntity<ServiceView> getService(@PathVariable String serviceId) {
        return registry.findService(serviceId)
                .map(entry -> ResponseEntity.ok(toView(entry)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/services/{serviceId}")
    public ServiceView upsertService(@PathVariable String serviceId, @RequestBody ServiceDefinition service) {
        service.setId(serviceId);
        return toView(configurationService.upsertService(service));
    }

    @DeleteMapping("/services/{serviceId}")
    public ResponseEntity<Void> removeService(@PathVariable String serviceId) {
        return configurationService.removeService(serviceId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/services/{serviceId}/endpoints")
    public List<EndpointView> listEndpoints(@PathVariable String serviceId) {
        return registry.lookup(serviceId).stream().map(this::toView).toList();
    }

    @PostMapping("/services/{serviceId}/endpoints")
    public EndpointView upsertEndpoint(@PathVariable String serviceId, @RequestBody EndpointDefinition endpoint) {
        return toView(configurationService.upsertEndpoint(serviceId, endpoint));
    }

    @DeleteMapping("/services/{serviceId}/endpoints/{host}/{port}")
    public ResponseEntity<Void> removeEndpoint(@PathVariable String serviceId,
                                               @PathVariable String host,
                                               @PathVariable int port) {
        return configurationService.removeEndpoint(serviceId, host, port)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    private ServiceView toView(ServiceEntry entry) {
        return ServiceView.builder()
                .id(entry.getServiceId())
                .healthCheck(entry.healthCheck().orElse(null))
                .endpoints(entry.getEndpoints().stream().map(this::toView).toList())
                .build();
    }

    private EndpointView toView(Endpoint endpoint) {
        return EndpointView.builder()
                .id(endpoint.getId())
                .serviceId(endpoint.getServiceId())
                .host(endpoint.getHost())
                .port(endpoint.getPort())
                .health(endpoint.getHealth())
                .activeConnections(endpoint.getActiveConnections())
                .circuit(circuitBreakers.stateOf(endpoint))
                .build();
    }
}
