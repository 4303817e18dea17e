package com.vpcrouter.web;

import com.vpcrouter.circuitbreaker.CircuitState;
import com.vpcrouter.registry.HealthState;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EndpointView {
    String id;
    String serviceId;
    String host;
    int port;
    HealthState health;
    int activeConnections;
    CircuitState circuit;
}
