package com.vpcrouter.web;

import com.vpcrouter.registry.HealthCheckSpec;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ServiceView {
    String id;
    /** Null when the service is not actively probed. */
    HealthCheckSpec healthCheck;
    @Singular
    List<EndpointView> endpoints;
}
