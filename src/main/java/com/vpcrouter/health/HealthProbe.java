package com.vpcrouter.health;

import com.vpcrouter.registry.Endpoint;
import com.vpcrouter.registry.HealthCheckSpec;

/**
 * One active check against one endpoint.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * @return true when the endpoint answered as healthy within the health-check timeout
     */
    boolean probe(Endpoint endpoint, HealthCheckSpec spec);
}
