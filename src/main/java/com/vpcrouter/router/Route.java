package com.vpcrouter.router;

import com.vpcrouter.loadbalancer.HashKeySource;
import com.vpcrouter.loadbalancer.LoadBalancingStrategy;
import com.vpcrouter.policy.RetryPolicy;
import com.vpcrouter.policy.TimeoutPolicy;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Route definition for the gateway. Instances are immutable; a configuration change
 * publishes a new {@link RouteTable} instead of editing a route in place.
 */
@Value
@Builder(toBuilder = true)
public class Route {
    String id;
    RouteMatch match;
    @Singular
    List<Destination> destinations;
    @Builder.Default
    LoadBalancingStrategy loadBalancing = LoadBalancingStrategy.ROUND_ROBIN;
    @Builder.Default
    HashKeySource hashKey = HashKeySource.clientAddress();
    @Builder.Default
    RetryPolicy retryPolicy = RetryPolicy.defaults();
    @Builder.Default
    TimeoutPolicy timeoutPolicy = TimeoutPolicy.defaults();
}
