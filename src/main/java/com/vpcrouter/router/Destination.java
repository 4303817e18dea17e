package com.vpcrouter.router;

import lombok.Value;

/**
 * A service a route sends traffic to. The weight is carried through configuration
 * but selection currently treats all destinations of a route equally.
 */
@Value
public class Destination {
    public static final int DEFAULT_WEIGHT = 100;

    String serviceId;
    int weight;

    public static Destination of(String serviceId) {
        return new Destination(serviceId, DEFAULT_WEIGHT);
    }
}
