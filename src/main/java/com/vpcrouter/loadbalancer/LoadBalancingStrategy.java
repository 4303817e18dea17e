package com.vpcrouter.loadbalancer;

import java.util.Locale;

public enum LoadBalancingStrategy {
    ROUND_ROBIN,
    LEAST_CONNECTIONS,
    SOURCE_IP_HASH,
    CONSISTENT_HASH;

    /**
     * Accepts enum names as well as the kebab-case spelling used in configuration,
     * e.g. {@code least-connections}; {@code source-ip} is an alias of {@link #SOURCE_IP_HASH}.
     */
    public static LoadBalancingStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ROUND_ROBIN;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        if (normalized.equals("SOURCE_IP")) {
            return SOURCE_IP_HASH;
        }
        return LoadBalancingStrategy.valueOf(normalized);
    }
}
