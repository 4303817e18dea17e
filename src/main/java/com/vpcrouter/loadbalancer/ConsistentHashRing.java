package com.vpcrouter.loadbalancer;

import com.vpcrouter.registry.Endpoint;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Hash ring with a fixed number of virtual points per endpoint. A key belongs to the first
 * point at or after its hash, wrapping around; adding or removing an endpoint only moves the
 * keys its own points cover.
 */
public class ConsistentHashRing {

    public static final int DEFAULT_REPLICAS = 100;

    private final NavigableMap<Long, Endpoint> ring = new TreeMap<>();
    @Getter
    private final List<Endpoint> members;

    public ConsistentHashRing(List<Endpoint> endpoints, int replicas) {
        this.members = List.copyOf(endpoints);
        for (Endpoint endpoint : endpoints) {
            for (int replica = 0; replica < replicas; replica++) {
                // on collision the earlier endpoint keeps the point
                ring.putIfAbsent(HashFunctions.ringHash(endpoint.getId() + ":" + replica), endpoint);
            }
        }
    }

    public Endpoint locate(String key) {
        if (ring.isEmpty()) {
            return null;
        }
        Map.Entry<Long, Endpoint> entry = ring.ceilingEntry(HashFunctions.ringHash(key));
        return entry != null ? entry.getValue() : ring.firstEntry().getValue();
    }

    boolean isBuiltFrom(List<Endpoint> endpoints) {
        if (endpoints.size() != members.size()) {
            return false;
        }
        for (int i = 0; i < endpoints.size(); i++) {
            if (endpoints.get(i) != members.get(i)) {
                return false;
            }
        }
        return true;
    }
}
