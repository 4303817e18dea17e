package com.vpcrouter.circuitbreaker;

import lombok.Value;

/**
 * Permission to send one attempt through a breaker. Trial permits are the ones issued
 * while half-open; their verdict decides the next state.
 */
@Value
public class CircuitPermit {
    String endpointId;
    boolean trial;
    long generation;
}
