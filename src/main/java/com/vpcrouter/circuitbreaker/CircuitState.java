package com.vpcrouter.circuitbreaker;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
