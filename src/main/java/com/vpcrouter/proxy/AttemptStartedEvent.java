package com.vpcrouter.proxy;

import lombok.Value;

@Value
public class AttemptStartedEvent {
    String routeId;
    String endpointId;
    int attempt;
}
