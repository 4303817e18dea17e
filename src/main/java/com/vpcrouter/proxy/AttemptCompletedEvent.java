package com.vpcrouter.proxy;

import lombok.Value;

@Value
public class AttemptCompletedEvent {
    String routeId;
    int attempt;
    AttemptOutcome outcome;
}
