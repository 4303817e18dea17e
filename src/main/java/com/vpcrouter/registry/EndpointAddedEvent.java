package com.vpcrouter.registry;

import lombok.Value;

@Value
public class EndpointAddedEvent {
    Endpoint endpoint;
}
