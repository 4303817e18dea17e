package com.vpcrouter.registry;

import lombok.Value;

@Value
public class EndpointRemovedEvent {
    Endpoint endpoint;
}
