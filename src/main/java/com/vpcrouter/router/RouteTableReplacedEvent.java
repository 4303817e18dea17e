package com.vpcrouter.router;

import lombok.Value;

/**
 * Published after a new route table generation becomes visible.
 */
@Value
public class RouteTableReplacedEvent {
    RouteTable table;
}
