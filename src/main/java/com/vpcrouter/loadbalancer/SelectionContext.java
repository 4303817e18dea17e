package com.vpcrouter.loadbalancer;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpHeaders;

/**
 * Request metadata the strategies may key on.
 */
@Value
@Builder
public class SelectionContext {
    String clientAddress;
    String path;
    @Builder.Default
    HttpHeaders headers = new HttpHeaders();
}
