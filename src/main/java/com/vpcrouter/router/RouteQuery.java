package com.vpcrouter.router;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/**
 * The parts of an inbound request the matcher looks at.
 */
@Value
@Builder
public class RouteQuery {
    String method;
    String path;
    @Builder.Default
    HttpHeaders headers = new HttpHeaders();
    @Builder.Default
    MultiValueMap<String, String> queryParams = new LinkedMultiValueMap<>();
}
