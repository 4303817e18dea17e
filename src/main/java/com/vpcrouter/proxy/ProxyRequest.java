package com.vpcrouter.proxy;

import com.vpcrouter.loadbalancer.SelectionContext;
import com.vpcrouter.router.RouteQuery;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.springframework.http.HttpHeaders;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * Inbound request as seen by the gateway, independent of the servlet API.
 */
@Value
@Builder(toBuilder = true)
public class ProxyRequest {

    String method;
    String path;
    /** Raw, still-encoded query string without the leading '?'; may be null. */
    String rawQuery;
    @Builder.Default
    HttpHeaders headers = new HttpHeaders();
    @With
    @Builder.Default
    BodySource body = BodySource.empty();
    String clientAddress;

    public String pathAndQuery() {
        return rawQuery == null || rawQuery.isEmpty() ? path : path + "?" + rawQuery;
    }

    /**
     * Decoded query parameters in request order. A malformed escape keeps its raw text.
     */
    public MultiValueMap<String, String> queryParams() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        UriComponentsBuilder.newInstance().query(rawQuery).build().getQueryParams()
                .forEach((name, values) -> values.forEach(value ->
                        params.add(decode(name), value == null ? null : decode(value))));
        return params;
    }

    private static String decode(String text) {
        try {
            return UriUtils.decode(text, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return text;
        }
    }

    public RouteQuery toRouteQuery() {
        return RouteQuery.builder()
                .method(method)
                .path(path)
                .headers(headers)
                .queryParams(queryParams())
                .build();
    }

    public SelectionContext toSelectionContext() {
        return SelectionContext.builder()
                .clientAddress(clientAddress)
                .path(path)
                .headers(headers)
                .build();
    }
}
