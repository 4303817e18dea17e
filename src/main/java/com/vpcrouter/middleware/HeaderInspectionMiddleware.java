package com.vpcrouter.middleware;

import com.vpcrouter.proxy.ProxyRequest;
import com.vpcrouter.proxy.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Copies configured request headers into the request context and the log.
 */
@Slf4j
@Component
@Order(30)
public class HeaderInspectionMiddleware implements GatewayMiddleware {

    public static final String ATTRIBUTE_PREFIX = "header.";

    private final List<String> headerNames;

    public HeaderInspectionMiddleware(@Value("${gateway.middleware.inspect-headers:}") List<String> headerNames) {
        this.headerNames = headerNames.stream()
                .filter(name -> !name.isBlank())
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public void beforeDispatch(ProxyRequest request, RequestContext context) {
        for (String name : headerNames) {
            String value = request.getHeaders().getFirst(name);
            if (value != null) {
                context.setAttribute(ATTRIBUTE_PREFIX + name, value);
                log.info("Header {}={} on {} {}", name, value, request.getMethod(), request.getPath());
            }
        }
    }
}
