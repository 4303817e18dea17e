package com.vpcrouter.middleware;

import com.vpcrouter.proxy.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * One line per request once the final status is known.
 */
@Slf4j
@Component
@Order(20)
public class AccessLogMiddleware implements GatewayMiddleware {

    private final Clock clock;

    public AccessLogMiddleware(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void afterCompletion(RequestContext context) {
        long millis = Duration.between(context.getStartedAt(), clock.instant()).toMillis();
        if (context.getError() != null) {
            log.info("{} {} {} route={} attempts={} error={} {}ms",
                    context.getMethod(), context.getPath(), context.getResponseStatus(), context.routeId(),
                    context.getAttempts(), context.getError().getErrorCode().getType(), millis);
        } else {
            log.info("{} {} {} route={} endpoint={} attempts={} bytes={} {}ms",
                    context.getMethod(), context.getPath(), context.getResponseStatus(), context.routeId(),
                    context.getLastEndpointId(), context.getAttempts(), context.getResponseBytes(), millis);
        }
    }
}
