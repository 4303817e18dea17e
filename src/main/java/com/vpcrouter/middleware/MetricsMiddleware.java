package com.vpcrouter.middleware;

import com.vpcrouter.error.GatewayException;
import com.vpcrouter.metrics.GatewayMetrics;
import com.vpcrouter.proxy.ProxyRequest;
import com.vpcrouter.proxy.RequestContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

@Component
@Order(10)
public class MetricsMiddleware implements GatewayMiddleware {

    private final GatewayMetrics metrics;
    private final Clock clock;

    public MetricsMiddleware(GatewayMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void beforeDispatch(ProxyRequest request, RequestContext context) {
        metrics.requestReceived();
    }

    @Override
    public void onError(RequestContext context, GatewayException error) {
        metrics.error(error.getErrorCode().getType());
    }

    @Override
    public void afterCompletion(RequestContext context) {
        Duration duration = Duration.between(context.getStartedAt(), clock.instant());
        metrics.requestCompleted(context.getResponseStatus(), duration, context.getRequestBytes(), context.getResponseBytes());
    }
}
