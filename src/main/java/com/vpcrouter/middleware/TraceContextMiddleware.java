package com.vpcrouter.middleware;

import com.vpcrouter.proxy.ProxyRequest;
import com.vpcrouter.proxy.RequestContext;
import com.vpcrouter.proxy.TraceContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Accepts the caller's {@code traceparent} or starts a new trace, and puts the ids in the MDC
 * for every log line of the request.
 */
@Slf4j
@Component
@Order(0)
public class TraceContextMiddleware implements GatewayMiddleware {

    public static final String MDC_TRACE_ID = "traceId";
    public static final String MDC_SPAN_ID = "spanId";

    @Override
    public void beforeDispatch(ProxyRequest request, RequestContext context) {
        String header = request.getHeaders().getFirst(TraceContext.TRACEPARENT_HEADER);
        TraceContext trace = TraceContext.parse(header);
        if (trace == null) {
            trace = TraceContext.generate();
            if (header != null) {
                log.debug("Ignoring malformed traceparent: {}", header);
            }
        }
        context.setTrace(trace);
        MDC.put(MDC_TRACE_ID, trace.getTraceId());
        MDC.put(MDC_SPAN_ID, trace.getSpanId());
        log.debug("Trace {} for request: {} {}", trace.getTraceId(), request.getMethod(), request.getPath());
    }

    @Override
    public void afterCompletion(RequestContext context) {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
    }
}
