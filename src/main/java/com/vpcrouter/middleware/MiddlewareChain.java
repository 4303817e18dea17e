package com.vpcrouter.middleware;

import com.vpcrouter.error.GatewayException;
import com.vpcrouter.proxy.ProxyRequest;
import com.vpcrouter.proxy.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Runs the ordered middleware around a dispatch step.
 *
 * <p>Every middleware whose pre-hook was entered gets its post-hooks, in reverse order, even
 * when a later one rejected the request or dispatch failed. A hook that throws anything
 * other than a {@link MiddlewareRejectedException} is logged and skipped.
 */
@Slf4j
@Component
public class MiddlewareChain {

    @FunctionalInterface
    public interface DispatchStep {
        void proceed() throws IOException;
    }

    private final List<GatewayMiddleware> middlewares;

    public MiddlewareChain(List<GatewayMiddleware> middlewares) {
        this.middlewares = List.copyOf(middlewares);
        log.info("Middleware chain: {}", this.middlewares.stream().map(GatewayMiddleware::name).toList());
    }

    public List<GatewayMiddleware> getMiddlewares() {
        return middlewares;
    }

    public void execute(ProxyRequest request, RequestContext context, DispatchStep step) throws IOException {
        int entered = 0;
        try {
            for (GatewayMiddleware middleware : middlewares) {
                entered++;
                before(middleware, request, context);
            }
            step.proceed();
        } catch (GatewayException e) {
            context.setError(e);
            if (context.getResponseStatus() == 0) {
                context.setResponseStatus(e.getStatus());
            }
            for (int i = entered - 1; i >= 0; i--) {
                error(middlewares.get(i), context, e);
            }
            throw e;
        } finally {
            for (int i = entered - 1; i >= 0; i--) {
                after(middlewares.get(i), context);
            }
        }
    }

    private static void before(GatewayMiddleware middleware, ProxyRequest request, RequestContext context) {
        try {
            middleware.beforeDispatch(request, context);
        } catch (MiddlewareRejectedException e) {
            log.info("Request {} {} rejected by {}: {}", context.getMethod(), context.getPath(), middleware.name(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.warn("Middleware {} failed before dispatch", middleware.name(), e);
        }
    }

    private static void error(GatewayMiddleware middleware, RequestContext context, GatewayException error) {
        try {
            middleware.onError(context, error);
        } catch (RuntimeException e) {
            log.warn("Middleware {} failed handling error", middleware.name(), e);
        }
    }

    private static void after(GatewayMiddleware middleware, RequestContext context) {
        try {
            middleware.afterCompletion(context);
        } catch (RuntimeException e) {
            log.warn("Middleware {} failed after completion", middleware.name(), e);
        }
    }
}
