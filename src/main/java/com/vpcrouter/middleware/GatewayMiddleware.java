package com.vpcrouter.middleware;

import com.vpcrouter.error.GatewayException;
import com.vpcrouter.proxy.ProxyRequest;
import com.vpcrouter.proxy.RequestContext;

/**
 * Hook around every proxied request. Beans are ordered with {@code @Order}: pre-hooks run in
 * that order, post-hooks in reverse. Hooks may annotate the {@link RequestContext} but never
 * influence which route or endpoint serves the request.
 */
public interface GatewayMiddleware {

    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Called before the request is matched. Throw {@link MiddlewareRejectedException} to stop
     * it; any other exception is logged and ignored.
     */
    default void beforeDispatch(ProxyRequest request, RequestContext context) {
    }

    /**
     * Called once the final status is known, whether relayed or produced by the gateway.
     */
    default void afterCompletion(RequestContext context) {
    }

    /**
     * Called before {@link #afterCompletion} when the gateway answers with an error.
     */
    default void onError(RequestContext context, GatewayException error) {
    }
}
