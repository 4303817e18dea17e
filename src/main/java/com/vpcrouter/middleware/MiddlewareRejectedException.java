package com.vpcrouter.middleware;

import com.vpcrouter.error.GatewayErrorCode;
import com.vpcrouter.error.GatewayException;

/**
 * Thrown by a pre-hook to refuse a request before it is dispatched.
 */
public class MiddlewareRejectedException extends GatewayException {

    public MiddlewareRejectedException(String message) {
        super(GatewayErrorCode.MIDDLEWARE_REJECTED, message);
    }
}
