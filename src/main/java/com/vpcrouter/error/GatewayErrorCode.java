package com.vpcrouter.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Failure kinds the gateway itself produces. Each one has its own problem type so clients,
 * logs and metrics can tell them apart even where the HTTP status is shared.
 */
@Getter
@RequiredArgsConstructor
public enum GatewayErrorCode {

    ROUTE_NOT_FOUND(HttpStatus.NOT_FOUND, "route-not-found", "No route matches the request"),
    NO_HEALTHY_ENDPOINT(HttpStatus.SERVICE_UNAVAILABLE, "no-healthy-endpoint", "No healthy endpoint available"),
    CIRCUIT_OPEN(HttpStatus.SERVICE_UNAVAILABLE, "circuit-open", "Circuit breaker is open for every candidate endpoint"),
    CONNECTION_FAILURE(HttpStatus.BAD_GATEWAY, "connection-failure", "Backend endpoint is unreachable"),
    GATEWAY_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "timeout", "Backend did not respond in time"),
    PAYLOAD_TOO_LARGE(HttpStatus.PAYLOAD_TOO_LARGE, "payload-too-large", "Request body exceeds the buffering limit"),
    MIDDLEWARE_REJECTED(HttpStatus.BAD_REQUEST, "middleware-rejected", "Request rejected before dispatch"),
    REQUEST_CANCELLED(HttpStatus.BAD_REQUEST, "request-cancelled", "Client closed the request"),
    INVALID_CONFIGURATION(HttpStatus.BAD_REQUEST, "invalid-configuration", "Invalid gateway configuration");

    private final HttpStatus status;
    private final String type;
    private final String message;
}
