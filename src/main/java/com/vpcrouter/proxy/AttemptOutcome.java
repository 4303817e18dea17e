package com.vpcrouter.proxy;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * Classified result of one attempt against one endpoint.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AttemptOutcome {

    public enum Kind {
        SUCCESS,
        /** Endpoint answered, with a failure status. */
        BACKEND_ERROR,
        TIMEOUT,
        /** Endpoint could not be reached or dropped the connection. */
        CONNECTION_FAILURE,
        /** Short-circuited by the breaker; no connection was made. */
        CIRCUIT_OPEN,
        /** Client went away; counts for nothing. */
        CANCELLED
    }

    Kind kind;
    /** Backend status, or 0 when no response was received. */
    int status;
    String endpointId;
    Duration latency;
    Throwable cause;

    public static AttemptOutcome response(int status, String endpointId, Duration latency) {
        return new AttemptOutcome(status >= 500 ? Kind.BACKEND_ERROR : Kind.SUCCESS, status, endpointId, latency, null);
    }

    public static AttemptOutcome timeout(String endpointId, Duration latency, Throwable cause) {
        return new AttemptOutcome(Kind.TIMEOUT, 0, endpointId, latency, cause);
    }

    public static AttemptOutcome connectionFailure(String endpointId, Duration latency, Throwable cause) {
        return new AttemptOutcome(Kind.CONNECTION_FAILURE, 0, endpointId, latency, cause);
    }

    public static AttemptOutcome circuitOpen(String endpointId) {
        return new AttemptOutcome(Kind.CIRCUIT_OPEN, 0, endpointId, Duration.ZERO, null);
    }

    public static AttemptOutcome cancelled(String endpointId, Duration latency) {
        return new AttemptOutcome(Kind.CANCELLED, 0, endpointId, latency, null);
    }

    public boolean hasResponse() {
        return kind == Kind.SUCCESS || kind == Kind.BACKEND_ERROR;
    }

    /**
     * Outcomes that count against the endpoint's breaker.
     */
    public boolean isBreakerFailure() {
        return kind == Kind.BACKEND_ERROR || kind == Kind.TIMEOUT || kind == Kind.CONNECTION_FAILURE;
    }

    public String tag() {
        return kind.name().toLowerCase();
    }
}
