package com.vpcrouter.proxy;

import com.vpcrouter.error.GatewayException;
import com.vpcrouter.router.Route;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-request state shared by middleware, the dispatcher and the forwarder. Owned by the
 * thread serving the request; only {@link #cancel()} may be called from elsewhere.
 */
@Getter
@Setter
public class RequestContext {

    private final String method;
    private final String path;
    private final String clientAddress;
    private final Instant startedAt;

    private TraceContext trace;
    private Route route;
    private Instant deadline;
    private int attempts;
    private String lastEndpointId;
    private int responseStatus;
    private long requestBytes;
    private long responseBytes;
    private GatewayException error;

    @Setter(AccessLevel.NONE)
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private volatile boolean cancelled;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final AtomicReference<Runnable> abortAction = new AtomicReference<>();

    public RequestContext(String method, String path, String clientAddress, Instant startedAt) {
        this.method = method;
        this.path = path;
        this.clientAddress = clientAddress;
        this.startedAt = startedAt;
    }

    /**
     * Trace attached by middleware, or a fresh one when none was attached.
     */
    public TraceContext traceOrCreate() {
        if (trace == null) {
            trace = TraceContext.generate();
        }
        return trace;
    }

    public Optional<Route> route() {
        return Optional.ofNullable(route);
    }

    public String routeId() {
        return route == null ? "none" : route.getId();
    }

    public Duration remaining(Instant now) {
        if (deadline == null) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        return Duration.between(now, deadline);
    }

    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    /**
     * @throws ClassCastException when the stored value is not a {@code type}
     */
    public <T> T getAttribute(String key, Class<T> type) {
        return type.cast(attributes.get(key));
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Client is gone: abort whatever attempt is in flight.
     */
    public void cancel() {
        cancelled = true;
        Runnable action = abortAction.getAndSet(null);
        if (action != null) {
            action.run();
        }
    }

    /**
     * Register how to abort the in-flight attempt. Runs immediately if already cancelled.
     */
    public void onCancel(Runnable action) {
        abortAction.set(action);
        if (cancelled && abortAction.compareAndSet(action, null)) {
            action.run();
        }
    }

    public void clearOnCancel() {
        abortAction.set(null);
    }
}
