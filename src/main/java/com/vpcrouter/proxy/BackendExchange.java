package com.vpcrouter.proxy;

import lombok.AccessLevel;
import lombok.Getter;
import org.springframework.http.HttpHeaders;

import java.io.Closeable;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One attempt's result. When the backend answered, the response body is still open and
 * the endpoint's connection slot is held until {@link #close()}.
 */
@Getter
public class BackendExchange implements Closeable {

    /**
     * Releases what the attempt holds; {@code aborted} when the body was not fully read.
     */
    @FunctionalInterface
    interface Cleanup {
        void run(boolean aborted);
    }

    private final AttemptOutcome outcome;
    private final HttpHeaders headers;
    private final InputStream body;
    /** Body length announced by the backend, or -1. */
    private final long contentLength;
    @Getter(AccessLevel.NONE)
    private final Cleanup cleanup;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean timedOut;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean closed = new AtomicBoolean();
    @Getter(AccessLevel.NONE)
    private volatile boolean completed;

    BackendExchange(AttemptOutcome outcome, HttpHeaders headers, InputStream body, long contentLength,
                    Cleanup cleanup, AtomicBoolean timedOut) {
        this.outcome = outcome;
        this.headers = headers;
        this.body = body;
        this.contentLength = contentLength;
        this.cleanup = cleanup;
        this.timedOut = timedOut;
    }

    /**
     * Attempt that produced no response; nothing is left open.
     */
    public static BackendExchange failed(AttemptOutcome outcome) {
        return new BackendExchange(outcome, new HttpHeaders(), null, -1, aborted -> { }, new AtomicBoolean());
    }

    public int getStatus() {
        return outcome.getStatus();
    }

    public boolean hasResponse() {
        return outcome.hasResponse();
    }

    /**
     * True once the per-attempt deadline fired, including while the body was streaming.
     */
    public boolean isTimedOut() {
        return timedOut.get();
    }

    /**
     * The body was relayed in full; closing returns the connection to the pool.
     */
    public void markCompleted() {
        completed = true;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            cleanup.run(!completed);
        }
    }
}
