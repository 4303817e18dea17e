package com.vpcrouter.registry;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One unit of an endpoint's active-connection count. Releasing more than once has no effect.
 */
public final class ConnectionLease implements AutoCloseable {

    private final AtomicInteger counter;
    private final AtomicBoolean released = new AtomicBoolean();

    ConnectionLease(AtomicInteger counter) {
        this.counter = counter;
        counter.incrementAndGet();
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            counter.decrementAndGet();
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        release();
    }
}
