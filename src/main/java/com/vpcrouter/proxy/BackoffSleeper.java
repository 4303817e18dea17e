package com.vpcrouter.proxy;

import java.time.Duration;

/**
 * Waits out the backoff between attempts.
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(Duration delay) throws InterruptedException;
}
