package com.vpcrouter.policy;

import com.vpcrouter.proxy.AttemptOutcome;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Retry settings of a route: how many extra attempts, on which outcomes, and how long to
 * wait between them.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    public static final Set<Integer> DEFAULT_RETRYABLE_STATUSES = Set.of(502, 503, 504);

    @Builder.Default
    int maxRetries = 3;
    @Singular
    Set<Integer> retryableStatuses;
    @Builder.Default
    boolean retryOnTimeout = true;
    @Builder.Default
    boolean retryOnConnectionFailure = true;
    @Builder.Default
    Duration initialBackoff = Duration.ofMillis(100);
    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(10);

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().retryableStatuses(DEFAULT_RETRYABLE_STATUSES).build();
    }

    public static RetryPolicy none() {
        return defaults().toBuilder().maxRetries(0).build();
    }

    public boolean isRetryableStatus(int status) {
        return retryableStatuses.contains(status);
    }

    /**
     * Whether an attempt that ended with this outcome may be followed by another one,
     * budget permitting.
     */
    public boolean isRetryable(AttemptOutcome outcome) {
        return switch (outcome.getKind()) {
            case SUCCESS, BACKEND_ERROR -> isRetryableStatus(outcome.getStatus());
            case TIMEOUT -> retryOnTimeout;
            case CONNECTION_FAILURE -> retryOnConnectionFailure;
            case CIRCUIT_OPEN -> true;
            case CANCELLED -> false;
        };
    }

    /**
     * Delay before retry number {@code retry} (0 for the first retry):
     * {@code initialBackoff * 2^retry}, capped at {@code maxBackoff}.
     */
    public Duration backoff(int retry) {
        long base = initialBackoff.toMillis();
        long cap = maxBackoff.toMillis();
        if (retry >= 62 || base > (cap >> Math.min(retry, 62))) {
            return maxBackoff;
        }
        return Duration.ofMillis(Math.min(base << retry, cap));
    }

    /**
     * Longest time a request may take across every attempt and backoff.
     */
    public Duration overallBudget(TimeoutPolicy timeouts) {
        Duration total = timeouts.getRequestTimeout().multipliedBy(maxRetries + 1L);
        for (int retry = 0; retry < maxRetries; retry++) {
            total = total.plus(backoff(retry));
        }
        return total;
    }
}
