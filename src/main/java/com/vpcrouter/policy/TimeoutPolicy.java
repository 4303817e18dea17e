package com.vpcrouter.policy;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class TimeoutPolicy {
    /** Hard limit for one attempt, from dispatch until the response body is fully relayed. */
    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(30);
    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(10);

    public static TimeoutPolicy defaults() {
        return TimeoutPolicy.builder().build();
    }
}
