package com.vpcrouter.metrics;

import com.vpcrouter.proxy.AttemptCompletedEvent;
import com.vpcrouter.proxy.AttemptStartedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Request and attempt meters.
 */
@Slf4j
@Component
public class GatewayMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter requests;
    private final Timer requestDuration;
    private final DistributionSummary requestSize;
    private final DistributionSummary responseSize;

    public GatewayMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.requests = Counter.builder("gateway.requests")
                .description("Requests received")
                .register(meterRegistry);
        this.requestDuration = Timer.builder("gateway.request.duration")
                .description("Time from receipt to final response")
                .register(meterRegistry);
        this.requestSize = DistributionSummary.builder("gateway.request.size")
                .baseUnit("bytes")
                .register(meterRegistry);
        this.responseSize = DistributionSummary.builder("gateway.response.size")
                .baseUnit("bytes")
                .register(meterRegistry);
    }

    public void requestReceived() {
        requests.increment();
    }

    public void requestCompleted(int status, Duration duration, long requestBytes, long responseBytes) {
        meterRegistry.counter("gateway.responses", "status", String.valueOf(status)).increment();
        requestDuration.record(duration);
        if (requestBytes > 0) {
            requestSize.record(requestBytes);
        }
        if (responseBytes > 0) {
            responseSize.record(responseBytes);
        }
    }

    public void error(String kind) {
        meterRegistry.counter("gateway.errors", "kind", kind).increment();
    }

    @EventListener
    public void onAttemptStarted(AttemptStartedEvent event) {
        log.debug("Attempt {} of route {} started against {}", event.getAttempt(), event.getRouteId(), event.getEndpointId());
    }

    @EventListener
    public void onAttemptCompleted(AttemptCompletedEvent event) {
        String outcome = event.getOutcome().tag();
        meterRegistry.counter("gateway.attempts", "route", event.getRouteId(), "outcome", outcome).increment();
        Timer.builder("gateway.attempt.duration")
                .tag("route", event.getRouteId())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(event.getOutcome().getLatency());
    }
}
