package com.vpcrouter.circuitbreaker;

import com.vpcrouter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class EndpointCircuitBreakerTest {

    private static final Duration COOLDOWN = Duration.ofSeconds(30);

    private MutableClock clock;
    private EndpointCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingNow();
        breaker = new EndpointCircuitBreaker("10.0.0.1:8080",
                CircuitBreakerConfig.builder().failureThreshold(3).cooldown(COOLDOWN).build(), clock);
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            breaker.onFailure(breaker.tryAcquire().orElseThrow());
        }
    }

    @Test
    void opensAfterThresholdConsecutiveFailures() {
        fail(2);
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);

        fail(1);

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.isCallPermitted()).isFalse();
        assertThat(breaker.tryAcquire()).isEmpty();
    }

    @Test
    void successResetsFailureStreak() {
        fail(2);
        breaker.onSuccess(breaker.tryAcquire().orElseThrow());
        fail(2);

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.snapshot().getConsecutiveFailures()).isEqualTo(2);
    }

    @Test
    void halfOpenTrialSuccessCloses() {
        fail(3);
        clock.advance(COOLDOWN.minusMillis(1));
        assertThat(breaker.tryAcquire()).isEmpty();

        clock.advance(Duration.ofMillis(1));
        CircuitPermit trial = breaker.tryAcquire().orElseThrow();

        assertThat(trial.isTrial()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.tryAcquire()).as("only one trial at a time").isEmpty();

        breaker.onSuccess(trial);

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.snapshot().getConsecutiveFailures()).isZero();
    }

    @Test
    void halfOpenTrialFailureReopensAndRestartsCooldown() {
        fail(3);
        clock.advance(COOLDOWN);
        CircuitPermit trial = breaker.tryAcquire().orElseThrow();

        breaker.onFailure(trial);

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        clock.advance(COOLDOWN.minusSeconds(1));
        assertThat(breaker.tryAcquire()).isEmpty();
        clock.advance(Duration.ofSeconds(1));
        assertThat(breaker.tryAcquire()).isPresent();
    }

    @Test
    void releasedTrialFreesTheSlot() {
        fail(3);
        clock.advance(COOLDOWN);
        CircuitPermit trial = breaker.tryAcquire().orElseThrow();

        breaker.release(trial);

        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.tryAcquire()).isPresent();
    }

    @Test
    void staleVerdictsFromPreviousEpisodeAreIgnored() {
        CircuitPermit early = breaker.tryAcquire().orElseThrow();
        fail(3);
        clock.advance(COOLDOWN);
        CircuitPermit trial = breaker.tryAcquire().orElseThrow();

        // a late success from before the breaker opened must not close it
        breaker.onSuccess(early);

        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        breaker.onSuccess(trial);
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void concurrentCallersGetExactlyOneTrial() throws Exception {
        fail(3);
        clock.advance(COOLDOWN);
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Callable<Optional<CircuitPermit>> attempt = () -> {
                start.await();
                return breaker.tryAcquire();
            };
            List<Future<Optional<CircuitPermit>>> futures = IntStream.range(0, threads)
                    .mapToObj(i -> pool.submit(attempt))
                    .collect(Collectors.toList());
            start.countDown();
            long granted = 0;
            for (Future<Optional<CircuitPermit>> future : futures) {
                if (future.get(10, TimeUnit.SECONDS).isPresent()) {
                    granted++;
                }
            }
            assertThat(granted).isEqualTo(1);
            assertThat(breaker.snapshot().getTrialsInFlight()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentFailuresOpenExactlyOnce() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<CircuitPermit> permits = IntStream.range(0, threads)
                .mapToObj(i -> breaker.tryAcquire().orElseThrow())
                .collect(Collectors.toList());
        long generation = breaker.snapshot().getGeneration();
        try {
            List<Future<Object>> futures = permits.stream()
                    .map(permit -> pool.submit(() -> {
                        start.await();
                        breaker.onFailure(permit);
                        return null;
                    }))
                    .collect(Collectors.toList());
            start.countDown();
            for (Future<Object> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.snapshot().getGeneration()).isEqualTo(generation + 1);
    }
}
