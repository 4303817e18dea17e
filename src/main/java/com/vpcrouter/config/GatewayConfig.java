package com.vpcrouter.config;

import com.vpcrouter.proxy.BackoffSleeper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

@Configuration
public class GatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackoffSleeper backoffSleeper() {
        return delay -> Thread.sleep(delay.toMillis());
    }

    /**
     * Fires per-attempt deadlines. Tasks only flag and cancel, so a small pool suffices.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService deadlineScheduler(@Value("${gateway.forwarder.deadline-threads:2}") int threads) {
        return scheduler(threads, "gateway-deadline-");
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService healthCheckScheduler(@Value("${gateway.health.pool-size:4}") int threads) {
        return scheduler(threads, "gateway-health-");
    }

    private static ScheduledExecutorService scheduler(int threads, String prefix) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(prefix);
        threadFactory.setDaemon(true);
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(threads, threadFactory);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
