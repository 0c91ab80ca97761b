package com.ridematch.dispatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class DispatchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs delayed offer batches. Tasks are never revoked once scheduled;
     * each one re-checks the ride status when it fires.
     */
    @Bean
    public ThreadPoolTaskScheduler offerBatchScheduler(
            @Value("${dispatch.offer-batch.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("offer-batch-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
