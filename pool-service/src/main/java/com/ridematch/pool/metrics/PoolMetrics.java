package com.ridematch.pool.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Pool matching metrics, exposed at /actuator/prometheus:
 *
 *   pool_requests_total{outcome="matched|new_pool"}
 *   pool_match_score                      every candidate score evaluated
 *   pool_expired_total
 *   pool_route_reoptimizations_total{outcome="success|failure"}
 */
@Component
public class PoolMetrics {

    private final Counter matchedCounter;
    private final Counter newPoolCounter;
    private final Counter expiredCounter;
    private final Counter reoptimizedCounter;
    private final Counter reoptimizationFailedCounter;
    private final DistributionSummary matchScoreSummary;

    public PoolMetrics(MeterRegistry registry) {
        this.matchedCounter = Counter.builder("pool.requests")
                .tag("outcome", "matched")
                .description("Pool requests that joined an existing pool")
                .register(registry);

        this.newPoolCounter = Counter.builder("pool.requests")
                .tag("outcome", "new_pool")
                .description("Pool requests that opened a new pool")
                .register(registry);

        this.expiredCounter = Counter.builder("pool.expired")
                .description("Pools cancelled because their match deadline passed")
                .register(registry);

        this.reoptimizedCounter = Counter.builder("pool.route.reoptimizations")
                .tag("outcome", "success")
                .register(registry);

        this.reoptimizationFailedCounter = Counter.builder("pool.route.reoptimizations")
                .tag("outcome", "failure")
                .register(registry);

        this.matchScoreSummary = DistributionSummary.builder("pool.match.score")
                .description("Match scores of candidate pools")
                .publishPercentiles(0.5, 0.9)
                .register(registry);
    }

    public void recordRequest(boolean matched) {
        (matched ? matchedCounter : newPoolCounter).increment();
    }

    public void recordMatchScore(double score) { matchScoreSummary.record(score); }
    public void recordExpired(int count)       { expiredCounter.increment(count); }

    public void recordReoptimization(boolean succeeded) {
        (succeeded ? reoptimizedCounter : reoptimizationFailedCounter).increment();
    }
}
