package com.ridematch.pool.config;

import com.ridematch.pool.routing.HaversineRoutingService;
import com.ridematch.pool.routing.RoutingService;
import com.ridematch.shared.geo.H3SpatialCellIndex;
import com.ridematch.shared.geo.SpatialCellIndex;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class PoolConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SpatialCellIndex spatialCellIndex() {
        return new H3SpatialCellIndex();
    }

    /**
     * Straight-line routing at a flat average speed.
     */
    @Bean
    public RoutingService routingService(
            @Value("${pool.routing.average-speed-kmh:30.0}") double averageSpeedKmh) {
        return new HaversineRoutingService(averageSpeedKmh);
    }

    /**
     * Route re-optimization runs here so joins, cancels, pickups and dropoffs never wait for it.
     */
    @Bean
    public ThreadPoolTaskExecutor routeOptimizerExecutor(
            @Value("${pool.route-optimizer.pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("route-opt-");
        return executor;
    }
}
