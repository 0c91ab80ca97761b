package com.ridematch.pool.model;

import com.ridematch.pool.config.PoolProperties;
import com.ridematch.pool.entity.PoolConfig;

/**
 * Effective matching parameters for one request: a city row, the global row, or the service defaults.
 */
public record PoolSettings(
        double maxDetourPercent,
        int maxDetourMinutes,
        int maxWaitMinutes,
        int maxPassengersPerRide,
        double minMatchScore,
        double matchRadiusKm,
        int h3Resolution,
        double discountPercent,
        double minSavingsPercent) {

    public static PoolSettings from(PoolConfig config) {
        return new PoolSettings(
                config.getMaxDetourPercent(),
                config.getMaxDetourMinutes(),
                config.getMaxWaitMinutes(),
                config.getMaxPassengersPerRide(),
                config.getMinMatchScore(),
                config.getMatchRadiusKm(),
                config.getH3Resolution(),
                config.getDiscountPercent(),
                config.getMinSavingsPercent());
    }

    public static PoolSettings from(PoolProperties properties) {
        return new PoolSettings(
                properties.defaultMaxDetourPercent(),
                properties.defaultMaxDetourMinutes(),
                properties.defaultMaxWaitMinutes(),
                properties.maxPassengersPerRide(),
                properties.minMatchScore(),
                properties.matchRadiusKm(),
                properties.h3Resolution(),
                properties.defaultDiscountPercent(),
                properties.minSavingsPercent());
    }
}
