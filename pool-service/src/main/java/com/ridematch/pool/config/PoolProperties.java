package com.ridematch.pool.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;

/**
 * Service-wide pool defaults. A matching row in {@code pool_configs} overrides the
 * matching parameters; the fare schedule and earnings share are service-wide only.
 */
@ConfigurationProperties(prefix = "pool")
public record PoolProperties(
        @DefaultValue("5") int defaultMaxWaitMinutes,
        @DefaultValue("25") double defaultMaxDetourPercent,
        @DefaultValue("15") int defaultMaxDetourMinutes,
        @DefaultValue("25") double defaultDiscountPercent,
        @DefaultValue("4") int maxPassengersPerRide,
        @DefaultValue("7") int h3Resolution,
        @DefaultValue("2") int searchRingSize,
        @DefaultValue("0.5") double minMatchScore,
        @DefaultValue("3.0") double matchRadiusKm,
        @DefaultValue("15") double minSavingsPercent,
        @DefaultValue("2.00") BigDecimal baseFare,
        @DefaultValue("1.50") BigDecimal perKmRate,
        @DefaultValue("0.25") BigDecimal perMinuteRate,
        @DefaultValue("0.75") BigDecimal driverEarningsShare) {

    public static PoolProperties defaults() {
        return new PoolProperties(5, 25, 15, 25, 4, 7, 2, 0.5, 3.0, 15,
                new BigDecimal("2.00"), new BigDecimal("1.50"), new BigDecimal("0.25"), new BigDecimal("0.75"));
    }
}
