package com.ridematch.pool.service;

import com.ridematch.pool.config.PoolProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pool pricing.
 *
 * Formula:
 *   soloFare = BASE_FARE + distanceKm * PER_KM_RATE + durationMin * PER_MIN_RATE
 *   poolFare = soloFare * (1 - discountPercent / 100)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PoolFareCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PoolProperties properties;

    /** What the rider would pay riding alone. */
    public BigDecimal soloFare(double distanceKm, int durationMinutes) {
        BigDecimal fare = properties.baseFare()
                .add(BigDecimal.valueOf(distanceKm).multiply(properties.perKmRate()))
                .add(BigDecimal.valueOf(durationMinutes).multiply(properties.perMinuteRate()))
                .setScale(2, RoundingMode.HALF_UP);

        log.debug("Solo fare: dist={}km duration={}min -> {}", distanceKm, durationMinutes, fare);
        return fare;
    }

    public BigDecimal discounted(BigDecimal originalFare, double discountPercent) {
        BigDecimal factor = BigDecimal.ONE.subtract(BigDecimal.valueOf(discountPercent).divide(HUNDRED));
        return originalFare.multiply(factor).setScale(2, RoundingMode.HALF_UP);
    }

    /** {@code max(0, 1 - poolFare / originalFare) * 100}; 0 for a free original fare. */
    public double savingsPercent(BigDecimal originalFare, BigDecimal poolFare) {
        if (originalFare.signum() <= 0) {
            return 0;
        }
        BigDecimal ratio = poolFare.divide(originalFare, 6, RoundingMode.HALF_UP);
        return Math.max(0, BigDecimal.ONE.subtract(ratio).multiply(HUNDRED).doubleValue());
    }

    public BigDecimal driverEarnings(BigDecimal totalFare) {
        return totalFare.multiply(properties.driverEarningsShare()).setScale(2, RoundingMode.HALF_UP);
    }
}
