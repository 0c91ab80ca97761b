package com.ridematch.pool.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PoolStats {

    private long totalPoolRides;
    private long activePoolRides;
    private double avgPassengersPerPool;
    private double avgSavingsPercent;
    /** Share of pool requests that were not cancelled, as a percentage. */
    private double matchSuccessRate;
    private double totalCo2SavedKg;
}
