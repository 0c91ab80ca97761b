package com.ridematch.pool.model;

/**
 * Compatibility of a pool with a new rider's trip. Never persisted.
 *
 * @param score              overall score in [0,1]; 0 means the pool cannot take the rider
 * @param costSavingsPercent discount the rider earns from this match
 */
public record RouteMatchScore(
        double score,
        double detourMinutes,
        double detourKm,
        double detourPercent,
        double costSavingsPercent) {

    public static RouteMatchScore rejected() {
        return new RouteMatchScore(0, 0, 0, 0, 0);
    }

    public boolean clears(double minScore) {
        return score > 0 && score >= minScore;
    }
}
