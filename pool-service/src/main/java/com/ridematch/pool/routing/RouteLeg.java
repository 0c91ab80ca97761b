package com.ridematch.pool.routing;

/** Travel between two consecutive stops, indexed into the requested stop list. */
public record RouteLeg(int fromIndex, int toIndex, double distanceKm, int durationMinutes) {
}
