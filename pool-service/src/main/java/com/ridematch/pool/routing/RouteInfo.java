package com.ridematch.pool.routing;

public record RouteInfo(double distanceKm, int durationMinutes) {
}
