package com.ridematch.pool.routing;

import java.util.List;

public record MultiStopRoute(double totalDistanceKm, int totalDurationMinutes, List<RouteLeg> legs) {

    public MultiStopRoute {
        legs = List.copyOf(legs);
    }
}
