package com.ridematch.pool.routing;

import com.ridematch.shared.model.GeoLocation;
import com.ridematch.shared.util.GeoMath;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Great-circle legs at a flat average speed, minutes rounded up per leg.
 */
@Slf4j
public class HaversineRoutingService implements RoutingService {

    private final double averageSpeedKmh;

    public HaversineRoutingService(double averageSpeedKmh) {
        if (averageSpeedKmh <= 0) {
            throw new IllegalArgumentException("Average speed must be positive: " + averageSpeedKmh);
        }
        this.averageSpeedKmh = averageSpeedKmh;
    }

    @Override
    public RouteInfo getRoute(GeoLocation origin, GeoLocation destination) {
        if (origin == null || destination == null) {
            throw new RoutingException("Route needs both an origin and a destination");
        }
        double km = distance(origin, destination);
        return new RouteInfo(km, GeoMath.travelMinutes(km, averageSpeedKmh));
    }

    @Override
    public MultiStopRoute getMultiStopRoute(List<GeoLocation> stops) {
        if (stops == null || stops.size() < 2) {
            throw new RoutingException("Multi-stop route needs at least two stops, got "
                    + (stops == null ? 0 : stops.size()));
        }
        List<RouteLeg> legs = new ArrayList<>(stops.size() - 1);
        double totalKm = 0;
        int totalMinutes = 0;
        for (int i = 1; i < stops.size(); i++) {
            double km = distance(stops.get(i - 1), stops.get(i));
            int minutes = GeoMath.travelMinutes(km, averageSpeedKmh);
            legs.add(new RouteLeg(i - 1, i, km, minutes));
            totalKm += km;
            totalMinutes += minutes;
        }
        log.debug("Routed {} stops: {} km, {} min", stops.size(), totalKm, totalMinutes);
        return new MultiStopRoute(totalKm, totalMinutes, legs);
    }

    private static double distance(GeoLocation a, GeoLocation b) {
        return GeoMath.distanceKm(a.getLat(), a.getLng(), b.getLat(), b.getLng());
    }
}
