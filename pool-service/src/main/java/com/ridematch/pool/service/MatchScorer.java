package com.ridematch.pool.service;

import com.ridematch.pool.entity.PoolRide;
import com.ridematch.pool.entity.RouteStop;
import com.ridematch.pool.model.PoolSettings;
import com.ridematch.pool.model.RouteMatchScore;
import com.ridematch.pool.routing.MultiStopRoute;
import com.ridematch.pool.routing.RoutingException;
import com.ridematch.pool.routing.RoutingService;
import com.ridematch.shared.model.GeoLocation;
import com.ridematch.shared.util.GeoMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores how well a new rider fits an existing pool.
 *
 *   score = 0.4 * routeEfficiency + 0.3 * timeEfficiency + 0.3 * directionAlignment
 *
 * routeEfficiency    = 1 - detourPercent / maxDetourPercent
 * timeEfficiency     = 1 - detourMinutes / maxDetourMinutes
 * directionAlignment = 1 - angle(center→dropoff, pickup→dropoff) / 180
 *
 * A detour beyond either limit scores 0.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MatchScorer {

    static final double ROUTE_WEIGHT = 0.4;
    static final double TIME_WEIGHT = 0.3;
    static final double DIRECTION_WEIGHT = 0.3;

    private final RoutingService routingService;

    public RouteMatchScore score(PoolRide pool, GeoLocation pickup, GeoLocation dropoff, PoolSettings settings) {
        double currentKm = pool.getTotalDistanceKm();
        if (currentKm <= 0) {
            log.debug("Pool {} has no route distance yet, not scoring", pool.getId());
            return RouteMatchScore.rejected();
        }

        MultiStopRoute extended;
        try {
            extended = routingService.getMultiStopRoute(stopsWithNewRider(pool, pickup, dropoff));
        } catch (RoutingException e) {
            log.warn("Could not route pool {} with the new rider: {}", pool.getId(), e.getMessage());
            return RouteMatchScore.rejected();
        }

        double detourKm = extended.totalDistanceKm() - currentKm;
        double detourMinutes = extended.totalDurationMinutes() - pool.getTotalDurationMinutes();
        double detourPercent = detourKm / currentKm * 100;

        if (detourPercent > settings.maxDetourPercent() || detourMinutes > settings.maxDetourMinutes()) {
            log.debug("Pool {} rejected: detour {}% / {} min", pool.getId(), detourPercent, detourMinutes);
            return RouteMatchScore.rejected();
        }

        double routeScore = headroom(detourPercent, settings.maxDetourPercent());
        double timeScore = headroom(detourMinutes, settings.maxDetourMinutes());
        double directionScore = directionAlignment(pool.getCenterLat(), pool.getCenterLng(), pickup, dropoff);

        double score = clamp(routeScore * ROUTE_WEIGHT + timeScore * TIME_WEIGHT + directionScore * DIRECTION_WEIGHT);

        return new RouteMatchScore(score, detourMinutes, detourKm, detourPercent, settings.discountPercent() * score);
    }

    /**
     * Compares the bearing from the pool's center to the new dropoff with the new rider's own
     * bearing. 1 for the same heading, 0 for opposite headings.
     */
    static double directionAlignment(double centerLat, double centerLng, GeoLocation pickup, GeoLocation dropoff) {
        double poolBearing = GeoMath.bearingDegrees(centerLat, centerLng, dropoff.getLat(), dropoff.getLng());
        double riderBearing = GeoMath.bearingDegrees(pickup.getLat(), pickup.getLng(), dropoff.getLat(), dropoff.getLng());
        return clamp(1.0 - GeoMath.angularDifference(poolBearing, riderBearing) / 180.0);
    }

    private static List<GeoLocation> stopsWithNewRider(PoolRide pool, GeoLocation pickup, GeoLocation dropoff) {
        List<GeoLocation> stops = new ArrayList<>(pool.getRoute().size() + 2);
        for (RouteStop stop : pool.getRoute()) {
            stops.add(new GeoLocation(stop.getLat(), stop.getLng(), stop.getAddress()));
        }
        stops.add(pickup);
        stops.add(dropoff);
        return stops;
    }

    private static double headroom(double used, double limit) {
        if (limit <= 0) {
            return used <= 0 ? 1.0 : 0.0;
        }
        return clamp(1.0 - used / limit);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
