package com.ridematch.pool.routing;

import com.ridematch.shared.model.GeoLocation;

import java.util.List;

/**
 * Road routing used for solo-trip pricing, match scoring and pool route rebuilding.
 * Implementations throw {@link RoutingException} when no route can be produced.
 */
public interface RoutingService {

    RouteInfo getRoute(GeoLocation origin, GeoLocation destination);

    /**
     * Route visiting {@code stops} in the given order. Requires at least two stops.
     */
    MultiStopRoute getMultiStopRoute(List<GeoLocation> stops);
}
