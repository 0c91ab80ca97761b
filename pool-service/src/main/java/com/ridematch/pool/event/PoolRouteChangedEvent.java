package com.ridematch.pool.event;

import java.util.UUID;

/**
 * Published when a pool's passenger set changes and its route should be rebuilt.
 */
public record PoolRouteChangedEvent(UUID poolRideId, String reason) {

    public static final String JOINED = "joined";
    public static final String DECLINED = "declined";
    public static final String CANCELLED = "cancelled";
    public static final String PICKED_UP = "picked_up";
    public static final String DROPPED_OFF = "dropped_off";
}
