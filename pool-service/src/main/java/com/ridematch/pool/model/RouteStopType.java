package com.ridematch.pool.model;

public enum RouteStopType {
    PICKUP,
    DROPOFF
}
