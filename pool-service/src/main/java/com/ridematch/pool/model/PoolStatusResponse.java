package com.ridematch.pool.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ridematch.pool.entity.PoolRide;
import com.ridematch.pool.entity.RouteStop;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class PoolStatusResponse {

    private PoolRide poolRide;
    private PassengerStatus myStatus;
    private List<PassengerInfo> otherPassengers;
    private List<RouteStop> routeStops;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant estimatedArrival;
}
