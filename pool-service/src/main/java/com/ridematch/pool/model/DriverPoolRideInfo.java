package com.ridematch.pool.model;

import com.ridematch.pool.entity.PoolPassenger;
import com.ridematch.pool.entity.PoolRide;
import com.ridematch.pool.entity.RouteStop;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
public class DriverPoolRideInfo {

    private PoolRide poolRide;
    private List<PoolPassenger> passengers;
    private List<RouteStop> routeStops;
    private RouteStop nextStop;
    private BigDecimal totalFare;
    private BigDecimal driverEarnings;
}
