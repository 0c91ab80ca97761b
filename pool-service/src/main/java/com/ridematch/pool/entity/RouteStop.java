package com.ridematch.pool.entity;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ridematch.pool.model.RouteStopType;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One pickup or dropoff on a pool's route. The route is replaced as a whole on re-optimization.
 */
@Embeddable
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RouteStop {

    @Column(name = "pool_passenger_id", nullable = false)
    private UUID poolPassengerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "stop_type", nullable = false)
    private RouteStopType type;

    @Column(name = "lat", nullable = false)
    private double lat;

    @Column(name = "lng", nullable = false)
    private double lng;

    @Column(name = "address")
    private String address;

    @Column(name = "sequence_order", nullable = false)
    private int sequenceOrder;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Column(name = "estimated_arrival")
    private Instant estimatedArrival;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Column(name = "actual_arrival")
    private Instant actualArrival;

    @Column(name = "wait_time_seconds")
    private int waitTimeSeconds;
}
