package com.ridematch.pool.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PoolRideResponse {

    private UUID poolPassengerId;
    private UUID poolRideId;
    private PassengerStatus status;
    private boolean matchFound;

    private BigDecimal originalFare;
    private BigDecimal poolFare;
    private double savingsPercent;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant estimatedPickup;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant estimatedDropoff;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant matchDeadline;

    private RouteMatchScore matchScore;
    private int currentPassengers;
    private int maxPassengers;

    private String message;
}
