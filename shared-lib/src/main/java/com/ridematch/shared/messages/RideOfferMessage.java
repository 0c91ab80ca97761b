package com.ridematch.shared.messages;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ridematch.shared.model.GeoLocation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Snapshot of a ride offered to one driver. Never mutated after it is sent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideOfferMessage {

    private String rideId;
    private String riderId;
    private String riderName;
    private double riderRating;
    private GeoLocation pickup;
    private GeoLocation dropoff;
    private String rideTypeName;
    private BigDecimal estimatedFare;
    private double estimatedDistanceKm;
    private int estimatedDurationMinutes;
    private String currency;
    private double distanceToPickupKm;
    private int etaToPickupMinutes;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant expiresAt;

    private int timeoutSeconds;
}
