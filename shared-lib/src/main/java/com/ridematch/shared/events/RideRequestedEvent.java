package com.ridematch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideRequestedEvent {

    public static final String TOPIC = "ride.requested";

    private String rideId;
    private String riderId;
    private String riderName;
    private double riderRating;

    private double pickupLat;
    private double pickupLng;
    private String pickupAddress;

    // dropoff is optional for street-hail style requests
    private Double dropoffLat;
    private Double dropoffLng;
    private String dropoffAddress;

    private String rideTypeId;
    private String rideTypeName;
    private BigDecimal estimatedFare;
    private double estimatedDistanceKm;
    private int estimatedDurationMinutes;
    private String currency;
    private String regionId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant requestedAt;

    @JsonIgnore
    public boolean hasDropoff() {
        return dropoffLat != null && dropoffLng != null;
    }
}
