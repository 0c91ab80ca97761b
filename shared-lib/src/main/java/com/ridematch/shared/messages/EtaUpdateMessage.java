package com.ridematch.shared.messages;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtaUpdateMessage {

    private String rideId;
    private String driverId;
    private double driverLat;
    private double driverLng;
    private Double heading;
    private double distanceKm;
    private int etaMinutes;
    private String rideStatus;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant updatedAt;
}
