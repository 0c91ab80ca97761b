package com.ridematch.shared.events;

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
public class RideAcceptedEvent {

    public static final String TOPIC = "ride.accepted";

    private String rideId;
    private String riderId;
    private String driverId;
    private String driverName;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant acceptedAt;
}
