package com.ridematch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ridematch.shared.enums.RideStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Published by the rides service on trip progress ({@code ride.in_progress}, {@code ride.completed}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideStatusChangedEvent {

    public static final String TOPIC_IN_PROGRESS = "ride.in_progress";
    public static final String TOPIC_COMPLETED   = "ride.completed";

    private String rideId;
    private String riderId;
    private String driverId;
    private RideStatus status;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant changedAt;
}
