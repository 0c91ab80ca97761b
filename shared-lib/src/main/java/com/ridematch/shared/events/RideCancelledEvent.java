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
public class RideCancelledEvent {

    public static final String TOPIC = "ride.cancelled";

    private String rideId;
    private String cancelledBy;
    private String reason;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant cancelledAt;
}
