package com.ridematch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored at {@code ride_offer:{rideId}:{driverId}} for the lifetime of the offer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackedOffer {

    @JsonProperty("driver_id")
    private String driverId;

    @JsonProperty("sent_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant sentAt;

    @JsonProperty("expires_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant expiresAt;
}
