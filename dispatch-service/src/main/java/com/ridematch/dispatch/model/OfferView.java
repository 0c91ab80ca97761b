package com.ridematch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class OfferView {

    private String rideId;
    private String driverId;
    private boolean live;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant sentAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant expiresAt;
}
