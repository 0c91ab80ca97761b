package com.ridematch.shared.messages;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OfferCancelledMessage {

    public static final String REASON_RIDE_TAKEN     = "RIDE_TAKEN";
    public static final String REASON_RIDE_CANCELLED = "RIDE_CANCELLED";

    private String rideId;
    private String reason;
    private String message;
}
