package com.ridematch.shared.messages;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope delivered to a single user through the notification channel.
 * {@code type} tells the client how to read {@code payload}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserNotification {

    public static final String TYPE_RIDE_OFFER           = "ride.offer";
    public static final String TYPE_RIDE_OFFER_CANCELLED = "ride.offer_cancelled";
    public static final String TYPE_NO_DRIVERS           = "ride.no_drivers";
    public static final String TYPE_ETA_UPDATE           = "eta_update";

    private String type;
    private String userId;
    private String rideId;
    private Object payload;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant sentAt;
}
