package com.ridematch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ridematch.shared.enums.RideStatus;
import com.ridematch.shared.model.GeoLocation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ETA-tracking registration kept at {@code ride:active:{driverId}} while a driver serves a ride.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveRideInfo {

    private String rideId;
    private String riderId;
    private String driverId;
    private GeoLocation pickup;
    private GeoLocation dropoff;
    private RideStatus status;

    /** Pickup until the trip starts, dropoff afterwards. Null when the ride has no dropoff yet. */
    @JsonIgnore
    public GeoLocation destination() {
        return status == RideStatus.ACCEPTED || status == RideStatus.DRIVER_ARRIVED ? pickup : dropoff;
    }
}
