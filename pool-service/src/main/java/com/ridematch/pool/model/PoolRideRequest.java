package com.ridematch.pool.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolRideRequest {

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double pickupLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double pickupLng;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double dropoffLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double dropoffLng;

    private String pickupAddress;
    private String dropoffAddress;

    /** Seats needed; 1 when absent. */
    @Min(1)
    private Integer passengerCount;

    /** Overrides the configured wait for a match. */
    @Min(1) @Max(60)
    private Integer maxWaitMinutes;

    /** Selects a city-specific pool configuration when one is active. */
    private String cityId;

    public int seatsRequested() {
        return passengerCount == null ? 1 : passengerCount;
    }
}
