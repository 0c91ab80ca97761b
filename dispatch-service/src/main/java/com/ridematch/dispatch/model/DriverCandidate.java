package com.ridematch.dispatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Driver considered for one dispatch cycle. Recomputed every cycle, never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverCandidate {

    private String driverId;
    private double lat;
    private double lng;
    private String status;
    private double distanceKm;
}
