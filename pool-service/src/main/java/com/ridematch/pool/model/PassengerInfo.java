package com.ridematch.pool.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a rider may see about a co-passenger: no identity, only where they board and leave.
 * Stop numbers are 1-based; 0 means the stop is not on the current route.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PassengerInfo {

    private String firstNameInitial;
    private Double rating;
    private int pickupStop;
    private int dropoffStop;
}
