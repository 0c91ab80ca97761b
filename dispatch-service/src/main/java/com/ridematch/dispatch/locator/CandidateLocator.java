package com.ridematch.dispatch.locator;

import com.ridematch.dispatch.model.DriverCandidate;

import java.util.List;

/**
 * Spatial search over the live driver fleet.
 */
public interface CandidateLocator {

    /**
     * Up to {@code maxDrivers} available drivers near the point, nearest first.
     *
     * @throws com.ridematch.dispatch.exception.DispatchException if the driver index cannot be queried
     */
    List<DriverCandidate> findAvailableDrivers(double lat, double lng, int maxDrivers);

    /** Great-circle distance in km; symmetric and zero for identical points. */
    double calculateDistance(double lat1, double lng1, double lat2, double lng2);
}
