package com.ridematch.shared.geo;

import java.util.List;

/**
 * Buckets coordinates into fixed-resolution cells for bounded proximity search.
 */
public interface SpatialCellIndex {

    String cellForPoint(double lat, double lng, int resolution);

    /**
     * The cell containing the point plus every cell within {@code ringSize} steps of it.
     */
    List<String> kRingNeighbors(double lat, double lng, int resolution, int ringSize);
}
