package com.ridematch.shared.geo;

import com.uber.h3core.H3Core;

import java.io.IOException;
import java.util.List;

/**
 * H3 hexagonal cells. Resolution 7 ≈ 5.2 km², the default pool formation bucket.
 */
public class H3SpatialCellIndex implements SpatialCellIndex {

    private final H3Core h3;

    public H3SpatialCellIndex() {
        try {
            this.h3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialise H3Core", e);
        }
    }

    @Override
    public String cellForPoint(double lat, double lng, int resolution) {
        return h3.latLngToCellAddress(lat, lng, resolution);
    }

    @Override
    public List<String> kRingNeighbors(double lat, double lng, int resolution, int ringSize) {
        return h3.gridDisk(cellForPoint(lat, lng, resolution), ringSize);
    }
}
