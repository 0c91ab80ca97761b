package com.ridematch.shared.util;

/**
 * Great-circle helpers on a spherical earth.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoMath() {}

    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Initial bearing from the first point to the second, in degrees within [0, 360).
     */
    public static double bearingDegrees(double lat1, double lng1, double lat2, double lng2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dLambda = Math.toRadians(lng2 - lng1);

        double y = Math.sin(dLambda) * Math.cos(phi2);
        double x = Math.cos(phi1) * Math.sin(phi2) - Math.sin(phi1) * Math.cos(phi2) * Math.cos(dLambda);
        double bearing = Math.toDegrees(Math.atan2(y, x));
        return (bearing + 360.0) % 360.0;
    }

    /** Smallest angle between two bearings, in [0, 180]. */
    public static double angularDifference(double bearing1, double bearing2) {
        double diff = Math.abs(bearing1 - bearing2) % 360.0;
        return diff > 180.0 ? 360.0 - diff : diff;
    }

    /** Minutes to cover {@code distanceKm} at {@code speedKmh}, rounded up. */
    public static int travelMinutes(double distanceKm, double speedKmh) {
        return (int) Math.ceil(distanceKm / speedKmh * 60.0);
    }
}
