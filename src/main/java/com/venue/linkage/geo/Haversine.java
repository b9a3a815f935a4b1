package com.venue.linkage.geo;

import com.venue.linkage.core.model.Coordinates;

/**
 * Great-circle distance on a spherical Earth.
 */
public final class Haversine {

    /** Mean Earth radius in meters. */
    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private Haversine() {
        // Utility class
    }

    public static double distanceMeters(Coordinates a, Coordinates b) {
        return distanceMeters(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    public static double distanceMeters(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double halfDeltaPhi = Math.toRadians(lat2 - lat1) / 2.0;
        double halfDeltaLambda = Math.toRadians(lon2 - lon1) / 2.0;

        double sinPhi = Math.sin(halfDeltaPhi);
        double sinLambda = Math.sin(halfDeltaLambda);
        double h = sinPhi * sinPhi + Math.cos(phi1) * Math.cos(phi2) * sinLambda * sinLambda;

        // Rounding can push h fractionally above 1 for antipodal points
        return 2.0 * EARTH_RADIUS_METERS * Math.asin(Math.sqrt(Math.min(1.0, h)));
    }

    /**
     * Returns the distance, or null when either side is missing.
     */
    public static Double distanceOrNull(Coordinates a, Coordinates b) {
        if (a == null || b == null) {
            return null;
        }
        return distanceMeters(a, b);
    }
}
