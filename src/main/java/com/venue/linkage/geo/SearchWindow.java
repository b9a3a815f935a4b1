package com.venue.linkage.geo;

import com.venue.linkage.core.model.Coordinates;

/**
 * A latitude/longitude rectangle around a point, used as a cheap necessary condition
 * before the exact distance test.
 *
 * <p>{@link #around(Coordinates, double, double)} derives the half-widths from the exact
 * spherical bounds for a circle of the given radius: {@code delta} radians of latitude and
 * {@code asin(sin(delta) / cos(lat))} of longitude, each widened by a safety margin.
 * Every point within the radius is therefore inside the window. Near the poles, or when the
 * circle would wrap the whole globe, the longitude band covers all longitudes.
 * Longitude comparisons are wrap-aware across the antimeridian.</p>
 *
 * @param latitudeDelta  half-height in degrees
 * @param longitudeDelta half-width in degrees; 180 or more means every longitude
 */
public record SearchWindow(Coordinates center, double latitudeDelta, double longitudeDelta) {

    /** Default widening applied to the exact bounds. */
    public static final double DEFAULT_MARGIN = 1.05;

    public SearchWindow {
        if (!(latitudeDelta >= 0.0) || !(longitudeDelta >= 0.0)) {
            throw new IllegalArgumentException("window deltas must be non-negative");
        }
    }

    public static SearchWindow around(Coordinates center, double radiusMeters) {
        return around(center, radiusMeters, DEFAULT_MARGIN);
    }

    public static SearchWindow around(Coordinates center, double radiusMeters, double margin) {
        if (!(radiusMeters >= 0.0) || Double.isInfinite(radiusMeters)) {
            throw new IllegalArgumentException("radiusMeters must be finite and non-negative");
        }
        if (!(margin >= 1.0) || Double.isInfinite(margin)) {
            throw new IllegalArgumentException("margin must be >= 1.0");
        }

        double angular = radiusMeters / Haversine.EARTH_RADIUS_METERS;
        double latitudeDelta = Math.toDegrees(angular) * margin;

        double phi = Math.toRadians(Math.abs(center.latitude()));
        double longitudeDelta;
        if (angular >= Math.PI / 2.0 || phi + angular >= Math.PI / 2.0) {
            longitudeDelta = 180.0;
        } else {
            double ratio = Math.sin(angular) / Math.cos(phi);
            longitudeDelta = ratio >= 1.0 ? 180.0 : Math.toDegrees(Math.asin(ratio)) * margin;
        }

        return new SearchWindow(center, latitudeDelta, Math.min(180.0, longitudeDelta));
    }

    /**
     * Returns a window at least as large as both this one and {@code other} in each direction.
     */
    public SearchWindow union(SearchWindow other) {
        return new SearchWindow(center,
                Math.max(latitudeDelta, other.latitudeDelta),
                Math.max(longitudeDelta, other.longitudeDelta));
    }

    public double minLatitude() {
        return center.latitude() - latitudeDelta;
    }

    public double maxLatitude() {
        return center.latitude() + latitudeDelta;
    }

    public boolean contains(Coordinates point) {
        if (point == null) {
            return false;
        }
        if (Math.abs(point.latitude() - center.latitude()) > latitudeDelta) {
            return false;
        }
        return longitudeDelta >= 180.0
                || longitudeDifference(point.longitude(), center.longitude()) <= longitudeDelta;
    }

    /**
     * Absolute longitude separation in [0, 180], measured the short way round.
     */
    static double longitudeDifference(double lng1, double lng2) {
        double diff = Math.abs(lng1 - lng2) % 360.0;
        return diff > 180.0 ? 360.0 - diff : diff;
    }
}
