package com.venue.linkage.core.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * A latitude/longitude pair in decimal degrees.
 * Missing coordinates are never represented by this type; callers hold a null or an empty Optional instead.
 */
public record Coordinates(double latitude, double longitude) {

    public Coordinates {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude must be a finite value in [-90, 90], got " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude must be a finite value in [-180, 180], got " + longitude);
        }
    }

    public static Coordinates of(double latitude, double longitude) {
        return new Coordinates(latitude, longitude);
    }

    /**
     * Parses a pair of decimal-degree strings.
     * Blank, non-numeric, non-finite or out-of-range input on either side yields an empty result.
     */
    public static Optional<Coordinates> parse(String latitude, String longitude) {
        Double lat = parseDegrees(latitude);
        Double lng = parseDegrees(longitude);
        if (lat == null || lng == null) {
            return Optional.empty();
        }
        if (Math.abs(lat) > 90.0 || Math.abs(lng) > 180.0) {
            return Optional.empty();
        }
        return Optional.of(new Coordinates(lat, lng));
    }

    private static Double parseDegrees(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Latitude as plain decimal text, never in scientific notation.
     */
    public String latitudeText() {
        return plain(latitude);
    }

    /**
     * Longitude as plain decimal text; {@code -0.0005} stays {@code "-0.0005"}.
     */
    public String longitudeText() {
        return plain(longitude);
    }

    private static String plain(double degrees) {
        return BigDecimal.valueOf(degrees).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.6f, %.6f)", latitude, longitude);
    }
}
