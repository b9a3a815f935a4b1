package com.venue.linkage.core.model;

import java.util.Objects;

/**
 * A venue record paired with its comparable keys.
 *
 * @param source     the original record
 * @param nameKey    canonical name (uppercase, alphanumerics and single spaces only)
 * @param locatorKey the address or postcode, uppercased with all whitespace removed
 */
public record NormalizedVenue<T extends VenueRecord>(
        T source,
        String nameKey,
        String locatorKey
) {
    public NormalizedVenue {
        Objects.requireNonNull(source, "source is required");
        nameKey = nameKey != null ? nameKey : "";
        locatorKey = locatorKey != null ? locatorKey : "";
    }

    public String id() {
        return source.id();
    }

    public LocatorKind locatorKind() {
        return source.locatorKind();
    }

    public Coordinates coordinates() {
        return source.coordinates();
    }

    public boolean hasCoordinates() {
        return source.hasCoordinates();
    }
}
