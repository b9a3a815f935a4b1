package com.venue.linkage.core.model;

import java.util.Map;

/**
 * Common view of a food-service venue from either source collection.
 *
 * <p>Implementations are immutable. {@link #coordinates()} returns null when the source
 * carried no usable position; an empty name is represented by an empty string.</p>
 */
public interface VenueRecord {

    /**
     * Opaque identifier, unique within the record's source collection.
     */
    String id();

    String name();

    /**
     * The address (directory side) or postcode (registry side), see {@link #locatorKind()}.
     */
    String addressOrPostcode();

    LocatorKind locatorKind();

    /**
     * The venue position, or null when missing or unparseable.
     */
    Coordinates coordinates();

    default boolean hasCoordinates() {
        return coordinates() != null;
    }

    /**
     * All source fields as display strings, in a stable column order.
     * Used when flattening joined output; absent values are empty strings.
     */
    Map<String, String> attributes();
}
