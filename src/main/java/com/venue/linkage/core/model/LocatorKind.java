package com.venue.linkage.core.model;

/**
 * What the free-text locator field of a venue record holds.
 */
public enum LocatorKind {
    /** A full postal address, which may embed a postcode. */
    ADDRESS,
    /** A bare postcode. */
    POSTCODE
}
