package com.venue.linkage.rules;

import com.venue.linkage.core.model.NormalizedVenue;
import com.venue.linkage.core.model.VenueRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes the identifying text fields of venue records.
 * Both operations are pure, never throw on bad input and are idempotent.
 */
public class VenueNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final NormalizationEngine nameEngine;

    public VenueNormalizer() {
        this(DefaultNormalizationRules.createDefaultEngine());
    }

    public VenueNormalizer(NormalizationEngine nameEngine) {
        this.nameEngine = nameEngine;
    }

    public String normalizeName(String raw) {
        return nameEngine.normalize(raw);
    }

    /**
     * Uppercases and removes all whitespace. Also applied to full addresses so that
     * an embedded postcode such as {@code "SW1A 1AA"} becomes a literal substring match.
     */
    public String normalizePostcode(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        return WHITESPACE.matcher(raw.toUpperCase(Locale.ROOT)).replaceAll("");
    }

    public <T extends VenueRecord> NormalizedVenue<T> normalize(T venue) {
        return new NormalizedVenue<>(venue, normalizeName(venue.name()),
                normalizePostcode(venue.addressOrPostcode()));
    }

    /**
     * Normalizes a whole collection, preserving order. The input list is not modified.
     */
    public <T extends VenueRecord> List<NormalizedVenue<T>> normalizeAll(List<T> venues) {
        List<NormalizedVenue<T>> normalized = new ArrayList<>(venues.size());
        for (T venue : venues) {
            normalized.add(normalize(venue));
        }
        return Collections.unmodifiableList(normalized);
    }
}
