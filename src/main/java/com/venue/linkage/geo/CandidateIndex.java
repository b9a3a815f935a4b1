package com.venue.linkage.geo;

import com.venue.linkage.core.model.NormalizedVenue;
import com.venue.linkage.core.model.VenueRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only spatial index over a candidate collection, built once before matching.
 *
 * <p>Positioned candidates are sorted by latitude so that a window query is a binary search
 * for the latitude band followed by a longitude filter. Query results are always returned in
 * the original collection order, which keeps tie-breaking identical to a full scan.
 * Instances are safe to share between threads.</p>
 */
public class CandidateIndex<C extends VenueRecord> {

    private final List<NormalizedVenue<C>> all;
    private final Entry<C>[] byLatitude;
    private final double[] latitudes;

    private record Entry<C extends VenueRecord>(int ordinal, NormalizedVenue<C> venue) {
        double latitude() {
            return venue.coordinates().latitude();
        }
    }

    @SuppressWarnings("unchecked")
    public CandidateIndex(List<NormalizedVenue<C>> candidates) {
        this.all = Collections.unmodifiableList(new ArrayList<>(candidates));

        List<Entry<C>> positioned = new ArrayList<>();
        for (int i = 0; i < all.size(); i++) {
            NormalizedVenue<C> venue = all.get(i);
            if (venue.hasCoordinates()) {
                positioned.add(new Entry<>(i, venue));
            }
        }
        positioned.sort(Comparator.comparingDouble((Entry<C> e) -> e.latitude())
                .thenComparingInt(Entry::ordinal));

        this.byLatitude = positioned.toArray(new Entry[0]);
        this.latitudes = new double[byLatitude.length];
        for (int i = 0; i < byLatitude.length; i++) {
            latitudes[i] = byLatitude[i].latitude();
        }
    }

    /**
     * Every candidate, positioned or not, in original order.
     */
    public List<NormalizedVenue<C>> all() {
        return all;
    }

    public int size() {
        return all.size();
    }

    public int positionedCount() {
        return byLatitude.length;
    }

    public boolean isEmpty() {
        return all.isEmpty();
    }

    /**
     * Candidates with coordinates inside the window, in original order.
     * Candidates lacking coordinates are never returned.
     */
    public List<NormalizedVenue<C>> within(SearchWindow window) {
        int from = lowerBound(window.minLatitude());
        List<Entry<C>> hits = new ArrayList<>();
        for (int i = from; i < byLatitude.length && latitudes[i] <= window.maxLatitude(); i++) {
            Entry<C> entry = byLatitude[i];
            if (window.contains(entry.venue().coordinates())) {
                hits.add(entry);
            }
        }
        if (hits.isEmpty()) {
            return List.of();
        }

        hits.sort(Comparator.comparingInt(Entry::ordinal));
        List<NormalizedVenue<C>> result = new ArrayList<>(hits.size());
        for (Entry<C> hit : hits) {
            result.add(hit.venue());
        }
        return result;
    }

    private int lowerBound(double latitude) {
        int idx = Arrays.binarySearch(latitudes, latitude);
        if (idx < 0) {
            return -idx - 1;
        }
        // Step back over equal keys
        while (idx > 0 && latitudes[idx - 1] == latitude) {
            idx--;
        }
        return idx;
    }
}
