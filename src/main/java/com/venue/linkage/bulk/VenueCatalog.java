package com.venue.linkage.bulk;

import com.venue.linkage.core.model.VenueRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyed accumulation of venue records during acquisition, deduplicated by id.
 * The first record seen for an id wins. {@link #snapshot()} hands the matching engine an
 * immutable list in first-seen order. Not thread-safe.
 */
public class VenueCatalog<T extends VenueRecord> {

    private final Map<String, T> byId = new LinkedHashMap<>();
    private long duplicates;

    /**
     * Adds the record unless its id is already present.
     *
     * @return true if the record was added
     */
    public boolean add(T venue) {
        if (byId.putIfAbsent(venue.id(), venue) != null) {
            duplicates++;
            return false;
        }
        return true;
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public int size() {
        return byId.size();
    }

    public long getDuplicates() {
        return duplicates;
    }

    public List<T> snapshot() {
        return List.copyOf(byId.values());
    }
}
