package com.venue.linkage.bulk;

import java.util.List;

/**
 * Result of loading one source collection.
 *
 * @param records    deduplicated records in first-seen order
 * @param rowsRead   data rows read, excluding the header
 * @param duplicates rows skipped because their id was already loaded
 * @param errors     rows that could not be turned into a record
 */
public record LoadResult<T>(
        List<T> records,
        long rowsRead,
        long duplicates,
        List<LoadError> errors
) {
    public LoadResult {
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that was skipped.
     *
     * @param lineNumber the record number in the input (1-based, header is record 1)
     * @param message    why the row was skipped
     */
    public record LoadError(long lineNumber, String message) {}

    @Override
    public String toString() {
        return "LoadResult{records=" + records.size() +
                ", rows=" + rowsRead +
                ", duplicates=" + duplicates +
                ", errors=" + errors.size() + '}';
    }
}
