package com.venue.linkage.bulk;

/**
 * Result of writing match results.
 *
 * @param rowsWritten number of result rows written, excluding any header
 * @param matched     how many of those rows carry a matched candidate
 */
public record ExportResult(
        long rowsWritten,
        long matched
) {
    @Override
    public String toString() {
        return "ExportResult{rows=" + rowsWritten + ", matched=" + matched + '}';
    }
}
