package com.venue.linkage.bulk;

import com.venue.linkage.core.model.MatchResult;
import com.venue.linkage.match.ProgressCallback;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.util.List;

/**
 * Writes match results in a specific format, one row or line per probe, in the order given.
 */
public interface MatchExporter {

    /**
     * Exports results to an output stream as UTF-8.
     *
     * @param results  results in probe order
     * @param output   the output stream to write to
     * @param callback optional progress callback
     * @return the export result
     * @throws IOException if the stream cannot be written
     */
    ExportResult export(List<? extends MatchResult<?, ?>> results, OutputStream output,
                        ProgressCallback callback) throws IOException;

    /**
     * Exports results to a writer. The writer is flushed but not closed.
     *
     * @param results  results in probe order
     * @param writer   the writer to write to
     * @param callback optional progress callback
     * @return the export result
     * @throws IOException if the writer fails
     */
    ExportResult export(List<? extends MatchResult<?, ?>> results, Writer writer,
                        ProgressCallback callback) throws IOException;

    /**
     * Returns the format produced by this exporter (e.g., "csv", "jsonl").
     */
    String getFormat();
}
