package com.venue.linkage.bulk;

import com.venue.linkage.core.model.MatchResult;
import com.venue.linkage.core.model.ScoreBreakdown;
import com.venue.linkage.match.ProgressCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Writes the joined view: every probe row enriched with its matched candidate.
 *
 * <p>Output format:</p>
 * <pre>
 * place_id,name,...,matched,match_score,match_name_score,match_distance_m,fhrs_fhrs_id,fhrs_business_name,...
 * p1,The Crown &amp; Anchor,...,true,1.000,1.000,0.00,F1,Crown and Anchor Ltd,...
 * p2,Red Lion,...,false,0.140,0.200,,,,...
 * </pre>
 *
 * <p>Attribute columns are the union of the attribute keys seen across the results, in
 * first-seen order. Candidate columns carry a prefix and are blank for unmatched probes; the score
 * columns of an unmatched probe hold the best breakdown seen, or zero when no candidate survived pruning.</p>
 */
public class CsvMatchExporter implements MatchExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvMatchExporter.class);
    private static final int PROGRESS_INTERVAL = 1_000;

    static final List<String> MATCH_COLUMNS =
            List.of("matched", "match_score", "match_name_score", "match_distance_m");

    private final String candidatePrefix;

    public CsvMatchExporter() {
        this("fhrs_");
    }

    public CsvMatchExporter(String candidatePrefix) {
        this.candidatePrefix = Objects.requireNonNull(candidatePrefix, "candidatePrefix is required");
    }

    @Override
    public ExportResult export(List<? extends MatchResult<?, ?>> results, OutputStream output,
                               ProgressCallback callback) throws IOException {
        Writer writer = new OutputStreamWriter(output, StandardCharsets.UTF_8);
        return export(results, writer, callback);
    }

    @Override
    public ExportResult export(List<? extends MatchResult<?, ?>> results, Writer writer,
                               ProgressCallback callback) throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        BufferedWriter out = new BufferedWriter(writer);

        Set<String> probeColumns = new LinkedHashSet<>();
        Set<String> candidateColumns = new LinkedHashSet<>();
        for (MatchResult<?, ?> result : results) {
            probeColumns.addAll(result.probe().attributes().keySet());
            if (result.isMatched()) {
                candidateColumns.addAll(result.candidate().attributes().keySet());
            }
        }

        List<String> header = new ArrayList<>(probeColumns);
        header.addAll(MATCH_COLUMNS);
        for (String column : candidateColumns) {
            header.add(candidatePrefix + column);
        }
        writeRow(out, header);

        long rows = 0;
        long matched = 0;
        List<String> row = new ArrayList<>(header.size());
        for (MatchResult<?, ?> result : results) {
            row.clear();
            Map<String, String> probe = result.probe().attributes();
            for (String column : probeColumns) {
                row.add(probe.getOrDefault(column, ""));
            }

            // Unmatched rows still carry the best score seen
            ScoreBreakdown breakdown = result.breakdown();
            row.add(Boolean.toString(result.isMatched()));
            row.add(String.format(Locale.ROOT, "%.3f", breakdown.combinedScore()));
            row.add(String.format(Locale.ROOT, "%.3f", breakdown.nameScore()));
            row.add(breakdown.hasDistance()
                    ? String.format(Locale.ROOT, "%.2f", breakdown.distanceMeters()) : "");

            if (result.isMatched()) {
                Map<String, String> candidate = result.candidate().attributes();
                for (String column : candidateColumns) {
                    row.add(candidate.getOrDefault(column, ""));
                }
                matched++;
            } else {
                for (int i = 0; i < candidateColumns.size(); i++) {
                    row.add("");
                }
            }
            writeRow(out, row);
            rows++;

            if (rows % PROGRESS_INTERVAL == 0) {
                cb.onProgress(rows, results.size(), "Exported " + rows + " rows");
            }
        }
        out.flush();

        ExportResult result = new ExportResult(rows, matched);
        cb.onProgress(rows, rows, "Export completed");
        log.info("export.completed format={} result={}", getFormat(), result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private static void writeRow(Writer out, List<String> values) throws IOException {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                out.write(',');
            }
            out.write(csvEscape(values.get(i)));
        }
        out.write("\r\n");
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
