package com.venue.linkage.bulk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.util.List;
import java.util.Map;

/**
 * Writes one JSON object per line:
 * <pre>
 * {"probe_id":"p1","candidate_id":"F1","matched":true,"score":1.0,"name_score":1.0,
 *  "distance_score":1.0,"postcode_score":1.0,"distance_m":0.0,"probe":{...},"candidate":{...}}
 * </pre>
 * Unmatched lines carry {@code null} for {@code candidate_id} and {@code candidate} and the
 * best scores seen for the probe.
 */
public class JsonLinesMatchExporter implements MatchExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesMatchExporter.class);

    private final ObjectMapper objectMapper;

    public JsonLinesMatchExporter() {
        this(new ObjectMapper());
    }

    public JsonLinesMatchExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ExportResult export(List<? extends MatchResult<?, ?>> results, OutputStream output,
                               ProgressCallback callback) throws IOException {
        return export(results, new OutputStreamWriter(output, StandardCharsets.UTF_8), callback);
    }

    @Override
    public ExportResult export(List<? extends MatchResult<?, ?>> results, Writer writer,
                               ProgressCallback callback) throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        BufferedWriter out = new BufferedWriter(writer);

        long rows = 0;
        long matched = 0;
        for (MatchResult<?, ?> result : results) {
            out.write(objectMapper.writeValueAsString(toNode(result)));
            out.write('\n');
            rows++;
            if (result.isMatched()) {
                matched++;
            }
        }
        out.flush();

        ExportResult result = new ExportResult(rows, matched);
        cb.onProgress(rows, rows, "Export completed");
        log.info("export.completed format={} result={}", getFormat(), result);
        return result;
    }

    ObjectNode toNode(MatchResult<?, ?> result) {
        ScoreBreakdown breakdown = result.breakdown();
        ObjectNode node = objectMapper.createObjectNode();
        node.put("probe_id", result.probeId());
        node.put("candidate_id", result.candidateId());
        node.put("matched", result.isMatched());
        node.put("score", breakdown.combinedScore());
        node.put("name_score", breakdown.nameScore());
        node.put("distance_score", breakdown.distanceScore());
        node.put("postcode_score", breakdown.postcodeScore());
        node.put("distance_m", breakdown.distanceMeters());
        node.set("probe", attributes(result.probe().attributes()));
        if (result.isMatched()) {
            node.set("candidate", attributes(result.candidate().attributes()));
        } else {
            node.putNull("candidate");
        }
        return node;
    }

    private ObjectNode attributes(Map<String, String> attributes) {
        ObjectNode node = objectMapper.createObjectNode();
        attributes.forEach(node::put);
        return node;
    }

    @Override
    public String getFormat() {
        return "jsonl";
    }
}
