package com.venue.linkage.bulk;

import com.venue.linkage.core.model.Coordinates;
import com.venue.linkage.core.model.HygieneEstablishment;
import com.venue.linkage.core.model.PlaceListing;
import com.venue.linkage.core.model.VenueRecord;
import com.venue.linkage.logging.LogContext;
import com.venue.linkage.match.ProgressCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Loads the two source collections from CSV exports.
 *
 * <p>Places directory columns:</p>
 * <pre>
 * place_id,name,address,latitude,longitude,rating,num_reviews,food_types,price_level,hours
 * </pre>
 *
 * <p>Hygiene registry columns:</p>
 * <pre>
 * fhrs_id,business_name,business_type,address1,address2,address3,address4,postcode,
 * rating_value,rating_date,local_authority_name,hygiene_score,structural_score,
 * confidence_in_management_score,latitude,longitude
 * </pre>
 *
 * <p>Columns are located by header name and may appear in any order; unknown columns are ignored.
 * Unparseable numeric values, including coordinates, become missing values and never abort the
 * load. Rows without an id are reported in {@link LoadResult#errors()}; repeated ids keep the first
 * row. The literal {@code N/A} is read as an absent value.</p>
 */
public class VenueCsvLoader {
    private static final Logger log = LoggerFactory.getLogger(VenueCsvLoader.class);
    private static final int PROGRESS_INTERVAL = 1_000;
    private static final String MISSING_MARKER = "N/A";

    public LoadResult<PlaceListing> loadPlaces(InputStream input, ProgressCallback callback) throws IOException {
        return loadPlaces(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    public LoadResult<PlaceListing> loadPlaces(Reader reader, ProgressCallback callback) throws IOException {
        return load("places", reader, callback, "place_id", row -> PlaceListing.builder()
                .id(row.get("place_id"))
                .name(row.get("name"))
                .address(row.get("address"))
                .coordinates(Coordinates.parse(row.get("latitude"), row.get("longitude")).orElse(null))
                .rating(parseDouble(row.get("rating")))
                .reviewCount(parseInteger(row.get("num_reviews")))
                .foodTypes(row.get("food_types"))
                .priceLevel(row.get("price_level"))
                .openingHours(row.get("hours"))
                .build());
    }

    public LoadResult<HygieneEstablishment> loadEstablishments(InputStream input, ProgressCallback callback)
            throws IOException {
        return loadEstablishments(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    public LoadResult<HygieneEstablishment> loadEstablishments(Reader reader, ProgressCallback callback)
            throws IOException {
        return load("hygiene", reader, callback, "fhrs_id", row -> HygieneEstablishment.builder()
                .id(row.get("fhrs_id"))
                .name(row.get("business_name"))
                .businessType(row.get("business_type"))
                .addressLines(addressLines(row))
                .postcode(row.get("postcode"))
                .coordinates(Coordinates.parse(row.get("latitude"), row.get("longitude")).orElse(null))
                .ratingValue(row.get("rating_value"))
                .ratingDate(row.get("rating_date"))
                .localAuthority(row.get("local_authority_name"))
                .hygieneScore(parseInteger(row.get("hygiene_score")))
                .structuralScore(parseInteger(row.get("structural_score")))
                .confidenceInManagementScore(parseInteger(row.get("confidence_in_management_score")))
                .build());
    }

    private <T extends VenueRecord> LoadResult<T> load(String source, Reader reader, ProgressCallback callback,
                                                       String idColumn, Function<Row, T> mapper)
            throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        VenueCatalog<T> catalog = new VenueCatalog<>();
        List<LoadResult.LoadError> errors = new ArrayList<>();
        long rowsRead = 0;

        try (LogContext ctx = LogContext.forLoad(source); CsvReader csv = new CsvReader(reader)) {
            List<String> header = csv.readRecord();
            if (header == null) {
                log.warn("load.empty source={}", source);
                return new LoadResult<>(List.of(), 0, 0, List.of());
            }
            Map<String, Integer> columns = columnIndex(header);
            if (!columns.containsKey(idColumn)) {
                throw new IOException("Missing required column '" + idColumn + "' in " + source + " header");
            }

            List<String> fields;
            while ((fields = csv.readRecord()) != null) {
                if (isBlank(fields)) {
                    continue;
                }
                rowsRead++;
                long lineNumber = csv.getRecordNumber();
                Row row = new Row(columns, fields);

                if (row.get(idColumn).isEmpty()) {
                    errors.add(new LoadResult.LoadError(lineNumber, "Missing " + idColumn));
                    log.warn("load.row.skipped line={} reason=missing-id", lineNumber);
                    continue;
                }

                try {
                    if (!catalog.add(mapper.apply(row))) {
                        log.debug("load.row.duplicate line={} id={}", lineNumber, row.get(idColumn));
                    }
                } catch (RuntimeException e) {
                    errors.add(new LoadResult.LoadError(lineNumber, e.getMessage()));
                    log.warn("load.row.skipped line={} error={}", lineNumber, e.getMessage());
                }

                if (rowsRead % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(rowsRead, -1, "Read " + rowsRead + " " + source + " rows");
                }
            }
        }

        LoadResult<T> result = new LoadResult<>(catalog.snapshot(), rowsRead, catalog.getDuplicates(), errors);
        cb.onProgress(rowsRead, rowsRead, "Load completed");
        log.info("load.completed source={} result={}", source, result);
        return result;
    }

    // Positional: blank lines are kept
    private static List<String> addressLines(Row row) {
        List<String> lines = new ArrayList<>(4);
        for (int i = 1; i <= 4; i++) {
            lines.add(row.get("address" + i));
        }
        return lines;
    }

    private static Map<String, Integer> columnIndex(List<String> header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i).trim().toLowerCase(Locale.ROOT);
            // Excel prepends a byte order mark to UTF-8 exports
            if (i == 0 && name.startsWith("\uFEFF")) {
                name = name.substring(1);
            }
            columns.putIfAbsent(name, i);
        }
        return columns;
    }

    private static boolean isBlank(List<String> fields) {
        for (String field : fields) {
            if (!field.isBlank()) {
                return false;
            }
        }
        return true;
    }

    static Double parseDouble(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Integer parseInteger(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            // Some exports write whole numbers as "5.0"
            Double value = parseDouble(raw);
            if (value != null && value == Math.rint(value) && Math.abs(value) <= Integer.MAX_VALUE) {
                return value.intValue();
            }
            return null;
        }
    }

    private record Row(Map<String, Integer> columns, List<String> fields) {
        String get(String column) {
            Integer index = columns.get(column);
            if (index == null || index >= fields.size()) {
                return "";
            }
            String value = fields.get(index).trim();
            // the places export writes N/A for absent fields
            return MISSING_MARKER.equalsIgnoreCase(value) ? "" : value;
        }
    }
}
