package com.venue.linkage.bulk;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal RFC 4180 record reader: comma separated, double-quote enclosed fields,
 * doubled quotes as escapes, quoted fields may span lines. CRLF and LF line endings are accepted.
 */
public class CsvReader implements Closeable {

    private final BufferedReader reader;
    private long recordNumber;

    public CsvReader(Reader reader) {
        this.reader = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
    }

    /**
     * Reads the next record.
     *
     * @return the fields of the record, or null at end of input
     */
    public List<String> readRecord() throws IOException {
        int c = reader.read();
        if (c == -1) {
            return null;
        }

        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean fieldStart = true;

        while (true) {
            if (c == -1) {
                fields.add(field.toString());
                break;
            }
            char ch = (char) c;

            if (quoted) {
                if (ch == '"') {
                    reader.mark(1);
                    int next = reader.read();
                    if (next == '"') {
                        field.append('"');
                    } else {
                        quoted = false;
                        if (next != -1) {
                            reader.reset();
                        }
                    }
                } else {
                    field.append(ch);
                }
            } else if (ch == '"' && fieldStart) {
                quoted = true;
                fieldStart = false;
            } else if (ch == ',') {
                fields.add(field.toString());
                field.setLength(0);
                fieldStart = true;
            } else if (ch == '\n' || ch == '\r') {
                if (ch == '\r') {
                    reader.mark(1);
                    int next = reader.read();
                    if (next != '\n' && next != -1) {
                        reader.reset();
                    }
                }
                fields.add(field.toString());
                break;
            } else {
                field.append(ch);
                fieldStart = false;
            }
            c = reader.read();
        }

        recordNumber++;
        return fields;
    }

    /**
     * Number of records returned so far, including the header.
     */
    public long getRecordNumber() {
        return recordNumber;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
