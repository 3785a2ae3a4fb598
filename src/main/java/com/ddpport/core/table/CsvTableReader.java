package com.ddpport.core.table;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads comma separated exports (RFC 4180 quoting, first row is the header) into a {@link RowSet}.
 * Blank lines are skipped; rows with fewer cells than the header are padded with {@code null}.
 */
public final class CsvTableReader {
    private static final char BOM = '\uFEFF';

    private final char delimiter;

    public CsvTableReader() {
        this(',');
    }

    public CsvTableReader(char delimiter) {
        this.delimiter = delimiter;
    }

    public RowSet read(byte[] content) throws IOException {
        String text = new String(content, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        return read(new StringReader(text));
    }

    public RowSet read(Reader reader) throws IOException {
        List<List<String>> records = parseRecords(new BufferedReader(reader));
        if (records.isEmpty()) {
            return RowSet.empty();
        }
        List<String> header = new ArrayList<>();
        for (String name : records.get(0)) {
            header.add(name.trim());
        }
        if (!header.isEmpty() && !header.get(0).isEmpty() && header.get(0).charAt(0) == BOM) {
            header.set(0, header.get(0).substring(1));
        }

        List<List<Object>> rows = new ArrayList<>();
        for (int i = 1; i < records.size(); i++) {
            List<String> record = records.get(i);
            if (record.size() > header.size()) {
                throw new IOException("Row %d has %d cells, header has %d".formatted(i + 1, record.size(), header.size()));
            }
            rows.add(new ArrayList<>(record));
        }
        return new RowSet(header, rows);
    }

    private List<List<String>> parseRecords(BufferedReader reader) throws IOException {
        List<List<String>> records = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean inQuotes = false;
        boolean cellStarted = false;
        int c;
        while ((c = reader.read()) != -1) {
            char ch = (char) c;
            if (inQuotes) {
                if (ch == '"') {
                    reader.mark(1);
                    int next = reader.read();
                    if (next == '"') {
                        cell.append('"');
                    } else {
                        inQuotes = false;
                        if (next != -1) {
                            reader.reset();
                        }
                    }
                } else {
                    cell.append(ch);
                }
                continue;
            }
            if (ch == '"' && cell.length() == 0) {
                inQuotes = true;
                cellStarted = true;
            } else if (ch == delimiter) {
                current.add(cell.toString());
                cell.setLength(0);
                cellStarted = true;
            } else if (ch == '\n') {
                endRecord(records, current, cell, cellStarted);
                current = new ArrayList<>();
                cellStarted = false;
            } else if (ch != '\r') {
                cell.append(ch);
                cellStarted = true;
            }
        }
        if (inQuotes) {
            throw new IOException("Unterminated quoted field");
        }
        endRecord(records, current, cell, cellStarted);
        return records;
    }

    private static void endRecord(List<List<String>> records, List<String> current, StringBuilder cell,
                                  boolean cellStarted) {
        if (!cellStarted && current.isEmpty()) {
            return;
        }
        current.add(cell.toString());
        cell.setLength(0);
        records.add(current);
    }
}
