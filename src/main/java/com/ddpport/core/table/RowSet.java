package com.ddpport.core.table;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Immutable rectangular table: ordered column names and rows of cell values.
 * Cells may be {@code null}; rows shorter than the header are padded with {@code null}.
 */
public final class RowSet {
    private static final RowSet EMPTY = new RowSet(List.of(), List.of());

    private final List<String> columns;
    private final List<List<Object>> rows;

    public RowSet(List<String> columns, List<? extends List<?>> rows) {
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            if (row.size() > this.columns.size()) {
                throw new IllegalArgumentException(
                        "Row has %d cells but only %d columns".formatted(row.size(), this.columns.size()));
            }
            List<Object> padded = new ArrayList<>(row);
            while (padded.size() < this.columns.size()) {
                padded.add(null);
            }
            copy.add(Collections.unmodifiableList(padded));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static RowSet empty() {
        return EMPTY;
    }

    /**
     * A one-column, one-row table carrying a notice for the participant.
     */
    public static RowSet notice(String column, String text) {
        return new RowSet(List.of(column), List.of(List.of(text)));
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Object get(int row, String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rows.get(row).get(index);
    }

    /**
     * Returns a copy where {@code null} cells of {@code column} are replaced by {@code replacement}.
     * Unknown columns leave the table unchanged.
     */
    public RowSet fillNulls(String column, Object replacement) {
        int index = columns.indexOf(column);
        if (index < 0) {
            return this;
        }
        List<List<Object>> filled = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> copy = new ArrayList<>(row);
            if (copy.get(index) == null) {
                copy.set(index, replacement);
            }
            filled.add(copy);
        }
        return new RowSet(columns, filled);
    }

    /**
     * Returns a copy with an extra column computed from an existing one.
     */
    public RowSet withDerivedColumn(String name, String source, Function<Object, Object> derive) {
        int index = columns.indexOf(source);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + source);
        }
        List<String> newColumns = new ArrayList<>(columns);
        newColumns.add(name);
        List<List<Object>> newRows = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> copy = new ArrayList<>(row);
            copy.add(derive.apply(row.get(index)));
            newRows.add(copy);
        }
        return new RowSet(newColumns, newRows);
    }

    /**
     * Splits the table into consecutive chunks of at most {@code chunkSize} rows.
     * An empty table yields a single empty chunk.
     */
    public List<RowSet> chunks(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        List<RowSet> chunks = new ArrayList<>();
        int numChunks = rows.size() / chunkSize + (rows.size() % chunkSize == 0 && !rows.isEmpty() ? 0 : 1);
        for (int i = 0; i < numChunks; i++) {
            int start = i * chunkSize;
            int end = Math.min(start + chunkSize, rows.size());
            chunks.add(new RowSet(columns, rows.subList(start, end)));
        }
        return chunks;
    }

    /**
     * One JSON object per row, keyed by column name; {@code null} cells become JSON null.
     */
    public JSONArray toRecords() {
        JSONArray records = new JSONArray();
        for (List<Object> row : rows) {
            JSONObject record = new JSONObject();
            for (int i = 0; i < columns.size(); i++) {
                Object cell = row.get(i);
                record.put(columns.get(i), cell == null ? JSONObject.NULL : cell);
            }
            records.put(record);
        }
        return records;
    }
}
