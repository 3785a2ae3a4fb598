package com.ddpport.core.table;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RowSetTest {

    private static RowSet numbered(int rows) {
        List<List<Object>> data = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            data.add(List.of(i));
        }
        return new RowSet(List.of("n"), data);
    }

    @Test
    void padsShortRowsWithNull() {
        RowSet rows = new RowSet(List.of("a", "b"), List.of(List.of("x")));

        assertEquals(Arrays.asList("x", null), rows.rows().get(0));
        assertNull(rows.get(0, "b"));
    }

    @Test
    void rejectsRowsWiderThanHeader() {
        assertThrows(IllegalArgumentException.class,
                () -> new RowSet(List.of("a"), List.of(List.of("x", "y"))));
    }

    @Test
    void isImmutable() {
        RowSet rows = new RowSet(List.of("a"), List.of(List.of("x")));

        assertThrows(UnsupportedOperationException.class, () -> rows.rows().add(List.of("y")));
        assertThrows(UnsupportedOperationException.class, () -> rows.rows().get(0).set(0, "z"));
    }

    @Test
    void fillNullsReturnsCopy() {
        RowSet rows = new RowSet(List.of("Title", "Channel"),
                List.of(Arrays.asList("video", null), List.of("other", "chan")));

        RowSet filled = rows.fillNulls("Channel", "");

        assertEquals("", filled.get(0, "Channel"));
        assertEquals("chan", filled.get(1, "Channel"));
        assertNull(rows.get(0, "Channel"));
        assertSame(rows, rows.fillNulls("Unknown", ""));
    }

    @Test
    void derivedColumnIsAppended() {
        RowSet rows = new RowSet(List.of("Date"), List.of(List.of("a"), List.of("b")));

        RowSet derived = rows.withDerivedColumn("Upper", "Date", value -> ((String) value).toUpperCase());

        assertEquals(List.of("Date", "Upper"), derived.columns());
        assertEquals("B", derived.get(1, "Upper"));
        assertThrows(IllegalArgumentException.class, () -> rows.withDerivedColumn("x", "missing", v -> v));
    }

    @Test
    void chunksSplitRowsInOrder() {
        List<RowSet> chunks = numbered(5).chunks(2);

        assertEquals(3, chunks.size());
        assertEquals(2, chunks.get(0).size());
        assertEquals(2, chunks.get(1).size());
        assertEquals(1, chunks.get(2).size());
        assertEquals(4, chunks.get(2).get(0, "n"));
    }

    @Test
    void exactMultipleHasNoTrailingEmptyChunk() {
        List<RowSet> chunks = numbered(4).chunks(2);

        assertEquals(2, chunks.size());
        assertTrue(chunks.stream().noneMatch(RowSet::isEmpty));
    }

    @Test
    void emptyTableIsOneEmptyChunk() {
        List<RowSet> chunks = RowSet.empty().chunks(10);

        assertEquals(1, chunks.size());
        assertTrue(chunks.get(0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> numbered(1).chunks(0));
    }

    @Test
    void recordsUseColumnNamesAndJsonNull() {
        RowSet rows = new RowSet(List.of("a", "b"), List.of(Arrays.asList("x", null)));

        JSONArray records = rows.toRecords();

        JSONObject record = records.getJSONObject(0);
        assertEquals("x", record.getString("a"));
        assertTrue(record.isNull("b"));
        assertTrue(record.has("b"));
    }

    @Test
    void noticeIsSingleCell() {
        RowSet notice = RowSet.notice("No data found", "No data found");

        assertEquals(List.of("No data found"), notice.columns());
        assertEquals(1, notice.size());
    }
}
