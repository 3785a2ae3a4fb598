package com.ddpport.core.table;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConsentTableTest {

    @Test
    void serializesColumnsDataAndCharts() {
        RowSet rows = new RowSet(List.of("Date standard format"), List.of(List.of("2023-01-05T15:04:05")));
        ConsentTable table = new ConsentTable("youtube_watch_history",
                Translatable.of("Watch history", "Kijkgeschiedenis"), rows,
                Translatable.same("description"),
                List.of(VisualizationSpec.countByDate(VisualizationSpec.Type.AREA, Translatable.same("Per month"),
                        "Date standard format", VisualizationSpec.DateFormat.MONTH, null)));

        JSONObject json = table.toJson();

        assertEquals("youtube_watch_history", json.getString("id"));
        assertEquals("Kijkgeschiedenis", json.getJSONObject("title").getString("nl"));
        assertEquals(new JSONArray(List.of("Date standard format")).toString(), json.getJSONArray("columns").toString());
        JSONObject chart = json.getJSONArray("visualizations").getJSONObject(0);
        assertEquals("area", chart.getString("type"));
        JSONObject group = chart.getJSONObject("group");
        assertEquals("month", group.getString("dateFormat"));
        assertFalse(chart.getJSONArray("values").getJSONObject(0).has("label"));
    }

    @Test
    void wordcloudOptions() {
        JSONObject chart = VisualizationSpec.wordcloud(Translatable.same("Words"), "Search Terms", true).toJson();

        assertEquals("wordcloud", chart.getString("type"));
        assertEquals("Search Terms", chart.getString("textColumn"));
        assertEquals(true, chart.getBoolean("tokenize"));
        assertThrows(IllegalArgumentException.class, () -> VisualizationSpec.countByDate(
                VisualizationSpec.Type.WORDCLOUD, Translatable.same("x"), "Date", VisualizationSpec.DateFormat.MONTH, null));
    }

    @Test
    void translatableFallsBackToEnglish() {
        Translatable text = Translatable.of("Hello", "Hallo");

        assertEquals("Hallo", text.get("nl"));
        assertEquals("Hello", text.get("de"));
    }
}
