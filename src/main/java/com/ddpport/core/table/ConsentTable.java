package com.ddpport.core.table;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Objects;

/**
 * A named table presented to the participant for review before donation.
 * Created by a platform's extraction and never modified afterwards.
 */
public record ConsentTable(String name,
                           Translatable title,
                           RowSet rows,
                           Translatable description,
                           List<VisualizationSpec> visualizations) {

    public ConsentTable {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(rows, "rows");
        description = description == null ? Translatable.same("") : description;
        visualizations = visualizations == null ? List.of() : List.copyOf(visualizations);
    }

    public ConsentTable(String name, Translatable title, RowSet rows, Translatable description) {
        this(name, title, rows, description, List.of());
    }

    public JSONObject toJson() {
        JSONArray charts = new JSONArray();
        for (VisualizationSpec visualization : visualizations) {
            charts.put(visualization.toJson());
        }
        return new JSONObject()
                .put("id", name)
                .put("title", title.toJson())
                .put("description", description.toJson())
                .put("columns", new JSONArray(rows.columns()))
                .put("data", rows.toRecords())
                .put("visualizations", charts);
    }
}
