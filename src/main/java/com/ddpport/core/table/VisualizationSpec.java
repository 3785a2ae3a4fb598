package com.ddpport.core.table;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Objects;

/**
 * Chart shown below a consent table. Rendering is up to the host; this only carries the declaration.
 */
public final class VisualizationSpec {

    public enum Type {
        AREA("area"),
        BAR("bar"),
        WORDCLOUD("wordcloud");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public enum DateFormat {
        MONTH("month"),
        HOUR_CYCLE("hour_cycle");

        private final String wireName;

        DateFormat(String wireName) {
            this.wireName = wireName;
        }
    }

    private final Type type;
    private final Translatable title;
    private final JSONObject options;

    private VisualizationSpec(Type type, Translatable title, JSONObject options) {
        this.type = Objects.requireNonNull(type);
        this.title = Objects.requireNonNull(title);
        this.options = options;
    }

    public static VisualizationSpec wordcloud(Translatable title, String textColumn, boolean tokenize) {
        JSONObject options = new JSONObject()
                .put("textColumn", textColumn)
                .put("tokenize", tokenize);
        return new VisualizationSpec(Type.WORDCLOUD, title, options);
    }

    /**
     * Counts rows per date bucket of {@code dateColumn}.
     */
    public static VisualizationSpec countByDate(Type type, Translatable title, String dateColumn,
                                                DateFormat dateFormat, Translatable valueLabel) {
        if (type == Type.WORDCLOUD) {
            throw new IllegalArgumentException("A word cloud has no date grouping");
        }
        JSONObject value = new JSONObject().put("aggregate", "count");
        if (valueLabel != null) {
            value.put("label", valueLabel.toJson());
        }
        JSONObject options = new JSONObject()
                .put("group", new JSONObject().put("column", dateColumn).put("dateFormat", dateFormat.wireName))
                .put("values", new JSONArray().put(value));
        return new VisualizationSpec(type, title, options);
    }

    public Type type() {
        return type;
    }

    public Translatable title() {
        return title;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject(options.toMap());
        json.put("title", title.toJson());
        json.put("type", type.wireName());
        return json;
    }
}
