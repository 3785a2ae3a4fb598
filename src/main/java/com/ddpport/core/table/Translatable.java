package com.ddpport.core.table;

import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Text shown to participants, keyed by language code ({@code en}, {@code nl}).
 */
public record Translatable(Map<String, String> translations) {

    public Translatable {
        translations = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(translations)));
    }

    public static Translatable of(String en, String nl) {
        Map<String, String> translations = new LinkedHashMap<>();
        translations.put("en", en);
        translations.put("nl", nl);
        return new Translatable(translations);
    }

    public static Translatable same(String text) {
        return of(text, text);
    }

    public String get(String language) {
        String text = translations.get(language);
        return text != null ? text : translations.getOrDefault("en", "");
    }

    public JSONObject toJson() {
        return new JSONObject(translations);
    }
}
