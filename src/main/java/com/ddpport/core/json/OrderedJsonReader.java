package com.ddpport.core.json;

import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.ByteArrayInputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses JSON into {@link LinkedHashMap}/{@link ArrayList} trees that keep the document's member order.
 * {@link JSONObject} does not preserve member order, which matters when flattened keys tie.
 * JSON {@code null} becomes Java {@code null}. Malformed input raises {@link org.json.JSONException}.
 */
public final class OrderedJsonReader {
    private OrderedJsonReader() {
    }

    public static Object read(byte[] bytes) {
        int offset = hasUtf8Bom(bytes) ? 3 : 0;
        return read(new InputStreamReader(
                new ByteArrayInputStream(bytes, offset, bytes.length - offset), StandardCharsets.UTF_8));
    }

    public static Object read(String text) {
        return read(new JSONTokener(text));
    }

    public static Object read(Reader reader) {
        return read(new JSONTokener(reader));
    }

    private static Object read(JSONTokener tokener) {
        Object value = readValue(tokener);
        if (tokener.nextClean() != 0) {
            throw tokener.syntaxError("Unexpected content after the JSON value");
        }
        return value;
    }

    private static Object readValue(JSONTokener tokener) {
        char c = tokener.nextClean();
        switch (c) {
            case '{':
                return readObject(tokener);
            case '[':
                return readArray(tokener);
            case 0:
                throw tokener.syntaxError("Unexpected end of JSON input");
            default:
                tokener.back();
                Object scalar = tokener.nextValue();
                return JSONObject.NULL.equals(scalar) ? null : scalar;
        }
    }

    private static Map<String, Object> readObject(JSONTokener tokener) {
        Map<String, Object> object = new LinkedHashMap<>();
        if (tokener.nextClean() == '}') {
            return object;
        }
        tokener.back();
        while (true) {
            char quote = tokener.nextClean();
            if (quote != '"' && quote != '\'') {
                throw tokener.syntaxError("Expected a quoted member name");
            }
            String key = tokener.nextString(quote);
            if (tokener.nextClean() != ':') {
                throw tokener.syntaxError("Expected ':' after member name '" + key + "'");
            }
            object.put(key, readValue(tokener));
            char next = tokener.nextClean();
            if (next == '}') {
                return object;
            }
            if (next != ',') {
                throw tokener.syntaxError("Expected ',' or '}' in object");
            }
        }
    }

    private static List<Object> readArray(JSONTokener tokener) {
        List<Object> array = new ArrayList<>();
        if (tokener.nextClean() == ']') {
            return array;
        }
        tokener.back();
        while (true) {
            array.add(readValue(tokener));
            char next = tokener.nextClean();
            if (next == ']') {
                return array;
            }
            if (next != ',') {
                throw tokener.syntaxError("Expected ',' or ']' in array");
            }
        }
    }

    private static boolean hasUtf8Bom(byte[] bytes) {
        return bytes.length >= 3
                && (bytes[0] & 0xFF) == 0xEF
                && (bytes[1] & 0xFF) == 0xBB
                && (bytes[2] & 0xFF) == 0xBF;
    }
}
