package com.ddpport.core.tree;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens nested mapping/sequence structures into a single-level table keyed by dash-joined paths.
 * <p>
 * {@code {"a": {"b": [1, 2]}}} becomes {@code {"a-b-0": 1, "a-b-1": 2}}. Containers contribute no entry of
 * their own, so empty maps and lists disappear. Identical paths overwrite earlier values. The input is not
 * modified and the result preserves the input's iteration order.
 */
public final class TreeFlattener {
    static final String SEPARATOR = "-";

    private TreeFlattener() {
    }

    public static Map<String, Object> flatten(Object tree) {
        Map<String, Object> table = new LinkedHashMap<>();
        flattenInto(tree, "", table);
        return table;
    }

    private static void flattenInto(Object node, String path, Map<String, Object> table) {
        if (node instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                flattenInto(entry.getValue(), path + SEPARATOR + entry.getKey(), table);
            }
        } else if (node instanceof JSONObject object) {
            for (String key : object.keySet()) {
                flattenInto(object.opt(key), path + SEPARATOR + key, table);
            }
        } else if (node instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                flattenInto(list.get(i), path + SEPARATOR + i, table);
            }
        } else if (node instanceof JSONArray array) {
            for (int i = 0; i < array.length(); i++) {
                flattenInto(array.opt(i), path + SEPARATOR + i, table);
            }
        } else {
            Object leaf = JSONObject.NULL.equals(node) ? null : node;
            table.put(path.isEmpty() ? path : path.substring(SEPARATOR.length()), leaf);
        }
    }
}
