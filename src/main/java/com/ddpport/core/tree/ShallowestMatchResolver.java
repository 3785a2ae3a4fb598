package com.ddpport.core.tree;

import com.ddpport.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Looks values up in a table produced by {@link TreeFlattener} without knowing their exact path.
 * <p>
 * A key matches when the search text occurs anywhere in it. The search text is a regular-expression
 * fragment, so plain words behave as a substring search. {@link #findFirst} prefers the least nested
 * key (fewest separators); among equally shallow keys the one iterated last wins.
 * Lookup never throws: any failure is logged and reported as "no match".
 */
public final class ShallowestMatchResolver {
    private static final Logger LOGGER = AppLogger.get();

    private ShallowestMatchResolver() {
    }

    /**
     * @return the value of the shallowest matching key as a string, or {@code ""} when nothing matches
     */
    public static String findFirst(Map<String, ?> table, String keyToMatch) {
        String out = "";
        int depth = Integer.MAX_VALUE;
        try {
            Pattern pattern = Pattern.compile(keyToMatch);
            for (Map.Entry<String, ?> entry : table.entrySet()) {
                String key = entry.getKey();
                if (!pattern.matcher(key).find()) {
                    continue;
                }
                int currentDepth = depthOf(key);
                if (currentDepth <= depth) {
                    depth = currentDepth;
                    out = render(entry.getValue());
                }
            }
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Lookup of '" + keyToMatch + "' failed: " + ex.getMessage(), ex);
            return "";
        }
        return out;
    }

    /**
     * @return the values of every matching key, in table order
     */
    public static List<String> findAll(Map<String, ?> table, String keyToMatch) {
        List<String> out = new ArrayList<>();
        try {
            Pattern pattern = Pattern.compile(keyToMatch);
            for (Map.Entry<String, ?> entry : table.entrySet()) {
                if (pattern.matcher(entry.getKey()).find()) {
                    out.add(render(entry.getValue()));
                }
            }
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Lookup of '" + keyToMatch + "' failed: " + ex.getMessage(), ex);
            return new ArrayList<>();
        }
        return out;
    }

    static int depthOf(String key) {
        int count = 0;
        int index = key.indexOf(TreeFlattener.SEPARATOR);
        while (index >= 0) {
            count++;
            index = key.indexOf(TreeFlattener.SEPARATOR, index + 1);
        }
        return count;
    }

    private static String render(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
