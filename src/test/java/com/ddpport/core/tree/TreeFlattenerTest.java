package com.ddpport.core.tree;

import com.ddpport.core.json.OrderedJsonReader;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeFlattenerTest {

    @Test
    void joinsPathsWithDashesInDocumentOrder() {
        Object tree = OrderedJsonReader.read("{\"a\": {\"b\": [1, 2]}, \"c\": \"x\"}");

        Map<String, Object> flat = TreeFlattener.flatten(tree);

        assertEquals(List.of("a-b-0", "a-b-1", "c"), new ArrayList<>(flat.keySet()));
        assertEquals(1, flat.get("a-b-0"));
        assertEquals(2, flat.get("a-b-1"));
        assertEquals("x", flat.get("c"));
    }

    @Test
    void emptyContainersContributeNothing() {
        Object tree = OrderedJsonReader.read("{\"a\": {}, \"b\": [], \"c\": {\"d\": []}, \"e\": true}");

        Map<String, Object> flat = TreeFlattener.flatten(tree);

        assertEquals(Map.of("e", true), flat);
    }

    @Test
    void scalarRootIsStoredUnderEmptyKey() {
        assertEquals(Map.of("", "hello"), TreeFlattener.flatten("hello"));
    }

    @Test
    void nullLeavesAreKept() {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("missing", null);

        Map<String, Object> flat = TreeFlattener.flatten(tree);

        assertTrue(flat.containsKey("missing"));
        assertNull(flat.get("missing"));
    }

    @Test
    void acceptsOrgJsonStructures() {
        JSONObject object = new JSONObject()
                .put("list", new JSONArray().put("first").put(JSONObject.NULL))
                .put("n", 7);

        Map<String, Object> flat = TreeFlattener.flatten(object);

        assertEquals("first", flat.get("list-0"));
        assertTrue(flat.containsKey("list-1"));
        assertNull(flat.get("list-1"));
        assertEquals(7, flat.get("n"));
        assertEquals(3, flat.size());
    }

    @Test
    void doesNotModifyInput() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("b", List.of("x"));
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("a", inner);

        TreeFlattener.flatten(tree);

        assertEquals(Map.of("a", Map.of("b", List.of("x"))), tree);
    }

    @Test
    void repeatedFlatteningGivesSameKeysForEveryLeaf() {
        Object tree = OrderedJsonReader.read("""
                {"Activity": {"Video Browsing History": {"VideoList": [
                    {"Date": "2023-01-01 10:00:00", "Link": "v1"},
                    {"Date": "2023-01-02 11:00:00", "Link": "v2", "Tags": ["a", "b"]}
                ]}},
                 "Profile": {"userName": "someone", "bio": null},
                 "Counts": [[1, 2], [3]]}
                """);

        Map<String, Object> first = TreeFlattener.flatten(tree);
        Map<String, Object> second = TreeFlattener.flatten(tree);

        assertEquals(new ArrayList<>(first.entrySet()), new ArrayList<>(second.entrySet()));
        assertEquals(11, first.size());
        assertEquals("b", first.get("Activity-Video Browsing History-VideoList-1-Tags-1"));
        assertEquals(3, first.get("Counts-1-0"));
        assertTrue(first.containsKey("Profile-bio"));
        assertEquals(List.of("2023-01-01 10:00:00", "v1", "2023-01-02 11:00:00", "v2", "a", "b",
                "someone", "null", "1", "2", "3"),
                first.values().stream().map(String::valueOf).toList());
    }
}
