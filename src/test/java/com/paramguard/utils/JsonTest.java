package com.paramguard.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class JsonTest {

    record Item(String itemName, String note) {}

    @Test
    void testToSnakeCase() {
        assertEquals("get_user_by_id", Json.toSnakeCase("getUserById"));
        assertEquals("name", Json.toSnakeCase("name"));
    }

    @Test
    void testReadObject_KeepsOrderAndTypes() {
        Map<String, Object> fields = Json.readObject("{\"b\": 1, \"a\": [\"x\", 2.5], \"c\": null, \"d\": true}");
        assertEquals(List.of("b", "a", "c", "d"), List.copyOf(fields.keySet()));
        assertEquals(1, fields.get("b"));
        assertEquals(List.of("x", 2.5), fields.get("a"));
        assertNull(fields.get("c"));
        assertEquals(true, fields.get("d"));
    }

    @Test
    void testReadObject_NonObjectBodiesYieldEmptyMap() {
        assertTrue(Json.readObject("[1, 2]").isEmpty());
        assertTrue(Json.readObject("42").isEmpty());
        assertTrue(Json.readObject("   ").isEmpty());
        assertTrue(Json.readObject(null).isEmpty());
    }

    @Test
    void testReadObject_Malformed() {
        assertThrows(IllegalArgumentException.class, () -> Json.readObject("{\"a\": "));
    }

    @Test
    void testSerialize_OmitsNulls() {
        assertEquals("{\"item_name\":\"x\"}", Json.serialize(new Item("x", null)));
    }
}
