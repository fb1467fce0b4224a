package io.jsonkv.storage;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonSerializerTest {

    /** No properties: Jackson refuses to serialize it. */
    static final class Opaque {
    }

    public record Point(int x, int y) {
    }

    private static String text(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Test
    void compact_output_is_a_single_line_object() {
        var ser = new JsonSerializer<>(String.class, Integer.class, false);
        assertEquals("{\"a\":1}", text(ser.encode(Map.of("a", 1))));
        assertFalse(ser.isPretty());
    }

    @Test
    void pretty_output_is_indented() {
        var ser = new JsonSerializer<>(String.class, Integer.class, true);
        String json = text(ser.encode(Map.of("a", 1)));
        assertTrue(json.contains("\n"));
        assertTrue(json.contains("  \"a\""));
    }

    @Test
    void empty_map_encodes_as_empty_object() {
        var ser = new JsonSerializer<>(String.class, String.class, false);
        assertEquals("{}", text(ser.encode(new HashMap<>())));
        assertTrue(ser.decode("{}".getBytes(StandardCharsets.UTF_8)).isEmpty());
    }

    @Test
    void integer_keys_are_json_strings_and_decode_back() {
        var ser = new JsonSerializer<>(Integer.class, String.class, false);
        assertEquals("{\"7\":\"seven\"}", text(ser.encode(Map.of(7, "seven"))));
        assertEquals(Map.of(7, "seven"), ser.decode("{\"7\":\"seven\"}".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void record_values_decode_to_the_declared_type() {
        var ser = new JsonSerializer<>(String.class, Point.class, false);
        Map<String, Point> decoded = ser.decode("{\"p\":{\"x\":1,\"y\":2}}".getBytes(StandardCharsets.UTF_8));
        assertEquals(new Point(1, 2), decoded.get("p"));
    }

    @Test
    void malformed_input_is_a_deserialize_error() {
        var ser = new JsonSerializer<>(String.class, Integer.class, false);
        assertThrows(StoreException.DeserializeException.class,
                () -> ser.decode("{\"a\":".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void wrong_shape_is_a_deserialize_error() {
        var ser = new JsonSerializer<>(String.class, Integer.class, false);
        assertThrows(StoreException.DeserializeException.class,
                () -> ser.decode("{\"a\":\"not a number\"}".getBytes(StandardCharsets.UTF_8)));
        assertThrows(StoreException.DeserializeException.class,
                () -> ser.decode("[1,2,3]".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void json_null_document_is_a_deserialize_error() {
        var ser = new JsonSerializer<>(String.class, Integer.class, false);
        assertThrows(StoreException.DeserializeException.class,
                () -> ser.decode("null".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void unencodable_value_is_a_serialize_error() {
        var ser = new JsonSerializer<>(String.class, Opaque.class, false);
        assertThrows(StoreException.SerializeException.class, () -> ser.encode(Map.of("o", new Opaque())));
    }
}
