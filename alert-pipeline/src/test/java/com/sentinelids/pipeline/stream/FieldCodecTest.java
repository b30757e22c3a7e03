package com.sentinelids.pipeline.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldCodecTest {

    private final FieldCodec codec = new FieldCodec(new ObjectMapper());

    @Test
    void shouldStringifyScalarsAndJsonEncodeStructures() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("source_ip", "10.0.0.5");
        record.put("destination_port", 22);
        record.put("features", List.of(1.5, 0.0));
        record.put("meta", Map.of("k", "v"));
        record.put("timestamp", Instant.parse("2024-01-01T00:00:00Z"));

        Map<String, String> fields = codec.encodeFields(record);

        assertEquals("10.0.0.5", fields.get("source_ip"));
        assertEquals("22", fields.get("destination_port"));
        assertEquals("[1.5,0.0]", fields.get("features"));
        assertEquals("{\"k\":\"v\"}", fields.get("meta"));
        assertEquals("2024-01-01T00:00:00Z", fields.get("timestamp"));
    }

    @Test
    void shouldDropNullValues() {
        Map<String, Object> record = new HashMap<>();
        record.put("a", "x");
        record.put("b", null);

        Map<String, String> fields = codec.encodeFields(record);

        assertEquals(Map.of("a", "x"), fields);
    }

    @Test
    void shouldRejectEmptyOrBlankRecords() {
        assertThrows(InvalidRecordException.class, () -> codec.encodeFields(Map.of()));
        assertThrows(InvalidRecordException.class, () -> codec.encodeFields(null));
        assertThrows(InvalidRecordException.class, () -> codec.encodeFields(Map.of(" ", "x")));

        Map<String, Object> allNull = new HashMap<>();
        allNull.put("a", null);
        assertThrows(InvalidRecordException.class, () -> codec.encodeFields(allNull));
    }

    @Test
    void shouldDecodeJsonValues() {
        assertEquals(22, codec.decode("22"));
        assertEquals(List.of(1.5, 0.0), codec.decode("[1.5,0.0]"));
        assertEquals(Map.of("k", "v"), codec.decode("{\"k\":\"v\"}"));
        assertEquals(true, codec.decode("true"));
    }

    @Test
    void shouldFallBackToRawStringWhenNotJson() {
        assertEquals("10.0.0.5", codec.decode("10.0.0.5"));
        assertEquals("ET SCAN nmap", codec.decode("ET SCAN nmap"));
        assertEquals("404 not found", codec.decode("404 not found"));
        assertEquals("2024-01-01T00:00:00Z", codec.decode("2024-01-01T00:00:00Z"));
        assertEquals("", codec.decode(""));
        assertNull(codec.decode(null));
    }
}
