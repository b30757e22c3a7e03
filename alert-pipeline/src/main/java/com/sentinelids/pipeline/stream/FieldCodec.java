package com.sentinelids.pipeline.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Component;

import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes values onto stream fields and back.
 *
 * <p>
 * Stream fields are flat strings. Maps, collections and arrays are written as
 * JSON; every other value is stringified. Readers cannot tell the two apart
 * from the field name alone, so {@link #decode(String)} tries JSON first and
 * falls back to the plain string.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class FieldCodec {

    private final ObjectMapper objectMapper;
    /** Whole-value reader: "404 not found" must stay a string, not become 404. */
    private final ObjectReader valueReader;

    public FieldCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.valueReader = objectMapper.readerFor(Object.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Encode a whole record. Null values are dropped since stream fields cannot
     * hold them.
     *
     * @throws InvalidRecordException if the record is empty, has a blank field
     *                                name or a value cannot be serialized
     */
    public Map<String, String> encodeFields(Map<String, ?> record) {
        if (record == null || record.isEmpty()) {
            throw new InvalidRecordException("Record has no fields");
        }
        Map<String, String> fields = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : record.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new InvalidRecordException("Record contains a blank field name");
            }
            if (entry.getValue() != null) {
                fields.put(entry.getKey(), encode(entry.getValue()));
            }
        }
        if (fields.isEmpty()) {
            throw new InvalidRecordException("Record has only null values");
        }
        return fields;
    }

    /**
     * Encode a single value for the wire.
     *
     * @throws InvalidRecordException if a structured value cannot be serialized
     */
    public String encode(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?> || value.getClass().isArray()) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new InvalidRecordException("Cannot serialize " + value.getClass().getSimpleName()
                        + " field value: " + e.getOriginalMessage(), e);
            }
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        return String.valueOf(value);
    }

    /**
     * Decode a wire value: the parsed JSON value when the string is valid
     * JSON, otherwise the string itself.
     */
    public Object decode(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return raw;
        }
        try {
            return valueReader.readValue(trimmed);
        } catch (JsonProcessingException e) {
            return raw;
        }
    }

    /** Serialize a whole value as JSON, used for cache payloads. */
    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InvalidRecordException("Cannot serialize " + value.getClass().getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }
}
