package com.sentinelids.pipeline.alert;

import com.sentinelids.pipeline.stream.FieldCodec;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-mapping table between alert records and stream fields.
 *
 * <p>
 * Schema version 1:
 * </p>
 *
 * <pre>
 * Field                Record component               Encoding
 * -----                ----------------               --------
 * source_ip            RawAlert.sourceIp              string
 * destination_ip       RawAlert.destinationIp         string
 * source_port          RawAlert.sourcePort            integer
 * destination_port     RawAlert.destinationPort       integer
 * protocol             RawAlert.protocol              string
 * alert_message        RawAlert.message               string (alias: message)
 * snort_sid            RawAlert.sensorRuleId          integer, omitted when absent (alias: sensor_rule_id)
 * timestamp            RawAlert.timestamp             ISO-8601
 * source               RawAlert.source                snort | custom
 * ingestion_timestamp  RawAlert.ingestionTimestamp    ISO-8601
 * ml_prediction        EnrichedAlert.label            0 | 1
 * ml_confidence        EnrichedAlert.confidence       decimal
 * features             EnrichedAlert.featureVector    JSON array
 * processed_timestamp  EnrichedAlert.processedAt      ISO-8601
 * source_message_id    EnrichedAlert.sourceMessageId  raw stream entry id
 * schema_version       -                              integer
 * </pre>
 *
 * <p>
 * Decoding is lenient. String fields are taken verbatim, only a JSON string
 * literal is unwrapped. Numeric and structured fields may arrive stringified
 * or JSON-encoded. Missing or malformed values fall back to the
 * {@link RawAlert} defaults.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class AlertWireFormat {

    public static final int SCHEMA_VERSION = 1;

    public static final String SOURCE_IP = "source_ip";
    public static final String DESTINATION_IP = "destination_ip";
    public static final String SOURCE_PORT = "source_port";
    public static final String DESTINATION_PORT = "destination_port";
    public static final String PROTOCOL = "protocol";
    public static final String MESSAGE = "alert_message";
    public static final String MESSAGE_ALIAS = "message";
    public static final String RULE_ID = "snort_sid";
    public static final String RULE_ID_ALIAS = "sensor_rule_id";
    public static final String TIMESTAMP = "timestamp";
    public static final String SOURCE = "source";
    public static final String INGESTION_TIMESTAMP = "ingestion_timestamp";

    public static final String LABEL = "ml_prediction";
    public static final String CONFIDENCE = "ml_confidence";
    public static final String FEATURES = "features";
    public static final String PROCESSED_TIMESTAMP = "processed_timestamp";
    public static final String SOURCE_MESSAGE_ID = "source_message_id";
    public static final String SCHEMA_VERSION_FIELD = "schema_version";

    private final FieldCodec codec;

    public AlertWireFormat(FieldCodec codec) {
        this.codec = codec;
    }

    /** Decode a raw alert. Never throws. */
    public RawAlert decodeRaw(Map<String, String> fields) {
        String message = text(fields, MESSAGE);
        return new RawAlert(
                text(fields, SOURCE_IP),
                text(fields, DESTINATION_IP),
                asInt(value(fields, SOURCE_PORT)),
                asInt(value(fields, DESTINATION_PORT)),
                text(fields, PROTOCOL),
                message != null ? message : text(fields, MESSAGE_ALIAS),
                asLong(firstPresent(fields, RULE_ID, RULE_ID_ALIAS)),
                asInstant(text(fields, TIMESTAMP)),
                asSource(text(fields, SOURCE)),
                asInstant(text(fields, INGESTION_TIMESTAMP)));
    }

    /** Encode a raw alert; absent optional components are omitted. */
    public Map<String, Object> encodeRaw(RawAlert alert) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(SOURCE_IP, alert.sourceIp());
        record.put(DESTINATION_IP, alert.destinationIp());
        record.put(SOURCE_PORT, alert.sourcePort());
        record.put(DESTINATION_PORT, alert.destinationPort());
        record.put(PROTOCOL, alert.protocol());
        record.put(MESSAGE, alert.message());
        if (alert.sensorRuleId() != null) {
            record.put(RULE_ID, alert.sensorRuleId());
        }
        if (alert.timestamp() != null) {
            record.put(TIMESTAMP, alert.timestamp().toString());
        }
        if (alert.source() != null) {
            record.put(SOURCE, alert.source().getWireValue());
        }
        if (alert.ingestionTimestamp() != null) {
            record.put(INGESTION_TIMESTAMP, alert.ingestionTimestamp().toString());
        }
        return record;
    }

    /** Encode an enriched alert as one record for the processed stream and cache. */
    public Map<String, Object> encodeEnriched(EnrichedAlert enriched) {
        Map<String, Object> record = encodeRaw(enriched.alert());
        record.put(LABEL, enriched.label());
        record.put(CONFIDENCE, enriched.confidence());
        record.put(FEATURES, enriched.featureVector());
        record.put(PROCESSED_TIMESTAMP, enriched.processedAt().toString());
        record.put(SOURCE_MESSAGE_ID, enriched.sourceMessageId());
        record.put(SCHEMA_VERSION_FIELD, SCHEMA_VERSION);
        return record;
    }

    /**
     * Decode an entry of the processed stream.
     *
     * @throws IllegalArgumentException if the entry carries no valid label
     */
    public EnrichedAlert decodeEnriched(Map<String, String> fields) {
        Object label = value(fields, LABEL);
        if (!(label instanceof Number) && !(label instanceof String)) {
            throw new IllegalArgumentException("Entry has no " + LABEL + " field");
        }
        List<Double> features = new ArrayList<>();
        if (value(fields, FEATURES) instanceof List<?> values) {
            for (Object v : values) {
                features.add(v instanceof Number n ? n.doubleValue() : 0.0);
            }
        }
        Instant processedAt = asInstant(text(fields, PROCESSED_TIMESTAMP));
        return new EnrichedAlert(
                decodeRaw(fields),
                asInt(label),
                asDouble(value(fields, CONFIDENCE)),
                features,
                processedAt != null ? processedAt : Instant.EPOCH,
                text(fields, SOURCE_MESSAGE_ID));
    }

    private Object value(Map<String, String> fields, String name) {
        return fields == null ? null : codec.decode(fields.get(name));
    }

    /**
     * A string-typed field: the wire value as is, except that a JSON string
     * literal is unwrapped. Other JSON shapes are kept verbatim.
     */
    private String text(Map<String, String> fields, String name) {
        String raw = fields == null ? null : fields.get(name);
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")
                && codec.decode(trimmed) instanceof String unquoted) {
            return unquoted;
        }
        return raw;
    }

    private Object firstPresent(Map<String, String> fields, String name, String alias) {
        Object primary = value(fields, name);
        return primary != null ? primary : value(fields, alias);
    }

    private static int asInt(Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return (int) Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private static Long asLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static double asDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }

    private static AlertSource asSource(Object value) {
        if (!(value instanceof String s)) {
            return null;
        }
        try {
            return AlertSource.fromWireValue(s.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** ISO-8601 instant, or a zone-less local date-time taken as UTC. */
    static Instant asInstant(Object value) {
        if (!(value instanceof String s) || s.isBlank()) {
            return null;
        }
        String text = s.trim();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
