package com.sentinelids.pipeline.alert;

import java.time.Instant;
import java.util.Locale;

/**
 * A network intrusion alert as it was appended to the raw stream.
 *
 * @param sourceIp           source address, {@code 0.0.0.0} when unknown
 * @param destinationIp      destination address, {@code 0.0.0.0} when unknown
 * @param sourcePort         source port, 0 when unknown
 * @param destinationPort    destination port, 0 when unknown
 * @param protocol           upper-cased protocol name, {@code UNKNOWN} when absent
 * @param message            sensor alert message, never null
 * @param sensorRuleId       sensor rule (signature) id, null when absent
 * @param timestamp          event time, null when absent or unparseable
 * @param source             ingestion origin, null for records appended by other producers
 * @param ingestionTimestamp time the ingestion service accepted the record
 *
 * @author Naveed Gung
 */
public record RawAlert(
        String sourceIp,
        String destinationIp,
        int sourcePort,
        int destinationPort,
        String protocol,
        String message,
        Long sensorRuleId,
        Instant timestamp,
        AlertSource source,
        Instant ingestionTimestamp) {

    public static final String UNKNOWN_IP = "0.0.0.0";
    public static final String UNKNOWN_PROTOCOL = "UNKNOWN";

    public RawAlert {
        sourceIp = sourceIp == null || sourceIp.isBlank() ? UNKNOWN_IP : sourceIp.trim();
        destinationIp = destinationIp == null || destinationIp.isBlank() ? UNKNOWN_IP : destinationIp.trim();
        protocol = protocol == null || protocol.isBlank()
                ? UNKNOWN_PROTOCOL
                : protocol.trim().toUpperCase(Locale.ROOT);
        message = message == null ? "" : message;
    }

    /** True when the sensor attached a rule id. */
    public boolean hasSensorRule() {
        return sensorRuleId != null;
    }
}
