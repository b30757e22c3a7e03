package com.sentinelids.pipeline.alert;

/**
 * Ingestion origin of a raw alert.
 *
 * <p>
 * Stamped into the {@code source} field before the alert enters the raw
 * stream. This is the only externally visible distinction between alerts
 * produced by the sensor tailer and alerts submitted manually.
 * </p>
 *
 * @author Naveed Gung
 */
public enum AlertSource {

    SNORT("snort"),
    CUSTOM("custom");

    private final String wireValue;

    AlertSource(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * Decode from the stream representation.
     *
     * @param value the {@code source} field value
     * @return the corresponding source
     * @throws IllegalArgumentException if the value is unknown
     */
    public static AlertSource fromWireValue(String value) {
        for (AlertSource source : values()) {
            if (source.wireValue.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown alert source: " + value);
    }
}
