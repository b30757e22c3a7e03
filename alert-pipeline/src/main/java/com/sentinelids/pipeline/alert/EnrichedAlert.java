package com.sentinelids.pipeline.alert;

import java.time.Instant;
import java.util.List;

/**
 * A raw alert with its feature vector and classification attached.
 *
 * <p>
 * Created only after a successful scoring call. It is persisted and
 * republished as a single unit, so downstream consumers never observe a
 * partially enriched alert.
 * </p>
 *
 * @param alert           the originating raw alert
 * @param label           0 for normal, 1 for anomaly
 * @param confidence      classifier confidence in [0.0, 1.0]
 * @param featureVector   the vector the classifier was given
 * @param processedAt     enrichment completion time
 * @param sourceMessageId id of the raw stream entry this alert was built from
 *
 * @author Naveed Gung
 */
public record EnrichedAlert(
        RawAlert alert,
        int label,
        double confidence,
        List<Double> featureVector,
        Instant processedAt,
        String sourceMessageId) {

    public static final int NORMAL = 0;
    public static final int ANOMALY = 1;

    public EnrichedAlert {
        if (label != NORMAL && label != ANOMALY) {
            throw new IllegalArgumentException("Label must be 0 or 1, got " + label);
        }
        featureVector = List.copyOf(featureVector);
        confidence = Math.min(1.0, Math.max(0.0, confidence));
    }

    /** Build from the extractor's primitive vector. */
    public static EnrichedAlert of(RawAlert alert, int label, double confidence, double[] features,
            Instant processedAt, String sourceMessageId) {
        Double[] boxed = new Double[features.length];
        for (int i = 0; i < features.length; i++) {
            boxed[i] = features[i];
        }
        return new EnrichedAlert(alert, label, confidence, List.of(boxed), processedAt, sourceMessageId);
    }

    public boolean isAnomaly() {
        return label == ANOMALY;
    }

    /** Metric/log friendly prediction name. */
    public String predictionName() {
        return isAnomaly() ? "anomaly" : "normal";
    }
}
