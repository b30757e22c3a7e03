package com.sentinelids.pipeline.scoring;

/**
 * Output of the scoring capability.
 *
 * @param label      0 for normal, 1 for anomaly
 * @param confidence confidence in the label in [0.0, 1.0], NaN when the
 *                   capability does not report one
 *
 * @author Naveed Gung
 */
public record Classification(int label, double confidence) {

    /** Classification without a confidence. */
    public static Classification labelOnly(int label) {
        return new Classification(label, Double.NaN);
    }

    public boolean hasConfidence() {
        return !Double.isNaN(confidence);
    }

    public boolean isValidLabel() {
        return label == 0 || label == 1;
    }
}
