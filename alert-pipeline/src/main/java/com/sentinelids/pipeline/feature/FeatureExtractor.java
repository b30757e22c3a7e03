package com.sentinelids.pipeline.feature;

import com.sentinelids.pipeline.alert.RawAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Maps a raw alert onto the fixed-length vector the scoring capability expects.
 *
 * <p>
 * The vector is the concatenation of the following groups, in this order. The
 * order is part of the scoring contract and must not change without bumping
 * {@link #VERSION}.
 * </p>
 *
 * <pre>
 * Index  Width  Group
 * -----  -----  -----
 *   0      6    address   src/dst octet entropy, src/dst private, src/dst multicast
 *   6      6    port      src/dst port, src/dst privileged, src/dst service class
 *  12      5    protocol  one-hot TCP, UDP, ICMP, HTTP, HTTPS
 *  17      6    message   length, tokens, special chars, "attack", "scan", "exploit"
 *  23      3    temporal  placeholders, always 0.0
 *  26      2    rule      sensor rule id, rule id above 1,000,000
 * -----  -----
 * Total: 28
 * </pre>
 *
 * <p>
 * Extraction never fails. Missing or malformed inputs degrade to each group's
 * documented default, and a group that throws anyway contributes zeros.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class FeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(FeatureExtractor.class);

    /** Length of every vector produced by this extractor version. */
    public static final int FEATURE_LENGTH = 28;

    public static final int VERSION = 1;

    private final List<FeatureGroup> groups = List.of(
            new AddressFeatures(),
            new PortFeatures(),
            new ProtocolFeatures(),
            new MessageFeatures(),
            new TemporalFeatures(),
            new RuleFeatures());

    public FeatureExtractor() {
        int total = groups.stream().mapToInt(FeatureGroup::width).sum();
        if (total != FEATURE_LENGTH) {
            throw new IllegalStateException(
                    "Feature groups produce " + total + " values, expected " + FEATURE_LENGTH);
        }
    }

    /**
     * Extract the feature vector for one alert.
     *
     * @param alert the alert, may be null
     * @return a new array of exactly {@link #FEATURE_LENGTH} values
     */
    public double[] extract(RawAlert alert) {
        double[] features = new double[FEATURE_LENGTH];
        if (alert == null) {
            return features;
        }

        int offset = 0;
        for (FeatureGroup group : groups) {
            try {
                group.extract(alert, features, offset);
            } catch (RuntimeException e) {
                Arrays.fill(features, offset, offset + group.width(), 0.0);
                log.warn("{} failed for alert src={} dst={}, using defaults: {}",
                        group.getClass().getSimpleName(), alert.sourceIp(), alert.destinationIp(), e.toString());
            }
            offset += group.width();
        }
        return features;
    }

    /** One contiguous slice of the feature vector. */
    interface FeatureGroup {

        /** Number of values this group writes. */
        int width();

        /**
         * Write exactly {@link #width()} values into {@code into} starting at
         * {@code offset}.
         */
        void extract(RawAlert alert, double[] into, int offset);
    }
}
