package com.sentinelids.pipeline.scoring;

import com.sentinelids.pipeline.alert.RawAlert;
import com.sentinelids.pipeline.config.ScoringConfig;
import com.sentinelids.pipeline.feature.FeatureExtractor;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class LinearScoringModelTest {

    private final FeatureExtractor extractor = new FeatureExtractor();
    private final LinearScoringModel model = new LinearScoringModel(new ScoringConfig());

    private double[] features(String message, String protocol) {
        return extractor.extract(new RawAlert("10.0.0.5", "192.168.1.10", 51515, 22, protocol, message,
                null, Instant.EPOCH, null, null));
    }

    @Test
    void shouldFlagExploitTrafficAsAnomaly() {
        Classification result = model.classify(features("Exploit attack detected", "TCP"));

        assertEquals(1, result.label());
        assertTrue(result.hasConfidence());
        assertTrue(result.confidence() >= 0.5 && result.confidence() <= 1.0);
    }

    @Test
    void shouldTreatQuietTrafficAsNormal() {
        Classification result = model.classify(features("heartbeat", "UDP"));

        assertEquals(0, result.label());
        assertTrue(result.confidence() >= 0.5);
    }

    @Test
    void shouldRejectWrongLength() {
        assertThrows(ScoringException.class, () -> model.classify(new double[3]));
        assertThrows(ScoringException.class, () -> model.classify(null));
    }

    @Test
    void shouldRejectNaNFeatures() {
        double[] features = new double[FeatureExtractor.FEATURE_LENGTH];
        features[21] = Double.NaN;

        assertThrows(ScoringException.class, () -> model.classify(features));
    }

    @Test
    void shouldRequireOneWeightPerFeature() {
        assertThrows(IllegalArgumentException.class, () -> new LinearScoringModel(new double[5], 0.0, 0.5));
    }

    @Test
    void shouldGiveSameAnswerUnderConcurrentCalls() throws Exception {
        double[] input = features("ET SCAN Potential SSH Scan", "TCP");
        Classification expected = model.classify(input);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int i = 0; i < 16; i++) {
                Future<Classification> result = pool.submit(() -> model.classify(input));
                assertEquals(expected, result.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
