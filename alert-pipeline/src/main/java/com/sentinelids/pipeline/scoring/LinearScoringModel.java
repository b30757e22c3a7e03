package com.sentinelids.pipeline.scoring;

import com.sentinelids.pipeline.config.ScoringConfig;
import com.sentinelids.pipeline.feature.FeatureExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * In-process scorer: a logistic function over a fixed weight vector.
 *
 * <p>
 * {@code p = 1 / (1 + exp(-(bias + w . x)))}, label 1 when {@code p >= threshold}.
 * The reported confidence is the probability of the chosen label. Weights
 * are immutable after construction, so concurrent calls need no locking.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
@ConditionalOnProperty(prefix = "sentinel.scoring", name = "mode", havingValue = "local", matchIfMissing = true)
public class LinearScoringModel implements ScoringCapability {

    private static final Logger log = LoggerFactory.getLogger(LinearScoringModel.class);

    /** Built-in weights, indexed as documented on {@link FeatureExtractor}. */
    static final double[] DEFAULT_WEIGHTS = {
            // address: entropy src/dst, private src/dst, multicast src/dst
            0.0, 0.0, -0.5, 0.0, 0.5, 0.5,
            // port: src, dst, privileged src/dst, service class src/dst
            0.0, 0.0, 0.3, 0.4, 0.0, 0.0,
            // protocol: TCP, UDP, ICMP, HTTP, HTTPS
            0.2, 0.1, 0.6, 0.2, 0.0,
            // message: length, tokens, special chars, attack, scan, exploit
            0.0, 0.0, 0.05, 2.0, 1.5, 2.5,
            // temporal
            0.0, 0.0, 0.0,
            // rule: id, local rule
            0.0, 0.5
    };

    private final double[] weights;
    private final double bias;
    private final double threshold;

    @Autowired
    public LinearScoringModel(ScoringConfig config) {
        this(toArray(config.getLocal().getWeights()), config.getLocal().getBias(), config.getLocal().getThreshold());
    }

    LinearScoringModel(double[] weights, double bias, double threshold) {
        double[] effective = weights.length == 0 ? DEFAULT_WEIGHTS : weights;
        if (effective.length != FeatureExtractor.FEATURE_LENGTH) {
            throw new IllegalArgumentException("Expected " + FeatureExtractor.FEATURE_LENGTH
                    + " weights, got " + effective.length);
        }
        this.weights = effective.clone();
        this.bias = bias;
        this.threshold = threshold;
        log.info("Local scoring model ready: {} weights, bias={}, threshold={}",
                this.weights.length, bias, threshold);
    }

    @Override
    public Classification classify(double[] features) {
        if (features == null || features.length != weights.length) {
            throw new ScoringException("Expected " + weights.length + " features, got "
                    + (features == null ? "null" : features.length));
        }
        double z = bias;
        for (int i = 0; i < weights.length; i++) {
            z += weights[i] * features[i];
        }
        if (Double.isNaN(z)) {
            throw new ScoringException("Feature vector produced a NaN score");
        }
        double p = 1.0 / (1.0 + Math.exp(-z));
        int label = p >= threshold ? 1 : 0;
        return new Classification(label, label == 1 ? p : 1.0 - p);
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i) != null ? values.get(i) : 0.0;
        }
        return array;
    }
}
