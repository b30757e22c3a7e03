package com.sentinelids.pipeline.scoring;

/**
 * External classifier boundary: a fixed-length feature vector in, a discrete
 * label out.
 *
 * <p>
 * Implementations are called concurrently from every worker thread and must
 * not need external synchronization. Each call must be bounded in time.
 * </p>
 *
 * @author Naveed Gung
 */
public interface ScoringCapability {

    /**
     * Classify one feature vector.
     *
     * @param features vector of {@code FeatureExtractor.FEATURE_LENGTH} values
     * @return the classification
     * @throws ScoringException if the classifier fails or times out
     */
    Classification classify(double[] features);
}
