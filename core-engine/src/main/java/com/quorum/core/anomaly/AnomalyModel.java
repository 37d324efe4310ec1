package com.quorum.core.anomaly;

/**
 * Opaque outlier scorer loaded from an anomaly-model payload.
 *
 * <p>
 * Implementations are immutable and safe for concurrent scoring.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyModel {

    /**
     * @return featurizer version the model was built against
     */
    String featurizerVersion();

    /**
     * @return expected feature vector length
     */
    int dimension();

    /**
     * Score a feature vector.
     *
     * @param features vector of length {@link #dimension()}
     * @return outlier score in [0, 1]
     * @throws IllegalArgumentException if the vector has the wrong length
     */
    double score(double[] features);
}
